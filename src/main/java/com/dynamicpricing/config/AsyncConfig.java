package com.dynamicpricing.config;

import java.lang.reflect.Method;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools used by the simulation.
 *
 * <ul>
 *   <li>{@code taskScheduler} -- drives the tick cadence and the scenario expiry sweep</li>
 *   <li>{@code entityExecutor} -- per-city work inside one tick</li>
 *   <li>{@code scoringExecutor} -- time-limited pricing model calls</li>
 *   <li>{@code deliveryExecutor} -- per-subscriber snapshot delivery</li>
 *   <li>{@code eventExecutor} -- async application event listeners</li>
 * </ul>
 *
 * <p>Entity and scoring work use separate pools: an entity task blocks on its scoring
 * call, so sharing one pool could starve it.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private final SimulatorConfig simulatorConfig;
    private final ScoringConfig scoringConfig;
    private final BroadcastConfig broadcastConfig;

    public AsyncConfig(SimulatorConfig simulatorConfig, ScoringConfig scoringConfig, BroadcastConfig broadcastConfig) {
        this.simulatorConfig = simulatorConfig;
        this.scoringConfig = scoringConfig;
        this.broadcastConfig = broadcastConfig;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("sim-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean("entityExecutor")
    public ThreadPoolTaskExecutor entityExecutor() {
        int cities = Math.max(1, simulatorConfig.getCities().size());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cities);
        executor.setMaxPoolSize(cities);
        executor.setQueueCapacity(cities * 4);
        executor.setThreadNamePrefix("entity-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        return executor;
    }

    @Bean("scoringExecutor")
    public ThreadPoolTaskExecutor scoringExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(scoringConfig.getPoolSize());
        executor.setMaxPoolSize(scoringConfig.getPoolSize());
        executor.setQueueCapacity(scoringConfig.getPoolSize() * 4);
        executor.setThreadNamePrefix("scoring-");
        // Rejection surfaces as a scoring failure and falls back
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        return executor;
    }

    @Bean("deliveryExecutor")
    public ThreadPoolTaskExecutor deliveryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(broadcastConfig.getDeliveryPoolSize());
        executor.setMaxPoolSize(broadcastConfig.getDeliveryPoolSize());
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("delivery-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        return executor;
    }

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
