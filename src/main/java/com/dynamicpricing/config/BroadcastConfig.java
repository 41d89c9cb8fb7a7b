package com.dynamicpricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "dynamicpricing.broadcast")
@Getter
@Setter
public class BroadcastConfig {

    /** Snapshots buffered per subscriber before it is dropped as too slow. */
    private int subscriberQueueCapacity = 16;

    private int deliveryPoolSize = 4;
}
