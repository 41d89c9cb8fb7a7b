package com.dynamicpricing.config;

import com.dynamicpricing.api.websocket.StompPricingSubscriptionInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * Configures the STOMP WebSocket message broker.
 *
 * <p>Registers the {@code /ws} endpoint, a simple broker on {@code /topic} and
 * {@code /queue}, and the {@link StompPricingSubscriptionInterceptor} that turns a
 * subscription to {@code /user/queue/pricing} into a broadcast hub subscriber.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${dynamicpricing.cors.allowed-origin}")
    private String allowedOrigin;

    private final StompPricingSubscriptionInterceptor stompPricingSubscriptionInterceptor;

    public WebSocketConfig(StompPricingSubscriptionInterceptor stompPricingSubscriptionInterceptor) {
        this.stompPricingSubscriptionInterceptor = stompPricingSubscriptionInterceptor;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws").setAllowedOriginPatterns(allowedOrigin);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic", "/queue");
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(stompPricingSubscriptionInterceptor);
    }
}
