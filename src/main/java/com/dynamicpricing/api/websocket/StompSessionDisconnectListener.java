package com.dynamicpricing.api.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Releases pricing subscribers of sessions that closed without a STOMP DISCONNECT frame
 * (tab closed, network drop). Spring fires {@link SessionDisconnectEvent} in both cases;
 * the interceptor's cleanup is idempotent.
 */
@Component
public class StompSessionDisconnectListener {

    private static final Logger log = LoggerFactory.getLogger(StompSessionDisconnectListener.class);

    private final StompPricingSubscriptionInterceptor stompPricingSubscriptionInterceptor;

    public StompSessionDisconnectListener(StompPricingSubscriptionInterceptor stompPricingSubscriptionInterceptor) {
        this.stompPricingSubscriptionInterceptor = stompPricingSubscriptionInterceptor;
    }

    @EventListener
    public void onSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        log.debug("STOMP session disconnected: {}", sessionId);
        stompPricingSubscriptionInterceptor.handleDisconnect(sessionId);
    }
}
