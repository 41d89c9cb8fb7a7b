package com.dynamicpricing.api.websocket;

import com.dynamicpricing.broadcast.SnapshotSink;
import com.dynamicpricing.domain.model.PricingSnapshot;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Delivers snapshots to one STOMP session on its {@code /user/queue/pricing} destination.
 *
 * <p>Sessions are anonymous, so the session id doubles as the user name; the session id
 * header lets the user destination resolver target exactly this session.
 */
public class StompSnapshotSink implements SnapshotSink {

    static final String PRICING_QUEUE = "/queue/pricing";

    private final SimpMessagingTemplate simpMessagingTemplate;
    private final String sessionId;

    public StompSnapshotSink(SimpMessagingTemplate simpMessagingTemplate, String sessionId) {
        this.simpMessagingTemplate = simpMessagingTemplate;
        this.sessionId = sessionId;
    }

    @Override
    public void deliver(PricingSnapshot snapshot) {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(sessionId);
        headerAccessor.setLeaveMutable(true);
        simpMessagingTemplate.convertAndSendToUser(
                sessionId,
                PRICING_QUEUE,
                WebSocketMessage.of(WebSocketMessage.PRICING_UPDATE, snapshot.getStates()),
                headerAccessor.getMessageHeaders());
    }

    public String getSessionId() {
        return sessionId;
    }
}
