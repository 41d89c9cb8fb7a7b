package com.dynamicpricing.api.websocket;

import com.dynamicpricing.broadcast.BroadcastHub;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageHandler;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.simp.user.UserDestinationMessageHandler;
import org.springframework.messaging.support.ExecutorChannelInterceptor;
import org.springframework.stereotype.Component;

/**
 * Maps STOMP subscriptions to {@code /user/queue/pricing} onto {@link BroadcastHub} subscribers.
 *
 * <p>SUBSCRIBE registers a {@code CONNECTING} hub subscriber for the session. Once the user
 * destination handler has registered the subscription with the broker, the subscriber is
 * connected, which pushes the current snapshot; connecting earlier could send it before the
 * broker knows where to route it.
 *
 * <p>UNSUBSCRIBE and DISCONNECT release the subscriber. Abrupt closes are handled by
 * {@link StompSessionDisconnectListener} through {@link #handleDisconnect(String)}.
 */
@Component
public class StompPricingSubscriptionInterceptor implements ExecutorChannelInterceptor {

    private static final Logger log = LoggerFactory.getLogger(StompPricingSubscriptionInterceptor.class);

    static final String PRICING_DESTINATION = "/user" + StompSnapshotSink.PRICING_QUEUE;

    private final BroadcastHub broadcastHub;
    private final ObjectProvider<SimpMessagingTemplate> simpMessagingTemplateProvider;

    /** sessionId -> subscriptionId of the session's pricing subscription. */
    private final Map<String, String> pricingSubscriptions = new ConcurrentHashMap<>();

    public StompPricingSubscriptionInterceptor(
            BroadcastHub broadcastHub, ObjectProvider<SimpMessagingTemplate> simpMessagingTemplateProvider) {
        this.broadcastHub = broadcastHub;
        this.simpMessagingTemplateProvider = simpMessagingTemplateProvider;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);
        StompCommand command = accessor.getCommand();
        if (command == null) {
            return message;
        }

        switch (command) {
            case SUBSCRIBE -> handleSubscribe(accessor);
            case UNSUBSCRIBE -> handleUnsubscribe(accessor);
            case DISCONNECT -> {
                String sessionId = accessor.getSessionId();
                if (sessionId != null) {
                    handleDisconnect(sessionId);
                }
            }
            default -> {
                // No-op for other commands
            }
        }
        return message;
    }

    @Override
    public void afterMessageHandled(Message<?> message, MessageChannel channel, MessageHandler handler, Exception ex) {
        if (!(handler instanceof UserDestinationMessageHandler) || ex != null) {
            return;
        }
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);
        if (accessor.getCommand() != StompCommand.SUBSCRIBE || !isPricingDestination(accessor.getDestination())) {
            return;
        }
        String sessionId = accessor.getSessionId();
        if (sessionId != null && broadcastHub.connect(subscriberKey(sessionId))) {
            log.debug("STOMP SUBSCRIBE: session={} connected to pricing updates", sessionId);
        }
    }

    private void handleSubscribe(StompHeaderAccessor accessor) {
        if (!isPricingDestination(accessor.getDestination())) {
            return;
        }
        String sessionId = accessor.getSessionId();
        String subscriptionId = accessor.getSubscriptionId();
        if (sessionId == null || subscriptionId == null) {
            return;
        }

        String previous = pricingSubscriptions.put(sessionId, subscriptionId);
        if (previous != null) {
            log.debug(
                    "STOMP SUBSCRIBE: session={} re-subscribed to pricing ({} -> {})",
                    sessionId,
                    previous,
                    subscriptionId);
        }
        broadcastHub.register(
                subscriberKey(sessionId), new StompSnapshotSink(simpMessagingTemplateProvider.getObject(), sessionId));
    }

    private void handleUnsubscribe(StompHeaderAccessor accessor) {
        String sessionId = accessor.getSessionId();
        String subscriptionId = accessor.getSubscriptionId();
        if (sessionId == null || subscriptionId == null) {
            return;
        }
        if (pricingSubscriptions.remove(sessionId, subscriptionId)) {
            broadcastHub.unsubscribe(subscriberKey(sessionId));
        }
    }

    /**
     * Releases the pricing subscriber of a closed session. Idempotent.
     */
    public void handleDisconnect(String sessionId) {
        if (pricingSubscriptions.remove(sessionId) != null) {
            broadcastHub.disconnect(subscriberKey(sessionId), "session closed");
        }
    }

    public Map<String, String> getPricingSubscriptions() {
        return Map.copyOf(pricingSubscriptions);
    }

    static String subscriberKey(String sessionId) {
        return "stomp:" + sessionId;
    }

    private static boolean isPricingDestination(String destination) {
        return PRICING_DESTINATION.equals(destination);
    }
}
