package com.dynamicpricing.api.websocket;

import com.dynamicpricing.domain.model.ScenarioOverride;
import com.dynamicpricing.event.ScenarioEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Pushes scenario lifecycle updates to {@code /topic/updates} as {@code {type: "SCENARIO", data}},
 * so dashboards can show which cities are under an active scenario and until when.
 *
 * <p>Runs on the eventExecutor, off the thread that applied or expired the scenario.
 */
@Component
public class UpdatesHandler {

    private static final Logger log = LoggerFactory.getLogger(UpdatesHandler.class);

    static final String UPDATES_TOPIC = "/topic/updates";

    private final SimpMessagingTemplate simpMessagingTemplate;

    public UpdatesHandler(SimpMessagingTemplate simpMessagingTemplate) {
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    @Async("eventExecutor")
    @EventListener
    public void onScenarioEvent(ScenarioEvent scenarioEvent) {
        ScenarioOverride override = scenarioEvent.getOverride();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("eventType", scenarioEvent.getEventType().name());
        payload.put("city", override.getEntityId());
        payload.put("scenario", override.getSource());
        payload.put("effects", override.getEffects());
        payload.put("appliedAt", override.getAppliedAt());
        payload.put("expiresAt", override.getExpiresAt());
        if (scenarioEvent.getPrevious() != null) {
            payload.put("replaced", scenarioEvent.getPrevious().getSource());
        }

        sendUpdate(WebSocketMessage.SCENARIO, payload);
    }

    private void sendUpdate(String type, Object data) {
        try {
            simpMessagingTemplate.convertAndSend(UPDATES_TOPIC, WebSocketMessage.of(type, data));
        } catch (Exception e) {
            log.error("Failed to send {} update via WebSocket: {}", type, e.getMessage());
        }
    }
}
