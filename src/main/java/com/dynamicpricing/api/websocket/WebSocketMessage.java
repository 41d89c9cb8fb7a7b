package com.dynamicpricing.api.websocket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope of every WebSocket message: {@code { type, data }}.
 *
 * <p>{@code type} is {@code "PRICING_UPDATE"} for snapshots on {@code /user/queue/pricing}
 * and {@code "SCENARIO"} for scenario lifecycle updates on {@code /topic/updates}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebSocketMessage {

    public static final String PRICING_UPDATE = "PRICING_UPDATE";
    public static final String SCENARIO = "SCENARIO";

    private String type;

    private Object data;

    public static WebSocketMessage of(String type, Object data) {
        return new WebSocketMessage(type, data);
    }
}
