package com.dynamicpricing.api.controller;

import com.dynamicpricing.domain.model.EntityState;
import com.dynamicpricing.domain.model.HistoryRecord;
import com.dynamicpricing.exception.BadRequestException;
import com.dynamicpricing.exception.CityNotFoundException;
import com.dynamicpricing.state.EntityStateStore;
import com.dynamicpricing.state.HistoryBuffer;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to the latest snapshot and the pricing history.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/pricing/current -- latest state of every city</li>
 *   <li>GET /api/pricing/current/{city} -- latest state of one city</li>
 *   <li>GET /api/pricing/history -- retained history, oldest-first, optionally filtered</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/pricing")
public class PricingController {

    private final EntityStateStore entityStateStore;
    private final HistoryBuffer historyBuffer;

    public PricingController(EntityStateStore entityStateStore, HistoryBuffer historyBuffer) {
        this.entityStateStore = entityStateStore;
        this.historyBuffer = historyBuffer;
    }

    /** Empty until the first tick completed. */
    @GetMapping("/current")
    public ResponseEntity<Map<String, EntityState>> getCurrent() {
        return ResponseEntity.ok(entityStateStore.getAll().getStates());
    }

    @GetMapping("/current/{city}")
    public ResponseEntity<EntityState> getCurrentForCity(@PathVariable String city) {
        EntityState state =
                entityStateStore.get(city).orElseThrow(() -> new CityNotFoundException(city));
        return ResponseEntity.ok(state);
    }

    /**
     * @param city  only records of this city
     * @param since only records generated at or after this ISO-8601 instant
     * @param limit only the newest {@code limit} matching records
     */
    @GetMapping("/history")
    public ResponseEntity<List<HistoryRecord>> getHistory(
            @RequestParam(required = false) String city,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(required = false) Integer limit) {
        if (limit != null && limit <= 0) {
            throw new BadRequestException("limit must be positive", Map.of("limit", limit));
        }
        int effectiveLimit = limit != null ? limit : Integer.MAX_VALUE;
        return ResponseEntity.ok(historyBuffer.query(city, since, effectiveLimit));
    }
}
