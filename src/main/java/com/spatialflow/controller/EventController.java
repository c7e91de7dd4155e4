package com.spatialflow.controller;

import com.spatialflow.dto.AutomationEvent;
import com.spatialflow.service.AutomationEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoint for submitting graph events directly (alternative to Kafka).
 *
 * POST /api/events
 * {
 *   "type": "property-change",
 *   "sourceNodeId": "task-42",
 *   "property": "status",
 *   "oldValue": "todo",
 *   "newValue": "done"
 * }
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final AutomationEngine engine;

    @PostMapping
    public ResponseEntity<Map<String, String>> submitEvent(@Valid @RequestBody AutomationEvent event) {
        engine.handleEvent(event);
        return ResponseEntity.accepted()
                .body(Map.of("status", "accepted", "sourceNodeId", event.getSourceNodeId()));
    }

    @GetMapping("/recent")
    public ResponseEntity<List<AutomationEvent>> recent() {
        return ResponseEntity.ok(engine.recentEvents());
    }
}
