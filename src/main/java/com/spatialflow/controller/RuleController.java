package com.spatialflow.controller;

import com.spatialflow.dto.RuleSummary;
import com.spatialflow.service.RuleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/rules")
@RequiredArgsConstructor
public class RuleController {

    private final RuleService ruleService;

    @GetMapping
    public ResponseEntity<List<RuleSummary>> listActive() {
        return ResponseEntity.ok(ruleService.listActive());
    }

    @PostMapping("/sync")
    public ResponseEntity<Map<String, Integer>> sync() {
        return ResponseEntity.ok(Map.of("active", ruleService.sync()));
    }

    @PostMapping("/{id}/trigger")
    public ResponseEntity<Map<String, String>> trigger(@PathVariable String id) {
        if (!ruleService.trigger(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().body(Map.of("status", "triggered", "ruleId", id));
    }
}
