package com.spatialflow.service;

import com.spatialflow.config.AutomationProperties;
import com.spatialflow.dto.ExecutionContext;
import com.spatialflow.dto.StepResult;
import com.spatialflow.model.GraphSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Hands action steps to a remote step interpreter over HTTP.
 *
 * POST {spatialflow.executor.url}
 * {
 *   "steps":   [ {"type": "create-node", ...}, ... ],
 *   "context": { "triggerNodeId": "...", "ruleId": "...", "event": {...}, "variables": {} },
 *   "graph":   { "nodes": [...], "edges": [...] }
 * }
 * → {"success": true} or {"success": false, "error": "..."}
 *
 * Runs on the step executor pool so the engine never blocks on the call.
 * Every failure (no URL, connection refused, 5xx, empty body) comes back as
 * a failure result; the returned future never completes exceptionally.
 */
@Component
@Slf4j
public class WebhookStepExecutor implements StepExecutor {

    private final RestTemplate restTemplate;
    private final AutomationProperties properties;
    private final Executor pool;

    public WebhookStepExecutor(RestTemplate restTemplate,
                               AutomationProperties properties,
                               @Qualifier("stepExecutorPool") Executor pool) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.pool = pool;
    }

    @Override
    public CompletableFuture<StepResult> execute(List<Map<String, Object>> steps,
                                                 ExecutionContext context,
                                                 GraphSnapshot graph) {
        String url = properties.getExecutor().getUrl();
        if (url == null || url.isBlank()) {
            return CompletableFuture.completedFuture(StepResult.failure("No step executor configured"));
        }
        return CompletableFuture.supplyAsync(() -> post(url, steps, context, graph), pool);
    }

    private StepResult post(String url, List<Map<String, Object>> steps,
                            ExecutionContext context, GraphSnapshot graph) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            Map<String, Object> body = new HashMap<>();
            body.put("steps", steps);
            body.put("context", context);
            body.put("graph", graph);

            StepResult result = restTemplate.postForObject(url, new HttpEntity<>(body, headers), StepResult.class);
            if (result == null) {
                return StepResult.failure("Step executor returned an empty response");
            }
            log.debug("Steps executed remotely: rule={}, success={}", context.getRuleId(), result.isSuccess());
            return result;
        } catch (Exception e) {
            log.error("Step executor call failed for rule {}: {}", context.getRuleId(), e.getMessage(), e);
            return StepResult.failure("Step executor call failed: " + e.getMessage());
        }
    }
}
