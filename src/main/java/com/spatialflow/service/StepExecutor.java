package com.spatialflow.service;

import com.spatialflow.dto.ExecutionContext;
import com.spatialflow.dto.StepResult;
import com.spatialflow.model.GraphSnapshot;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a rule's action steps (create node, call an LLM, HTTP request...).
 *
 * Implementations report failures through {@code success=false}. The engine
 * still treats a thrown exception or a failed future as a failure result.
 */
public interface StepExecutor {

    CompletableFuture<StepResult> execute(List<Map<String, Object>> steps,
                                          ExecutionContext context,
                                          GraphSnapshot graph);
}
