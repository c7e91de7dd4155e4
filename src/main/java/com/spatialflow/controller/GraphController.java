package com.spatialflow.controller;

import com.spatialflow.model.GraphSnapshot;
import com.spatialflow.repository.InMemoryGraphStore;
import com.spatialflow.service.GraphChangeTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * The canvas pushes its whole graph here after every edit. The change
 * tracker diffs it against the previous push and feeds the engine.
 */
@RestController
@RequestMapping("/api/graph")
@RequiredArgsConstructor
public class GraphController {

    private final InMemoryGraphStore graphStore;
    private final GraphChangeTracker changeTracker;

    @GetMapping
    public ResponseEntity<GraphSnapshot> current() {
        return ResponseEntity.ok(graphStore.snapshot());
    }

    @PutMapping
    public ResponseEntity<Void> replace(@RequestBody GraphSnapshot graph) {
        graphStore.replace(graph);
        changeTracker.onGraphChanged(graphStore.snapshot());
        return ResponseEntity.noContent().build();
    }
}
