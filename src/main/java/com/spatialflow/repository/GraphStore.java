package com.spatialflow.repository;

import com.spatialflow.model.GraphSnapshot;
import com.spatialflow.model.RunStats;

/**
 * Access to the canvas graph the engine observes.
 *
 * The engine only reads whole snapshots and writes run statistics back onto
 * rule nodes; node/edge CRUD, persistence and undo belong to the graph
 * store itself.
 */
public interface GraphStore {

    GraphSnapshot snapshot();

    /**
     * Replaces the run statistics of the rule carried by the given node.
     * Unknown nodes and nodes without a rule are ignored.
     */
    void updateRunStats(String ruleNodeId, RunStats stats);
}
