package com.spatialflow.service;

import lombok.Value;

import java.util.HashMap;
import java.util.Map;

/**
 * Last known "within distance" flag per (rule, moving node), used to turn
 * proximity into crossing events. Never persisted. The first observation of
 * a pair only records where it started.
 */
public class ProximityMemory {

    private final Map<Key, Boolean> withinByPair = new HashMap<>();

    /**
     * Stores the new flag and returns the previous one, or null if the pair
     * had not been seen before.
     */
    public synchronized Boolean update(String ruleId, String nodeId, boolean within) {
        return withinByPair.put(new Key(ruleId, nodeId), within);
    }

    public synchronized void forgetRule(String ruleId) {
        withinByPair.keySet().removeIf(k -> k.getRuleId().equals(ruleId));
    }

    /**
     * Drops every entry for a deleted node.
     */
    public synchronized void forgetNode(String nodeId) {
        withinByPair.keySet().removeIf(k -> k.getNodeId().equals(nodeId));
    }

    public synchronized int size() {
        return withinByPair.size();
    }

    @Value
    private static class Key {
        String ruleId;
        String nodeId;
    }
}
