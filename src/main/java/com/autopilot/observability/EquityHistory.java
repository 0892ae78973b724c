package com.autopilot.observability;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded per-account equity curve, one sample per trading cycle. Written only by the scheduling
 * loop through {@link SnapshotPublisher}.
 */
class EquityHistory {

    private final int window;
    private final Map<String, Deque<Double>> samples = new HashMap<>();

    EquityHistory(int window) {
        this.window = window + 1;
    }

    void record(String accountId, double equity) {
        Deque<Double> curve = samples.computeIfAbsent(accountId, id -> new ArrayDeque<>());
        curve.addLast(equity);
        while (curve.size() > window) {
            curve.pollFirst();
        }
    }

    List<Double> curve(String accountId) {
        Deque<Double> curve = samples.get(accountId);
        return curve == null ? List.of() : new ArrayList<>(curve);
    }
}
