package com.asra.orchestrator.workflow;

import com.asra.orchestrator.synth.StageKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upstream relationships between the stages of one run.
 *
 * Edges come from {@link StageKind#upstream()} and only connect stages that
 * are part of this run: asking for the hypothesis generator without the
 * literature review leaves it with no predecessors.
 */
public final class StageGraph {

    private final Map<String, List<String>> upstream;

    private StageGraph(Map<String, List<String>> upstream) {
        this.upstream = upstream;
    }

    public static StageGraph of(Collection<String> stageNames, DependencyMode mode) {
        Map<String, StageKind> kinds = new LinkedHashMap<>();
        stageNames.forEach(name -> kinds.put(name, StageKind.resolve(name)));

        Map<String, List<String>> upstream = new LinkedHashMap<>();
        for (Map.Entry<String, StageKind> entry : kinds.entrySet()) {
            List<String> predecessors = new ArrayList<>();
            if (mode == DependencyMode.GRAPH) {
                for (StageKind needed : entry.getValue().upstream()) {
                    kinds.forEach((name, kind) -> {
                        if (kind == needed && !name.equals(entry.getKey())) predecessors.add(name);
                    });
                }
            }
            upstream.put(entry.getKey(), List.copyOf(predecessors));
        }
        return new StageGraph(upstream);
    }

    public List<String> upstreamOf(String stageName) {
        return upstream.getOrDefault(stageName, List.of());
    }

    /**
     * Stages ordered so every stage follows its predecessors; ties keep the
     * order the stages were given in.
     *
     * @throws IllegalStateException if the edges form a cycle
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> remaining = new LinkedHashMap<>();
        Map<String, List<String>> downstream = new LinkedHashMap<>();
        upstream.forEach((stage, preds) -> {
            remaining.put(stage, preds.size());
            preds.forEach(p -> downstream.computeIfAbsent(p, k -> new ArrayList<>()).add(stage));
        });

        Deque<String> ready = new ArrayDeque<>();
        remaining.forEach((stage, count) -> { if (count == 0) ready.add(stage); });

        List<String> order = new ArrayList<>(upstream.size());
        while (!ready.isEmpty()) {
            String stage = ready.poll();
            order.add(stage);
            for (String next : downstream.getOrDefault(stage, List.of())) {
                if (remaining.merge(next, -1, Integer::sum) == 0) ready.add(next);
            }
        }
        if (order.size() != upstream.size()) {
            throw new IllegalStateException("Stage dependencies form a cycle: " + upstream);
        }
        return order;
    }
}
