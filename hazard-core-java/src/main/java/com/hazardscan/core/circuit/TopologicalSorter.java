package com.hazardscan.core.circuit;

import java.util.*;

/**
 * Kahn's algorithm over the gate-to-gate subgraph of a circuit.
 *
 * Only connections whose endpoints are both gates take part; primary inputs are sources by
 * definition. Zero in-degree gates are dequeued FIFO, seeded in gate insertion order, so the
 * order is reproducible for a given circuit.
 */
public final class TopologicalSorter {

    private TopologicalSorter() {}

    /**
     * @param gates       gates keyed by id, in insertion order
     * @param connections all circuit connections
     * @return gate ids such that every gate follows all gates feeding it
     * @throws CycleException if the gate-to-gate subgraph contains a cycle
     */
    public static List<String> sort(Map<String, Gate> gates, List<Connection> connections) {
        Map<String, List<String>> successors = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String gateId : gates.keySet()) {
            successors.put(gateId, new ArrayList<>());
            inDegree.put(gateId, 0);
        }

        for (Connection conn : connections) {
            if (gates.containsKey(conn.from()) && gates.containsKey(conn.to())) {
                successors.get(conn.from()).add(conn.to());
                inDegree.merge(conn.to(), 1, Integer::sum);
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        for (Map.Entry<String, Integer> e : inDegree.entrySet()) {
            if (e.getValue() == 0) queue.add(e.getKey());
        }

        List<String> order = new ArrayList<>(gates.size());
        while (!queue.isEmpty()) {
            String gateId = queue.poll();
            order.add(gateId);
            for (String next : successors.get(gateId)) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) queue.add(next);
            }
        }

        if (order.size() < gates.size()) {
            Set<String> ordered = new HashSet<>(order);
            List<String> unresolved = new ArrayList<>();
            for (String gateId : gates.keySet()) {
                if (!ordered.contains(gateId)) unresolved.add(gateId);
            }
            throw new CycleException(unresolved);
        }
        return order;
    }

    public static class CycleException extends RuntimeException {
        private final List<String> unresolvedGates;

        public CycleException(List<String> unresolvedGates) {
            super("Circuit contains a cycle; gates left unordered: " + unresolvedGates);
            this.unresolvedGates = List.copyOf(unresolvedGates);
        }

        /** Gates that are on, or downstream of, a cycle. */
        public List<String> getUnresolvedGates() { return unresolvedGates; }
    }
}
