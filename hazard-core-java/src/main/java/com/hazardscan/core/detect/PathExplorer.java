package com.hazardscan.core.detect;

import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.circuit.Connection;
import com.hazardscan.core.circuit.Gate;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enumerates every signal path from a node back to the primary inputs.
 *
 * A path lists node ids from the primary input to the queried node, so consecutive entries
 * are the {@code from}/{@code to} ends of a connection. The search is an explicit-stack DFS:
 * a node already on the current branch is not re-entered (cycle guard), but reconvergent
 * fan-out is fully explored across branches. Results are cached per node for the lifetime
 * of the explorer; they depend only on the circuit topology.
 */
public class PathExplorer {

    private final Circuit circuit;
    private final int maxDepth;
    private final Map<String, List<List<String>>> cache = new ConcurrentHashMap<>();

    public PathExplorer(Circuit circuit, int maxDepth) {
        this.circuit = circuit;
        this.maxDepth = maxDepth;
    }

    public PathExplorer(Circuit circuit) {
        this(circuit, DetectorConfig.defaults().maxPathDepth);
    }

    /** All paths from any primary input to {@code nodeId}; empty if none reach it. */
    public List<List<String>> pathsTo(String nodeId) {
        return cache.computeIfAbsent(nodeId, this::explore);
    }

    /**
     * Sum of the gate delays of every gate on the path plus the delay of each connection
     * between consecutive nodes. A missing connection contributes 0 and is logged.
     */
    public double pathDelay(List<String> path) {
        double total = 0.0;
        for (String nodeId : path) {
            Gate gate = circuit.gate(nodeId);
            if (gate != null) total += gate.delay();
        }
        for (int i = 0; i + 1 < path.size(); i++) {
            Optional<Connection> conn = circuit.connection(path.get(i), path.get(i + 1));
            if (conn.isPresent()) {
                total += conn.get().delay();
            } else {
                System.err.println("[hazard-core] WARNING: no connection from " + path.get(i)
                        + " to " + path.get(i + 1) + " (counted as 0)");
            }
        }
        return total;
    }

    private List<List<String>> explore(String nodeId) {
        List<List<String>> paths = new ArrayList<>();
        if (circuit.isInput(nodeId)) {
            paths.add(List.of(nodeId));
            return Collections.unmodifiableList(paths);
        }

        Deque<Frame> stack = new ArrayDeque<>();
        Set<String> onBranch = new HashSet<>();
        stack.push(new Frame(nodeId, circuit.incoming(nodeId)));
        onBranch.add(nodeId);
        boolean ceilingHit = false;

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.next >= top.incoming.size()) {
                stack.pop();
                onBranch.remove(top.node);
                continue;
            }
            String source = top.incoming.get(top.next++).from();

            if (circuit.isInput(source)) {
                paths.add(branchPath(source, stack));
            } else if (!onBranch.contains(source)) {
                if (stack.size() >= maxDepth) {
                    ceilingHit = true;
                } else {
                    stack.push(new Frame(source, circuit.incoming(source)));
                    onBranch.add(source);
                }
            }
        }

        if (ceilingHit) {
            System.err.println("[hazard-core] WARNING: path search to " + nodeId
                    + " reached depth limit " + maxDepth + "; deeper branches skipped");
        }
        return Collections.unmodifiableList(paths);
    }

    // The stack head is the node nearest the input, the tail is the queried node.
    private static List<String> branchPath(String input, Deque<Frame> stack) {
        List<String> path = new ArrayList<>(stack.size() + 1);
        path.add(input);
        for (Frame f : stack) {
            path.add(f.node);
        }
        return Collections.unmodifiableList(path);
    }

    private static final class Frame {
        final String node;
        final List<Connection> incoming;
        int next;

        Frame(String node, List<Connection> incoming) {
            this.node = node;
            this.incoming = incoming;
        }
    }
}
