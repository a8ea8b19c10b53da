package com.hazardscan.core.detect;

import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.circuit.Gate;

import java.util.*;

/**
 * Flags pairs of inputs on the same gate that arrive at nearly the same time.
 *
 * The arrival delay of a port is the slowest path from any primary input to the port,
 * plus the wire from the port into the gate.
 */
public class RaceDetector {

    private final Circuit circuit;
    private final PathExplorer explorer;
    private final double threshold;

    public RaceDetector(Circuit circuit, PathExplorer explorer, double threshold) {
        this.circuit = circuit;
        this.explorer = explorer;
        this.threshold = threshold;
    }

    public List<RaceCondition> detect() {
        List<RaceCondition> races = new ArrayList<>();
        for (Gate gate : circuit.getGates().values()) {
            Map<String, Double> delays = arrivalDelays(gate);
            if (delays.size() < 2) continue;

            List<Map.Entry<String, Double>> ports = new ArrayList<>(delays.entrySet());
            for (int i = 0; i < ports.size(); i++) {
                for (int j = i + 1; j < ports.size(); j++) {
                    double d1 = ports.get(i).getValue();
                    double d2 = ports.get(j).getValue();
                    if (Math.abs(d1 - d2) < threshold) {
                        races.add(new RaceCondition(gate.id(), gate.kind(),
                                ports.get(i).getKey(), ports.get(j).getKey(), d1, d2));
                    }
                }
            }
        }
        return races;
    }

    /** Arrival delay per distinct input port, in port order. */
    public Map<String, Double> arrivalDelays(Gate gate) {
        Map<String, Double> delays = new LinkedHashMap<>();
        for (String port : gate.inputs()) {
            if (!delays.containsKey(port)) {
                delays.put(port, arrivalDelay(gate, port));
            }
        }
        return delays;
    }

    private double arrivalDelay(Gate gate, String port) {
        try {
            List<List<String>> paths = explorer.pathsTo(port);
            double slowest = 0.0;
            if (paths.isEmpty()) {
                System.err.println("[hazard-core] WARNING: no path reaches input " + port
                        + " of gate " + gate.id() + "; using delay 0");
            }
            for (List<String> path : paths) {
                slowest = Math.max(slowest, explorer.pathDelay(path));
            }
            double wire = circuit.connection(port, gate.id()).map(c -> c.delay()).orElse(0.0);
            return slowest + wire;
        } catch (RuntimeException e) {
            System.err.println("[hazard-core] ERROR: computing delay of input " + port
                    + " of gate " + gate.id() + ": " + e.getMessage());
            return 0.0;
        }
    }
}
