package com.hazardscan.core.circuit;

import java.util.List;

/**
 * A logic gate. {@code inputs} lists upstream node ids (primary inputs or gates) in port
 * order; {@code output} is by convention the gate id.
 */
public record Gate(
    String id,
    GateKind kind,
    double delay,
    List<String> inputs,
    String output
) {
    public Gate {
        inputs = List.copyOf(inputs);
    }

    public Gate(String id, GateKind kind, double delay, List<String> inputs) {
        this(id, kind, delay, inputs, id);
    }
}
