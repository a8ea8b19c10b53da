package com.hazardscan.core.circuit;

import java.util.List;
import java.util.Locale;

/**
 * Logic function of a gate. The string form ("AND", "OR", ...) is the one used in
 * structured circuit descriptions.
 */
public enum GateKind {
    AND,
    OR,
    NOT,
    XOR;

    /**
     * Applies the gate function to binary input values.
     *
     * @throws Circuit.EvaluationException on wrong arity
     */
    public int evaluate(String gateId, List<Integer> inputs) {
        return switch (this) {
            case AND -> inputs.stream().allMatch(v -> v == 1) ? 1 : 0;
            case OR  -> inputs.stream().anyMatch(v -> v == 1) ? 1 : 0;
            case XOR -> (int) (inputs.stream().filter(v -> v == 1).count() % 2);
            case NOT -> {
                if (inputs.size() != 1) {
                    throw new Circuit.EvaluationException("NOT gate " + gateId
                            + " must have exactly one input, has " + inputs.size());
                }
                yield 1 - inputs.get(0);
            }
        };
    }

    /**
     * Resolves a description type name, case-insensitively.
     *
     * @return the kind, or null if the name is unknown
     */
    public static GateKind fromName(String name) {
        if (name == null) return null;
        try {
            return GateKind.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
