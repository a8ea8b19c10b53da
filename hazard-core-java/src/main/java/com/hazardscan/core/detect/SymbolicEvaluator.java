package com.hazardscan.core.detect;

import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.circuit.Gate;
import com.hazardscan.core.detect.SymbolicValue.Constant;
import com.hazardscan.core.detect.SymbolicValue.Literal;
import com.hazardscan.core.detect.SymbolicValue.NegatedLiteral;

import java.util.*;

/**
 * Ternary gate rules for symbolic simulation.
 *
 * A gate that receives both a variable and its complement is a reconvergence site: the
 * steady-state output is the constant the function forces (0 for AND, 1 for OR), but the
 * unequal path delays can let a glitch through.
 */
public final class SymbolicEvaluator {

    private SymbolicEvaluator() {}

    /** Gate output plus whether the inputs carried both forms of one variable. */
    public record Outcome(SymbolicValue value, boolean reconvergent) {
        static Outcome of(SymbolicValue value) { return new Outcome(value, false); }
    }

    /**
     * @param inputs values of the gate's input ports, in port order
     * @throws Circuit.EvaluationException if a NOT gate does not have exactly one input
     */
    public static Outcome evaluate(Gate gate, List<SymbolicValue> inputs) {
        return switch (gate.kind()) {
            case NOT -> {
                if (inputs.size() != 1) {
                    throw new Circuit.EvaluationException("NOT gate " + gate.id()
                            + " must have exactly one input, has " + inputs.size());
                }
                yield Outcome.of(inputs.get(0).negate());
            }
            case AND -> dominated(inputs, 0);
            case OR  -> dominated(inputs, 1);
            case XOR -> parity(inputs);
        };
    }

    // AND (dominant 0) and OR (dominant 1) are mirror images.
    private static Outcome dominated(List<SymbolicValue> inputs, int dominant) {
        Set<SymbolicValue> tokens = new LinkedHashSet<>();
        boolean allIdentity = true;
        for (SymbolicValue v : inputs) {
            if (v instanceof Constant c) {
                if (c.value() == dominant) return Outcome.of(SymbolicValue.constant(dominant));
                allIdentity &= c.value() == 1 - dominant;
            } else {
                tokens.add(v);
            }
        }
        if (hasComplementaryPair(tokens)) {
            return new Outcome(SymbolicValue.constant(dominant), true);
        }
        if (tokens.size() == 1 && allIdentity) {
            return Outcome.of(tokens.iterator().next());
        }
        if (tokens.isEmpty() && allIdentity) {
            return Outcome.of(SymbolicValue.constant(1 - dominant));
        }
        return Outcome.of(SymbolicValue.constant(dominant));
    }

    private static Outcome parity(List<SymbolicValue> inputs) {
        int constants = 0;
        Map<String, int[]> counts = new LinkedHashMap<>();   // variable id -> {literal, negated}
        Map<String, Literal> literals = new HashMap<>();
        for (SymbolicValue v : inputs) {
            if (v instanceof Constant c) {
                constants ^= c.value();
            } else if (v instanceof Literal l) {
                counts.computeIfAbsent(l.variableId(), k -> new int[2])[0]++;
                literals.put(l.variableId(), l);
            } else if (v instanceof NegatedLiteral n) {
                counts.computeIfAbsent(n.variableId(), k -> new int[2])[1]++;
                literals.put(n.variableId(), new Literal(n.variableId(), n.variableName()));
            }
        }

        boolean reconvergent = counts.values().stream().anyMatch(c -> c[0] > 0 && c[1] > 0);
        SymbolicValue token = null;
        for (Map.Entry<String, int[]> e : counts.entrySet()) {
            // x ^ x = 0, ~x ^ ~x = 0, x ^ ~x = 1
            int lit = e.getValue()[0] % 2;
            int neg = e.getValue()[1] % 2;
            if (lit == 1 && neg == 1) {
                constants ^= 1;
            } else if (lit == 1 || neg == 1) {
                if (token != null) {
                    // two different variables; not representable, collapse like AND/OR do
                    return new Outcome(SymbolicValue.constant(0), reconvergent);
                }
                Literal l = literals.get(e.getKey());
                token = lit == 1 ? l : l.negate();
            }
        }
        if (token == null) return new Outcome(SymbolicValue.constant(constants), reconvergent);
        return new Outcome(constants == 1 ? token.negate() : token, reconvergent);
    }

    private static boolean hasComplementaryPair(Set<SymbolicValue> tokens) {
        Set<String> positive = new HashSet<>();
        Set<String> negative = new HashSet<>();
        for (SymbolicValue v : tokens) {
            if (v instanceof Literal l) positive.add(l.variableId());
            else if (v instanceof NegatedLiteral n) negative.add(n.variableId());
        }
        positive.retainAll(negative);
        return !positive.isEmpty();
    }
}
