package com.hazardscan.core.detect;

import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.circuit.Gate;
import com.hazardscan.core.circuit.GateKind;
import com.hazardscan.core.circuit.PrimaryInput;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Exhaustive symbolic simulation of one variable.
 *
 * The target input carries {@link SymbolicValue.Literal}; every assignment of the other
 * k-1 inputs is tried (bit j of the assignment index drives the j-th other input, in
 * circuit order). Gate values are resolved in topological order and reconvergence sites are
 * collected outputs-first along the reversed order. Each gate is reported once per
 * variable, with the first assignment that exposed it.
 */
public class SymbolicSimulator {

    private final Circuit circuit;
    private final DetectorConfig config;

    public SymbolicSimulator(Circuit circuit, DetectorConfig config) {
        this.circuit = circuit;
        this.config = config;
    }

    /** A reconvergence site and the other-input assignment that exposed it. */
    public record Site(String gateId, GateKind gateKind, Map<String, Integer> otherInputs) {}

    /**
     * @throws IllegalStateException if there are more other inputs than
     *                               {@link DetectorConfig#maxEnumeratedInputs}
     * @throws Circuit.EvaluationException if a gate input has no value
     */
    public List<Site> simulate(String variableId) {
        PrimaryInput variable = circuit.getInputs().get(variableId);
        if (variable == null) {
            throw new Circuit.EvaluationException("Unknown input ID: " + variableId);
        }
        List<String> others = new ArrayList<>(circuit.getInputs().keySet());
        others.remove(variableId);
        if (others.size() > config.maxEnumeratedInputs) {
            throw new IllegalStateException("Symbolic simulation of " + variable.name() + " needs 2^"
                    + others.size() + " assignments; limit is 2^" + config.maxEnumeratedInputs);
        }

        List<String> forward = circuit.topologicalOrder();
        List<String> backward = new ArrayList<>(forward);
        Collections.reverse(backward);

        int count = 1 << others.size();
        IntStream indices = IntStream.range(0, count);
        if (config.parallelSimulation) indices = indices.parallel();
        List<List<String>> flaggedPerAssignment = indices
                .mapToObj(i -> runPass(variable, others, i, forward, backward))
                .collect(Collectors.toList());

        Map<String, Site> sites = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            for (String gateId : flaggedPerAssignment.get(i)) {
                if (!sites.containsKey(gateId)) {
                    sites.put(gateId, new Site(gateId, circuit.gate(gateId).kind(), assignment(others, i)));
                }
            }
        }
        return new ArrayList<>(sites.values());
    }

    /** Symbolic value of every node for one assignment of the other inputs. */
    public Map<String, SymbolicValue> evaluate(String variableId, Map<String, Integer> otherInputs) {
        PrimaryInput variable = circuit.getInputs().get(variableId);
        if (variable == null) {
            throw new Circuit.EvaluationException("Unknown input ID: " + variableId);
        }
        Map<String, SymbolicValue> state = new LinkedHashMap<>();
        seed(state, variable, otherInputs);
        for (String gateId : circuit.topologicalOrder()) {
            state.put(gateId, step(circuit.gate(gateId), state).value());
        }
        return state;
    }

    // Returns the gates flagged in this pass, outputs first.
    private List<String> runPass(PrimaryInput variable, List<String> others, int index,
                                 List<String> forward, List<String> backward) {
        Map<String, SymbolicValue> state = new HashMap<>();
        seed(state, variable, assignment(others, index));

        Set<String> flagged = new HashSet<>();
        for (String gateId : forward) {
            SymbolicEvaluator.Outcome outcome = step(circuit.gate(gateId), state);
            state.put(gateId, outcome.value());
            if (outcome.reconvergent()) flagged.add(gateId);
        }

        List<String> ordered = new ArrayList<>();
        for (String gateId : backward) {
            if (flagged.contains(gateId)) ordered.add(gateId);
        }
        return ordered;
    }

    private void seed(Map<String, SymbolicValue> state, PrimaryInput variable, Map<String, Integer> otherInputs) {
        for (PrimaryInput in : circuit.getInputs().values()) {
            if (in.id().equals(variable.id())) {
                state.put(in.id(), new SymbolicValue.Literal(in.id(), in.name()));
            } else {
                Integer v = otherInputs.get(in.id());
                state.put(in.id(), SymbolicValue.constant(v != null ? v : in.initialValue()));
            }
        }
    }

    private SymbolicEvaluator.Outcome step(Gate gate, Map<String, SymbolicValue> state) {
        List<SymbolicValue> values = new ArrayList<>(gate.inputs().size());
        for (String port : gate.inputs()) {
            SymbolicValue v = state.get(port);
            if (v == null) {
                throw new Circuit.EvaluationException("Cannot resolve input " + port + " of gate " + gate.id());
            }
            values.add(v);
        }
        return SymbolicEvaluator.evaluate(gate, values);
    }

    private static Map<String, Integer> assignment(List<String> others, int index) {
        Map<String, Integer> values = new LinkedHashMap<>();
        for (int j = 0; j < others.size(); j++) {
            values.put(others.get(j), (index >> j) & 1);
        }
        return values;
    }
}
