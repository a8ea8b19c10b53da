package com.hazardscan.core.circuit;

import java.util.*;

/**
 * An acyclic network of gates between named primary inputs and primary outputs.
 *
 * Instances are immutable once built and may be read from several threads. Use
 * {@link #builder(String)} to construct one; {@link Builder#build()} checks the structural
 * invariants except acyclicity, which is enforced when the gates are ordered.
 */
public final class Circuit {

    private final String name;
    private final Map<String, Gate> gates;
    private final Map<String, PrimaryInput> inputs;
    private final Map<String, PrimaryOutput> outputs;
    private final List<Connection> connections;
    private final Map<String, List<Connection>> incoming;

    private Circuit(Builder b) {
        this.name = b.name;
        this.gates = Collections.unmodifiableMap(new LinkedHashMap<>(b.gates));
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(b.inputs));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(b.outputs));
        this.connections = List.copyOf(b.connections);

        Map<String, List<Connection>> byTarget = new HashMap<>();
        for (Connection c : connections) {
            byTarget.computeIfAbsent(c.to(), k -> new ArrayList<>()).add(c);
        }
        Map<String, List<Connection>> frozen = new HashMap<>();
        byTarget.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.incoming = Collections.unmodifiableMap(frozen);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName()                       { return name; }
    public Map<String, Gate> getGates()           { return gates; }
    public Map<String, PrimaryInput> getInputs()  { return inputs; }
    public Map<String, PrimaryOutput> getOutputs(){ return outputs; }
    public List<Connection> getConnections()      { return connections; }

    public Gate gate(String id)        { return gates.get(id); }
    public boolean isGate(String id)   { return gates.containsKey(id); }
    public boolean isInput(String id)  { return inputs.containsKey(id); }

    /** Connections terminating at {@code nodeId}, in declaration order. */
    public List<Connection> incoming(String nodeId) {
        return incoming.getOrDefault(nodeId, Collections.emptyList());
    }

    /** First connection declared from {@code from} to {@code to}, if any. */
    public Optional<Connection> connection(String from, String to) {
        for (Connection c : incoming(to)) {
            if (c.from().equals(from)) return Optional.of(c);
        }
        return Optional.empty();
    }

    /**
     * @throws TopologicalSorter.CycleException if the gates cannot be ordered
     */
    public List<String> topologicalOrder() {
        return TopologicalSorter.sort(gates, connections);
    }

    /** Outputs-first order used by output-to-input traversals. */
    public List<String> reverseTopologicalOrder() {
        List<String> order = new ArrayList<>(topologicalOrder());
        Collections.reverse(order);
        return order;
    }

    /**
     * Evaluates every gate and output for one input assignment.
     *
     * @param inputValues input id to 0/1; null uses each input's initial value, and inputs
     *                    missing from a partial assignment also use their initial value
     * @return node id to value: inputs, then gates in topological order, then outputs
     * @throws EvaluationException if the assignment or the graph cannot be evaluated
     * @throws TopologicalSorter.CycleException if the gate graph has a cycle
     */
    public Map<String, Integer> compute(Map<String, Integer> inputValues) {
        Map<String, Integer> results = new LinkedHashMap<>();
        if (inputValues != null) {
            for (Map.Entry<String, Integer> e : inputValues.entrySet()) {
                if (!inputs.containsKey(e.getKey())) {
                    throw new EvaluationException("Unknown input ID: " + e.getKey());
                }
                Integer v = e.getValue();
                if (v == null || (v != 0 && v != 1)) {
                    throw new EvaluationException("Input " + e.getKey() + " must be 0 or 1, got " + v);
                }
            }
        }
        for (PrimaryInput in : inputs.values()) {
            Integer v = inputValues != null ? inputValues.get(in.id()) : null;
            results.put(in.id(), v != null ? v : in.initialValue());
        }

        for (String gateId : topologicalOrder()) {
            Gate gate = gates.get(gateId);
            List<Integer> values = new ArrayList<>(gate.inputs().size());
            for (String port : gate.inputs()) {
                Integer v = results.get(port);
                if (v == null) {
                    throw new EvaluationException("Cannot compute input " + port + " of gate " + gateId);
                }
                values.add(v);
            }
            results.put(gateId, gate.kind().evaluate(gateId, values));
        }

        Map<String, Integer> outputValues = new LinkedHashMap<>();
        for (PrimaryOutput out : outputs.values()) {
            Integer v = results.get(out.source());
            if (v == null) {
                throw new EvaluationException("Cannot compute output " + out.id()
                        + ": source " + out.source() + " not found");
            }
            outputValues.put(out.id(), v);
        }
        results.putAll(outputValues);
        return results;
    }

    @Override
    public String toString() {
        return "Circuit{" + name + ", " + inputs.size() + " inputs, " + gates.size() + " gates, "
                + outputs.size() + " outputs, " + connections.size() + " connections}";
    }

    // -----------------------------------------------------------------------
    // Builder
    // -----------------------------------------------------------------------

    /** Single-threaded builder; discard after {@link #build()}. */
    public static final class Builder {
        private final String name;
        private final Map<String, Gate> gates = new LinkedHashMap<>();
        private final Map<String, PrimaryInput> inputs = new LinkedHashMap<>();
        private final Map<String, PrimaryOutput> outputs = new LinkedHashMap<>();
        private final List<Connection> connections = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder addGate(Gate gate) {
            gates.put(gate.id(), gate);
            return this;
        }

        public Builder addGate(String id, GateKind kind, double delay, String... inputIds) {
            return addGate(new Gate(id, kind, delay, List.of(inputIds)));
        }

        public Builder addInput(String id, String displayName, int initialValue) {
            inputs.put(id, new PrimaryInput(id, displayName, initialValue));
            return this;
        }

        public Builder addOutput(String id, String displayName, String source) {
            outputs.put(id, new PrimaryOutput(id, displayName, source));
            return this;
        }

        public Builder addConnection(String from, String to, double delay) {
            connections.add(new Connection(from, to, delay));
            return this;
        }

        public boolean hasInput(String id) { return inputs.containsKey(id); }

        /**
         * @throws ValidationException if the structure is inconsistent
         */
        public Circuit build() {
            if (name == null) throw new ValidationException("Circuit name is required");

            for (PrimaryInput in : inputs.values()) {
                if (gates.containsKey(in.id())) {
                    throw new ValidationException("ID " + in.id() + " is used by both an input and a gate");
                }
                if (in.initialValue() != 0 && in.initialValue() != 1) {
                    throw new ValidationException("Input " + in.id() + " initial value must be 0 or 1, got "
                            + in.initialValue());
                }
            }

            for (Gate g : gates.values()) {
                if (g.kind() == null) {
                    throw new ValidationException("Gate " + g.id() + " has no type");
                }
                if (g.delay() < 0) {
                    throw new ValidationException("Gate " + g.id() + " has negative delay " + g.delay());
                }
                if (g.kind() == GateKind.NOT && g.inputs().size() != 1) {
                    throw new ValidationException("NOT gate " + g.id() + " must have exactly one input, has "
                            + g.inputs().size());
                }
                if (g.inputs().isEmpty()) {
                    throw new ValidationException("Gate " + g.id() + " has no inputs");
                }
            }

            for (Connection c : connections) {
                if (!gates.containsKey(c.from()) && !inputs.containsKey(c.from())) {
                    throw new ValidationException("Connection source " + c.from() + " is not a known input or gate");
                }
                if (!gates.containsKey(c.to())) {
                    throw new ValidationException("Connection target " + c.to() + " is not a known gate");
                }
                if (c.delay() < 0) {
                    throw new ValidationException("Connection " + c.from() + " -> " + c.to()
                            + " has negative delay " + c.delay());
                }
            }

            for (Gate g : gates.values()) {
                for (String port : g.inputs()) {
                    boolean wired = connections.stream()
                            .anyMatch(c -> c.to().equals(g.id()) && c.from().equals(port));
                    if (!wired) {
                        throw new ValidationException("Input " + port + " of gate " + g.id()
                                + " has no connection");
                    }
                }
            }

            for (PrimaryOutput out : outputs.values()) {
                if (!gates.containsKey(out.source()) && !inputs.containsKey(out.source())) {
                    throw new ValidationException("Output " + out.id() + " source " + out.source()
                            + " is not a known node");
                }
            }
            return new Circuit(this);
        }
    }

    // -----------------------------------------------------------------------
    // Errors
    // -----------------------------------------------------------------------

    /** A circuit or circuit description is structurally malformed. */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) { super(message); }
        public ValidationException(String message, Throwable cause) { super(message, cause); }
    }

    /** A circuit cannot be evaluated for the requested assignment. */
    public static class EvaluationException extends RuntimeException {
        public EvaluationException(String message) { super(message); }
    }
}
