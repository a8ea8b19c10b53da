package com.hazardscan.core.circuit;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.*;

/**
 * Converts between {@link Circuit} and its structured {@link CircuitDescription}, and between
 * descriptions and JSON.
 *
 * JSON input may be a bare description or wrapped as {@code {"circuit": {...}}}; the
 * {@code inputs} and {@code outputs} members may be arrays of entries or objects keyed by id.
 */
public final class CircuitDescriptions {

    private static final Gson GSON = new Gson();
    private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().create();

    private CircuitDescriptions() {}

    /**
     * Builds a circuit from a description, checking every required field.
     *
     * @throws Circuit.ValidationException naming the first missing or invalid field
     */
    public static Circuit fromDescription(CircuitDescription d) {
        if (d == null) throw new Circuit.ValidationException("Circuit description is required");
        require(d.name, "name");
        require(d.gates, "gates");
        require(d.inputs, "inputs");
        require(d.outputs, "outputs");
        require(d.connections, "connections");

        Circuit.Builder builder = Circuit.builder(d.name);
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < d.gates.size(); i++) {
            CircuitDescription.GateEntry g = d.gates.get(i);
            String at = "gates[" + i + "]";
            require(g, at);
            require(g.id, at + ".id");
            require(g.type, at + ".type");
            require(g.delay, at + ".delay");
            require(g.inputs, at + ".inputs");
            require(g.output, at + ".output");
            GateKind kind = GateKind.fromName(g.type);
            if (kind == null) {
                throw new Circuit.ValidationException(at + ".type '" + g.type + "' is not a supported gate type");
            }
            for (int j = 0; j < g.inputs.size(); j++) {
                require(g.inputs.get(j), at + ".inputs[" + j + "]");
            }
            if (!seen.add(g.id)) {
                throw new Circuit.ValidationException(at + ".id '" + g.id + "' is duplicated");
            }
            builder.addGate(new Gate(g.id, kind, g.delay, g.inputs, g.output));
        }

        for (int i = 0; i < d.inputs.size(); i++) {
            CircuitDescription.InputEntry in = d.inputs.get(i);
            String at = "inputs[" + i + "]";
            require(in, at);
            require(in.id, at + ".id");
            require(in.name, at + ".name");
            require(in.initialValue, at + ".initial_value");
            if (in.initialValue != 0 && in.initialValue != 1) {
                throw new Circuit.ValidationException(at + ".initial_value must be 0 or 1, got " + in.initialValue);
            }
            if (!seen.add(in.id)) {
                throw new Circuit.ValidationException(at + ".id '" + in.id + "' is duplicated");
            }
            builder.addInput(in.id, in.name, in.initialValue);
        }

        Set<String> outputIds = new HashSet<>();
        for (int i = 0; i < d.outputs.size(); i++) {
            CircuitDescription.OutputEntry out = d.outputs.get(i);
            String at = "outputs[" + i + "]";
            require(out, at);
            require(out.id, at + ".id");
            require(out.name, at + ".name");
            require(out.source, at + ".source");
            if (!outputIds.add(out.id)) {
                throw new Circuit.ValidationException(at + ".id '" + out.id + "' is duplicated");
            }
            builder.addOutput(out.id, out.name, out.source);
        }

        for (int i = 0; i < d.connections.size(); i++) {
            CircuitDescription.ConnectionEntry c = d.connections.get(i);
            String at = "connections[" + i + "]";
            require(c, at);
            require(c.from, at + ".from");
            require(c.to, at + ".to");
            require(c.delay, at + ".delay");
            builder.addConnection(c.from, c.to, c.delay);
        }

        return builder.build();
    }

    /** Inverse of {@link #fromDescription}. */
    public static CircuitDescription toDescription(Circuit circuit) {
        CircuitDescription d = new CircuitDescription();
        d.name = circuit.getName();

        d.gates = new ArrayList<>();
        for (Gate g : circuit.getGates().values()) {
            CircuitDescription.GateEntry e = new CircuitDescription.GateEntry();
            e.id = g.id();
            e.type = g.kind().name();
            e.delay = g.delay();
            e.inputs = new ArrayList<>(g.inputs());
            e.output = g.output();
            d.gates.add(e);
        }

        d.inputs = new ArrayList<>();
        for (PrimaryInput in : circuit.getInputs().values()) {
            CircuitDescription.InputEntry e = new CircuitDescription.InputEntry();
            e.id = in.id();
            e.name = in.name();
            e.initialValue = in.initialValue();
            d.inputs.add(e);
        }

        d.outputs = new ArrayList<>();
        for (PrimaryOutput out : circuit.getOutputs().values()) {
            CircuitDescription.OutputEntry e = new CircuitDescription.OutputEntry();
            e.id = out.id();
            e.name = out.name();
            e.source = out.source();
            d.outputs.add(e);
        }

        d.connections = new ArrayList<>();
        for (Connection c : circuit.getConnections()) {
            CircuitDescription.ConnectionEntry e = new CircuitDescription.ConnectionEntry();
            e.from = c.from();
            e.to = c.to();
            e.delay = c.delay();
            d.connections.add(e);
        }
        return d;
    }

    /**
     * Parses JSON into a description without validating required fields.
     *
     * @throws Circuit.ValidationException if the text is not JSON of the expected shape
     */
    public static CircuitDescription fromJson(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new Circuit.ValidationException("Malformed circuit JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isJsonObject()) {
            throw new Circuit.ValidationException("Circuit JSON must be an object");
        }
        JsonObject obj = root.getAsJsonObject();
        if (obj.has("circuit")) {
            if (!obj.get("circuit").isJsonObject()) {
                throw new Circuit.ValidationException("circuit must be an object");
            }
            obj = obj.getAsJsonObject("circuit");
        }
        normalizeKeyed(obj, "inputs");
        normalizeKeyed(obj, "outputs");

        try {
            return GSON.fromJson(obj, CircuitDescription.class);
        } catch (JsonParseException | NumberFormatException | IllegalStateException e) {
            throw new Circuit.ValidationException("Circuit JSON has a field of the wrong type: " + e.getMessage(), e);
        }
    }

    /** Parses and validates in one step. */
    public static Circuit circuitFromJson(String json) {
        return fromDescription(fromJson(json));
    }

    public static String toJson(CircuitDescription description) {
        return PRETTY.toJson(description);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    // {"a": {"name": "A", ...}} -> [{"id": "a", "name": "A", ...}]
    private static void normalizeKeyed(JsonObject obj, String member) {
        JsonElement el = obj.get(member);
        if (el == null || !el.isJsonObject()) return;
        JsonArray entries = new JsonArray();
        for (Map.Entry<String, JsonElement> e : el.getAsJsonObject().entrySet()) {
            if (!e.getValue().isJsonObject()) {
                throw new Circuit.ValidationException(member + "." + e.getKey() + " must be an object");
            }
            JsonObject entry = e.getValue().getAsJsonObject().deepCopy();
            if (!entry.has("id")) entry.addProperty("id", e.getKey());
            entries.add(entry);
        }
        obj.add(member, entries);
    }

    private static void require(Object value, String field) {
        if (value == null) {
            throw new Circuit.ValidationException(field + " is required");
        }
    }
}
