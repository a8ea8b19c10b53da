package com.hazardscan.core;

import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.circuit.CircuitDescription;
import com.hazardscan.core.circuit.CircuitDescriptions;
import com.hazardscan.core.circuit.GateKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CircuitDescriptionsTest {

    private static final String AND_JSON = """
            {
              "name": "test_circuit",
              "gates": [
                {"id": "g1", "type": "AND", "delay": 2.0, "inputs": ["in1", "in2"], "output": "g1"}
              ],
              "inputs": [
                {"id": "in1", "name": "A", "initial_value": 0},
                {"id": "in2", "name": "B", "initial_value": 1}
              ],
              "outputs": [
                {"id": "out1", "name": "Y", "source": "g1"}
              ],
              "connections": [
                {"from": "in1", "to": "g1", "delay": 0.1},
                {"from": "in2", "to": "g1", "delay": 0.5}
              ]
            }
            """;

    @Test
    void parsesArrayForm() {
        Circuit c = CircuitDescriptions.circuitFromJson(AND_JSON);
        assertEquals("test_circuit", c.getName());
        assertEquals(GateKind.AND, c.gate("g1").kind());
        assertEquals(1, c.getInputs().get("in2").initialValue());
        assertEquals(0.5, c.connection("in2", "g1").orElseThrow().delay());
    }

    @Test
    void parsesKeyedInputsAndOutputs() {
        String json = """
                {
                  "name": "keyed",
                  "gates": [{"id": "g1", "type": "NOT", "delay": 1, "inputs": ["a"], "output": "g1"}],
                  "inputs": {"a": {"name": "A", "initial_value": 1}},
                  "outputs": {"out1": {"name": "Y", "source": "g1"}},
                  "connections": [{"from": "a", "to": "g1", "delay": 0.1}]
                }
                """;
        Circuit c = CircuitDescriptions.circuitFromJson(json);
        assertEquals("A", c.getInputs().get("a").name());
        assertEquals("g1", c.getOutputs().get("out1").source());
        assertEquals(0, c.compute(null).get("out1"));
    }

    @Test
    void unwrapsCircuitEnvelope() {
        Circuit c = CircuitDescriptions.circuitFromJson("{\"circuit\": " + AND_JSON + "}");
        assertEquals("test_circuit", c.getName());
    }

    @Test
    void toleratesUnknownFields() {
        String json = AND_JSON.replace("\"name\": \"test_circuit\",",
                "\"name\": \"test_circuit\", \"author\": \"someone\",");
        assertDoesNotThrow(() -> CircuitDescriptions.circuitFromJson(json));
    }

    @Test
    void missingTopLevelFieldIsNamed() {
        CircuitDescription d = CircuitDescriptions.fromJson(AND_JSON);
        d.connections = null;
        assertValidationError(d, "connections is required");
    }

    @Test
    void missingGateFieldIsNamed() {
        CircuitDescription d = CircuitDescriptions.fromJson(AND_JSON);
        d.gates.get(0).delay = null;
        assertValidationError(d, "gates[0].delay is required");
    }

    @Test
    void missingInitialValueIsNamed() {
        CircuitDescription d = CircuitDescriptions.fromJson(AND_JSON);
        d.inputs.get(1).initialValue = null;
        assertValidationError(d, "inputs[1].initial_value is required");
    }

    @Test
    void nonBinaryInitialValueRejected() {
        CircuitDescription d = CircuitDescriptions.fromJson(AND_JSON);
        d.inputs.get(0).initialValue = 3;
        assertValidationError(d, "inputs[0].initial_value must be 0 or 1");
    }

    @Test
    void unsupportedGateTypeRejected() {
        CircuitDescription d = CircuitDescriptions.fromJson(AND_JSON);
        d.gates.get(0).type = "NAND";
        assertValidationError(d, "gates[0].type 'NAND' is not a supported gate type");
    }

    @Test
    void duplicateIdRejected() {
        CircuitDescription d = CircuitDescriptions.fromJson(AND_JSON);
        d.inputs.get(1).id = "in1";
        assertValidationError(d, "is duplicated");
    }

    @Test
    void structuralErrorsSurfaceAsValidationErrors() {
        CircuitDescription d = CircuitDescriptions.fromJson(AND_JSON);
        d.outputs.get(0).source = "ghost";
        assertValidationError(d, "ghost");
    }

    @Test
    void wrongFieldTypeRejected() {
        String json = AND_JSON.replace("\"delay\": 2.0", "\"delay\": \"fast\"");
        assertThrows(Circuit.ValidationException.class, () -> CircuitDescriptions.fromJson(json));
    }

    @Test
    void malformedJsonRejected() {
        assertThrows(Circuit.ValidationException.class, () -> CircuitDescriptions.fromJson("{\"name\": "));
        assertThrows(Circuit.ValidationException.class, () -> CircuitDescriptions.fromJson("[1, 2]"));
    }

    @Test
    void descriptionSurvivesRebuild() {
        for (String expr : List.of("A AND B", "(A AND B) OR (NOT C)", "A OR NOT A", "NOT (A OR B) AND C")) {
            CircuitDescription first = HazardScan.parseExpression(expr);
            Circuit rebuilt = CircuitDescriptions.fromDescription(first);
            CircuitDescription second = CircuitDescriptions.toDescription(rebuilt);
            assertEquals(CircuitDescriptions.toJson(first), CircuitDescriptions.toJson(second), expr);
        }
    }

    @Test
    void rebuiltCircuitComputesTheSame() {
        Circuit original = CircuitDescriptions.circuitFromJson(AND_JSON);
        Circuit rebuilt = CircuitDescriptions.circuitFromJson(
                CircuitDescriptions.toJson(CircuitDescriptions.toDescription(original)));
        Map<String, Integer> assignment = Map.of("in1", 1, "in2", 1);
        assertEquals(original.compute(assignment), rebuilt.compute(assignment));
    }

    @Test
    void jsonUsesSnakeCaseInitialValue() {
        String json = CircuitDescriptions.toJson(HazardScan.parseExpression("A"));
        assertTrue(json.contains("\"initial_value\": 0"), json);
    }

    private static void assertValidationError(CircuitDescription d, String fragment) {
        Circuit.ValidationException ex = assertThrows(Circuit.ValidationException.class,
                () -> CircuitDescriptions.fromDescription(d));
        assertTrue(ex.getMessage().contains(fragment),
                "Expected '" + fragment + "' in: " + ex.getMessage());
    }
}
