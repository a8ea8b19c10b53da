package com.hazardscan.core;

import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.circuit.CircuitDescription;
import com.hazardscan.core.circuit.CircuitDescriptions;
import com.hazardscan.core.detect.DetectionReport;
import com.hazardscan.core.detect.DetectorConfig;
import com.hazardscan.core.detect.HazardDetector;
import com.hazardscan.core.parse.ExpressionParser;

import java.util.Map;

/**
 * The four operations the engine offers to callers. Nothing below this facade needs to be
 * touched to parse, build, evaluate or analyze a circuit.
 */
public final class HazardScan {

    private HazardScan() {}

    /**
     * @throws ExpressionParser.ParseException if the expression is empty or malformed
     */
    public static CircuitDescription parseExpression(String expression) {
        return CircuitDescriptions.toDescription(new ExpressionParser().parse(expression));
    }

    /**
     * @throws Circuit.ValidationException naming the missing or invalid field
     */
    public static Circuit circuitFromDescription(CircuitDescription description) {
        return CircuitDescriptions.fromDescription(description);
    }

    /**
     * @param inputValues input id to 0/1, or null for the initial values
     * @throws Circuit.EvaluationException if the circuit cannot be evaluated
     * @throws com.hazardscan.core.circuit.TopologicalSorter.CycleException if the gates form a cycle
     */
    public static Map<String, Integer> computeCircuit(Circuit circuit, Map<String, Integer> inputValues) {
        return circuit.compute(inputValues);
    }

    /** Never throws for a failing sub-check; those degrade to empty findings. */
    public static DetectionReport detectHazards(Circuit circuit) {
        return detectHazards(circuit, DetectorConfig.defaults());
    }

    public static DetectionReport detectHazards(Circuit circuit, DetectorConfig config) {
        return new HazardDetector(circuit, config).detect();
    }
}
