package com.hazardscan.core.detect;

import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.circuit.Connection;
import com.hazardscan.core.circuit.Gate;
import com.hazardscan.core.circuit.GateKind;
import com.hazardscan.core.circuit.PrimaryInput;
import com.hazardscan.core.circuit.PrimaryOutput;

import java.util.*;

/**
 * Path-based hazard screening: finds the gates where a variable's true and complemented
 * forms can meet, and classifies them by gate kind without simulating.
 */
public class ConvergenceAnalyzer {

    private final Circuit circuit;
    private final PathExplorer explorer;

    public ConvergenceAnalyzer(Circuit circuit, PathExplorer explorer) {
        this.circuit = circuit;
        this.explorer = explorer;
    }

    /** NOT gates fed straight from {@code inputId}, in connection order. */
    public List<String> directNotGates(String inputId) {
        Set<String> nots = new LinkedHashSet<>();
        for (Connection c : circuit.getConnections()) {
            if (!c.from().equals(inputId)) continue;
            Gate target = circuit.gate(c.to());
            if (target != null && target.kind() == GateKind.NOT) {
                nots.add(target.id());
            }
        }
        return new ArrayList<>(nots);
    }

    /**
     * Splits the variable's output paths into original and negated sets and intersects the
     * gates they visit.
     */
    public HazardCandidate analyze(PrimaryInput variable) {
        String varId = variable.id();
        List<String> directNots = directNotGates(varId);

        Set<List<String>> variablePaths = new LinkedHashSet<>();
        for (PrimaryOutput out : circuit.getOutputs().values()) {
            for (List<String> path : explorer.pathsTo(out.source())) {
                if (path.contains(varId)) variablePaths.add(path);
            }
        }

        List<List<String>> original = new ArrayList<>();
        List<List<String>> negated = new ArrayList<>();
        for (List<String> path : variablePaths) {
            int at = path.indexOf(varId);
            if (at == path.size() - 1) continue;   // output driven by the input itself
            if (directNots.contains(path.get(at + 1))) {
                negated.add(path);
            } else {
                original.add(path);
            }
        }

        Set<String> common = gatesOn(original);
        common.retainAll(gatesOn(negated));
        common.removeAll(directNots);

        List<String> points = new ArrayList<>();
        for (String gateId : circuit.topologicalOrder()) {
            if (common.contains(gateId)) points.add(gateId);
        }
        return new HazardCandidate(varId, variable.name(), directNots,
                List.copyOf(original), List.copyOf(negated), List.copyOf(points));
    }

    /** One hazard per convergence point, typed by the gate kind at that point. */
    public List<Hazard> classify(HazardCandidate candidate) {
        List<Hazard> hazards = new ArrayList<>();
        for (String gateId : candidate.convergencePoints()) {
            Gate gate = circuit.gate(gateId);
            if (gate == null) {
                System.err.println("[hazard-core] WARNING: convergence point " + gateId + " is not a gate, skipped");
                continue;
            }
            HazardKind kind = HazardKind.forGate(gate.kind());
            hazards.add(new Hazard(
                    candidate.variableName(),
                    candidate.variableId(),
                    kind,
                    List.of(gateId),
                    gate.kind(),
                    "Gate " + gateId + " (" + gate.kind() + ") may receive variable "
                            + candidate.variableName() + " and its complement; possible " + kind + " hazard",
                    null,
                    Hazard.Method.CONVERGENCE));
        }
        return hazards;
    }

    private Set<String> gatesOn(List<List<String>> paths) {
        Set<String> gates = new HashSet<>();
        for (List<String> path : paths) {
            for (String node : path) {
                if (circuit.isGate(node)) gates.add(node);
            }
        }
        return gates;
    }
}
