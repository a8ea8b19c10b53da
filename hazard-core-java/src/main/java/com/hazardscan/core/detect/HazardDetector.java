package com.hazardscan.core.detect;

import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.circuit.PrimaryInput;

import java.util.*;

/**
 * Race and hazard sweep over one circuit.
 *
 * Hazards are searched per input variable that drives a NOT gate directly. Exhaustive
 * symbolic simulation is the primary route; when it finds nothing for a variable, the
 * convergence points from the path pre-check are classified by gate kind instead.
 * Every sub-check is isolated: a failure is logged and counts as "no finding", so one bad
 * variable does not abort the sweep.
 *
 * One detector per circuit; the path cache lives as long as the detector.
 */
public class HazardDetector {

    private final Circuit circuit;
    private final DetectorConfig config;
    private final PathExplorer explorer;
    private final ConvergenceAnalyzer analyzer;
    private final SymbolicSimulator simulator;

    public HazardDetector(Circuit circuit) {
        this(circuit, DetectorConfig.defaults());
    }

    public HazardDetector(Circuit circuit, DetectorConfig config) {
        this.circuit = circuit;
        this.config = config;
        this.explorer = new PathExplorer(circuit, config.maxPathDepth);
        this.analyzer = new ConvergenceAnalyzer(circuit, explorer);
        this.simulator = new SymbolicSimulator(circuit, config);
    }

    public DetectionReport detect() {
        System.err.println("[hazard-core] Detecting races and hazards in circuit '" + circuit.getName() + "'");
        List<RaceCondition> races = detectRaceConditions();
        List<Hazard> hazards = detectHazards();
        System.err.println("[hazard-core] Detection complete: " + races.size() + " race conditions, "
                + hazards.size() + " hazards");
        return new DetectionReport(circuit.getName(), races, hazards);
    }

    public List<RaceCondition> detectRaceConditions() {
        try {
            return new RaceDetector(circuit, explorer, config.raceThreshold).detect();
        } catch (RuntimeException e) {
            System.err.println("[hazard-core] ERROR: race detection failed: " + e.getMessage());
            return new ArrayList<>();
        }
    }

    public List<Hazard> detectHazards() {
        List<Hazard> hazards = new ArrayList<>();
        for (PrimaryInput variable : hazardCandidates()) {
            HazardCandidate candidate = null;
            try {
                candidate = analyzer.analyze(variable);
            } catch (RuntimeException e) {
                System.err.println("[hazard-core] ERROR: path pre-check for " + variable.name()
                        + " failed: " + e.getMessage());
            }

            List<Hazard> found = simulationHazards(variable);
            if (found.isEmpty() && candidate != null && candidate.hasConvergence()) {
                System.err.println("[hazard-core] Simulation found nothing for " + variable.name()
                        + "; classifying convergence points " + candidate.convergencePoints());
                found = analyzer.classify(candidate);
            }
            hazards.addAll(found);
        }
        return hazards;
    }

    /** Inputs that feed at least one NOT gate directly; only these can reconverge with their complement. */
    public List<PrimaryInput> hazardCandidates() {
        List<PrimaryInput> candidates = new ArrayList<>();
        for (PrimaryInput in : circuit.getInputs().values()) {
            if (!analyzer.directNotGates(in.id()).isEmpty()) candidates.add(in);
        }
        return candidates;
    }

    /** Primary route only. Empty on failure. */
    public List<Hazard> simulationHazards(PrimaryInput variable) {
        try {
            List<Hazard> hazards = new ArrayList<>();
            for (SymbolicSimulator.Site site : simulator.simulate(variable.id())) {
                HazardKind kind = HazardKind.forGate(site.gateKind());
                hazards.add(new Hazard(
                        variable.name(),
                        variable.id(),
                        kind,
                        List.of(site.gateId()),
                        site.gateKind(),
                        "Gate " + site.gateId() + " (" + site.gateKind() + ") receives variable "
                                + variable.name() + " and its complement when " + describe(site.otherInputs())
                                + "; possible " + kind + " hazard",
                        site.otherInputs(),
                        Hazard.Method.SIMULATION));
            }
            System.err.println("[hazard-core] Variable " + variable.name() + ": " + hazards.size()
                    + " reconvergence site(s) by simulation");
            return hazards;
        } catch (RuntimeException e) {
            System.err.println("[hazard-core] ERROR: symbolic simulation of " + variable.name()
                    + " failed: " + e.getMessage());
            return new ArrayList<>();
        }
    }

    /** Fallback route only. Empty on failure. */
    public List<Hazard> convergenceHazards(PrimaryInput variable) {
        try {
            return analyzer.classify(analyzer.analyze(variable));
        } catch (RuntimeException e) {
            System.err.println("[hazard-core] ERROR: convergence classification of " + variable.name()
                    + " failed: " + e.getMessage());
            return new ArrayList<>();
        }
    }

    public PathExplorer getPathExplorer() { return explorer; }

    private static String describe(Map<String, Integer> assignment) {
        if (assignment.isEmpty()) return "no other inputs are set";
        StringJoiner joiner = new StringJoiner(", ");
        assignment.forEach((k, v) -> joiner.add(k + "=" + v));
        return joiner.toString();
    }
}
