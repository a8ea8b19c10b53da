package com.hazardscan.core;

import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.circuit.GateKind;
import com.hazardscan.core.detect.PathExplorer;
import com.hazardscan.core.detect.RaceCondition;
import com.hazardscan.core.detect.RaceDetector;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RaceDetectorTest {

    private static List<RaceCondition> races(Circuit c, double threshold) {
        return new RaceDetector(c, new PathExplorer(c), threshold).detect();
    }

    @Test
    void closeArrivalsAreARace() {
        List<RaceCondition> races = races(TestCircuits.twoInputAnd(0.1, 0.5), 0.5);
        assertEquals(1, races.size());
        RaceCondition race = races.get(0);
        assertEquals("g1", race.gateId());
        assertEquals(GateKind.AND, race.gateType());
        assertEquals("in1", race.input1());
        assertEquals("in2", race.input2());
        assertEquals(0.1, race.delay1(), 1e-9);
        assertEquals(0.5, race.delay2(), 1e-9);
    }

    @Test
    void distantArrivalsAreNotARace() {
        assertTrue(races(TestCircuits.twoInputAnd(0.1, 0.7), 0.5).isEmpty());
    }

    @Test
    void thresholdIsStrict() {
        assertTrue(races(TestCircuits.twoInputAnd(0.0, 0.5), 0.5).isEmpty());
        assertEquals(1, races(TestCircuits.twoInputAnd(0.0, 0.5), 0.6).size());
    }

    @Test
    void arrivalIncludesUpstreamGatesAndEntryWire() {
        Circuit c = Circuit.builder("upstream")
                .addInput("a", "A", 0)
                .addInput("b", "B", 0)
                .addGate("g1", GateKind.NOT, 1.0, "a")
                .addGate("g2", GateKind.AND, 2.0, "g1", "b")
                .addConnection("a", "g1", 0.1)
                .addConnection("g1", "g2", 0.1)
                .addConnection("b", "g2", 1.0)
                .addOutput("out1", "Y", "g2")
                .build();
        RaceDetector detector = new RaceDetector(c, new PathExplorer(c), 0.5);

        Map<String, Double> delays = detector.arrivalDelays(c.gate("g2"));
        assertEquals(1.2, delays.get("g1"), 1e-9);
        assertEquals(1.0, delays.get("b"), 1e-9);
        assertEquals(1, detector.detect().size());
    }

    @Test
    void singleInputGatesNeverRace() {
        assertTrue(races(TestCircuits.notChain(3), 10.0).isEmpty());
    }

    @Test
    void repeatedPortCountsOnce() {
        Circuit c = Circuit.builder("same")
                .addInput("a", "A", 0)
                .addGate("g1", GateKind.AND, 2.0, "a", "a")
                .addConnection("a", "g1", 0.1)
                .addOutput("out1", "Y", "g1")
                .build();
        assertTrue(races(c, 0.5).isEmpty());
    }

    @Test
    void everyPairOnAWideGateIsChecked() {
        Circuit c = Circuit.builder("wide")
                .addInput("a", "A", 0)
                .addInput("b", "B", 0)
                .addInput("c", "C", 0)
                .addGate("g1", GateKind.OR, 2.0, "a", "b", "c")
                .addConnection("a", "g1", 0.1)
                .addConnection("b", "g1", 0.2)
                .addConnection("c", "g1", 0.3)
                .addOutput("out1", "Y", "g1")
                .build();
        assertEquals(3, races(c, 0.5).size());
    }
}
