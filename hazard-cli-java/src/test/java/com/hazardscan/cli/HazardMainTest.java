package com.hazardscan.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.parse.ExpressionParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HazardMainTest {

    private static String fixture(String name) throws Exception {
        return Path.of(HazardMainTest.class.getResource("/circuits/" + name).toURI()).toString();
    }

    private static JsonObject readJson(Path file) throws Exception {
        return JsonParser.parseString(Files.readString(file)).getAsJsonObject();
    }

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(HazardMain.UsageException.class, () -> HazardMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(HazardMain.UsageException.class, () -> HazardMain.run(new String[]{"simulate"}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(HazardMain.UsageException.class,
                () -> HazardMain.run(new String[]{"parse", "--foo", "bar"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        assertThrows(HazardMain.UsageException.class, () -> HazardMain.run(new String[]{"parse", "--expr"}));
    }

    @Test
    void parseRequiresExpr() {
        assertThrows(HazardMain.UsageException.class, () -> HazardMain.run(new String[]{"parse"}));
    }

    @Test
    void computeRequiresCircuit() {
        assertThrows(HazardMain.UsageException.class,
                () -> HazardMain.run(new String[]{"compute", "--inputs", "a=1"}));
    }

    @Test
    void detectRejectsBothSources() throws Exception {
        String circuit = fixture("mux.json");
        assertThrows(HazardMain.UsageException.class,
                () -> HazardMain.run(new String[]{"detect", "--circuit", circuit, "--expr", "A"}));
        assertThrows(HazardMain.UsageException.class, () -> HazardMain.run(new String[]{"detect"}));
    }

    @Test
    void parseWritesDescription(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("parsed.json");
        HazardMain.run(new String[]{"parse", "--expr", "A AND NOT B", "--output", out.toString()});

        JsonObject json = readJson(out);
        assertEquals(ExpressionParser.CIRCUIT_NAME, json.get("name").getAsString());
        JsonArray gates = json.getAsJsonArray("gates");
        assertEquals(2, gates.size());
        assertEquals("NOT", gates.get(0).getAsJsonObject().get("type").getAsString());
        assertEquals(0, json.getAsJsonArray("inputs").get(0).getAsJsonObject().get("initial_value").getAsInt());
    }

    @Test
    void parseOutputLoadsBackAsCircuit(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("parsed.json");
        HazardMain.run(new String[]{"parse", "--expr", "(A OR B) AND C", "--output", out.toString()});

        Path computed = tmp.resolve("computed.json");
        HazardMain.run(new String[]{"compute", "--circuit", out.toString(), "--inputs", "a=1,c=1",
                "--output", computed.toString()});
        assertEquals(1, readJson(computed).getAsJsonObject("values").get("out1").getAsInt());
    }

    @Test
    void computeUsesInitialValuesByDefault(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("values.json");
        HazardMain.run(new String[]{"compute", "--circuit", fixture("mux.json"), "--output", out.toString()});

        JsonObject json = readJson(out);
        assertEquals("mux", json.get("circuit_name").getAsString());
        JsonObject values = json.getAsJsonObject("values");
        assertEquals(1, values.get("g2").getAsInt());
        assertEquals(1, values.get("out1").getAsInt());
    }

    @Test
    void computeRejectsUnknownInput() throws Exception {
        String circuit = fixture("mux.json");
        assertThrows(Circuit.EvaluationException.class,
                () -> HazardMain.run(new String[]{"compute", "--circuit", circuit, "--inputs", "zz=1"}));
    }

    @Test
    void malformedInputsThrowsUsageException() {
        assertThrows(HazardMain.UsageException.class, () -> HazardMain.parseInputs("a=1,b"));
        assertThrows(HazardMain.UsageException.class, () -> HazardMain.parseInputs("a=x"));
        assertEquals(Map.of("a", 1, "b", 0), HazardMain.parseInputs(" a=1 , b=0 "));
        assertNull(HazardMain.parseInputs(null));
    }

    @Test
    void detectReportsRaceAndHazard(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("report.json");
        HazardMain.run(new String[]{"detect", "--circuit", fixture("mux.json"), "--output", out.toString()});

        JsonObject report = readJson(out);
        assertEquals("mux", report.get("circuit_name").getAsString());

        JsonArray races = report.getAsJsonArray("race_conditions");
        assertEquals(1, races.size());
        assertEquals("g1", races.get(0).getAsJsonObject().get("gate_id").getAsString());

        JsonArray hazards = report.getAsJsonArray("hazards");
        assertEquals(1, hazards.size());
        JsonObject hazard = hazards.get(0).getAsJsonObject();
        assertEquals("static-1", hazard.get("hazard_type").getAsString());
        assertEquals("SEL", hazard.get("variable").getAsString());
        assertEquals("g4", hazard.getAsJsonArray("gate_ids").get(0).getAsString());
        assertEquals("simulation", hazard.get("method").getAsString());
        assertEquals(1, hazard.getAsJsonObject("other_inputs").get("d0").getAsInt());
    }

    @Test
    void detectFromExpression(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("report.json");
        HazardMain.run(new String[]{"detect", "--expr", "A AND NOT A", "--output", out.toString()});

        JsonArray hazards = readJson(out).getAsJsonArray("hazards");
        assertEquals(1, hazards.size());
        assertEquals("static-0", hazards.get(0).getAsJsonObject().get("hazard_type").getAsString());
    }

    @Test
    void detectHonoursConfig(@TempDir Path tmp) throws Exception {
        Path config = tmp.resolve("scan-config.json");
        Files.writeString(config, "{\"race_threshold\": 0.3}");
        Path out = tmp.resolve("report.json");
        HazardMain.run(new String[]{"detect", "--circuit", fixture("and_race.json"),
                "--config", config.toString(), "--output", out.toString()});
        assertEquals(0, readJson(out).getAsJsonArray("race_conditions").size());

        HazardMain.run(new String[]{"detect", "--circuit", fixture("and_race.json"), "--output", out.toString()});
        assertEquals(1, readJson(out).getAsJsonArray("race_conditions").size());
    }

    @Test
    void missingCircuitFileFails(@TempDir Path tmp) {
        String missing = tmp.resolve("nope.json").toString();
        assertThrows(HazardMain.CircuitReadException.class,
                () -> HazardMain.run(new String[]{"detect", "--circuit", missing}));
    }

    @Test
    void invalidCircuitFileNamesTheField() throws Exception {
        String broken = fixture("missing_delay.json");
        Circuit.ValidationException ex = assertThrows(Circuit.ValidationException.class,
                () -> HazardMain.run(new String[]{"compute", "--circuit", broken}));
        assertEquals("gates[0].delay is required", ex.getMessage());
    }

    @Test
    void parseErrorPropagates() {
        assertThrows(ExpressionParser.ParseException.class,
                () -> HazardMain.run(new String[]{"parse", "--expr", "A AND"}));
    }
}
