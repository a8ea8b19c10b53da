package com.hazardscan.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.hazardscan.cli.report.ComputeReport;
import com.hazardscan.cli.report.ReportWriter;
import com.hazardscan.core.HazardScan;
import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.detect.DetectionReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    private static DetectionReport sampleReport() {
        Circuit c = HazardScan.circuitFromDescription(HazardScan.parseExpression("A OR NOT A"));
        return HazardScan.detectHazards(c);
    }

    @Test
    void writesToStdoutWithoutOutputFile() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new ReportWriter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).write(sampleReport(), null);

        JsonObject json = JsonParser.parseString(buffer.toString(StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals("parsed_circuit", json.get("circuit_name").getAsString());
    }

    @Test
    void outputDirCreatedIfAbsent(@TempDir Path tmp) throws Exception {
        Path nested = tmp.resolve("a/b/report.json");
        new ReportWriter().write(sampleReport(), nested);
        assertTrue(Files.exists(nested));
    }

    @Test
    void usesSnakeCaseAndHazardLabels(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("report.json");
        new ReportWriter().write(sampleReport(), out);

        String content = Files.readString(out);
        assertTrue(content.contains("\"race_conditions\""), content);
        assertTrue(content.contains("\"hazard_type\": \"static-1\""), content);
        assertTrue(content.contains("\"gate_type\": \"OR\""), content);
    }

    @Test
    void deterministicOutput(@TempDir Path tmp) throws Exception {
        ReportWriter writer = new ReportWriter();
        Path out = tmp.resolve("report.json");
        writer.write(sampleReport(), out);
        String first = Files.readString(out);
        writer.write(sampleReport(), out);
        assertEquals(first, Files.readString(out), "Identical input should produce identical output");
    }

    @Test
    void computeReportKeepsNodeOrder() {
        Map<String, Integer> values = new LinkedHashMap<>();
        values.put("b", 1);
        values.put("a", 0);
        String json = new ReportWriter().toJson(new ComputeReport("c", values));
        assertTrue(json.indexOf("\"b\"") < json.indexOf("\"a\""), json);
    }
}
