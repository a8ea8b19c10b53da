package com.hazardscan.cli;

import com.hazardscan.cli.config.ScanConfig;
import com.hazardscan.cli.config.ScanConfigReader;
import com.hazardscan.cli.report.ComputeReport;
import com.hazardscan.cli.report.ReportWriter;
import com.hazardscan.core.HazardScan;
import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.circuit.CircuitDescription;
import com.hazardscan.core.circuit.CircuitDescriptions;
import com.hazardscan.core.detect.DetectionReport;
import com.hazardscan.core.detect.DetectorConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for the hazard-scan command line.
 *
 * Usage:
 *   java -jar hazard-cli-java.jar parse   --expr <expression> [--output <file>]
 *   java -jar hazard-cli-java.jar compute --circuit <file.json> [--inputs a=1,b=0] [--output <file>]
 *   java -jar hazard-cli-java.jar detect  (--circuit <file.json> | --expr <expression>) \
 *     [--config <scan-config.json>] [--output <file>]
 */
public class HazardMain {

    private static final String USAGE = "Usage: java -jar hazard-cli-java.jar "
            + "parse --expr <expression> | compute --circuit <file> [--inputs a=1,b=0] | "
            + "detect (--circuit <file> | --expr <expression>) [--config <file>] [--output <file>]";

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[hazard-scan] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[hazard-scan] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        run(args, new ReportWriter());
    }

    static void run(String[] args, ReportWriter writer) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        String command = args[0];
        if (!command.equals("parse") && !command.equals("compute") && !command.equals("detect")) {
            throw new UsageException("Unknown subcommand: " + command);
        }

        String expression = null;
        String circuitPath = null;
        String inputs = null;
        String configPath = null;
        String outputPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--expr"    -> expression  = requireNext(args, i++, "--expr");
                case "--circuit" -> circuitPath = requireNext(args, i++, "--circuit");
                case "--inputs"  -> inputs      = requireNext(args, i++, "--inputs");
                case "--config"  -> configPath  = requireNext(args, i++, "--config");
                case "--output"  -> outputPath  = requireNext(args, i++, "--output");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        Path output = outputPath != null ? Paths.get(outputPath) : null;

        switch (command) {
            case "parse" -> {
                if (expression == null) throw new UsageException("--expr is required");
                rejectFlag(command, "--circuit", circuitPath);
                rejectFlag(command, "--inputs", inputs);
                rejectFlag(command, "--config", configPath);
                System.err.println("[hazard-scan] Parsing expression: " + expression);
                writer.write(HazardScan.parseExpression(expression), output);
            }
            case "compute" -> {
                if (circuitPath == null) throw new UsageException("--circuit is required");
                rejectFlag(command, "--expr", expression);
                rejectFlag(command, "--config", configPath);
                Circuit circuit = readCircuit(Paths.get(circuitPath));
                Map<String, Integer> values = HazardScan.computeCircuit(circuit, parseInputs(inputs));
                writer.write(new ComputeReport(circuit.getName(), values), output);
            }
            default -> {
                if (circuitPath == null && expression == null) {
                    throw new UsageException("One of --circuit or --expr is required");
                }
                if (circuitPath != null && expression != null) {
                    throw new UsageException("--circuit and --expr cannot be combined");
                }
                rejectFlag(command, "--inputs", inputs);

                DetectorConfig config = DetectorConfig.defaults();
                if (configPath != null) {
                    System.err.println("[hazard-scan] Reading config: " + configPath);
                    ScanConfig scanConfig = new ScanConfigReader().read(Paths.get(configPath));
                    config = scanConfig.toDetectorConfig();
                }

                Circuit circuit;
                if (circuitPath != null) {
                    circuit = readCircuit(Paths.get(circuitPath));
                } else {
                    System.err.println("[hazard-scan] Parsing expression: " + expression);
                    circuit = HazardScan.circuitFromDescription(HazardScan.parseExpression(expression));
                }
                DetectionReport report = HazardScan.detectHazards(circuit, config);
                writer.write(report, output);
            }
        }
    }

    private static Circuit readCircuit(Path path) {
        System.err.println("[hazard-scan] Reading circuit: " + path);
        if (!Files.exists(path)) {
            throw new CircuitReadException("Circuit file not found: " + path, null);
        }
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new CircuitReadException("Failed to read circuit file: " + path + ": " + e.getMessage(), e);
        }
        CircuitDescription description = CircuitDescriptions.fromJson(json);
        Circuit circuit = HazardScan.circuitFromDescription(description);
        System.err.println("[hazard-scan] Loaded " + circuit);
        return circuit;
    }

    // "a=1,b=0" -> {a=1, b=0}; value range is checked by the circuit.
    static Map<String, Integer> parseInputs(String text) {
        if (text == null || text.isBlank()) return null;
        Map<String, Integer> values = new LinkedHashMap<>();
        for (String pair : text.split(",")) {
            String[] parts = pair.trim().split("=", -1);
            if (parts.length != 2 || parts[0].isBlank()) {
                throw new UsageException("Malformed --inputs entry '" + pair.trim() + "', expected id=value");
            }
            try {
                values.put(parts[0].trim(), Integer.parseInt(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new UsageException("Value of input " + parts[0].trim() + " is not a number: " + parts[1]);
            }
        }
        return values;
    }

    private static void rejectFlag(String command, String flag, String value) {
        if (value != null) {
            throw new UsageException(flag + " is not accepted by " + command);
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }

    static class CircuitReadException extends RuntimeException {
        CircuitReadException(String msg, Throwable cause) { super(msg, cause); }
    }
}
