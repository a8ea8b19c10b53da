package com.hazardscan.cli.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.*;
import java.nio.file.*;

/**
 * Writes command results as pretty-printed JSON, to a file or to stdout.
 */
public class ReportWriter {

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final PrintStream stdout;

    public ReportWriter() {
        this(System.out);
    }

    public ReportWriter(PrintStream stdout) {
        this.stdout = stdout;
    }

    /**
     * @param result     any Gson-serializable value
     * @param outputFile target file, parent directories created if absent; null for stdout
     */
    public void write(Object result, Path outputFile) {
        String json = toJson(result);
        if (outputFile == null) {
            stdout.println(json);
            stdout.flush();
            return;
        }

        Path parent = outputFile.toAbsolutePath().getParent();
        try {
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + parent, e);
        }
        try (Writer w = new FileWriter(outputFile.toFile())) {
            w.write(json);
            w.write(System.lineSeparator());
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + outputFile + ": " + e.getMessage(), e);
        }
        System.err.println("[hazard-scan] Report written: " + outputFile);
    }

    public String toJson(Object result) {
        return gson.toJson(result);
    }
}
