package com.hazardscan.cli.report;

import com.google.gson.annotations.SerializedName;

import java.util.Map;

/** Values of every node for one input assignment, as written by {@code hazard-scan compute}. */
public record ComputeReport(
    @SerializedName("circuit_name") String circuitName,
    @SerializedName("values")       Map<String, Integer> values
) {}
