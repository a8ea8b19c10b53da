package com.hazardscan.core.detect;

import com.google.gson.annotations.SerializedName;

import java.util.List;

public record DetectionReport(
    @SerializedName("circuit_name")    String circuitName,
    @SerializedName("race_conditions") List<RaceCondition> raceConditions,
    @SerializedName("hazards")         List<Hazard> hazards
) {}
