package com.hazardscan.core.detect;

import com.google.gson.annotations.SerializedName;
import com.hazardscan.core.circuit.GateKind;

/**
 * Two inputs of the same gate whose arrival delays differ by less than the race threshold.
 */
public record RaceCondition(
    @SerializedName("gate_id")   String gateId,
    @SerializedName("gate_type") GateKind gateType,
    @SerializedName("input1")    String input1,
    @SerializedName("input2")    String input2,
    @SerializedName("delay1")    double delay1,
    @SerializedName("delay2")    double delay2
) {}
