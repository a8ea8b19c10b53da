package com.hazardscan.core.detect;

import com.google.gson.annotations.SerializedName;
import com.hazardscan.core.circuit.GateKind;

import java.util.List;
import java.util.Map;

/**
 * A gate where a variable and its complement reconverge.
 *
 * {@code otherInputs} is the assignment of the remaining inputs under which the simulation
 * exposed the site; it is null for findings from convergence classification.
 */
public record Hazard(
    @SerializedName("variable")     String variable,
    @SerializedName("variable_id")  String variableId,
    @SerializedName("hazard_type")  HazardKind hazardType,
    @SerializedName("gate_ids")     List<String> gateIds,
    @SerializedName("gate_type")    GateKind gateType,
    @SerializedName("description")  String description,
    @SerializedName("other_inputs") Map<String, Integer> otherInputs,
    @SerializedName("method")       Method method
) {
    public enum Method {
        @SerializedName("simulation")  SIMULATION,
        @SerializedName("convergence") CONVERGENCE
    }

    public String gateId() {
        return gateIds.get(0);
    }
}
