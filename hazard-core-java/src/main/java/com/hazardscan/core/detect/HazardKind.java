package com.hazardscan.core.detect;

import com.google.gson.annotations.SerializedName;
import com.hazardscan.core.circuit.GateKind;

public enum HazardKind {
    @SerializedName("static-0") STATIC_0("static-0"),
    @SerializedName("static-1") STATIC_1("static-1"),
    @SerializedName("dynamic")  DYNAMIC("dynamic");

    private final String label;

    HazardKind(String label) {
        this.label = label;
    }

    public String label() { return label; }

    /** AND reconvergence glitches to 0, OR to 1; any other gate kind is treated as dynamic. */
    public static HazardKind forGate(GateKind kind) {
        return switch (kind) {
            case AND -> STATIC_0;
            case OR  -> STATIC_1;
            default  -> DYNAMIC;
        };
    }

    @Override
    public String toString() { return label; }
}
