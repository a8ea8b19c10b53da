package com.hazardscan.core.circuit;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * Structured, serialization-friendly form of a circuit.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public class CircuitDescription {

    @SerializedName("name")        public String name;
    @SerializedName("gates")       public List<GateEntry> gates;
    @SerializedName("inputs")      public List<InputEntry> inputs;
    @SerializedName("outputs")     public List<OutputEntry> outputs;
    @SerializedName("connections") public List<ConnectionEntry> connections;

    public static class GateEntry {
        @SerializedName("id")     public String id;
        @SerializedName("type")   public String type;     // AND, OR, NOT, XOR
        @SerializedName("delay")  public Double delay;
        @SerializedName("inputs") public List<String> inputs;
        @SerializedName("output") public String output;
    }

    public static class InputEntry {
        @SerializedName("id")            public String id;
        @SerializedName("name")          public String name;
        @SerializedName("initial_value") public Integer initialValue;
    }

    public static class OutputEntry {
        @SerializedName("id")     public String id;
        @SerializedName("name")   public String name;
        @SerializedName("source") public String source;
    }

    public static class ConnectionEntry {
        @SerializedName("from")  public String from;
        @SerializedName("to")    public String to;
        @SerializedName("delay") public Double delay;
    }
}
