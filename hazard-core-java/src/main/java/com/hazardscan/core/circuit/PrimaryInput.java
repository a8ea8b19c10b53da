package com.hazardscan.core.circuit;

public record PrimaryInput(String id, String name, int initialValue) {}
