package com.hazardscan.core.circuit;

/** A named circuit output; {@code source} is the node id driving it. */
public record PrimaryOutput(String id, String name, String source) {}
