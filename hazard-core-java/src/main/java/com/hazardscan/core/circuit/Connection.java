package com.hazardscan.core.circuit;

/**
 * A wire from a primary input or gate to a gate, with its propagation delay in nanoseconds.
 */
public record Connection(String from, String to, double delay) {}
