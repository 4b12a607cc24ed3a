package com.risk.ftree.api;

/**
 * Closed set of node kinds a gate can hold as arguments.
 * Each kind maps to exactly one argument collection of a gate.
 */
public enum NodeKind {
    GATE,
    BASIC_EVENT,
    HOUSE_EVENT,
    /** Forward-declared or unresolved reference. */
    UNDEFINED
}
