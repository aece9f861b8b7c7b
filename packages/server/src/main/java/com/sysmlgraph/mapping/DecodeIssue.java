package com.sysmlgraph.mapping;

/**
 * A stored property that could not be turned back into its field.
 *
 * @param field field name in the element spec
 * @param storageKey property name in the graph store
 * @param message parser message
 */
public record DecodeIssue(String field, String storageKey, String message) {}
