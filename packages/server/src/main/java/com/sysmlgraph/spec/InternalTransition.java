package com.sysmlgraph.spec;

/** Transition handled inside a state without leaving it. */
public record InternalTransition(String trigger, String guard, String effect) {}
