package com.streamhistory.insights;

/**
 * A category value and how many plays fell into it.
 */
public record NamedCount(String name, long plays) {}
