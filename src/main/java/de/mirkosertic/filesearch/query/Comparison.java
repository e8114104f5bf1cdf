package de.mirkosertic.filesearch.query;

/**
 * Operator of a range or comparison filter value.
 */
public enum Comparison {
    EQ, GT, GE, LT, LE, RANGE
}
