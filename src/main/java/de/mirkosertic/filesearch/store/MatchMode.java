package de.mirkosertic.filesearch.store;

/**
 * What a keyword atom is verified against.
 */
public enum MatchMode {
    /** The file name only. */
    RESTRICTED,
    /** The file name or the full path. */
    SIMPLE
}
