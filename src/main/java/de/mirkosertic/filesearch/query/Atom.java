package de.mirkosertic.filesearch.query;

import java.util.Locale;

/**
 * A lowercase keyword, either a plain literal or a wildcard pattern using {@code *} and {@code ?}.
 */
public record Atom(String text, boolean wildcard) {

    public static Atom of(final String raw) {
        final String lower = raw.toLowerCase(Locale.ROOT);
        return new Atom(lower, lower.indexOf('*') >= 0 || lower.indexOf('?') >= 0);
    }

    /**
     * True when the atom can be resolved through the trigram index of the file name.
     */
    public boolean trigramResolvable() {
        return !wildcard && text.length() >= 3;
    }

    public boolean containsSeparator() {
        return text.indexOf('/') >= 0 || text.indexOf('\\') >= 0;
    }
}
