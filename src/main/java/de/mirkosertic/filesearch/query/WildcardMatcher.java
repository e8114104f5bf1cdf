package de.mirkosertic.filesearch.query;

import java.util.Locale;

/**
 * Whole-string glob matcher: {@code *} matches any run of characters, {@code ?} exactly one.
 * Input is expected to be lowercase already.
 */
public final class WildcardMatcher {

    private final String pattern;

    public WildcardMatcher(final String pattern) {
        this.pattern = pattern.toLowerCase(Locale.ROOT);
    }

    public boolean matches(final String input) {
        int p = 0;
        int i = 0;
        int starP = -1;
        int starI = 0;
        while (i < input.length()) {
            if (p < pattern.length() && (pattern.charAt(p) == '?' || pattern.charAt(p) == input.charAt(i))) {
                p++;
                i++;
            } else if (p < pattern.length() && pattern.charAt(p) == '*') {
                starP = p++;
                starI = i;
            } else if (starP >= 0) {
                // backtrack: let the last star swallow one more character
                p = starP + 1;
                i = ++starI;
            } else {
                return false;
            }
        }
        while (p < pattern.length() && pattern.charAt(p) == '*') {
            p++;
        }
        return p == pattern.length();
    }
}
