package de.mirkosertic.filesearch.search;

import org.jspecify.annotations.Nullable;

/**
 * Either all configured drives or one drive by id.
 */
public record SearchScope(@Nullable String drive) {

    private static final SearchScope ALL = new SearchScope(null);

    public static SearchScope all() {
        return ALL;
    }

    public static SearchScope drive(final String driveId) {
        if (driveId == null || driveId.isBlank()) {
            throw new IllegalArgumentException("Drive id must not be blank");
        }
        return new SearchScope(driveId);
    }

    /**
     * {@code null}, blank, {@code all} and {@code *} select all drives, anything else one drive.
     */
    public static SearchScope parse(final @Nullable String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        final String trimmed = value.trim();
        if ("all".equalsIgnoreCase(trimmed) || "*".equals(trimmed)) {
            return ALL;
        }
        return new SearchScope(trimmed);
    }

    public boolean isAll() {
        return drive == null;
    }
}
