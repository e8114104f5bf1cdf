package de.mirkosertic.filesearch.query;

/**
 * Inclusive range of longs. {@link Long#MIN_VALUE} and {@link Long#MAX_VALUE} stand for open ends.
 */
public record LongRange(long min, long max) {

    public LongRange {
        if (min > max) {
            final long t = min;
            min = max;
            max = t;
        }
    }

    public static LongRange exactly(final long value) {
        return new LongRange(value, value);
    }

    public static LongRange atLeast(final long value) {
        return new LongRange(value, Long.MAX_VALUE);
    }

    public static LongRange atMost(final long value) {
        return new LongRange(Long.MIN_VALUE, value);
    }

    /**
     * Range for a single comparison against {@code value}. Strict operators exclude the value itself.
     */
    public static LongRange compare(final Comparison comparison, final long value) {
        return switch (comparison) {
            case GT -> atLeast(value == Long.MAX_VALUE ? value : value + 1);
            case GE -> atLeast(value);
            case LT -> atMost(value == Long.MIN_VALUE ? value : value - 1);
            case LE -> atMost(value);
            case EQ, RANGE -> exactly(value);
        };
    }

    public boolean contains(final long value) {
        return value >= min && value <= max;
    }
}
