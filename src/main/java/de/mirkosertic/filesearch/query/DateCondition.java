package de.mirkosertic.filesearch.query;

/**
 * One value of a {@code dm:} filter: a comparison against a date expression, or a range between two.
 * For non-range conditions {@code from} and {@code to} are the same expression.
 */
public record DateCondition(Comparison comparison, DateExpression from, DateExpression to) {

    public static DateCondition of(final Comparison comparison, final DateExpression expression) {
        return new DateCondition(comparison, expression, expression);
    }

    public static DateCondition between(final DateExpression from, final DateExpression to) {
        return new DateCondition(Comparison.RANGE, from, to);
    }

    /**
     * Accepted modification times in epoch seconds.
     */
    public LongRange resolve(final FilterContext context) {
        final LongRange a = from.resolve(context);
        if (comparison == Comparison.RANGE) {
            final LongRange b = to.resolve(context);
            return new LongRange(Math.min(a.min(), b.min()), Math.max(a.max(), b.max()));
        }
        return switch (comparison) {
            case EQ -> from.point() ? LongRange.atLeast(a.min()) : a;
            case GT -> LongRange.atLeast(a.max() + 1);
            case GE -> LongRange.atLeast(a.min());
            case LT -> LongRange.atMost(a.min() - 1);
            case LE -> LongRange.atMost(a.max());
            case RANGE -> a;
        };
    }
}
