package de.mirkosertic.filesearch.query;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Symbolic date as written in a {@code dm:} filter. It stays unresolved in the compiled query and
 * is turned into epoch seconds against a {@link FilterContext} per search.
 * <p>
 * Relative forms ({@code 7d}, {@code 12h}, {@code 30m}, {@code week}, {@code month}, {@code year})
 * resolve to a single instant. Calendar forms ({@code today}, {@code yesterday}, {@code YYYY-MM-DD})
 * resolve to a whole day.
 */
public record DateExpression(Form form, long amount, @Nullable LocalDate date) {

    private static final Pattern RELATIVE = Pattern.compile("(\\d{1,9})([dhm])");
    // Four-digit years only, so the day after any accepted date is still representable.
    private static final Pattern CALENDAR = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    public enum Form {
        MINUTES_AGO, HOURS_AGO, DAYS_AGO, TODAY, YESTERDAY, WEEK, MONTH, YEAR, DATE
    }

    public static @Nullable DateExpression parse(final String value) {
        final String v = value.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "today":
                return new DateExpression(Form.TODAY, 0, null);
            case "yesterday":
                return new DateExpression(Form.YESTERDAY, 0, null);
            case "week":
                return new DateExpression(Form.WEEK, 0, null);
            case "month":
                return new DateExpression(Form.MONTH, 0, null);
            case "year":
                return new DateExpression(Form.YEAR, 0, null);
            default:
                break;
        }
        final Matcher m = RELATIVE.matcher(v);
        if (m.matches()) {
            final long amount = Long.parseLong(m.group(1));
            final Form form = switch (m.group(2)) {
                case "d" -> Form.DAYS_AGO;
                case "h" -> Form.HOURS_AGO;
                default -> Form.MINUTES_AGO;
            };
            return new DateExpression(form, amount, null);
        }
        if (!CALENDAR.matcher(v).matches()) {
            return null;
        }
        try {
            return new DateExpression(Form.DATE, 0, LocalDate.parse(v));
        } catch (final DateTimeParseException e) {
            return null;
        }
    }

    /**
     * True for forms that denote an instant rather than a calendar day.
     */
    public boolean point() {
        return switch (form) {
            case TODAY, YESTERDAY, DATE -> false;
            default -> true;
        };
    }

    /**
     * Inclusive interval in epoch seconds. Points resolve to a single-second interval.
     */
    public LongRange resolve(final FilterContext context) {
        final long now = context.nowEpochSeconds();
        final LocalDate today = Instant.ofEpochSecond(now).atZone(context.zone()).toLocalDate();
        return switch (form) {
            case MINUTES_AGO -> LongRange.exactly(now - amount * 60L);
            case HOURS_AGO -> LongRange.exactly(now - amount * 3600L);
            case DAYS_AGO -> LongRange.exactly(now - amount * 86400L);
            case WEEK -> LongRange.exactly(now - 7L * 86400L);
            case MONTH -> LongRange.exactly(now - 30L * 86400L);
            case YEAR -> LongRange.exactly(startOfDay(today.withDayOfYear(1), context));
            case TODAY -> day(today, context);
            case YESTERDAY -> day(today.minusDays(1), context);
            case DATE -> day(date, context);
        };
    }

    private static LongRange day(final LocalDate day, final FilterContext context) {
        return new LongRange(startOfDay(day, context), startOfDay(day.plusDays(1), context) - 1);
    }

    private static long startOfDay(final LocalDate day, final FilterContext context) {
        final ZonedDateTime start = day.atStartOfDay(context.zone());
        return start.toEpochSecond();
    }
}
