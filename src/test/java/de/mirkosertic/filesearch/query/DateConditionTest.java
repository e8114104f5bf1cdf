package de.mirkosertic.filesearch.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Date expression resolution Tests")
class DateConditionTest {

    // 2024-12-15T10:00:00Z
    private static final FilterContext CONTEXT = new FilterContext(
            ZonedDateTime.of(2024, 12, 15, 10, 0, 0, 0, ZoneOffset.UTC).toEpochSecond(), ZoneOffset.UTC);

    private static long startOf(final String isoDate) {
        return LocalDate.parse(isoDate).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }

    @Test
    @DisplayName("Should parse all supported forms and reject others")
    void shouldParseForms() {
        assertThat(DateExpression.parse("today").form()).isEqualTo(DateExpression.Form.TODAY);
        assertThat(DateExpression.parse("Yesterday").form()).isEqualTo(DateExpression.Form.YESTERDAY);
        assertThat(DateExpression.parse("7d").amount()).isEqualTo(7);
        assertThat(DateExpression.parse("12h").form()).isEqualTo(DateExpression.Form.HOURS_AGO);
        assertThat(DateExpression.parse("30m").form()).isEqualTo(DateExpression.Form.MINUTES_AGO);
        assertThat(DateExpression.parse("2024-01-31").date()).isEqualTo(LocalDate.of(2024, 1, 31));
        assertThat(DateExpression.parse("notadate")).isNull();
        assertThat(DateExpression.parse("2024-13-01")).isNull();
        assertThat(DateExpression.parse("7w")).isNull();
    }

    @Test
    @DisplayName("A calendar day should resolve to the whole day")
    void dayResolvesToWholeDay() {
        final LongRange range = DateCondition.of(Comparison.EQ, DateExpression.parse("2024-12-10")).resolve(CONTEXT);

        assertThat(range.min()).isEqualTo(startOf("2024-12-10"));
        assertThat(range.max()).isEqualTo(startOf("2024-12-11") - 1);
    }

    @Test
    @DisplayName("A range should run from the start of the first to the end of the last day")
    void rangeCoversBothDays() {
        final LongRange range = DateCondition.between(DateExpression.parse("2024-12-22"),
                DateExpression.parse("2024-12-01")).resolve(CONTEXT);

        assertThat(range.min()).isEqualTo(startOf("2024-12-01"));
        assertThat(range.max()).isEqualTo(startOf("2024-12-23") - 1);
    }

    @Test
    @DisplayName("A relative form should mean within the last period")
    void relativeMeansWithin() {
        final LongRange range = DateCondition.of(Comparison.EQ, DateExpression.parse("7d")).resolve(CONTEXT);

        assertThat(range.min()).isEqualTo(CONTEXT.nowEpochSeconds() - 7 * 86400L);
        assertThat(range.max()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    @DisplayName("Comparisons against a day should use its boundaries")
    void comparisonsUseDayBoundaries() {
        final DateExpression day = DateExpression.parse("2024-01-01");

        assertThat(DateCondition.of(Comparison.GT, day).resolve(CONTEXT).min()).isEqualTo(startOf("2024-01-02"));
        assertThat(DateCondition.of(Comparison.GE, day).resolve(CONTEXT).min()).isEqualTo(startOf("2024-01-01"));
        assertThat(DateCondition.of(Comparison.LT, day).resolve(CONTEXT).max()).isEqualTo(startOf("2024-01-01") - 1);
        assertThat(DateCondition.of(Comparison.LE, day).resolve(CONTEXT).max()).isEqualTo(startOf("2024-01-02") - 1);
    }

    @Test
    @DisplayName("Today, yesterday and year should follow the configured zone")
    void calendarFormsFollowZone() {
        final FilterContext tokyo = new FilterContext(CONTEXT.nowEpochSeconds(), ZoneId.of("Asia/Tokyo"));

        final LongRange today = DateExpression.parse("today").resolve(tokyo);
        final LongRange yesterday = DateExpression.parse("yesterday").resolve(tokyo);
        final LongRange year = DateExpression.parse("year").resolve(CONTEXT);

        // 10:00 UTC is 19:00 in Tokyo, still 2024-12-15 there
        assertThat(today.min()).isEqualTo(LocalDate.of(2024, 12, 15).atStartOfDay(ZoneId.of("Asia/Tokyo")).toEpochSecond());
        assertThat(yesterday.max()).isEqualTo(today.min() - 1);
        assertThat(year.min()).isEqualTo(startOf("2024-01-01"));
    }
}
