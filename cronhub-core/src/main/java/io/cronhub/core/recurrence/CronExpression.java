package io.cronhub.core.recurrence;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Locale;
import java.util.Optional;

/**
 * Parsed five-field cron rule: minute, hour, day-of-month, month, day-of-week.
 *
 * <p>Evaluation is per wall-clock minute. Day-of-month and day-of-week follow the Vixie cron rule:
 * when both fields are restricted (neither starts with {@code *}) a day matches if <em>either</em>
 * field matches, otherwise both must match. So {@code 0 0 1 * mon} fires on the first of each month
 * and on every Monday, while <code>0 0 *&#47;2 * mon</code> fires only on odd-numbered Mondays.
 *
 * <p>Across daylight-saving transitions a rule with a fixed minute and hour (neither starts with
 * {@code *}) fires at most once per wall-clock time: a time skipped by spring-forward is not run that
 * day, and a time repeated by fall-back runs only in its first occurrence. Rules with a wildcard minute
 * or hour follow elapsed time and match in both occurrences of a repeated hour.
 *
 * <p>Instances are immutable; equality is by normalized expression text.
 */
public final class CronExpression {
    private static final int SEARCH_YEARS = 8;

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthStar;
    private final boolean dayOfWeekStar;
    private final boolean fixedTime;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.minutes = CronField.MINUTE.parse(expression, fields[0]);
        this.hours = CronField.HOUR.parse(expression, fields[1]);
        this.daysOfMonth = CronField.DAY_OF_MONTH.parse(expression, fields[2]);
        this.months = CronField.MONTH.parse(expression, fields[3]);
        this.daysOfWeek = CronField.DAY_OF_WEEK.parse(expression, fields[4]);
        this.dayOfMonthStar = fields[2].startsWith("*");
        this.dayOfWeekStar = fields[4].startsWith("*");
        this.fixedTime = !fields[0].startsWith("*") && !fields[1].startsWith("*");
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new CronParseException(String.valueOf(expression), "expression is empty");
        }
        String[] fields = expression.trim().toLowerCase(Locale.ROOT).split("\\s+");
        if (fields.length != 5) {
            throw new CronParseException(expression, "expected 5 fields but found " + fields.length);
        }
        return new CronExpression(String.join(" ", fields), fields);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (CronParseException e) {
            return false;
        }
    }

    public String expression() {
        return expression;
    }

    public boolean matches(ZonedDateTime time) {
        return minutes.get(time.getMinute())
            && hours.get(time.getHour())
            && months.get(time.getMonthValue())
            && dayMatches(time);
    }

    public boolean matches(Instant instant, ZoneId zone) {
        return matches(instant.atZone(zone));
    }

    /**
     * First matching minute strictly after {@code after}, or empty when the rule can never fire
     * (for example {@code 0 0 30 2 *}).
     */
    public Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after) {
        ZonedDateTime candidate = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        ZonedDateTime horizon = candidate.plusYears(SEARCH_YEARS);

        while (candidate.isBefore(horizon)) {
            if (!months.get(candidate.getMonthValue())) {
                candidate = candidate.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!dayMatches(candidate)) {
                candidate = candidate.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!hours.get(candidate.getHour())) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.get(candidate.getMinute())) {
                candidate = candidate.plusMinutes(1);
                continue;
            }
            if (fixedTime && !candidate.toLocalDateTime().isAfter(after.toLocalDateTime())) {
                // second pass through a fall-back hour
                candidate = candidate.plusMinutes(1);
                continue;
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    public Optional<Instant> nextFireAfter(Instant after, ZoneId zone) {
        return nextFireAfter(after.atZone(zone)).map(ZonedDateTime::toInstant);
    }

    private boolean dayMatches(ZonedDateTime time) {
        boolean dom = daysOfMonth.get(time.getDayOfMonth());
        boolean dow = daysOfWeek.get(time.getDayOfWeek().getValue() % 7);
        if (dayOfMonthStar || dayOfWeekStar) {
            return dom && dow;
        }
        return dom || dow;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof CronExpression that && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
