package os.siafu.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import os.siafu.SchedulerException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed cron pattern evaluated in a fixed time zone.
 *
 * <p>Patterns have six or seven fields: {@code sec min hour day-of-month month day-of-week [year]}.
 * Day-of-week runs from 1 (Sunday) to 7 (Saturday), names like {@code MON} are accepted. Unlike Quartz a
 * {@code ?} in one of the day fields is allowed but not required.</p>
 */
public final class CronExpression {

    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    private static final CronDefinition DEFINITION = CronDefinitionBuilder.defineCron()
            .withSeconds().withValidRange(0, 59).and()
            .withMinutes().withValidRange(0, 59).and()
            .withHours().withValidRange(0, 23).and()
            .withDayOfMonth().supportsL().supportsW().supportsLW().supportsQuestionMark().withValidRange(1, 31).and()
            .withMonth().withValidRange(1, 12).and()
            .withDayOfWeek().withMondayDoWValue(2).supportsHash().supportsL().supportsQuestionMark().withValidRange(1, 7).and()
            .withYear().withValidRange(1970, 2099).withStrictRange().optional().and()
            .instance();

    private static final CronParser PARSER = new CronParser(DEFINITION);

    private final String pattern;
    private final ZoneId zone;
    private final ExecutionTime executionTime;

    private CronExpression(String pattern, ZoneId zone, ExecutionTime executionTime) {
        this.pattern = pattern;
        this.zone = zone;
        this.executionTime = executionTime;
    }

    public static CronExpression parse(String pattern) {
        return parse(pattern, DEFAULT_ZONE);
    }

    /**
     * @throws SchedulerException of kind {@code INVALID_SCHEDULE} if the pattern is malformed
     */
    public static CronExpression parse(String pattern, ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        if (pattern == null || pattern.trim().isEmpty()) {
            throw SchedulerException.invalidSchedule("Cron pattern must not be empty");
        }

        String normalized = pattern.trim();
        try {
            Cron cron = PARSER.parse(normalized).validate();
            return new CronExpression(normalized, zone, ExecutionTime.forCron(cron));
        } catch (IllegalArgumentException e) {
            throw SchedulerException.invalidSchedule("Invalid cron pattern '" + normalized + "': " + e.getMessage(), e);
        }
    }

    /**
     * @return the first instant matched by this pattern strictly after {@code instant},
     * or {@link Optional#empty()} if the pattern matches no later instant
     */
    public Optional<Instant> nextAfter(Instant instant) {
        try {
            // matches are whole seconds, so the next match after the truncated instant is also after the instant
            ZonedDateTime base = instant.truncatedTo(ChronoUnit.SECONDS).atZone(zone);
            return executionTime.nextExecution(base).map(ZonedDateTime::toInstant);
        } catch (DateTimeException | ArithmeticException e) {
            throw SchedulerException.timeCalculation("Next run of cron pattern '" + pattern + "' after " + instant, e);
        }
    }

    public String getPattern() {
        return pattern;
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CronExpression that = (CronExpression) o;
        return pattern.equals(that.pattern) && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, zone);
    }

    @Override
    public String toString() {
        return pattern + " (" + zone + ")";
    }
}
