package villagecompute.curator.jobs;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

import org.jboss.logging.Logger;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import villagecompute.curator.exceptions.ValidationException;

/**
 * Parsed form of a {@code scheduled_jobs.schedule} value.
 *
 * <p>
 * A schedule is either a standard five-field UNIX cron expression ({@code minute hour day-of-month month day-of-week},
 * evaluated in UTC) or a single ISO-8601 timestamp marking a one-time run. Timestamps without an offset are read as
 * UTC.
 *
 * <pre>
 * JobSchedule.parse("0 0 * * 0").nextRunAfter(now); // next Sunday 00:00 UTC
 * JobSchedule.parse("2026-01-01T09:00:00Z").isOneTime(); // true
 * </pre>
 */
public final class JobSchedule {

    private static final Logger LOG = Logger.getLogger(JobSchedule.class);

    private static final Pattern ISO_TIMESTAMP = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}.*");

    private static final CronParser CRON_PARSER = new CronParser(
            CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final String expression;
    private final ExecutionTime executionTime;
    private final Instant runAt;

    private JobSchedule(String expression, ExecutionTime executionTime, Instant runAt) {
        this.expression = expression;
        this.executionTime = executionTime;
        this.runAt = runAt;
    }

    /**
     * Parses a schedule string.
     *
     * @param expression
     *            cron expression or ISO-8601 timestamp
     * @return parsed schedule
     * @throws ValidationException
     *             if the value is blank or neither a valid cron expression nor a valid timestamp
     */
    public static JobSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("Schedule is required");
        }
        String trimmed = expression.trim();
        if (isIsoTimestamp(trimmed)) {
            return new JobSchedule(trimmed, null, parseTimestamp(trimmed));
        }
        try {
            return new JobSchedule(trimmed, ExecutionTime.forCron(CRON_PARSER.parse(trimmed).validate()), null);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron expression '" + trimmed + "': " + e.getMessage(), e);
        }
    }

    /**
     * Returns true when the value looks like an ISO-8601 timestamp rather than a cron expression.
     */
    public static boolean isIsoTimestamp(String expression) {
        return expression != null && ISO_TIMESTAMP.matcher(expression.trim()).matches();
    }

    /**
     * Computes the next run time, logging instead of throwing when the schedule cannot be parsed.
     *
     * @return next run instant, or null if the schedule is invalid or has no future occurrence
     */
    public static Instant nextRunAtOrNull(String expression, Instant now) {
        try {
            return parse(expression).nextRunAfter(now).orElse(null);
        } catch (ValidationException e) {
            LOG.errorf("Cannot compute next run for schedule '%s': %s", expression, e.getMessage());
            return null;
        }
    }

    public boolean isOneTime() {
        return runAt != null;
    }

    public String getExpression() {
        return expression;
    }

    /**
     * Next occurrence strictly after {@code now}. A one-time schedule always yields its timestamp, even when it is in
     * the past, so an overdue one-shot job still runs once.
     */
    public Optional<Instant> nextRunAfter(Instant now) {
        if (runAt != null) {
            return Optional.of(runAt);
        }
        return executionTime.nextExecution(ZonedDateTime.ofInstant(now, ZoneOffset.UTC)).map(ZonedDateTime::toInstant);
    }

    private static Instant parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException inner) {
                throw new ValidationException("Invalid ISO-8601 timestamp '" + value + "'", inner);
            }
        }
    }

    @Override
    public String toString() {
        return expression;
    }
}
