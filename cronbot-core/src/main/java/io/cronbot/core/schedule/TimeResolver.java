package io.cronbot.core.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.scheduling.support.CronExpression;

/**
 * Stateless next-trigger computation. Accepts classic five-field expressions
 * ({@code minute hour day-of-month month day-of-week}), six-field expressions with a leading
 * seconds field, and the {@code @hourly}/{@code @daily}/{@code @weekly}/{@code @monthly}/{@code @yearly}
 * macros.
 */
public final class TimeResolver {
    /** Last instant that survives the epoch-millisecond storage and timer delay arithmetic. */
    public static final Instant LATEST_SUPPORTED = Instant.parse("9999-12-31T23:59:59.999Z");

    private final ZoneId zone;
    private final Map<String, CronExpression> parsed = new ConcurrentHashMap<>();

    public TimeResolver(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ZoneId zone() {
        return zone;
    }

    public Instant computeNextRun(String expression, Instant from) {
        return computeNextRun(expression, from, zone);
    }

    /**
     * First instant strictly after {@code from} matching {@code expression}, with calendar fields
     * evaluated in {@code zone}.
     */
    public Instant computeNextRun(String expression, Instant from, ZoneId zone) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        CronExpression cron = parse(expression);
        ZonedDateTime next = cron.next(from.atZone(zone));
        if (next == null) {
            throw new InvalidScheduleExpressionException(expression, "expression never fires");
        }
        return next.toInstant();
    }

    public void validate(String expression) {
        parse(expression);
    }

    /**
     * One-time schedules resolve to themselves; they are only accepted while still ahead of {@code now}
     * and no later than {@link #LATEST_SUPPORTED}.
     */
    public Instant requireFuture(Instant scheduledAt, Instant now) {
        Objects.requireNonNull(scheduledAt, "scheduledAt must not be null");
        if (!scheduledAt.isAfter(now)) {
            throw new PastScheduleTimeException(scheduledAt, now);
        }
        if (scheduledAt.isAfter(LATEST_SUPPORTED)) {
            throw new ScheduleOutOfRangeException(scheduledAt, LATEST_SUPPORTED);
        }
        return scheduledAt;
    }

    private CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleExpressionException(String.valueOf(expression), "expression is blank");
        }
        String normalized = normalize(expression);
        CronExpression cached = parsed.get(normalized);
        if (cached != null) {
            return cached;
        }
        try {
            CronExpression cron = CronExpression.parse(normalized);
            parsed.put(normalized, cron);
            return cron;
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleExpressionException(expression, e.getMessage(), e);
        }
    }

    static String normalize(String expression) {
        String trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            return trimmed;
        }
        String[] fields = trimmed.split("\\s+");
        if (fields.length == 5) {
            return "0 " + String.join(" ", fields);
        }
        return String.join(" ", fields);
    }
}
