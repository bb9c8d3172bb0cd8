package com.whereq.conductor.scheduler;

import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.model.ScheduleInterval;
import com.whereq.conductor.model.ScheduledRun;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.regex.Pattern;

/**
 * Crontab derivation and next-occurrence arithmetic for scheduled runs.
 * <p>
 * Crontabs are the classic five fields (minute hour day-of-month month day-of-week). They are
 * evaluated with Spring's {@link CronExpression}, which expects a leading seconds field.
 */
public final class ScheduleCalculator {

    public static final Duration MIN_FUTURE_LEAD = Duration.ofSeconds(15);

    private static final Pattern CRONTAB_FIELD = Pattern.compile("[0-9*,/-]+");

    private ScheduleCalculator() {
    }

    /**
     * Crontab of a recurring interval, anchored on the start time in the run's zone.
     *
     * @return the crontab, or null for one-off intervals
     */
    public static String crontabFor(ScheduleInterval interval, Instant startTime, ZoneId zone) {
        if (interval == ScheduleInterval.CUSTOM || interval.isOneOff()) {
            return null;
        }
        ZonedDateTime start = startTime.atZone(zone);
        return switch (interval) {
            case HOURLY -> start.getMinute() + " * * * *";
            case DAILY -> start.getMinute() + " " + start.getHour() + " * * *";
            case WEEKLY -> start.getMinute() + " " + start.getHour() + " * * " + (start.getDayOfWeek().getValue() % 7);
            default -> null;
        };
    }

    public static void validateCrontab(String crontab) {
        if (crontab == null || crontab.isBlank()) {
            throw new ValidationException("A crontab is required for CUSTOM schedules");
        }
        String[] fields = crontab.trim().split("\\s+");
        if (fields.length != 5) {
            throw new ValidationException("Crontab '" + crontab + "' must have 5 fields, found " + fields.length);
        }
        for (String field : fields) {
            if (!CRONTAB_FIELD.matcher(field).matches()) {
                throw new ValidationException("Crontab field '" + field + "' may only contain digits, '*', ',', '-' and '/'");
            }
        }
        try {
            CronExpression.parse("0 " + crontab.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid crontab '" + crontab + "': " + e.getMessage());
        }
    }

    public static ZoneId zone(String timeZone, String defaultZone) {
        String id = timeZone == null || timeZone.isBlank() ? defaultZone : timeZone;
        try {
            return ZoneId.of(id);
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid time zone '" + id + "'");
        }
    }

    /**
     * Next time the run should fire.
     * <p>
     * One-offs fire once at their start time. Recurring runs fire at the first crontab match after
     * the last firing, or at or after the start time when they never fired.
     *
     * @return the occurrence, or null when the run will not fire again
     */
    public static Instant nextOccurrence(ScheduledRun run, String defaultZone) {
        if (run.getInterval().isOneOff()) {
            return run.getLastRunAt() == null ? run.getStartTime() : null;
        }
        if (run.getCrontab() == null) {
            return null;
        }
        Instant base;
        if (run.getLastRunAt() != null) {
            base = run.getLastRunAt();
        } else if (run.getStartTime() != null) {
            base = run.getStartTime().minusSeconds(1);
        } else {
            base = run.getCreatedAt();
        }
        ZoneId zone = zone(run.getTimeZone(), defaultZone);
        ZonedDateTime next = CronExpression.parse("0 " + run.getCrontab().trim()).next(base.atZone(zone));
        return next == null ? null : next.toInstant();
    }

    /**
     * Start time rules: FUTURE must be far enough ahead, recurring runs other than CUSTOM need one
     */
    public static void validateStartTime(ScheduleInterval interval, Instant startTime, Instant now) {
        switch (interval) {
            case FUTURE -> {
                if (startTime == null) {
                    throw new ValidationException("A start time is required for FUTURE schedules");
                }
                if (startTime.isBefore(now.plus(MIN_FUTURE_LEAD))) {
                    throw new ValidationException("Start time of a FUTURE schedule must be at least "
                        + MIN_FUTURE_LEAD.toSeconds() + " seconds in the future");
                }
            }
            case HOURLY, DAILY, WEEKLY -> {
                if (startTime == null) {
                    throw new ValidationException("A start time is required for " + interval + " schedules");
                }
            }
            default -> {
            }
        }
    }
}
