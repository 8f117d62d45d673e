package com.platform.drengine.core;

import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ValidationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Spring cron expressions evaluated in UTC.
 */
public final class CronSchedules {
    
    private CronSchedules() {
    }
    
    public static void validate(String field, String schedule) {
        if (schedule == null || !CronExpression.isValidExpression(schedule)) {
            throw new ValidationException(ErrorCode.INVALID_SCHEDULE, "Invalid " + field + ": " + schedule);
        }
    }
    
    /**
     * First instant of the schedule strictly after {@code after}.
     */
    public static Instant nextAfter(String schedule, Instant after) {
        validate("schedule", schedule);
        ZonedDateTime next = CronExpression.parse(schedule).next(after.atZone(ZoneOffset.UTC));
        if (next == null) {
            throw new ValidationException(ErrorCode.INVALID_SCHEDULE, "Schedule never fires: " + schedule);
        }
        return next.toInstant();
    }
}
