package com.qqsuccubus.core.model;

import com.qqsuccubus.core.error.ValidationException;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Absolute {@code [start, end)} interval a metric query covers.
 * <p>
 * A window resolved from an all-zero request is {@link #isEmpty() empty}: it is the
 * "no query" sentinel, and metric fetches short-circuit to an empty table without
 * calling the monitoring backend.
 * </p>
 */
@Value
public class TimeWindow {

    /**
     * Inclusive lower bound. Equal to {@link #end} for an empty window.
     */
    Instant start;

    /**
     * Exclusive upper bound: the moment the query was issued.
     */
    Instant end;

    boolean empty;

    /**
     * Resolves a relative look-back request into an absolute window ending at {@code now}.
     *
     * @param days    days to look back, non-negative
     * @param hours   hours to look back, non-negative
     * @param minutes minutes to look back, non-negative
     * @param now     query issue time
     * @return resolved window, empty iff all three spans are zero
     * @throws ValidationException if any span is negative
     */
    public static TimeWindow resolve(int days, int hours, int minutes, Instant now) {
        if (days < 0 || hours < 0 || minutes < 0) {
            throw new ValidationException(String.format(
                "Time window must not be negative (days=%d, hours=%d, minutes=%d)", days, hours, minutes));
        }
        if (days == 0 && hours == 0 && minutes == 0) {
            return new TimeWindow(now, now, true);
        }
        Duration span = Duration.ofDays(days).plusHours(hours).plusMinutes(minutes);
        return new TimeWindow(now.minus(span), now, false);
    }

    public Duration getDuration() {
        return Duration.between(start, end);
    }
}
