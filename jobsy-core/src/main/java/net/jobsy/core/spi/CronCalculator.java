package net.jobsy.core.spi;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Cron arithmetic in a given local zone. Every method throws
 * {@link net.jobsy.core.exception.InvalidScheduleException} for an unparsable expression.
 */
public interface CronCalculator {
    /** Earliest scheduled instant strictly after {@code from}. */
    Instant next(Instant from, String cronExpr, ZoneId zone);

    /** Latest scheduled instant at or before {@code at}. */
    Instant previous(Instant at, String cronExpr, ZoneId zone);

    void validate(String cronExpr);

    /** Human-readable form, e.g. "every hour". */
    String describe(String cronExpr);
}
