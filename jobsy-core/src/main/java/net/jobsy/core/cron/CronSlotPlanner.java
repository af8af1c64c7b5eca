package net.jobsy.core.cron;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.jobsy.core.exception.InvalidScheduleException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * cron-utils based window calculator for standard 5-field (UNIX) expressions.
 * Parsed expressions are kept in a small LRU cache.
 */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private static final Map<String, Parsed> CACHE = new LruMap<>(256);

    private CronSlotPlanner() {}

    /**
     * Scheduled instants around {@code now}: the latest one at or before it and the earliest one after it.
     * UNIX cron has minute granularity, so both are computed from {@code now} truncated to the minute.
     */
    public static SlotInfo compute(String cronExpr, ZoneId zone, Instant now) {
        Objects.requireNonNull(zone); Objects.requireNonNull(now);
        ExecutionTime et = parse(cronExpr).executionTime();

        ZonedDateTime base = now.atZone(zone).truncatedTo(ChronoUnit.MINUTES);
        ZonedDateTime previous = et.isMatch(base)
                ? base
                : et.lastExecution(base).orElseThrow(
                        () -> new InvalidScheduleException(cronExpr, "no execution before " + base));
        ZonedDateTime next = et.nextExecution(base).orElseThrow(
                () -> new InvalidScheduleException(cronExpr, "no execution after " + base));

        return new SlotInfo(previous.toInstant(), next.toInstant());
    }

    public static void validate(String cronExpr) {
        parse(cronExpr);
    }

    public static String describe(String cronExpr) {
        return CronDescriptor.instance(Locale.UK).describe(parse(cronExpr).cron());
    }

    static Parsed parse(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) {
            throw new InvalidScheduleException(cronExpr, "empty expression");
        }
        String expr = cronExpr.trim();
        synchronized (CACHE) {
            Parsed cached = CACHE.get(expr);
            if (cached != null) return cached;
        }
        Parsed parsed;
        try {
            Cron cron = PARSER.parse(expr).validate();
            parsed = new Parsed(cron, ExecutionTime.forCron(cron));
        } catch (RuntimeException e) {
            throw new InvalidScheduleException(expr, e);
        }
        synchronized (CACHE) {
            CACHE.put(expr, parsed);
        }
        return parsed;
    }

    public record SlotInfo(Instant previous, Instant next) {}

    record Parsed(Cron cron, ExecutionTime executionTime) {}

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
