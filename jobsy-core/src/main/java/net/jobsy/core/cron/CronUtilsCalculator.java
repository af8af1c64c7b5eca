package net.jobsy.core.cron;

import net.jobsy.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;

public final class CronUtilsCalculator implements CronCalculator {
    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.compute(cronExpr, zone, from).next();
    }

    @Override
    public Instant previous(Instant at, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.compute(cronExpr, zone, at).previous();
    }

    @Override
    public void validate(String cronExpr) {
        CronSlotPlanner.validate(cronExpr);
    }

    @Override
    public String describe(String cronExpr) {
        return CronSlotPlanner.describe(cronExpr);
    }
}
