package net.jobsy.core.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Per-job summary of one {@code runCheckCycle} call. */
public record CheckCycleReport(
        Instant startedAt,
        Instant finishedAt,
        List<JobCheck> checks
) {
    public CheckCycleReport {
        checks = List.copyOf(checks);
    }

    public long count(CheckState state) {
        return checks.stream().filter(c -> c.state() == state).count();
    }

    public Map<CheckState, Long> countsByState() {
        Map<CheckState, Long> out = new EnumMap<>(CheckState.class);
        for (JobCheck c : checks) out.merge(c.state(), 1L, Long::sum);
        return out;
    }

    @Override public String toString() {
        return "CheckCycleReport{" +
                "startedAt=" + startedAt +
                ", finishedAt=" + finishedAt +
                ", jobs=" + checks.size() +
                ", states=" + countsByState() +
                '}';
    }
}
