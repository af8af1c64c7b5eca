package net.jobsy.core.model;

import java.time.Instant;

/**
 * Output of the workflow evaluator: the outcome plus the job as it must be written back.
 *
 * @param previous       latest scheduled instant at or before {@code checkedAt}
 * @param expectedFinish {@code previous + deadline}
 */
public record Evaluation(
        Outcome outcome,
        Job job,
        Instant previous,
        Instant expectedFinish,
        Instant checkedAt
) {}
