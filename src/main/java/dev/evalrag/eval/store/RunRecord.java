package dev.evalrag.eval.store;

import dev.evalrag.eval.RunStatus;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Stored state of a run, without its items.
 *
 * @param runId the run
 * @param datasetId the evaluated dataset
 * @param status latest status
 * @param error the systemic error of a failed run
 * @param startedAt when the run was accepted
 * @param completedAt when the run finished, absent while running
 */
public record RunRecord(
    String runId,
    String datasetId,
    RunStatus status,
    @Nullable String error,
    Instant startedAt,
    @Nullable Instant completedAt) {}
