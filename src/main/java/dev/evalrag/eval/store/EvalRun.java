package dev.evalrag.eval.store;

import dev.evalrag.eval.RunStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/** Row of the {@code eval_runs} table. The summary is stored as JSONB. */
@Entity
@Table(name = "eval_runs")
public class EvalRun {

  @Id
  @Column(name = "run_id")
  private String runId;

  @Column(name = "dataset_id", nullable = false)
  private String datasetId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private RunStatus status;

  @Column(columnDefinition = "TEXT")
  private @Nullable String error;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private @Nullable String summary;

  @Column(name = "started_at", nullable = false)
  private Instant startedAt;

  @Column(name = "completed_at")
  private @Nullable Instant completedAt;

  protected EvalRun() {
    // JPA requires no-arg constructor
  }

  public EvalRun(String runId, String datasetId, Instant startedAt) {
    this.runId = runId;
    this.datasetId = datasetId;
    this.status = RunStatus.RUNNING;
    this.startedAt = startedAt;
  }

  public void complete(
      RunStatus status, @Nullable String summary, @Nullable String error, Instant completedAt) {
    this.status = status;
    this.summary = summary;
    this.error = error;
    this.completedAt = completedAt;
  }

  public RunRecord toRecord() {
    return new RunRecord(runId, datasetId, status, error, startedAt, completedAt);
  }

  public String getRunId() {
    return runId;
  }

  public String getDatasetId() {
    return datasetId;
  }

  public RunStatus getStatus() {
    return status;
  }

  public @Nullable String getError() {
    return error;
  }

  public @Nullable String getSummary() {
    return summary;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public @Nullable Instant getCompletedAt() {
    return completedAt;
  }
}
