package dev.evalrag.eval.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.evalrag.eval.EvalItemResult;
import dev.evalrag.eval.EvalRunSummary;
import dev.evalrag.eval.RunStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link ResultStore} on PostgreSQL through Spring Data JPA.
 *
 * <p>Item results and summaries are serialized to JSONB with the application {@link ObjectMapper}.
 */
@Component
public class JpaResultStore implements ResultStore {

  private final EvalRunRepository runRepository;
  private final EvalItemRepository itemRepository;
  private final ObjectMapper objectMapper;

  public JpaResultStore(
      EvalRunRepository runRepository,
      EvalItemRepository itemRepository,
      ObjectMapper objectMapper) {
    this.runRepository = runRepository;
    this.itemRepository = itemRepository;
    this.objectMapper = objectMapper;
  }

  @Override
  @Transactional
  public void createRun(String runId, String datasetId, Instant startedAt) {
    runRepository.save(new EvalRun(runId, datasetId, startedAt));
  }

  @Override
  @Transactional
  public void saveItem(String runId, int position, EvalItemResult result) {
    itemRepository.save(
        new EvalItem(runId, result.itemId(), position, result.status(), toJson(result)));
  }

  @Override
  @Transactional
  public void completeRun(
      String runId,
      RunStatus status,
      @Nullable EvalRunSummary summary,
      @Nullable String error,
      Instant completedAt) {
    EvalRun run =
        runRepository
            .findById(runId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
    run.complete(status, summary != null ? toJson(summary) : null, error, completedAt);
    runRepository.save(run);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<RunRecord> findRun(String runId) {
    return runRepository.findById(runId).map(EvalRun::toRecord);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<EvalRunSummary> findSummary(String runId) {
    return runRepository
        .findById(runId)
        .map(EvalRun::getSummary)
        .map(json -> fromJson(json, EvalRunSummary.class));
  }

  @Override
  @Transactional(readOnly = true)
  public List<EvalItemResult> findItems(String runId) {
    return itemRepository.findByRunIdOrderByPositionAsc(runId).stream()
        .map(item -> fromJson(item.getResult(), EvalItemResult.class))
        .toList();
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
    }
  }

  private <T> T fromJson(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
    }
  }
}
