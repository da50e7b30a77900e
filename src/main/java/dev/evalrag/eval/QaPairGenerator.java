package dev.evalrag.eval;

import dev.evalrag.document.DocumentChunkRepository;
import dev.evalrag.error.ConfigurationException;
import dev.evalrag.error.GenerationException;
import dev.evalrag.generation.Generator;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds a synthetic evaluation dataset from the indexed chunks.
 *
 * <p>A random sample of chunks is drawn, and for each the generation model writes one factoid
 * question with its answer. The sampled chunk becomes the item's expected context. Pairs that cannot
 * be parsed, or whose answer is 300 characters or longer, are dropped.
 */
@Service
public class QaPairGenerator {

  private static final Logger log = LoggerFactory.getLogger(QaPairGenerator.class);

  static final int MAX_ANSWER_LENGTH = 300;

  private static final int MAX_SAMPLED_CHUNKS = 10_000;
  private static final String QUESTION_MARKER = "Factoid question:";
  private static final String ANSWER_MARKER = "Answer:";

  static final String QA_PROMPT =
      """
      Your task is to write a factoid question and an answer given a context.
      Your factoid question should be answerable with a specific, concise piece of factual \
      information from the context.
      Your factoid question should be formulated in the same style as questions users could ask \
      in a search engine.
      This means that your factoid question MUST NOT mention something like "according to the \
      passage" or "context".

      Provide your answer as follows:

      Output:::
      Factoid question: (your factoid question)
      Answer: (your answer to the factoid question)

      Now here is the context.

      Context: %s

      Output:::""";

  private final DocumentChunkRepository chunkRepository;
  private final Generator generator;
  private final DatasetLoader datasetLoader;

  public QaPairGenerator(
      DocumentChunkRepository chunkRepository, Generator generator, DatasetLoader datasetLoader) {
    this.chunkRepository = chunkRepository;
    this.generator = generator;
    this.datasetLoader = datasetLoader;
  }

  /**
   * Generates a dataset and writes it to {@code <dataset-dir>/<datasetId>.jsonl}.
   *
   * @param datasetId the dataset to create, overwritten if it exists
   * @param count number of chunks to sample
   * @param seed sampling seed, so the same index and seed pick the same chunks
   * @return the written file and how many pairs were kept
   * @throws ConfigurationException if {@code count < 1} or the index is empty
   */
  public GeneratedDataset generate(String datasetId, int count, long seed) {
    if (count < 1) {
      throw new ConfigurationException("count must be at least 1, got: " + count);
    }
    Path path = datasetLoader.pathOf(datasetId);
    List<String> chunks = new ArrayList<>(chunkRepository.findChunkTexts(MAX_SAMPLED_CHUNKS));
    if (chunks.isEmpty()) {
      throw new ConfigurationException("No chunks indexed; ingest documents first");
    }
    Collections.shuffle(chunks, new Random(seed));
    List<String> sample = chunks.subList(0, Math.min(count, chunks.size()));

    List<EvalDatasetItem> items = new ArrayList<>();
    for (String chunk : sample) {
      String output;
      try {
        output = generator.generate(QA_PROMPT.formatted(chunk), generator.defaultSettings()).text();
      } catch (GenerationException e) {
        log.warn("Skipping chunk: {}", e.getMessage());
        continue;
      }
      Optional<QaPair> pair = parse(output);
      if (pair.isEmpty()) {
        log.debug("Dropping unusable QA output: {}", output);
        continue;
      }
      items.add(
          new EvalDatasetItem(
              "%s-%03d".formatted(datasetId, items.size() + 1),
              pair.get().question(),
              pair.get().answer(),
              List.of(chunk)));
    }

    datasetLoader.write(datasetId, items);
    log.info("Generated dataset {}: {} of {} sampled chunks kept", datasetId, items.size(),
        sample.size());
    return new GeneratedDataset(datasetId, path, sample.size(), items.size());
  }

  /**
   * Extracts the question and answer from the model output.
   *
   * @param output raw generation output
   * @return the pair, or empty if a marker is missing, a part is blank or the answer is too long
   */
  static Optional<QaPair> parse(String output) {
    int questionAt = output.lastIndexOf(QUESTION_MARKER);
    if (questionAt < 0) {
      return Optional.empty();
    }
    int answerAt = output.indexOf(ANSWER_MARKER, questionAt);
    if (answerAt < 0) {
      return Optional.empty();
    }
    String question = output.substring(questionAt + QUESTION_MARKER.length(), answerAt).strip();
    String answer = output.substring(answerAt + ANSWER_MARKER.length()).strip();
    if (question.isEmpty() || answer.isEmpty() || answer.length() >= MAX_ANSWER_LENGTH) {
      return Optional.empty();
    }
    return Optional.of(new QaPair(question, answer));
  }

  record QaPair(String question, String answer) {}

  /**
   * Result of a generation request.
   *
   * @param datasetId the written dataset
   * @param path the written file
   * @param chunksSampled chunks sent to the model
   * @param itemsWritten pairs kept
   */
  public record GeneratedDataset(String datasetId, Path path, int chunksSampled, int itemsWritten) {}
}
