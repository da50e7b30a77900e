package dev.evalrag.eval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.evalrag.error.DatasetException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads evaluation datasets stored as JSON Lines under {@code evalrag.eval.dataset-dir}.
 *
 * <p>Dataset {@code foo} lives in {@code foo.jsonl}. Each non-blank line is one object with {@code
 * id}, {@code question}, {@code expected_answer} and an optional {@code expected_contexts} array of
 * strings. Loading is all-or-nothing: the first bad line rejects the whole file.
 */
@Component
public class DatasetLoader {

  private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

  static final String ID = "id";
  static final String QUESTION = "question";
  static final String EXPECTED_ANSWER = "expected_answer";
  static final String EXPECTED_CONTEXTS = "expected_contexts";

  private static final Pattern DATASET_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

  private final ObjectMapper objectMapper;
  private final Path datasetDir;

  public DatasetLoader(ObjectMapper objectMapper, EvalProperties properties) {
    this.objectMapper = objectMapper;
    this.datasetDir = Path.of(properties.getDatasetDir());
  }

  /** Path of the file backing a dataset id. */
  public Path pathOf(String datasetId) {
    if (datasetId == null || !DATASET_ID.matcher(datasetId).matches()) {
      throw new DatasetException("Invalid dataset id: " + datasetId);
    }
    return datasetDir.resolve(datasetId + ".jsonl");
  }

  /**
   * Loads a dataset by id.
   *
   * @param datasetId file name without the {@code .jsonl} extension
   * @return items in file order
   * @throws DatasetException if the file is missing, unreadable or has an invalid line
   */
  public List<EvalDatasetItem> load(String datasetId) {
    Path path = pathOf(datasetId);
    if (!Files.isRegularFile(path)) {
      throw new DatasetException("Dataset not found: " + path);
    }
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      List<EvalDatasetItem> items = read(reader);
      log.debug("Loaded {} items from {}", items.size(), path);
      return items;
    } catch (IOException e) {
      throw new DatasetException("Failed to read dataset " + path + ": " + e.getMessage(), e);
    }
  }

  /**
   * Parses JSON Lines content.
   *
   * @param reader the dataset content
   * @return items in input order
   * @throws IOException if reading fails
   * @throws DatasetException naming the 1-based line of the first invalid record
   */
  public List<EvalDatasetItem> read(Reader reader) throws IOException {
    BufferedReader lines =
        reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
    List<EvalDatasetItem> items = new ArrayList<>();
    Map<String, Integer> seenIds = new HashMap<>();
    int lineNumber = 0;
    String line;
    while ((line = lines.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      EvalDatasetItem item = parseLine(line, lineNumber);
      Integer firstSeen = seenIds.putIfAbsent(item.id(), lineNumber);
      if (firstSeen != null) {
        throw new DatasetException(
            lineNumber, "Duplicate id '%s' (first seen on line %d)".formatted(item.id(), firstSeen));
      }
      items.add(item);
    }
    return items;
  }

  private EvalDatasetItem parseLine(String line, int lineNumber) {
    JsonNode node;
    try {
      node = objectMapper.readTree(line);
    } catch (JsonProcessingException e) {
      throw new DatasetException(lineNumber, "Malformed JSON: " + e.getOriginalMessage(), e);
    }
    if (!(node instanceof ObjectNode object)) {
      throw new DatasetException(lineNumber, "Expected a JSON object");
    }
    return new EvalDatasetItem(
        requiredText(object, ID, lineNumber),
        requiredText(object, QUESTION, lineNumber),
        requiredText(object, EXPECTED_ANSWER, lineNumber),
        contexts(object, lineNumber));
  }

  private static String requiredText(ObjectNode object, String field, int lineNumber) {
    JsonNode value = object.get(field);
    if (value == null || value.isNull()) {
      throw new DatasetException(lineNumber, "Missing required field '" + field + "'");
    }
    if (!value.isTextual()) {
      throw new DatasetException(lineNumber, "Field '" + field + "' must be a string");
    }
    if (value.asText().isBlank()) {
      throw new DatasetException(lineNumber, "Field '" + field + "' must not be blank");
    }
    return value.asText();
  }

  private static List<String> contexts(ObjectNode object, int lineNumber) {
    JsonNode value = object.get(EXPECTED_CONTEXTS);
    if (value == null || value.isNull()) {
      return List.of();
    }
    if (!value.isArray()) {
      throw new DatasetException(lineNumber, "Field '" + EXPECTED_CONTEXTS + "' must be an array");
    }
    List<String> contexts = new ArrayList<>(value.size());
    for (JsonNode element : value) {
      if (!element.isTextual()) {
        throw new DatasetException(
            lineNumber, "Field '" + EXPECTED_CONTEXTS + "' must contain only strings");
      }
      contexts.add(element.asText());
    }
    return contexts;
  }

  /**
   * Writes items as JSON Lines in the format {@link #read} accepts.
   *
   * @param datasetId target dataset id
   * @param items items to write
   * @return the written file
   * @throws DatasetException if the file cannot be written
   */
  public Path write(String datasetId, List<EvalDatasetItem> items) {
    Path path = pathOf(datasetId);
    try {
      Files.createDirectories(datasetDir);
      List<String> lines = new ArrayList<>(items.size());
      for (EvalDatasetItem item : items) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(ID, item.id());
        node.put(QUESTION, item.question());
        node.put(EXPECTED_ANSWER, item.expectedAnswer());
        item.expectedContexts().forEach(node.putArray(EXPECTED_CONTEXTS)::add);
        lines.add(objectMapper.writeValueAsString(node));
      }
      Files.write(path, lines, StandardCharsets.UTF_8);
      return path;
    } catch (IOException e) {
      throw new DatasetException("Failed to write dataset " + path + ": " + e.getMessage(), e);
    }
  }
}
