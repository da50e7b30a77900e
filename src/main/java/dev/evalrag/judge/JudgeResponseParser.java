package dev.evalrag.judge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Strict parser for judge output.
 *
 * <p>The response must be a single JSON object, optionally wrapped in a Markdown code fence, with
 * numeric {@code correctness}, {@code faithfulness} and {@code context_relevance} fields in {@code
 * [0, 1]} and a string {@code rationale}. Anything else, including a response with only some of the
 * scores, yields an invalid verdict. There is no partial credit.
 */
@Component
public class JudgeResponseParser {

  static final String CORRECTNESS = "correctness";
  static final String FAITHFULNESS = "faithfulness";
  static final String CONTEXT_RELEVANCE = "context_relevance";
  static final String RATIONALE = "rationale";

  private static final Pattern CODE_FENCE =
      Pattern.compile("^```(?:json)?\\s*\\n(.*?)\\n?```$", Pattern.DOTALL);

  private final ObjectMapper objectMapper;

  public JudgeResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses a judge response.
   *
   * @param response raw judge output
   * @return a valid verdict, or an invalid one whose rationale names the schema violation
   */
  public JudgeVerdict parse(@Nullable String response) {
    if (response == null || response.isBlank()) {
      return JudgeVerdict.unscored("Judge returned an empty response");
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(response.strip()));
    } catch (JsonProcessingException e) {
      return JudgeVerdict.unscored("Judge response is not valid JSON: " + e.getOriginalMessage());
    }
    if (root == null || !root.isObject()) {
      return JudgeVerdict.unscored("Judge response is not a JSON object");
    }

    for (String axis : List.of(CORRECTNESS, FAITHFULNESS, CONTEXT_RELEVANCE)) {
      String violation = scoreViolation(root, axis);
      if (violation != null) {
        return JudgeVerdict.unscored(violation);
      }
    }
    JsonNode rationale = root.get(RATIONALE);
    if (rationale == null || !rationale.isTextual()) {
      return JudgeVerdict.unscored("Judge response has no string field '" + RATIONALE + "'");
    }

    return JudgeVerdict.scored(
        root.get(CORRECTNESS).doubleValue(),
        root.get(FAITHFULNESS).doubleValue(),
        root.get(CONTEXT_RELEVANCE).doubleValue(),
        rationale.textValue());
  }

  private static @Nullable String scoreViolation(JsonNode root, String axis) {
    JsonNode node = root.get(axis);
    if (node == null || node.isNull()) {
      return "Judge response is missing score '" + axis + "'";
    }
    if (!node.isNumber()) {
      return "Judge score '" + axis + "' is not a number: " + node;
    }
    double value = node.doubleValue();
    if (!(value >= 0.0 && value <= 1.0)) {
      return "Judge score '" + axis + "' is outside [0, 1]: " + node;
    }
    return null;
  }

  private static String stripCodeFence(String response) {
    Matcher matcher = CODE_FENCE.matcher(response);
    return matcher.matches() ? matcher.group(1) : response;
  }
}
