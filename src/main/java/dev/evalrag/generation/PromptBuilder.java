package dev.evalrag.generation;

import dev.evalrag.error.TemplateException;
import dev.evalrag.retrieval.RetrievedContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Renders the generation prompt from a question, ranked contexts and a {@link PromptTemplate}.
 *
 * <p>Contexts are joined in the given order with {@value #CONTEXT_SEPARATOR}; blank ones are
 * skipped and the block stops before the first context that would push it past {@code
 * max-context-chars}. Slots are substituted in a single pass, so braces inside the question or the
 * contexts are copied verbatim.
 */
@Component
public class PromptBuilder {

  static final String CONTEXT_SEPARATOR = "\n\n---\n\n";

  private static final Pattern SLOT = Pattern.compile("\\{(question|context|instructions)}");

  private final int maxContextChars;

  public PromptBuilder(PromptProperties properties) {
    this.maxContextChars = properties.getMaxContextChars();
  }

  /**
   * Renders the prompt.
   *
   * @param question the user question
   * @param contexts retrieved contexts, best first
   * @param template the template to fill
   * @return the rendered prompt
   * @throws TemplateException if the template lacks {@code {question}} or {@code {context}}
   */
  public String build(String question, List<RetrievedContext> contexts, PromptTemplate template) {
    validate(template);
    Map<String, String> values =
        Map.of(
            "question", question,
            "context", contextBlock(contexts),
            "instructions", template.instructions());

    Matcher matcher = SLOT.matcher(template.text());
    StringBuilder prompt = new StringBuilder();
    while (matcher.find()) {
      matcher.appendReplacement(prompt, Matcher.quoteReplacement(values.get(matcher.group(1))));
    }
    matcher.appendTail(prompt);
    return prompt.toString();
  }

  /** Joins context texts under the character cap. The cap counts text only, not separators. */
  String contextBlock(List<RetrievedContext> contexts) {
    List<String> parts = new ArrayList<>();
    int total = 0;
    for (RetrievedContext context : contexts) {
      String text = context.text().strip();
      if (text.isEmpty()) {
        continue;
      }
      if (total + text.length() > maxContextChars) {
        break;
      }
      parts.add(text);
      total += text.length();
    }
    return String.join(CONTEXT_SEPARATOR, parts);
  }

  /**
   * Checks that a template carries every required slot.
   *
   * @throws TemplateException naming the first missing slot
   */
  public static void validate(PromptTemplate template) {
    for (String slot : List.of(PromptTemplate.QUESTION_SLOT, PromptTemplate.CONTEXT_SLOT)) {
      if (!template.text().contains(slot)) {
        throw new TemplateException("Prompt template is missing required slot " + slot);
      }
    }
  }
}
