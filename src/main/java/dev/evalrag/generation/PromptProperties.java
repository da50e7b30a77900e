package dev.evalrag.generation;

import dev.evalrag.error.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Prompt settings bound from {@code evalrag.prompt.*}.
 *
 * <ul>
 *   <li>{@code template} - generation template, see {@link PromptTemplate}
 *   <li>{@code instructions} - text for the {@code {instructions}} slot
 *   <li>{@code max-context-chars} - cap on the joined context block (default 4000)
 * </ul>
 *
 * <p>A template missing a required slot fails startup with a {@link
 * dev.evalrag.error.TemplateException}.
 */
@Configuration
@ConfigurationProperties(prefix = "evalrag.prompt")
public class PromptProperties {

  private String template = PromptTemplate.DEFAULT_TEXT;
  private String instructions = PromptTemplate.DEFAULT_INSTRUCTIONS;
  private int maxContextChars = 4000;

  @PostConstruct
  void validate() {
    if (maxContextChars < 1) {
      throw new ConfigurationException(
          "evalrag.prompt.max-context-chars must be positive, got: " + maxContextChars);
    }
    PromptBuilder.validate(toTemplate());
  }

  public PromptTemplate toTemplate() {
    return new PromptTemplate(template, instructions);
  }

  public String getTemplate() {
    return template;
  }

  public void setTemplate(String template) {
    this.template = template;
  }

  public String getInstructions() {
    return instructions;
  }

  public void setInstructions(String instructions) {
    this.instructions = instructions;
  }

  public int getMaxContextChars() {
    return maxContextChars;
  }

  public void setMaxContextChars(int maxContextChars) {
    this.maxContextChars = maxContextChars;
  }
}
