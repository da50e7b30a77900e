package dev.evalrag.judge;

import dev.evalrag.error.ConfigurationException;
import dev.evalrag.generation.RateLimitProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Judge settings bound from {@code evalrag.judge.*}.
 *
 * <p>The judge shares the generation retry and timeout policy but has its own {@code rate-limit},
 * since an evaluation run calls the judge once per item on top of live traffic.
 */
@Configuration
@ConfigurationProperties(prefix = "evalrag.judge")
public class JudgeProperties {

  private String model = "gpt-4o";
  private final RateLimitProperties rateLimit = new RateLimitProperties();

  @PostConstruct
  void validate() {
    if (model == null || model.isBlank()) {
      throw new ConfigurationException("evalrag.judge.model must not be blank");
    }
    rateLimit.validate("evalrag.judge.rate-limit");
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public RateLimitProperties getRateLimit() {
    return rateLimit;
  }
}
