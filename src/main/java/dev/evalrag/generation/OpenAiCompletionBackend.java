package dev.evalrag.generation;

import dev.evalrag.error.ConfigurationException;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * {@link CompletionBackend} calling OpenAI (or an OpenAI-compatible endpoint) through LangChain4j.
 *
 * <p>One {@link ChatModel} is built per model identifier and response format, on first use. The
 * LangChain4j client's own retries are disabled and its timeout is only a safety net; the effective
 * policy is applied by {@link ResilientCaller}.
 */
@Component
public class OpenAiCompletionBackend implements CompletionBackend {

  private static final Duration CLIENT_TIMEOUT = Duration.ofMinutes(5);

  private final LlmProperties properties;
  private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

  public OpenAiCompletionBackend(LlmProperties properties) {
    this.properties = properties;
  }

  @Override
  public Completion complete(CompletionRequest request) {
    ChatModel model =
        models.computeIfAbsent(
            request.model() + (request.jsonResponse() ? "#json" : ""),
            key -> buildModel(request.model(), request.jsonResponse()));
    ChatResponse response =
        model.chat(ChatRequest.builder().messages(UserMessage.from(request.prompt())).build());
    String text = response.aiMessage().text();
    return new Completion(text != null ? text : "", toTokenUsage(response));
  }

  private ChatModel buildModel(String modelName, boolean jsonResponse) {
    validateApiKey();
    OpenAiChatModel.OpenAiChatModelBuilder builder =
        OpenAiChatModel.builder()
            .apiKey(properties.getApiKey())
            .modelName(modelName)
            .temperature(properties.getTemperature())
            .timeout(CLIENT_TIMEOUT)
            .maxRetries(0)
            .logRequests(false)
            .logResponses(false);
    if (properties.getBaseUrl() != null && !properties.getBaseUrl().isBlank()) {
      builder.baseUrl(properties.getBaseUrl());
    }
    if (jsonResponse) {
      builder.responseFormat("json_object");
    }
    return builder.build();
  }

  private static TokenUsage toTokenUsage(ChatResponse response) {
    dev.langchain4j.model.output.TokenUsage usage = response.tokenUsage();
    if (usage == null) {
      return TokenUsage.ZERO;
    }
    Integer input = usage.inputTokenCount();
    Integer output = usage.outputTokenCount();
    return new TokenUsage(input != null ? input : 0, output != null ? output : 0);
  }

  private void validateApiKey() {
    String apiKey = properties.getApiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new ConfigurationException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
