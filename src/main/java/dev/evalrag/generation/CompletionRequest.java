package dev.evalrag.generation;

/**
 * A single prompt sent to a {@link CompletionBackend}.
 *
 * @param model provider model identifier
 * @param prompt the fully rendered prompt
 * @param jsonResponse ask the provider to constrain the output to a JSON object
 */
public record CompletionRequest(String model, String prompt, boolean jsonResponse) {}
