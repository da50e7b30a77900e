package dev.evalrag.generation;

import java.util.Objects;

/**
 * A generation prompt template with named slots.
 *
 * <p>{@value #QUESTION_SLOT} and {@value #CONTEXT_SLOT} are required; {@value #INSTRUCTIONS_SLOT}
 * is optional and receives {@link #instructions()}.
 *
 * @param text the template text
 * @param instructions text substituted into the instructions slot, may be empty
 */
public record PromptTemplate(String text, String instructions) {

  public static final String QUESTION_SLOT = "{question}";
  public static final String CONTEXT_SLOT = "{context}";
  public static final String INSTRUCTIONS_SLOT = "{instructions}";

  public static final String DEFAULT_INSTRUCTIONS =
      "If the answer is not in the context, say you don't know. "
          + "Answer in a concise and precise way.";

  public static final String DEFAULT_TEXT =
      """
      You are an assistant answering questions about a document collection.
      Use only the context below to answer.
      {instructions}

      Context:
      {context}

      Question: {question}

      Answer:""";

  public PromptTemplate {
    Objects.requireNonNull(text, "text");
    instructions = instructions == null ? "" : instructions;
  }

  public static PromptTemplate defaults() {
    return new PromptTemplate(DEFAULT_TEXT, DEFAULT_INSTRUCTIONS);
  }
}
