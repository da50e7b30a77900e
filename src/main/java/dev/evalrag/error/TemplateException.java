package dev.evalrag.error;

/** A prompt template is missing a required slot. */
public class TemplateException extends EvalRagException {

  public TemplateException(String message) {
    super(message);
  }
}
