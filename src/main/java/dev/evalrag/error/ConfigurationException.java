package dev.evalrag.error;

/** Invalid static configuration: chunking options, retrieval depth, embedding dimensions. */
public class ConfigurationException extends EvalRagException {

  public ConfigurationException(String message) {
    super(message);
  }
}
