package com.scholary.meditation.generation;

/** Sampling options for one generation request. {@code maxTokens} is optional. */
public record GenerationOptions(double temperature, Integer maxTokens) {

  /** Creative writing, e.g. the narration itself. */
  public static GenerationOptions creative() {
    return new GenerationOptions(0.7, null);
  }

  /** Analysis and markup, where consistency matters more than variety. */
  public static GenerationOptions precise() {
    return new GenerationOptions(0.2, null);
  }

  public static GenerationOptions withTemperature(double temperature) {
    return new GenerationOptions(temperature, null);
  }
}
