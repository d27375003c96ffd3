package com.scholary.meditation.generation;

/**
 * A chat-style generative text service.
 *
 * <p>Implementations return the raw text of the model's answer. Callers that expect structured
 * output decode it with {@link StructuredOutputParser}.
 */
public interface GenerativeTextClient {

  /**
   * Generate a response.
   *
   * @param systemPrompt instructions for the model; may be null
   * @param userPrompt the request itself
   * @param options sampling options
   * @return the generated text
   * @throws GenerationException if the service fails after retries
   */
  String generate(String systemPrompt, String userPrompt, GenerationOptions options);
}
