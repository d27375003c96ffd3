package com.scholary.meditation.generation;

/**
 * Exception thrown when the generative text service cannot be reached or answers with an error.
 *
 * <p>Thrown after the configured retries are used up.
 */
public class GenerationException extends RuntimeException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
