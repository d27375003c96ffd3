package com.scholary.meditation.synthesis;

/**
 * Exception thrown when markup cannot be turned into audio.
 *
 * <p>Covers provider errors, empty provider output and failed concatenation of fragments. No
 * partial audio file survives a failure.
 */
public class SynthesisException extends RuntimeException {

  public SynthesisException(String message) {
    super(message);
  }

  public SynthesisException(String message, Throwable cause) {
    super(message, cause);
  }
}
