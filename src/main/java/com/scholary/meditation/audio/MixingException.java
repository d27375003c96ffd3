package com.scholary.meditation.audio;

/**
 * Exception thrown when a narration cannot be mixed with its background.
 *
 * <p>When this is thrown no mix or sample output is left behind.
 */
public class MixingException extends RuntimeException {

  public MixingException(String message) {
    super(message);
  }

  public MixingException(String message, Throwable cause) {
    super(message, cause);
  }
}
