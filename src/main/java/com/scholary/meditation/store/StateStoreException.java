package com.scholary.meditation.store;

/**
 * Exception thrown when a snapshot cannot be written or read back.
 *
 * <p>A snapshot that exists but cannot be parsed is reported with this exception, never as a
 * missing snapshot.
 */
public class StateStoreException extends RuntimeException {

  public StateStoreException(String message) {
    super(message);
  }

  public StateStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
