package com.scholary.meditation.state;

import com.fasterxml.jackson.annotation.JsonValue;

/** Progress of the audio part of a run. */
public enum AudioStatus {
  GENERATED("generated"),
  COMPLETED("completed");

  private final String value;

  AudioStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
