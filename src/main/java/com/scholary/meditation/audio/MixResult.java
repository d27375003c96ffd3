package com.scholary.meditation.audio;

import java.nio.file.Path;

/** Output of a mix; {@code sampleFile} is null when no sample was requested. */
public record MixResult(Path mixedFile, Path sampleFile) {

  public boolean hasSample() {
    return sampleFile != null;
  }
}
