package com.scholary.meditation.audio;

import java.nio.file.Path;

/** No background audio file could be found to mix under the narration. */
public class NoSoundscapeAvailableException extends RuntimeException {

  public NoSoundscapeAvailableException(Path directory) {
    super("No soundscape files available in " + directory);
  }
}
