package com.scholary.meditation.synthesis;

import java.nio.file.Path;

/** A text-to-speech provider that renders one markup document to one audio file. */
public interface SpeechSynthesizer {

  /**
   * Synthesize markup into {@code outputFile}.
   *
   * @param markup a complete {@code <speak>} document within the provider's size limit
   * @param voiceId provider voice id
   * @param languageCode BCP-47 language code, e.g. en-US
   * @param outputFile file to write; replaced if it exists
   * @return the written file
   * @throws SynthesisException if the provider rejects the request or returns no audio
   */
  Path synthesize(String markup, String voiceId, String languageCode, Path outputFile);
}
