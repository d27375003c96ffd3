package com.scholary.meditation.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/** Generated narration text plus its ordered, typed sections. */
public record MeditationScript(
    @JsonProperty("content") String content,
    @JsonProperty("sections") List<ScriptSection> sections) {

  public MeditationScript {
    Objects.requireNonNull(content, "script content is required");
    sections = sections == null ? List.of() : List.copyOf(sections);
  }
}
