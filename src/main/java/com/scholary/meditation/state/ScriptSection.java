package com.scholary.meditation.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** One typed section of a meditation script (introduction, breathing, closing, ...). */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScriptSection(
    @JsonProperty("type") String type, @JsonProperty("content") String content) {

  public ScriptSection {
    Objects.requireNonNull(type, "section type is required");
    Objects.requireNonNull(content, "section content is required");
  }
}
