package com.scholary.meditation.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Voice settings the markup generator applies across the whole meditation. */
public record ProsodyProfile(
    @JsonProperty("base_pitch") String basePitch,
    @JsonProperty("base_rate") String baseRate,
    @JsonProperty("volume") String volume,
    @JsonProperty("pauses") Pauses pauses,
    @JsonProperty("emphasis_terms") List<String> emphasisTerms,
    @JsonProperty("section_profiles") Map<String, SectionProsody> sectionProfiles) {

  public ProsodyProfile {
    Objects.requireNonNull(basePitch, "base_pitch is required");
    Objects.requireNonNull(baseRate, "base_rate is required");
    Objects.requireNonNull(volume, "volume is required");
    Objects.requireNonNull(pauses, "pauses is required");
    emphasisTerms = emphasisTerms == null ? List.of() : List.copyOf(emphasisTerms);
    sectionProfiles = sectionProfiles == null ? Map.of() : Map.copyOf(sectionProfiles);
  }

  public record Pauses(
      @JsonProperty("short") String shortPause,
      @JsonProperty("medium") String mediumPause,
      @JsonProperty("long") String longPause,
      @JsonProperty("breath") String breathPause) {

    public Pauses {
      Objects.requireNonNull(shortPause, "pauses.short is required");
      Objects.requireNonNull(mediumPause, "pauses.medium is required");
      Objects.requireNonNull(longPause, "pauses.long is required");
      Objects.requireNonNull(breathPause, "pauses.breath is required");
    }
  }

  public record SectionProsody(
      @JsonProperty("pitch") String pitch,
      @JsonProperty("rate") String rate,
      @JsonProperty("volume") String volume) {}
}
