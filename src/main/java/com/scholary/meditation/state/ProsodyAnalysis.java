package com.scholary.meditation.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Prosody recommendations for a script, as returned by the analysis collaborator.
 *
 * <p>Only the markup stages read it. The compact constructors reject missing required fields so a
 * half-formed collaborator response fails the strict decode instead of leaking nulls downstream.
 */
public record ProsodyAnalysis(
    @JsonProperty("overall_tone") String overallTone,
    @JsonProperty("key_terms") List<String> keyTerms,
    @JsonProperty("breathing_patterns") List<BreathingPattern> breathingPatterns,
    @JsonProperty("section_recommendations") List<SectionRecommendation> sectionRecommendations) {

  public ProsodyAnalysis {
    Objects.requireNonNull(overallTone, "overall_tone is required");
    keyTerms = keyTerms == null ? List.of() : List.copyOf(keyTerms);
    breathingPatterns = breathingPatterns == null ? List.of() : List.copyOf(breathingPatterns);
    sectionRecommendations =
        sectionRecommendations == null ? List.of() : List.copyOf(sectionRecommendations);
  }

  /** A breathing technique detected in the script, with phase durations ("inhale" -> "4s"). */
  public record BreathingPattern(
      @JsonProperty("type") String type, @JsonProperty("phases") Map<String, String> phases) {

    public BreathingPattern {
      Objects.requireNonNull(type, "breathing pattern type is required");
      phases = phases == null ? Map.of() : Map.copyOf(phases);
    }
  }

  /** Suggested delivery for one section type. */
  public record SectionRecommendation(
      @JsonProperty("section_type") String sectionType,
      @JsonProperty("pitch") String pitch,
      @JsonProperty("rate") String rate,
      @JsonProperty("volume") String volume) {

    public SectionRecommendation {
      Objects.requireNonNull(sectionType, "section_type is required");
    }
  }
}
