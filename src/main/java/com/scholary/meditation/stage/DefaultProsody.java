package com.scholary.meditation.stage;

import com.scholary.meditation.state.MeditationRequest;
import com.scholary.meditation.state.MeditationScript;
import com.scholary.meditation.state.ProsodyAnalysis;
import com.scholary.meditation.state.ProsodyAnalysis.BreathingPattern;
import com.scholary.meditation.state.ProsodyAnalysis.SectionRecommendation;
import com.scholary.meditation.state.ProsodyProfile;
import com.scholary.meditation.state.ProsodyProfile.Pauses;
import com.scholary.meditation.state.ProsodyProfile.SectionProsody;
import com.scholary.meditation.state.ScriptSection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Template prosody used when the generated analysis or profile cannot be decoded. */
final class DefaultProsody {

  static final List<String> DEFAULT_KEY_TERMS =
      List.of("breath", "relax", "present", "awareness", "gentle");

  static final Map<String, SectionProsody> SECTION_PROFILES;

  static {
    Map<String, SectionProsody> profiles = new LinkedHashMap<>();
    profiles.put("introduction", new SectionProsody("-15%", "80%", "soft"));
    profiles.put("grounding", new SectionProsody("-20%", "65%", "x-soft"));
    profiles.put("body_scan", new SectionProsody("-18%", "60%", "x-soft"));
    profiles.put("breathing", new SectionProsody("-15%", "70%", "soft"));
    profiles.put("visualization", new SectionProsody("-12%", "75%", "soft"));
    profiles.put("affirmations", new SectionProsody("-10%", "75%", "medium"));
    profiles.put("closing", new SectionProsody("-15%", "75%", "soft"));
    SECTION_PROFILES = Map.copyOf(profiles);
  }

  /** Base pitch, rate and volume per language; applied last, so they override everything. */
  static final Map<String, SectionProsody> LANGUAGE_ADJUSTMENTS =
      Map.of(
          "es-ES", new SectionProsody("-12%", "80%", "soft"),
          "en-US", new SectionProsody("-10%", "85%", "medium"));

  private static final SectionProsody BODY_DEFAULT = new SectionProsody("-18%", "70%", "x-soft");

  private DefaultProsody() {}

  /** A gentle, generic analysis with one recommendation per section type in the script. */
  static ProsodyAnalysis analysis(MeditationScript script) {
    Set<String> types = new LinkedHashSet<>();
    for (ScriptSection section : script.sections()) {
      types.add(section.type());
    }
    if (types.isEmpty()) {
      types.addAll(List.of("introduction", "body", "closing"));
    }

    List<SectionRecommendation> recommendations =
        types.stream()
            .map(
                type -> {
                  SectionProsody prosody = SECTION_PROFILES.getOrDefault(type, BODY_DEFAULT);
                  return new SectionRecommendation(
                      type, prosody.pitch(), prosody.rate(), prosody.volume());
                })
            .collect(Collectors.toList());

    return new ProsodyAnalysis(
        "calming and soothing",
        DEFAULT_KEY_TERMS,
        List.of(new BreathingPattern("deep_breathing", Map.of("inhale", "4s", "exhale", "6s"))),
        recommendations);
  }

  /**
   * Template profile adjusted for the request: emotional state first, then meditation style, then
   * language, which has the last word on base pitch, rate and volume.
   */
  static ProsodyProfile profile(MeditationRequest request, ProsodyAnalysis analysis) {
    String pitch = "-10%";
    String rate = "85%";
    String volume = "soft";
    String shortPause = "800ms";
    String mediumPause = "2s";
    String longPause = "4s";
    String breathPause = "3s";
    Map<String, SectionProsody> sections = new LinkedHashMap<>(SECTION_PROFILES);

    if ("anxious".equalsIgnoreCase(request.emotionalState())) {
      pitch = "-15%";
      rate = "75%";
      volume = "x-soft";
    } else if ("energetic".equalsIgnoreCase(request.emotionalState())) {
      pitch = "-5%";
      rate = "90%";
      volume = "medium";
    }

    String style = request.meditationStyle() == null ? "" : request.meditationStyle();
    switch (style) {
      case "Mindfulness":
        rate = "75%";
        mediumPause = "2.5s";
        longPause = "5s";
        break;
      case "BreathFocus":
        sections.put("breathing", new SectionProsody("-15%", "65%", "x-soft"));
        break;
      case "BodyScan":
        rate = "70%";
        sections.put("body_scan", new SectionProsody("-18%", "60%", "x-soft"));
        break;
      default:
        break;
    }

    SectionProsody language = LANGUAGE_ADJUSTMENTS.get(request.languageCode());
    if (language != null) {
      pitch = language.pitch();
      rate = language.rate();
      volume = language.volume();
    }

    List<String> emphasis =
        analysis == null || analysis.keyTerms().isEmpty() ? DEFAULT_KEY_TERMS : analysis.keyTerms();
    return new ProsodyProfile(
        pitch,
        rate,
        volume,
        new Pauses(shortPause, mediumPause, longPause, breathPause),
        emphasis,
        sections);
  }
}
