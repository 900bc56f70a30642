package cafe.woden.spellcafe.check.api;

import cafe.woden.spellcafe.config.SpellcheckProperties;

/**
 * Per-call checker switches.
 *
 * @param suggestionsEnabled whether flagged words carry suggestions
 * @param caseSensitive whether dictionary membership is tested on the raw token
 * @param maxSuggestions upper bound on suggestions per word
 * @param confidenceThreshold minimum confidence for a dictionary miss to count as misspelled
 */
public record CheckOptions(
    boolean suggestionsEnabled,
    boolean caseSensitive,
    int maxSuggestions,
    double confidenceThreshold) {

  public CheckOptions {
    maxSuggestions = Math.max(0, maxSuggestions);
    if (Double.isNaN(confidenceThreshold)) {
      confidenceThreshold = SpellcheckProperties.DEFAULT_CONFIDENCE_THRESHOLD;
    }
    confidenceThreshold = Math.max(0.0, Math.min(1.0, confidenceThreshold));
  }

  public static CheckOptions defaults() {
    return from(SpellcheckProperties.defaults());
  }

  public static CheckOptions from(SpellcheckProperties props) {
    SpellcheckProperties p = props != null ? props : SpellcheckProperties.defaults();
    return new CheckOptions(
        Boolean.TRUE.equals(p.suggestionsEnabled()),
        Boolean.TRUE.equals(p.caseSensitive()),
        p.maxSuggestions(),
        p.confidenceThreshold());
  }

  public CheckOptions withConfidenceThreshold(double threshold) {
    return new CheckOptions(suggestionsEnabled, caseSensitive, maxSuggestions, threshold);
  }

  public CheckOptions withSuggestionsEnabled(boolean enabled) {
    return new CheckOptions(enabled, caseSensitive, maxSuggestions, confidenceThreshold);
  }

  public CheckOptions withMaxSuggestions(int max) {
    return new CheckOptions(suggestionsEnabled, caseSensitive, max, confidenceThreshold);
  }

  public CheckOptions withCaseSensitive(boolean enabled) {
    return new CheckOptions(suggestionsEnabled, enabled, maxSuggestions, confidenceThreshold);
  }
}
