package cafe.woden.spellcafe.check;

import cafe.woden.spellcafe.text.WordCategory;
import java.util.List;

/**
 * Confidence, in {@code [0, 1]}, that a dictionary miss is a real typo rather than acceptable
 * noise. Correct words always score 1.0.
 */
final class ConfidenceScorer {

  private static final double BASE = 0.5;
  private static final List<String> TYPO_PRONE_PATTERNS =
      List.of("ie", "ei", "tion", "sion", "able", "ible", "ment", "ness", "ough");

  private ConfidenceScorer() {}

  static double score(String word, WordCategory category, boolean correct) {
    if (correct) return 1.0;

    double confidence = BASE * categoryWeight(category);

    int length = word.codePointCount(0, word.length());
    if (length < 3) confidence *= 0.3;
    else if (length > 20) confidence *= 0.7;

    if (word.indexOf('_') >= 0 || word.indexOf('-') >= 0) confidence *= 1.1;
    if (hasTypoPronePattern(word)) confidence *= 1.3;

    return Math.max(0.0, Math.min(1.0, confidence));
  }

  static double categoryWeight(WordCategory category) {
    return switch (category) {
      case NORMAL -> 1.2;
      case CODE_IDENTIFIER -> 0.3;
      case ACRONYM -> 0.4;
      case PROPER_NOUN -> 0.6;
      case TECHNICAL_TERM -> 0.8;
    };
  }

  static boolean hasTypoPronePattern(String word) {
    for (String p : TYPO_PRONE_PATTERNS) {
      if (word.contains(p)) return true;
    }
    return false;
  }
}
