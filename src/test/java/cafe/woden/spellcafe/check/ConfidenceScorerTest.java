package cafe.woden.spellcafe.check;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.spellcafe.text.WordCategory;
import org.junit.jupiter.api.Test;

class ConfidenceScorerTest {

  private static final double EPS = 1e-9;

  @Test
  void correctWordsScoreOne() {
    assertEquals(1.0, ConfidenceScorer.score("anything", WordCategory.ACRONYM, true));
  }

  @Test
  void plainMissScoresBaseTimesCategoryWeight() {
    assertEquals(0.6, ConfidenceScorer.score("quikc", WordCategory.NORMAL, false), EPS);
    assertEquals(0.3, ConfidenceScorer.score("Zorblax", WordCategory.PROPER_NOUN, false), EPS);
    assertEquals(0.15, ConfidenceScorer.score("fooBar", WordCategory.CODE_IDENTIFIER, false), EPS);
  }

  @Test
  void lengthAndShapeAdjustments() {
    assertEquals(0.18, ConfidenceScorer.score("xq", WordCategory.NORMAL, false), EPS);
    assertEquals(
        0.42, ConfidenceScorer.score("abcdefghijklmnopqrstu", WordCategory.NORMAL, false), EPS);
    assertEquals(0.44, ConfidenceScorer.score("abc-defg", WordCategory.TECHNICAL_TERM, false), EPS);
    assertEquals(0.78, ConfidenceScorer.score("recieve", WordCategory.NORMAL, false), EPS);
  }

  @Test
  void adjustmentsMultiply() {
    double score = ConfidenceScorer.score("mention-able", WordCategory.NORMAL, false);

    assertEquals(0.858, score, EPS);
  }

  @Test
  void typoPronePatterns() {
    assertTrue(ConfidenceScorer.hasTypoPronePattern("thoughness"));
    assertFalse(ConfidenceScorer.hasTypoPronePattern("quick"));
  }
}
