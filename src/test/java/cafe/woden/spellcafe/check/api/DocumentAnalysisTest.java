package cafe.woden.spellcafe.check.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.spellcafe.language.Language;
import cafe.woden.spellcafe.text.WordCategory;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentAnalysisTest {

  @Test
  void accuracyIsRoundedPercentOfCorrectWords() {
    assertEquals(100.0, DocumentAnalysis.accuracyOf(0, 0));
    assertEquals(70.0, DocumentAnalysis.accuracyOf(10, 3));
    assertEquals(67.0, DocumentAnalysis.accuracyOf(3, 1));
    assertEquals(0.0, DocumentAnalysis.accuracyOf(4, 4));
  }

  @Test
  void emptyAnalysisHasFullAccuracy() {
    DocumentAnalysis empty = DocumentAnalysis.empty(Language.Builtin.GERMAN, null);

    assertEquals(100.0, empty.accuracy());
    assertEquals(Language.Builtin.GERMAN, empty.language());
    assertTrue(empty.fileTypeHint().isEmpty());
    assertEquals(Duration.ZERO, empty.checkDuration());
  }

  @Test
  void uniqueWordsCountsNormalizedFormsOfCountedWords() {
    WordCheck the = word("The", "the", true);
    WordCheck theAgain = word("the", "the", true);
    WordCheck typo = word("quikc", "quikc", false);
    WordCheck api = WordCheck.skipped("API", 0, 3, 1, WordCategory.ACRONYM);

    DocumentAnalysis analysis =
        new DocumentAnalysis(
            3, 1, 67.0, List.of(the, theAgain, typo, api), 0, null, 1, null, false, "a.txt");

    assertEquals(2, analysis.uniqueWords());
    assertEquals(List.of(typo), analysis.misspelled());
    assertEquals(Language.ENGLISH, analysis.language());
    assertEquals("a.txt", analysis.fileTypeHint().orElseThrow());
  }

  @Test
  void optionsAreClamped() {
    CheckOptions options = new CheckOptions(true, false, -2, 3.0);

    assertEquals(0, options.maxSuggestions());
    assertEquals(1.0, options.confidenceThreshold());
    assertEquals(0.7, CheckOptions.defaults().confidenceThreshold());
    assertEquals(5, CheckOptions.defaults().maxSuggestions());
    assertEquals(0.0, CheckOptions.defaults().withConfidenceThreshold(-1).confidenceThreshold());
  }

  private static WordCheck word(String original, String normalized, boolean correct) {
    return new WordCheck(
        original,
        normalized,
        0,
        original.length(),
        1,
        1,
        correct,
        correct ? 1.0 : 0.6,
        WordCategory.NORMAL,
        List.of(),
        false);
  }
}
