package cafe.woden.spellcafe.check;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.spellcafe.dictionary.Dictionary;
import cafe.woden.spellcafe.dictionary.DictionaryFixtures;
import cafe.woden.spellcafe.language.Language;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SuggestionGeneratorTest {

  @TempDir Path tempDir;

  private Dictionary dictionary(String... words) throws Exception {
    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, words);
    Dictionary d =
        DictionaryFixtures.dictionary(DictionaryFixtures.properties(tempDir), Language.ENGLISH);
    d.load();
    return d;
  }

  @Test
  void transpositionsRankFirstAndCaseFollowsTheToken() throws Exception {
    Dictionary d = dictionary("the", "tea", "ten", "quick", "quack", "fox");

    assertEquals("The", SuggestionGenerator.suggest("Teh", "teh", d, 5).get(0));
    assertEquals(List.of("quick", "quack"), SuggestionGenerator.suggest("quikc", "quikc", d, 5));
    assertEquals(List.of("QUICK", "QUACK"), SuggestionGenerator.suggest("QUIKC", "quikc", d, 5));
  }

  @Test
  void rankingIsDistanceThenLengthDeltaThenSharedPrefix() throws Exception {
    Dictionary d = dictionary("house", "horse", "mouse", "hose", "houses");

    assertEquals(
        List.of("house", "hose", "horse"), SuggestionGenerator.suggest("hous", "hous", d, 3));
  }

  @Test
  void respectsMaxAndShortTokenFirstLetterRule() throws Exception {
    Dictionary d = dictionary("cat", "bat", "car", "cot");

    assertEquals(List.of("cat", "cot"), SuggestionGenerator.suggest("cst", "cst", d, 5));
    assertEquals(1, SuggestionGenerator.suggest("cst", "cst", d, 1).size());
    assertTrue(SuggestionGenerator.suggest("cst", "cst", d, 0).isEmpty());
  }

  @Test
  void nothingWithinReachGivesNoSuggestions() throws Exception {
    Dictionary d = dictionary("elephant");

    assertTrue(SuggestionGenerator.suggest("xyz", "xyz", d, 5).isEmpty());
  }

  @Test
  void distanceAndHelpers() {
    assertEquals(1, SuggestionGenerator.damerauLevenshteinDistance("teh", "the"));
    assertEquals(3, SuggestionGenerator.damerauLevenshteinDistance("kitten", "sitting"));
    assertEquals(3, SuggestionGenerator.damerauLevenshteinDistance("", "abc"));
    assertTrue(SuggestionGenerator.isAdjacentTranspositionTypo("quikc", "quick"));
    assertFalse(SuggestionGenerator.isAdjacentTranspositionTypo("quack", "quick"));
    assertEquals(2, SuggestionGenerator.commonPrefixLength("house", "horse"));
    assertEquals("World", SuggestionGenerator.matchCase("Hello", "world"));
    assertEquals("world", SuggestionGenerator.matchCase("hello", "world"));
    assertEquals("Word", SuggestionGenerator.matchCase("A", "word"));
  }
}
