package cafe.woden.spellcafe.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class WordClassifierTest {

  @Test
  void shortAllCapsIsAcronym() {
    assertEquals(WordCategory.ACRONYM, WordClassifier.classify("API", false));
    assertEquals(WordCategory.ACRONYM, WordClassifier.classify("MP3", false));
    assertEquals(WordCategory.ACRONYM, WordClassifier.classify("I", false));
  }

  @Test
  void longAllCapsFallsThroughToProperNoun() {
    assertEquals(WordCategory.PROPER_NOUN, WordClassifier.classify("ABCDEFG", false));
  }

  @Test
  void capitalizedWordMidSentenceIsProperNoun() {
    assertEquals(WordCategory.PROPER_NOUN, WordClassifier.classify("London", false));
    assertEquals(WordCategory.NORMAL, WordClassifier.classify("The", false));
    assertEquals(WordCategory.NORMAL, WordClassifier.classify("Al", false));
  }

  @Test
  void capitalizedWordOpeningASentenceIsNormal() {
    assertEquals(WordCategory.NORMAL, WordClassifier.classify("Teh", false, true));
    assertEquals(WordCategory.PROPER_NOUN, WordClassifier.classify("Teh", false, false));
  }

  @Test
  void identifiersOnlyInCodeContext() {
    assertEquals(WordCategory.CODE_IDENTIFIER, WordClassifier.classify("get_value_t", true));
    assertEquals(WordCategory.CODE_IDENTIFIER, WordClassifier.classify("getValue", true));
    assertEquals(WordCategory.NORMAL, WordClassifier.classify("get_value_t", false));
    assertEquals(WordCategory.NORMAL, WordClassifier.classify("getValue", false));
  }

  @Test
  void pascalCaseInCodeIsReadAsProperNounFirst() {
    assertEquals(WordCategory.PROPER_NOUN, WordClassifier.classify("HttpClient", true));
  }

  @Test
  void longHyphenatedWordIsTechnicalTerm() {
    assertEquals(WordCategory.TECHNICAL_TERM, WordClassifier.classify("well-known", false));
    assertEquals(WordCategory.NORMAL, WordClassifier.classify("x-ray", false));
  }

  @Test
  void emptyInputIsNormal() {
    assertEquals(WordCategory.NORMAL, WordClassifier.classify("", true));
    assertEquals(WordCategory.NORMAL, WordClassifier.classify(null, false));
  }

  @Test
  void shapeHelpers() {
    assertTrue(WordClassifier.isAcronymShape("HTTP_2"));
    assertFalse(WordClassifier.isAcronymShape("Http"));
    assertTrue(WordClassifier.isIdentifierShape("snake_case"));
    assertFalse(WordClassifier.isIdentifierShape("plain"));
  }
}
