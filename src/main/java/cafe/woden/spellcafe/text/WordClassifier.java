package cafe.woden.spellcafe.text;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Assigns a {@link WordCategory} to a token.
 *
 * <p>Rules are tried in table order and the first match wins. Acronyms come before proper nouns so
 * a short all-caps token is never read as a name.
 */
public final class WordClassifier {

  private static final int MAX_ACRONYM_LENGTH = 6;
  private static final int MIN_PROPER_NOUN_LENGTH = 3;
  private static final int MIN_TECHNICAL_TERM_LENGTH = 6;

  private static final Set<String> COMMON_CAPITALIZED =
      Set.of("I", "A", "The", "And", "But", "Or", "For", "Nor", "Yet", "So");

  /** What a rule sees. */
  public record Subject(String word, boolean codeContext, boolean sentenceStart) {}

  record Rule(WordCategory category, Predicate<Subject> test) {}

  static final List<Rule> RULES =
      List.of(
          new Rule(WordCategory.ACRONYM, s -> isAcronymShape(s.word())),
          new Rule(
              WordCategory.PROPER_NOUN,
              s ->
                  !s.sentenceStart()
                      && startsUpper(s.word())
                      && length(s.word()) >= MIN_PROPER_NOUN_LENGTH
                      && !COMMON_CAPITALIZED.contains(s.word())),
          new Rule(
              WordCategory.CODE_IDENTIFIER,
              s -> s.codeContext() && isIdentifierShape(s.word())),
          new Rule(
              WordCategory.TECHNICAL_TERM,
              s -> s.word().indexOf('-') >= 0 && length(s.word()) >= MIN_TECHNICAL_TERM_LENGTH));

  private WordClassifier() {}

  public static WordCategory classify(String word, boolean codeContext) {
    return classify(word, codeContext, false);
  }

  /**
   * Like {@link #classify(String, boolean)}, but a capitalized word that opens a sentence is not
   * taken for a proper noun.
   */
  public static WordCategory classify(String word, boolean codeContext, boolean sentenceStart) {
    if (word == null || word.isEmpty()) return WordCategory.NORMAL;
    Subject subject = new Subject(word, codeContext, sentenceStart);
    for (Rule rule : RULES) {
      if (rule.test().test(subject)) return rule.category();
    }
    return WordCategory.NORMAL;
  }

  static boolean isAcronymShape(String word) {
    if (length(word) > MAX_ACRONYM_LENGTH) return false;
    return word.codePoints()
        .allMatch(cp -> Character.isUpperCase(cp) || Character.isDigit(cp) || cp == '_');
  }

  static boolean isIdentifierShape(String word) {
    if (word.indexOf('_') >= 0) return true;
    boolean upper = word.codePoints().anyMatch(Character::isUpperCase);
    boolean lower = word.codePoints().anyMatch(Character::isLowerCase);
    if (upper && lower) return true;
    return word.startsWith("get_")
        || word.startsWith("set_")
        || word.endsWith("_t")
        || word.endsWith("_ptr");
  }

  private static boolean startsUpper(String word) {
    return Character.isUpperCase(word.codePointAt(0));
  }

  private static int length(String word) {
    return word.codePointCount(0, word.length());
  }
}
