package cafe.woden.spellcafe.check;

import cafe.woden.spellcafe.dictionary.Dictionary;
import cafe.woden.spellcafe.language.Language;
import cafe.woden.spellcafe.text.WordCategory;
import java.util.Objects;
import java.util.Set;

/**
 * Answers whether a classified token is spelled correctly.
 *
 * <p>Lookup order: session and persisted ignore lists, user words, then the dictionary answer
 * (memoized in {@link CorrectnessCache}) with category leniency on top. The cache holds only the
 * dictionary answer, so add/ignore mutations take effect without touching it and the same word can
 * be judged differently as a name and as a plain word.
 */
final class CorrectnessResolver {

  private static final int MAX_LENIENT_IDENTIFIER_LENGTH = 15;
  private static final double MIN_LETTER_RATIO = 0.7;
  private static final int MAX_REPEATED_CHARS = 4;
  private static final String VOWELS = "aeiouyAEIOUY";

  /** What one document's lookups share. */
  record Lookup(
      Dictionary dictionary,
      Set<String> sessionIgnored,
      boolean caseSensitive,
      boolean codeContext) {

    Lookup {
      Objects.requireNonNull(dictionary, "dictionary");
      sessionIgnored = sessionIgnored == null ? Set.of() : sessionIgnored;
    }
  }

  private final CorrectnessCache cache;

  CorrectnessResolver(CorrectnessCache cache) {
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  boolean isCorrect(Lookup lookup, String original, String normalized, WordCategory category) {
    Dictionary dictionary = lookup.dictionary();
    if (lookup.sessionIgnored().contains(normalized) || dictionary.isIgnored(normalized)) {
      return true;
    }
    if (dictionary.isUserWord(normalized)) return true;

    boolean inDictionary = inDictionary(lookup, original, normalized);
    return switch (category) {
      case PROPER_NOUN, ACRONYM -> inDictionary || looksReasonable(original);
      case CODE_IDENTIFIER ->
          inDictionary
              || original.codePointCount(0, original.length()) <= MAX_LENIENT_IDENTIFIER_LENGTH;
      case NORMAL, TECHNICAL_TERM -> inDictionary;
    };
  }

  // Case-sensitive lookups see the raw token, so that is what they are cached under. The
  // revision is read before the lookup so the answer is never filed under a newer revision.
  private boolean inDictionary(Lookup lookup, String original, String normalized) {
    Dictionary dictionary = lookup.dictionary();
    Language language = dictionary.language();
    long revision = dictionary.revision();
    String key = lookup.caseSensitive() ? original : normalized;
    Boolean cached =
        cache.get(language, revision, key, lookup.caseSensitive(), lookup.codeContext());
    if (cached != null) return cached;

    boolean found = dictionary.contains(original, lookup.caseSensitive(), lookup.codeContext());
    cache.put(language, revision, key, lookup.caseSensitive(), lookup.codeContext(), found);
    return found;
  }

  /**
   * Plausible name or acronym: mostly letters, no character repeated more than four times in a
   * row, and a vowel unless the word is at most four characters long.
   */
  static boolean looksReasonable(String word) {
    if (word == null || word.isEmpty()) return false;
    int total = word.codePointCount(0, word.length());
    long letters = word.codePoints().filter(Character::isLetter).count();
    if ((double) letters / total <= MIN_LETTER_RATIO) return false;
    if (hasRepeatedRun(word, MAX_REPEATED_CHARS)) return false;
    return total <= 4 || hasVowel(word);
  }

  static boolean hasRepeatedRun(String word, int maxRepeats) {
    int previous = -1;
    int run = 0;
    for (int i = 0; i < word.length(); ) {
      int cp = word.codePointAt(i);
      i += Character.charCount(cp);
      run = cp == previous ? run + 1 : 1;
      previous = cp;
      if (run > maxRepeats) return true;
    }
    return false;
  }

  private static boolean hasVowel(String word) {
    for (int i = 0; i < word.length(); i++) {
      if (VOWELS.indexOf(word.charAt(i)) >= 0) return true;
    }
    return false;
  }
}
