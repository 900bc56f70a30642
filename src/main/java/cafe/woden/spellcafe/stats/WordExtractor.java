package cafe.woden.spellcafe.stats;

import cafe.woden.spellcafe.dictionary.WordNormalizer;
import cafe.woden.spellcafe.language.Language;
import cafe.woden.spellcafe.text.TextLines;
import cafe.woden.spellcafe.text.Token;
import cafe.woden.spellcafe.text.TokenPattern;
import cafe.woden.spellcafe.text.Tokenizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalized words of a document, in order, for counting.
 *
 * <p>In code the extraction leaves out language keywords and identifier-shaped tokens, which are
 * noise for frequency tables and generated word lists.
 */
final class WordExtractor {

  private static final Set<String> CODE_SYMBOLS =
      Set.of(
          "var", "val", "def", "func", "cls", "obj", "arr", "vec", "str", "int", "num", "bool",
          "float", "double", "char", "byte", "ptr", "ref", "mut", "const", "static", "pub", "priv",
          "prot", "async", "await", "try", "catch", "throw", "null", "nil", "none", "some", "err",
          "true", "false", "self", "this", "super", "new", "del", "inc", "dec");

  private WordExtractor() {}

  static List<String> extract(String text, Language language, String filename) {
    List<String> out = new ArrayList<>();
    if (text == null || text.isEmpty()) return out;
    Language lang = language != null ? language : Language.ENGLISH;
    Tokenizer tokenizer = Tokenizer.forDocument(lang, filename, text);
    boolean code = tokenizer.pattern() == TokenPattern.CODE;

    for (String line : TextLines.split(text)) {
      for (Token token : tokenizer.tokens(line)) {
        String word = token.text();
        if (code && isCodeNoise(word)) continue;
        out.add(WordNormalizer.normalize(lang, word));
      }
    }
    return out;
  }

  /** Prose extraction, whatever the document looks like. */
  static List<String> extractProse(String text) {
    List<String> out = new ArrayList<>();
    if (text == null || text.isEmpty()) return out;
    Tokenizer tokenizer = new Tokenizer(TokenPattern.PROSE);
    for (String line : TextLines.split(text)) {
      for (Token token : tokenizer.tokens(line)) {
        out.add(WordNormalizer.normalize(Language.ENGLISH, token.text()));
      }
    }
    return out;
  }

  static boolean isCodeNoise(String word) {
    if (word.indexOf('_') >= 0) return true;
    if (word.startsWith("0x")) return true;
    if (word.chars().anyMatch(Character::isDigit)) return true;
    for (int i = 1; i < word.length(); i++) {
      if (Character.isUpperCase(word.charAt(i))) return true;
    }
    return CODE_SYMBOLS.contains(word.toLowerCase(Locale.ROOT));
  }
}
