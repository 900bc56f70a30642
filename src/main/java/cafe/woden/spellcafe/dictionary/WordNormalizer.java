package cafe.woden.spellcafe.dictionary;

import cafe.woden.spellcafe.language.Language;
import java.util.Locale;

/** Per-language normalization applied before any dictionary storage or lookup. */
public final class WordNormalizer {

  private WordNormalizer() {}

  /** Lower-cases Latin-script words; CJK words are kept verbatim. Surrounding space is trimmed. */
  public static String normalize(Language language, String word) {
    if (word == null) return "";
    String trimmed = word.trim();
    if (trimmed.isEmpty()) return "";
    if (language != null && language.isCjk()) return trimmed;
    return trimmed.toLowerCase(Locale.ROOT);
  }

  /** Length in code points. */
  public static int length(String word) {
    return word == null ? 0 : word.codePointCount(0, word.length());
  }
}
