package cafe.woden.spellcafe.check;

import cafe.woden.spellcafe.config.SpellcheckProperties;
import cafe.woden.spellcafe.text.WordCategory;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Tokens that are reported correct without a lookup and left out of document totals.
 *
 * <p>Acronym and proper-noun lists are matched case-insensitively.
 */
final class SkipPolicy {

  private static final int MAX_SHORT_IDENTIFIER_LENGTH = 3;

  private final Set<String> acronyms;
  private final Set<String> properNouns;

  SkipPolicy(Collection<String> acronyms, Collection<String> properNouns) {
    this.acronyms = lowerCased(acronyms);
    this.properNouns = lowerCased(properNouns);
  }

  static SkipPolicy from(SpellcheckProperties props) {
    SpellcheckProperties p = props != null ? props : SpellcheckProperties.defaults();
    return new SkipPolicy(p.commonAcronyms(), p.properNouns());
  }

  boolean shouldSkip(String word, WordCategory category) {
    return switch (category) {
      case ACRONYM -> acronyms.contains(word.toLowerCase(Locale.ROOT));
      case CODE_IDENTIFIER ->
          word.codePointCount(0, word.length()) <= MAX_SHORT_IDENTIFIER_LENGTH
              || word.chars().allMatch(Character::isDigit)
              || word.startsWith("0x")
              || word.contains("__");
      case PROPER_NOUN -> properNouns.contains(word.toLowerCase(Locale.ROOT));
      default -> false;
    };
  }

  private static Set<String> lowerCased(Collection<String> words) {
    Set<String> out = new HashSet<>();
    if (words == null) return out;
    for (String w : words) {
      if (w == null || w.isBlank()) continue;
      out.add(w.trim().toLowerCase(Locale.ROOT));
    }
    return Set.copyOf(out);
  }
}
