package cafe.woden.spellcafe.dictionary;

import java.util.List;

/**
 * Shape test for tokens that look like source identifiers, used by {@link Dictionary#contains}
 * when the surrounding text is code.
 */
final class CodeIdentifierShape {

  private static final List<String> PREFIXES = List.of("get_", "set_", "is_", "has_");
  private static final List<String> SUFFIXES = List.of("_t", "_ptr");
  private static final List<String> TYPE_SUFFIXES =
      List.of("Handler", "Service", "Manager", "Factory");

  private CodeIdentifierShape() {}

  static boolean matches(String word) {
    if (word == null || word.isEmpty()) return false;

    int underscore = word.indexOf('_', 1);
    if (underscore > 0 && underscore < word.length() - 1) return true;
    if (hasInnerMixedCase(word)) return true;

    for (String p : PREFIXES) {
      if (word.startsWith(p)) return true;
    }
    for (String s : SUFFIXES) {
      if (word.endsWith(s)) return true;
    }
    for (String s : TYPE_SUFFIXES) {
      if (word.length() > s.length() && word.endsWith(s)) return true;
    }
    return false;
  }

  // camelCase / PascalCase: a lower-case letter anywhere and an upper-case letter past index 0.
  private static boolean hasInnerMixedCase(String word) {
    boolean lower = false;
    boolean innerUpper = false;
    for (int i = 0; i < word.length(); i++) {
      char c = word.charAt(i);
      if (Character.isLowerCase(c)) lower = true;
      else if (i > 0 && Character.isUpperCase(c)) innerUpper = true;
    }
    return lower && innerUpper;
  }
}
