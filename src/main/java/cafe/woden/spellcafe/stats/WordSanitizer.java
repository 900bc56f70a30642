package cafe.woden.spellcafe.stats;

/** Cleanup and sanity checks for words typed or pasted by a user. */
public final class WordSanitizer {

  private WordSanitizer() {}

  /**
   * Keeps letters and digits; an apostrophe or hyphen survives only between two letters.
   *
   * <p>{@code "--well-known!"} becomes {@code "well-known"}.
   */
  public static String sanitize(String word) {
    if (word == null) return "";
    String trimmed = word.trim();
    if (trimmed.isEmpty()) return "";

    int[] cps = trimmed.codePoints().toArray();
    StringBuilder out = new StringBuilder(trimmed.length());
    for (int i = 0; i < cps.length; i++) {
      int c = cps[i];
      if (Character.isLetterOrDigit(c)) {
        out.appendCodePoint(c);
      } else if ((c == '\'' || c == '-')
          && i > 0
          && i < cps.length - 1
          && Character.isLetter(cps[i - 1])
          && Character.isLetter(cps[i + 1])) {
        out.appendCodePoint(c);
      }
    }
    return out.toString();
  }

  /** At least two characters once trimmed, one of them a letter. */
  public static boolean isValidWord(String word) {
    if (word == null) return false;
    String trimmed = word.trim();
    return trimmed.codePointCount(0, trimmed.length()) >= 2
        && trimmed.codePoints().anyMatch(Character::isLetter);
  }
}
