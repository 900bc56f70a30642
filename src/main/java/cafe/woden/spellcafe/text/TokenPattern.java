package cafe.woden.spellcafe.text;

import java.util.regex.Pattern;

/** The three word shapes the tokenizer can extract. */
public enum TokenPattern {
  /** Unicode letter runs with embedded apostrophes or hyphens. */
  PROSE(Pattern.compile("\\b\\p{L}[\\p{L}'-]*\\b", Pattern.UNICODE_CHARACTER_CLASS)),

  /** Han/kana/Hangul runs, or letter runs as in {@link #PROSE}. */
  CJK(
      Pattern.compile(
          "[\\p{IsHan}\\p{IsHiragana}\\p{IsKatakana}\\p{IsHangul}]+|\\p{L}[\\p{L}'-]*",
          Pattern.UNICODE_CHARACTER_CLASS)),

  /**
   * ASCII identifiers of three or more chars. Underscores and digits stay inside the token so
   * {@code get_value_t} is seen whole.
   */
  CODE(Pattern.compile("\\b[a-zA-Z][a-zA-Z0-9_'-]{2,}\\b"));

  private final Pattern pattern;

  TokenPattern(Pattern pattern) {
    this.pattern = pattern;
  }

  public Pattern pattern() {
    return pattern;
  }
}
