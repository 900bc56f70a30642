package cafe.woden.spellcafe.text;

import java.util.List;

/** Tells whether a token opens a sentence, so sentence-initial capitals are not taken for names. */
public final class SentenceBoundaries {

  private SentenceBoundaries() {}

  /**
   * True when line {@code index} begins a sentence: it is the first non-blank line, or the
   * previous line is blank or ends with terminal punctuation.
   */
  public static boolean lineOpensSentence(List<String> lines, int index) {
    if (index <= 0) return true;
    String previous = lines.get(index - 1).strip();
    if (previous.isEmpty()) return true;
    return isTerminal(previous.charAt(previous.length() - 1));
  }

  /** True when the text between the previous token and {@code start} closes a sentence. */
  public static boolean gapClosesSentence(String line, int from, int start) {
    for (int i = Math.max(0, from); i < start && i < line.length(); i++) {
      if (isTerminal(line.charAt(i))) return true;
    }
    return false;
  }

  private static boolean isTerminal(char c) {
    return c == '.' || c == '!' || c == '?' || c == '\u3002';
  }
}
