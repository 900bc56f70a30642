package cafe.woden.spellcafe.text;

import java.util.ArrayList;
import java.util.List;

/** Line splitting shared by the tokenizer and the analyzer. */
public final class TextLines {

  private TextLines() {}

  /**
   * Splits on {@code \n}, dropping one {@code \r} before each break. A trailing newline does not
   * start another line and empty text has no lines.
   */
  public static List<String> split(String text) {
    List<String> out = new ArrayList<>();
    if (text == null || text.isEmpty()) return out;
    int from = 0;
    int len = text.length();
    while (from < len) {
      int nl = text.indexOf('\n', from);
      int end = nl < 0 ? len : nl;
      int stop = end > from && text.charAt(end - 1) == '\r' ? end - 1 : end;
      out.add(text.substring(from, stop));
      if (nl < 0) break;
      from = nl + 1;
    }
    return out;
  }
}
