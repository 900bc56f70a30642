package cafe.woden.spellcafe.check.api;

import cafe.woden.spellcafe.text.WordCategory;
import java.util.List;

/**
 * Result for one token.
 *
 * <p>{@code start}/{@code end} are 0-based char offsets within the line; {@code line} and {@code
 * column} are 1-based. Skipped tokens are reported correct with confidence 1.0 and do not count
 * toward document totals.
 */
public record WordCheck(
    String original,
    String normalized,
    int start,
    int end,
    int line,
    int column,
    boolean correct,
    double confidence,
    WordCategory category,
    List<String> suggestions,
    boolean skipped) {

  public WordCheck {
    if (original == null) original = "";
    if (normalized == null) normalized = "";
    if (category == null) category = WordCategory.NORMAL;
    suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
  }

  public static WordCheck skipped(
      String original, int start, int end, int line, WordCategory category) {
    return new WordCheck(
        original, original, start, end, line, start + 1, true, 1.0, category, List.of(), true);
  }

  public boolean misspelled() {
    return !correct;
  }
}
