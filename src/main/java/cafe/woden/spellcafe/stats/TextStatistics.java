package cafe.woden.spellcafe.stats;

import cafe.woden.spellcafe.language.Language;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Word counts and reading time for a document. */
public final class TextStatistics {

  static final int WORDS_PER_MINUTE = 200;

  public record WordCount(String word, int count) {}

  public record ReadingTime(int minutes, int seconds) {}

  private TextStatistics() {}

  /** Occurrences of each normalized word. */
  public static Map<String, Integer> wordFrequency(
      String text, Language language, String filename) {
    Map<String, Integer> freq = new HashMap<>();
    for (String w : WordExtractor.extract(text, language, filename)) {
      freq.merge(w, 1, Integer::sum);
    }
    return freq;
  }

  /** The {@code n} most frequent words, by count descending then word ascending. */
  public static List<WordCount> mostCommonWords(Map<String, Integer> frequency, int n) {
    if (frequency == null || n <= 0) return List.of();
    List<WordCount> all = new ArrayList<>(frequency.size());
    frequency.forEach((w, c) -> all.add(new WordCount(w, c)));
    all.sort(
        Comparator.comparingInt(WordCount::count).reversed().thenComparing(WordCount::word));
    return List.copyOf(all.subList(0, Math.min(n, all.size())));
  }

  /** Time to read {@code text} at 200 words per minute, truncated to whole seconds. */
  public static ReadingTime readingTime(String text) {
    int words = WordExtractor.extractProse(text).size();
    int minutes = words / WORDS_PER_MINUTE;
    int seconds = (words % WORDS_PER_MINUTE) * 60 / WORDS_PER_MINUTE;
    return new ReadingTime(minutes, seconds);
  }

  /** Rounded percentage, 100 when {@code total} is zero. */
  public static double accuracy(int correct, int total) {
    if (total <= 0) return 100.0;
    return Math.round(correct * 100.0 / total);
  }
}
