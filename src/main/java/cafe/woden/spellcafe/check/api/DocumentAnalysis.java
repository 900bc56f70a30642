package cafe.woden.spellcafe.check.api;

import cafe.woden.spellcafe.language.Language;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Whole-document result. {@code words} is in document order (line, then position).
 *
 * <p>{@code fileType} is the caller's filename hint, or null when none was given.
 */
public record DocumentAnalysis(
    int totalWords,
    int misspelledWords,
    double accuracy,
    List<WordCheck> words,
    int suggestionsCount,
    Language language,
    int linesChecked,
    Duration checkDuration,
    boolean likelyCode,
    String fileType) {

  public DocumentAnalysis {
    words = words == null ? List.of() : List.copyOf(words);
    if (checkDuration == null) checkDuration = Duration.ZERO;
    if (language == null) language = Language.ENGLISH;
  }

  /** Zero totals and 100% accuracy; used when no dictionary is available. */
  public static DocumentAnalysis empty(Language language, String fileType) {
    return new DocumentAnalysis(
        0, 0, 100.0, List.of(), 0, language, 0, Duration.ZERO, false, fileType);
  }

  /** Rounded percentage of correct words, or 100 when nothing was counted. */
  public static double accuracyOf(int total, int misspelled) {
    if (total <= 0) return 100.0;
    return Math.round((total - misspelled) * 100.0 / total);
  }

  public List<WordCheck> misspelled() {
    return words.stream().filter(WordCheck::misspelled).collect(Collectors.toList());
  }

  /** Distinct normalized forms among the counted (non-skipped) words. */
  public int uniqueWords() {
    Set<String> seen = new HashSet<>();
    for (WordCheck w : words) {
      if (!w.skipped()) seen.add(w.normalized());
    }
    return seen.size();
  }

  public Optional<String> fileTypeHint() {
    return Optional.ofNullable(fileType);
  }
}
