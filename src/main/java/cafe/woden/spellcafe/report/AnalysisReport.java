package cafe.woden.spellcafe.report;

import cafe.woden.spellcafe.check.api.DocumentAnalysis;
import cafe.woden.spellcafe.check.api.WordCheck;
import java.util.List;
import java.util.Locale;

/** Serialized shape of a {@link DocumentAnalysis}. */
public record AnalysisReport(
    String language,
    String languageName,
    String fileType,
    int totalWords,
    int uniqueWords,
    int misspelledWords,
    double accuracy,
    int suggestionsCount,
    int linesChecked,
    long checkDurationMs,
    boolean likelyCode,
    List<Entry> words) {

  public record Entry(
      String word,
      String original,
      int line,
      int column,
      int start,
      int end,
      boolean correct,
      double confidence,
      String wordType,
      List<String> suggestions) {}

  static AnalysisReport of(DocumentAnalysis analysis, boolean misspelledOnly) {
    List<WordCheck> source = misspelledOnly ? analysis.misspelled() : analysis.words();
    List<Entry> entries =
        source.stream()
            .map(
                w ->
                    new Entry(
                        w.normalized(),
                        w.original(),
                        w.line(),
                        w.column(),
                        w.start(),
                        w.end(),
                        w.correct(),
                        w.confidence(),
                        w.category().name().toLowerCase(Locale.ROOT),
                        w.suggestions()))
            .toList();
    return new AnalysisReport(
        analysis.language().code(),
        analysis.language().displayName(),
        analysis.fileType(),
        analysis.totalWords(),
        analysis.uniqueWords(),
        analysis.misspelledWords(),
        analysis.accuracy(),
        analysis.suggestionsCount(),
        analysis.linesChecked(),
        analysis.checkDuration().toMillis(),
        analysis.likelyCode(),
        entries);
  }
}
