package cafe.woden.spellcafe.report;

import cafe.woden.spellcafe.check.api.DocumentAnalysis;
import cafe.woden.spellcafe.check.api.WordCheck;
import cafe.woden.spellcafe.language.Language;
import cafe.woden.spellcafe.stats.TextStatistics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Renders analyses as pretty JSON (snake_case keys) or as a plain-text summary. */
@Component
public class AnalysisReportWriter {

  private static final ObjectMapper JSON =
      new ObjectMapper()
          .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
          .enable(SerializationFeature.INDENT_OUTPUT);

  private static final String RULE = "-".repeat(50);

  public String toJson(DocumentAnalysis analysis) {
    return toJson(analysis, false);
  }

  /** With {@code misspelledOnly}, the {@code words} array lists flagged words only. */
  public String toJson(DocumentAnalysis analysis, boolean misspelledOnly) {
    try {
      return JSON.writeValueAsString(AnalysisReport.of(analysis, misspelledOnly));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not render analysis as JSON", e);
    }
  }

  public void writeJson(DocumentAnalysis analysis, Path out) throws IOException {
    Path parent = out.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
    Files.writeString(out, toJson(analysis), StandardCharsets.UTF_8);
  }

  /** Totals, accuracy, and one line per flagged word with its suggestions. */
  public String summary(DocumentAnalysis analysis, String title) {
    StringBuilder sb = new StringBuilder();
    if (title != null && !title.isBlank()) {
      sb.append("Checking '")
          .append(title)
          .append("' in ")
          .append(analysis.language().displayName())
          .append('\n')
          .append(RULE)
          .append('\n');
    }
    sb.append("Total words: ").append(analysis.totalWords()).append('\n');
    sb.append("Unique words: ").append(analysis.uniqueWords()).append('\n');
    sb.append("Misspelled: ").append(analysis.misspelledWords()).append('\n');
    sb.append(String.format(Locale.ROOT, "Accuracy: %.1f%%\n", analysis.accuracy()));
    sb.append("Check time: ").append(analysis.checkDuration().toMillis()).append("ms\n");

    List<WordCheck> flagged = analysis.misspelled();
    if (flagged.isEmpty()) {
      sb.append("No spelling errors found.\n");
      return sb.toString();
    }
    sb.append("Errors found:\n");
    for (WordCheck w : flagged) {
      sb.append("  Line ")
          .append(w.line())
          .append(':')
          .append(w.column())
          .append(" '")
          .append(w.original())
          .append('\'');
      if (!w.suggestions().isEmpty()) {
        sb.append(" -> ").append(String.join(", ", w.suggestions()));
      }
      sb.append('\n');
    }
    sb.append("Total errors: ").append(analysis.misspelledWords()).append('\n');
    return sb.toString();
  }

  /** Reading time and the {@code top} most frequent words of {@code text}. */
  public String statistics(String text, Language language, String filenameHint, int top) {
    TextStatistics.ReadingTime time = TextStatistics.readingTime(text);
    Map<String, Integer> freq = TextStatistics.wordFrequency(text, language, filenameHint);
    StringBuilder sb = new StringBuilder();
    sb.append("Reading time: ")
        .append(time.minutes())
        .append(" min ")
        .append(time.seconds())
        .append(" sec\n");
    sb.append("Unique words: ").append(freq.size()).append('\n');
    sb.append("Most common words:\n");
    for (TextStatistics.WordCount wc : TextStatistics.mostCommonWords(freq, top)) {
      sb.append("  ").append(wc.word()).append(": ").append(wc.count()).append('\n');
    }
    return sb.toString();
  }
}
