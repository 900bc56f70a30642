package cafe.woden.spellcafe.dictionary;

import cafe.woden.spellcafe.language.Language;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes word lists in {@link WordListFormat#CSV} and {@link WordListFormat#TXT} form.
 *
 * <p>Parsed lines are normalized in parallel; the resulting set carries no order.
 */
public final class WordListCodec {

  private static final Logger log = LoggerFactory.getLogger(WordListCodec.class);

  /** Lines starting with this are comments in every list this codec reads. */
  public static final String COMMENT_PREFIX = "#";

  private static final CsvMapper CSV = new CsvMapper();
  private static final CsvSchema WORD_ROW_SCHEMA = CSV.schemaFor(WordRow.class).withoutHeader();

  private WordListCodec() {}

  /** Single-column CSV record. */
  public record WordRow(String word) {}

  /**
   * Reads the words in {@code path}, normalized for {@code language}, dropping blanks, comment
   * lines and words shorter than {@code minWordLength}.
   */
  public static Set<String> readWords(Path path, Language language, int minWordLength)
      throws DictionaryException {
    WordListFormat format = WordListFormat.forPath(path);
    String content = stripBom(readText(path));
    List<String> raw = format == WordListFormat.CSV ? firstColumn(content, path) : lines(content);
    return raw.parallelStream()
        .filter(line -> !line.startsWith(COMMENT_PREFIX))
        .map(line -> WordNormalizer.normalize(language, line))
        .filter(word -> !word.isEmpty() && word.indexOf('\uFFFD') < 0)
        .filter(word -> WordNormalizer.length(word) >= minWordLength)
        .collect(Collectors.toSet());
  }

  /** Writes {@code words} sorted, in the format implied by {@code path}'s extension. */
  public static void writeWords(Collection<String> words, Path path) throws DictionaryException {
    WordListFormat format = WordListFormat.forPath(path);
    TreeSet<String> sorted = new TreeSet<>();
    for (String w : words) {
      if (w != null && !w.isBlank()) sorted.add(w);
    }
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
        if (format == WordListFormat.CSV) {
          List<WordRow> rows = new ArrayList<>(sorted.size());
          for (String w : sorted) rows.add(new WordRow(w));
          CSV.writer(WORD_ROW_SCHEMA).writeValues(out).writeAll(rows).close();
        } else {
          for (String w : sorted) {
            out.write(w);
            out.write('\n');
          }
        }
      }
    } catch (IOException e) {
      throw new DictionaryException(
          DictionaryException.Kind.IO, "Could not write word list " + path, e);
    }
  }

  /**
   * Decodes {@code path} as UTF-8, retrying leniently (malformed bytes replaced) before giving up.
   */
  static String readText(Path path) throws DictionaryException {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new DictionaryException(
          DictionaryException.Kind.IO, "Could not read word list " + path, e);
    }
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      log.warn("[WordListCodec] {} is not valid UTF-8; decoding leniently", path);
    }

    String lenient = new String(bytes, StandardCharsets.UTF_8);
    boolean usable =
        lines(lenient).stream().anyMatch(line -> !line.isBlank() && line.indexOf('\uFFFD') < 0);
    if (!usable) {
      throw new DictionaryException(
          DictionaryException.Kind.INVALID_ENCODING, "Undecodable word list " + path);
    }
    return lenient;
  }

  private static String stripBom(String content) {
    return content.startsWith("\uFEFF") ? content.substring(1) : content;
  }

  private static List<String> lines(String content) {
    return content.lines().map(String::trim).collect(Collectors.toList());
  }

  private static List<String> firstColumn(String content, Path path) throws DictionaryException {
    List<String> out = new ArrayList<>();
    try (MappingIterator<String[]> rows =
        CSV.readerFor(String[].class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY)
            .with(CsvParser.Feature.SKIP_EMPTY_LINES)
            .with(CsvParser.Feature.TRIM_SPACES)
            .readValues(content)) {
      while (rows.hasNextValue()) {
        String[] row = rows.nextValue();
        if (row == null || row.length == 0 || row[0] == null) continue;
        out.add(row[0].trim());
      }
    } catch (IOException | RuntimeException e) {
      throw new DictionaryException(
          DictionaryException.Kind.IO, "Malformed CSV word list " + path, e);
    }
    return out;
  }
}
