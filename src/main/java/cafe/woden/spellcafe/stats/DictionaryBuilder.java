package cafe.woden.spellcafe.stats;

import cafe.woden.spellcafe.dictionary.DictionaryException;
import cafe.woden.spellcafe.dictionary.WordListCodec;
import cafe.woden.spellcafe.language.Language;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds a word list from sample text, for seeding a dictionary in a new language. */
public final class DictionaryBuilder {

  private static final Logger log = LoggerFactory.getLogger(DictionaryBuilder.class);

  private DictionaryBuilder() {}

  /** Distinct sanitized words of {@code text} at least {@code minLength} characters long. */
  public static SortedSet<String> build(
      String text, Language language, String filenameHint, int minLength) {
    TreeSet<String> out = new TreeSet<>();
    for (String w : WordExtractor.extract(text, language, filenameHint)) {
      String clean = WordSanitizer.sanitize(w);
      if (!WordSanitizer.isValidWord(clean)) continue;
      if (clean.codePointCount(0, clean.length()) < minLength) continue;
      out.add(clean);
    }
    return Collections.unmodifiableSortedSet(out);
  }

  /** Writes {@code words} as CSV or TXT, chosen by the extension of {@code path}. */
  public static void writeTo(Collection<String> words, Path path) throws DictionaryException {
    WordListCodec.writeWords(words, path);
    log.info("[DictionaryBuilder] wrote {} words to {}", words.size(), path);
  }
}
