package cafe.woden.spellcafe.dictionary;

import java.nio.file.Path;
import java.util.Locale;

/** On-disk word list formats, chosen by file extension. */
public enum WordListFormat {
  /** First column of each record is the word. */
  CSV(".csv"),
  /** One word per line. */
  TXT(".txt");

  private final String extension;

  WordListFormat(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }

  public static WordListFormat forPath(Path path) throws DictionaryException {
    Path name = path == null ? null : path.getFileName();
    String file = name == null ? "" : name.toString().toLowerCase(Locale.ROOT);
    for (WordListFormat format : values()) {
      if (file.endsWith(format.extension)) return format;
    }
    throw new DictionaryException(
        DictionaryException.Kind.UNSUPPORTED_FORMAT,
        "Unsupported word list format: " + (name == null ? "<none>" : name));
  }
}
