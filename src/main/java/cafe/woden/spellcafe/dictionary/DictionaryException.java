package cafe.woden.spellcafe.dictionary;

import java.util.Objects;

/** Failure while loading, mutating, importing or exporting a word list. */
public class DictionaryException extends Exception {

  public enum Kind {
    /** File missing, unreadable or unwritable. */
    IO,
    /** No base list for the language and no fallback available. */
    DICTIONARY_NOT_FOUND,
    /** Loaded, but no usable words. */
    EMPTY_DICTIONARY,
    /** Content could not be decoded, even leniently. */
    INVALID_ENCODING,
    /** Neither {@code .csv} nor {@code .txt}. */
    UNSUPPORTED_FORMAT,
    /** Empty or too-short word after normalization. */
    INVALID_WORD
  }

  private final Kind kind;

  public DictionaryException(Kind kind, String message) {
    this(kind, message, null);
  }

  public DictionaryException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public Kind kind() {
    return kind;
  }
}
