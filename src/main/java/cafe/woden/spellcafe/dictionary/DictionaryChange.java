package cafe.woden.spellcafe.dictionary;

import cafe.woden.spellcafe.language.Language;

/** Emitted on {@link DictionaryManager#changes()} whenever a dictionary's contents move. */
public record DictionaryChange(Language language, Kind kind, String word) {

  public enum Kind {
    LOADED,
    RELOADED,
    IMPORTED,
    WORD_ADDED,
    WORD_REMOVED,
    WORD_IGNORED,
    IGNORED_CLEARED
  }

  public DictionaryChange {
    word = word == null ? "" : word;
  }

  /** True when previously computed correctness answers for the language may be stale. */
  public boolean invalidatesLookups() {
    return kind == Kind.RELOADED
        || kind == Kind.IMPORTED
        || kind == Kind.WORD_REMOVED
        || kind == Kind.IGNORED_CLEARED;
  }
}
