package cafe.woden.spellcafe.dictionary;

import cafe.woden.spellcafe.language.Language;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Word set for one language: the base list plus user-added and ignored words.
 *
 * <p>All stored words are normalized with {@link WordNormalizer}. Word sets are immutable
 * snapshots swapped on mutation, so lookups never lock; mutations are serialized on this instance
 * and each one rewrites the matching user-scope file.
 *
 * <p>{@link #revision()} changes whenever a mutation can turn a known word unknown, and is unique
 * across instances, so answers memoized against one revision are never read against another.
 */
public class Dictionary {

  private static final Logger log = LoggerFactory.getLogger(Dictionary.class);

  private static final AtomicLong REVISIONS = new AtomicLong();

  private final Language language;
  private final Language fallbackLanguage;
  private final int minWordLength;
  private final DictionaryLocator locator;
  private final UserWordStore store;
  private final Consumer<DictionaryChange> changeSink;

  private volatile Set<String> baseWords = Set.of();
  private volatile Set<String> userWords = Set.of();
  private volatile Set<String> ignoredWords = Set.of();
  private volatile Set<String> allWords = Set.of();
  private volatile long revision = REVISIONS.incrementAndGet();
  private volatile boolean loaded;
  private volatile Path loadedFrom;

  public Dictionary(
      Language language,
      Language fallbackLanguage,
      int minWordLength,
      DictionaryLocator locator,
      UserWordStore store,
      Consumer<DictionaryChange> changeSink) {
    this.language = Objects.requireNonNull(language, "language");
    if (language.isAutoDetect()) {
      throw new IllegalArgumentException(
          "auto-detect must be resolved before creating a dictionary");
    }
    this.fallbackLanguage = fallbackLanguage != null ? fallbackLanguage : Language.ENGLISH;
    this.minWordLength = Math.max(1, minWordLength);
    this.locator = Objects.requireNonNull(locator, "locator");
    this.store = Objects.requireNonNull(store, "store");
    this.changeSink = changeSink != null ? changeSink : change -> {};
  }

  /**
   * Loads the base list and merges the user-scope lists. No-op once loaded.
   *
   * <p>Falls back to the default language's list when this language has none.
   */
  public synchronized void load() throws DictionaryException {
    if (loaded) return;

    Optional<Path> path = locator.locate(language);
    if (path.isEmpty() && !language.equals(fallbackLanguage)) {
      path = locator.locate(fallbackLanguage);
      path.ifPresent(
          p ->
              log.warn(
                  "[Dictionary] no word list for {}; falling back to {} ({})",
                  language.displayName(),
                  fallbackLanguage.displayName(),
                  p));
    }
    if (path.isEmpty()) {
      throw new DictionaryException(
          DictionaryException.Kind.DICTIONARY_NOT_FOUND,
          "Could not load dictionary for " + language.displayName());
    }

    loadFile(path.get());
    mergeUserLists();
    loaded = true;
    if (baseWords.isEmpty()) {
      log.warn(
          "[Dictionary] {}: {} contains no usable words",
          DictionaryException.Kind.EMPTY_DICTIONARY,
          path.get());
    }
    changeSink.accept(new DictionaryChange(language, DictionaryChange.Kind.LOADED, null));
  }

  /** Adds every word of {@code path} to the base list. */
  public synchronized void loadFile(Path path) throws DictionaryException {
    Set<String> parsed = WordListCodec.readWords(path, language, minWordLength);
    HashSet<String> merged = new HashSet<>(baseWords);
    merged.addAll(parsed);
    baseWords = Set.copyOf(merged);
    refreshAllWords();
    revision = REVISIONS.incrementAndGet();
    loadedFrom = path;
    log.debug("[Dictionary] {} words from {} for {}", parsed.size(), path, language.code());
  }

  private void mergeUserLists() {
    try {
      userWords = Set.copyOf(store.load(language, UserWordStore.ListKind.ADDED));
      refreshAllWords();
    } catch (DictionaryException e) {
      log.warn("[Dictionary] could not read user words for {}", language.code(), e);
    }
    try {
      HashSet<String> ignored = new HashSet<>(store.load(language, UserWordStore.ListKind.IGNORED));
      // A word both added and ignored counts as added.
      ignored.removeAll(userWords);
      ignoredWords = Set.copyOf(ignored);
    } catch (DictionaryException e) {
      log.warn("[Dictionary] could not read ignored words for {}", language.code(), e);
    }
  }

  /**
   * True when {@code word} should not be flagged.
   *
   * <p>Empty or too-short input, ignored words, numeric-heavy tokens and (in code context) tokens
   * shaped like identifiers are accepted without a lookup.
   */
  public boolean contains(String word, boolean caseSensitive, boolean codeContext) {
    if (word == null) return true;
    String trimmed = word.trim();
    if (trimmed.isEmpty() || WordNormalizer.length(trimmed) < minWordLength) return true;

    String normalized = WordNormalizer.normalize(language, trimmed);
    if (ignoredWords.contains(normalized)) return true;
    if (!language.isCjk() && isNumericHeavy(trimmed)) return true;
    if (codeContext && CodeIdentifierShape.matches(trimmed)) return true;

    if (caseSensitive) {
      return baseWords.contains(trimmed) || userWords.contains(trimmed);
    }
    return baseWords.contains(normalized) || userWords.contains(normalized);
  }

  /** Membership in the base or user list only, with no skip rules. */
  public boolean isKnown(String normalizedWord) {
    return baseWords.contains(normalizedWord) || userWords.contains(normalizedWord);
  }

  public boolean isUserWord(String normalizedWord) {
    return userWords.contains(normalizedWord);
  }

  public boolean isIgnored(String normalizedWord) {
    return ignoredWords.contains(normalizedWord);
  }

  /**
   * Adds {@code word} to the user list and persists it.
   *
   * <p>If persisting fails the word stays usable for this session and the failure is rethrown.
   */
  public void addWord(String word) throws DictionaryException {
    String normalized = requireValidWord(word);
    synchronized (this) {
      HashSet<String> added = new HashSet<>(userWords);
      added.add(normalized);
      userWords = Set.copyOf(added);
      refreshAllWords();
      if (ignoredWords.contains(normalized)) {
        HashSet<String> ignored = new HashSet<>(ignoredWords);
        ignored.remove(normalized);
        ignoredWords = Set.copyOf(ignored);
      }
      changeSink.accept(
          new DictionaryChange(language, DictionaryChange.Kind.WORD_ADDED, normalized));
      store.save(language, UserWordStore.ListKind.ADDED, userWords);
      store.save(language, UserWordStore.ListKind.IGNORED, ignoredWords);
    }
  }

  /** Adds {@code word} to the persisted ignore list, persisting like {@link #addWord}. */
  public void ignoreWord(String word) throws DictionaryException {
    String normalized = requireValidWord(word);
    synchronized (this) {
      HashSet<String> ignored = new HashSet<>(ignoredWords);
      ignored.add(normalized);
      ignoredWords = Set.copyOf(ignored);
      changeSink.accept(
          new DictionaryChange(language, DictionaryChange.Kind.WORD_IGNORED, normalized));
      store.save(language, UserWordStore.ListKind.IGNORED, ignoredWords);
    }
  }

  public synchronized void clearIgnored() throws DictionaryException {
    ignoredWords = Set.of();
    revision = REVISIONS.incrementAndGet();
    changeSink.accept(new DictionaryChange(language, DictionaryChange.Kind.IGNORED_CLEARED, null));
    store.save(language, UserWordStore.ListKind.IGNORED, ignoredWords);
  }

  /** Removes {@code word} from the base and user lists; true if it was present in either. */
  public boolean removeWord(String word) throws DictionaryException {
    String normalized = WordNormalizer.normalize(language, word);
    if (normalized.isEmpty()) return false;
    synchronized (this) {
      boolean inBase = baseWords.contains(normalized);
      boolean inUser = userWords.contains(normalized);
      if (!inBase && !inUser) return false;
      if (inBase) {
        HashSet<String> base = new HashSet<>(baseWords);
        base.remove(normalized);
        baseWords = Set.copyOf(base);
      }
      if (inUser) {
        HashSet<String> user = new HashSet<>(userWords);
        user.remove(normalized);
        userWords = Set.copyOf(user);
      }
      refreshAllWords();
      revision = REVISIONS.incrementAndGet();
      changeSink.accept(
          new DictionaryChange(language, DictionaryChange.Kind.WORD_REMOVED, normalized));
      if (inUser) {
        store.save(language, UserWordStore.ListKind.ADDED, userWords);
      }
      return true;
    }
  }

  /** Writes the base and user words to {@code path} ({@code .csv} or {@code .txt}). */
  public void exportTo(Path path) throws DictionaryException {
    WordListCodec.writeWords(words(), path);
  }

  /** Merges the words of {@code path} into the base list and marks this dictionary loaded. */
  public synchronized void importFrom(Path path) throws DictionaryException {
    WordListFormat.forPath(path);
    loadFile(path);
    loaded = true;
    changeSink.accept(new DictionaryChange(language, DictionaryChange.Kind.IMPORTED, null));
  }

  /** Snapshot of base and user words. */
  public Set<String> words() {
    return allWords;
  }

  /** Identifies the word sets lookups currently see; see the class comment. */
  public long revision() {
    return revision;
  }

  public Set<String> userWords() {
    return userWords;
  }

  public Set<String> ignoredWords() {
    return ignoredWords;
  }

  public int wordCount() {
    return allWords.size();
  }

  public Language language() {
    return language;
  }

  public int minWordLength() {
    return minWordLength;
  }

  public boolean isLoaded() {
    return loaded;
  }

  public Optional<Path> loadedFrom() {
    return Optional.ofNullable(loadedFrom);
  }

  // Callers hold the monitor.
  private void refreshAllWords() {
    Set<String> base = baseWords;
    Set<String> user = userWords;
    if (user.isEmpty()) {
      allWords = base;
      return;
    }
    HashSet<String> merged = new HashSet<>(base);
    merged.addAll(user);
    allWords = Set.copyOf(merged);
  }

  private String requireValidWord(String word) throws DictionaryException {
    String normalized = WordNormalizer.normalize(language, word);
    if (normalized.isEmpty() || WordNormalizer.length(normalized) < minWordLength) {
      throw new DictionaryException(
          DictionaryException.Kind.INVALID_WORD, "Invalid word: '" + word + "'");
    }
    // Word lists treat '#' lines as comments, so such a word would not survive a reload.
    if (normalized.startsWith(WordListCodec.COMMENT_PREFIX)) {
      throw new DictionaryException(
          DictionaryException.Kind.INVALID_WORD, "Words may not start with '#': '" + word + "'");
    }
    return normalized;
  }

  /** A digit is present and fewer than three letters. */
  static boolean isNumericHeavy(String word) {
    boolean digit = false;
    int letters = 0;
    for (int i = 0; i < word.length(); ) {
      int cp = word.codePointAt(i);
      i += Character.charCount(cp);
      if (Character.isDigit(cp)) digit = true;
      else if (Character.isLetter(cp)) letters++;
    }
    return digit && letters < 3;
  }
}
