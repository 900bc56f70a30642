package cafe.woden.spellcafe.dictionary;

import cafe.woden.spellcafe.config.SpellcheckProperties;
import cafe.woden.spellcafe.language.Language;
import cafe.woden.spellcafe.language.LanguageCatalog;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import jakarta.annotation.PostConstruct;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds at most one loaded {@link Dictionary} per language.
 *
 * <p>Loads are atomic per key: concurrent callers asking for the same language wait on a single
 * load and then share the instance.
 */
@Component
@ApplicationLayer
public class DictionaryManager {

  private static final Logger log = LoggerFactory.getLogger(DictionaryManager.class);

  private final LanguageCatalog catalog;
  private final DictionaryLocator locator;
  private final UserWordStore store;
  private final int minWordLength;

  private final Cache<Language, Dictionary> dictionaries = Caffeine.newBuilder().build();

  private final FlowableProcessor<DictionaryChange> changes =
      PublishProcessor.<DictionaryChange>create().toSerialized();

  public DictionaryManager(
      SpellcheckProperties props,
      LanguageCatalog catalog,
      DictionaryLocator locator,
      UserWordStore store) {
    SpellcheckProperties p = props != null ? props : SpellcheckProperties.defaults();
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.locator = Objects.requireNonNull(locator, "locator");
    this.store = Objects.requireNonNull(store, "store");
    this.minWordLength = p.minWordLength();
  }

  public Flowable<DictionaryChange> changes() {
    return changes.onBackpressureBuffer();
  }

  @PostConstruct
  void warmDefaultLanguage() {
    Language language = catalog.defaultLanguage();
    try {
      Dictionary d = getDictionary(language);
      log.info(
          "[DictionaryManager] {} dictionary ready: {} words", language.code(), d.wordCount());
    } catch (DictionaryException e) {
      log.warn(
          "[DictionaryManager] could not warm the {} dictionary: {}",
          language.code(),
          e.getMessage());
    }
  }

  /**
   * Returns the cached dictionary for {@code language}, loading it first if needed.
   *
   * @throws IllegalArgumentException for {@link Language#AUTO_DETECT}
   */
  public Dictionary getDictionary(Language language) throws DictionaryException {
    requireConcrete(language);
    try {
      return dictionaries.get(language, this::loadUnchecked);
    } catch (LoadFailure e) {
      throw e.getCause();
    }
  }

  /** The cached dictionary, without triggering a load. */
  public Optional<Dictionary> cachedDictionary(Language language) {
    if (language == null) return Optional.empty();
    return Optional.ofNullable(dictionaries.getIfPresent(language));
  }

  /** Discards the cached instance and loads a fresh one from disk. */
  public Dictionary reloadDictionary(Language language) throws DictionaryException {
    requireConcrete(language);
    Dictionary fresh = newDictionary(language);
    fresh.load();
    dictionaries.put(language, fresh);
    log.debug("[DictionaryManager] reloaded {}", language.code());
    changes.onNext(new DictionaryChange(language, DictionaryChange.Kind.RELOADED, null));
    return fresh;
  }

  /**
   * Uses {@code path} as the base list for {@code language} from now on and replaces any cached
   * dictionary with one loaded from it.
   */
  public Dictionary registerCustomDictionary(Path path, Language language)
      throws DictionaryException {
    requireConcrete(language);
    Objects.requireNonNull(path, "path");
    WordListFormat.forPath(path);
    if (!Files.isRegularFile(path)) {
      throw new DictionaryException(
          DictionaryException.Kind.IO, "Dictionary file does not exist: " + path);
    }
    locator.pin(language, path);
    log.info("[DictionaryManager] using {} for {}", path, language.displayName());
    return reloadDictionary(language);
  }

  /** Built-in languages plus any language with a word list on disk. */
  public List<Language> availableLanguages() {
    List<Language> out = new ArrayList<>(catalog.availableLanguages());
    for (Language l : locator.languagesOnDisk()) {
      if (!out.contains(l)) out.add(l);
    }
    return List.copyOf(out);
  }

  public Language defaultLanguage() {
    return catalog.defaultLanguage();
  }

  private Dictionary loadUnchecked(Language language) {
    Dictionary d = newDictionary(language);
    try {
      d.load();
    } catch (DictionaryException e) {
      throw new LoadFailure(e);
    }
    return d;
  }

  private Dictionary newDictionary(Language language) {
    return new Dictionary(
        language, catalog.defaultLanguage(), minWordLength, locator, store, changes::onNext);
  }

  private static void requireConcrete(Language language) {
    Objects.requireNonNull(language, "language");
    if (language.isAutoDetect()) {
      throw new IllegalArgumentException("auto-detect is not a dictionary language");
    }
  }

  /** Carries a checked load failure out of the cache's mapping function. */
  private static final class LoadFailure extends RuntimeException {
    LoadFailure(DictionaryException cause) {
      super(cause);
    }

    @Override
    public synchronized DictionaryException getCause() {
      return (DictionaryException) super.getCause();
    }
  }
}
