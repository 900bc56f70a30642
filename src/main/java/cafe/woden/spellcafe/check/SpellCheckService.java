package cafe.woden.spellcafe.check;

import cafe.woden.spellcafe.check.api.CheckOptions;
import cafe.woden.spellcafe.check.api.DocumentAnalysis;
import cafe.woden.spellcafe.check.api.SpellCheckPort;
import cafe.woden.spellcafe.check.api.WordListCommandPort;
import cafe.woden.spellcafe.config.ExecutorConfig;
import cafe.woden.spellcafe.config.SpellcheckProperties;
import cafe.woden.spellcafe.dictionary.Dictionary;
import cafe.woden.spellcafe.dictionary.DictionaryChange;
import cafe.woden.spellcafe.dictionary.DictionaryException;
import cafe.woden.spellcafe.dictionary.DictionaryManager;
import cafe.woden.spellcafe.dictionary.WordNormalizer;
import cafe.woden.spellcafe.language.Language;
import cafe.woden.spellcafe.language.LanguageCatalog;
import io.reactivex.rxjava3.disposables.Disposable;
import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Spell-checking facade: owns the active language, the session ignore list and the correctness
 * cache, and forwards word-list mutations to the language's {@link Dictionary}.
 *
 * <p>Analyses run under the read lock; a language switch clears the cache under the write lock so
 * no analysis can observe entries from before the switch.
 */
@Component
@ApplicationLayer
public class SpellCheckService implements SpellCheckPort, WordListCommandPort {

  private static final Logger log = LoggerFactory.getLogger(SpellCheckService.class);

  private final LanguageCatalog catalog;
  private final DictionaryManager dictionaries;
  private final CorrectnessCache cache;
  private final CheckOptions defaultOptions;
  private final DocumentAnalyzer analyzer;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Set<String> sessionIgnored = ConcurrentHashMap.newKeySet();
  private final Disposable changeSubscription;

  private volatile Language activeLanguage;

  public SpellCheckService(
      SpellcheckProperties props,
      LanguageCatalog catalog,
      DictionaryManager dictionaries,
      CorrectnessCache cache,
      @Qualifier(ExecutorConfig.SPELLCHECK_WORKER_EXECUTOR) ExecutorService workerExecutor) {
    SpellcheckProperties p = props != null ? props : SpellcheckProperties.defaults();
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.dictionaries = Objects.requireNonNull(dictionaries, "dictionaries");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.defaultOptions = CheckOptions.from(p);
    this.analyzer =
        new DocumentAnalyzer(
            new CorrectnessResolver(cache),
            SkipPolicy.from(p),
            workerExecutor,
            p.parallelLineThreshold());
    this.activeLanguage = catalog.defaultLanguage();
    this.changeSubscription =
        dictionaries
            .changes()
            .subscribe(
                this::onDictionaryChange,
                err -> log.warn("[SpellCheckService] dictionary change stream failed", err));
  }

  @PreDestroy
  void shutdown() {
    changeSubscription.dispose();
  }

  private void onDictionaryChange(DictionaryChange change) {
    if (!change.invalidatesLookups()) return;
    cache.clear(change.language());
    log.debug(
        "[SpellCheckService] {} {}: dropped cached answers",
        change.language().code(),
        change.kind());
  }

  @Override
  public DocumentAnalysis analyze(
      String text, Language language, String filenameHint, CheckOptions options) {
    CheckOptions opts = options != null ? options : defaultOptions;
    lock.readLock().lock();
    try {
      Language requested = language != null ? language : activeLanguage;
      Language target = catalog.resolve(requested, text);
      Dictionary dictionary;
      try {
        dictionary = dictionaries.getDictionary(target);
      } catch (DictionaryException e) {
        log.warn(
            "[SpellCheckService] no dictionary for {}; returning an empty analysis: {}",
            target.code(),
            e.getMessage());
        return DocumentAnalysis.empty(target, filenameHint);
      }
      return analyzer.analyze(text, dictionary, Set.copyOf(sessionIgnored), filenameHint, opts);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public DocumentAnalysis analyze(String text, String filenameHint) {
    return analyze(text, null, filenameHint, defaultOptions);
  }

  @Override
  public Language activeLanguage() {
    return activeLanguage;
  }

  @Override
  public void setLanguage(Language language) throws DictionaryException {
    Language target = requireConcrete(language);
    if (target.equals(activeLanguage)) return;

    dictionaries.getDictionary(target);
    lock.writeLock().lock();
    try {
      activeLanguage = target;
      cache.clear();
    } finally {
      lock.writeLock().unlock();
    }
    log.info("[SpellCheckService] active language is now {}", target.displayName());
  }

  @Override
  public Language detectLanguage(String text) {
    return catalog.detectLanguage(text);
  }

  @Override
  public void ignoreForSession(String word) {
    String normalized = WordNormalizer.normalize(activeLanguage, word);
    if (normalized.isEmpty()) return;
    sessionIgnored.add(normalized);
  }

  @Override
  public int wordCount(Language language) throws DictionaryException {
    return dictionaryFor(language).wordCount();
  }

  @Override
  public void addWord(String word, Language language) throws DictionaryException {
    Dictionary dictionary = dictionaryFor(language);
    dictionary.addWord(word);
    log.info("[SpellCheckService] added '{}' to {}", word, dictionary.language().code());
  }

  @Override
  public void ignoreWord(String word, Language language) throws DictionaryException {
    Dictionary dictionary = dictionaryFor(language);
    dictionary.ignoreWord(word);
    log.info("[SpellCheckService] ignoring '{}' in {}", word, dictionary.language().code());
  }

  @Override
  public void clearIgnored(Language language) throws DictionaryException {
    dictionaryFor(language).clearIgnored();
  }

  @Override
  public void importDictionary(Path path, Language language) throws DictionaryException {
    Objects.requireNonNull(path, "path");
    Dictionary dictionary = dictionaryFor(language);
    int before = dictionary.wordCount();
    dictionary.importFrom(path);
    log.info(
        "[SpellCheckService] imported {} new words into {} from {}",
        dictionary.wordCount() - before,
        dictionary.language().code(),
        path);
  }

  @Override
  public void exportDictionary(Language language, Path path) throws DictionaryException {
    Objects.requireNonNull(path, "path");
    Dictionary dictionary = dictionaryFor(language);
    dictionary.exportTo(path);
    log.info(
        "[SpellCheckService] exported {} words of {} to {}",
        dictionary.wordCount(),
        dictionary.language().code(),
        path);
  }

  public Set<String> sessionIgnoredWords() {
    return Set.copyOf(sessionIgnored);
  }

  private Dictionary dictionaryFor(Language language) throws DictionaryException {
    return dictionaries.getDictionary(
        language != null ? requireConcrete(language) : activeLanguage);
  }

  private static Language requireConcrete(Language language) {
    Objects.requireNonNull(language, "language");
    if (language.isAutoDetect()) {
      throw new IllegalArgumentException("auto-detect must be resolved to a concrete language");
    }
    return language;
  }
}
