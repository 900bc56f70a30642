package cafe.woden.spellcafe.check;

import cafe.woden.spellcafe.language.Language;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Memoized dictionary answers keyed by language code, dictionary revision and looked-up word.
 *
 * <p>The two lookup flags that change a dictionary answer (case sensitivity, code context) are
 * part of the key. The revision keeps a lookup still running against a replaced or mutated
 * dictionary from serving its answers to later lookups. Entries never expire; they are dropped only
 * through {@link #clear}.
 */
@Component
@InfrastructureLayer
public class CorrectnessCache {

  private static final Logger log = LoggerFactory.getLogger(CorrectnessCache.class);

  record Key(
      String languageCode,
      long revision,
      String word,
      boolean caseSensitive,
      boolean codeContext) {}

  private final Cache<Key, Boolean> answers = Caffeine.newBuilder().build();

  public Boolean get(
      Language language, long revision, String word, boolean caseSensitive, boolean codeContext) {
    return answers.getIfPresent(
        new Key(language.code(), revision, word, caseSensitive, codeContext));
  }

  public void put(
      Language language,
      long revision,
      String word,
      boolean caseSensitive,
      boolean codeContext,
      boolean correct) {
    answers.put(new Key(language.code(), revision, word, caseSensitive, codeContext), correct);
  }

  public void clear() {
    long before = answers.estimatedSize();
    answers.invalidateAll();
    log.debug("[CorrectnessCache] cleared ~{} entries", before);
  }

  public void clear(Language language) {
    String code = language.code();
    answers.asMap().keySet().removeIf(k -> k.languageCode().equals(code));
    log.debug("[CorrectnessCache] cleared entries for {}", code);
  }

  public long size() {
    answers.cleanUp();
    return answers.estimatedSize();
  }
}
