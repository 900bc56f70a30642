package cafe.woden.spellcafe.language;

import cafe.woden.spellcafe.config.SpellcheckProperties;
import java.util.List;
import org.jmolecules.architecture.layered.DomainLayer;
import org.springframework.stereotype.Component;

/** Supported languages, the configured default, and detection of a concrete language from text. */
@Component
@DomainLayer
public class LanguageCatalog {

  private static final double MIN_DETECTION_SCORE = 25.0;

  private final Language defaultLanguage;

  public LanguageCatalog(SpellcheckProperties props) {
    SpellcheckProperties p = props != null ? props : SpellcheckProperties.defaults();
    Language configured = Language.custom(p.defaultLanguage());
    this.defaultLanguage = configured.isAutoDetect() ? Language.ENGLISH : configured;
  }

  public List<Language> availableLanguages() {
    return Language.all();
  }

  /** Never {@link Language#AUTO_DETECT}. */
  public Language defaultLanguage() {
    return defaultLanguage;
  }

  /**
   * Best concrete language for {@code text}.
   *
   * <p>Blank text, or a best guess scoring at most 25, yields English.
   */
  public Language detectLanguage(String text) {
    if (text == null || text.isBlank()) return Language.ENGLISH;
    List<LanguageDetector.Score> scores = LanguageDetector.detect(text);
    if (scores.isEmpty()) return Language.ENGLISH;
    LanguageDetector.Score best = scores.get(0);
    return best.score() > MIN_DETECTION_SCORE ? best.language() : Language.ENGLISH;
  }

  /** Replaces {@link Language#AUTO_DETECT} (or null) with a concrete language. */
  public Language resolve(Language requested, String text) {
    if (requested == null) return defaultLanguage;
    if (requested.isAutoDetect()) return detectLanguage(text);
    return requested;
  }
}
