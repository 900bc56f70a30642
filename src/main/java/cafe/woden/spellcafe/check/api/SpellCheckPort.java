package cafe.woden.spellcafe.check.api;

import cafe.woden.spellcafe.dictionary.DictionaryException;
import cafe.woden.spellcafe.language.Language;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** Read-side entry point: checks text and manages the active language. */
@ApplicationLayer
public interface SpellCheckPort {

  /**
   * Checks {@code text}. {@link Language#AUTO_DETECT} is resolved from the text; null means the
   * active language. Never throws for malformed text.
   */
  DocumentAnalysis analyze(
      String text, Language language, String filenameHint, CheckOptions options);

  /** Checks {@code text} with the active language and configured options. */
  DocumentAnalysis analyze(String text, String filenameHint);

  Language activeLanguage();

  /**
   * Switches the active language once its dictionary is loaded; cached correctness answers are
   * dropped.
   *
   * @throws IllegalArgumentException for {@link Language#AUTO_DETECT}
   */
  void setLanguage(Language language) throws DictionaryException;

  Language detectLanguage(String text);

  /** Accepts {@code word} for the rest of this process without persisting it. */
  void ignoreForSession(String word);

  int wordCount(Language language) throws DictionaryException;
}
