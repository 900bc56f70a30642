package cafe.woden.spellcafe.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spell-checker configuration.
 *
 * <p>Stored under {@code spellcafe}. Every field is optional; missing values fall back to the
 * defaults below.
 */
@ConfigurationProperties(prefix = "spellcafe")
public record SpellcheckProperties(
    /** Language code used when nothing else is requested. Default: {@code eng}. */
    String defaultLanguage,

    /** If true (default), misspelled words carry correction suggestions. */
    Boolean suggestionsEnabled,

    /** If true, dictionary membership is tested on the raw token. Default: false. */
    Boolean caseSensitive,

    /** Upper bound on suggestions per word. Default: 5. */
    Integer maxSuggestions,

    /**
     * Minimum confidence for a dictionary miss to count as misspelled. Default: 0.7.
     *
     * <p>Values outside {@code [0, 1]} are clamped.
     */
    Double confidenceThreshold,

    /** Words shorter than this are never flagged. Default: 1. */
    Integer minWordLength,

    /** Directories searched, in order, for {@code dictionary(<code>).csv|txt}. */
    List<String> dictionaryDirs,

    /** Root for per-user word lists. Default: {@code ${user.home}/.local/share/spellcafe}. */
    String userDataDir,

    /** Acronyms that are always reported correct. */
    List<String> commonAcronyms,

    /** Capitalized names that are always reported correct. */
    List<String> properNouns,

    /**
     * Documents with more lines than this are analysed on the worker pool.
     *
     * <p>{@code <= 0} keeps analysis on the calling thread.
     */
    Integer parallelLineThreshold) {

  public static final String DEFAULT_LANGUAGE = "eng";
  public static final int DEFAULT_MAX_SUGGESTIONS = 5;
  public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;
  public static final List<String> DEFAULT_DICTIONARY_DIRS =
      List.of("src/dictionary", "dictionary", ".");
  public static final List<String> DEFAULT_COMMON_ACRONYMS =
      List.of(
          "API", "HTTP", "HTTPS", "URL", "URI", "HTML", "CSS", "JS", "TS", "JSON", "XML", "SQL",
          "NoSQL", "CPU", "GPU", "RAM", "ROM", "USB", "SSD", "HDD", "LAN", "WAN", "VPN", "DNS",
          "IP", "TCP", "UDP");

  public SpellcheckProperties {
    if (defaultLanguage == null || defaultLanguage.isBlank()) defaultLanguage = DEFAULT_LANGUAGE;
    if (suggestionsEnabled == null) suggestionsEnabled = Boolean.TRUE;
    if (caseSensitive == null) caseSensitive = Boolean.FALSE;
    if (maxSuggestions == null || maxSuggestions < 0) maxSuggestions = DEFAULT_MAX_SUGGESTIONS;
    if (confidenceThreshold == null || confidenceThreshold.isNaN()) {
      confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
    }
    confidenceThreshold = Math.max(0.0, Math.min(1.0, confidenceThreshold));
    if (minWordLength == null || minWordLength < 1) minWordLength = 1;
    if (dictionaryDirs == null || dictionaryDirs.isEmpty()) {
      dictionaryDirs = DEFAULT_DICTIONARY_DIRS;
    }
    if (userDataDir == null || userDataDir.isBlank()) {
      userDataDir = System.getProperty("user.home", ".") + "/.local/share/spellcafe";
    }
    if (commonAcronyms == null) commonAcronyms = DEFAULT_COMMON_ACRONYMS;
    if (properNouns == null) properNouns = List.of();
    if (parallelLineThreshold == null) parallelLineThreshold = 0;
    dictionaryDirs = List.copyOf(dictionaryDirs);
    commonAcronyms = List.copyOf(commonAcronyms);
    properNouns = List.copyOf(properNouns);
  }

  public static SpellcheckProperties defaults() {
    return new SpellcheckProperties(
        null, null, null, null, null, null, null, null, null, null, null);
  }

  public SpellcheckProperties withUserDataDir(String dir) {
    return new SpellcheckProperties(
        defaultLanguage,
        suggestionsEnabled,
        caseSensitive,
        maxSuggestions,
        confidenceThreshold,
        minWordLength,
        dictionaryDirs,
        dir,
        commonAcronyms,
        properNouns,
        parallelLineThreshold);
  }

  public SpellcheckProperties withDictionaryDirs(List<String> dirs) {
    return new SpellcheckProperties(
        defaultLanguage,
        suggestionsEnabled,
        caseSensitive,
        maxSuggestions,
        confidenceThreshold,
        minWordLength,
        dirs,
        userDataDir,
        commonAcronyms,
        properNouns,
        parallelLineThreshold);
  }

  public SpellcheckProperties withParallelLineThreshold(int threshold) {
    return new SpellcheckProperties(
        defaultLanguage,
        suggestionsEnabled,
        caseSensitive,
        maxSuggestions,
        confidenceThreshold,
        minWordLength,
        dictionaryDirs,
        userDataDir,
        commonAcronyms,
        properNouns,
        threshold);
  }
}
