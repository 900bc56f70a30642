package cafe.woden.spellcafe.language;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A language the checker knows how to normalize and look up.
 *
 * <p>Built-in languages are an enum; anything else is a {@link Custom} language identified only by
 * its code. Two languages are equal exactly when their codes are equal.
 */
public sealed interface Language permits Language.Builtin, Language.Custom {

  Language ENGLISH = Builtin.ENGLISH;
  Language AUTO_DETECT = Builtin.AUTO_DETECT;

  String code();

  String displayName();

  /** Chinese, Japanese and Korean words are stored verbatim instead of lower-cased. */
  boolean isCjk();

  default boolean isAutoDetect() {
    return false;
  }

  /** Dictionary file stem for this language, e.g. {@code dictionary(eng)}. */
  default String dictionaryFileStem() {
    return "dictionary(" + code() + ")";
  }

  enum Builtin implements Language {
    ENGLISH("eng", "English", false, "en", "english"),
    AFRIKAANS("afr", "Afrikaans", false, "af", "afrikaans"),
    FRENCH("fra", "French", false, "fr", "french"),
    SPANISH("spa", "Spanish", false, "es", "spanish"),
    GERMAN("deu", "German", false, "de", "german"),
    CHINESE("zho", "Chinese", true, "zh", "chinese"),
    ITALIAN("ita", "Italian", false, "it", "italian"),
    PORTUGUESE("por", "Portuguese", false, "pt", "portuguese"),
    RUSSIAN("rus", "Russian", false, "ru", "russian"),
    JAPANESE("jpn", "Japanese", true, "ja", "japanese"),
    KOREAN("kor", "Korean", true, "ko", "korean"),
    AUTO_DETECT("auto", "Auto-detect", false, "autodetect", "auto-detect");

    private final String code;
    private final String displayName;
    private final boolean cjk;
    private final List<String> aliases;

    Builtin(String code, String displayName, boolean cjk, String... aliases) {
      this.code = code;
      this.displayName = displayName;
      this.cjk = cjk;
      this.aliases = List.of(aliases);
    }

    @Override
    public String code() {
      return code;
    }

    @Override
    public String displayName() {
      return displayName;
    }

    @Override
    public boolean isCjk() {
      return cjk;
    }

    @Override
    public boolean isAutoDetect() {
      return this == AUTO_DETECT;
    }

    boolean matches(String lowerToken) {
      return code.equals(lowerToken) || aliases.contains(lowerToken);
    }
  }

  /**
   * A language outside the built-in catalog, backed by a user-supplied word list.
   *
   * <p>Codes and aliases of built-in languages are rejected; {@link Language#custom} maps them to
   * the built-in instead.
   */
  record Custom(String code) implements Language {
    public Custom {
      code = normalizeCode(code);
      if (code.isEmpty()) {
        throw new IllegalArgumentException("custom language code must not be blank");
      }
      if (builtinFor(code) != null) {
        throw new IllegalArgumentException("'" + code + "' is a built-in language code");
      }
    }

    @Override
    public String displayName() {
      return "Custom (" + code + ")";
    }

    @Override
    public boolean isCjk() {
      return false;
    }
  }

  /** Built-in languages in catalog order, {@link #AUTO_DETECT} last. */
  static List<Language> all() {
    return List.of(Builtin.values());
  }

  /**
   * Resolves a code, ISO 639-1 tag or English name to a built-in language.
   *
   * <p>Unknown or blank input maps to {@link #ENGLISH}.
   */
  static Language fromCode(String code) {
    Builtin builtin = builtinFor(normalizeCode(code));
    return builtin != null ? builtin : ENGLISH;
  }

  /** Returns the built-in language for {@code code} if there is one, else a {@link Custom}. */
  static Language custom(String code) {
    String token = normalizeCode(code);
    Builtin builtin = builtinFor(token);
    return builtin != null ? builtin : new Custom(token);
  }

  private static Builtin builtinFor(String token) {
    for (Builtin b : Builtin.values()) {
      if (b.matches(token)) return b;
    }
    return null;
  }

  private static String normalizeCode(String code) {
    return Objects.toString(code, "").trim().toLowerCase(Locale.ROOT);
  }
}
