package cafe.woden.spellcafe.language;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Heuristic language guess from common-word hits and CJK script share.
 *
 * <p>Only the first {@value #MAX_WORDS_SAMPLED} words are considered.
 */
public final class LanguageDetector {

  private static final int MAX_WORDS_SAMPLED = 50;
  private static final int MIN_WORDS = 3;
  private static final double MIN_SCORE = 10.0;
  private static final double CJK_RATIO_THRESHOLD = 0.3;
  private static final int MAX_RESULTS = 3;

  private static final Map<Language, Set<String>> COMMON_WORDS = commonWords();

  private LanguageDetector() {}

  public record Score(Language language, double score) {}

  /**
   * Scores candidate languages for {@code text}, best first, at most three entries.
   *
   * <p>Never returns an empty list: with nothing to go on the answer is English.
   */
  public static List<Score> detect(String text) {
    String source = text == null ? "" : text;
    String[] words = source.toLowerCase(Locale.ROOT).trim().split("\\s+");
    // CJK text is usually unspaced, so script share is checked before the word-count floor.
    Language cjk = dominantCjkLanguage(source);
    if (source.isBlank() || words.length < MIN_WORDS) {
      return List.of(new Score(cjk != null ? cjk : Language.ENGLISH, 100.0));
    }

    Map<Language, Double> scores = new LinkedHashMap<>();
    int sampled = Math.min(words.length, MAX_WORDS_SAMPLED);
    for (Map.Entry<Language, Set<String>> entry : COMMON_WORDS.entrySet()) {
      int matches = 0;
      for (int i = 0; i < sampled; i++) {
        if (entry.getValue().contains(words[i])) matches++;
      }
      double score = matches * 100.0 / sampled;
      if (score > MIN_SCORE) {
        scores.put(entry.getKey(), score);
      }
    }

    if (cjk != null) {
      scores.put(cjk, 100.0);
    }
    if (scores.isEmpty()) {
      scores.put(Language.ENGLISH, 80.0);
    }

    List<Score> ranked = new ArrayList<>(scores.size());
    scores.forEach((language, score) -> ranked.add(new Score(language, score)));
    ranked.sort(Comparator.comparingDouble(Score::score).reversed());
    return ranked.size() > MAX_RESULTS ? List.copyOf(ranked.subList(0, MAX_RESULTS)) : ranked;
  }

  /** True for Han, Hiragana, Katakana and Hangul code points. */
  public static boolean isCjkCodePoint(int codePoint) {
    Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
    return script == Character.UnicodeScript.HAN
        || script == Character.UnicodeScript.HIRAGANA
        || script == Character.UnicodeScript.KATAKANA
        || script == Character.UnicodeScript.HANGUL;
  }

  private static Language dominantCjkLanguage(String text) {
    int total = text.codePointCount(0, text.length());
    if (total == 0) return null;

    int cjk = 0;
    boolean han = false;
    boolean kana = false;
    boolean hangul = false;
    for (int i = 0; i < text.length(); ) {
      int cp = text.codePointAt(i);
      i += Character.charCount(cp);
      if (!isCjkCodePoint(cp)) continue;
      cjk++;
      Character.UnicodeScript script = Character.UnicodeScript.of(cp);
      if (script == Character.UnicodeScript.HAN) han = true;
      else if (script == Character.UnicodeScript.HANGUL) hangul = true;
      else kana = true;
    }
    if ((double) cjk / total <= CJK_RATIO_THRESHOLD) return null;
    // Kana wins over Han: Japanese text mixes both.
    if (kana) return Language.Builtin.JAPANESE;
    if (han) return Language.Builtin.CHINESE;
    if (hangul) return Language.Builtin.KOREAN;
    return null;
  }

  private static Map<Language, Set<String>> commonWords() {
    Map<Language, Set<String>> map = new LinkedHashMap<>();
    map.put(
        Language.Builtin.ENGLISH,
        words(
            "the and that have for with this from they would will what there their about which"
                + " when who them some time could people other than then now look only come its"
                + " over think also back after use two how our work first well way even new want"));
    map.put(
        Language.Builtin.AFRIKAANS,
        words(
            "die en het vir om wat in is jy ek nie sy ons hulle daar maar my haar so by kan van"
                + " dit te met hy was op een toe gaan moet nog al uit sê baie hier wees gewees"
                + " word waar kom laat dink sien"));
    map.put(
        Language.Builtin.FRENCH,
        words(
            "le la et que dans un est pour des les une pas son avec il elle qui mais nous vous"
                + " ce se aux du de par sur sont cette été plus pouvoir comme tout faire me même"
                + " sans autre aussi bien si y ou où lui donc"));
    map.put(
        Language.Builtin.SPANISH,
        words(
            "el la de que y a en un ser se no haber por con su para como estar tener le lo todo"
                + " pero más hacer o poder decir este ir otro ese si me ya ver porque dar cuando"
                + " él muy sin vez mucho saber qué sobre mi alguno"));
    map.put(
        Language.Builtin.GERMAN,
        words(
            "der die und in den von zu das mit sich des auf für ist im dem nicht ein eine"
                + " als auch es an werden aus er hat dass sie nach wird bei einer um am sind"
                + " noch wie"));
    return Collections.unmodifiableMap(map);
  }

  private static Set<String> words(String spaceSeparated) {
    return Set.copyOf(Arrays.asList(spaceSeparated.split(" ")));
  }
}
