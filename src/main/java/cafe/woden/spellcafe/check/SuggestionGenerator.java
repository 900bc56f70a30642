package cafe.woden.spellcafe.check;

import cafe.woden.spellcafe.dictionary.Dictionary;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ranked corrections for a misspelled token, drawn from the dictionary's base and user words.
 *
 * <p>Candidates must be within an edit distance that grows with token length. Ranking: distance,
 * then adjacent transpositions, then length difference, then longer shared prefix, then
 * alphabetical. Suggestions take the token's capitalization.
 */
final class SuggestionGenerator {

  private static final int MIN_FUZZY_TOKEN_LENGTH = 3;
  private static final int SHORT_TOKEN_MAX_DISTANCE = 1;
  private static final int MEDIUM_TOKEN_MAX_DISTANCE = 2;
  private static final int LONG_TOKEN_MAX_DISTANCE = 3;
  private static final int MEDIUM_TOKEN_MAX_LENGTH = 6;

  private record ScoredSuggestion(
      String word, int distance, boolean transposition, int lengthDelta, int sharedPrefix) {}

  private static final Comparator<ScoredSuggestion> RANKING =
      Comparator.comparingInt(ScoredSuggestion::distance)
          .thenComparing(s -> !s.transposition())
          .thenComparingInt(ScoredSuggestion::lengthDelta)
          .thenComparing(Comparator.comparingInt(ScoredSuggestion::sharedPrefix).reversed())
          .thenComparing(ScoredSuggestion::word);

  private SuggestionGenerator() {}

  static List<String> suggest(String token, String normalized, Dictionary dictionary, int max) {
    if (max <= 0 || normalized == null || normalized.isEmpty()) return List.of();
    String needle = normalized.toLowerCase(Locale.ROOT);
    int tokenLen = needle.length();
    int maxLengthDelta = Math.max(1, tokenLen / 2);

    List<ScoredSuggestion> ranked = new ArrayList<>();
    for (String candidate : dictionary.words()) {
      String candidateLower = candidate.toLowerCase(Locale.ROOT);
      int lengthDelta = Math.abs(tokenLen - candidateLower.length());
      if (lengthDelta > maxLengthDelta) continue;
      int distance = damerauLevenshteinDistance(needle, candidateLower);
      if (!isPlausibleSuggestion(needle, candidateLower, distance)) continue;
      ranked.add(
          new ScoredSuggestion(
              candidate,
              distance,
              isAdjacentTranspositionTypo(needle, candidateLower),
              lengthDelta,
              commonPrefixLength(needle, candidateLower)));
    }
    if (ranked.isEmpty()) return List.of();
    ranked.sort(RANKING);

    Set<String> out = new LinkedHashSet<>();
    for (ScoredSuggestion s : ranked) {
      out.add(matchCase(token, s.word()));
      if (out.size() >= max) break;
    }
    return List.copyOf(out);
  }

  static boolean isPlausibleSuggestion(String tokenLower, String candidateLower, int distance) {
    if (distance <= 0) return false;
    int tokenLen = tokenLower.length();
    int lengthDelta = Math.abs(tokenLen - candidateLower.length());
    int maxDistance =
        tokenLen <= MIN_FUZZY_TOKEN_LENGTH
            ? SHORT_TOKEN_MAX_DISTANCE
            : (tokenLen <= MEDIUM_TOKEN_MAX_LENGTH
                ? MEDIUM_TOKEN_MAX_DISTANCE
                : LONG_TOKEN_MAX_DISTANCE);
    if (distance > maxDistance) return false;
    if (lengthDelta > Math.max(1, tokenLen / 2)) return false;
    if (tokenLen <= MIN_FUZZY_TOKEN_LENGTH
        && !candidateLower.isEmpty()
        && tokenLower.charAt(0) != candidateLower.charAt(0)) {
      return false;
    }
    return true;
  }

  /** All-caps token gives upper case, capitalized token gives a capitalized word. */
  static String matchCase(String token, String word) {
    if (token == null || token.isEmpty() || word.isEmpty()) return word;
    if (isAllUpper(token) && token.codePointCount(0, token.length()) > 1) {
      return word.toUpperCase(Locale.ROOT);
    }
    if (Character.isUpperCase(token.codePointAt(0))) {
      int first = word.codePointAt(0);
      int width = Character.charCount(first);
      return new StringBuilder()
          .appendCodePoint(Character.toTitleCase(first))
          .append(word, width, word.length())
          .toString();
    }
    return word;
  }

  private static boolean isAllUpper(String token) {
    boolean letter = false;
    for (int i = 0; i < token.length(); ) {
      int cp = token.codePointAt(i);
      i += Character.charCount(cp);
      if (!Character.isLetter(cp)) continue;
      letter = true;
      if (!Character.isUpperCase(cp)) return false;
    }
    return letter;
  }

  static int commonPrefixLength(String a, String b) {
    int max = Math.min(a.length(), b.length());
    int i = 0;
    while (i < max && a.charAt(i) == b.charAt(i)) {
      i++;
    }
    return i;
  }

  static boolean isAdjacentTranspositionTypo(String tokenLower, String candidateLower) {
    if (tokenLower.length() != candidateLower.length()) return false;
    if (tokenLower.length() < 2) return false;

    int firstMismatch = -1;
    int secondMismatch = -1;
    for (int i = 0; i < tokenLower.length(); i++) {
      if (tokenLower.charAt(i) == candidateLower.charAt(i)) continue;
      if (firstMismatch < 0) {
        firstMismatch = i;
        continue;
      }
      if (secondMismatch < 0) {
        secondMismatch = i;
        continue;
      }
      return false;
    }

    if (firstMismatch < 0 || secondMismatch != firstMismatch + 1) return false;
    return tokenLower.charAt(firstMismatch) == candidateLower.charAt(secondMismatch)
        && tokenLower.charAt(secondMismatch) == candidateLower.charAt(firstMismatch);
  }

  /** Optimal string alignment distance: insertions, deletions, substitutions, transpositions. */
  static int damerauLevenshteinDistance(String a, String b) {
    if (a.equals(b)) return 0;
    if (a.isEmpty()) return b.length();
    if (b.isEmpty()) return a.length();

    int aLen = a.length();
    int bLen = b.length();
    int[][] dp = new int[aLen + 1][bLen + 1];
    for (int i = 0; i <= aLen; i++) dp[i][0] = i;
    for (int j = 0; j <= bLen; j++) dp[0][j] = j;

    for (int i = 1; i <= aLen; i++) {
      char ca = a.charAt(i - 1);
      for (int j = 1; j <= bLen; j++) {
        int cost = (ca == b.charAt(j - 1)) ? 0 : 1;
        int value =
            Math.min(Math.min(dp[i][j - 1] + 1, dp[i - 1][j] + 1), dp[i - 1][j - 1] + cost);
        if (i > 1 && j > 1 && ca == b.charAt(j - 2) && a.charAt(i - 2) == b.charAt(j - 1)) {
          value = Math.min(value, dp[i - 2][j - 2] + 1);
        }
        dp[i][j] = value;
      }
    }
    return dp[aLen][bLen];
  }
}
