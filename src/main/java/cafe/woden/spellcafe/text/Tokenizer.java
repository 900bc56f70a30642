package cafe.woden.spellcafe.text;

import cafe.woden.spellcafe.language.Language;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;

/**
 * Splits lines into candidate words with one {@link TokenPattern}, chosen once per document.
 *
 * <p>Tokens under two code points are dropped, except single CJK characters, which are words in
 * their own right.
 */
public final class Tokenizer {

  private static final int MIN_TOKEN_LENGTH = 2;

  private final TokenPattern pattern;

  public Tokenizer(TokenPattern pattern) {
    this.pattern = pattern != null ? pattern : TokenPattern.PROSE;
  }

  /** CJK for CJK languages, else code when the name or content looks like source, else prose. */
  public static TokenPattern selectPattern(Language language, String filename, String text) {
    if (language != null && language.isCjk()) return TokenPattern.CJK;
    if (CodeContextDetector.isCodeContext(filename, text)) return TokenPattern.CODE;
    return TokenPattern.PROSE;
  }

  public static Tokenizer forDocument(Language language, String filename, String text) {
    return new Tokenizer(selectPattern(language, filename, text));
  }

  public TokenPattern pattern() {
    return pattern;
  }

  /** Lazy view of the tokens in {@code line}; every {@code iterator()} call starts over. */
  public Iterable<Token> tokens(String line) {
    String l = line != null ? line : "";
    return () -> new TokenIterator(pattern.pattern().matcher(l));
  }

  static boolean keep(String token) {
    int codePoints = token.codePointCount(0, token.length());
    if (codePoints >= MIN_TOKEN_LENGTH) return true;
    return codePoints == 1 && isCjk(token.codePointAt(0));
  }

  private static boolean isCjk(int cp) {
    Character.UnicodeScript script = Character.UnicodeScript.of(cp);
    return script == Character.UnicodeScript.HAN
        || script == Character.UnicodeScript.HIRAGANA
        || script == Character.UnicodeScript.KATAKANA
        || script == Character.UnicodeScript.HANGUL;
  }

  private static final class TokenIterator implements Iterator<Token> {
    private final Matcher matcher;
    private Token next;

    TokenIterator(Matcher matcher) {
      this.matcher = matcher;
    }

    @Override
    public boolean hasNext() {
      while (next == null && matcher.find()) {
        String text = matcher.group();
        if (keep(text)) next = new Token(text, matcher.start(), matcher.end());
      }
      return next != null;
    }

    @Override
    public Token next() {
      if (!hasNext()) throw new NoSuchElementException();
      Token t = next;
      next = null;
      return t;
    }
  }
}
