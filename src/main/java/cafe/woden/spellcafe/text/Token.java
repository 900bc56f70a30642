package cafe.woden.spellcafe.text;

/** A candidate word and its {@code [start, end)} char offsets within its line. */
public record Token(String text, int start, int end) {

  public Token {
    if (text == null) text = "";
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("bad token span [" + start + ", " + end + ")");
    }
  }
}
