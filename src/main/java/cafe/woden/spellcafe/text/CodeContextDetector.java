package cafe.woden.spellcafe.text;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Decides whether a document should be tokenized as source code. */
public final class CodeContextDetector {

  private static final Set<String> CODE_EXTENSIONS =
      Set.of(
          "rs", "py", "js", "ts", "jsx", "tsx", "java", "cpp", "c", "cc", "go", "rb", "php", "cs",
          "swift", "kt", "scala", "hs", "lua", "pl", "r", "m", "f", "f90", "f95", "f03", "f08",
          "v", "sv", "vhd", "vhdl", "asm", "s", "sh", "bash", "zsh", "fish", "ps1", "bat", "cmd",
          "yml", "yaml", "toml", "json", "xml", "html", "htm", "css", "scss", "less", "md",
          "markdown", "tex", "bib");

  private static final List<String> INDICATORS =
      List.of(
          "{", "}", "->", "=>", "fn ", "def ", "function ", "class ", "import ", "export ",
          "#include", "pub ", "let ", "const ", "var ", "return ");

  private static final int MIN_LINES = 3;
  private static final int SAMPLE_LINES = 10;
  private static final int MIN_INDICATOR_LINES = 2;

  private CodeContextDetector() {}

  /** True when {@code filename} ends in a known source or markup extension. */
  public static boolean isCodeFile(String filename) {
    if (filename == null) return false;
    String f = filename.trim();
    int dot = f.lastIndexOf('.');
    if (dot < 0 || dot == f.length() - 1) return false;
    return CODE_EXTENSIONS.contains(f.substring(dot + 1).toLowerCase(Locale.ROOT));
  }

  /**
   * True when at least two of the first ten lines carry a code indicator. Texts of fewer than
   * three lines never qualify.
   */
  public static boolean isLikelyCode(String text) {
    if (text == null || text.isEmpty()) return false;
    List<String> lines = TextLines.split(text);
    if (lines.size() < MIN_LINES) return false;

    int hits = 0;
    for (int i = 0; i < Math.min(SAMPLE_LINES, lines.size()); i++) {
      if (hasIndicator(lines.get(i).trim())) hits++;
    }
    return hits >= MIN_INDICATOR_LINES;
  }

  public static boolean isCodeContext(String filename, String text) {
    return isCodeFile(filename) || isLikelyCode(text);
  }

  private static boolean hasIndicator(String line) {
    if (line.contains(";") && !line.startsWith("//")) return true;
    for (String s : INDICATORS) {
      if (line.contains(s)) return true;
    }
    return false;
  }
}
