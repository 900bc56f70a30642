package cafe.woden.spellcafe.text;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CodeContextDetectorTest {

  @Test
  void knownExtensionsAreCode() {
    assertTrue(CodeContextDetector.isCodeFile("main.rs"));
    assertTrue(CodeContextDetector.isCodeFile("README.MD"));
    assertFalse(CodeContextDetector.isCodeFile("build.gradle.kts"));
    assertFalse(CodeContextDetector.isCodeFile("notes.txt"));
    assertFalse(CodeContextDetector.isCodeFile("Makefile"));
    assertFalse(CodeContextDetector.isCodeFile("trailing."));
    assertFalse(CodeContextDetector.isCodeFile(null));
  }

  @Test
  void twoIndicatorLinesMakeTextLookLikeCode() {
    String code = "fn main() {\n    let x = 1;\n    println!(\"{}\", x);\n}\n";

    assertTrue(CodeContextDetector.isLikelyCode(code));
    assertTrue(CodeContextDetector.isCodeContext("snippet.txt", code));
  }

  @Test
  void shortOrPlainTextIsNotCode() {
    assertFalse(CodeContextDetector.isLikelyCode("let x = 1;\nlet y = 2;"));
    assertFalse(CodeContextDetector.isLikelyCode("Dear team,\nthe report is ready.\nThanks"));
    assertFalse(CodeContextDetector.isLikelyCode("// one;\n// two;\nplain"));
    assertFalse(CodeContextDetector.isCodeContext(null, null));
  }
}
