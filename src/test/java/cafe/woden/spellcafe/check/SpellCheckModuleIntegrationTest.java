package cafe.woden.spellcafe.check;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.spellcafe.check.api.CheckOptions;
import cafe.woden.spellcafe.check.api.DocumentAnalysis;
import cafe.woden.spellcafe.check.api.SpellCheckPort;
import cafe.woden.spellcafe.check.api.WordListCommandPort;
import cafe.woden.spellcafe.dictionary.DictionaryManager;
import cafe.woden.spellcafe.language.Language;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.ApplicationRunner;
import org.springframework.modulith.test.ApplicationModuleTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.convention.TestBean;

@ApplicationModuleTest(mode = ApplicationModuleTest.BootstrapMode.ALL_DEPENDENCIES)
class SpellCheckModuleIntegrationTest {

  @TempDir static Path tempDir;

  @DynamicPropertySource
  static void spellcafeProperties(DynamicPropertyRegistry registry) {
    registry.add("spellcafe.dictionary-dirs[0]", () -> tempDir.resolve("dicts").toString());
    registry.add("spellcafe.user-data-dir", () -> tempDir.resolve("user").toString());
    registry.add("spellcafe.confidence-threshold", () -> "0.6");
  }

  @BeforeAll
  static void writeDictionary() {
    try {
      Path dicts = Files.createDirectories(tempDir.resolve("dicts"));
      Files.write(
          dicts.resolve("dictionary(eng).txt"),
          List.of("the", "quick", "fox"),
          StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @TestBean(name = "run")
  ApplicationRunner run;

  static ApplicationRunner run() {
    return args -> {};
  }

  private final SpellCheckPort spellCheck;
  private final WordListCommandPort wordLists;
  private final DictionaryManager dictionaries;
  private final CorrectnessCache cache;

  SpellCheckModuleIntegrationTest(
      SpellCheckPort spellCheck,
      WordListCommandPort wordLists,
      DictionaryManager dictionaries,
      CorrectnessCache cache) {
    this.spellCheck = spellCheck;
    this.wordLists = wordLists;
    this.dictionaries = dictionaries;
    this.cache = cache;
  }

  @Test
  void bothPortsAreServedByOneService() {
    assertSame(spellCheck, wordLists);
    assertInstanceOf(SpellCheckService.class, spellCheck);
  }

  @Test
  void configuredThresholdFlagsTypos() {
    DocumentAnalysis analysis = spellCheck.analyze("Teh quikc fox", null);

    assertEquals(2, analysis.misspelledWords());
    assertEquals(
        List.of("The", "quick"),
        analysis.misspelled().stream().map(w -> w.suggestions().get(0)).toList());
  }

  @Test
  void dictionaryEventsReachTheCache() throws Exception {
    spellCheck.analyze("the quick fox", Language.ENGLISH, null, CheckOptions.defaults());
    assertTrue(cache.size() > 0);

    dictionaries.reloadDictionary(Language.ENGLISH);

    assertEquals(0, cache.size());
  }
}
