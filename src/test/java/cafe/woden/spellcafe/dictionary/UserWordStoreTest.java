package cafe.woden.spellcafe.dictionary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.spellcafe.config.SpellcheckProperties;
import cafe.woden.spellcafe.language.Language;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UserWordStoreTest {

  @TempDir Path tempDir;

  @Test
  void filesAreNamedPerListAndLanguage() {
    UserWordStore store = new UserWordStore(DictionaryFixtures.properties(tempDir));

    assertEquals(
        tempDir.resolve("user/user_dictionaries/user_words(eng).txt"),
        store.fileFor(Language.ENGLISH, UserWordStore.ListKind.ADDED));
    assertEquals(
        tempDir.resolve("user/user_dictionaries/ignored_words(fra).txt"),
        store.fileFor(Language.Builtin.FRENCH, UserWordStore.ListKind.IGNORED));
  }

  @Test
  void missingListLoadsEmpty() throws Exception {
    UserWordStore store = new UserWordStore(DictionaryFixtures.properties(tempDir));

    assertEquals(Set.of(), store.load(Language.ENGLISH, UserWordStore.ListKind.ADDED));
  }

  @Test
  void saveWritesSortedListAndLeavesNoTempFiles() throws Exception {
    SpellcheckProperties props = DictionaryFixtures.properties(tempDir);
    UserWordStore store = new UserWordStore(props);

    store.save(Language.ENGLISH, UserWordStore.ListKind.ADDED, Set.of("kubernetes", "grafana"));
    store.save(Language.ENGLISH, UserWordStore.ListKind.ADDED, Set.of("kubernetes", "helm"));

    Path file = store.fileFor(Language.ENGLISH, UserWordStore.ListKind.ADDED);
    assertEquals(List.of("helm", "kubernetes"), Files.readAllLines(file, StandardCharsets.UTF_8));
    assertEquals(
        Set.of("helm", "kubernetes"), store.load(Language.ENGLISH, UserWordStore.ListKind.ADDED));
    try (Stream<Path> files = Files.list(store.directory())) {
      assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
    }
  }
}
