package cafe.woden.spellcafe.dictionary;

import cafe.woden.spellcafe.config.SpellcheckProperties;
import cafe.woden.spellcafe.language.Language;
import cafe.woden.spellcafe.language.LanguageCatalog;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Builds throwaway dictionary directories and managers rooted in a test's temp dir. */
public final class DictionaryFixtures {

  private DictionaryFixtures() {}

  public static SpellcheckProperties properties(Path root) {
    return SpellcheckProperties.defaults()
        .withDictionaryDirs(List.of(root.resolve("dicts").toString()))
        .withUserDataDir(root.resolve("user").toString());
  }

  /** Writes {@code dicts/dictionary(<code>).txt} under {@code root}. */
  public static Path writeList(Path root, Language language, String... words) throws IOException {
    Path dir = Files.createDirectories(root.resolve("dicts"));
    Path file = dir.resolve(language.dictionaryFileStem() + ".txt");
    Files.write(file, List.of(words), StandardCharsets.UTF_8);
    return file;
  }

  public static DictionaryManager manager(SpellcheckProperties props) {
    UserWordStore store = new UserWordStore(props);
    return new DictionaryManager(
        props, new LanguageCatalog(props), new DictionaryLocator(props, store), store);
  }

  public static Dictionary dictionary(SpellcheckProperties props, Language language) {
    UserWordStore store = new UserWordStore(props);
    return new Dictionary(
        language,
        Language.ENGLISH,
        props.minWordLength(),
        new DictionaryLocator(props, store),
        store,
        change -> {});
  }
}
