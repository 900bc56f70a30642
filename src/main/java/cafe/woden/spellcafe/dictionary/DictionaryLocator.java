package cafe.woden.spellcafe.dictionary;

import cafe.woden.spellcafe.config.SpellcheckProperties;
import cafe.woden.spellcafe.language.Language;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.springframework.stereotype.Component;

/**
 * Finds the base word list for a language.
 *
 * <p>Search order: a path pinned with {@link #pin}, then {@code dictionary(<code>).csv} in every
 * candidate directory, then {@code dictionary(<code>).txt} in every candidate directory.
 */
@Component
@InfrastructureLayer
public class DictionaryLocator {

  private final List<Path> candidateDirs;
  private final ConcurrentHashMap<Language, Path> pinned = new ConcurrentHashMap<>();

  public DictionaryLocator(SpellcheckProperties props, UserWordStore userWordStore) {
    SpellcheckProperties p = props != null ? props : SpellcheckProperties.defaults();
    LinkedHashSet<Path> dirs = new LinkedHashSet<>();
    for (String d : p.dictionaryDirs()) {
      if (d == null || d.isBlank()) continue;
      dirs.add(Paths.get(d.trim()));
    }
    dirs.add(userWordStore.userDataDir());
    dirs.add(userWordStore.directory());
    this.candidateDirs = List.copyOf(dirs);
  }

  public List<Path> candidateDirs() {
    return candidateDirs;
  }

  /** Pins {@code path} as the base list for {@code language}, ahead of the directory search. */
  public void pin(Language language, Path path) {
    pinned.put(language, path);
  }

  public Optional<Path> locate(Language language) {
    if (language == null || language.isAutoDetect()) return Optional.empty();

    Path pin = pinned.get(language);
    if (pin != null && Files.isRegularFile(pin)) return Optional.of(pin);

    for (WordListFormat format : WordListFormat.values()) {
      String fileName = language.dictionaryFileStem() + format.extension();
      for (Path dir : candidateDirs) {
        Path candidate = dir.resolve(fileName);
        if (Files.isRegularFile(candidate)) return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  /** Languages with a base list on disk, in catalog order; custom pins last. */
  public List<Language> languagesOnDisk() {
    List<Language> out = new ArrayList<>();
    for (Language language : Language.all()) {
      if (locate(language).isPresent()) out.add(language);
    }
    for (Language language : pinned.keySet()) {
      if (!out.contains(language) && locate(language).isPresent()) out.add(language);
    }
    return out;
  }
}
