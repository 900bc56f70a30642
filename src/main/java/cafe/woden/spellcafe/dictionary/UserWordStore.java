package cafe.woden.spellcafe.dictionary;

import cafe.woden.spellcafe.config.SpellcheckProperties;
import cafe.woden.spellcafe.language.Language;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-language user-scope word lists under {@code <userDataDir>/user_dictionaries}.
 *
 * <p>Each list is rewritten whole on every save, through a temp file and a move.
 */
@Component
@InfrastructureLayer
public class UserWordStore {

  private static final Logger log = LoggerFactory.getLogger(UserWordStore.class);

  public enum ListKind {
    ADDED("user_words"),
    IGNORED("ignored_words");

    private final String filePrefix;

    ListKind(String filePrefix) {
      this.filePrefix = filePrefix;
    }
  }

  private final Path userDataDir;
  private final Path dir;

  public UserWordStore(SpellcheckProperties props) {
    SpellcheckProperties p = props != null ? props : SpellcheckProperties.defaults();
    this.userDataDir = Paths.get(p.userDataDir());
    this.dir = userDataDir.resolve("user_dictionaries");
  }

  public Path userDataDir() {
    return userDataDir;
  }

  public Path directory() {
    return dir;
  }

  public Path fileFor(Language language, ListKind kind) {
    return dir.resolve(kind.filePrefix + "(" + language.code() + ").txt");
  }

  /** Missing files read as empty lists. */
  public Set<String> load(Language language, ListKind kind) throws DictionaryException {
    Path file = fileFor(language, kind);
    if (!Files.isRegularFile(file)) return Set.of();
    return WordListCodec.readWords(file, language, 1);
  }

  public synchronized void save(Language language, ListKind kind, Collection<String> words)
      throws DictionaryException {
    Path file = fileFor(language, kind);
    try {
      Files.createDirectories(dir);
      Path tmp = Files.createTempFile(dir, kind.filePrefix, ".tmp");
      try {
        try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
          for (String w : new TreeSet<>(words)) {
            out.write(w);
            out.write('\n');
          }
        }
        try {
          Files.move(
              tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
          Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
      } finally {
        Files.deleteIfExists(tmp);
      }
      log.debug("[UserWordStore] wrote {} {} words to {}", words.size(), kind, file);
    } catch (IOException e) {
      throw new DictionaryException(
          DictionaryException.Kind.IO, "Could not save " + kind + " words to " + file, e);
    }
  }
}
