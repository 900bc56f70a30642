package cafe.woden.spellcafe.check.api;

import cafe.woden.spellcafe.dictionary.DictionaryException;
import cafe.woden.spellcafe.language.Language;
import java.nio.file.Path;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** Mutations of the persisted word lists. */
@ApplicationLayer
public interface WordListCommandPort {

  void addWord(String word, Language language) throws DictionaryException;

  void ignoreWord(String word, Language language) throws DictionaryException;

  void clearIgnored(Language language) throws DictionaryException;

  void importDictionary(Path path, Language language) throws DictionaryException;

  void exportDictionary(Language language, Path path) throws DictionaryException;
}
