package cafe.woden.spellcafe.check;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.spellcafe.check.api.CheckOptions;
import cafe.woden.spellcafe.check.api.DocumentAnalysis;
import cafe.woden.spellcafe.config.SpellcheckProperties;
import cafe.woden.spellcafe.dictionary.Dictionary;
import cafe.woden.spellcafe.dictionary.DictionaryException;
import cafe.woden.spellcafe.dictionary.DictionaryFixtures;
import cafe.woden.spellcafe.dictionary.DictionaryManager;
import cafe.woden.spellcafe.language.Language;
import cafe.woden.spellcafe.language.LanguageCatalog;
import cafe.woden.spellcafe.text.WordCategory;
import io.reactivex.rxjava3.core.Flowable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpellCheckServiceTest {

  private static final CheckOptions STRICT = CheckOptions.defaults().withConfidenceThreshold(0.5);

  @TempDir Path tempDir;

  private final ExecutorService executor = Executors.newFixedThreadPool(2);
  private CorrectnessCache cache;
  private DictionaryManager dictionaries;

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private SpellCheckService newService() {
    SpellcheckProperties props = DictionaryFixtures.properties(tempDir);
    cache = new CorrectnessCache();
    dictionaries = DictionaryFixtures.manager(props);
    return new SpellCheckService(props, new LanguageCatalog(props), dictionaries, cache, executor);
  }

  @Test
  void missingDictionaryYieldsEmptyAnalysis() {
    SpellCheckService service = newService();

    DocumentAnalysis analysis = service.analyze("some words here", "notes.txt");

    assertEquals(0, analysis.totalWords());
    assertEquals(100.0, analysis.accuracy());
    assertEquals(Language.ENGLISH, analysis.language());
    assertEquals("notes.txt", analysis.fileType());
  }

  @Test
  void setLanguageSwitchesAndClearsTheCache() throws Exception {
    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, "the", "quick", "fox");
    DictionaryFixtures.writeList(tempDir, Language.Builtin.FRENCH, "le", "renard", "rapide");
    SpellCheckService service = newService();
    service.analyze("the quick fox", null);
    assertTrue(cache.size() > 0);

    service.setLanguage(Language.Builtin.FRENCH);

    assertEquals(Language.Builtin.FRENCH, service.activeLanguage());
    assertEquals(0, cache.size());
    assertEquals(0, service.analyze("le renard rapide", null).misspelledWords());
    assertEquals(3, service.wordCount(null));
  }

  @Test
  void setLanguageToSameLanguageKeepsTheCache() throws Exception {
    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, "the", "quick", "fox");
    SpellCheckService service = newService();
    service.analyze("the quick fox", null);
    long before = cache.size();

    service.setLanguage(Language.ENGLISH);

    assertEquals(before, cache.size());
  }

  @Test
  void failedSwitchLeavesLanguageAndCacheAlone() throws Exception {
    SpellcheckProperties props = DictionaryFixtures.properties(tempDir);
    DictionaryManager manager = mock(DictionaryManager.class);
    when(manager.changes()).thenReturn(Flowable.never());
    when(manager.getDictionary(Language.Builtin.GERMAN))
        .thenThrow(
            new DictionaryException(DictionaryException.Kind.DICTIONARY_NOT_FOUND, "no list"));
    CorrectnessCache spyCache = spy(new CorrectnessCache());
    SpellCheckService service =
        new SpellCheckService(props, new LanguageCatalog(props), manager, spyCache, executor);

    assertThrows(DictionaryException.class, () -> service.setLanguage(Language.Builtin.GERMAN));

    assertEquals(Language.ENGLISH, service.activeLanguage());
    verify(spyCache, never()).clear();
    assertThrows(
        IllegalArgumentException.class, () -> service.addWord("word", Language.AUTO_DETECT));
    verify(manager, never()).getDictionary(Language.AUTO_DETECT);
  }

  @Test
  void setLanguageFailsWithoutAnyDictionary() {
    SpellCheckService service = newService();

    DictionaryException e =
        assertThrows(DictionaryException.class, () -> service.setLanguage(Language.ENGLISH));
    assertEquals(DictionaryException.Kind.DICTIONARY_NOT_FOUND, e.kind());
    assertThrows(IllegalArgumentException.class, () -> service.setLanguage(Language.AUTO_DETECT));
  }

  @Test
  void autoDetectPicksTheDocumentLanguage() throws Exception {
    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, "the");
    DictionaryFixtures.writeList(
        tempDir,
        Language.Builtin.FRENCH,
        "nous", "sommes", "dans", "la", "maison", "avec", "le", "chat", "et", "une", "souris");
    SpellCheckService service = newService();

    DocumentAnalysis analysis =
        service.analyze(
            "nous sommes dans la maison avec le chat et une souris",
            Language.AUTO_DETECT,
            null,
            STRICT);

    assertEquals(Language.Builtin.FRENCH, analysis.language());
    assertEquals(0, analysis.misspelledWords());
    assertEquals(Language.Builtin.FRENCH, service.detectLanguage("nous sommes dans la maison"));
  }

  @Test
  void addedAndIgnoredWordsStopBeingFlagged() throws Exception {
    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, "the", "fox");
    SpellCheckService service = newService();
    assertEquals(2, service.analyze("the grafana fox zxqv", null, null, STRICT).misspelledWords());

    service.addWord("Grafana", null);
    service.ignoreWord("zxqv", Language.ENGLISH);

    assertEquals(0, service.analyze("the grafana fox zxqv", null, null, STRICT).misspelledWords());

    service.clearIgnored(null);
    assertEquals(1, service.analyze("the grafana fox zxqv", null, null, STRICT).misspelledWords());
  }

  @Test
  void sessionIgnoreIsNotPersisted() throws Exception {
    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, "the", "fox");
    SpellCheckService service = newService();

    service.ignoreForSession("Zxqv");

    assertEquals(Set.of("zxqv"), service.sessionIgnoredWords());
    assertEquals(0, service.analyze("the zxqv fox", null, null, STRICT).misspelledWords());
    assertEquals(0, newService().sessionIgnoredWords().size());
  }

  @Test
  void reloadingDropsStaleAnswers() throws Exception {
    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, "the", "fox");
    SpellCheckService service = newService();
    assertEquals(1, service.analyze("the quikc fox", null, null, STRICT).misspelledWords());

    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, "the", "fox", "quikc");
    dictionaries.reloadDictionary(Language.ENGLISH);

    assertEquals(0, service.analyze("the quikc fox", null, null, STRICT).misspelledWords());
  }

  @Test
  void lookupStillRunningOnTheReplacedDictionaryCannotRepopulateTheCache() throws Exception {
    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, "the", "fox", "quikc");
    SpellCheckService service = newService();
    assertEquals(0, service.analyze("the quikc fox", null, null, STRICT).misspelledWords());
    Dictionary replaced = dictionaries.getDictionary(Language.ENGLISH);

    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, "the", "fox");
    dictionaries.reloadDictionary(Language.ENGLISH);
    CorrectnessResolver.Lookup inFlight =
        new CorrectnessResolver.Lookup(replaced, Set.of(), false, false);
    assertTrue(
        new CorrectnessResolver(cache).isCorrect(inFlight, "quikc", "quikc", WordCategory.NORMAL));

    assertEquals(1, service.analyze("the quikc fox", null, null, STRICT).misspelledWords());
  }

  @Test
  void exportThenImportIntoAnotherLanguage() throws Exception {
    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, "apple", "pear");
    SpellCheckService service = newService();
    service.addWord("kiwi", null);
    Path export = tempDir.resolve("fruit.txt");

    service.exportDictionary(null, export);
    Language fruit = Language.custom("fru");
    Files.writeString(
        tempDir.resolve("dicts/dictionary(fru).txt"), "banana\n", StandardCharsets.UTF_8);
    service.importDictionary(export, fruit);

    assertEquals(
        List.of("apple", "kiwi", "pear"), Files.readAllLines(export, StandardCharsets.UTF_8));
    assertEquals(4, service.wordCount(fruit));
    assertEquals(0, service.analyze("apple kiwi banana", fruit, null, STRICT).misspelledWords());
  }

  @Test
  void concurrentAnalysesSurviveLanguageSwitches() throws Exception {
    DictionaryFixtures.writeList(tempDir, Language.ENGLISH, "the", "quick", "fox");
    DictionaryFixtures.writeList(tempDir, Language.Builtin.GERMAN, "der", "schnelle", "fuchs");
    SpellCheckService service = newService();
    ExecutorService pool = Executors.newFixedThreadPool(6);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < 4; t++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < 100; i++) {
                    DocumentAnalysis a =
                        service.analyze("the quick fox", Language.ENGLISH, null, STRICT);
                    assertEquals(0, a.misspelledWords());
                  }
                  return null;
                }));
      }
      futures.add(
          pool.submit(
              () -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                  service.setLanguage(i % 2 == 0 ? Language.Builtin.GERMAN : Language.ENGLISH);
                }
                return null;
              }));
      start.countDown();
      for (Future<?> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
    assertTrue(
        Set.of(Language.ENGLISH, Language.Builtin.GERMAN).contains(service.activeLanguage()));
  }
}
