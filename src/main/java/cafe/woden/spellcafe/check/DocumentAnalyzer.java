package cafe.woden.spellcafe.check;

import cafe.woden.spellcafe.check.api.CheckOptions;
import cafe.woden.spellcafe.check.api.DocumentAnalysis;
import cafe.woden.spellcafe.check.api.WordCheck;
import cafe.woden.spellcafe.dictionary.Dictionary;
import cafe.woden.spellcafe.dictionary.WordNormalizer;
import cafe.woden.spellcafe.language.Language;
import cafe.woden.spellcafe.text.CodeContextDetector;
import cafe.woden.spellcafe.text.SentenceBoundaries;
import cafe.woden.spellcafe.text.TextLines;
import cafe.woden.spellcafe.text.Token;
import cafe.woden.spellcafe.text.TokenPattern;
import cafe.woden.spellcafe.text.Tokenizer;
import cafe.woden.spellcafe.text.WordCategory;
import cafe.woden.spellcafe.text.WordClassifier;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs tokenize, classify, resolve, score and suggest over every line and aggregates the result.
 *
 * <p>Lines are independent once the dictionary snapshot is fixed, so documents longer than the
 * parallel threshold are split across the worker executor. Results are joined in line order.
 */
final class DocumentAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(DocumentAnalyzer.class);

  private final CorrectnessResolver resolver;
  private final SkipPolicy skipPolicy;
  private final Executor executor;
  private final int parallelLineThreshold;

  DocumentAnalyzer(
      CorrectnessResolver resolver,
      SkipPolicy skipPolicy,
      Executor executor,
      int parallelLineThreshold) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.skipPolicy = Objects.requireNonNull(skipPolicy, "skipPolicy");
    this.executor = executor;
    this.parallelLineThreshold = parallelLineThreshold;
  }

  /** Per-document state shared by every line. */
  private record Pass(
      Language language,
      List<String> lines,
      Tokenizer tokenizer,
      boolean codeContext,
      CorrectnessResolver.Lookup lookup,
      CheckOptions options) {}

  private record LineResult(
      List<WordCheck> words, int total, int misspelled, int suggestions) {

    static final LineResult EMPTY = new LineResult(List.of(), 0, 0, 0);
  }

  DocumentAnalysis analyze(
      String text,
      Dictionary dictionary,
      Set<String> sessionIgnored,
      String filename,
      CheckOptions options) {
    long startNanos = System.nanoTime();
    String source = text != null ? text : "";
    CheckOptions opts = options != null ? options : CheckOptions.defaults();
    Language language = dictionary.language();

    List<String> lines = TextLines.split(source);
    TokenPattern pattern = Tokenizer.selectPattern(language, filename, source);
    boolean codeContext = CodeContextDetector.isCodeContext(filename, source);
    Pass pass =
        new Pass(
            language,
            lines,
            new Tokenizer(pattern),
            codeContext,
            new CorrectnessResolver.Lookup(
                dictionary, sessionIgnored, opts.caseSensitive(), codeContext),
            opts);

    List<LineResult> results = runLines(pass);

    List<WordCheck> words = new ArrayList<>();
    int total = 0;
    int misspelled = 0;
    int suggestions = 0;
    for (LineResult r : results) {
      words.addAll(r.words());
      total += r.total();
      misspelled += r.misspelled();
      suggestions += r.suggestions();
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    log.debug(
        "[DocumentAnalyzer] {} lines, {} words, {} misspelled in {} ms ({})",
        lines.size(),
        total,
        misspelled,
        elapsed.toMillis(),
        pattern);
    return new DocumentAnalysis(
        total,
        misspelled,
        DocumentAnalysis.accuracyOf(total, misspelled),
        words,
        suggestions,
        language,
        lines.size(),
        elapsed,
        codeContext,
        filename);
  }

  private List<LineResult> runLines(Pass pass) {
    int count = pass.lines().size();
    if (executor == null || parallelLineThreshold <= 0 || count <= parallelLineThreshold) {
      List<LineResult> out = new ArrayList<>(count);
      for (int i = 0; i < count; i++) out.add(analyzeLine(pass, i));
      return out;
    }

    List<CompletableFuture<LineResult>> futures = new ArrayList<>(count);
    try {
      for (int i = 0; i < count; i++) {
        int index = i;
        futures.add(CompletableFuture.supplyAsync(() -> analyzeLine(pass, index), executor));
      }
    } catch (RejectedExecutionException e) {
      log.warn("[DocumentAnalyzer] worker pool rejected work; finishing on the calling thread");
    }

    List<LineResult> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      if (i >= futures.size()) {
        out.add(analyzeLine(pass, i));
        continue;
      }
      try {
        out.add(futures.get(i).join());
      } catch (CompletionException e) {
        log.warn("[DocumentAnalyzer] line {} failed on a worker; retrying inline", i + 1, e);
        out.add(analyzeLine(pass, i));
      }
    }
    return out;
  }

  private LineResult analyzeLine(Pass pass, int index) {
    String line = pass.lines().get(index);
    if (line.isEmpty()) return LineResult.EMPTY;

    int lineNumber = index + 1;
    boolean sentenceOpen = SentenceBoundaries.lineOpensSentence(pass.lines(), index);
    int previousEnd = 0;

    List<WordCheck> words = new ArrayList<>();
    int total = 0;
    int misspelled = 0;
    int suggestionCount = 0;
    CheckOptions opts = pass.options();

    for (Token token : pass.tokenizer().tokens(line)) {
      if (SentenceBoundaries.gapClosesSentence(line, previousEnd, token.start())) {
        sentenceOpen = true;
      }
      String original = token.text();
      WordCategory category = WordClassifier.classify(original, pass.codeContext(), sentenceOpen);
      sentenceOpen = false;
      previousEnd = token.end();

      if (skipPolicy.shouldSkip(original, category)) {
        words.add(WordCheck.skipped(original, token.start(), token.end(), lineNumber, category));
        continue;
      }

      String normalized = WordNormalizer.normalize(pass.language(), original);
      boolean correct = resolver.isCorrect(pass.lookup(), original, normalized, category);
      double confidence = ConfidenceScorer.score(original, category, correct);
      boolean counted = !correct && confidence >= opts.confidenceThreshold();

      total++;
      List<String> suggestions = List.of();
      if (counted) {
        misspelled++;
        if (opts.suggestionsEnabled()) {
          suggestions =
              SuggestionGenerator.suggest(
                  original, normalized, pass.lookup().dictionary(), opts.maxSuggestions());
          suggestionCount += suggestions.size();
        }
      }

      words.add(
          new WordCheck(
              original,
              normalized,
              token.start(),
              token.end(),
              lineNumber,
              token.start() + 1,
              !counted,
              confidence,
              category,
              suggestions,
              false));
    }
    return new LineResult(words, total, misspelled, suggestionCount);
  }
}
