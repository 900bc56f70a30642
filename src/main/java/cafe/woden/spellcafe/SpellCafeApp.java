package cafe.woden.spellcafe;

import cafe.woden.spellcafe.check.api.DocumentAnalysis;
import cafe.woden.spellcafe.check.api.SpellCheckPort;
import cafe.woden.spellcafe.config.SpellcheckProperties;
import cafe.woden.spellcafe.language.Language;
import cafe.woden.spellcafe.report.AnalysisReportWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "SpellCafe",
    sharedModules = {"config", "util"})
@EnableConfigurationProperties(SpellcheckProperties.class)
public class SpellCafeApp {
  private static final Logger log = LoggerFactory.getLogger(SpellCafeApp.class);

  private static final int STATISTICS_TOP_WORDS = 10;

  public static void main(String[] args) {
    new SpringApplicationBuilder(SpellCafeApp.class)
        .web(WebApplicationType.NONE)
        .headless(true)
        .run(args);
  }

  /**
   * Checks every non-option argument as a file.
   *
   * <p>{@code --language=<code>} picks the language ({@code auto} detects it per file), {@code
   * --json} logs the JSON report instead of the summary, {@code --stats} adds word statistics.
   */
  @Bean
  public ApplicationRunner run(SpellCheckPort spellCheck, AnalysisReportWriter reports) {
    return args -> {
      List<String> files = args.getNonOptionArgs();
      if (files.isEmpty()) {
        log.info("[spellcafe] nothing to check; pass one or more file paths");
        return;
      }
      Language language = languageOption(args);
      boolean json = args.containsOption("json");
      boolean stats = args.containsOption("stats");

      for (String file : files) {
        Path path = Paths.get(file);
        String text;
        try {
          text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
          log.warn("[spellcafe] could not read {}: {}", path, e.toString());
          continue;
        }

        DocumentAnalysis analysis =
            spellCheck.analyze(text, language, path.getFileName().toString(), null);
        if (json) {
          log.info("[spellcafe] {}\n{}", path, reports.toJson(analysis));
        } else {
          log.info("[spellcafe]\n{}", reports.summary(analysis, path.toString()));
        }
        if (stats) {
          log.info(
              "[spellcafe] statistics for {}\n{}",
              path,
              reports.statistics(
                  text,
                  analysis.language(),
                  path.getFileName().toString(),
                  STATISTICS_TOP_WORDS));
        }
      }
    };
  }

  private static Language languageOption(ApplicationArguments args) {
    List<String> values = args.getOptionValues("language");
    if (values == null || values.isEmpty()) return null;
    String code = values.get(0);
    if ("auto".equalsIgnoreCase(code.trim())) return Language.AUTO_DETECT;
    return Language.custom(code);
  }
}
