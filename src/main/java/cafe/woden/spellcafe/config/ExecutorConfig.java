package cafe.woden.spellcafe.config;

import cafe.woden.spellcafe.util.WorkerThreads;
import java.util.concurrent.ExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>Spring owns creation and shutdown; callers inject them by name.
 */
@Configuration
public class ExecutorConfig {
  public static final String SPELLCHECK_WORKER_EXECUTOR = "spellcheckWorkerExecutor";

  @Bean(name = SPELLCHECK_WORKER_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService spellcheckWorkerExecutor() {
    return WorkerThreads.newFixedPool(WorkerThreads.defaultPoolSize(), "spellcafe-check");
  }
}
