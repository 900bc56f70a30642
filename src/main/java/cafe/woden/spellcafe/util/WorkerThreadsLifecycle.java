package cafe.woden.spellcafe.util;

import jakarta.annotation.PreDestroy;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/** Fallback shutdown hook for worker pools created via {@link WorkerThreads}. */
@Component
@Lazy(false)
final class WorkerThreadsLifecycle {

  @PreDestroy
  void shutdown() {
    WorkerThreads.shutdownTrackedExecutorsNow();
  }
}
