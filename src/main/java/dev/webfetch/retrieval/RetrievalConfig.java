package dev.webfetch.retrieval;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the {@link RetrievalOrchestrator} with its attempt executor.
 *
 * <p>Attempts run on a bounded pool of daemon threads so a backend call that ignores interruption
 * cannot keep the JVM alive. The pool is shut down with the context.
 */
@Configuration
@EnableConfigurationProperties(RetrievalProperties.class)
public class RetrievalConfig {

  private static final Logger log = LoggerFactory.getLogger(RetrievalConfig.class);

  private static final int ATTEMPT_THREADS = 8;

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService scrapeAttemptExecutor() {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable, "scrape-attempt-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(ATTEMPT_THREADS, factory);
  }

  @Bean
  public RetrievalOrchestrator retrievalOrchestrator(
      RetrievalProperties properties,
      @Qualifier("scrapeAttemptExecutor") ExecutorService executor,
      Clock clock) {
    OrchestratorConfig config = properties.toOrchestratorConfig();
    log.info(
        "Retrieval fallback mode {} ({}), default timeout {}",
        config.fallbackMode(),
        config.fallbackMode().sequence(),
        config.defaultTimeout());
    return new RetrievalOrchestrator(config, executor, clock);
  }
}
