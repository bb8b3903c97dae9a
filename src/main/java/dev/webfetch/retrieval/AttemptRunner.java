package dev.webfetch.retrieval;

import dev.webfetch.backend.BackendResult;
import dev.webfetch.backend.ScrapeBackend;
import dev.webfetch.backend.ScrapeOptions;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one backend attempt on a worker thread with its own timeout. A timeout or an exception
 * escaping the backend becomes a failed {@link BackendResult}; interruption of the calling thread
 * cancels the in-flight attempt and is rethrown.
 *
 * <p>The timeout starts when a worker picks the attempt up, so time spent queued behind other
 * attempts is not charged to it. Cancellation interrupts the worker; backends are expected to
 * abort their call on interrupt (the JDK HTTP client does).
 */
class AttemptRunner {

  private final ExecutorService executor;

  AttemptRunner(ExecutorService executor) {
    this.executor = executor;
  }

  BackendResult run(ScrapeBackend backend, String url, ScrapeOptions options)
      throws InterruptedException {
    CountDownLatch started = new CountDownLatch(1);
    Future<BackendResult> future =
        executor.submit(
            () -> {
              started.countDown();
              return backend.scrape(url, options);
            });
    long timeoutMs = options.timeout().toMillis();
    try {
      started.await();
      BackendResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
      return result != null ? result : BackendResult.failed("Backend returned no result");
    } catch (TimeoutException e) {
      future.cancel(true);
      return BackendResult.failed("Request timed out after " + timeoutMs + " ms");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return BackendResult.failed(
          cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }
}
