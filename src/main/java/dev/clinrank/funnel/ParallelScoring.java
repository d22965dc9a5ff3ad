package dev.clinrank.funnel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.MDC;

/**
 * Fans per-candidate scoring out to a fixed worker pool and joins the results in input order.
 *
 * <p>The caller's MDC context is copied onto the worker thread for the duration of each task. The
 * first failure (in input order) cancels the remaining tasks and surfaces as a {@link
 * ScorerFailureException}; nothing is retried or skipped.
 */
public final class ParallelScoring {

  /** Bean name of the shared scoring worker pool. */
  public static final String FUNNEL_WORKER_POOL = "funnelWorkerPool";

  /** MDC key carrying the stage name onto worker threads. */
  public static final String MDC_STAGE = "stage";

  private ParallelScoring() {}

  /**
   * Scores every item on the pool.
   *
   * @param pool the worker pool
   * @param stage stage name used in failure messages
   * @param items items to score
   * @param scorer per-item scoring function; must not mutate shared state
   * @return results in the same order as {@code items}
   * @throws ScorerFailureException if any scoring call throws
   */
  public static <T, R> List<R> scoreAll(
      ExecutorService pool, String stage, List<T> items, Function<T, R> scorer) {
    if (items.isEmpty()) {
      return List.of();
    }

    Map<String, String> callerMdc = MDC.getCopyOfContextMap();
    List<Future<R>> futures = new ArrayList<>(items.size());
    for (T item : items) {
      futures.add(pool.submit(() -> runWithMdc(callerMdc, () -> scorer.apply(item))));
    }

    List<R> results = new ArrayList<>(items.size());
    for (Future<R> future : futures) {
      try {
        results.add(future.get());
      } catch (ExecutionException e) {
        int completed = countCompleted(futures);
        cancelAll(futures);
        throw new ScorerFailureException(stage, completed, e.getCause());
      } catch (InterruptedException e) {
        cancelAll(futures);
        Thread.currentThread().interrupt();
        throw new StageException(stage, "interrupted while waiting for scorers", e);
      }
    }
    return results;
  }

  private static <R> R runWithMdc(@Nullable Map<String, String> callerMdc, Supplier<R> task) {
    Map<String, String> previous = MDC.getCopyOfContextMap();
    if (callerMdc != null) {
      MDC.setContextMap(callerMdc);
    }
    try {
      return task.get();
    } finally {
      if (previous != null) {
        MDC.setContextMap(previous);
      } else {
        MDC.clear();
      }
    }
  }

  private static <R> int countCompleted(List<Future<R>> futures) {
    int completed = 0;
    for (Future<R> future : futures) {
      if (future.isDone() && !future.isCancelled() && completedNormally(future)) {
        completed++;
      }
    }
    return completed;
  }

  private static <R> boolean completedNormally(Future<R> future) {
    try {
      future.get();
      return true;
    } catch (ExecutionException | CancellationException e) {
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static <R> void cancelAll(List<Future<R>> futures) {
    for (Future<R> future : futures) {
      future.cancel(true);
    }
  }
}
