package dev.clinrank.config;

import dev.clinrank.funnel.FunnelProperties;
import dev.clinrank.funnel.ParallelScoring;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the fixed worker pool shared by the funnel stages for per-candidate scoring.
 *
 * <p>Threads are daemon threads named {@code funnel-worker-N}; the pool is shut down with the
 * application context.
 */
@Configuration
public class WorkerPoolConfig {

  private static final Logger log = LoggerFactory.getLogger(WorkerPoolConfig.class);

  @Bean(name = ParallelScoring.FUNNEL_WORKER_POOL, destroyMethod = "shutdown")
  public ExecutorService funnelWorkerPool(FunnelProperties properties) {
    int threads = properties.effectiveWorkerThreads();
    log.info("Funnel worker pool: {} thread(s)", threads);
    return Executors.newFixedThreadPool(threads, namedDaemonThreads());
  }

  private static ThreadFactory namedDaemonThreads() {
    AtomicInteger counter = new AtomicInteger(1);
    return runnable -> {
      Thread thread = new Thread(runnable, "funnel-worker-" + counter.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }
}
