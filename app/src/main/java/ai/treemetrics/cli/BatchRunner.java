package ai.treemetrics.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs one task per file on a fixed pool and hands results to a sink in input order. A failing or timed-out file is
 * logged and counted; it never stops the others. A timed-out task keeps its worker until it returns, but its result
 * is discarded.
 */
public final class BatchRunner {
    private static final Logger logger = LogManager.getLogger(BatchRunner.class);

    @FunctionalInterface
    public interface FileTask<T> {
        T run(SourceFile file) throws Exception;
    }

    @FunctionalInterface
    public interface ResultSink<T> {
        void accept(SourceFile file, T result) throws Exception;
    }

    public record Summary(int succeeded, int failed) {
        public boolean allSucceeded() {
            return failed == 0;
        }
    }

    private final int jobs;
    private final long timeoutSeconds;

    /** @param timeoutSeconds per-file limit counted from when the file starts; 0 disables it */
    public BatchRunner(int jobs, long timeoutSeconds) {
        this.jobs = Math.max(1, jobs);
        this.timeoutSeconds = Math.max(0, timeoutSeconds);
    }

    public <T> Summary run(List<SourceFile> files, FileTask<T> task, ResultSink<T> sink) {
        ExecutorService pool = Executors.newFixedThreadPool(jobs, namedDaemonThreads("treemetrics-worker"));
        @Nullable ScheduledExecutorService watchdog = timeoutSeconds > 0
                ? Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("treemetrics-timeout"))
                : null;
        try {
            var futures = new ArrayList<CompletableFuture<T>>(files.size());
            for (var file : files) {
                futures.add(submit(pool, watchdog, file, task));
            }

            int succeeded = 0;
            int failed = 0;
            for (int i = 0; i < files.size(); i++) {
                var file = files.get(i);
                try {
                    sink.accept(file, futures.get(i).get());
                    succeeded++;
                } catch (ExecutionException e) {
                    failed++;
                    var cause = e.getCause() == null ? e : e.getCause();
                    if (cause instanceof TimeoutException) {
                        logger.warn("{}: timed out after {}s", file.unitName(), timeoutSeconds);
                    } else {
                        logger.warn("{}: {}", file.unitName(), cause.getMessage());
                        logger.debug("Failure detail for {}", file.unitName(), cause);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.error("Interrupted while waiting for {}", file.unitName());
                    failed += files.size() - i;
                    break;
                } catch (Exception e) {
                    failed++;
                    logger.warn("{}: cannot write output: {}", file.unitName(), e.getMessage());
                }
            }
            logger.debug("Batch finished: {} succeeded, {} failed", succeeded, failed);
            return new Summary(succeeded, failed);
        } finally {
            pool.shutdownNow();
            if (watchdog != null) {
                watchdog.shutdownNow();
            }
        }
    }

    private <T> CompletableFuture<T> submit(
            ExecutorService pool, @Nullable ScheduledExecutorService watchdog, SourceFile file, FileTask<T> task) {
        var future = new CompletableFuture<T>();
        pool.execute(() -> {
            if (future.isDone()) {
                return;
            }
            var timer = watchdog == null
                    ? null
                    : watchdog.schedule(
                            () -> future.completeExceptionally(new TimeoutException(file.unitName())),
                            timeoutSeconds,
                            TimeUnit.SECONDS);
            try {
                future.complete(task.run(file));
            } catch (Exception e) {
                future.completeExceptionally(e);
            } finally {
                if (timer != null) {
                    timer.cancel(false);
                }
            }
        });
        return future;
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
