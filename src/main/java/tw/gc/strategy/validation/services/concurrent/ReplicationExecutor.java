package tw.gc.strategy.validation.services.concurrent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.config.ValidationProperties;

/**
 * Fan-out/fan-in over independent replications.
 *
 * <p>Each task index writes only to its own slot of a caller-owned, pre-sized array, so the
 * workers need no locking. The call returns once every index has run; the first failure is
 * rethrown on the calling thread.
 *
 * <p>With a parallelism of 1 everything runs inline on the caller.
 */
@Component
@Slf4j
public class ReplicationExecutor {

    /** Below this many tasks the hand-off costs more than it saves */
    private static final int MIN_PARALLEL_TASKS = 64;

    private final int parallelism;
    private final ExecutorService pool;

    @Autowired
    public ReplicationExecutor(ValidationProperties properties) {
        this(properties.getParallelism());
    }

    public ReplicationExecutor(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
        this.pool = parallelism > 1 ? Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory()) : null;
    }

    public static ReplicationExecutor sequential() {
        return new ReplicationExecutor(1);
    }

    public int parallelism() {
        return parallelism;
    }

    /**
     * Runs {@code task} for every index in [0, count).
     *
     * @throws IllegalStateException if a worker fails with a checked exception or the caller is
     *                               interrupted while waiting
     */
    public void forEachIndex(int count, IntConsumer task) {
        if (pool == null || count < MIN_PARALLEL_TASKS) {
            for (int i = 0; i < count; i++) {
                task.accept(i);
            }
            return;
        }

        int chunkSize = (count + parallelism - 1) / parallelism;
        List<Future<?>> futures = new ArrayList<>();
        for (int from = 0; from < count; from += chunkSize) {
            int start = from;
            int end = Math.min(count, from + chunkSize);
            futures.add(pool.submit(() -> {
                for (int i = start; i < end; i++) {
                    task.accept(i);
                }
            }));
        }

        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for replications", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Replication failed", cause);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (pool == null) {
            return;
        }
        log.debug("Shutting down replication pool ({} workers)", parallelism);
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements java.util.concurrent.ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "validation-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
