package ai.p8ls.workspace;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs workspace rebuilds one at a time on a single worker thread. At most one rebuild waits behind the running one:
 * submitting another replaces the waiting rebuild, whose future then completes with {@code false}.
 */
public final class RebuildScheduler implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RebuildScheduler.class);

    private final ExecutorService worker;
    private final Object lock = new Object();
    private @Nullable Pending pending;

    private record Pending(String description, Runnable rebuild, CompletableFuture<Boolean> done) {}

    public RebuildScheduler(String name) {
        this.worker = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "Rebuild-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queues {@code rebuild}.
     *
     * @return completes with {@code true} once the rebuild ran, {@code false} if a later submission superseded it,
     *     or exceptionally if it threw
     */
    public CompletableFuture<Boolean> submit(String description, Runnable rebuild) {
        requireNonNull(rebuild, "rebuild");
        var done = new CompletableFuture<Boolean>();
        synchronized (lock) {
            var replaced = pending;
            pending = new Pending(description, rebuild, done);
            if (replaced != null) {
                logger.debug("Rebuild '{}' superseded by '{}'", replaced.description(), description);
                replaced.done().complete(false);
            } else {
                // a drain is already queued whenever something is pending
                worker.execute(this::runPending);
            }
        }
        return done;
    }

    private void runPending() {
        Pending next;
        synchronized (lock) {
            next = pending;
            pending = null;
        }
        if (next == null) {
            return;
        }
        logger.debug("Running rebuild '{}'", next.description());
        try {
            next.rebuild().run();
            next.done().complete(true);
        } catch (RuntimeException e) {
            logger.error("Rebuild '{}' failed", next.description(), e);
            next.done().completeExceptionally(e);
        }
    }

    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Rebuild worker did not stop in time");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }
}
