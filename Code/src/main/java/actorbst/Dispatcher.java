package actorbst;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared thread pool that runs {@link MessageTask} mailboxes, plus the
 * bookkeeping of how many tasks exist and how many messages were lost.
 */
public final class Dispatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);
    private static final long SHUTDOWN_WAIT_MILLIS = 5000;

    private final TreeSetConfig config;
    private final ExecutorService executor;

    private final AtomicLong spawned = new AtomicLong();
    private final AtomicInteger live = new AtomicInteger();
    private final AtomicLong deadLetters = new AtomicLong();

    public Dispatcher(TreeSetConfig config) {
        this.config = config;
        this.executor = Executors.newFixedThreadPool(config.dispatcherThreads(),
                new ThreadFactoryBuilder().setNameFormat("actorbst-dispatcher-%d").setDaemon(true).build());
        logger.info("Started dispatcher with {}", config);
    }

    public TreeSetConfig config() {
        return config;
    }

    //--------------------------------------------------------------------------------
    // Task lifecycle
    //--------------------------------------------------------------------------------

    void taskStarted(MessageTask task) {
        spawned.incrementAndGet();
        live.incrementAndGet();
        logger.trace("Task {} started", task);
    }

    void taskStopped(MessageTask task) {
        live.decrementAndGet();
        logger.trace("Task {} stopped", task);
    }

    void deadLetter(MessageTask target, Object message) {
        deadLetters.incrementAndGet();
        logger.debug("Dead letter to {}: {}", target, message);
    }

    /** Returns false when the pool no longer accepts work. */
    boolean schedule(Runnable drain) {
        try {
            executor.execute(drain);
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    //--------------------------------------------------------------------------------
    // Introspection
    //--------------------------------------------------------------------------------

    /** Tasks created so far, stopped or not. */
    public long spawnedTasks() {
        return spawned.get();
    }

    /** Tasks created and not yet stopped. */
    public int liveTasks() {
        return live.get();
    }

    public long deadLetters() {
        return deadLetters.get();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                logger.warn("Dispatcher did not terminate within {} ms, interrupting workers", SHUTDOWN_WAIT_MILLIS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Dispatcher stopped ({} tasks still live, {} dead letters)", live.get(), deadLetters.get());
    }
}
