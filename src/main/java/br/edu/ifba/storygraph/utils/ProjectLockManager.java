package br.edu.ifba.storygraph.utils;

import br.edu.ifba.storygraph.config.StoryGraphConfig;
import br.edu.ifba.storygraph.exception.ConcurrencyException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-project fair locks serializing every read-modify-write cycle against a project's graph.
 * Uses a pool so the same project id always maps to the same lock instance.
 */
@ApplicationScoped
public class ProjectLockManager {

    private static final Logger logger = LoggerFactory.getLogger(ProjectLockManager.class);

    private final ConcurrentHashMap<String, ReentrantLock> lockPool = new ConcurrentHashMap<>();

    private Duration acquireTimeout;

    @Inject
    public ProjectLockManager(StoryGraphConfig config) {
        this(config.lock().acquireTimeout());
    }

    public ProjectLockManager(@NotNull Duration acquireTimeout) {
        this.acquireTimeout = acquireTimeout;
    }

    /**
     * Gets the fair reentrant lock for a project.
     */
    @NotNull
    public ReentrantLock getLock(@NotNull String projectId) {
        return lockPool.computeIfAbsent(projectId, k -> new ReentrantLock(true));
    }

    /**
     * Acquires the project lock, waiting at most the configured acquire timeout.
     *
     * @return the held lock, to be released with {@link #release(ReentrantLock)}
     * @throws ConcurrencyException if the lock is not acquired in time or the wait is interrupted
     */
    @NotNull
    public ReentrantLock acquire(@NotNull String projectId) {
        ReentrantLock lock = getLock(projectId);
        try {
            if (!lock.tryLock(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Timed out after {} waiting for lock on project {}", acquireTimeout, projectId);
                throw new ConcurrencyException(
                    "Could not acquire lock for project " + projectId + " within " + acquireTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyException("Interrupted while waiting for lock on project " + projectId, e);
        }
        return lock;
    }

    public void release(@NotNull ReentrantLock lock) {
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }

    /**
     * Runs an action while holding the project lock.
     */
    public <T> T withLock(@NotNull String projectId, @NotNull Supplier<T> action) {
        ReentrantLock lock = acquire(projectId);
        try {
            return action.get();
        } finally {
            release(lock);
        }
    }

    public void withLock(@NotNull String projectId, @NotNull Runnable action) {
        withLock(projectId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Drops the lock of a deleted project if nobody holds or waits for it.
     */
    public void forget(@NotNull String projectId) {
        lockPool.computeIfPresent(projectId, (id, lock) ->
            lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }
}
