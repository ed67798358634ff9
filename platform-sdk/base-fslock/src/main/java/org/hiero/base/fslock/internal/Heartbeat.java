// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock.internal;

import static java.util.Objects.requireNonNull;
import static org.hiero.base.fslock.logging.LogMarker.EXCEPTION;
import static org.hiero.base.fslock.logging.LogMarker.HEARTBEAT;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.base.fslock.LockFileSystem;

/**
 * Keeps a held lock directory fresh by setting its modification time to the current time every update interval, so
 * that waiters do not consider the lock stale.
 * <p>
 * A heartbeat runs on its own daemon thread from {@link #start} until {@link #cancel()} is observed at its next wait.
 * A failure to touch the directory ends the heartbeat but is only logged; the holder keeps running. Whatever way the
 * heartbeat ends, {@link #awaitDone()} returns afterwards, and after that no further update can happen.
 */
public final class Heartbeat implements Runnable {

    private static final Logger classLogger = LogManager.getLogger(Heartbeat.class);

    private static final ThreadFactory THREAD_FACTORY = new ThreadFactoryBuilder()
            .setNameFormat("fslock-heartbeat-%d")
            .setDaemon(true)
            .setUncaughtExceptionHandler(
                    (t, ex) -> classLogger.error(EXCEPTION.getMarker(), "Uncaught exception in lock heartbeat", ex))
            .build();

    private final Path path;
    private final Duration updateInterval;
    private final LockFileSystem fileSystem;
    private final Clock clock;
    private final Logger logger;

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CountDownLatch done = new CountDownLatch(1);
    private final AtomicLong updates = new AtomicLong();

    private Heartbeat(
            @NonNull final Path path,
            @NonNull final Duration updateInterval,
            @NonNull final LockFileSystem fileSystem,
            @NonNull final Clock clock,
            @NonNull final Logger logger) {
        this.path = requireNonNull(path);
        this.updateInterval = requireNonNull(updateInterval);
        this.fileSystem = requireNonNull(fileSystem);
        this.clock = requireNonNull(clock);
        this.logger = requireNonNull(logger);
    }

    /**
     * Starts a heartbeat for a lock directory that has just been created.
     *
     * @param path           the lock directory
     * @param updateInterval the time between two refreshes
     * @param fileSystem     the filesystem holding the directory
     * @param clock          the source of the modification times
     * @param logger         the logger of the lock
     * @return the running heartbeat
     */
    @NonNull
    public static Heartbeat start(
            @NonNull final Path path,
            @NonNull final Duration updateInterval,
            @NonNull final LockFileSystem fileSystem,
            @NonNull final Clock clock,
            @NonNull final Logger logger) {
        final Heartbeat heartbeat = new Heartbeat(path, updateInterval, fileSystem, clock, logger);
        THREAD_FACTORY.newThread(heartbeat).start();
        return heartbeat;
    }

    @Override
    public void run() {
        try {
            while (!cancelled.await(updateInterval.toNanos(), TimeUnit.NANOSECONDS)) {
                fileSystem.setLastModifiedTime(path, clock.instant());
                updates.incrementAndGet();
                logger.trace(HEARTBEAT.getMarker(), "Refreshed lock {}", path);
            }
            logger.trace(HEARTBEAT.getMarker(), "Heartbeat of lock {} stopped after {} updates", path, updates.get());
        } catch (final IOException | RuntimeException e) {
            logger.warn(
                    HEARTBEAT.getMarker(),
                    "Failed to refresh lock {}, other processes may consider it stale. error: {}",
                    path,
                    e.toString(),
                    e);
        } catch (final InterruptedException e) {
            logger.warn(HEARTBEAT.getMarker(), "Heartbeat of lock {} was interrupted", path);
            Thread.currentThread().interrupt();
        } finally {
            done.countDown();
        }
    }

    /**
     * Asks the heartbeat to stop. It stops at its next wait and never touches the directory again.
     */
    public void cancel() {
        cancelled.countDown();
    }

    /**
     * Waits until the heartbeat has stopped. Interrupting the calling thread does not end the wait; the interrupt is
     * restored once the heartbeat is done.
     */
    public void awaitDone() {
        Uninterruptibles.awaitUninterruptibly(done);
    }

    /**
     * @return true if the heartbeat has stopped, for whatever reason
     */
    public boolean isDone() {
        return done.getCount() == 0;
    }

    /**
     * @return the number of times the directory was refreshed
     */
    public long getUpdates() {
        return updates.get();
    }
}
