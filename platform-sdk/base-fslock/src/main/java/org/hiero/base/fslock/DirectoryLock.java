// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

import static java.util.Objects.requireNonNull;
import static org.hiero.base.fslock.logging.LogMarker.EXCEPTION;
import static org.hiero.base.fslock.logging.LogMarker.FILE_LOCK;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.base.fslock.LockFileSystem.EntryAttributes;
import org.hiero.base.fslock.internal.AcquiredOnTry;
import org.hiero.base.fslock.internal.Heartbeat;
import org.hiero.base.fslock.locked.Locked;
import org.hiero.base.fslock.locked.MaybeLocked;

/**
 * A lock shared between processes through a directory. Whoever creates the directory holds the lock, and removing it
 * releases the lock. Any process naming the same path contends for the same lock; nothing in memory is shared.
 * <p>
 * While the lock is held, a heartbeat refreshes the modification time of the directory every
 * {@link DirectoryLockConfig#updateInterval() update interval}. A waiter that sees the modification time unchanged for
 * longer than the {@link DirectoryLockConfig#staleDuration() stale duration} hands the path to a
 * {@link StaleLockHandler}, which by default fails the acquisition.
 * <p>
 * An instance serves one invocation at a time and can be reused once that invocation has returned. Waiters are not
 * served in any particular order.
 *
 * <pre>{@code
 * final DirectoryLock lock = FileSystemLocks.createDirectoryLock(Path.of("/tmp/app/lock"));
 * final long count = lock.call(() -> updateSharedCounter());
 * }</pre>
 */
public final class DirectoryLock {

    private static final Logger classLogger = LogManager.getLogger(DirectoryLock.class);

    /**
     * How often creating the directory may fail because it exists, without the directory ever being seen, before
     * giving up.
     */
    static final int MAX_CREATION_FAILURES = 50;

    private final Path path;
    private final DirectoryLockConfig config;
    private final LockFileSystem fileSystem;
    private final Clock clock;
    private final Logger logger;

    private final AtomicReference<LockState> state = new AtomicReference<>(LockState.CREATED);

    /**
     * Creates a lock. Nothing is done on disk until the lock is used.
     *
     * @param path   the lock directory
     * @param config the timing of the lock
     */
    public DirectoryLock(@NonNull final Path path, @NonNull final DirectoryLockConfig config) {
        this(path, config, LockFileSystem.nio(), Clock.systemUTC(), classLogger);
    }

    @VisibleForTesting
    DirectoryLock(
            @NonNull final Path path,
            @NonNull final DirectoryLockConfig config,
            @NonNull final LockFileSystem fileSystem,
            @NonNull final Clock clock,
            @NonNull final Logger logger) {
        this.path = requireNonNull(path, "path must not be null");
        this.config = requireNonNull(config, "config must not be null");
        this.fileSystem = requireNonNull(fileSystem, "fileSystem must not be null");
        this.clock = requireNonNull(clock, "clock must not be null");
        this.logger = requireNonNull(logger, "logger must not be null");
    }

    /**
     * Creates a builder for a lock on the given directory.
     *
     * @param path the lock directory
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull final Path path) {
        return new Builder(path);
    }

    /**
     * Acquires the lock, runs {@code action}, and releases the lock. A stale lock fails with a
     * {@link StaleLockException}.
     *
     * @param action the code to run while holding the lock
     * @return the result of {@code action}
     * @see #call(StaleLockHandler, LockedCallable)
     */
    public <T, E extends Exception> T call(@NonNull final LockedCallable<T, E> action)
            throws IOException, InterruptedException, E {
        return call(StaleLockHandler.FAIL, action);
    }

    /**
     * Acquires the lock, runs {@code action}, and releases the lock.
     * <p>
     * The lock is released however {@code action} ends, and an exception thrown by {@code action} reaches the caller
     * unchanged once the lock is released. Releasing is not affected by interrupts; an interrupt received while
     * releasing is restored afterwards.
     *
     * @param onStale what to do when the lock directory looks abandoned
     * @param action  the code to run while holding the lock
     * @return the result of {@code action}
     * @throws LockStateException    if this instance is already in use
     * @throws StaleLockException    if the lock is stale and {@code onStale} is {@link StaleLockHandler#FAIL}
     * @throws LockInternalException if the filesystem keeps refusing to create the directory without it existing
     * @throws IOException           if the lock directory cannot be created or removed, or by {@code onStale}
     * @throws InterruptedException  if interrupted while waiting for the lock
     * @throws E                     if thrown by {@code action}
     */
    public <T, E extends Exception> T call(
            @NonNull final StaleLockHandler onStale, @NonNull final LockedCallable<T, E> action)
            throws IOException, InterruptedException, E {
        requireNonNull(onStale, "onStale must not be null");
        requireNonNull(action, "action must not be null");

        final Heartbeat heartbeat = acquire(onStale);
        final T result;
        try {
            result = action.call();
        } catch (final Throwable t) {
            try {
                release(heartbeat);
            } catch (final IOException e) {
                t.addSuppressed(e);
            }
            throw t;
        }
        release(heartbeat);
        return result;
    }

    /**
     * Acquires the lock, runs {@code action}, and releases the lock. A stale lock fails with a
     * {@link StaleLockException}.
     *
     * @param action the code to run while holding the lock
     * @see #call(StaleLockHandler, LockedCallable)
     */
    public <E extends Exception> void run(@NonNull final LockedRunnable<E> action)
            throws IOException, InterruptedException, E {
        run(StaleLockHandler.FAIL, action);
    }

    /**
     * Acquires the lock, runs {@code action}, and releases the lock.
     *
     * @param onStale what to do when the lock directory looks abandoned
     * @param action  the code to run while holding the lock
     * @see #call(StaleLockHandler, LockedCallable)
     */
    public <E extends Exception> void run(@NonNull final StaleLockHandler onStale, @NonNull final LockedRunnable<E> action)
            throws IOException, InterruptedException, E {
        requireNonNull(action, "action must not be null");
        call(onStale, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Acquires the lock for use with try-with-resources. A stale lock fails with a {@link StaleLockException}.
     *
     * @return the handle that releases the lock when closed
     * @see #lock(StaleLockHandler)
     */
    @NonNull
    public Locked lock() throws IOException, InterruptedException {
        return lock(StaleLockHandler.FAIL);
    }

    /**
     * Acquires the lock for use with try-with-resources. The instance stays in use until the returned handle is
     * closed.
     *
     * @param onStale what to do when the lock directory looks abandoned
     * @return the handle that releases the lock when closed
     * @throws LockStateException   if this instance is already in use
     * @throws IOException          if the lock directory cannot be created, or by {@code onStale}
     * @throws InterruptedException if interrupted while waiting for the lock
     */
    @NonNull
    public Locked lock(@NonNull final StaleLockHandler onStale) throws IOException, InterruptedException {
        requireNonNull(onStale, "onStale must not be null");
        return new HeldLock(acquire(onStale));
    }

    /**
     * Makes a single attempt to create the lock directory, without waiting and without checking for staleness.
     *
     * @return the handle that releases the lock when closed, or {@link MaybeLocked#NOT_ACQUIRED} if the directory
     * already exists
     * @throws LockStateException if this instance is already in use
     * @throws IOException        if the lock path is not a directory or the directory cannot be created
     */
    @NonNull
    public MaybeLocked tryLock() throws IOException {
        enter();
        boolean owned = false;
        try {
            final EntryAttributes attributes = fileSystem.stat(path);
            if (attributes != null) {
                requireDirectory(attributes);
                logger.debug(FILE_LOCK.getMarker(), "Lock {} is held, not waiting for it", path);
                return MaybeLocked.NOT_ACQUIRED;
            }
            fileSystem.createParentDirectories(path);
            try {
                fileSystem.createDirectory(path);
            } catch (final FileAlreadyExistsException e) {
                logger.debug(FILE_LOCK.getMarker(), "Lost the race for lock {}, not waiting for it", path);
                return MaybeLocked.NOT_ACQUIRED;
            }
            final MaybeLocked locked = new AcquiredOnTry(new HeldLock(own()));
            owned = true;
            return locked;
        } finally {
            if (!owned) {
                state.set(LockState.CREATED);
            }
        }
    }

    /**
     * Checks whether anyone currently holds the lock, that is whether the lock directory exists. The answer may be
     * outdated as soon as it is returned.
     *
     * @return true if the lock directory exists
     * @throws IOException if the lock path cannot be inspected
     */
    public boolean isHeldByAnyone() throws IOException {
        final EntryAttributes attributes = fileSystem.stat(path);
        return attributes != null && attributes.directory();
    }

    /**
     * @return the lock directory
     */
    @NonNull
    public Path path() {
        return path;
    }

    /**
     * @return the timing of this lock
     */
    @NonNull
    public DirectoryLockConfig config() {
        return config;
    }

    /**
     * @return the state of this instance
     */
    @NonNull
    public LockState state() {
        return state.get();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("path", path)
                .add("state", state.get())
                .toString();
    }

    /**
     * Moves from {@link LockState#CREATED} through {@link LockState#TAKING} to {@link LockState#OWNED}. A failed
     * acquisition goes back to {@link LockState#CREATED}.
     */
    @NonNull
    private Heartbeat acquire(@NonNull final StaleLockHandler onStale) throws IOException, InterruptedException {
        enter();
        boolean owned = false;
        try {
            take(onStale);
            final Heartbeat heartbeat = own();
            owned = true;
            return heartbeat;
        } finally {
            if (!owned) {
                state.set(LockState.CREATED);
            }
        }
    }

    private void enter() {
        if (!state.compareAndSet(LockState.CREATED, LockState.TAKING)) {
            throw new LockStateException(path, state.get());
        }
    }

    /**
     * Waits until this process has created the lock directory.
     */
    private void take(@NonNull final StaleLockHandler onStale) throws IOException, InterruptedException {
        final long staleFactor = config.staleFactor();
        Instant lastModified = null;
        Instant lastChangeObservedAt = null;
        long unchangedPolls = 0;
        int creationFailures = 0;

        while (true) {
            final EntryAttributes attributes = fileSystem.stat(path);
            if (attributes != null) {
                requireDirectory(attributes);
                creationFailures = 0;

                final Instant now = clock.instant();
                if (attributes.lastModifiedTime().equals(lastModified)) {
                    unchangedPolls++;
                } else {
                    unchangedPolls = 0;
                    lastModified = attributes.lastModifiedTime();
                    lastChangeObservedAt = now;
                }

                final Duration unchangedFor = Duration.between(lastChangeObservedAt, now);
                if (unchangedPolls >= staleFactor && unchangedFor.compareTo(config.staleDuration()) > 0) {
                    logger.info(
                            FILE_LOCK.getMarker(),
                            "Lock {} has not been refreshed for {} ({} polls), treating it as stale",
                            path,
                            unchangedFor,
                            unchangedPolls);
                    onStale.onStale(path, lastModified);
                    unchangedPolls = 0;
                    continue;
                }

                logger.trace(FILE_LOCK.getMarker(), "Lock {} is held, polling again", path);
                TimeUnit.NANOSECONDS.sleep(config.pollInterval().toNanos());
                continue;
            }

            fileSystem.createParentDirectories(path);
            try {
                fileSystem.createDirectory(path);
                logger.debug(FILE_LOCK.getMarker(), "Acquired lock {}", path);
                return;
            } catch (final FileAlreadyExistsException e) {
                creationFailures++;
                if (creationFailures > MAX_CREATION_FAILURES) {
                    final LockInternalException failure = new LockInternalException(path, creationFailures);
                    logger.error(EXCEPTION.getMarker(), "Giving up on lock {}", path, failure);
                    throw failure;
                }
                logger.debug(FILE_LOCK.getMarker(), "Lost the race for lock {}, retrying", path);
            }
        }
    }

    /**
     * Starts the heartbeat for a freshly created lock directory and marks this instance as the owner.
     */
    @NonNull
    private Heartbeat own() throws IOException {
        final Heartbeat heartbeat;
        try {
            heartbeat = Heartbeat.start(path, config.updateInterval(), fileSystem, clock, logger);
        } catch (final RuntimeException | Error e) {
            try {
                fileSystem.deleteDirectory(path);
            } catch (final IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        state.set(LockState.OWNED);
        return heartbeat;
    }

    /**
     * Stops the heartbeat, waits for it to be done, and removes the lock directory. Always ends in
     * {@link LockState#CREATED}.
     */
    private void release(@NonNull final Heartbeat heartbeat) throws IOException {
        state.set(LockState.RELEASING);
        try {
            heartbeat.cancel();
            heartbeat.awaitDone();
            if (fileSystem.deleteDirectory(path)) {
                logger.debug(FILE_LOCK.getMarker(), "Released lock {}", path);
            } else {
                logger.warn(FILE_LOCK.getMarker(), "Lock {} was already gone when releasing it", path);
            }
        } finally {
            state.set(LockState.CREATED);
        }
    }

    private void requireDirectory(@NonNull final EntryAttributes attributes) throws NotDirectoryException {
        if (!attributes.directory()) {
            throw new NotDirectoryException(path.toString());
        }
    }

    /**
     * Releases the lock when closed. Closing more than once has no further effect.
     */
    private final class HeldLock implements Locked {
        private final Heartbeat heartbeat;
        private final AtomicBoolean closed = new AtomicBoolean();

        private HeldLock(@NonNull final Heartbeat heartbeat) {
            this.heartbeat = heartbeat;
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                release(heartbeat);
            } catch (final IOException e) {
                throw new UncheckedIOException("Failed to release lock " + path, e);
            }
        }
    }

    /**
     * Builds a {@link DirectoryLock}. Timing values that are not set are derived as described in
     * {@link DirectoryLockConfig#of(Duration, Duration, Duration)}.
     */
    public static final class Builder {
        private final Path path;
        private Duration pollInterval;
        private Duration updateInterval;
        private Duration staleDuration;
        private Logger logger = classLogger;
        private LockFileSystem fileSystem = LockFileSystem.nio();
        private Clock clock = Clock.systemUTC();

        private Builder(@NonNull final Path path) {
            this.path = requireNonNull(path, "path must not be null");
        }

        @NonNull
        public Builder pollInterval(@Nullable final Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        @NonNull
        public Builder updateInterval(@Nullable final Duration updateInterval) {
            this.updateInterval = updateInterval;
            return this;
        }

        @NonNull
        public Builder staleDuration(@Nullable final Duration staleDuration) {
            this.staleDuration = staleDuration;
            return this;
        }

        /**
         * Sets all timing values at once.
         */
        @NonNull
        public Builder config(@NonNull final DirectoryLockConfig config) {
            requireNonNull(config, "config must not be null");
            this.pollInterval = config.pollInterval();
            this.updateInterval = config.updateInterval();
            this.staleDuration = config.staleDuration();
            return this;
        }

        /**
         * Sets the logger the lock reports to. Defaults to the logger of {@link DirectoryLock}.
         */
        @NonNull
        public Builder logger(@NonNull final Logger logger) {
            this.logger = requireNonNull(logger, "logger must not be null");
            return this;
        }

        @NonNull
        public Builder fileSystem(@NonNull final LockFileSystem fileSystem) {
            this.fileSystem = requireNonNull(fileSystem, "fileSystem must not be null");
            return this;
        }

        @NonNull
        public Builder clock(@NonNull final Clock clock) {
            this.clock = requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * @return the lock
         * @throws IllegalArgumentException if the timing values are inconsistent
         */
        @NonNull
        public DirectoryLock build() {
            return new DirectoryLock(
                    path, DirectoryLockConfig.of(pollInterval, updateInterval, staleDuration), fileSystem, clock, logger);
        }
    }
}
