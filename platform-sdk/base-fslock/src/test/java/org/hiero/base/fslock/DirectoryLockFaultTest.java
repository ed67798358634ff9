// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.base.fslock.LockFileSystem.EntryAttributes;
import org.hiero.base.fslock.locked.Locked;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Drives a {@link DirectoryLock} through a mocked {@link LockFileSystem} to produce failures a real filesystem rarely
 * shows.
 */
@ExtendWith(MockitoExtension.class)
class DirectoryLockFaultTest {

    private static final Logger logger = LogManager.getLogger(DirectoryLockFaultTest.class);
    private static final DirectoryLockConfig CONFIG =
            new DirectoryLockConfig(Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofMillis(10));
    private static final EntryAttributes HELD = new EntryAttributes(true, Instant.parse("2024-01-01T00:00:00Z"));

    private final Path path = Path.of("locks", "lock");

    @Mock
    private LockFileSystem fileSystem;

    @Mock
    private Clock clock;

    private DirectoryLock newLock(final Clock lockClock) {
        return new DirectoryLock(path, CONFIG, fileSystem, lockClock, logger);
    }

    @Test
    @DisplayName("Creation failing as 'exists' while the directory is never seen is fatal")
    void neverObservedDirectoryIsFatal() throws IOException {
        when(fileSystem.stat(path)).thenReturn(null);
        doThrow(new FileAlreadyExistsException(path.toString())).when(fileSystem).createDirectory(path);
        final DirectoryLock lock = newLock(Clock.systemUTC());

        assertThatThrownBy(() -> lock.run(() -> {}))
                .isInstanceOf(LockInternalException.class)
                .satisfies(e -> {
                    assertThat(((LockInternalException) e).getAttempts())
                            .isEqualTo(DirectoryLock.MAX_CREATION_FAILURES + 1);
                    assertThat(((LockInternalException) e).getPath()).isEqualTo(path);
                });

        verify(fileSystem, times(DirectoryLock.MAX_CREATION_FAILURES + 1)).createDirectory(path);
        verify(fileSystem, never()).deleteDirectory(path);
        assertThat(lock.state()).isEqualTo(LockState.CREATED);
    }

    @Test
    @DisplayName("Seeing the directory resets the count of failed creations")
    void observedDirectoryResetsCreationFailures() throws Exception {
        final int failuresPerStreak = 40;
        final AtomicInteger stats = new AtomicInteger();
        final AtomicInteger creations = new AtomicInteger();
        when(fileSystem.stat(path))
                .thenAnswer(invocation -> stats.incrementAndGet() == failuresPerStreak + 1 ? HELD : null);
        doAnswerCreation(creations, 2 * failuresPerStreak);
        final DirectoryLock lock = newLock(Clock.systemUTC());

        assertThat(lock.call(() -> "owned")).isEqualTo("owned");

        assertThat(creations).hasValue(2 * failuresPerStreak + 1);
        verify(fileSystem).deleteDirectory(path);
    }

    private void doAnswerCreation(final AtomicInteger creations, final int failures) throws IOException {
        doAnswer(invocation -> {
                    if (creations.incrementAndGet() <= failures) {
                        throw new FileAlreadyExistsException(path.toString());
                    }
                    return null;
                })
                .when(fileSystem)
                .createDirectory(path);
    }

    @Test
    @DisplayName("Creation failing for any other reason reaches the caller unchanged")
    void otherCreationFailuresPropagate() throws IOException {
        final AccessDeniedException denied = new AccessDeniedException(path.toString());
        when(fileSystem.stat(path)).thenReturn(null);
        doThrow(denied).when(fileSystem).createDirectory(path);
        final DirectoryLock lock = newLock(Clock.systemUTC());

        assertThatThrownBy(() -> lock.run(() -> {})).isSameAs(denied);

        verify(fileSystem, times(1)).createDirectory(path);
        assertThat(lock.state()).isEqualTo(LockState.CREATED);
    }

    @Test
    @DisplayName("A failing heartbeat is logged and does not disturb the locked block")
    void heartbeatFailureDoesNotReachTheBlock() throws Exception {
        when(fileSystem.stat(path)).thenReturn(null);
        doThrow(new NoSuchFileException(path.toString()))
                .when(fileSystem)
                .setLastModifiedTime(eq(path), any(Instant.class));
        final DirectoryLock lock = newLock(Clock.systemUTC());

        final String result = lock.call(() -> {
            Thread.sleep(100);
            return "finished";
        });

        assertThat(result).isEqualTo("finished");
        verify(fileSystem, times(1)).setLastModifiedTime(eq(path), any(Instant.class));
        verify(fileSystem).deleteDirectory(path);
    }

    @Test
    @DisplayName("The heartbeat refreshes the directory while the block runs")
    void heartbeatRefreshesWhileHeld() throws Exception {
        when(fileSystem.stat(path)).thenReturn(null);
        when(fileSystem.deleteDirectory(path)).thenReturn(true);
        final DirectoryLock lock = newLock(Clock.systemUTC());

        lock.run(() -> Thread.sleep(100));

        verify(fileSystem, atLeastOnce()).setLastModifiedTime(eq(path), any(Instant.class));
        verify(fileSystem).deleteDirectory(path);
    }

    @Test
    @DisplayName("A failure to remove the directory is attached to the block's own failure")
    void releaseFailureIsSuppressedIntoBlockFailure() throws IOException {
        final DirectoryNotEmptyException notEmpty = new DirectoryNotEmptyException(path.toString());
        when(fileSystem.stat(path)).thenReturn(null);
        when(fileSystem.deleteDirectory(path)).thenThrow(notEmpty);
        final DirectoryLock lock = newLock(Clock.systemUTC());
        final IllegalStateException blockFailure = new IllegalStateException("block failed");

        assertThatThrownBy(() -> lock.run(() -> {
                    throw blockFailure;
                }))
                .isSameAs(blockFailure)
                .hasSuppressedException(notEmpty);
        assertThat(lock.state()).isEqualTo(LockState.CREATED);
    }

    @Test
    @DisplayName("A failure to remove the directory after a successful block is reported")
    void releaseFailureAfterSuccessIsThrown() throws IOException {
        final DirectoryNotEmptyException notEmpty = new DirectoryNotEmptyException(path.toString());
        when(fileSystem.stat(path)).thenReturn(null);
        when(fileSystem.deleteDirectory(path)).thenThrow(notEmpty);
        final DirectoryLock lock = newLock(Clock.systemUTC());

        assertThatThrownBy(() -> lock.call(() -> "ok")).isSameAs(notEmpty);
        assertThatThrownBy(() -> {
                    try (final Locked ignored = lock.lock()) {
                        assertThat(lock.state()).isEqualTo(LockState.OWNED);
                    }
                })
                .isInstanceOf(UncheckedIOException.class)
                .hasCause(notEmpty);
        assertThat(lock.state()).isEqualTo(LockState.CREATED);
    }

    @Test
    @DisplayName("Staleness needs the elapsed time as well as enough unchanged polls")
    void staleAfterEnoughPollsAndElapsedTime() throws IOException {
        final AtomicInteger ticks = new AtomicInteger();
        when(fileSystem.stat(path)).thenReturn(HELD);
        when(clock.instant()).thenAnswer(invocation -> Instant.EPOCH.plusSeconds(ticks.getAndIncrement()));
        final DirectoryLock lock = newLock(clock);

        assertThatThrownBy(() -> lock.run(() -> {})).isInstanceOf(StaleLockException.class);

        // one look to record the modification time, then stale-factor unchanged looks
        verify(fileSystem, times((int) CONFIG.staleFactor() + 1)).stat(path);
    }

    @Test
    @DisplayName("Unchanged polls alone do not make a lock stale while no time passes")
    void unchangedPollsWithoutElapsedTimeAreNotStale() throws Exception {
        final AtomicInteger stats = new AtomicInteger();
        final int polls = (int) CONFIG.staleFactor() * 5;
        when(fileSystem.stat(path)).thenAnswer(invocation -> stats.incrementAndGet() <= polls ? HELD : null);
        when(clock.instant()).thenReturn(Instant.EPOCH);
        final DirectoryLock lock = newLock(clock);

        lock.run(() -> {});

        assertThat(stats).hasValue(polls + 1);
    }

    @Test
    @DisplayName("A refreshed modification time keeps the lock from being stale however much time passes")
    void changingModificationTimeIsNeverStale() throws Exception {
        final AtomicInteger stats = new AtomicInteger();
        final int polls = 50;
        when(fileSystem.stat(path)).thenAnswer(invocation -> {
            final int look = stats.incrementAndGet();
            return look <= polls ? new EntryAttributes(true, Instant.EPOCH.plusMillis(look)) : null;
        });
        final AtomicInteger ticks = new AtomicInteger();
        when(clock.instant()).thenAnswer(invocation -> Instant.EPOCH.plusSeconds(3600L * ticks.getAndIncrement()));
        final DirectoryLock lock = newLock(clock);

        lock.run(() -> {});

        assertThat(stats).hasValue(polls + 1);
    }
}
