// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import org.hiero.base.fslock.LockFileSystem.EntryAttributes;

/**
 * Decides what happens when a waiter concludes that the lock directory is stale. If
 * {@link #onStale(Path, Instant)} returns normally the waiter keeps polling; it does not assume the directory is gone.
 * Throwing aborts the acquisition and the exception reaches the caller unchanged.
 */
@FunctionalInterface
public interface StaleLockHandler {

    /** Fails the acquisition with a {@link StaleLockException}. Used when no handler is given. */
    StaleLockHandler FAIL = (path, lastModified) -> {
        throw new StaleLockException(path);
    };

    /**
     * Called by a waiter when the lock directory has not been refreshed for longer than the stale duration.
     *
     * @param path
     * 		the lock directory
     * @param lastModified
     * 		the modification time the waiter saw unchanged; another waiter may have replaced the directory since
     * @throws IOException
     * 		to abort the acquisition
     */
    void onStale(@NonNull Path path, @NonNull Instant lastModified) throws IOException;

    /**
     * A handler that removes the stale lock directory so that the next poll can create it again.
     *
     * @return the handler
     * @see #breakLock(LockFileSystem)
     */
    @NonNull
    static StaleLockHandler breakLock() {
        return breakLock(LockFileSystem.nio());
    }

    /**
     * A handler that removes the stale lock directory through the given filesystem, as long as it still carries the
     * modification time that was judged stale. A directory that was replaced in the meantime, for example by another
     * waiter that broke the lock first, is left alone, and so is a directory that already disappeared.
     * <p>
     * The check and the removal are two separate filesystem operations. Two waiters that both check before either
     * removes can still remove a directory that one of them has just created; the window is the time between a
     * {@code stat} and an {@code rmdir}.
     *
     * @param fileSystem
     * 		the filesystem holding the lock directory
     * @return the handler
     */
    @NonNull
    static StaleLockHandler breakLock(@NonNull final LockFileSystem fileSystem) {
        requireNonNull(fileSystem);
        return (path, lastModified) -> {
            final EntryAttributes current = fileSystem.stat(path);
            if (current != null && current.directory() && current.lastModifiedTime().equals(lastModified)) {
                fileSystem.deleteDirectory(path);
            }
        };
    }
}
