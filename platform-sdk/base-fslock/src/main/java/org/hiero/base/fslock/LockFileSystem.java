// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.time.Instant;
import org.hiero.base.fslock.internal.NioLockFileSystem;

/**
 * The filesystem operations a {@link DirectoryLock} is built on. Directory creation must be atomic and exclusive, every
 * other guarantee of the lock follows from that.
 */
public interface LockFileSystem {

    /**
     * Reads the type and modification time of an entry.
     *
     * @param path
     * 		the entry to inspect
     * @return the attributes, or {@code null} if there is no such entry
     * @throws IOException
     * 		if the entry exists but cannot be read
     */
    @Nullable
    EntryAttributes stat(@NonNull Path path) throws IOException;

    /**
     * Creates every missing parent directory of {@code path}.
     *
     * @param path
     * 		the path whose parents are created
     * @throws IOException
     * 		if a parent cannot be created
     */
    void createParentDirectories(@NonNull Path path) throws IOException;

    /**
     * Creates a directory, failing if any entry already exists under that name.
     *
     * @param path
     * 		the directory to create
     * @throws FileAlreadyExistsException
     * 		if the entry exists
     * @throws IOException
     * 		on any other failure
     */
    void createDirectory(@NonNull Path path) throws IOException;

    /**
     * Removes an empty directory.
     *
     * @param path
     * 		the directory to remove
     * @return {@code true} if it was removed, {@code false} if it did not exist
     * @throws IOException
     * 		if it exists but cannot be removed
     */
    boolean deleteDirectory(@NonNull Path path) throws IOException;

    /**
     * Sets the modification time of an existing entry.
     *
     * @param path
     * 		the entry to update
     * @param time
     * 		the new modification time
     * @throws IOException
     * 		if the entry is missing or cannot be updated
     */
    void setLastModifiedTime(@NonNull Path path, @NonNull Instant time) throws IOException;

    /**
     * @return the filesystem backed by {@link java.nio.file.Files}
     */
    @NonNull
    static LockFileSystem nio() {
        return NioLockFileSystem.INSTANCE;
    }

    /**
     * The result of {@link #stat(Path)}.
     *
     * @param directory
     * 		whether the entry is a directory
     * @param lastModifiedTime
     * 		the modification time of the entry
     */
    record EntryAttributes(boolean directory, @NonNull Instant lastModifiedTime) {
        public EntryAttributes {
            requireNonNull(lastModifiedTime, "lastModifiedTime must not be null");
        }
    }
}
