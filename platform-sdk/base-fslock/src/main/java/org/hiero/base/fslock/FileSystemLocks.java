// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.file.Path;

/**
 * Factory for filesystem locks. Should be used as a facade for the API.
 */
public interface FileSystemLocks {

    /**
     * Creates a lock on a directory with the default timing of {@link DirectoryLockConfig#defaults()}.
     *
     * @param path
     * 		the lock directory, which must not exist while the lock is free
     * @return the lock
     */
    @NonNull
    static DirectoryLock createDirectoryLock(@NonNull final Path path) {
        return new DirectoryLock(path, DirectoryLockConfig.defaults());
    }

    /**
     * Creates a lock on a directory.
     *
     * @param path
     * 		the lock directory, which must not exist while the lock is free
     * @param config
     * 		the timing of the lock
     * @return the lock
     */
    @NonNull
    static DirectoryLock createDirectoryLock(@NonNull final Path path, @NonNull final DirectoryLockConfig config) {
        return new DirectoryLock(path, config);
    }

    /**
     * Creates a builder for a lock that needs a custom logger, filesystem or clock.
     *
     * @param path
     * 		the lock directory
     * @return the builder
     */
    @NonNull
    static DirectoryLock.Builder builder(@NonNull final Path path) {
        return DirectoryLock.builder(path);
    }
}
