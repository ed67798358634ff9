// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock.locked;

import org.hiero.base.fslock.DirectoryLock;

/**
 * Returned by a {@link DirectoryLock} when the lock has been acquired. Closing it releases the lock.
 */
@FunctionalInterface
public interface Locked extends AutoCloseable {
    /**
     * Stops the heartbeat and removes the lock directory. Failing to remove the directory is reported as an
     * {@link java.io.UncheckedIOException}.
     */
    @Override
    void close();
}
