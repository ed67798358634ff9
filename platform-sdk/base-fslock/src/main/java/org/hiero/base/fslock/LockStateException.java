// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.file.Path;

/**
 * Thrown when a {@link DirectoryLock} is used while a previous invocation on the same instance has not finished yet.
 * Locks are not re-entrant.
 */
public class LockStateException extends IllegalStateException {

    private final transient Path path;
    private final LockState state;

    /**
     * @param path
     * 		the lock directory
     * @param state
     * 		the state the lock was found in
     */
    public LockStateException(@NonNull final Path path, @NonNull final LockState state) {
        super("Lock " + path + " is already in use (state " + state + ")");
        this.path = path;
        this.state = state;
    }

    /**
     * @return the lock directory
     */
    @NonNull
    public Path getPath() {
        return path;
    }

    /**
     * @return the state the lock was in when it was rejected
     */
    @NonNull
    public LockState getState() {
        return state;
    }
}
