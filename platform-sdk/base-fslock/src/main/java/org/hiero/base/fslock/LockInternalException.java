// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.file.Path;

/**
 * Thrown when creating the lock directory keeps failing because it already exists, while the directory is never
 * observed to exist. The filesystem is not honouring the stat/mkdir contract and acquiring cannot make progress.
 */
public class LockInternalException extends RuntimeException {

    private final transient Path path;
    private final int attempts;

    public LockInternalException(@NonNull final Path path, final int attempts) {
        super("Failed to create lock directory " + path + " after " + attempts
                + " attempts although it never appeared to exist");
        this.path = path;
        this.attempts = attempts;
    }

    @NonNull
    public Path getPath() {
        return path;
    }

    /**
     * @return the number of failed creation attempts
     */
    public int getAttempts() {
        return attempts;
    }
}
