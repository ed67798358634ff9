// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown by {@link StaleLockHandler#FAIL} when the lock directory has not been refreshed for longer than the stale
 * duration, which usually means its holder died without releasing it.
 */
public class StaleLockException extends IOException {

    private final transient Path path;

    public StaleLockException(@NonNull final Path path) {
        super("Stale lock detected at " + path);
        this.path = path;
    }

    @NonNull
    public Path getPath() {
        return path;
    }
}
