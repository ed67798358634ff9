// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock.internal;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.base.fslock.locked.Locked;
import org.hiero.base.fslock.locked.MaybeLocked;

/**
 * Returned when a lock has been acquired on a try
 */
public final class AcquiredOnTry implements MaybeLocked {
    private final Locked locked;

    public AcquiredOnTry(@NonNull final Locked locked) {
        this.locked = requireNonNull(locked);
    }

    @Override
    public void close() {
        locked.close();
    }

    @Override
    public boolean isLockAcquired() {
        return true;
    }
}
