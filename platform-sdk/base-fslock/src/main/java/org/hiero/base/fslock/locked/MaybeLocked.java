// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock.locked;

import org.hiero.base.fslock.DirectoryLock;

/**
 * Returned by {@link DirectoryLock#tryLock()}, which makes a single attempt and may not get the lock.
 */
public interface MaybeLocked extends Locked {
    /** Returned when the lock directory already existed */
    MaybeLocked NOT_ACQUIRED = new MaybeLocked() {
        @Override
        public boolean isLockAcquired() {
            return false;
        }

        @Override
        public void close() {
            // nothing was acquired
        }
    };

    /**
     * @return true if the lock directory was created by this attempt, false otherwise
     */
    boolean isLockAcquired();
}
