// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

/**
 * The lifecycle of a {@link DirectoryLock} instance. A lock always returns to {@link #CREATED} once a
 * {@code call}/{@code run} invocation has finished, so the same instance can be used again.
 */
public enum LockState {
    /** Idle, ready to acquire */
    CREATED,
    /** Polling for the lock directory */
    TAKING,
    /** The lock directory was created by this instance and the heartbeat is running */
    OWNED,
    /** Stopping the heartbeat and removing the lock directory */
    RELEASING
}
