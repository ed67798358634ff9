// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

/**
 * Code that runs while a {@link DirectoryLock} is held.
 *
 * @param <E>
 * 		the type of exception the code may throw
 */
@FunctionalInterface
public interface LockedRunnable<E extends Exception> {
    void run() throws E;
}
