// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

/**
 * Code that runs while a {@link DirectoryLock} is held and produces a value.
 *
 * @param <T>
 * 		the type of the result
 * @param <E>
 * 		the type of exception the code may throw
 */
@FunctionalInterface
public interface LockedCallable<T, E extends Exception> {
    T call() throws E;
}
