// SPDX-License-Identifier: Apache-2.0
/**
 * Handles returned when a {@link org.hiero.base.fslock.DirectoryLock} is acquired, used with try-with-resources.
 * See {@link org.hiero.base.fslock.FileSystemLocks} for how to create locks.
 */
package org.hiero.base.fslock.locked;
