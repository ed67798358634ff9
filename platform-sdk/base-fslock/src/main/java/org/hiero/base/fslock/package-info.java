// SPDX-License-Identifier: Apache-2.0
/**
 * A lock shared between processes through the filesystem. See {@link org.hiero.base.fslock.FileSystemLocks} for how to
 * create locks and {@link org.hiero.base.fslock.DirectoryLock} for how they behave.
 */
package org.hiero.base.fslock;
