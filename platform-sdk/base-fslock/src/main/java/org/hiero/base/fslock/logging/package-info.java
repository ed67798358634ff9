// SPDX-License-Identifier: Apache-2.0
/**
 * Logging support for the filesystem lock.
 */
package org.hiero.base.fslock.logging;
