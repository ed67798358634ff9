// SPDX-License-Identifier: Apache-2.0
/**
 * Internal implementation of the filesystem lock. Should not be used outside of the
 * {@link org.hiero.base.fslock} package.
 */
package org.hiero.base.fslock.internal;
