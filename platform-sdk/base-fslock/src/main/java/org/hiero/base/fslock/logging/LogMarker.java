// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock.logging;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

/**
 * Log4j markers used by the filesystem lock, so its output can be filtered or routed separately.
 */
public enum LogMarker {
    /** Unexpected failures */
    EXCEPTION,
    /** Acquisition, contention, staleness and release of lock directories */
    FILE_LOCK,
    /** Refreshes of a held lock directory */
    HEARTBEAT;

    private final Marker marker;

    LogMarker() {
        this.marker = MarkerManager.getMarker(name());
    }

    /**
     * @return the log4j marker for this value
     */
    @NonNull
    public Marker getMarker() {
        return marker;
    }
}
