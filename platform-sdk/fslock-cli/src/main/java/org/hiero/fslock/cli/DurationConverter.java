// SPDX-License-Identifier: Apache-2.0
package org.hiero.fslock.cli;

import java.time.Duration;
import org.hiero.base.fslock.DirectoryLockConfig;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Reads durations the same way lock properties are read: {@code 250ms}, {@code 5s} or ISO-8601 such as
 * {@code PT0.25S}.
 */
public class DurationConverter implements ITypeConverter<Duration> {

    @Override
    public Duration convert(final String value) {
        try {
            return DirectoryLockConfig.parseDuration(value);
        } catch (final IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage());
        }
    }
}
