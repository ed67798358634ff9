// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Timing of a {@link DirectoryLock}.
 * <p>
 * The heartbeat of a holder refreshes the lock directory every {@code updateInterval}, so the update interval has to
 * be shorter than the {@code staleDuration} after which waiters give up on the holder. Use {@link #of(Duration,
 * Duration, Duration)} to have missing values derived from the given ones.
 *
 * @param pollInterval   the time a waiter sleeps between two looks at the lock directory
 * @param updateInterval the time between two heartbeat refreshes of the lock directory
 * @param staleDuration  the minimum time the lock directory has to stay unchanged before it is considered stale
 */
public record DirectoryLockConfig(
        @NonNull Duration pollInterval, @NonNull Duration updateInterval, @NonNull Duration staleDuration) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(10);
    public static final Duration MIN_DEFAULT_STALE_DURATION = Duration.ofSeconds(1);

    /** The longest duration accepted, the longest that can be counted in nanoseconds */
    public static final Duration MAX_DURATION = Duration.ofNanos(Long.MAX_VALUE);

    /** Prefix of the keys read by {@link #fromProperties(Properties)} */
    public static final String PROPERTY_PREFIX = "fslock.";

    private static final int UPDATES_PER_POLL = 10;
    private static final int UPDATES_PER_STALE_DURATION = 6;
    private static final Duration MIN_DERIVED_UPDATE_INTERVAL = Duration.ofMillis(1);
    private static final Pattern DURATION_WITH_UNIT = Pattern.compile("(\\d+)\\s*(ns|us|ms|s|m|h)");

    public DirectoryLockConfig {
        requireNonNull(pollInterval, "pollInterval must not be null");
        requireNonNull(updateInterval, "updateInterval must not be null");
        requireNonNull(staleDuration, "staleDuration must not be null");
        requireInRange("pollInterval", pollInterval);
        requireInRange("updateInterval", updateInterval);
        requireInRange("staleDuration", staleDuration);
        if (updateInterval.compareTo(staleDuration) >= 0) {
            throw new IllegalArgumentException("updateInterval must be shorter than staleDuration (found: "
                    + updateInterval + " >= " + staleDuration + ")");
        }
    }

    /**
     * @return the configuration used when nothing is specified
     */
    @NonNull
    public static DirectoryLockConfig defaults() {
        return of(null, null, null);
    }

    /**
     * Creates a configuration, deriving missing values.
     * <ul>
     *     <li>{@code pollInterval} defaults to {@link #DEFAULT_POLL_INTERVAL}</li>
     *     <li>{@code updateInterval} defaults to a sixth of {@code staleDuration} if that is given, otherwise to ten
     *     poll intervals</li>
     *     <li>{@code staleDuration} defaults to ten update intervals, but at least
     *     {@link #MIN_DEFAULT_STALE_DURATION}</li>
     * </ul>
     *
     * @param pollInterval   the poll interval, or {@code null}
     * @param updateInterval the update interval, or {@code null}
     * @param staleDuration  the stale duration, or {@code null}
     * @return the configuration
     * @throws IllegalArgumentException if the resulting values are inconsistent
     */
    @NonNull
    public static DirectoryLockConfig of(
            @Nullable final Duration pollInterval,
            @Nullable final Duration updateInterval,
            @Nullable final Duration staleDuration) {
        final Duration poll = pollInterval != null ? pollInterval : DEFAULT_POLL_INTERVAL;
        final Duration update;
        if (updateInterval != null) {
            update = updateInterval;
        } else if (staleDuration != null) {
            update = max(staleDuration.dividedBy(UPDATES_PER_STALE_DURATION), MIN_DERIVED_UPDATE_INTERVAL);
        } else {
            update = poll.multipliedBy(UPDATES_PER_POLL);
        }
        final Duration stale = staleDuration != null
                ? staleDuration
                : max(update.multipliedBy(UPDATES_PER_POLL), MIN_DEFAULT_STALE_DURATION);
        return new DirectoryLockConfig(poll, update, stale);
    }

    /**
     * Reads {@code fslock.pollInterval}, {@code fslock.updateInterval} and {@code fslock.staleDuration}. Missing keys
     * are derived as described in {@link #of(Duration, Duration, Duration)}.
     *
     * @param properties the properties to read
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed or the values are inconsistent
     */
    @NonNull
    public static DirectoryLockConfig fromProperties(@NonNull final Properties properties) {
        requireNonNull(properties, "properties must not be null");
        return of(
                readDuration(properties, "pollInterval"),
                readDuration(properties, "updateInterval"),
                readDuration(properties, "staleDuration"));
    }

    /**
     * Parses an ISO-8601 duration ({@code PT0.5S}) or a whole number followed by one of the units {@code ns},
     * {@code us}, {@code ms}, {@code s}, {@code m} or {@code h} ({@code 500ms}).
     *
     * @param value the text to parse
     * @return the duration
     * @throws IllegalArgumentException if the text is neither
     */
    @NonNull
    public static Duration parseDuration(@NonNull final String value) {
        requireNonNull(value, "value must not be null");
        final String trimmed = value.trim().toLowerCase(Locale.ROOT);
        final Matcher matcher = DURATION_WITH_UNIT.matcher(trimmed);
        if (matcher.matches()) {
            final long amount = Long.parseLong(matcher.group(1));
            return switch (matcher.group(2)) {
                case "ns" -> Duration.ofNanos(amount);
                case "us" -> Duration.ofNanos(Math.multiplyExact(amount, 1_000L));
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                default -> Duration.ofHours(amount);
            };
        }
        try {
            return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException("Cannot parse duration '" + value + "'", e);
        }
    }

    /**
     * The number of consecutive polls that must see an unchanged modification time before a waiter even looks at how
     * long the lock has been unchanged. A sleeping machine can make a lot of time pass between two polls without the
     * holder getting a chance to refresh the lock, and this guards against treating that as staleness.
     *
     * @return the stale factor, at least 2
     */
    public long staleFactor() {
        return Math.max(staleDuration.dividedBy(pollInterval), 2);
    }

    @Nullable
    private static Duration readDuration(@NonNull final Properties properties, @NonNull final String name) {
        final String key = PROPERTY_PREFIX + name;
        final String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return parseDuration(value);
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    private static void requireInRange(@NonNull final String name, @NonNull final Duration value) {
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive (found: " + value + ")");
        }
        if (value.compareTo(MAX_DURATION) > 0) {
            throw new IllegalArgumentException(name + " must not exceed " + MAX_DURATION + " (found: " + value + ")");
        }
    }

    @NonNull
    private static Duration max(@NonNull final Duration a, @NonNull final Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
