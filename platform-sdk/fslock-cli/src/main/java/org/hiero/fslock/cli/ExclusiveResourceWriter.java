// SPDX-License-Identifier: Apache-2.0
package org.hiero.fslock.cli;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks that a resource is used by one writer at a time. Each check creates the resource exclusively, writes the
 * owner into it, pauses, reads it back and deletes it. Finding the resource already present, or reading back another
 * owner, counts as a violation.
 */
public class ExclusiveResourceWriter {

    private static final Logger log = LogManager.getLogger(ExclusiveResourceWriter.class);

    private final Path resource;
    private final Duration pause;
    private final AtomicLong checks = new AtomicLong();
    private final AtomicLong violations = new AtomicLong();

    public ExclusiveResourceWriter(@NonNull final Path resource, @NonNull final Duration pause) {
        this.resource = requireNonNull(resource, "resource must not be null");
        this.pause = requireNonNull(pause, "pause must not be null");
    }

    /**
     * Runs one check. Must be called while holding the lock that guards the resource.
     *
     * @param owner the name written into the resource
     * @return true if the resource was used exclusively
     */
    public boolean check(@NonNull final String owner) throws IOException, InterruptedException {
        checks.incrementAndGet();
        try {
            Files.writeString(resource, owner, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        } catch (final FileAlreadyExistsException e) {
            violations.incrementAndGet();
            log.warn("{} found {} already in use", owner, resource);
            return false;
        }

        TimeUnit.NANOSECONDS.sleep(pause.toNanos());

        final String found = Files.readString(resource, StandardCharsets.UTF_8);
        Files.delete(resource);
        if (!owner.equals(found)) {
            violations.incrementAndGet();
            log.warn("{} read back {} from {}", owner, found, resource);
            return false;
        }
        return true;
    }

    public long getChecks() {
        return checks.get();
    }

    public long getViolations() {
        return violations.get();
    }
}
