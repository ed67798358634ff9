// SPDX-License-Identifier: Apache-2.0
package org.hiero.fslock.cli;

import java.io.PrintWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.base.fslock.DirectoryLock;
import org.hiero.base.fslock.StaleLockHandler;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
        name = "hold",
        mixinStandardHelpOptions = true,
        description = "Acquires the lock, holds it for the given time and releases it")
public class HoldCommand implements Callable<Integer> {

    private static final Logger log = LogManager.getLogger(HoldCommand.class);

    @ParentCommand
    private FsLockCommand parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", converter = DurationConverter.class, description = "How long to hold the lock")
    private Duration holdFor;

    @Option(
            names = "--break-stale",
            description = "Remove a stale lock and take it over instead of failing")
    private boolean breakStale;

    @Override
    public Integer call() throws Exception {
        final PrintWriter out = spec.commandLine().getOut();
        final DirectoryLock lock = parent.newLock();
        final StaleLockHandler onStale = breakStale ? StaleLockHandler.breakLock() : StaleLockHandler.FAIL;

        final long start = System.nanoTime();
        lock.run(onStale, () -> {
            final Duration waited = Duration.ofNanos(System.nanoTime() - start);
            log.info("Acquired {} after {}, holding it for {}", lock.path(), waited, holdFor);
            out.println("Acquired " + lock.path() + " at " + Instant.now() + " after " + waited.toMillis() + "ms");
            TimeUnit.MILLISECONDS.sleep(holdFor.toMillis());
            out.println("Releasing " + lock.path() + " at " + Instant.now());
        });
        out.println("Released " + lock.path());
        return 0;
    }
}
