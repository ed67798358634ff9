// SPDX-License-Identifier: Apache-2.0
package org.hiero.fslock.cli;

import java.io.PrintWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import org.hiero.base.fslock.DirectoryLock;
import org.hiero.base.fslock.LockFileSystem;
import org.hiero.base.fslock.LockFileSystem.EntryAttributes;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Reports whether the lock directory exists and when it was last refreshed. A single look cannot tell a slow holder
 * from a dead one; a lock that has not been refreshed for longer than the stale duration is only reported as possibly
 * stale, with exit code 1.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Shows whether the lock is held")
public class StatusCommand implements Callable<Integer> {

    @ParentCommand
    private FsLockCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final PrintWriter out = spec.commandLine().getOut();
        final DirectoryLock lock = parent.newLock();
        final EntryAttributes attributes = LockFileSystem.nio().stat(lock.path());

        if (attributes == null) {
            out.println(lock.path() + " is free");
            return 0;
        }
        if (!attributes.directory()) {
            out.println(lock.path() + " exists but is not a directory");
            return FsLockCommand.EXIT_FAILURE;
        }

        final Duration age = Duration.between(attributes.lastModifiedTime(), Instant.now());
        out.println(lock.path() + " is held, last refreshed at " + attributes.lastModifiedTime() + " ("
                + age.toMillis() + "ms ago)");
        if (age.compareTo(lock.config().staleDuration()) > 0) {
            out.println("Not refreshed for longer than " + lock.config().staleDuration() + ", possibly stale");
            return FsLockCommand.EXIT_FAILURE;
        }
        return 0;
    }
}
