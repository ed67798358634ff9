// SPDX-License-Identifier: Apache-2.0
package org.hiero.fslock.cli;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.base.fslock.DirectoryLock;
import org.hiero.base.fslock.FileSystemLocks;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

/**
 * Entry point of the {@code fslock} tool. The lock path and timing options are given before the subcommand, e.g.
 * {@code fslock --stale 5s /tmp/app/lock hold 30s}.
 */
@Command(
        name = "fslock",
        mixinStandardHelpOptions = true,
        subcommands = {HoldCommand.class, StatusCommand.class, ContendCommand.class},
        description = "Acquires, inspects and exercises filesystem directory locks")
public class FsLockCommand implements Runnable {

    private static final Logger log = LogManager.getLogger(FsLockCommand.class);

    /** Exit code for a stale lock, an exclusion violation or any other failure while running a command. */
    static final int EXIT_FAILURE = 1;

    @Spec
    private CommandSpec spec;

    @Option(
            names = "--poll",
            converter = DurationConverter.class,
            description = "Time between two looks at a held lock, e.g. 10ms or PT0.01S")
    private Duration pollInterval;

    @Option(
            names = "--update",
            converter = DurationConverter.class,
            description = "Time between two refreshes of a held lock")
    private Duration updateInterval;

    @Option(
            names = "--stale",
            converter = DurationConverter.class,
            description = "Time without refresh after which a lock is considered stale")
    private Duration staleDuration;

    @Parameters(index = "0", description = "Lock directory")
    private Path lockPath;

    Path getLockPath() {
        return lockPath;
    }

    /**
     * Creates a lock on the lock directory with the timing given on the command line.
     *
     * @throws IllegalArgumentException if the timing options are inconsistent
     */
    @NonNull
    DirectoryLock newLock() {
        return FileSystemLocks.builder(lockPath)
                .pollInterval(pollInterval)
                .updateInterval(updateInterval)
                .staleDuration(staleDuration)
                .build();
    }

    @Override
    public void run() {
        // no subcommand given
        spec.commandLine().getOut().println("Specify a subcommand (hold/status/contend).");
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * @return a command line whose failures are reported as exit codes instead of stack traces
     */
    @NonNull
    static CommandLine createCommandLine() {
        return new CommandLine(new FsLockCommand()).setExecutionExceptionHandler(FsLockCommand::handleFailure);
    }

    private static int handleFailure(
            @NonNull final Exception ex, @NonNull final CommandLine commandLine, @NonNull final ParseResult parseResult) {
        if (ex instanceof IllegalArgumentException) {
            commandLine.getErr().println("Invalid arguments: " + ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        log.error("Command {} failed", commandLine.getCommandName(), ex);
        commandLine.getErr().println(commandLine.getCommandName() + " failed: " + ex);
        return EXIT_FAILURE;
    }

    public static void main(final String[] args) {
        final long startTime = System.currentTimeMillis();
        final int exitCode = createCommandLine().execute(args);
        log.debug("Execution time: {}ms", System.currentTimeMillis() - startTime);
        System.exit(exitCode);
    }
}
