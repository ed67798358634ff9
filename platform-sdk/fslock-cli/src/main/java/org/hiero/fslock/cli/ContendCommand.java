// SPDX-License-Identifier: Apache-2.0
package org.hiero.fslock.cli;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.base.fslock.DirectoryLock;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs several contenders in this process, each with its own {@link DirectoryLock} on the same path, and checks that
 * they never use the shared resource at the same time.
 */
@Command(
        name = "contend",
        mixinStandardHelpOptions = true,
        description = "Exercises the lock with concurrent contenders and reports exclusion violations")
public class ContendCommand implements Callable<Integer> {

    private static final Logger log = LogManager.getLogger(ContendCommand.class);

    @ParentCommand
    private FsLockCommand parent;

    @Spec
    private CommandSpec spec;

    @Option(names = "--workers", defaultValue = "4", description = "Number of contenders (default: ${DEFAULT-VALUE})")
    private int workers;

    @Option(
            names = "--iterations",
            defaultValue = "10",
            description = "Checks per contender (default: ${DEFAULT-VALUE})")
    private int iterations;

    @Option(names = "--resource", required = true, description = "File the contenders take turns writing")
    private Path resource;

    @Option(
            names = "--pause",
            defaultValue = "1ms",
            converter = DurationConverter.class,
            description = "Time each contender keeps the resource (default: ${DEFAULT-VALUE})")
    private Duration pause;

    @Override
    public Integer call() throws Exception {
        if (workers < 1 || iterations < 1) {
            throw new IllegalArgumentException("--workers and --iterations must be positive");
        }
        final PrintWriter out = spec.commandLine().getOut();
        final ExclusiveResourceWriter writer = new ExclusiveResourceWriter(resource, pause);
        final ExecutorService executor = Executors.newFixedThreadPool(
                workers,
                new ThreadFactoryBuilder().setNameFormat("fslock-contender-%d").build());
        try {
            final List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                final String owner = "contender-" + i;
                final DirectoryLock lock = parent.newLock();
                futures.add(executor.submit(() -> {
                    for (int iteration = 0; iteration < iterations; iteration++) {
                        lock.run(() -> writer.check(owner));
                    }
                    return null;
                }));
            }
            for (final Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        log.info(
                "{} contenders ran {} checks on {} with {} violations",
                workers,
                writer.getChecks(),
                resource,
                writer.getViolations());
        out.println(workers + " contenders, " + writer.getChecks() + " checks, " + writer.getViolations()
                + " violations");
        return writer.getViolations() == 0 ? 0 : FsLockCommand.EXIT_FAILURE;
    }
}
