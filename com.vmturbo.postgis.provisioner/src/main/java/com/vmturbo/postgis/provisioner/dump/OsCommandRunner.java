package com.vmturbo.postgis.provisioner.dump;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs an OS command in a separate process and waits for it to finish. The combined output of
 * the child process is logged via log4j, each line tagged with the command being run.
 */
public class OsCommandRunner {
    private static final Logger logger = LogManager.getLogger();

    private final OsProcessFactory processFactory;

    /**
     * Create a new instance.
     *
     * @param processFactory factory for child processes
     */
    public OsCommandRunner(@Nonnull OsProcessFactory processFactory) {
        this.processFactory = processFactory;
    }

    /**
     * Create a new instance that launches real processes.
     */
    public OsCommandRunner() {
        this(new OsProcessFactory());
    }

    /**
     * Run a command to completion.
     *
     * @param osCommand   OS command path
     * @param args        arguments to the command
     * @param environment variables added to the inherited environment; not logged, since they
     *                    may hold credentials
     * @return the exit status of the command
     * @throws IOException          if the command cannot be launched or its output read
     * @throws InterruptedException if interrupted while waiting for the command
     */
    public int run(@Nonnull String osCommand, @Nonnull List<String> args,
            @Nonnull Map<String, String> environment) throws IOException, InterruptedException {
        final String tag = new File(osCommand).getName();
        logger.info("Running {} {}", osCommand, String.join(" ", args));
        final Process process = processFactory.startOsCommand(osCommand, args, environment);
        try (BufferedReader output = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = output.readLine()) != null) {
                logger.info("{}:---{}", tag, line);
            }
        }
        final int rc = process.waitFor();
        logger.debug("{} exited with status {}", tag, rc);
        return rc;
    }
}
