package com.vmturbo.postgis.provisioner.dump;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.postgis.provisioner.ProvisioningConfig;
import com.vmturbo.postgis.provisioner.ProvisioningException.SqlExecutionException;

/**
 * Dumps and loads the schema of a provisioned database using the PostgreSQL client tools.
 *
 * <p>Connection details are passed to the tools in the {@code PGHOST}, {@code PGPORT},
 * {@code PGDATABASE}, {@code PGUSER} and {@code PGPASSWORD} environment variables, never on the
 * command line, where a database name could be read as an option or a connection string. The
 * tools connect as the database owner, or as the superuser if no owner is configured.</p>
 */
public class StructureDumper {
    private static final Logger logger = LogManager.getLogger();

    private static final String SQL_COMMENT_BEGIN = "--";

    private final OsCommandRunner runner;

    /**
     * Create a new instance.
     *
     * @param runner runner for the client tools
     */
    public StructureDumper(@Nonnull OsCommandRunner runner) {
        this.runner = runner;
    }

    /**
     * Write the schema of the configured database to a file, without data, privileges or
     * ownership. Comment lines heading the dump are removed.
     *
     * @param config     provisioning config
     * @param outputFile file to write
     * @throws SqlExecutionException if pg_dump fails or the output cannot be post-processed
     */
    public void dump(@Nonnull ProvisioningConfig config, @Nonnull Path outputFile)
            throws SqlExecutionException {
        final List<String> args = new ArrayList<>();
        args.add("--schema-only");
        args.add("--no-privileges");
        args.add("--no-owner");
        args.add("--file=" + outputFile);
        if (config.isRestrictDumpToSearchPath()) {
            config.getSchemaSearchPath().forEach(schema -> args.add("--schema=" + schema));
        }
        runTool(config, config.getPgDumpPath(), args);
        try {
            stripHeaderComments(outputFile);
        } catch (IOException e) {
            throw new SqlExecutionException(String.format(
                    "Failed to post-process structure dump %s: %s", outputFile, e));
        }
        logger.info("Dumped structure of database {} to {}", config.getDatabaseName(),
                outputFile);
    }

    /**
     * Execute a structure file against the configured database, stopping at the first error.
     *
     * @param config    provisioning config
     * @param inputFile file to load
     * @throws SqlExecutionException if psql fails
     */
    public void load(@Nonnull ProvisioningConfig config, @Nonnull Path inputFile)
            throws SqlExecutionException {
        runTool(config, config.getPsqlPath(), ImmutableList.of(
                "--set", "ON_ERROR_STOP=1", "--quiet", "--no-psqlrc",
                "--file=" + inputFile));
        logger.info("Loaded structure of database {} from {}", config.getDatabaseName(),
                inputFile);
    }

    private void runTool(ProvisioningConfig config, String tool, List<String> args)
            throws SqlExecutionException {
        final int rc;
        try {
            rc = runner.run(tool, args, environment(config));
        } catch (IOException e) {
            throw new SqlExecutionException(String.format("Failed to run %s: %s", tool, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SqlExecutionException(String.format("Interrupted while running %s", tool));
        }
        if (rc != 0) {
            throw new SqlExecutionException(String.format(
                    "%s failed with exit status %d for database %s",
                    tool, rc, config.getDatabaseName()));
        }
    }

    /**
     * Build the environment carrying connection details to the client tools.
     *
     * @param config provisioning config
     * @return environment variables
     */
    @VisibleForTesting
    static Map<String, String> environment(@Nonnull ProvisioningConfig config) {
        final boolean asOwner = config.getOwnerUserName() != null;
        final String user = asOwner ? config.getOwnerUserName() : config.getSuperUserName();
        final String password = asOwner ? config.getOwnerPassword()
                : config.getSuperUserPassword();
        final ImmutableMap.Builder<String, String> env = ImmutableMap.<String, String>builder()
                .put("PGHOST", config.getHost())
                .put("PGPORT", Integer.toString(config.getPort()))
                .put("PGDATABASE", config.getDatabaseName());
        if (user != null) {
            env.put("PGUSER", user);
        }
        if (password != null) {
            env.put("PGPASSWORD", password);
        }
        return env.build();
    }

    /**
     * Remove the leading comment and blank lines from a SQL file.
     *
     * @param file file to rewrite in place
     * @throws IOException if the file cannot be read or written
     */
    @VisibleForTesting
    static void stripHeaderComments(@Nonnull Path file) throws IOException {
        final List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        int firstContent = 0;
        while (firstContent < lines.size() && isHeaderLine(lines.get(firstContent))) {
            firstContent++;
        }
        if (firstContent > 0) {
            Files.write(file, lines.subList(firstContent, lines.size()), StandardCharsets.UTF_8);
        }
    }

    private static boolean isHeaderLine(String line) {
        return line.startsWith(SQL_COMMENT_BEGIN) || StringUtils.isBlank(line);
    }
}
