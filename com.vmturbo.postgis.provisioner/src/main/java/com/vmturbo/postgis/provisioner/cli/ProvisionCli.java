package com.vmturbo.postgis.provisioner.cli;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.UnaryOperator;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.postgis.provisioner.ConfigAdapter;
import com.vmturbo.postgis.provisioner.Provisioner;
import com.vmturbo.postgis.provisioner.ProvisioningConfig;
import com.vmturbo.postgis.provisioner.ProvisioningConfigResolver;
import com.vmturbo.postgis.provisioner.ProvisioningException;
import com.vmturbo.postgis.provisioner.ProvisioningException.InvalidConfigException;
import com.vmturbo.postgis.provisioner.ProvisioningResult;

/**
 * Command-line front end for {@link Provisioner}.
 *
 * <pre>
 * provision create         &lt;config-file&gt; [endpoint]
 * provision extensions     &lt;config-file&gt; [endpoint]
 * provision drop           &lt;config-file&gt; [endpoint]
 * provision structure-dump &lt;config-file&gt; &lt;output-file&gt; [endpoint]
 * provision structure-load &lt;config-file&gt; &lt;input-file&gt; [endpoint]
 * </pre>
 *
 * <p>The optional last argument names the endpoint (or legacy section) of the configuration file
 * to use. Any property can be overridden with a {@code -Dprovision.<name>=<value>} system
 * property, e.g. {@code -Dprovision.rootPassword=...}.</p>
 *
 * <p>Exit status is {@value #EXIT_OK} on success (including creation of a database that already
 * exists), {@value #EXIT_FAILED} if provisioning fails, and {@value #EXIT_USAGE} for bad usage or
 * invalid configuration.</p>
 */
public class ProvisionCli {
    private static final Logger logger = LogManager.getLogger();

    /** exit status for success. */
    public static final int EXIT_OK = 0;
    /** exit status for a provisioning failure. */
    public static final int EXIT_FAILED = 1;
    /** exit status for bad usage or invalid configuration. */
    public static final int EXIT_USAGE = 2;

    /**
     * Available commands.
     */
    enum Command {
        CREATE("create", false),
        EXTENSIONS("extensions", false),
        DROP("drop", false),
        STRUCTURE_DUMP("structure-dump", true),
        STRUCTURE_LOAD("structure-load", true);

        private final String commandName;
        private final boolean takesFile;

        Command(String commandName, boolean takesFile) {
            this.commandName = commandName;
            this.takesFile = takesFile;
        }

        @Nullable
        static Command fromName(String name) {
            for (Command command : values()) {
                if (command.commandName.equals(name)) {
                    return command;
                }
            }
            return null;
        }
    }

    private final Provisioner provisioner;
    private final ConfigFileLoader loader;
    private final UnaryOperator<String> overrides;
    private final PrintStream err;

    /**
     * Create a new instance.
     *
     * @param provisioner provisioner to run commands with
     * @param loader      configuration file loader
     * @param overrides   source of configuration overrides
     * @param err         stream for usage messages
     */
    @VisibleForTesting
    ProvisionCli(@Nonnull Provisioner provisioner, @Nonnull ConfigFileLoader loader,
            @Nonnull UnaryOperator<String> overrides, @Nonnull PrintStream err) {
        this.provisioner = provisioner;
        this.loader = loader;
        this.overrides = overrides;
        this.err = err;
    }

    /**
     * Run a provisioning command.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        final int rc = new ProvisionCli(new Provisioner(), new ConfigFileLoader(),
                System::getProperty, System.err).run(args);
        System.exit(rc);
    }

    /**
     * Run a command.
     *
     * @param args command line arguments
     * @return exit status
     */
    @VisibleForTesting
    int run(String[] args) {
        final Command command = args.length > 0 ? Command.fromName(args[0]) : null;
        if (command == null) {
            return usage();
        }
        final int required = command.takesFile ? 3 : 2;
        if (args.length < required || args.length > required + 1) {
            return usage();
        }
        final Path configFile = Paths.get(args[1]);
        final Path file = command.takesFile ? Paths.get(args[2]) : null;
        final String endpoint = args.length > required ? args[required] : null;

        final ProvisioningConfig config;
        try {
            config = new ProvisioningConfigResolver(
                    ConfigAdapter.forRecord(loader.load(configFile), endpoint), overrides)
                    .resolve();
        } catch (InvalidConfigException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }

        try {
            switch (command) {
                case CREATE:
                    final ProvisioningResult result = provisioner.create(config);
                    logger.info("Create database: {}", result);
                    return result.isSuccess() ? EXIT_OK : EXIT_FAILED;
                case EXTENSIONS:
                    provisioner.installExtensions(config);
                    break;
                case DROP:
                    provisioner.drop(config);
                    break;
                case STRUCTURE_DUMP:
                    provisioner.structureDump(config, file);
                    break;
                case STRUCTURE_LOAD:
                    provisioner.structureLoad(config, file);
                    break;
                default:
                    return usage();
            }
        } catch (ProvisioningException e) {
            logger.error("{} failed for {}: {}", command.commandName, config, e.getMessage());
            return EXIT_FAILED;
        }
        logger.info("{} completed for {}", command.commandName, config);
        return EXIT_OK;
    }

    private int usage() {
        err.println("Usage:");
        for (Command command : Command.values()) {
            err.printf("  provision %s <config-file>%s [endpoint]%n", command.commandName,
                    command.takesFile ? " <file>" : "");
        }
        return EXIT_USAGE;
    }
}
