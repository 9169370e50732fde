package com.vmturbo.postgis.provisioner.dump;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;

/**
 * Factory for creating the processes that run PostgreSQL client tools. Extracted to enable
 * testing since ProcessBuilder is declared as "final", and hence cannot be mocked.
 *
 * <p>The {@code stderr} output stream is combined with the {@code stdout} stream, so the caller
 * need only monitor a single output stream.</p>
 */
public class OsProcessFactory {

    /**
     * Create and start a process to run the given command.
     *
     * @param osCommand   the command to run
     * @param args        the arguments to pass to the command
     * @param environment variables added to the inherited environment
     * @return the newly started process
     * @throws IOException if the command cannot be launched
     */
    public Process startOsCommand(@Nonnull String osCommand, @Nonnull List<String> args,
            @Nonnull Map<String, String> environment) throws IOException {
        final List<String> argList = new ArrayList<>(args.size() + 1);
        argList.add(osCommand);
        argList.addAll(args);
        final ProcessBuilder builder = new ProcessBuilder(argList).redirectErrorStream(true);
        builder.environment().putAll(environment);
        return builder.start();
    }
}
