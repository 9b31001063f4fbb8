package tech.homeport.secrets.resolve.clients;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs external commands for the CLI-backed store clients.
 */
public interface CommandRunner {

    /**
     * Run a command and wait at most {@code timeout} for it.
     * The process is killed once the timeout elapses.
     *
     * @param environment variables added to the inherited environment
     * @throws IOException if the command cannot be started, e.g. not on the PATH
     */
    CommandResult run(List<String> command, Map<String, String> environment, Duration timeout)
        throws IOException, InterruptedException;
}
