package tech.homeport.secrets.resolve.clients;

import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base for store clients that shell out to a vendor CLI.
 */
abstract class AbstractCliClient implements CredentialStoreClient {

    private static final Duration VERIFY_TIMEOUT = Duration.ofSeconds(15);

    protected final String binary;
    protected final CommandRunner runner;

    protected AbstractCliClient(String binary, CommandRunner runner) {
        this.binary = binary;
        this.runner = runner;
    }

    /**
     * Variables passed to every invocation.
     */
    protected Map<String, String> environment() {
        return Map.of();
    }

    /**
     * Run the CLI for one secret and return its trimmed stdout.
     */
    protected String fetch(String secretName, Duration timeout, List<String> args) {
        return output(secretName, secretName, timeout, args);
    }

    /**
     * Run a metadata-only listing command and return one name per non-blank
     * output line.
     */
    protected List<String> fetchLines(String subject, Duration timeout, List<String> args) {
        List<String> names = new ArrayList<>();
        for (String line : output(subject, null, timeout, args).split("\r?\n")) {
            if (!line.isBlank()) {
                names.add(line.trim());
            }
        }
        return names;
    }

    /**
     * Trimmed stdout of a successful run.
     *
     * @param subject    what is being fetched, for error messages
     * @param secretName secret the failure is attributed to, or null
     */
    protected String output(String subject, String secretName, Duration timeout, List<String> args) {
        CommandResult result = execute(secretName, timeout, args);
        if (result.timedOut()) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, secretName,
                binary + " timed out fetching " + subject);
        }
        if (!result.isSuccess()) {
            String stderr = result.stderr().trim();
            SecretErrorKind kind = looksLikeNotFound(stderr)
                ? SecretErrorKind.SECRET_NOT_FOUND
                : SecretErrorKind.SECRET_NOT_RESOLVED;
            throw new SecretResolutionException(kind, secretName,
                binary + " failed for " + subject + ": " + stderr);
        }
        return result.stdout().trim();
    }

    protected void verify(List<String> args) {
        CommandResult result = execute(null, VERIFY_TIMEOUT, args);
        if (!result.isSuccess()) {
            throw SecretResolutionException.unavailable(binary + " is not authenticated or not reachable: "
                + (result.timedOut() ? "timed out" : result.stderr().trim()));
        }
    }

    private CommandResult execute(String secretName, Duration timeout, List<String> args) {
        List<String> command = new ArrayList<>(args.size() + 1);
        command.add(binary);
        command.addAll(args);
        try {
            return runner.run(command, environment(), timeout);
        } catch (IOException e) {
            throw new SecretResolutionException(SecretErrorKind.PROVIDER_UNAVAILABLE, secretName,
                binary + " CLI not available: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, secretName,
                "Interrupted while running " + binary, e);
        }
    }

    private static boolean looksLikeNotFound(String stderr) {
        String lower = stderr.toLowerCase(Locale.ROOT);
        return lower.contains("not found") || lower.contains("notfound") || lower.contains("not_found")
            || lower.contains("no value found");
    }
}
