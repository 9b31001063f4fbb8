package tech.homeport.secrets.resolve;

import lombok.Builder;
import lombok.With;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretException;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.resource.CloudProvider;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Behaviour of a {@link SecretResolver}.
 *
 * @param secretsFile      env file consulted first, may be null
 * @param pullFrom         store every cloud-sourced secret is redirected to, may be null
 * @param envPrefix        prefix of the environment variables holding secret values
 * @param allowInteractive whether the prompt callback may be used
 * @param failOnMissing    whether missing required secrets fail the whole run
 * @param timeout          budget for one secret's resolution chain
 */
@Builder(toBuilder = true)
@With
public record ResolverOptions(
    Path secretsFile,
    CloudProvider pullFrom,
    String envPrefix,
    boolean allowInteractive,
    boolean failOnMissing,
    Duration timeout
) {

    public static final String DEFAULT_ENV_PREFIX = "HOMEPORT_SECRET_";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public ResolverOptions {
        envPrefix = envPrefix == null ? DEFAULT_ENV_PREFIX : envPrefix;
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
    }

    public static ResolverOptions defaults() {
        return new ResolverOptions(null, null, DEFAULT_ENV_PREFIX, true, true, DEFAULT_TIMEOUT);
    }

    public static ResolverOptions from(SecretsEngineConfig.Resolver config) {
        return new ResolverOptions(
            config.secretsFile().map(Path::of).orElse(null),
            config.pullFrom().map(ResolverOptions::parsePullFrom).orElse(null),
            config.envPrefix(),
            config.allowInteractive(),
            config.failOnMissing(),
            config.timeout());
    }

    public Optional<Path> secretsFileOptional() {
        return Optional.ofNullable(secretsFile);
    }

    /**
     * Source the forced cloud override maps to.
     */
    public Optional<SecretSource> pullFromSource() {
        if (pullFrom == null) {
            return Optional.empty();
        }
        return Optional.of(switch (pullFrom) {
            case AWS -> SecretSource.AWS_SECRETS_MANAGER;
            case GCP -> SecretSource.GCP_SECRET_MANAGER;
            case AZURE -> SecretSource.AZURE_KEY_VAULT;
        });
    }

    /**
     * @throws SecretException with kind INVALID_SOURCE for anything but aws, gcp or azure
     */
    public static CloudProvider parsePullFrom(String value) {
        return CloudProvider.fromValue(value)
            .orElseThrow(() -> new SecretException(SecretErrorKind.INVALID_SOURCE,
                "unknown cloud provider for pull-from: " + value + " (expected aws, gcp or azure)"));
    }
}
