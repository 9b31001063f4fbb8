package tech.homeport.secrets;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;
import tech.homeport.secrets.detect.DetectorRegistry;
import tech.homeport.secrets.envfile.ManifestSnapshots;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.resolve.ResolverOptions;
import tech.homeport.secrets.resolve.SecretProvider;
import tech.homeport.secrets.resolve.SecretResolver;
import tech.homeport.secrets.resolve.SecretsEngineConfig;
import tech.homeport.secrets.resolve.clients.AzCliKeyVaultClient;
import tech.homeport.secrets.resolve.clients.CommandRunner;
import tech.homeport.secrets.resolve.clients.GcloudSecretsClient;
import tech.homeport.secrets.resolve.clients.ProcessCommandRunner;
import tech.homeport.secrets.resolve.clients.SdkAwsSecretsClient;
import tech.homeport.secrets.resolve.clients.VaultCliKvClient;
import tech.homeport.secrets.resolve.providers.AwsSecretsManagerProvider;
import tech.homeport.secrets.resolve.providers.AzureKeyVaultProvider;
import tech.homeport.secrets.resolve.providers.EnvSecretProvider;
import tech.homeport.secrets.resolve.providers.FileSecretProvider;
import tech.homeport.secrets.resolve.providers.GcpSecretManagerProvider;
import tech.homeport.secrets.resolve.providers.HashiCorpVaultProvider;
import tech.homeport.secrets.resolve.providers.ManualSecretProvider;

import java.nio.file.Path;
import java.util.List;

/**
 * Produces the secrets engine beans from {@link SecretsEngineConfig}.
 *
 * The resolver gets one provider per source. A {@link SecretProvider} bean
 * supplied by the application replaces the built-in provider for its source.
 */
@ApplicationScoped
public class SecretsEngineProducer {

    private static final Logger LOG = Logger.getLogger(SecretsEngineProducer.class);

    @Inject
    SecretsEngineConfig config;

    @Inject
    Instance<ObjectMapper> objectMapperInstance;

    @Inject
    Instance<SecretsManagerClient> secretsManagerClientInstance;

    @Inject
    Instance<SecretProvider> providerInstances;

    @Produces
    @ApplicationScoped
    public DetectorRegistry detectorRegistry() {
        return DetectorRegistry.withDefaults();
    }

    @Produces
    @ApplicationScoped
    public ManifestSnapshots manifestSnapshots() {
        return new ManifestSnapshots(objectMapper());
    }

    @Produces
    @ApplicationScoped
    public SecretResolver secretResolver() {
        ResolverOptions options = ResolverOptions.from(config.resolver());
        SecretResolver resolver = new SecretResolver(options);

        ManualSecretProvider manual = new ManualSecretProvider()
            .withMasking(config.manual().maskInput());
        manual.setNonInteractive(config.manual().nonInteractive() || !options.allowInteractive());

        for (SecretProvider provider : defaultProviders(manual)) {
            resolver.registerProvider(provider);
        }
        for (SecretProvider provider : providerInstances) {
            LOG.infof("Using application provider %s for source %s",
                provider.getClass().getSimpleName(), provider.name().value());
            resolver.registerProvider(provider);
        }

        if (options.allowInteractive() && !config.manual().nonInteractive()) {
            resolver.setPromptCallback(manual.asPromptCallback());
        }

        LOG.infof("Secret resolver configured (secretsFile=%s, pullFrom=%s, interactive=%s, timeout=%s)",
            options.secretsFileOptional().map(Path::toString).orElse("none"),
            options.pullFromSource().map(SecretSource::value).orElse("none"),
            options.allowInteractive(), options.timeout());
        return resolver;
    }

    List<SecretProvider> defaultProviders(ManualSecretProvider manual) {
        ObjectMapper mapper = objectMapper();
        CommandRunner runner = new ProcessCommandRunner();

        SecretsEngineConfig.Gcp gcp = config.gcp();
        SecretsEngineConfig.Azure azure = config.azure();
        SecretsEngineConfig.Vault vault = config.vault();

        return List.of(
            manual,
            new EnvSecretProvider(),
            new FileSecretProvider(config.file().basePath().map(Path::of).orElse(null)),
            new AwsSecretsManagerProvider(awsClient(), mapper),
            new GcpSecretManagerProvider(new GcloudSecretsClient(gcp.cli(), runner), gcp.project().orElse(null)),
            new AzureKeyVaultProvider(
                new AzCliKeyVaultClient(azure.cli(), azure.subscription().orElse(null), runner),
                azure.vaultName().orElse(null)),
            new HashiCorpVaultProvider(
                new VaultCliKvClient(vault.cli(), vault.address().orElse(null), vault.token().orElse(null),
                    vault.namespace().orElse(null), runner, mapper),
                vault.mount(), mapper));
    }

    private SdkAwsSecretsClient awsClient() {
        if (!secretsManagerClientInstance.isUnsatisfied()) {
            return new SdkAwsSecretsClient(secretsManagerClientInstance.get());
        }
        SecretsEngineConfig.Aws aws = config.aws();
        return new SdkAwsSecretsClient(() -> {
            SecretsManagerClientBuilder builder = SecretsManagerClient.builder();
            aws.region().map(Region::of).ifPresent(builder::region);
            aws.profile().map(ProfileCredentialsProvider::create).ifPresent(builder::credentialsProvider);
            return builder.build();
        });
    }

    private ObjectMapper objectMapper() {
        return objectMapperInstance.isUnsatisfied() ? new ObjectMapper() : objectMapperInstance.get();
    }
}
