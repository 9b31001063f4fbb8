package tech.homeport.secrets.detect;

import tech.homeport.secrets.model.DetectedSecret;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.model.SecretType;
import tech.homeport.secrets.naming.SecretNaming;
import tech.homeport.secrets.naming.SensitivePatterns;
import tech.homeport.secrets.resource.CloudProvider;
import tech.homeport.secrets.resource.CloudResource;
import tech.homeport.secrets.resource.ResourceConfig;
import tech.homeport.secrets.resource.ResourceType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects secrets implied by Azure resources.
 *
 * Database admin passwords are deduplicated per server so that every
 * database on one server shares a single manifest entry. App settings that
 * use {@code @Microsoft.KeyVault(...)} references map to Key Vault.
 */
public class AzureSecretDetector extends AbstractSecretDetector {

    private static final String KEY_VAULT_REFERENCE_PREFIX = "@Microsoft.KeyVault";

    public AzureSecretDetector() {
        super(CloudProvider.AZURE);
        on(ResourceType.AZURE_SQL, this::detectSqlServer);
        on(ResourceType.AZURE_POSTGRES, r -> detectFlexibleServer(r, "postgres", "PostgreSQL", "azurepostgres"));
        on(ResourceType.AZURE_MYSQL, r -> detectFlexibleServer(r, "mysql", "MySQL", "azuremysql"));
        on(ResourceType.AZURE_COSMOS_DB, this::detectCosmosDb);
        on(ResourceType.AZURE_CACHE, this::detectRedisCache);
        on(ResourceType.AZURE_APP_SERVICE, this::detectAppService);
        on(ResourceType.AZURE_FUNCTION, this::detectAppService);
        on(ResourceType.AZURE_CONTAINER_INSTANCE, this::detectContainerInstance);
        on(ResourceType.AZURE_KEY_VAULT, this::detectKeyVault);
    }

    private List<DetectedSecret> detectSqlServer(CloudResource resource) {
        ResourceConfig config = resource.config();
        String serverName = config.string("server_name").orElse(resource.displayName());
        return List.of(adminPassword(resource,
            SecretNaming.generateSecretName(serverName, "azuresql", "password"),
            "Azure SQL Server " + serverName,
            "azuresql:server:" + serverName,
            config.string("administrator_login_password_key_vault_secret_id")));
    }

    private List<DetectedSecret> detectFlexibleServer(CloudResource resource, String kind, String label,
                                                      String dedupPrefix) {
        String name = resource.displayName();
        return List.of(adminPassword(resource,
            SecretNaming.generateSecretName(name, kind, "password"),
            "Azure " + label + " " + name,
            dedupPrefix + ":server:" + name,
            resource.config().string("administrator_password_key_vault_secret_id")));
    }

    private static DetectedSecret adminPassword(CloudResource resource, String name, String serverLabel,
                                                String serverDedupKey, Optional<String> keyVaultSecretId) {
        if (keyVaultSecretId.isPresent()) {
            return stored(resource, SecretSource.AZURE_KEY_VAULT, name, keyVaultSecretId.get(), SecretType.PASSWORD,
                String.format("Administrator password for %s (from Key Vault)", serverLabel));
        }
        return candidate(resource)
            .name(name)
            .source(SecretSource.MANUAL)
            .type(SecretType.PASSWORD)
            .description(String.format("Administrator password for %s", serverLabel))
            .deduplicationKey(serverDedupKey)
            .build();
    }

    private List<DetectedSecret> detectCosmosDb(CloudResource resource) {
        String name = resource.displayName();
        String dedupPrefix = "cosmosdb:account:" + name;
        return List.of(
            candidate(resource)
                .name(SecretNaming.generateSecretName(name, "cosmosdb", "primary_key"))
                .source(SecretSource.MANUAL)
                .type(SecretType.API_KEY)
                .description(String.format("Primary key for CosmosDB account %s", name))
                .deduplicationKey(dedupPrefix + ":primary_key")
                .build(),
            candidate(resource)
                .name(SecretNaming.generateSecretName(name, "cosmosdb", "connection_string"))
                .source(SecretSource.MANUAL)
                .type(SecretType.CONNECTION_STRING)
                .required(false)
                .description(String.format("Connection string for CosmosDB account %s", name))
                .deduplicationKey(dedupPrefix + ":connection_string")
                .build());
    }

    private List<DetectedSecret> detectRedisCache(CloudResource resource) {
        String name = resource.displayName();
        return List.of(candidate(resource)
            .name(SecretNaming.generateSecretName(name, "redis", "primary_access_key"))
            .source(SecretSource.MANUAL)
            .type(SecretType.API_KEY)
            .description(String.format("Primary access key for Azure Cache for Redis %s", name))
            .deduplicationKey("azurecache:redis:" + name)
            .build());
    }

    private List<DetectedSecret> detectAppService(CloudResource resource) {
        ResourceConfig config = resource.config();
        String name = resource.displayName();
        List<DetectedSecret> detected = new ArrayList<>();

        Map<String, String> appSettings = config.stringEntries("app_settings");
        if (appSettings.isEmpty()) {
            appSettings = config.map("site_config")
                .map(site -> site.stringEntries("app_settings"))
                .orElse(Map.of());
        }

        appSettings.forEach((key, value) -> {
            Optional<String> keyVaultRef = extractKeyVaultReference(value);
            if (keyVaultRef.isPresent()) {
                detected.add(stored(resource, SecretSource.AZURE_KEY_VAULT, SecretNaming.normalizeEnvName(key),
                    keyVaultRef.get(), SensitivePatterns.inferSecretType(key),
                    String.format("App setting %s for %s (from Key Vault)", key, name)));
            } else if (SensitivePatterns.isSensitiveEnvName(key)) {
                detected.add(manual(resource, SecretNaming.normalizeEnvName(key),
                    SensitivePatterns.inferSecretType(key),
                    String.format("App setting %s from %s", key, name)));
            }
        });

        for (ResourceConfig connection : config.maps("connection_string")) {
            Optional<String> connectionName = connection.string("name");
            if (connectionName.isEmpty()) {
                continue;
            }
            String secretName = SecretNaming.normalizeEnvName(connectionName.get() + "_CONNECTION_STRING");
            Optional<String> keyVaultRef = connection.string("value")
                .flatMap(AzureSecretDetector::extractKeyVaultReference);
            if (keyVaultRef.isPresent()) {
                detected.add(stored(resource, SecretSource.AZURE_KEY_VAULT, secretName, keyVaultRef.get(),
                    SecretType.CONNECTION_STRING,
                    String.format("Connection string %s for %s (from Key Vault)", connectionName.get(), name)));
            } else {
                detected.add(manual(resource, secretName, SecretType.CONNECTION_STRING,
                    String.format("Connection string %s for %s", connectionName.get(), name)));
            }
        }
        return detected;
    }

    private List<DetectedSecret> detectContainerInstance(CloudResource resource) {
        ResourceConfig config = resource.config();
        List<DetectedSecret> detected = new ArrayList<>();

        for (ResourceConfig container : config.maps("container")) {
            String containerName = container.string("name").orElse(resource.displayName());

            container.map("secure_environment_variables").ifPresent(secure -> {
                for (String key : secure.asMap().keySet()) {
                    detected.add(manual(resource, SecretNaming.normalizeEnvName(key),
                        SensitivePatterns.inferSecretType(key),
                        String.format("Secure environment variable %s from container %s", key, containerName)));
                }
            });

            container.map("environment_variables").ifPresent(env -> {
                for (String key : env.asMap().keySet()) {
                    if (SensitivePatterns.isSensitiveEnvName(key)) {
                        detected.add(manual(resource, SecretNaming.normalizeEnvName(key),
                            SensitivePatterns.inferSecretType(key),
                            String.format("Environment variable %s from container %s", key, containerName)));
                    }
                }
            });
        }

        for (ResourceConfig credential : config.maps("image_registry_credential")) {
            credential.string("server").ifPresent(server -> detected.add(manual(resource,
                SecretNaming.normalizeEnvName(server.replace('.', '_') + "_REGISTRY_PASSWORD"),
                SecretType.PASSWORD,
                String.format("Container registry password for %s", server))));
        }
        return detected;
    }

    private List<DetectedSecret> detectKeyVault(CloudResource resource) {
        String vaultName = resource.config().string("name").orElse(resource.displayName());
        return List.of(candidate(resource)
            .name(SecretNaming.normalizeEnvName(vaultName) + "_VAULT_URL")
            .source(SecretSource.AZURE_KEY_VAULT)
            .key(vaultName)
            .type(SecretType.GENERIC)
            .required(false)
            .description(String.format("Azure Key Vault reference: %s", vaultName))
            .deduplicationKey(SecretSource.AZURE_KEY_VAULT.value() + ":vault:" + vaultName)
            .build());
    }

    /**
     * Locator from an App Service Key Vault reference. Accepts
     * {@code @Microsoft.KeyVault(SecretUri=https://v.vault.azure.net/secrets/s/)} and
     * {@code @Microsoft.KeyVault(VaultName=v;SecretName=s)}, the latter returned as {@code v/s}.
     */
    static Optional<String> extractKeyVaultReference(String value) {
        if (value == null || !value.startsWith(KEY_VAULT_REFERENCE_PREFIX)) {
            return Optional.empty();
        }
        String body = value.substring(KEY_VAULT_REFERENCE_PREFIX.length()).trim();
        if (body.startsWith("(")) {
            body = body.substring(1);
        }
        int close = body.lastIndexOf(')');
        if (close >= 0) {
            body = body.substring(0, close);
        }

        String secretUri = null;
        String vaultName = null;
        String secretName = null;
        for (String part : body.split(";")) {
            String trimmed = part.trim();
            if (trimmed.startsWith("SecretUri=")) {
                secretUri = trimmed.substring("SecretUri=".length()).trim();
            } else if (trimmed.startsWith("VaultName=")) {
                vaultName = trimmed.substring("VaultName=".length()).trim();
            } else if (trimmed.startsWith("SecretName=")) {
                secretName = trimmed.substring("SecretName=".length()).trim();
            }
        }

        if (secretUri != null && !secretUri.isEmpty()) {
            return Optional.of(secretUri);
        }
        if (vaultName != null && !vaultName.isEmpty() && secretName != null && !secretName.isEmpty()) {
            return Optional.of(vaultName + "/" + secretName);
        }
        return Optional.empty();
    }
}
