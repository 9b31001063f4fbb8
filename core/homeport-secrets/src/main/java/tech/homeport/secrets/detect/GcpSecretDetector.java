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
import java.util.Optional;

/**
 * Detects secrets implied by GCP resources: Cloud SQL, Memorystore, Cloud Run,
 * Cloud Functions and Secret Manager.
 */
public class GcpSecretDetector extends AbstractSecretDetector {

    public GcpSecretDetector() {
        super(CloudProvider.GCP);
        on(ResourceType.GCP_CLOUD_SQL, this::detectCloudSql);
        on(ResourceType.GCP_MEMORYSTORE, this::detectMemorystore);
        on(ResourceType.GCP_CLOUD_RUN, this::detectCloudRun);
        on(ResourceType.GCP_CLOUD_FUNCTION, this::detectCloudFunction);
        on(ResourceType.GCP_SECRET_MANAGER, this::detectSecretManagerSecret);
    }

    private List<DetectedSecret> detectCloudSql(CloudResource resource) {
        ResourceConfig config = resource.config();
        String name = resource.displayName();

        String version = config.string("database_version").orElse("");
        String dbType = "database";
        if (version.startsWith("POSTGRES")) {
            dbType = "postgres";
        } else if (version.startsWith("MYSQL")) {
            dbType = "mysql";
        } else if (version.startsWith("SQLSERVER")) {
            dbType = "sqlserver";
        }

        List<DetectedSecret> detected = new ArrayList<>();
        detected.add(manual(resource, SecretNaming.generateSecretName(name, "cloudsql", "password"),
            SecretType.PASSWORD, String.format("Root password for Cloud SQL instance %s (%s)", name, dbType)));

        for (ResourceConfig user : config.maps("users")) {
            user.string("name")
                .filter(userName -> !"root".equals(userName))
                .ifPresent(userName -> detected.add(manual(resource,
                    SecretNaming.generateSecretName(name + "_" + userName, "cloudsql", "password"),
                    SecretType.PASSWORD,
                    String.format("Password for Cloud SQL user %s in instance %s", userName, name))));
        }
        return detected;
    }

    private List<DetectedSecret> detectMemorystore(CloudResource resource) {
        if (!resource.config().isTrue("auth_enabled")) {
            return List.of();
        }
        String name = resource.displayName();
        return List.of(manual(resource, SecretNaming.generateSecretName(name, "memorystore", "auth_string"),
            SecretType.PASSWORD, String.format("Auth string for Memorystore Redis instance %s", name)));
    }

    private List<DetectedSecret> detectCloudRun(CloudResource resource) {
        List<ResourceConfig> containers = resource.config().map("template")
            .flatMap(template -> template.map("spec"))
            .map(spec -> spec.maps("containers"))
            .orElse(List.of());

        List<DetectedSecret> detected = new ArrayList<>();
        for (ResourceConfig container : containers) {
            for (ResourceConfig env : container.maps("env")) {
                String envName = env.string("name").orElse("");
                if (envName.isEmpty()) {
                    continue;
                }

                Optional<ResourceConfig> secretRef = env.map("value_from")
                    .flatMap(valueFrom -> valueFrom.map("secret_key_ref"));
                Optional<String> secretName = secretRef.flatMap(ref -> ref.string("name"));
                if (secretName.isPresent()) {
                    String path = secretName.get() + secretRef.get().string("key").map(k -> "/" + k).orElse("");
                    detected.add(stored(resource, SecretSource.GCP_SECRET_MANAGER,
                        SecretNaming.normalizeEnvName(envName), path, SensitivePatterns.inferSecretType(envName),
                        String.format("Secret %s for Cloud Run service %s (from Secret Manager)",
                            envName, resource.displayName())));
                    continue;
                }

                if (SensitivePatterns.isSensitiveEnvName(envName)) {
                    detected.add(manual(resource, SecretNaming.normalizeEnvName(envName),
                        SensitivePatterns.inferSecretType(envName),
                        String.format("Environment variable %s from Cloud Run service %s",
                            envName, resource.displayName())));
                }
            }
        }
        return detected;
    }

    private List<DetectedSecret> detectCloudFunction(CloudResource resource) {
        ResourceConfig config = resource.config();
        String name = resource.displayName();
        List<DetectedSecret> detected = new ArrayList<>();

        config.map("environment_variables").ifPresent(vars -> {
            for (String key : vars.asMap().keySet()) {
                if (SensitivePatterns.isSensitiveEnvName(key)) {
                    detected.add(manual(resource, SecretNaming.normalizeEnvName(key),
                        SensitivePatterns.inferSecretType(key),
                        String.format("Environment variable %s from Cloud Function %s", key, name)));
                }
            }
        });

        for (ResourceConfig secret : config.maps("secret_environment_variables")) {
            Optional<String> secretId = secret.string("secret");
            Optional<String> envKey = secret.string("key");
            if (secretId.isEmpty() || envKey.isEmpty()) {
                continue;
            }
            String path = secret.string("project_id")
                .map(project -> String.format("projects/%s/secrets/%s", project, secretId.get()))
                .orElse(secretId.get());
            path += secret.string("version").map(v -> "/versions/" + v).orElse("");

            detected.add(stored(resource, SecretSource.GCP_SECRET_MANAGER,
                SecretNaming.normalizeEnvName(envKey.get()), path, SensitivePatterns.inferSecretType(envKey.get()),
                String.format("Secret %s for Cloud Function %s (from Secret Manager)", envKey.get(), name)));
        }
        return detected;
    }

    private List<DetectedSecret> detectSecretManagerSecret(CloudResource resource) {
        ResourceConfig config = resource.config();
        String secretId = config.string("secret_id").orElse(resource.displayName());
        String path = config.string("project")
            .map(project -> String.format("projects/%s/secrets/%s", project, secretId))
            .orElse(secretId);

        return List.of(stored(resource, SecretSource.GCP_SECRET_MANAGER,
            SecretNaming.normalizeEnvName(secretId), path, SecretType.GENERIC,
            String.format("Secret from GCP Secret Manager: %s", secretId)));
    }
}
