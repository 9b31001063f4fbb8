package tech.homeport.secrets.detect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.homeport.secrets.errors.SecretDetectionException;
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
 * Detects secrets implied by AWS resources.
 *
 * Supported:
 * <ul>
 *   <li>RDS instances and Aurora clusters: master password, from Secrets Manager when managed</li>
 *   <li>ElastiCache: auth token when auth or in-transit encryption is enabled</li>
 *   <li>Lambda: sensitive environment variables</li>
 *   <li>ECS services and task definitions: container secrets and sensitive environment</li>
 *   <li>Secrets Manager secrets</li>
 *   <li>Cognito user pools: app client secrets (optional)</li>
 * </ul>
 */
public class AwsSecretDetector extends AbstractSecretDetector {

    static final String SECRETS_MANAGER_ARN_PREFIX = "arn:aws:secretsmanager:";
    static final String SSM_ARN_PREFIX = "arn:aws:ssm:";

    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public AwsSecretDetector() {
        this(new ObjectMapper());
    }

    public AwsSecretDetector(ObjectMapper objectMapper) {
        super(CloudProvider.AWS);
        this.objectMapper = objectMapper;
        on(ResourceType.AWS_RDS_INSTANCE, this::detectRdsInstance);
        on(ResourceType.AWS_RDS_CLUSTER, this::detectRdsCluster);
        on(ResourceType.AWS_ELASTICACHE_CLUSTER, this::detectElastiCache);
        on(ResourceType.AWS_ELASTICACHE_REPLICATION_GROUP, this::detectElastiCache);
        on(ResourceType.AWS_LAMBDA_FUNCTION, this::detectLambda);
        on(ResourceType.AWS_ECS_SERVICE, this::detectEcs);
        on(ResourceType.AWS_ECS_TASK_DEFINITION, this::detectEcs);
        on(ResourceType.AWS_SECRETS_MANAGER_SECRET, this::detectSecretsManagerSecret);
        on(ResourceType.AWS_COGNITO_USER_POOL, this::detectCognito);
    }

    private List<DetectedSecret> detectRdsInstance(CloudResource resource) {
        ResourceConfig config = resource.config();
        String name = resource.displayName();

        // Aurora members inherit the password from their cluster
        if (config.string("db_cluster_identifier").isPresent() || config.string("cluster_identifier").isPresent()) {
            return List.of();
        }

        String secretName = SecretNaming.generateSecretName(name, "rds", "password");
        Optional<String> managedArn = managedMasterSecretArn(config);
        if (managedArn.isPresent()) {
            return List.of(stored(resource, SecretSource.AWS_SECRETS_MANAGER, secretName, managedArn.get(),
                SecretType.PASSWORD,
                String.format("Database master password for RDS instance %s (managed by Secrets Manager)", name)));
        }

        String engine = config.string("engine").orElse("database");
        return List.of(manual(resource, secretName, SecretType.PASSWORD,
            String.format("Database master password for %s (%s)", name, engine)));
    }

    private List<DetectedSecret> detectRdsCluster(CloudResource resource) {
        ResourceConfig config = resource.config();
        String name = resource.displayName();
        String secretName = SecretNaming.generateSecretName(name, "aurora", "password");

        Optional<String> managedArn = managedMasterSecretArn(config);
        if (managedArn.isPresent()) {
            return List.of(stored(resource, SecretSource.AWS_SECRETS_MANAGER, secretName, managedArn.get(),
                SecretType.PASSWORD,
                String.format("Database master password for Aurora cluster %s (managed by Secrets Manager)", name)));
        }

        String engine = config.string("engine").orElse("aurora");
        return List.of(manual(resource, secretName, SecretType.PASSWORD,
            String.format("Database master password for Aurora cluster %s (%s)", name, engine)));
    }

    /**
     * ARN of the RDS managed master secret, from {@code master_user_secret_arn}
     * or the {@code master_user_secret} block. Values that are not Secrets
     * Manager ARNs are ignored.
     */
    private static Optional<String> managedMasterSecretArn(ResourceConfig config) {
        Optional<String> arn = config.string("master_user_secret_arn")
            .filter(a -> a.startsWith(SECRETS_MANAGER_ARN_PREFIX));
        if (arn.isPresent()) {
            return arn;
        }
        return config.maps("master_user_secret").stream()
            .map(block -> block.string("secret_arn"))
            .flatMap(Optional::stream)
            .filter(a -> a.startsWith(SECRETS_MANAGER_ARN_PREFIX))
            .findFirst();
    }

    private List<DetectedSecret> detectElastiCache(CloudResource resource) {
        ResourceConfig config = resource.config();
        boolean authEnabled = config.isTrue("auth_token_enabled")
            || config.string("auth_token").isPresent()
            || config.isTrue("transit_encryption_enabled");
        if (!authEnabled) {
            return List.of();
        }

        String name = resource.displayName();
        String engine = config.string("engine").orElse("redis");
        return List.of(manual(resource,
            SecretNaming.generateSecretName(name, "elasticache", "auth_token"),
            SecretType.PASSWORD,
            String.format("Auth token for ElastiCache %s cluster %s", engine, name)));
    }

    private List<DetectedSecret> detectLambda(CloudResource resource) {
        Optional<ResourceConfig> environment = resource.config().map("environment");
        if (environment.isEmpty()) {
            return List.of();
        }
        ResourceConfig variables = environment.get().map("variables").orElse(environment.get());

        List<DetectedSecret> detected = new ArrayList<>();
        for (String key : variables.asMap().keySet()) {
            if (SensitivePatterns.isSensitiveEnvName(key)) {
                detected.add(manual(resource, SecretNaming.normalizeEnvName(key),
                    SensitivePatterns.inferSecretType(key),
                    String.format("Environment variable %s from Lambda function %s", key, resource.displayName())));
            }
        }
        return detected;
    }

    private List<DetectedSecret> detectEcs(CloudResource resource) {
        ResourceConfig config = resource.config();
        List<ResourceConfig> containers = config.maps("container_definitions");
        if (containers.isEmpty()) {
            Optional<String> json = config.string("container_definitions");
            if (json.isPresent()) {
                containers = parseContainerDefinitions(resource, json.get());
            }
        }

        List<DetectedSecret> detected = new ArrayList<>();
        for (ResourceConfig container : containers) {
            String containerName = container.string("name").orElse(resource.displayName());

            for (ResourceConfig secret : container.maps("secrets")) {
                Optional<String> envName = secret.string("name");
                Optional<String> valueFrom = secret.string("valueFrom");
                if (envName.isPresent() && valueFrom.isPresent()) {
                    detected.add(ecsContainerSecret(resource, containerName, envName.get(), valueFrom.get()));
                }
            }

            for (ResourceConfig env : container.maps("environment")) {
                env.string("name")
                    .filter(SensitivePatterns::isSensitiveEnvName)
                    .ifPresent(envName -> detected.add(manual(resource, SecretNaming.normalizeEnvName(envName),
                        SensitivePatterns.inferSecretType(envName),
                        String.format("Environment variable %s from ECS container %s", envName, containerName))));
            }
        }
        return detected;
    }

    /**
     * Container secret by {@code valueFrom}: a Secrets Manager ARN or a bare
     * secret name maps to Secrets Manager; SSM parameters and other ARNs are manual.
     */
    private static DetectedSecret ecsContainerSecret(CloudResource resource, String containerName,
                                                     String envName, String valueFrom) {
        String name = SecretNaming.normalizeEnvName(envName);
        SecretType type = SensitivePatterns.inferSecretType(envName);

        if (valueFrom.startsWith(SECRETS_MANAGER_ARN_PREFIX)) {
            return stored(resource, SecretSource.AWS_SECRETS_MANAGER, name, valueFrom, type,
                String.format("Secret %s for ECS container %s (from Secrets Manager)", envName, containerName));
        }
        if (valueFrom.startsWith(SSM_ARN_PREFIX)) {
            return manual(resource, name, type,
                String.format("Secret %s for ECS container %s (from SSM Parameter Store: %s)",
                    envName, containerName, valueFrom));
        }
        if (!valueFrom.startsWith("arn:")) {
            return stored(resource, SecretSource.AWS_SECRETS_MANAGER, name, valueFrom, type,
                String.format("Secret %s for ECS container %s (from Secrets Manager: %s)",
                    envName, containerName, valueFrom));
        }
        return manual(resource, name, type,
            String.format("Secret %s for ECS container %s (reference: %s)", envName, containerName, valueFrom));
    }

    private List<ResourceConfig> parseContainerDefinitions(CloudResource resource, String json) {
        List<Object> parsed;
        try {
            parsed = objectMapper.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new SecretDetectionException(
                "Invalid container_definitions JSON on ECS resource " + resource.id(), e);
        }
        List<ResourceConfig> containers = new ArrayList<>();
        for (Object element : parsed) {
            if (element instanceof Map<?, ?> map) {
                containers.add(ResourceConfig.of(map));
            }
        }
        return containers;
    }

    private List<DetectedSecret> detectSecretsManagerSecret(CloudResource resource) {
        ResourceConfig config = resource.config();
        String arn = Optional.ofNullable(resource.arn())
            .filter(a -> !a.isBlank())
            .or(() -> config.string("arn"))
            .or(() -> config.string("id"))
            .orElse("");

        if (!arn.startsWith(SECRETS_MANAGER_ARN_PREFIX)) {
            String secretName = config.string("name").orElse(resource.displayName());
            return List.of(manual(resource, SecretNaming.normalizeEnvName(secretName), SecretType.GENERIC,
                String.format("Secret from AWS Secrets Manager: %s (ARN not available)", secretName)));
        }

        String secretName = config.string("name")
            .or(() -> Optional.of(resource.name()).filter(n -> !n.isBlank()))
            .orElseGet(() -> SecretNaming.extractSecretKeyFromArn(arn));
        String description = config.string("description")
            .orElse(String.format("Secret from AWS Secrets Manager: %s", secretName));

        return List.of(stored(resource, SecretSource.AWS_SECRETS_MANAGER,
            SecretNaming.normalizeEnvName(secretName), arn, SecretType.GENERIC, description));
    }

    private List<DetectedSecret> detectCognito(CloudResource resource) {
        String poolName = resource.displayName();
        List<DetectedSecret> detected = new ArrayList<>();
        for (ResourceConfig client : resource.config().maps("app_clients")) {
            if (!client.isTrue("generate_secret")) {
                continue;
            }
            String clientName = client.string("name").orElse("app");
            detected.add(candidate(resource)
                .name(SecretNaming.generateSecretName(poolName + "_" + clientName, "cognito", "client_secret"))
                .source(SecretSource.MANUAL)
                .type(SecretType.API_KEY)
                .required(false)
                .description(String.format("Cognito app client secret for %s in pool %s", clientName, poolName))
                .build());
        }
        return detected;
    }
}
