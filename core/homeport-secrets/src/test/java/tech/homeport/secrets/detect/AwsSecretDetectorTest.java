package tech.homeport.secrets.detect;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.homeport.secrets.errors.SecretDetectionException;
import tech.homeport.secrets.model.DetectedSecret;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.model.SecretType;
import tech.homeport.secrets.resource.CloudResource;
import tech.homeport.secrets.resource.ResourceType;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AwsSecretDetector.
 */
class AwsSecretDetectorTest {

    private static final String SM_ARN =
        "arn:aws:secretsmanager:us-east-1:123456789012:secret:prod/db-password-AbCdEf";

    private final AwsSecretDetector detector = new AwsSecretDetector();

    // ========================================
    // RDS
    // ========================================

    @Test
    @DisplayName("detect should require a manual master password for a plain RDS instance")
    void detect_shouldRequireManualPassword_forRdsInstance() {
        var resource = CloudResource.of("db-1", "orders", ResourceType.AWS_RDS_INSTANCE,
            Map.of("engine", "postgres"));

        List<DetectedSecret> detected = detector.detect(resource);

        assertThat(detected).hasSize(1);
        DetectedSecret secret = detected.get(0);
        assertThat(secret.name()).isEqualTo("ORDERS_DB_PASSWORD");
        assertThat(secret.source()).isEqualTo(SecretSource.MANUAL);
        assertThat(secret.type()).isEqualTo(SecretType.PASSWORD);
        assertThat(secret.required()).isTrue();
        assertThat(secret.description()).isEqualTo("Database master password for orders (postgres)");
        assertThat(secret.resourceId()).isEqualTo("db-1");
    }

    @Test
    @DisplayName("detect should use the managed master secret when RDS manages it")
    void detect_shouldUseManagedSecret_whenPresent() {
        var resource = CloudResource.of("db-1", "orders", ResourceType.AWS_RDS_INSTANCE,
            Map.of("master_user_secret", List.of(Map.of("secret_arn", SM_ARN))));

        DetectedSecret secret = detector.detect(resource).get(0);

        assertThat(secret.source()).isEqualTo(SecretSource.AWS_SECRETS_MANAGER);
        assertThat(secret.key()).isEqualTo(SM_ARN);
        assertThat(secret.effectiveDeduplicationKey()).isEqualTo("aws-secrets-manager:" + SM_ARN);
    }

    @Test
    void detect_skipsClusterMembers() {
        var resource = CloudResource.of("db-2", "orders-1", ResourceType.AWS_RDS_INSTANCE,
            Map.of("cluster_identifier", "orders-cluster"));

        assertThat(detector.detect(resource)).isEmpty();
    }

    // ========================================
    // ElastiCache and Lambda
    // ========================================

    @Test
    void detect_elastiCacheOnlyWhenAuthIsEnabled() {
        var withAuth = CloudResource.of("c-1", "sessions", ResourceType.AWS_ELASTICACHE_REPLICATION_GROUP,
            Map.of("transit_encryption_enabled", true));
        var withoutAuth = CloudResource.of("c-2", "plain", ResourceType.AWS_ELASTICACHE_CLUSTER, Map.of());

        assertThat(detector.detect(withAuth)).extracting(DetectedSecret::name)
            .containsExactly("SESSIONS_CACHE_AUTH_TOKEN");
        assertThat(detector.detect(withoutAuth)).isEmpty();
    }

    @Test
    void detect_lambdaSensitiveEnvironmentOnly() {
        var resource = CloudResource.of("fn-1", "worker", ResourceType.AWS_LAMBDA_FUNCTION,
            Map.of("environment", List.of(Map.of("variables", Map.of(
                "STRIPE_API_KEY", "placeholder",
                "LOG_LEVEL", "info")))));

        List<DetectedSecret> detected = detector.detect(resource);

        assertThat(detected).extracting(DetectedSecret::name).containsExactly("STRIPE_API_KEY");
        assertThat(detected.get(0).type()).isEqualTo(SecretType.API_KEY);
    }

    // ========================================
    // ECS
    // ========================================

    @Test
    @DisplayName("detect should classify ECS container secrets by valueFrom")
    void detect_shouldClassifyEcsSecrets() {
        var resource = CloudResource.of("td-1", "api", ResourceType.AWS_ECS_TASK_DEFINITION,
            Map.of("container_definitions", """
                [{
                  "name": "api",
                  "secrets": [
                    {"name": "DB_PASSWORD", "valueFrom": "%s"},
                    {"name": "SIGNING_KEY", "valueFrom": "arn:aws:ssm:us-east-1:123456789012:parameter/signing"},
                    {"name": "STRIPE_TOKEN", "valueFrom": "prod/stripe"}
                  ],
                  "environment": [
                    {"name": "JWT_SECRET", "value": "x"},
                    {"name": "PORT", "value": "8080"}
                  ]
                }]
                """.formatted(SM_ARN)));

        List<DetectedSecret> detected = detector.detect(resource);

        assertThat(detected).extracting(DetectedSecret::name)
            .containsExactly("DB_PASSWORD", "SIGNING_KEY", "STRIPE_TOKEN", "JWT_SECRET");
        assertThat(detected).extracting(DetectedSecret::source).containsExactly(
            SecretSource.AWS_SECRETS_MANAGER, SecretSource.MANUAL, SecretSource.AWS_SECRETS_MANAGER,
            SecretSource.MANUAL);
        assertThat(detected.get(2).key()).isEqualTo("prod/stripe");
    }

    @Test
    void detect_ecsAcceptsStructuredContainerDefinitions() {
        var resource = CloudResource.of("svc-1", "api", ResourceType.AWS_ECS_SERVICE,
            Map.of("container_definitions", List.of(Map.of(
                "name", "api",
                "secrets", List.of(Map.of("name", "DB_PASSWORD", "valueFrom", SM_ARN))))));

        assertThat(detector.detect(resource)).extracting(DetectedSecret::key).containsExactly(SM_ARN);
    }

    @Test
    void detect_failsOnInvalidContainerDefinitionsJson() {
        var resource = CloudResource.of("td-1", "api", ResourceType.AWS_ECS_TASK_DEFINITION,
            Map.of("container_definitions", "[{not json"));

        assertThatThrownBy(() -> detector.detect(resource))
            .isInstanceOf(SecretDetectionException.class)
            .hasMessageContaining("td-1");
    }

    // ========================================
    // Secrets Manager and Cognito
    // ========================================

    @Test
    void detect_secretsManagerSecretUsesArnAsKey() {
        var resource = new CloudResource("sm-1", "", ResourceType.AWS_SECRETS_MANAGER_SECRET, SM_ARN, Map.of());

        DetectedSecret secret = detector.detect(resource).get(0);

        assertThat(secret.name()).isEqualTo("PROD_DB_PASSWORD");
        assertThat(secret.source()).isEqualTo(SecretSource.AWS_SECRETS_MANAGER);
        assertThat(secret.key()).isEqualTo(SM_ARN);
    }

    @Test
    void detect_secretsManagerSecretWithoutArnFallsBackToManual() {
        var resource = CloudResource.of("sm-2", "legacy-token", ResourceType.AWS_SECRETS_MANAGER_SECRET, Map.of());

        DetectedSecret secret = detector.detect(resource).get(0);

        assertThat(secret.name()).isEqualTo("LEGACY_TOKEN");
        assertThat(secret.source()).isEqualTo(SecretSource.MANUAL);
        assertThat(secret.description()).contains("ARN not available");
    }

    @Test
    void detect_cognitoClientSecretsAreOptional() {
        var resource = CloudResource.of("pool-1", "users", ResourceType.AWS_COGNITO_USER_POOL,
            Map.of("app_clients", List.of(
                Map.of("name", "web", "generate_secret", true),
                Map.of("name", "mobile", "generate_secret", false))));

        List<DetectedSecret> detected = detector.detect(resource);

        assertThat(detected).extracting(DetectedSecret::name).containsExactly("USERS_WEB_CLIENT_SECRET");
        assertThat(detected.get(0).required()).isFalse();
        assertThat(detected.get(0).type()).isEqualTo(SecretType.API_KEY);
    }

    @Test
    void detect_unknownTypeYieldsNothing() {
        var resource = CloudResource.of("b-1", "assets", ResourceType.of("aws_s3_bucket"), Map.of());

        assertThat(detector.detect(resource)).isEmpty();
        assertThat(detector.supportedTypes()).contains(ResourceType.AWS_RDS_INSTANCE)
            .doesNotContain(ResourceType.of("aws_s3_bucket"));
    }
}
