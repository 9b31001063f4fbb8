package tech.homeport.secrets.naming;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SecretNaming.
 */
class SecretNamingTest {

    @ParameterizedTest
    @CsvSource({
        "my-secret-key, MY_SECRET_KEY",
        "db.password, DB_PASSWORD",
        "app/config/token, APP_CONFIG_TOKEN",
        "api key!, API_KEY",
        "__foo--bar__, FOO_BAR",
        "123abc, VAR_123ABC",
        "ALREADY_OK, ALREADY_OK"
    })
    void normalizeEnvName_producesValidNames(String input, String expected) {
        assertThat(SecretNaming.normalizeEnvName(input)).isEqualTo(expected);
    }

    @Test
    void normalizeEnvName_handlesNullAndEmpty() {
        assertThat(SecretNaming.normalizeEnvName(null)).isEmpty();
        assertThat(SecretNaming.normalizeEnvName("--")).isEmpty();
    }

    @Test
    @DisplayName("generateSecretName should add a type hint unless the name already has it")
    void generateSecretName_shouldInsertTypeHint() {
        assertThat(SecretNaming.generateSecretName("orders", "rds", "password")).isEqualTo("ORDERS_DB_PASSWORD");
        assertThat(SecretNaming.generateSecretName("prod-db", "rds", "password")).isEqualTo("PROD_DB_PASSWORD");
        assertThat(SecretNaming.generateSecretName("sessions", "elasticache", "auth_token"))
            .isEqualTo("SESSIONS_CACHE_AUTH_TOKEN");
        assertThat(SecretNaming.generateSecretName("worker", "lambda", "api_key")).isEqualTo("WORKER_FN_API_KEY");
        assertThat(SecretNaming.generateSecretName("billing", "azuresql", "password"))
            .isEqualTo("BILLING_DB_PASSWORD");
    }

    @Test
    void generateSecretName_withoutHintForUnknownKinds() {
        assertThat(SecretNaming.generateSecretName("users_web", "cognito", "client_secret"))
            .isEqualTo("USERS_WEB_CLIENT_SECRET");
        assertThat(SecretNaming.generateSecretName("main-aurora", "aurora", "password"))
            .isEqualTo("MAIN_AURORA_PASSWORD");
    }

    @Test
    @DisplayName("extractSecretKeyFromArn should strip the six-character random suffix")
    void extractSecretKeyFromArn_shouldStripRandomSuffix() {
        assertThat(SecretNaming.extractSecretKeyFromArn(
            "arn:aws:secretsmanager:us-east-1:123456789012:secret:prod/db-password-AbCdEf"))
            .isEqualTo("prod/db-password");
        assertThat(SecretNaming.extractSecretKeyFromArn(
            "arn:aws:secretsmanager:us-east-1:123456789012:secret:plain"))
            .isEqualTo("plain");
    }

    @Test
    @DisplayName("extractSecretKeyFromArn also strips legitimate six-character name segments")
    void extractSecretKeyFromArn_heuristicStripsSixCharacterSegments() {
        assertThat(SecretNaming.extractSecretKeyFromArn(
            "arn:aws:secretsmanager:us-east-1:123456789012:secret:simple-secret"))
            .isEqualTo("simple");
    }

    @Test
    void extractSecretKeyFromArn_returnsNonArnUnchanged() {
        assertThat(SecretNaming.extractSecretKeyFromArn("prod/db-password")).isEqualTo("prod/db-password");
        assertThat(SecretNaming.extractSecretKeyFromArn("arn:aws:s3:::bucket")).isEqualTo("arn:aws:s3:::bucket");
    }
}
