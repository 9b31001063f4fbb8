package tech.homeport.secrets.resolve.clients;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.APIErrorType;
import software.amazon.awssdk.services.secretsmanager.model.BatchGetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.BatchGetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretListEntry;
import software.amazon.awssdk.services.secretsmanager.model.SecretValueEntry;
import software.amazon.awssdk.services.secretsmanager.paginators.ListSecretsIterable;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SdkAwsSecretsClient.
 */
@ExtendWith(MockitoExtension.class)
class SdkAwsSecretsClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    SecretsManagerClient secretsManager;

    @Test
    void getSecretString_sendsStageAndTimeout() {
        when(secretsManager.getSecretValue(any(GetSecretValueRequest.class)))
            .thenReturn(GetSecretValueResponse.builder().secretString("hunter2").build());
        var client = new SdkAwsSecretsClient(secretsManager);

        assertThat(client.getSecretString("prod/db", "AWSCURRENT", TIMEOUT)).isEqualTo("hunter2");

        ArgumentCaptor<GetSecretValueRequest> captor = ArgumentCaptor.forClass(GetSecretValueRequest.class);
        verify(secretsManager).getSecretValue(captor.capture());
        assertThat(captor.getValue().secretId()).isEqualTo("prod/db");
        assertThat(captor.getValue().versionStage()).isEqualTo("AWSCURRENT");
        assertThat(captor.getValue().overrideConfiguration()).hasValueSatisfying(
            o -> assertThat(o.apiCallTimeout()).contains(TIMEOUT));
    }

    @Test
    void getSecretString_mapsMissingSecretToNotFound() {
        when(secretsManager.getSecretValue(any(GetSecretValueRequest.class)))
            .thenThrow(ResourceNotFoundException.builder().message("Secrets Manager can't find the secret").build());
        var client = new SdkAwsSecretsClient(secretsManager);

        assertThatThrownBy(() -> client.getSecretString("prod/db", null, TIMEOUT))
            .isInstanceOf(SecretResolutionException.class)
            .extracting(e -> ((SecretResolutionException) e).kind())
            .isEqualTo(SecretErrorKind.SECRET_NOT_FOUND);
    }

    @Test
    void getSecretString_rejectsBinarySecret() {
        when(secretsManager.getSecretValue(any(GetSecretValueRequest.class)))
            .thenReturn(GetSecretValueResponse.builder().secretBinary(SdkBytes.fromUtf8String("bin")).build());
        var client = new SdkAwsSecretsClient(secretsManager);

        assertThatThrownBy(() -> client.getSecretString("prod/cert", null, TIMEOUT))
            .hasMessageContaining("binary");
    }

    @Test
    void batchGet_mapsEntriesBackToRequestedIds() {
        String arn = "arn:aws:secretsmanager:us-east-1:123456789012:secret:prod/api-AbCdEf";
        when(secretsManager.batchGetSecretValue(any(BatchGetSecretValueRequest.class)))
            .thenReturn(BatchGetSecretValueResponse.builder()
                .secretValues(
                    SecretValueEntry.builder().name("prod/db").arn("arn:db").secretString("v-db").build(),
                    SecretValueEntry.builder().name("prod/api").arn(arn).secretString("v-api").build())
                .errors(APIErrorType.builder().secretId("prod/gone")
                    .errorCode("ResourceNotFoundException").message("not found").build())
                .build());
        var client = new SdkAwsSecretsClient(secretsManager);

        AwsSecretsClient.BatchValues batch = client.batchGet(List.of("prod/db", arn, "prod/gone"), TIMEOUT);

        assertThat(batch.values()).containsOnly(entry("prod/db", "v-db"), entry(arn, "v-api"));
        assertThat(batch.errors()).containsOnly(entry("prod/gone", "ResourceNotFoundException: not found"));
        assertThat(batch.toString()).doesNotContain("v-db");
    }

    @Test
    void batchGet_wrapsSdkFailure() {
        when(secretsManager.batchGetSecretValue(any(BatchGetSecretValueRequest.class)))
            .thenThrow(SdkClientException.create("connection refused"));
        var client = new SdkAwsSecretsClient(secretsManager);

        assertThatThrownBy(() -> client.batchGet(List.of("a", "b"), TIMEOUT))
            .isInstanceOf(SecretResolutionException.class)
            .extracting(e -> ((SecretResolutionException) e).kind())
            .isEqualTo(SecretErrorKind.SECRET_NOT_RESOLVED);
    }

    @Test
    void verifyAccess_reportsUnavailable() {
        when(secretsManager.listSecrets(any(ListSecretsRequest.class)))
            .thenThrow(SdkClientException.create("Unable to load credentials"));
        var client = new SdkAwsSecretsClient(secretsManager);

        assertThatThrownBy(client::verifyAccess)
            .isInstanceOf(SecretResolutionException.class)
            .extracting(e -> ((SecretResolutionException) e).kind())
            .isEqualTo(SecretErrorKind.PROVIDER_UNAVAILABLE);
    }

    @Test
    @SuppressWarnings("unchecked")
    void clientFactory_isCalledOnceOnFirstUse() {
        Supplier<SecretsManagerClient> factory = mock(Supplier.class);
        when(factory.get()).thenReturn(secretsManager);
        when(secretsManager.getSecretValue(any(GetSecretValueRequest.class)))
            .thenReturn(GetSecretValueResponse.builder().secretString("v").build());
        var client = new SdkAwsSecretsClient(factory);
        verifyNoInteractions(factory);

        client.getSecretString("a", null, TIMEOUT);
        client.getSecretString("b", null, TIMEOUT);

        verify(factory, times(1)).get();
    }

    @Test
    void listSecretNames_followsPages() {
        when(secretsManager.listSecretsPaginator(any(ListSecretsRequest.class)))
            .thenAnswer(inv -> new ListSecretsIterable(secretsManager, inv.getArgument(0)));
        when(secretsManager.listSecrets(any(ListSecretsRequest.class))).thenReturn(
            ListSecretsResponse.builder()
                .secretList(SecretListEntry.builder().name("prod/db").build())
                .nextToken("page-2")
                .build(),
            ListSecretsResponse.builder()
                .secretList(SecretListEntry.builder().name("prod/api").build())
                .build());
        var client = new SdkAwsSecretsClient(secretsManager);

        assertThat(client.listSecretNames(TIMEOUT)).containsExactly("prod/db", "prod/api");
        verify(secretsManager, never()).getSecretValue(any(GetSecretValueRequest.class));
    }

    @Test
    void listSecretNames_mapsSdkFailure() {
        when(secretsManager.listSecretsPaginator(any(ListSecretsRequest.class)))
            .thenThrow(SdkClientException.create("Unable to load region"));
        var client = new SdkAwsSecretsClient(secretsManager);

        assertThatThrownBy(() -> client.listSecretNames(TIMEOUT))
            .isInstanceOf(SecretResolutionException.class)
            .hasMessage("Failed to list secrets in AWS Secrets Manager");
    }
}
