package tech.homeport.secrets.resolve.clients;

import org.jboss.logging.Logger;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.APIErrorType;
import software.amazon.awssdk.services.secretsmanager.model.BatchGetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.BatchGetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretListEntry;
import software.amazon.awssdk.services.secretsmanager.model.SecretValueEntry;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link AwsSecretsClient} on the AWS SDK. Credentials come from the
 * standard SDK chain. Every call is bounded by the caller's remaining time.
 */
public class SdkAwsSecretsClient implements AwsSecretsClient {

    private static final Logger LOG = Logger.getLogger(SdkAwsSecretsClient.class);

    private final Supplier<SecretsManagerClient> clientFactory;
    private volatile SecretsManagerClient client;

    public SdkAwsSecretsClient(SecretsManagerClient client) {
        this(() -> client);
    }

    /**
     * @param clientFactory called on first use; region or credential errors surface then
     */
    public SdkAwsSecretsClient(Supplier<SecretsManagerClient> clientFactory) {
        this.clientFactory = clientFactory;
    }

    @Override
    public String getSecretString(String secretId, String versionStage, Duration timeout) {
        GetSecretValueRequest.Builder request = GetSecretValueRequest.builder()
            .secretId(secretId)
            .overrideConfiguration(o -> o.apiCallTimeout(timeout));
        if (versionStage != null && !versionStage.isEmpty()) {
            request.versionStage(versionStage);
        }

        try {
            GetSecretValueResponse response = client().getSecretValue(request.build());
            if (response.secretString() == null) {
                throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, secretId,
                    "Secret is stored as binary, but string expected: " + secretId);
            }
            return response.secretString();
        } catch (ResourceNotFoundException e) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_FOUND, secretId,
                "Secret not found: " + secretId, e);
        } catch (ApiCallTimeoutException e) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, secretId,
                "Timed out fetching secret from AWS Secrets Manager: " + secretId, e);
        } catch (SdkException e) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, secretId,
                "Failed to retrieve secret from AWS Secrets Manager: " + secretId, e);
        }
    }

    @Override
    public BatchValues batchGet(List<String> secretIds, Duration timeout) {
        BatchGetSecretValueRequest request = BatchGetSecretValueRequest.builder()
            .secretIdList(secretIds)
            .overrideConfiguration(o -> o.apiCallTimeout(timeout))
            .build();

        BatchGetSecretValueResponse response;
        try {
            response = client().batchGetSecretValue(request);
        } catch (SdkException e) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, null,
                "Batch fetch from AWS Secrets Manager failed", e);
        }

        Map<String, String> values = new HashMap<>();
        Map<String, String> errors = new HashMap<>();
        for (SecretValueEntry entry : response.secretValues()) {
            // the response names the secret by name and ARN; map back to whichever was requested
            String requested = secretIds.contains(entry.name()) ? entry.name() : entry.arn();
            if (requested != null && entry.secretString() != null) {
                values.put(requested, entry.secretString());
            }
        }
        for (APIErrorType error : response.errors()) {
            errors.put(error.secretId(), error.errorCode() + ": " + error.message());
        }
        LOG.debugf("Batch fetched %d of %d secrets from AWS Secrets Manager", values.size(), secretIds.size());
        return new BatchValues(values, errors);
    }

    @Override
    public List<String> listSecretNames(Duration timeout) {
        ListSecretsRequest request = ListSecretsRequest.builder()
            .overrideConfiguration(o -> o.apiCallTimeout(timeout))
            .build();
        List<String> names = new ArrayList<>();
        try {
            for (SecretListEntry entry : client().listSecretsPaginator(request).secretList()) {
                names.add(entry.name());
            }
        } catch (SdkException e) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, null,
                "Failed to list secrets in AWS Secrets Manager", e);
        }
        return names;
    }

    @Override
    public void verifyAccess() {
        try {
            client().listSecrets(ListSecretsRequest.builder().maxResults(1).build());
        } catch (SdkException e) {
            throw SecretResolutionException.unavailable("AWS credentials not configured or Secrets Manager not reachable", e);
        }
    }

    private SecretsManagerClient client() {
        SecretsManagerClient current = client;
        if (current == null) {
            synchronized (this) {
                if (client == null) {
                    client = clientFactory.get();
                }
                current = client;
            }
        }
        return current;
    }
}
