package tech.homeport.secrets.resolve.clients;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for AWS Secrets Manager.
 */
public interface AwsSecretsClient extends CredentialStoreClient {

    /**
     * @param secretId     secret name or ARN
     * @param versionStage stage label such as AWSCURRENT, or null
     * @return the secret string
     */
    String getSecretString(String secretId, String versionStage, Duration timeout);

    /**
     * Fetch several secrets in one call.
     *
     * @return values and error messages, both keyed by the requested secret id
     */
    BatchValues batchGet(List<String> secretIds, Duration timeout);

    /**
     * Names of all secrets in the account and region. Values are not read.
     *
     * @param timeout bound for each page request
     */
    List<String> listSecretNames(Duration timeout);

    record BatchValues(Map<String, String> values, Map<String, String> errors) {

        @Override
        public String toString() {
            return "BatchValues{values=" + values.keySet() + ", errors=" + errors.keySet() + "}";
        }
    }
}
