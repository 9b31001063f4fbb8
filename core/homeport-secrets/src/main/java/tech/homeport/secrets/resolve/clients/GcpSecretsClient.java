package tech.homeport.secrets.resolve.clients;

import java.time.Duration;

/**
 * Client for GCP Secret Manager.
 */
public interface GcpSecretsClient extends CredentialStoreClient {

    /**
     * @param project project id, or null for the client's default project
     * @param version version number or {@code latest}
     */
    String accessVersion(String project, String secret, String version, Duration timeout);
}
