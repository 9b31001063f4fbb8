package tech.homeport.secrets.resolve.clients;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for the HashiCorp Vault KV v2 engine.
 */
public interface VaultKvClient extends CredentialStoreClient {

    /**
     * Read the data map stored at a full KV path, e.g. {@code secret/data/app/db}.
     */
    Map<String, Object> read(String fullPath, Duration timeout);

    /**
     * Keys directly under a path, e.g. {@code secret/app}. Folders end in {@code /}.
     */
    List<String> list(String path, Duration timeout);
}
