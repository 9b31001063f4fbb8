package tech.homeport.secrets.resolve.clients;

import java.time.Duration;
import java.util.List;

/**
 * Client for Azure Key Vault secrets.
 */
public interface AzureKeyVaultClient extends CredentialStoreClient {

    /**
     * @param version secret version, or null for the current one
     */
    String getSecret(String vaultName, String secretName, String version, Duration timeout);

    /**
     * Names of the secrets in a vault. Values are not read.
     */
    List<String> listSecrets(String vaultName, Duration timeout);

    /**
     * Names of the vaults visible to the caller.
     */
    List<String> listVaults(Duration timeout);
}
