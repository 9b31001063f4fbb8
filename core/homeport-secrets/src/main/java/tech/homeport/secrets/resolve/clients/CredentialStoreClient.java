package tech.homeport.secrets.resolve.clients;

import tech.homeport.secrets.errors.SecretResolutionException;

/**
 * Read-only client of an external credential store.
 */
public interface CredentialStoreClient {

    /**
     * Check that the store is reachable and the caller is authenticated.
     * Must not read any secret value.
     *
     * @throws SecretResolutionException with kind PROVIDER_UNAVAILABLE otherwise
     */
    void verifyAccess();
}
