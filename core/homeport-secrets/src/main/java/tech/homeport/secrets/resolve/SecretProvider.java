package tech.homeport.secrets.resolve;

import tech.homeport.secrets.errors.SecretResolutionException;
import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretSource;

/**
 * Resolves secret references of one {@link SecretSource} to their values.
 *
 * Providers are read-only. Secrets are provisioned in their stores by
 * infrastructure owners; this engine only fetches them at deploy time.
 */
public interface SecretProvider {

    /**
     * Source this provider serves. The resolver registers one provider per source.
     */
    SecretSource name();

    /**
     * Whether this provider can attempt the reference. Must not perform I/O.
     */
    boolean canResolve(SecretReference ref);

    /**
     * Fetch the value. Blocking calls must honour {@link ResolutionContext#remaining()}.
     *
     * @throws SecretResolutionException if the value cannot be fetched
     */
    String resolve(ResolutionContext context, SecretReference ref);

    /**
     * Check that the provider is usable (client present, authenticated)
     * without fetching or displaying any secret value.
     *
     * @throws SecretResolutionException with kind PROVIDER_UNAVAILABLE if not usable
     */
    void validateConfig();

    /**
     * Whether {@link #resolve} asks the operator for the value. The resolver
     * does not prompt again for a secret such a provider already asked for.
     */
    default boolean prompts() {
        return false;
    }
}
