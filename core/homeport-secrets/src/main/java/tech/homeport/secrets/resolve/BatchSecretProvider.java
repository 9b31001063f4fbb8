package tech.homeport.secrets.resolve;

import tech.homeport.secrets.model.SecretReference;

import java.util.List;

/**
 * Provider that can fetch several secrets in one round trip. Secrets missing
 * from the batch result are resolved one by one afterwards.
 */
public interface BatchSecretProvider extends SecretProvider {

    BatchResult resolveBatch(ResolutionContext context, List<SecretReference> refs);
}
