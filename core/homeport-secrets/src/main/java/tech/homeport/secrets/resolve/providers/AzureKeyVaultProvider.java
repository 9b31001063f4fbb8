package tech.homeport.secrets.resolve.providers;

import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;
import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.resolve.ResolutionContext;
import tech.homeport.secrets.resolve.SecretProvider;
import tech.homeport.secrets.resolve.clients.AzureKeyVaultClient;

import java.util.List;

/**
 * Secret provider that uses Azure Key Vault.
 *
 * Key formats: {@code vault/secret},
 * {@code https://vault.vault.azure.net/secrets/secret[/version]}, or a bare
 * secret name in the configured vault.
 */
public class AzureKeyVaultProvider implements SecretProvider {

    private static final String HTTPS = "https://";

    private final AzureKeyVaultClient client;
    private final String defaultVault;

    public AzureKeyVaultProvider(AzureKeyVaultClient client, String defaultVault) {
        this.client = client;
        this.defaultVault = defaultVault;
    }

    @Override
    public SecretSource name() {
        return SecretSource.AZURE_KEY_VAULT;
    }

    @Override
    public boolean canResolve(SecretReference ref) {
        return ref.source == SecretSource.AZURE_KEY_VAULT && ref.hasKey();
    }

    @Override
    public String resolve(ResolutionContext context, SecretReference ref) {
        if (!ref.hasKey()) {
            throw SecretResolutionException.notFound(ref.name, "No Key Vault secret for secret " + ref.name);
        }
        Locator locator = Locator.parse(ref.key, defaultVault);
        if (locator.vault() == null || locator.vault().isEmpty()) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, ref.name,
                "Vault name not specified for secret " + ref.name);
        }
        String version = ref.version != null && !ref.version.isEmpty() ? ref.version : locator.version();
        context.checkNotExpired(ref.name);
        return client.getSecret(locator.vault(), locator.secret(), version, context.remaining());
    }

    @Override
    public void validateConfig() {
        client.verifyAccess();
    }

    /**
     * Names of the secrets in the configured vault.
     *
     * @throws SecretResolutionException with kind PROVIDER_UNAVAILABLE when no vault is configured
     */
    public List<String> listSecrets(ResolutionContext context) {
        if (defaultVault == null || defaultVault.isEmpty()) {
            throw SecretResolutionException.unavailable("Vault name not specified");
        }
        context.checkNotExpired(null);
        return client.listSecrets(defaultVault, context.remaining());
    }

    public List<String> listVaults(ResolutionContext context) {
        context.checkNotExpired(null);
        return client.listVaults(context.remaining());
    }

    record Locator(String vault, String secret, String version) {

        static Locator parse(String key, String defaultVault) {
            if (key.startsWith(HTTPS)) {
                // vault.vault.azure.net/secrets/name[/version]
                String[] parts = key.substring(HTTPS.length()).split("/");
                if (parts.length >= 3 && parts[1].equals("secrets")) {
                    String vault = parts[0].split("\\.")[0];
                    String version = parts.length >= 4 && !parts[3].isEmpty() ? parts[3] : null;
                    return new Locator(vault, parts[2], version);
                }
                return new Locator(defaultVault, key, null);
            }
            int slash = key.indexOf('/');
            if (slash > 0) {
                return new Locator(key.substring(0, slash), key.substring(slash + 1), null);
            }
            return new Locator(defaultVault, key, null);
        }
    }
}
