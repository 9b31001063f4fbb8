package tech.homeport.secrets.resolve.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;
import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.resolve.ResolutionContext;
import tech.homeport.secrets.resolve.SecretProvider;
import tech.homeport.secrets.resolve.clients.VaultKvClient;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Secret provider that uses the HashiCorp Vault KV v2 engine.
 *
 * Key format: path/to/secret#field
 * - path/to/secret: relative to the mount, or already starting with it
 * - field: optional. Without it a single-field secret yields its value and a
 *   multi-field secret yields the whole data map as JSON.
 */
public class HashiCorpVaultProvider implements SecretProvider {

    private final VaultKvClient client;
    private final String mount;
    private final ObjectMapper objectMapper;

    public HashiCorpVaultProvider(VaultKvClient client, String mount, ObjectMapper objectMapper) {
        this.client = client;
        this.mount = mount;
        this.objectMapper = objectMapper;
    }

    @Override
    public SecretSource name() {
        return SecretSource.HASHICORP_VAULT;
    }

    @Override
    public boolean canResolve(SecretReference ref) {
        return ref.source == SecretSource.HASHICORP_VAULT && ref.hasKey();
    }

    @Override
    public String resolve(ResolutionContext context, SecretReference ref) {
        if (!ref.hasKey()) {
            throw SecretResolutionException.notFound(ref.name, "No Vault path for secret " + ref.name);
        }

        String path = ref.key;
        String field = null;
        int hash = path.indexOf('#');
        if (hash >= 0) {
            field = path.substring(hash + 1);
            path = path.substring(0, hash);
        }

        context.checkNotExpired(ref.name);
        Map<String, Object> data = client.read(fullPath(path), context.remaining());

        if (field != null && !field.isEmpty()) {
            if (!data.containsKey(field)) {
                throw SecretResolutionException.notFound(ref.name, "Field " + field + " not found in Vault secret " + path);
            }
            Object value = data.get(field);
            return value instanceof String s ? s : toJson(ref.name, value);
        }

        if (data.size() == 1 && data.values().iterator().next() instanceof String s) {
            return s;
        }
        return toJson(ref.name, new TreeMap<>(data));
    }

    @Override
    public void validateConfig() {
        client.verifyAccess();
    }

    /**
     * Keys under a path relative to the mount; a null or empty path lists the mount root.
     */
    public List<String> listSecrets(ResolutionContext context, String path) {
        context.checkNotExpired(null);
        return client.list(listPath(path), context.remaining());
    }

    String listPath(String path) {
        if (path == null || path.isEmpty()) {
            return mount + "/";
        }
        if (path.startsWith(mount + "/")) {
            return path;
        }
        return mount + "/" + path;
    }

    String fullPath(String path) {
        if (path.startsWith(mount + "/")) {
            return path;
        }
        return mount + "/data/" + path;
    }

    private String toJson(String secretName, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, secretName,
                "Failed to serialize Vault data for secret " + secretName);
        }
    }
}
