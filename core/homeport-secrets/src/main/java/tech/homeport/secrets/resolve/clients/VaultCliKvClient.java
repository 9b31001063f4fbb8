package tech.homeport.secrets.resolve.clients;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link VaultKvClient} on the {@code vault} CLI. Address, token and namespace
 * are passed through the VAULT_* environment variables when configured.
 */
public class VaultCliKvClient extends AbstractCliClient implements VaultKvClient {

    private final ObjectMapper objectMapper;
    private final Map<String, String> environment;

    public VaultCliKvClient(String binary, String address, String token, String namespace,
                            CommandRunner runner, ObjectMapper objectMapper) {
        super(binary, runner);
        this.objectMapper = objectMapper;
        Map<String, String> env = new HashMap<>();
        putIfSet(env, "VAULT_ADDR", address);
        putIfSet(env, "VAULT_TOKEN", token);
        putIfSet(env, "VAULT_NAMESPACE", namespace);
        this.environment = Map.copyOf(env);
    }

    @Override
    protected Map<String, String> environment() {
        return environment;
    }

    @Override
    public Map<String, Object> read(String fullPath, Duration timeout) {
        String output = fetch(fullPath, timeout, List.of("kv", "get", "-format=json", fullPath));
        try {
            JsonNode data = objectMapper.readTree(output).path("data").path("data");
            if (!data.isObject()) {
                throw SecretResolutionException.notFound(null, "No data at Vault path " + fullPath);
            }
            return objectMapper.convertValue(data, objectMapper.getTypeFactory()
                .constructMapType(Map.class, String.class, Object.class));
        } catch (JsonProcessingException e) {
            // the parser message could quote the payload
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, null,
                "Failed to parse Vault response for " + fullPath);
        }
    }

    @Override
    public List<String> list(String path, Duration timeout) {
        String output = output("key list of " + path, null, timeout, List.of("kv", "list", "-format=json", path));
        try {
            JsonNode keys = objectMapper.readTree(output);
            List<String> names = new ArrayList<>();
            if (keys.isArray()) {
                keys.forEach(key -> names.add(key.asText()));
            }
            return names;
        } catch (JsonProcessingException e) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, null,
                "Failed to parse Vault key list for " + path);
        }
    }

    @Override
    public void verifyAccess() {
        verify(List.of("token", "lookup", "-format=json"));
    }

    private static void putIfSet(Map<String, String> env, String name, String value) {
        if (value != null && !value.isEmpty()) {
            env.put(name, value);
        }
    }
}
