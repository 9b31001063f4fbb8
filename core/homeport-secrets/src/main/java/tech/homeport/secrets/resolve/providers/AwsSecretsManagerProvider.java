package tech.homeport.secrets.resolve.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.homeport.secrets.errors.SecretResolutionException;
import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.resolve.BatchResult;
import tech.homeport.secrets.resolve.BatchSecretProvider;
import tech.homeport.secrets.resolve.ResolutionContext;
import tech.homeport.secrets.resolve.clients.AwsSecretsClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Secret provider that uses AWS Secrets Manager.
 *
 * The reference key is the secret name or ARN; the reference version, when
 * set, selects a version stage. When the secret string is a JSON object and
 * the last path segment of the key ends in {@code -field}, that field is
 * returned instead of the whole document ({@code prod/app/db-password}
 * yields the {@code password} field).
 *
 * SECURITY NOTE: values are never logged; batch results are keyed by
 * secret name only in log output.
 */
public class AwsSecretsManagerProvider implements BatchSecretProvider {

    private static final Logger LOG = Logger.getLogger(AwsSecretsManagerProvider.class);

    private final AwsSecretsClient client;
    private final ObjectMapper objectMapper;

    public AwsSecretsManagerProvider(AwsSecretsClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public SecretSource name() {
        return SecretSource.AWS_SECRETS_MANAGER;
    }

    @Override
    public boolean canResolve(SecretReference ref) {
        return ref.source == SecretSource.AWS_SECRETS_MANAGER && ref.hasKey();
    }

    @Override
    public String resolve(ResolutionContext context, SecretReference ref) {
        if (!ref.hasKey()) {
            throw SecretResolutionException.notFound(ref.name, "No secret id for secret " + ref.name);
        }
        context.checkNotExpired(ref.name);
        String value = client.getSecretString(ref.key, emptyToNull(ref.version), context.remaining());
        return extractField(ref.key, value);
    }

    /**
     * Fetch all references in one call. References pinned to a version stage,
     * and everything when the batch call itself fails, are fetched one by one.
     */
    @Override
    public BatchResult resolveBatch(ResolutionContext context, List<SecretReference> refs) {
        Map<String, String> secrets = new LinkedHashMap<>();
        Map<String, SecretResolutionException> errors = new LinkedHashMap<>();

        Map<String, List<SecretReference>> byId = new LinkedHashMap<>();
        List<SecretReference> single = new ArrayList<>();
        for (SecretReference ref : refs) {
            if (!ref.hasKey()) {
                continue;
            }
            if (ref.version != null && !ref.version.isEmpty()) {
                single.add(ref);
            } else {
                byId.computeIfAbsent(ref.key, k -> new ArrayList<>()).add(ref);
            }
        }

        if (!byId.isEmpty()) {
            try {
                AwsSecretsClient.BatchValues batch = client.batchGet(new ArrayList<>(byId.keySet()), context.remaining());
                byId.forEach((id, sharing) -> {
                    String value = batch.values().get(id);
                    for (SecretReference ref : sharing) {
                        if (value != null) {
                            secrets.put(ref.name, extractField(ref.key, value));
                        } else {
                            String message = batch.errors().getOrDefault(id, "not returned by batch call");
                            errors.put(ref.name, SecretResolutionException.notFound(ref.name,
                                "AWS error for " + id + ": " + message));
                        }
                    }
                });
            } catch (SecretResolutionException e) {
                LOG.debugf("Batch fetch failed, falling back to single fetches: %s", e.getMessage());
                byId.values().forEach(single::addAll);
            }
        }

        for (SecretReference ref : single) {
            try {
                secrets.put(ref.name, resolve(context, ref));
            } catch (SecretResolutionException e) {
                errors.put(ref.name, e);
            }
        }
        return new BatchResult(secrets, errors);
    }

    @Override
    public void validateConfig() {
        client.verifyAccess();
    }

    /**
     * Names of the secrets in the configured account and region.
     */
    public List<String> listSecrets(ResolutionContext context) {
        context.checkNotExpired(null);
        return client.listSecretNames(context.remaining());
    }

    String extractField(String key, String value) {
        String field = fieldName(key);
        if (field == null || !value.trim().startsWith("{")) {
            return value;
        }
        try {
            JsonNode node = objectMapper.readTree(value).get(field);
            if (node != null && node.isTextual()) {
                return node.asText();
            }
        } catch (JsonProcessingException e) {
            LOG.debugf("Secret %s is not a JSON document, returning it whole", key);
        }
        return value;
    }

    static String fieldName(String key) {
        String last = key.substring(key.lastIndexOf('/') + 1);
        int idx = last.lastIndexOf('-');
        if (idx < 0 || idx == last.length() - 1) {
            return null;
        }
        return last.substring(idx + 1);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
