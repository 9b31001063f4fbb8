package tech.homeport.secrets.envfile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jboss.logging.Logger;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretException;
import tech.homeport.secrets.model.SecretsManifest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON snapshots of a {@link SecretsManifest}. Snapshots hold references
 * only; reading one re-validates every entry.
 */
public class ManifestSnapshots {

    private static final Logger LOG = Logger.getLogger(ManifestSnapshots.class);

    public static final String DEFAULT_FILE_NAME = "secrets-manifest.json";

    private final ObjectMapper objectMapper;

    public ManifestSnapshots() {
        this(new ObjectMapper());
    }

    public ManifestSnapshots(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(SecretsManifest manifest) {
        try {
            return objectMapper.writeValueAsString(manifest);
        } catch (JsonProcessingException e) {
            throw new SecretException(SecretErrorKind.INVALID_MANIFEST, null,
                "Failed to serialize secrets manifest", e);
        }
    }

    /**
     * @throws SecretException with kind INVALID_MANIFEST when the JSON is malformed
     *                         or an entry fails validation
     */
    public SecretsManifest fromJson(String json) {
        try {
            SecretsManifest manifest = objectMapper.readValue(json, SecretsManifest.class);
            if (manifest == null) {
                throw new SecretException(SecretErrorKind.INVALID_MANIFEST, "Secrets manifest is empty");
            }
            return manifest;
        } catch (JsonProcessingException e) {
            Throwable cause = e.getCause() instanceof SecretException ? e.getCause() : e;
            throw new SecretException(SecretErrorKind.INVALID_MANIFEST, null,
                "Invalid secrets manifest: " + cause.getMessage(), cause);
        }
    }

    public void write(SecretsManifest manifest, Path path) throws IOException {
        Files.writeString(path, toJson(manifest), StandardCharsets.UTF_8);
        LOG.debugf("Wrote secrets manifest with %d entries to %s", manifest.size(), path);
    }

    public SecretsManifest read(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }
}
