package tech.homeport.secrets.resolve.providers;

import org.jboss.logging.Logger;
import tech.homeport.secrets.envfile.EnvFiles;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;
import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.resolve.ResolutionContext;
import tech.homeport.secrets.resolve.SecretProvider;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads secrets from local files.
 *
 * The reference key is either a file path, whose trimmed content is the
 * value, or {@code path:KEY}, which looks up {@code KEY} in an env file.
 * Relative paths are resolved against the configured base path.
 * Parsed env files are cached until {@link #clearCache()}.
 */
public class FileSecretProvider implements SecretProvider {

    private static final Logger LOG = Logger.getLogger(FileSecretProvider.class);

    private final Path basePath;
    private final Map<Path, Map<String, String>> envFileCache = new HashMap<>();

    public FileSecretProvider() {
        this(null);
    }

    /**
     * @param basePath directory for relative paths; the working directory when null
     */
    public FileSecretProvider(Path basePath) {
        this.basePath = basePath;
    }

    @Override
    public SecretSource name() {
        return SecretSource.FILE;
    }

    @Override
    public boolean canResolve(SecretReference ref) {
        return ref.source == SecretSource.FILE && ref.hasKey();
    }

    @Override
    public String resolve(ResolutionContext context, SecretReference ref) {
        if (!ref.hasKey()) {
            throw SecretResolutionException.notFound(ref.name, "No file path for secret " + ref.name);
        }

        FileKey fileKey = FileKey.parse(ref.key);
        Path path = resolvePath(fileKey.path());
        if (!Files.exists(path)) {
            throw SecretResolutionException.notFound(ref.name, "Secret file not found: " + path);
        }

        if (fileKey.envKey() != null) {
            String value = loadEnvFile(path).get(fileKey.envKey());
            if (value == null) {
                throw SecretResolutionException.notFound(ref.name,
                    "Key " + fileKey.envKey() + " not found in " + path);
            }
            return value;
        }

        try {
            return Files.readString(path, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_FOUND, ref.name,
                "Failed to read secret file " + path, e);
        }
    }

    @Override
    public void validateConfig() {
        if (basePath != null && !Files.isDirectory(basePath)) {
            throw SecretResolutionException.unavailable("Base path does not exist: " + basePath);
        }
    }

    /**
     * Parse an env file, cached by normalized path.
     *
     * @throws SecretResolutionException if the file cannot be read
     */
    public synchronized Map<String, String> loadEnvFile(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        Map<String, String> cached = envFileCache.get(normalized);
        if (cached != null) {
            return cached;
        }
        try {
            Map<String, String> values = EnvFiles.read(normalized);
            envFileCache.put(normalized, values);
            LOG.debugf("Loaded %d entries from %s", values.size(), normalized);
            return values;
        } catch (IOException e) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_FOUND, null,
                "Failed to read env file " + normalized, e);
        }
    }

    /**
     * Keys defined in an env file, without their values.
     */
    public List<String> listKeys(Path path) {
        return new ArrayList<>(loadEnvFile(resolvePath(path.toString())).keySet());
    }

    public synchronized void clearCache() {
        envFileCache.clear();
    }

    private Path resolvePath(String location) {
        Path path = Paths.get(location);
        if (path.isAbsolute()) {
            return path;
        }
        return basePath != null ? basePath.resolve(path) : path.toAbsolutePath();
    }

    /**
     * Split of a reference key into file path and optional env key.
     */
    record FileKey(String path, String envKey) {

        static FileKey parse(String key) {
            int idx = key.lastIndexOf(':');
            if (idx <= 0 || idx == key.length() - 1) {
                return new FileKey(key, null);
            }
            // C:\secrets or C:/secrets
            if (idx == 1 && Character.isLetter(key.charAt(0))) {
                return new FileKey(key, null);
            }
            String suffix = key.substring(idx + 1);
            if (suffix.contains("/") || suffix.contains("\\")) {
                return new FileKey(key, null);
            }
            return new FileKey(key.substring(0, idx), suffix);
        }
    }
}
