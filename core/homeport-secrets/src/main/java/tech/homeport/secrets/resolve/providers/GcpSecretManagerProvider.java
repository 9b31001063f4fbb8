package tech.homeport.secrets.resolve.providers;

import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;
import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.resolve.ResolutionContext;
import tech.homeport.secrets.resolve.SecretProvider;
import tech.homeport.secrets.resolve.clients.GcpSecretsClient;

/**
 * Secret provider that uses GCP Secret Manager.
 *
 * Key formats:
 * <ul>
 *   <li>{@code projects/P/secrets/S} with optional {@code /versions/V}</li>
 *   <li>{@code S}, {@code S/V} or {@code S/versions/V}, in the configured default project</li>
 * </ul>
 * The reference version, when set, wins over the version in the key.
 */
public class GcpSecretManagerProvider implements SecretProvider {

    static final String LATEST = "latest";

    private final GcpSecretsClient client;
    private final String defaultProject;

    public GcpSecretManagerProvider(GcpSecretsClient client, String defaultProject) {
        this.client = client;
        this.defaultProject = defaultProject;
    }

    @Override
    public SecretSource name() {
        return SecretSource.GCP_SECRET_MANAGER;
    }

    @Override
    public boolean canResolve(SecretReference ref) {
        return ref.source == SecretSource.GCP_SECRET_MANAGER && ref.hasKey();
    }

    @Override
    public String resolve(ResolutionContext context, SecretReference ref) {
        if (!ref.hasKey()) {
            throw SecretResolutionException.notFound(ref.name, "No secret path for secret " + ref.name);
        }
        Locator locator = Locator.parse(ref.key, defaultProject);
        if (locator == null) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, ref.name,
                "Malformed Secret Manager path for secret " + ref.name + ": " + ref.key);
        }
        String version = ref.version != null && !ref.version.isEmpty() ? ref.version : locator.version();
        context.checkNotExpired(ref.name);
        return client.accessVersion(locator.project(), locator.secret(), version, context.remaining());
    }

    @Override
    public void validateConfig() {
        client.verifyAccess();
    }

    record Locator(String project, String secret, String version) {

        /**
         * @return null when the key is not a recognised secret path
         */
        static Locator parse(String key, String defaultProject) {
            String[] parts = key.split("/");
            if (parts[0].equals("projects")) {
                if (parts.length == 4 && parts[2].equals("secrets")) {
                    return new Locator(parts[1], parts[3], LATEST);
                }
                if (parts.length == 6 && parts[2].equals("secrets") && parts[4].equals("versions")) {
                    return new Locator(parts[1], parts[3], parts[5]);
                }
                return null;
            }
            return switch (parts.length) {
                case 1 -> new Locator(defaultProject, parts[0], LATEST);
                case 2 -> new Locator(defaultProject, parts[0], parts[1]);
                case 3 -> parts[1].equals("versions") ? new Locator(defaultProject, parts[0], parts[2]) : null;
                default -> null;
            };
        }
    }
}
