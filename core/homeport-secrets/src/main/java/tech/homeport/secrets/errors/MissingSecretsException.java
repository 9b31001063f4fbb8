package tech.homeport.secrets.errors;

import tech.homeport.secrets.model.ResolvedSecrets;

import java.util.List;

/**
 * Aggregate failure raised after a full resolution pass, naming every required
 * secret that could not be resolved.
 *
 * The secrets resolved before the failure remain available through
 * {@link #resolved()}; callers own them and should {@link ResolvedSecrets#clear()}
 * them when done.
 */
public class MissingSecretsException extends SecretException {

    private final List<String> missingSecrets;
    private final transient ResolvedSecrets resolved;

    public MissingSecretsException(List<String> missingSecrets, ResolvedSecrets resolved) {
        super(SecretErrorKind.SECRET_NOT_RESOLVED, null, String.format(
            "failed to resolve %d required secrets: %s",
            missingSecrets.size(), String.join(", ", missingSecrets)));
        this.missingSecrets = List.copyOf(missingSecrets);
        this.resolved = resolved;
    }

    public List<String> missingSecrets() {
        return missingSecrets;
    }

    public ResolvedSecrets resolved() {
        return resolved;
    }
}
