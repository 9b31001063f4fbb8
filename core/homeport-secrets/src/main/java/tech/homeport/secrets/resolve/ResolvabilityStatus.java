package tech.homeport.secrets.resolve;

/**
 * Dry-run classification of one secret.
 *
 * @param state  classification
 * @param method how the secret would be resolved, e.g. {@code secrets-file},
 *               {@code environment}, a source name, {@code interactive-prompt} or {@code none}
 */
public record ResolvabilityStatus(ResolvabilityState state, String method) {
}
