package tech.homeport.secrets.errors;

/**
 * Classification of secret engine failures. Callers branch on the kind,
 * never on message text.
 */
public enum SecretErrorKind {
    /** Reference has no name. */
    EMPTY_NAME,
    /** Reference name does not match {@code ^[A-Z][A-Z0-9_]*$}. */
    INVALID_NAME,
    /** Unrecognised secret source. */
    INVALID_SOURCE,
    /** Non-manual reference without a locator key. */
    MISSING_KEY,
    /** Manifest already holds a secret with the same name. */
    DUPLICATE_NAME,
    /** Named secret not present in the manifest or store. */
    SECRET_NOT_FOUND,
    /** Resolution chain exhausted without a value. */
    SECRET_NOT_RESOLVED,
    /** No provider registered for the reference's source. */
    NO_PROVIDER_FOR_SOURCE,
    /** Provider cannot be used in the current environment. */
    PROVIDER_UNAVAILABLE,
    /** Manifest snapshot could not be read or is inconsistent. */
    INVALID_MANIFEST,
    /** A detector failed on a resource. */
    DETECTION_FAILED
}
