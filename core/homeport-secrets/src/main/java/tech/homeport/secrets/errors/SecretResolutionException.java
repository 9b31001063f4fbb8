package tech.homeport.secrets.errors;

/**
 * Exception thrown when a secret cannot be resolved by a provider or the
 * resolution chain.
 */
public class SecretResolutionException extends SecretException {

    public SecretResolutionException(SecretErrorKind kind, String secretName, String message) {
        super(kind, secretName, message);
    }

    public SecretResolutionException(SecretErrorKind kind, String secretName, String message, Throwable cause) {
        super(kind, secretName, message, cause);
    }

    public static SecretResolutionException notFound(String secretName, String message) {
        return new SecretResolutionException(SecretErrorKind.SECRET_NOT_FOUND, secretName, message);
    }

    public static SecretResolutionException unavailable(String message) {
        return new SecretResolutionException(SecretErrorKind.PROVIDER_UNAVAILABLE, null, message);
    }

    public static SecretResolutionException unavailable(String message, Throwable cause) {
        return new SecretResolutionException(SecretErrorKind.PROVIDER_UNAVAILABLE, null, message, cause);
    }
}
