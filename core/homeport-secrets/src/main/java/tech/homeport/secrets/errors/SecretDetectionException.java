package tech.homeport.secrets.errors;

/**
 * Exception thrown by a detector that cannot interpret a resource.
 */
public class SecretDetectionException extends SecretException {

    public SecretDetectionException(String message) {
        super(SecretErrorKind.DETECTION_FAILED, null, message);
    }

    public SecretDetectionException(String message, Throwable cause) {
        super(SecretErrorKind.DETECTION_FAILED, null, message, cause);
    }
}
