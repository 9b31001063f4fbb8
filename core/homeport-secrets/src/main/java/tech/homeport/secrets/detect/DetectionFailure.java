package tech.homeport.secrets.detect;

/**
 * A resource whose detector failed during a scan.
 */
public record DetectionFailure(String resourceId, String resourceType, String message) {
}
