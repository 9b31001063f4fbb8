package tech.homeport.secrets.detect;

import tech.homeport.secrets.model.DetectedSecret;
import tech.homeport.secrets.model.SecretsManifest;

import java.util.List;

/**
 * Outcome of a scan.
 *
 * @param manifest deduplicated, name-sorted manifest
 * @param failures resources whose detector threw; the scan continued past them
 * @param dropped  candidates that could not be added to the manifest
 */
public record DetectionReport(
    SecretsManifest manifest,
    List<DetectionFailure> failures,
    List<DetectedSecret> dropped
) {

    public DetectionReport {
        failures = List.copyOf(failures);
        dropped = List.copyOf(dropped);
    }

    public boolean isComplete() {
        return failures.isEmpty() && dropped.isEmpty();
    }
}
