package tech.homeport.secrets.resource;

import java.util.Optional;

/**
 * Cloud provider a resource belongs to.
 */
public enum CloudProvider {
    AWS("aws"),
    GCP("gcp"),
    AZURE("azure");

    private final String value;

    CloudProvider(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<CloudProvider> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (CloudProvider provider : values()) {
            if (provider.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
