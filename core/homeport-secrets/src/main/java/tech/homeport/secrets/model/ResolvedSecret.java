package tech.homeport.secrets.model;

import java.time.Instant;
import java.util.Arrays;

/**
 * A secret value fetched at deploy time.
 *
 * WARNING: Never log or persist instances. The value is held in a char array
 * that {@link #destroy()} overwrites. This is best effort only; strings handed
 * out by {@link #value()} cannot be scrubbed.
 */
public final class ResolvedSecret {

    private final SecretReference reference;
    private final String resolvedFrom;
    private final Instant resolvedAt;
    private char[] value;
    private boolean destroyed;

    public ResolvedSecret(SecretReference reference, String value, String resolvedFrom, Instant resolvedAt) {
        this.reference = reference;
        this.value = value == null ? new char[0] : value.toCharArray();
        this.resolvedFrom = resolvedFrom;
        this.resolvedAt = resolvedAt;
    }

    public String name() {
        return reference.name;
    }

    public SecretReference reference() {
        return reference;
    }

    public synchronized String value() {
        return new String(value);
    }

    /**
     * Where the value came from, e.g. {@code file:/path}, {@code env:PREFIX_NAME}.
     */
    public String resolvedFrom() {
        return resolvedFrom;
    }

    public Instant resolvedAt() {
        return resolvedAt;
    }

    public synchronized boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Overwrite the value buffer and drop it.
     */
    public synchronized void destroy() {
        Arrays.fill(value, '\0');
        value = new char[0];
        destroyed = true;
    }

    @Override
    public String toString() {
        return "ResolvedSecret{name=" + name() + ", resolvedFrom=" + resolvedFrom + "}";
    }
}
