package tech.homeport.secrets.resolve;

import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;

import java.time.Duration;

/**
 * Deadline shared by every step of one secret's resolution chain.
 */
public final class ResolutionContext {

    private final long deadlineNanos;

    private ResolutionContext(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static ResolutionContext withTimeout(Duration timeout) {
        return new ResolutionContext(System.nanoTime() + timeout.toNanos());
    }

    /**
     * Time left before the deadline, never negative.
     */
    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0 || Thread.currentThread().isInterrupted();
    }

    /**
     * @throws SecretResolutionException with kind SECRET_NOT_RESOLVED once the deadline has passed
     */
    public void checkNotExpired(String secretName) {
        if (isExpired()) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, secretName,
                secretName == null ? "Timed out" : "Timed out resolving secret " + secretName);
        }
    }
}
