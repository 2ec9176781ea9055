package tech.noetzold.trust_engine_api.exception;

/**
 * Stakeholder delivery gave up after its retries. The routing decision itself stays valid.
 */
public class NotificationFailedException extends RuntimeException {

    private final int attempts;

    public NotificationFailedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
