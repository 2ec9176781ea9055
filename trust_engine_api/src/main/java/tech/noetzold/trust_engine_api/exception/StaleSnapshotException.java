package tech.noetzold.trust_engine_api.exception;

/**
 * The cluster mapping a query was pinned to has been superseded. Retry against
 * the current version.
 */
public class StaleSnapshotException extends RuntimeException {

    private final long requestedVersion;
    private final long currentVersion;

    public StaleSnapshotException(long requestedVersion, long currentVersion) {
        super("Cluster mapping version " + requestedVersion + " superseded by " + currentVersion);
        this.requestedVersion = requestedVersion;
        this.currentVersion = currentVersion;
    }

    public long getRequestedVersion() {
        return requestedVersion;
    }

    public long getCurrentVersion() {
        return currentVersion;
    }
}
