package flowclaim.worker.claim;

/**
 * The shared directory could not be used to claim a job (permissions,
 * unreachable mount, missing directory). Unlike a lost race this is fatal to
 * the worker.
 */
public class ClaimException extends RuntimeException {

    private final int jobIndex;

    public ClaimException(int jobIndex, String message, Throwable cause) {
        super(message, cause);
        this.jobIndex = jobIndex;
    }

    public int jobIndex() {
        return jobIndex;
    }
}
