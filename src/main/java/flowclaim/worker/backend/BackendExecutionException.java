package flowclaim.worker.backend;

import java.io.IOException;

/**
 * An external flow or consistency-check tool could not be started, exited
 * non-zero, or did not produce its output file.
 */
public class BackendExecutionException extends IOException {

    private final int exitCode;

    public BackendExecutionException(String message) {
        this(message, -1);
    }

    public BackendExecutionException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public BackendExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /** Process exit status, or -1 when the process never ran to completion. */
    public int exitCode() {
        return exitCode;
    }
}
