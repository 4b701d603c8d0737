package flowclaim.worker.model;

/**
 * Outcome of one job index from the point of view of this worker.
 */
public enum JobStatus {
    /** Claimed here and all artifacts written */
    COMPLETED,
    /** Claimed here but the pipeline failed; the claim stays in place */
    FAILED,
    /** Already claimed by another worker or thread */
    SKIPPED
}
