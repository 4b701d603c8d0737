package flowclaim.worker.model;

/**
 * Why a claimed job failed.
 */
public enum FailureKind {
    MISSING_FRAME,
    BACKEND_EXECUTION,
    CODEC_IO,
    UNEXPECTED
}
