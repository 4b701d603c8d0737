package flowclaim.worker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-index result collected by the worker pool.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResult(
        @JsonProperty("index") int index,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("failure") FailureKind failure,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("runtimeMs") Long runtimeMs) {

    public static JobResult completed(int index, long runtimeMs) {
        return new JobResult(index, JobStatus.COMPLETED, null, null, runtimeMs);
    }

    public static JobResult failed(int index, FailureKind failure, String errorMessage, long runtimeMs) {
        return new JobResult(index, JobStatus.FAILED, failure, errorMessage, runtimeMs);
    }

    public static JobResult skipped(int index) {
        return new JobResult(index, JobStatus.SKIPPED, null, null, null);
    }
}
