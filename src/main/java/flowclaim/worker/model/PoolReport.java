package flowclaim.worker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Summary of one WorkerPool run: what this worker completed, failed and
 * skipped, ordered by job index.
 */
public record PoolReport(
        @JsonProperty("claimant") String claimant,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("skipped") int skipped,
        @JsonProperty("jobs") List<JobResult> jobs) {

    public static PoolReport of(String claimant, Instant startedAt, Instant finishedAt, List<JobResult> results) {
        List<JobResult> sorted = results.stream()
                .sorted(Comparator.comparingInt(JobResult::index))
                .toList();
        return new PoolReport(
                claimant,
                startedAt,
                finishedAt,
                count(sorted, JobStatus.COMPLETED),
                count(sorted, JobStatus.FAILED),
                count(sorted, JobStatus.SKIPPED),
                sorted);
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    public List<JobResult> failures() {
        return jobs.stream().filter(j -> j.status() == JobStatus.FAILED).toList();
    }

    private static int count(List<JobResult> results, JobStatus status) {
        return (int) results.stream().filter(r -> r.status() == status).count();
    }
}
