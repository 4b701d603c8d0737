package flowclaim.worker.scheduler;

import flowclaim.worker.backend.BackendExecutionException;
import flowclaim.worker.claim.ClaimException;
import flowclaim.worker.claim.JobClaimer;
import flowclaim.worker.model.ClaimedJob;
import flowclaim.worker.model.FailureKind;
import flowclaim.worker.model.JobResult;
import flowclaim.worker.model.PoolReport;
import flowclaim.worker.pipeline.FlowPipeline;
import flowclaim.worker.pipeline.MissingFrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Claims job indices in increasing order and runs up to {@code maxJobs}
 * pipelines at once.
 *
 * The calling thread is the only one that claims. It takes a slot before
 * each claim attempt, so it blocks while the pool is full; a lost claim gives
 * the slot straight back and moves on to the next index without waiting.
 * A failed job is recorded and does not stop the loop. A {@link ClaimException}
 * does: running jobs are drained and the exception is rethrown.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobClaimer claimer;
    private final FlowPipeline pipeline;
    private final int maxJobs;

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peakActive = new AtomicInteger();

    public WorkerPool(JobClaimer claimer, FlowPipeline pipeline, int maxJobs) {
        if (maxJobs < 1) {
            throw new IllegalArgumentException("maxJobs must be >= 1, got " + maxJobs);
        }
        this.claimer = claimer;
        this.pipeline = pipeline;
        this.maxJobs = maxJobs;
    }

    /**
     * Process job indices {@code [start, start + count)}.
     *
     * @return outcome of every index this worker looked at
     */
    public PoolReport run(int start, int count) throws InterruptedException {
        log.info("Starting optical flow calculations: jobs {}..{}, up to {} at once",
                start, start + count - 1, maxJobs);

        Instant startedAt = Instant.now();
        Semaphore slots = new Semaphore(maxJobs);
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(maxJobs,
                r -> new Thread(r, "flow-job-" + threadCounter.incrementAndGet()));

        List<JobResult> results = new ArrayList<>();
        List<Future<JobResult>> running = new ArrayList<>();

        try {
            for (int index = start; index < start + count; index++) {
                slots.acquire();

                Optional<ClaimedJob> claimed;
                try {
                    claimed = claimer.claim(index);
                } catch (RuntimeException e) {
                    slots.release();
                    throw e;
                }

                if (claimed.isEmpty()) {
                    slots.release();
                    results.add(JobResult.skipped(index));
                    continue;
                }

                ClaimedJob job = claimed.get();
                running.add(executor.submit(() -> execute(job, slots)));
            }
        } finally {
            log.info("Wrapping up {} optical flow jobs...", running.size());
            executor.shutdown();
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Still waiting on {} active optical flow jobs", active.get());
            }
        }

        for (Future<JobResult> future : running) {
            results.add(resultOf(future));
        }

        PoolReport report = PoolReport.of(claimer.claimant(), startedAt, Instant.now(), results);
        log.info("...optical flow calculations are finished: {} completed, {} failed, {} skipped",
                report.completed(), report.failed(), report.skipped());
        return report;
    }

    public int maxJobs() {
        return maxJobs;
    }

    /** Pipelines running right now. */
    public int activeCount() {
        return active.get();
    }

    /** Highest number of pipelines that ran at the same time. */
    public int peakActiveCount() {
        return peakActive.get();
    }

    private JobResult execute(ClaimedJob job, Semaphore slots) {
        int now = active.incrementAndGet();
        peakActive.accumulateAndGet(now, Math::max);
        long startMs = System.currentTimeMillis();

        try {
            pipeline.run(job);
            long elapsed = System.currentTimeMillis() - startMs;
            log.info("Job {} completed in {}ms", job.index(), elapsed);
            return JobResult.completed(job.index(), elapsed);
        } catch (MissingFrameException e) {
            return failed(job, FailureKind.MISSING_FRAME, e, startMs);
        } catch (BackendExecutionException e) {
            return failed(job, FailureKind.BACKEND_EXECUTION, e, startMs);
        } catch (IOException e) {
            return failed(job, FailureKind.CODEC_IO, e, startMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(job, FailureKind.UNEXPECTED, e, startMs);
        } catch (RuntimeException e) {
            return failed(job, FailureKind.UNEXPECTED, e, startMs);
        } finally {
            active.decrementAndGet();
            slots.release();
        }
    }

    private static JobResult failed(ClaimedJob job, FailureKind kind, Exception e, long startMs) {
        long elapsed = System.currentTimeMillis() - startMs;
        if (kind == FailureKind.UNEXPECTED) {
            log.error("Job {} failed unexpectedly after {}ms", job.index(), elapsed, e);
        } else {
            log.error("Job {} failed ({}) after {}ms: {}", job.index(), kind, elapsed, e.getMessage());
        }
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return JobResult.failed(job.index(), kind, message, elapsed);
    }

    // execute() never throws, so get() only fails if the executor itself broke
    private static JobResult resultOf(Future<JobResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Job task failed outside the pipeline", e.getCause());
        }
    }
}
