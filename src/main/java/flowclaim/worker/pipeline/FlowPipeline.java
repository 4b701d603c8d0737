package flowclaim.worker.pipeline;

import flowclaim.worker.backend.BackendExecutionException;
import flowclaim.worker.backend.FlowBackend;
import flowclaim.worker.model.ClaimedJob;
import flowclaim.worker.model.FrameLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Processes one claimed frame pair:
 * 1. forward and backward flow via the backend
 * 2. consistency check on (backward, forward, end frame)
 * 3. delete the forward field
 *
 * Each step needs the previous one; the first failure aborts the job and
 * leaves whatever was written in place.
 */
public class FlowPipeline {

    private static final Logger log = LoggerFactory.getLogger(FlowPipeline.class);

    private final FrameLayout layout;
    private final FlowBackend backend;
    private final ConsistencyCheck consistencyCheck;

    public FlowPipeline(FrameLayout layout, FlowBackend backend, ConsistencyCheck consistencyCheck) {
        this.layout = Objects.requireNonNull(layout, "layout is required");
        this.backend = Objects.requireNonNull(backend, "backend is required");
        this.consistencyCheck = Objects.requireNonNull(consistencyCheck, "consistencyCheck is required");
    }

    public void run(ClaimedJob job) throws IOException, InterruptedException {
        int index = job.index();
        log.info("Computing optical flow for job {} ({})", index, backend.name());

        requireFrame(index, job.startFrame());
        requireFrame(index, job.endFrame());

        Path forward = layout.forwardFlow(index);
        Path backward = layout.backwardFlow(index);
        Path reliable = layout.reliability(index);

        backend.computeFlows(job.startFrame(), job.endFrame(), forward, backward);
        requireOutput(forward);
        requireOutput(backward);

        consistencyCheck.check(backward, forward, reliable, job.endFrame());
        requireOutput(reliable);

        // only the consistency check needs the forward field
        Files.deleteIfExists(forward);
        log.debug("Job {}: removed {}", index, forward.getFileName());
    }

    public FlowBackend backend() {
        return backend;
    }

    private static void requireFrame(int index, Path frame) throws MissingFrameException {
        if (!Files.isRegularFile(frame)) {
            throw new MissingFrameException(index, frame);
        }
    }

    private static void requireOutput(Path artifact) throws BackendExecutionException {
        if (!Files.isRegularFile(artifact)) {
            throw new BackendExecutionException("Expected output was not written: " + artifact);
        }
    }
}
