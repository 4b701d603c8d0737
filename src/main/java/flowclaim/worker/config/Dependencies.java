package flowclaim.worker.config;

import flowclaim.worker.backend.DeepFlowBackend;
import flowclaim.worker.backend.FarnebackBackend;
import flowclaim.worker.backend.FlowBackend;
import flowclaim.worker.claim.JobClaimer;
import flowclaim.worker.codec.FlowFileCodec;
import flowclaim.worker.model.FrameLayout;
import flowclaim.worker.pipeline.ConsistencyCheck;
import flowclaim.worker.pipeline.ExternalConsistencyCheck;
import flowclaim.worker.pipeline.FlowPipeline;
import flowclaim.worker.report.ReportWriter;
import flowclaim.worker.scheduler.FrameScanner;
import flowclaim.worker.scheduler.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all worker components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(WorkerConfig.fromEnv());
 * List&lt;Path&gt; frames = deps.frameScanner().scan();
 * PoolReport report = deps.workerPool().run(1, FrameScanner.jobCount(frames));
 * </pre>
 */
public final class Dependencies {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final WorkerConfig config;
    private final FlowFileCodec codec;
    private final FrameLayout layout;
    private final JobClaimer claimer;
    private final FlowBackend backend;
    private final ConsistencyCheck consistencyCheck;
    private final FlowPipeline pipeline;
    private final WorkerPool workerPool;
    private final FrameScanner frameScanner;
    private final ReportWriter reportWriter;

    private Dependencies(WorkerConfig config, FlowBackend backend, ConsistencyCheck consistencyCheck) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.codec = new FlowFileCodec();
        this.layout = config.frameLayout();
        this.claimer = new JobClaimer(layout, config.claimant());
        this.backend = backend != null ? backend : defaultBackend(config, codec);
        this.consistencyCheck = consistencyCheck != null
                ? consistencyCheck
                : new ExternalConsistencyCheck(config.consistencyCheckerExecutable());
        this.pipeline = new FlowPipeline(layout, this.backend, this.consistencyCheck);
        this.workerPool = new WorkerPool(claimer, pipeline, config.maxJobs());
        this.frameScanner = new FrameScanner(layout);
        this.reportWriter = new ReportWriter(config.sharedDir());

        log.info("Dependencies initialized with {} backend", this.backend.name());
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(WorkerConfig config) {
        return new Dependencies(config, null, null);
    }

    /**
     * Create dependencies with a custom backend and consistency check.
     */
    public static Dependencies create(WorkerConfig config, FlowBackend backend, ConsistencyCheck consistencyCheck) {
        return new Dependencies(config, backend, consistencyCheck);
    }

    private static FlowBackend defaultBackend(WorkerConfig config, FlowFileCodec codec) {
        if (config.fast()) {
            return new FarnebackBackend(codec);
        }
        return new DeepFlowBackend(config.deepMatchingExecutable(), config.deepFlowExecutable());
    }

    // Getters
    public WorkerConfig config() {
        return config;
    }

    public FlowFileCodec codec() {
        return codec;
    }

    public FrameLayout layout() {
        return layout;
    }

    public JobClaimer claimer() {
        return claimer;
    }

    public FlowBackend backend() {
        return backend;
    }

    public ConsistencyCheck consistencyCheck() {
        return consistencyCheck;
    }

    public FlowPipeline pipeline() {
        return pipeline;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public FrameScanner frameScanner() {
        return frameScanner;
    }

    public ReportWriter reportWriter() {
        return reportWriter;
    }
}
