package flowclaim;

import flowclaim.worker.claim.ClaimException;
import flowclaim.worker.config.Dependencies;
import flowclaim.worker.config.IniLoader;
import flowclaim.worker.config.WorkerConfig;
import flowclaim.worker.model.PoolReport;
import flowclaim.worker.scheduler.FrameScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 * flowclaim [--config worker.ini] [--test] [--fast] &lt;remote&gt;
 * </pre>
 *
 * {@code remote} is the shared directory holding the .ppm frames; .flo and
 * .pgm files are written next to them. Start one process per machine.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_JOBS_FAILED = 1;
    static final int EXIT_FATAL = 2;

    private App() {
    }

    public static void main(String[] args) {
        int code;
        try {
            WorkerConfig config = parseArgs(args);
            code = run(Dependencies.create(config));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("usage: flowclaim [--config worker.ini] [--test] [--fast] <remote>");
            code = EXIT_FATAL;
        } catch (IOException | ClaimException e) {
            log.error("Worker aborted", e);
            code = EXIT_FATAL;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Worker interrupted");
            code = EXIT_FATAL;
        }
        System.exit(code);
    }

    static WorkerConfig parseArgs(String[] args) throws IOException {
        WorkerConfig config = WorkerConfig.fromEnv();
        String remote = null;
        boolean test = false;
        boolean fast = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--test" -> test = true;
                case "--fast" -> fast = true;
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config needs a file");
                    }
                    IniLoader.load(new File(args[++i]), config);
                }
                default -> {
                    if (args[i].startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                    remote = args[i];
                }
            }
        }

        if (remote != null) {
            config.withSharedDir(Path.of(remote));
        }
        // flags only switch on, so they never undo the config file
        if (test) {
            config.withTestMode(true);
        }
        if (fast) {
            config.withFast(true);
        }
        return config;
    }

    /**
     * Claim and process every frame pair in the shared directory.
     *
     * @return process exit code
     */
    static int run(Dependencies deps) throws IOException, InterruptedException {
        WorkerConfig config = deps.config();

        List<Path> frames = deps.frameScanner().scan();
        if (config.testMode()) {
            frames = FrameScanner.limit(frames, config.testFrameCount());
        }

        // frames are 1-indexed, job i is (frame i, frame i+1)
        PoolReport report = deps.workerPool().run(1, FrameScanner.jobCount(frames));

        if (config.reportEnabled()) {
            try {
                deps.reportWriter().write(report);
            } catch (IOException e) {
                log.warn("Could not write run report: {}", e.getMessage());
            }
        }

        for (var failure : report.failures()) {
            log.warn("Job {} failed: {}", failure.index(), failure.errorMessage());
        }
        return report.hasFailures() ? EXIT_JOBS_FAILED : EXIT_OK;
    }
}
