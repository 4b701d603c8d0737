package flowclaim.worker.config;

import flowclaim.worker.model.FrameLayout;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;

/**
 * Configuration holder for a flow worker.
 * All settings have sensible defaults.
 */
public final class WorkerConfig {

    // Shared directory settings
    private Path sharedDir = Path.of(".");
    private String framePattern = FrameLayout.DEFAULT_FRAME_PATTERN;

    // Scheduling settings
    private int maxJobs = 4;
    private boolean testMode = false;
    private int testFrameCount = 10;

    // Backend settings
    private boolean fast = false;
    private Path toolDir = Path.of(".");
    private String deepMatchingName = "deepmatching";
    private String deepFlowName = "deepflow2";
    private String consistencyCheckerName = "consistencyChecker";

    // Reporting
    private String claimant = localHostName();
    private boolean reportEnabled = true;

    private WorkerConfig() {
    }

    public static WorkerConfig defaults() {
        return new WorkerConfig();
    }

    public static WorkerConfig fromEnv() {
        WorkerConfig config = new WorkerConfig();

        // Override from environment variables
        String sharedDir = System.getenv("FLOWCLAIM_SHARED_DIR");
        if (sharedDir != null && !sharedDir.isBlank()) {
            config.sharedDir = Path.of(sharedDir);
        }

        String maxJobs = System.getenv("FLOWCLAIM_MAX_JOBS");
        if (maxJobs != null && !maxJobs.isBlank()) {
            config.withMaxJobs(Integer.parseInt(maxJobs.trim()));
        }

        String fast = System.getenv("FLOWCLAIM_FAST");
        if (fast != null && !fast.isBlank()) {
            config.fast = Boolean.parseBoolean(fast.trim());
        }

        String toolDir = System.getenv("FLOWCLAIM_TOOL_DIR");
        if (toolDir != null && !toolDir.isBlank()) {
            config.toolDir = Path.of(toolDir);
        }

        String testFrames = System.getenv("FLOWCLAIM_TEST_FRAMES");
        if (testFrames != null && !testFrames.isBlank()) {
            config.withTestFrameCount(Integer.parseInt(testFrames.trim()));
        }

        return config;
    }

    // Getters
    public Path sharedDir() {
        return sharedDir;
    }

    public String framePattern() {
        return framePattern;
    }

    public int maxJobs() {
        return maxJobs;
    }

    public boolean testMode() {
        return testMode;
    }

    public int testFrameCount() {
        return testFrameCount;
    }

    public boolean fast() {
        return fast;
    }

    public Path toolDir() {
        return toolDir;
    }

    public Path deepMatchingExecutable() {
        return toolDir.resolve(deepMatchingName);
    }

    public Path deepFlowExecutable() {
        return toolDir.resolve(deepFlowName);
    }

    public Path consistencyCheckerExecutable() {
        return toolDir.resolve(consistencyCheckerName);
    }

    public String claimant() {
        return claimant;
    }

    public boolean reportEnabled() {
        return reportEnabled;
    }

    public FrameLayout frameLayout() {
        return new FrameLayout(sharedDir, framePattern);
    }

    // Fluent setters for testing/customization
    public WorkerConfig withSharedDir(Path dir) {
        this.sharedDir = dir;
        return this;
    }

    public WorkerConfig withFramePattern(String pattern) {
        this.framePattern = pattern;
        return this;
    }

    public WorkerConfig withMaxJobs(int jobs) {
        if (jobs < 1) {
            throw new IllegalArgumentException("maxJobs must be >= 1, got " + jobs);
        }
        this.maxJobs = jobs;
        return this;
    }

    public WorkerConfig withTestMode(boolean enabled) {
        this.testMode = enabled;
        return this;
    }

    public WorkerConfig withTestFrameCount(int count) {
        if (count < 2) {
            throw new IllegalArgumentException("testFrameCount must be >= 2, got " + count);
        }
        this.testFrameCount = count;
        return this;
    }

    public WorkerConfig withFast(boolean enabled) {
        this.fast = enabled;
        return this;
    }

    public WorkerConfig withToolDir(Path dir) {
        this.toolDir = dir;
        return this;
    }

    public WorkerConfig withDeepMatchingName(String name) {
        this.deepMatchingName = name;
        return this;
    }

    public WorkerConfig withDeepFlowName(String name) {
        this.deepFlowName = name;
        return this;
    }

    public WorkerConfig withConsistencyCheckerName(String name) {
        this.consistencyCheckerName = name;
        return this;
    }

    public WorkerConfig withClaimant(String name) {
        this.claimant = name;
        return this;
    }

    public WorkerConfig withReportEnabled(boolean enabled) {
        this.reportEnabled = enabled;
        return this;
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            return env != null && !env.isBlank() ? env : "unknown-host";
        }
    }

    @Override
    public String toString() {
        return "WorkerConfig{" +
                "sharedDir=" + sharedDir +
                ", framePattern='" + framePattern + '\'' +
                ", maxJobs=" + maxJobs +
                ", fast=" + fast +
                ", testMode=" + testMode +
                ", toolDir=" + toolDir +
                ", claimant='" + claimant + '\'' +
                '}';
    }
}
