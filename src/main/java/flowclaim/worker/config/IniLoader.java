package flowclaim.worker.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads worker settings from an INI file on top of an existing config.
 * Supports sections [WORKER] and [TOOLS]; missing sections or keys keep the
 * current value.
 *
 * <pre>
 * [WORKER]
 * shared_dir   = /mnt/frames
 * max_jobs     = 4
 * fast         = false
 * frame_pattern = frame_%05d.ppm
 * test_frames  = 10
 * claimant     = node-a
 * report       = true
 *
 * [TOOLS]
 * dir                 = /opt/flow
 * deepmatching        = deepmatching
 * deepflow            = deepflow2
 * consistency_checker = consistencyChecker
 * </pre>
 */
public final class IniLoader {

    private IniLoader() {
    }

    public static WorkerConfig load(File file, WorkerConfig base) throws IOException {
        Ini ini = new Ini(file);

        Profile.Section worker = ini.get("WORKER");
        Profile.Section tools = ini.get("TOOLS");

        // WORKER
        String sharedDir = opt(worker, "shared_dir");
        if (sharedDir != null) base.withSharedDir(Path.of(sharedDir));

        String maxJobs = opt(worker, "max_jobs");
        if (maxJobs != null) base.withMaxJobs(parseInt(file, "max_jobs", maxJobs));

        String fast = opt(worker, "fast");
        if (fast != null) base.withFast(Boolean.parseBoolean(fast));

        String pattern = opt(worker, "frame_pattern");
        if (pattern != null) base.withFramePattern(pattern);

        String testFrames = opt(worker, "test_frames");
        if (testFrames != null) base.withTestFrameCount(parseInt(file, "test_frames", testFrames));

        String claimant = opt(worker, "claimant");
        if (claimant != null) base.withClaimant(claimant);

        String report = opt(worker, "report");
        if (report != null) base.withReportEnabled(Boolean.parseBoolean(report));

        // TOOLS
        String dir = opt(tools, "dir");
        if (dir != null) base.withToolDir(Path.of(dir));

        String dm = opt(tools, "deepmatching");
        if (dm != null) base.withDeepMatchingName(dm);

        String df = opt(tools, "deepflow");
        if (df != null) base.withDeepFlowName(df);

        String cc = opt(tools, "consistency_checker");
        if (cc != null) base.withConsistencyCheckerName(cc);

        return base;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) return null;
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static int parseInt(File file, String key, String value) throws IOException {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IOException(file + ": " + key + " is not a number: " + value, e);
        }
    }
}
