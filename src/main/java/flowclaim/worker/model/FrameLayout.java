package flowclaim.worker.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Names every file a job touches inside the shared directory.
 *
 * All cooperating workers must derive paths the same way, otherwise two
 * workers could claim the same frame pair under different placeholders.
 */
public final class FrameLayout {

    public static final String DEFAULT_FRAME_PATTERN = "frame_%05d.ppm";
    public static final String PLACEHOLDER_EXTENSION = ".plc";

    private final Path directory;
    private final String framePattern;

    public FrameLayout(Path directory, String framePattern) {
        this.directory = Objects.requireNonNull(directory, "directory is required");
        this.framePattern = Objects.requireNonNull(framePattern, "framePattern is required");
    }

    public Path directory() {
        return directory;
    }

    public String framePattern() {
        return framePattern;
    }

    public Path frame(int index) {
        return directory.resolve(String.format(framePattern, index));
    }

    /** frame_%05d.ppm -> frame_00007.plc */
    public Path placeholder(int index) {
        String name = String.format(framePattern, index);
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return directory.resolve(stem + PLACEHOLDER_EXTENSION);
    }

    public Path forwardFlow(int index) {
        return directory.resolve("forward_" + index + "_" + (index + 1) + ".flo");
    }

    public Path backwardFlow(int index) {
        return directory.resolve("backward_" + (index + 1) + "_" + index + ".flo");
    }

    public Path reliability(int index) {
        return directory.resolve("reliable_" + (index + 1) + "_" + index + ".pgm");
    }

    /** Extension of frame files, e.g. ".ppm"; empty if the pattern has none. */
    public String frameExtension() {
        int dot = framePattern.lastIndexOf('.');
        return dot >= 0 ? framePattern.substring(dot) : "";
    }
}
