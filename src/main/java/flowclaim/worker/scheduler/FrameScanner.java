package flowclaim.worker.scheduler;

import flowclaim.worker.model.FrameLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists the frames available in the shared directory.
 */
public class FrameScanner {

    private static final Logger log = LoggerFactory.getLogger(FrameScanner.class);

    private final FrameLayout layout;

    public FrameScanner(FrameLayout layout) {
        this.layout = layout;
    }

    /**
     * Frames whose extension matches the frame pattern, sorted by file name.
     */
    public List<Path> scan() throws IOException {
        List<Path> frames = new ArrayList<>();
        String glob = "*" + layout.frameExtension();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(layout.directory(), glob)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    frames.add(p);
                }
            }
        }
        frames.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        log.info("Found {} frames in {}", frames.size(), layout.directory());
        return frames;
    }

    /** First {@code cap} frames, used by test runs. */
    public static List<Path> limit(List<Path> frames, int cap) {
        return frames.size() <= cap ? frames : List.copyOf(frames.subList(0, cap));
    }

    /** Number of adjacent frame pairs. */
    public static int jobCount(List<Path> frames) {
        return Math.max(0, frames.size() - 1);
    }
}
