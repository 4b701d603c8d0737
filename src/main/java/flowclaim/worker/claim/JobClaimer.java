package flowclaim.worker.claim;

import flowclaim.worker.model.ClaimedJob;
import flowclaim.worker.model.FrameLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Claims jobs by creating a placeholder file in the shared directory.
 *
 * Exclusive creation is atomic on the filesystem, so among any number of
 * threads or hosts racing for the same index exactly one succeeds. Claims are
 * permanent: the placeholder is never removed, even if the job later fails.
 */
public class JobClaimer {

    private static final Logger log = LoggerFactory.getLogger(JobClaimer.class);

    private final FrameLayout layout;
    private final String claimant;

    /**
     * @param layout   naming shared by all cooperating workers
     * @param claimant written into the placeholder for diagnostics only
     */
    public JobClaimer(FrameLayout layout, String claimant) {
        this.layout = Objects.requireNonNull(layout, "layout is required");
        this.claimant = Objects.requireNonNull(claimant, "claimant is required");
    }

    /**
     * Try to claim job {@code index}.
     *
     * @return the frame pair if this caller won the claim, empty if the index
     *         was already claimed
     * @throws ClaimException on any filesystem failure other than "already
     *                        exists"
     */
    public Optional<ClaimedJob> claim(int index) {
        Path placeholder = layout.placeholder(index);

        try (Writer writer = Files.newBufferedWriter(placeholder, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            writer.write("PLACEHOLDER CREATED BY " + claimant);
        } catch (FileAlreadyExistsException e) {
            log.trace("Job {} already claimed", index);
            return Optional.empty();
        } catch (IOException e) {
            throw new ClaimException(index, "Failed to claim job " + index + " at " + placeholder, e);
        }

        log.debug("Job claimed: {}", index);
        return Optional.of(new ClaimedJob(index, layout.frame(index), layout.frame(index + 1)));
    }

    public FrameLayout layout() {
        return layout;
    }

    public String claimant() {
        return claimant;
    }
}
