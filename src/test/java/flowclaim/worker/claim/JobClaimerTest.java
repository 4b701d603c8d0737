package flowclaim.worker.claim;

import flowclaim.worker.model.ClaimedJob;
import flowclaim.worker.model.FrameLayout;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for placeholder-based job claiming.
 */
class JobClaimerTest {

    @TempDir
    Path shared;

    private JobClaimer claimer(String claimant) {
        return new JobClaimer(new FrameLayout(shared, FrameLayout.DEFAULT_FRAME_PATTERN), claimant);
    }

    @Test
    @DisplayName("First claim wins and returns frames idx and idx+1")
    void claim_success() throws Exception {
        Optional<ClaimedJob> job = claimer("node-a").claim(3);

        assertTrue(job.isPresent());
        assertEquals(3, job.get().index());
        assertEquals(shared.resolve("frame_00003.ppm"), job.get().startFrame());
        assertEquals(shared.resolve("frame_00004.ppm"), job.get().endFrame());

        Path placeholder = shared.resolve("frame_00003.plc");
        assertTrue(Files.exists(placeholder));
        assertEquals("PLACEHOLDER CREATED BY node-a",
                Files.readString(placeholder, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Claiming an already claimed index returns empty, repeatedly")
    void claim_alreadyClaimed() {
        assertTrue(claimer("node-a").claim(1).isPresent());

        JobClaimer other = claimer("node-b");
        for (int i = 0; i < 3; i++) {
            assertTrue(other.claim(1).isEmpty());
        }
        assertTrue(claimer("node-a").claim(1).isEmpty());
    }

    @Test
    @DisplayName("A lost claim leaves the winner's placeholder untouched")
    void claim_lostDoesNotOverwrite() throws Exception {
        claimer("node-a").claim(2);
        claimer("node-b").claim(2);

        assertEquals("PLACEHOLDER CREATED BY node-a",
                Files.readString(shared.resolve("frame_00002.plc")));
    }

    @Test
    @DisplayName("Claims are independent per index")
    void claim_differentIndices() {
        JobClaimer c = claimer("node-a");

        assertTrue(c.claim(1).isPresent());
        assertTrue(c.claim(2).isPresent());
        assertTrue(c.claim(1).isEmpty());
    }

    @Test
    @DisplayName("N threads racing on one index: exactly one wins")
    void claim_concurrentRace() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);

        try {
            for (int index = 1; index <= 20; index++) {
                final int idx = index;
                List<Future<Boolean>> results = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    JobClaimer c = claimer("thread-" + t);
                    Callable<Boolean> attempt = () -> {
                        go.await();
                        return c.claim(idx).isPresent();
                    };
                    results.add(pool.submit(attempt));
                }
                if (index == 1) {
                    go.countDown();
                }

                int winners = 0;
                for (Future<Boolean> f : results) {
                    if (f.get(10, TimeUnit.SECONDS)) {
                        winners++;
                    }
                }
                assertEquals(1, winners, "index " + idx);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Unusable shared directory is a ClaimException, not a lost race")
    void claim_ioFailure() {
        JobClaimer broken = new JobClaimer(
                new FrameLayout(shared.resolve("does-not-exist"), FrameLayout.DEFAULT_FRAME_PATTERN), "node-a");

        ClaimException e = assertThrows(ClaimException.class, () -> broken.claim(5));
        assertEquals(5, e.jobIndex());
        assertNotNull(e.getCause());
    }
}
