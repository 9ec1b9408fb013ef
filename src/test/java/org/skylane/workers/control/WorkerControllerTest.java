package org.skylane.workers.control;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class WorkerControllerTest {

    @Test
    void newControllerIsNeitherPausedNorExiting() {
        WorkerController controller = new WorkerController();
        assertFalse(controller.isPaused());
        assertFalse(controller.isExitRequested());
        assertEquals(WorkerController.DEFAULT_POLL_INTERVAL, controller.getPollInterval());
    }

    @Test
    void rejectsNonPositivePollInterval() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerController(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new WorkerController(Duration.ofMillis(-5)));
        assertThrows(NullPointerException.class, () -> new WorkerController(null));
    }

    @Test
    void pauseAndResumeToggleTheFlag() {
        WorkerController controller = new WorkerController();
        controller.pause();
        assertTrue(controller.isPaused());
        controller.pause();
        assertTrue(controller.isPaused());
        controller.resume();
        assertFalse(controller.isPaused());
    }

    @Test
    @Timeout(1)
    void checkPauseReturnsImmediatelyWhenNotPaused() throws InterruptedException {
        WorkerController controller = new WorkerController(Duration.ofSeconds(10));
        controller.checkPause();
    }

    @Test
    @Timeout(5)
    void checkPauseBlocksUntilResumed() throws InterruptedException {
        WorkerController controller = new WorkerController(Duration.ofMillis(20));
        controller.pause();
        AtomicBoolean passed = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);

        Thread worker = new Thread(() -> {
            try {
                controller.checkPause();
                passed.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });
        worker.start();

        Thread.sleep(200);
        assertFalse(passed.get(), "worker must stay suspended while paused");

        controller.resume();
        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertTrue(passed.get());
    }

    @Test
    @Timeout(5)
    void exitRequestReleasesPausedWorker() throws InterruptedException {
        WorkerController controller = new WorkerController(Duration.ofMillis(20));
        controller.pause();
        CountDownLatch done = new CountDownLatch(1);

        Thread worker = new Thread(() -> {
            try {
                controller.checkPause();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });
        worker.start();

        controller.requestExit();
        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertTrue(controller.isPaused(), "exit does not clear the paused flag");
        assertTrue(controller.isExitRequested());
    }

    @Test
    void exitRequestIsStickyUntilReset() {
        WorkerController controller = new WorkerController();
        controller.requestExit();
        controller.requestExit();
        controller.resume();
        assertTrue(controller.isExitRequested());

        controller.pause();
        controller.reset();
        assertFalse(controller.isExitRequested());
        assertFalse(controller.isPaused());
    }

    @Test
    @Timeout(5)
    void pausedWorkerObservesFlagsWithinPollInterval() {
        WorkerController controller = new WorkerController(Duration.ofMillis(50));
        controller.pause();
        AtomicBoolean released = new AtomicBoolean(false);
        Thread worker = new Thread(() -> {
            try {
                controller.checkPause();
                released.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        worker.start();

        controller.resume();
        await().atMost(1, TimeUnit.SECONDS).untilTrue(released);
    }
}
