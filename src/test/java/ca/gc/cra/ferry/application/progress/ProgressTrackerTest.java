package ca.gc.cra.ferry.application.progress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class ProgressTrackerTest {
  private static final List<String> STEPS = List.of("DOWNLOAD", "CONVERT", "UPLOAD");

  @Test
  void unseenItemsReadAsPending() {
    ProgressTracker<String> tracker = new ProgressTracker<>(STEPS);

    Map<String, StepStatus> progress = tracker.getProgress("asset-1");

    assertEquals(List.of("DOWNLOAD", "CONVERT", "UPLOAD"), new ArrayList<>(progress.keySet()));
    progress.values().forEach(status -> assertEquals(StepStatus.PENDING, status));
  }

  @Test
  void failedStepAbortsEveryLaterStep() {
    ProgressTracker<String> tracker = new ProgressTracker<>(STEPS);
    tracker.setProgress("asset-1", "DOWNLOAD", StepStatus.SUCCESS);

    tracker.setProgress("asset-1", "CONVERT", "failed");

    assertEquals(StepStatus.SUCCESS, tracker.getProgress("asset-1", "DOWNLOAD"));
    assertEquals(StepStatus.FAILED, tracker.getProgress("asset-1", "CONVERT"));
    assertEquals(StepStatus.ABORTED, tracker.getProgress("asset-1", "UPLOAD"));
  }

  @Test
  void poisonedStepsCannotRevert() {
    ProgressTracker<String> tracker = new ProgressTracker<>(STEPS);
    tracker.setProgress("asset-1", "DOWNLOAD", StepStatus.FAILED);

    tracker.setProgress("asset-1", "UPLOAD", StepStatus.ABORTED);
    tracker.setProgress("asset-1", "DOWNLOAD", StepStatus.FAILED);

    assertThrows(IllegalStateException.class,
        () -> tracker.setProgress("asset-1", "UPLOAD", StepStatus.SUCCESS));
    assertThrows(IllegalStateException.class,
        () -> tracker.setProgress("asset-1", "DOWNLOAD", StepStatus.PENDING));
    assertEquals(StepStatus.ABORTED, tracker.getProgress("asset-1", "UPLOAD"));
  }

  @Test
  void trySetProgressLeavesPoisonedStepsAlone() {
    ProgressTracker<String> tracker = new ProgressTracker<>(STEPS);
    tracker.setProgress("asset-1", "CONVERT", StepStatus.FAILED);

    assertFalse(tracker.trySetProgress("asset-1", "UPLOAD", StepStatus.SUCCESS));
    assertTrue(tracker.trySetProgress("asset-1", "UPLOAD", StepStatus.ABORTED));
    assertTrue(tracker.trySetProgress("asset-2", "UPLOAD", StepStatus.SUCCESS));

    assertEquals(StepStatus.ABORTED, tracker.getProgress("asset-1", "UPLOAD"));
    assertEquals(StepStatus.SUCCESS, tracker.getProgress("asset-2", "UPLOAD"));
  }

  @Test
  void unknownStepOrStatusIsRejected() {
    ProgressTracker<String> tracker = new ProgressTracker<>(STEPS);

    assertThrows(IllegalArgumentException.class, () -> tracker.setProgress("a", "PUBLISH", StepStatus.SUCCESS));
    assertThrows(IllegalArgumentException.class, () -> tracker.setProgress("a", "UPLOAD", "done"));
    assertThrows(IllegalArgumentException.class, () -> tracker.getProgress("a", "upload"));
  }

  @Test
  void constructorRejectsEmptyAndDuplicateSteps() {
    assertThrows(IllegalArgumentException.class, () -> new ProgressTracker<String>(List.of()));
    assertThrows(IllegalArgumentException.class, () -> new ProgressTracker<String>(List.of("A", "A")));
  }

  @Test
  void aggregateCountsStatusesPerStep() {
    ProgressTracker<Integer> tracker = new ProgressTracker<>(STEPS);
    tracker.setProgress(1, "DOWNLOAD", StepStatus.SUCCESS);
    tracker.setProgress(2, "DOWNLOAD", StepStatus.SUCCESS);
    tracker.setProgress(2, "CONVERT", StepStatus.FAILED);

    Map<String, Map<StepStatus, Long>> aggregate = tracker.aggregate();

    assertEquals(2L, aggregate.get("DOWNLOAD").get(StepStatus.SUCCESS));
    assertEquals(1L, aggregate.get("CONVERT").get(StepStatus.FAILED));
    assertEquals(1L, aggregate.get("CONVERT").get(StepStatus.PENDING));
    assertEquals(1L, aggregate.get("UPLOAD").get(StepStatus.ABORTED));
    assertEquals(List.of(2), tracker.failedItems());
    assertEquals(2, tracker.result().size());
  }

  @Test
  void concurrentUpdatesAreNotLost() throws Exception {
    ProgressTracker<Integer> tracker = new ProgressTracker<>(STEPS);
    int threads = 8;
    int perThread = 500;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      int offset = t * perThread;
      futures.add(pool.submit(() -> {
        start.await();
        for (int i = 0; i < perThread; i++) {
          tracker.setProgress(offset + i, "DOWNLOAD", StepStatus.SUCCESS);
          tracker.setProgress(offset + i, "CONVERT", StepStatus.SUCCESS);
        }
        return null;
      }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get();
    }
    pool.shutdown();

    assertEquals((long) threads * perThread, tracker.aggregate().get("CONVERT").get(StepStatus.SUCCESS));
  }
}
