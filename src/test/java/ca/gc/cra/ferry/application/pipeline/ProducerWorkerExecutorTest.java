package ca.gc.cra.ferry.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ferry.application.port.MetricsPort;
import ca.gc.cra.ferry.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class ProducerWorkerExecutorTest {
  private static final long POLL_MILLIS = 20L;

  @Test
  void runsEveryChunkThroughAllStagesInOrder() {
    List<List<Integer>> chunks = List.of(range(0, 5), range(5, 10), range(10, 15));
    List<String> written = Collections.synchronizedList(new ArrayList<>());
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    ProducerWorkerExecutor<List<Integer>, String> executor = new ProducerWorkerExecutor<>(
        chunks,
        chunk -> chunk.stream().map(String::valueOf).collect(Collectors.joining(",")),
        written::add,
        PipelineSettings.of(2).withIterationCount(3),
        metrics,
        POLL_MILLIS);

    executor.run();

    assertFalse(executor.errorOccurred());
    assertNull(executor.errorMessage());
    assertEquals(15, executor.totalItems());
    assertEquals(List.of("0,1,2,3,4", "5,6,7,8,9", "10,11,12,13,14"), written);
    assertEquals(3, metrics.count("pipeline.chunks.written"));
    executor.raiseOnError();
  }

  @Test
  void processFailureIsRecordedWithStageDescription() {
    ProducerWorkerExecutor<List<Integer>, Integer> executor = new ProducerWorkerExecutor<>(
        List.of(range(0, 3), range(3, 6)),
        chunk -> {
          if (chunk.contains(4)) {
            throw new IllegalArgumentException("bad row 4");
          }
          return chunk.size();
        },
        size -> { },
        PipelineSettings.of(4).withDescriptions("downloading rows", "converting rows", "uploading rows"),
        MetricsPort.NO_OP,
        POLL_MILLIS);

    executor.run();

    assertTrue(executor.errorOccurred());
    assertEquals("Error occurred while converting rows: bad row 4", executor.errorMessage());
    PipelineExecutionException ex = assertThrows(PipelineExecutionException.class, executor::raiseOnError);
    assertEquals("An error occurred during execution: Error occurred while converting rows: bad row 4",
        ex.getMessage());
    assertTrue(ex.getCause() instanceof IllegalArgumentException);
  }

  @Test
  void downloadFailureStopsPipeline() {
    Iterable<List<Integer>> download = () -> new Iterator<>() {
      private int served;

      @Override
      public boolean hasNext() {
        return true;
      }

      @Override
      public List<Integer> next() {
        if (served++ == 2) {
          throw new IllegalStateException("cursor expired");
        }
        return range(0, 2);
      }
    };
    List<Integer> written = Collections.synchronizedList(new ArrayList<>());
    ProducerWorkerExecutor<List<Integer>, Integer> executor = new ProducerWorkerExecutor<>(
        download, List::size, written::add, PipelineSettings.of(2), MetricsPort.NO_OP, POLL_MILLIS);

    executor.run();

    assertTrue(executor.errorOccurred());
    assertEquals("Error occurred while downloading: cursor expired", executor.errorMessage());
    assertEquals(4, executor.totalItems());
    assertTrue(written.size() <= 2);
  }

  @Test
  void failingWriterTerminatesEndlessDownload() {
    Iterable<List<Integer>> endless = () -> new Iterator<>() {
      @Override
      public boolean hasNext() {
        return true;
      }

      @Override
      public List<Integer> next() {
        return range(0, 1);
      }
    };
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    ProducerWorkerExecutor<List<Integer>, List<Integer>> executor = new ProducerWorkerExecutor<>(
        endless,
        chunk -> chunk,
        chunk -> {
          throw new IOException("upload endpoint unavailable");
        },
        PipelineSettings.of(1),
        metrics,
        POLL_MILLIS);

    assertTimeoutPreemptively(Duration.ofSeconds(10), executor::run);

    assertTrue(executor.errorOccurred());
    assertEquals("Error occurred while writing: upload endpoint unavailable", executor.errorMessage());
    assertEquals(1, metrics.count("pipeline.error"));
  }

  @Test
  void boundedQueuesLimitHowFarDownloadRunsAhead() {
    AtomicInteger downloaded = new AtomicInteger();
    AtomicInteger written = new AtomicInteger();
    AtomicInteger maxAhead = new AtomicInteger();
    Iterable<List<Integer>> download = () -> new Iterator<>() {
      private int served;

      @Override
      public boolean hasNext() {
        return served < 30;
      }

      @Override
      public List<Integer> next() {
        served++;
        int ahead = downloaded.incrementAndGet() - written.get();
        maxAhead.accumulateAndGet(ahead, Math::max);
        return range(0, 1);
      }
    };
    ProducerWorkerExecutor<List<Integer>, List<Integer>> executor = new ProducerWorkerExecutor<>(
        download,
        chunk -> chunk,
        chunk -> {
          Thread.sleep(5);
          written.incrementAndGet();
        },
        PipelineSettings.of(1),
        MetricsPort.NO_OP,
        POLL_MILLIS);

    executor.run();

    assertFalse(executor.errorOccurred());
    assertEquals(30, written.get());
    // one chunk held by each stage plus one per queue, plus the chunk being downloaded
    assertTrue(maxAhead.get() <= 6, "download ran " + maxAhead.get() + " chunks ahead");
  }

  @Test
  void emptyDownloadFinishesCleanly() {
    ProducerWorkerExecutor<List<Integer>, Integer> executor = new ProducerWorkerExecutor<>(
        List.of(), List::size, size -> { }, PipelineSettings.of(3), MetricsPort.NO_OP, POLL_MILLIS);

    executor.run();

    assertFalse(executor.errorOccurred());
    assertEquals(0, executor.totalItems());
  }

  @Test
  void canOnlyRunOnce() {
    ProducerWorkerExecutor<List<Integer>, Integer> executor = new ProducerWorkerExecutor<>(
        List.of(range(0, 1)), List::size, size -> { }, PipelineSettings.of(1), MetricsPort.NO_OP, POLL_MILLIS);
    executor.run();

    assertThrows(IllegalStateException.class, executor::run);
  }

  @Test
  void settingsRejectOutOfRangeQueueSize() {
    assertThrows(IllegalArgumentException.class, () -> PipelineSettings.of(0));
    assertThrows(IllegalArgumentException.class, () -> PipelineSettings.of(10_001));
    assertEquals(10_000, PipelineSettings.of(10_000).maxQueueSize());
  }

  private static List<Integer> range(int from, int to) {
    return IntStream.range(from, to).boxed().collect(Collectors.toList());
  }
}
