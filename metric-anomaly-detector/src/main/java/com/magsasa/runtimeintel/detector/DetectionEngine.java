package com.magsasa.runtimeintel.detector;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.magsasa.runtimeintel.datamodel.AnomalyEvent;
import com.magsasa.runtimeintel.datamodel.MetricSample;
import com.magsasa.runtimeintel.detector.evaluator.AbstractSeriesDetector;
import com.magsasa.runtimeintel.detector.evaluator.DetectorFactory;
import com.magsasa.runtimeintel.detector.evaluator.DetectorSpec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every configured detector over incoming samples. Series are partitioned over a fixed set
 * of single threaded workers by series identity, so the state of a series is only ever touched
 * by its owning worker and samples of one series are evaluated in arrival order.
 */
public class DetectionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(DetectionEngine.class);
  private static final String SAMPLES_COUNTER = "runtime.intelligence.detector.samples";
  private static final String ANOMALIES_COUNTER = "runtime.intelligence.detector.anomalies";
  private static final String SINK_ERROR_COUNTER = "runtime.intelligence.detector.sink.error";

  private final List<Worker> workers;
  private final DetectorFactory detectorFactory;
  private final Consumer<AnomalyEvent> sink;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final ConcurrentMap<String, Counter> anomalyCounters = new ConcurrentHashMap<>();
  private final Counter sampleCounter;
  private final Counter sinkErrorCounter;

  public DetectionEngine(
      int workerCount,
      List<DetectorSpec> specs,
      Consumer<AnomalyEvent> sink,
      Clock clock,
      MeterRegistry meterRegistry) {
    Preconditions.checkArgument(workerCount > 0, "at least one detection worker is required");
    this.detectorFactory = new DetectorFactory(clock);
    this.sink = sink;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.sampleCounter = meterRegistry.counter(SAMPLES_COUNTER);
    this.sinkErrorCounter = meterRegistry.counter(SINK_ERROR_COUNTER);
    List<Worker> created = new ArrayList<>(workerCount);
    for (int i = 0; i < workerCount; i++) {
      created.add(new Worker(i, specs));
    }
    this.workers = List.copyOf(created);
    LOGGER.info("Started detection with {} workers and {} detectors", workerCount, specs.size());
  }

  /** Hands the sample to the worker owning its series. Returns false once stopped. */
  public boolean submit(MetricSample sample) {
    if (!accepting.get()) {
      return false;
    }
    Worker worker = workers.get(sample.getSeriesKey().shard(workers.size()));
    try {
      worker.executor.execute(() -> worker.evaluate(sample));
      sampleCounter.increment();
      return true;
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Detection is stopping, rejected sample for {}", sample.getMetricId());
      return false;
    }
  }

  /**
   * Replaces the detector set. Detectors whose spec is unchanged keep their series state, new or
   * changed specs start cold. Applied inside each worker, between two samples.
   */
  public CompletableFuture<Void> reload(List<DetectorSpec> specs) {
    List<DetectorSpec> snapshot = List.copyOf(specs);
    return CompletableFuture.allOf(
        workers.stream()
            .map(
                worker ->
                    CompletableFuture.runAsync(() -> worker.reconcile(snapshot), worker.executor))
            .toArray(CompletableFuture[]::new));
  }

  /** Evicts series without samples for {@code idleTtl}. Completes with the evicted count. */
  public CompletableFuture<Integer> evictIdleSeries(Duration idleTtl) {
    List<CompletableFuture<Integer>> perWorker = new ArrayList<>();
    for (Worker worker : workers) {
      perWorker.add(
          CompletableFuture.supplyAsync(() -> worker.evictIdle(idleTtl), worker.executor));
    }
    return CompletableFuture.allOf(perWorker.toArray(new CompletableFuture[0]))
        .thenApply(v -> perWorker.stream().mapToInt(CompletableFuture::join).sum());
  }

  /** Samples evaluated per detector name, summed over workers. */
  public Map<String, Long> getSampleCounts() {
    Map<String, Long> counts = new LinkedHashMap<>();
    for (Worker worker : workers) {
      for (AbstractSeriesDetector<?> detector : worker.detectors) {
        counts.merge(detector.getSpec().getName(), detector.getSampleCount(), Long::sum);
      }
    }
    return counts;
  }

  public long getOutOfOrderCount() {
    return workers.stream()
        .flatMap(worker -> worker.detectors.stream())
        .mapToLong(AbstractSeriesDetector::getOutOfOrderCount)
        .sum();
  }

  public long getActiveSeriesCount() {
    return workers.stream()
        .flatMap(worker -> worker.detectors.stream())
        .mapToLong(AbstractSeriesDetector::getSeriesCount)
        .sum();
  }

  public boolean isAccepting() {
    return accepting.get();
  }

  /** Stops accepting samples and waits for queued evaluations to finish. */
  public boolean shutdown(Duration timeout) throws InterruptedException {
    accepting.set(false);
    workers.forEach(worker -> worker.executor.shutdown());
    long deadline = System.nanoTime() + timeout.toNanos();
    boolean drained = true;
    for (Worker worker : workers) {
      long remaining = Math.max(0, deadline - System.nanoTime());
      drained &= worker.executor.awaitTermination(remaining, TimeUnit.NANOSECONDS);
    }
    if (!drained) {
      LOGGER.warn("Detection workers did not drain within {}", timeout);
    }
    return drained;
  }

  @VisibleForTesting
  int getWorkerCount() {
    return workers.size();
  }

  private class Worker {
    private final ExecutorService executor;
    // replaced wholesale by the worker thread, read by stats callers
    private volatile List<AbstractSeriesDetector<?>> detectors;

    Worker(int index, List<DetectorSpec> specs) {
      this.executor =
          Executors.newSingleThreadExecutor(
              new ThreadFactoryBuilder().setNameFormat("detection-worker-" + index).build());
      List<AbstractSeriesDetector<?>> initial = new ArrayList<>();
      for (DetectorSpec spec : specs) {
        initial.add(detectorFactory.create(spec));
      }
      this.detectors = List.copyOf(initial);
    }

    void evaluate(MetricSample sample) {
      for (AbstractSeriesDetector<?> detector : detectors) {
        if (!detector.accepts(sample.getMetricId())) {
          continue;
        }
        Optional<AnomalyEvent> event = detector.evaluate(sample);
        if (event.isPresent()) {
          anomalyCounters
              .computeIfAbsent(
                  detector.getSpec().getName(),
                  name -> meterRegistry.counter(ANOMALIES_COUNTER, "detector", name))
              .increment();
          publish(event.get());
        }
      }
    }

    private void publish(AnomalyEvent event) {
      try {
        sink.accept(event);
      } catch (RuntimeException e) {
        sinkErrorCounter.increment();
        LOGGER.error(
            "Failed to hand over anomaly {} of {}", event.getEventId(), event.getMetricId(), e);
      }
    }

    void reconcile(List<DetectorSpec> specs) {
      Map<String, AbstractSeriesDetector<?>> current = new LinkedHashMap<>();
      for (AbstractSeriesDetector<?> detector : detectors) {
        current.put(detector.getSpec().getName(), detector);
      }
      List<AbstractSeriesDetector<?>> next = new ArrayList<>();
      for (DetectorSpec spec : specs) {
        AbstractSeriesDetector<?> existing = current.get(spec.getName());
        next.add(
            existing != null && existing.getSpec().equals(spec)
                ? existing
                : detectorFactory.create(spec));
      }
      detectors = List.copyOf(next);
    }

    int evictIdle(Duration idleTtl) {
      int evicted = 0;
      for (AbstractSeriesDetector<?> detector : detectors) {
        evicted += detector.evictIdle(clock.instant(), idleTtl);
      }
      return evicted;
    }
  }
}
