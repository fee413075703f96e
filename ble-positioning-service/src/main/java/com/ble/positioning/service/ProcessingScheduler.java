package com.ble.positioning.service;

import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.metrics.PositioningMetrics;
import com.ble.positioning.repository.SignalStore;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrating loop of the pipeline: {@code STOPPED → RUNNING → STOPPED}, no pause.
 *
 * <p><strong>Each tick:</strong></p>
 * <ol>
 *   <li>Takes a {@link SignalStore} cut; signals appended later wait for the next tick</li>
 *   <li>Collects the beacons that received signals since the previous tick's cut, plus any
 *       skipped last time because they were busy</li>
 *   <li>Submits one evaluation per beacon to a bounded worker pool and waits for all of them;
 *       ticks never overlap</li>
 * </ol>
 * An exception in one beacon's evaluation is logged, counted and isolated; the other beacons of
 * the tick are unaffected.
 *
 * <p><strong>Stopping</strong> is immediate: the tick stops submitting, beacons not yet started
 * are dropped and evaluations already running get the configured grace period before the
 * workers are interrupted. A beacon's smoothed state is replaced atomically at the end of its
 * evaluation, so an interrupted evaluation leaves the previous state intact.</p>
 */
@Slf4j
@Service
public class ProcessingScheduler {

    public enum State {
        STOPPED,
        RUNNING
    }

    private final SignalStore signalStore;
    private final BeaconProcessingService processingService;
    private final PositioningMetrics metrics;
    private final Clock clock;
    private final Duration tickPeriod;
    private final int workerCount;
    private final Duration shutdownGrace;
    private final boolean autoStart;

    private final AtomicLong tickCounter = new AtomicLong();
    private final Set<String> carryOver = new TreeSet<>();
    private volatile State state = State.STOPPED;
    private volatile TickStatistics lastTick;
    private volatile Instant startedAt;
    private ScheduledExecutorService ticker;
    private ExecutorService workers;
    private long lastCut;

    @Autowired
    public ProcessingScheduler(SignalStore signalStore, BeaconProcessingService processingService,
            PositioningMetrics metrics, Clock clock, PositioningProperties properties) {
        this(signalStore, processingService, metrics, clock,
                Duration.ofSeconds(properties.getProcessing().getTickPeriodSeconds()),
                properties.getProcessing().getWorkers(),
                Duration.ofSeconds(properties.getProcessing().getShutdownGraceSeconds()),
                properties.getProcessing().isAutoStart());
    }

    public ProcessingScheduler(SignalStore signalStore, BeaconProcessingService processingService,
            PositioningMetrics metrics, Clock clock, Duration tickPeriod, int workerCount,
            Duration shutdownGrace, boolean autoStart) {
        if (signalStore == null || processingService == null || metrics == null || clock == null) {
            throw new IllegalArgumentException("Scheduler dependencies cannot be null");
        }
        if (tickPeriod.isZero() || tickPeriod.isNegative()) {
            throw new IllegalArgumentException("Tick period must be positive");
        }
        this.signalStore = signalStore;
        this.processingService = processingService;
        this.metrics = metrics;
        this.clock = clock;
        this.tickPeriod = tickPeriod;
        this.workerCount = Math.max(1, workerCount);
        this.shutdownGrace = shutdownGrace;
        this.autoStart = autoStart;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (autoStart) {
            start();
        } else {
            log.info("Processing scheduler auto-start disabled, waiting for an explicit start");
        }
    }

    /**
     * Starts ticking. The first tick runs one period from now.
     *
     * @return false if the scheduler was already running
     */
    public synchronized boolean start() {
        if (state == State.RUNNING) {
            return false;
        }
        workers = new ThreadPoolExecutor(workerCount, workerCount, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new CustomizableThreadFactory("positioning-worker-"));
        ScheduledThreadPoolExecutor scheduled =
                new ScheduledThreadPoolExecutor(1, new CustomizableThreadFactory("positioning-tick-"));
        scheduled.setRemoveOnCancelPolicy(true);
        ticker = scheduled;
        state = State.RUNNING;
        startedAt = clock.instant();
        long periodMillis = tickPeriod.toMillis();
        ticker.scheduleAtFixedRate(this::scheduledTick, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Processing scheduler started - tick period: {} ms, workers: {}", periodMillis, workerCount);
        return true;
    }

    /**
     * Stops ticking. Returns once running evaluations have finished or the grace period expired.
     *
     * @return false if the scheduler was not running
     */
    @PreDestroy
    public synchronized boolean stop() {
        if (state == State.STOPPED) {
            return false;
        }
        state = State.STOPPED;
        log.info("Stopping processing scheduler, grace period {} ms", shutdownGrace.toMillis());

        ticker.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Beacon evaluations still running after {} ms, interrupting", shutdownGrace.toMillis());
                workers.shutdownNow();
                if (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
                    log.error("Beacon evaluations did not terminate after interruption");
                }
            }
            ticker.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            log.warn("Interrupted while stopping, forcing immediate termination");
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Processing scheduler stopped after {} tick(s)", tickCounter.get());
        return true;
    }

    public State getState() {
        return state;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    /** Statistics of the last completed tick, null before the first one. */
    public TickStatistics getLastTick() {
        return lastTick;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Duration getTickPeriod() {
        return tickPeriod;
    }

    private void scheduledTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // A throwing periodic task would be cancelled by the executor.
            log.error("Processing tick failed", e);
        }
    }

    /**
     * Runs one tick on the calling thread. Does nothing unless the scheduler is running.
     *
     * @return the tick's statistics, or null if the scheduler is stopped or the tick was interrupted
     */
    TickStatistics tick() {
        if (state != State.RUNNING) {
            return null;
        }
        long startNanos = System.nanoTime();
        Instant now = clock.instant();
        long cut = signalStore.snapshot();

        Set<String> beacons;
        synchronized (carryOver) {
            beacons = new TreeSet<>(signalStore.beaconsWithSignalsBetween(lastCut, cut));
            beacons.addAll(carryOver);
            carryOver.clear();
            lastCut = cut;
        }

        Map<String, Future<BeaconOutcome>> submitted = new LinkedHashMap<>();
        Map<BeaconOutcome, Integer> outcomes = new EnumMap<>(BeaconOutcome.class);
        for (String beaconId : beacons) {
            if (state != State.RUNNING) {
                outcomes.merge(BeaconOutcome.DROPPED, 1, Integer::sum);
                continue;
            }
            try {
                submitted.put(beaconId, workers.submit(() -> evaluate(beaconId, now, cut)));
            } catch (RejectedExecutionException e) {
                outcomes.merge(BeaconOutcome.DROPPED, 1, Integer::sum);
            }
        }

        for (Map.Entry<String, Future<BeaconOutcome>> entry : submitted.entrySet()) {
            BeaconOutcome outcome;
            try {
                outcome = entry.getValue().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Tick {} interrupted while waiting for evaluations", tickCounter.get() + 1);
                return null;
            } catch (ExecutionException e) {
                metrics.recordBeaconFailure();
                log.error("Evaluation of beacon {} failed", entry.getKey(), e.getCause());
                outcome = BeaconOutcome.FAILED;
            } catch (CancellationException e) {
                outcome = BeaconOutcome.DROPPED;
            }
            if (outcome == BeaconOutcome.BUSY) {
                synchronized (carryOver) {
                    carryOver.add(entry.getKey());
                }
            }
            outcomes.merge(outcome, 1, Integer::sum);
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        TickStatistics statistics = new TickStatistics(tickCounter.incrementAndGet(), now, cut, outcomes, duration);
        lastTick = statistics;
        metrics.recordTick(duration);
        if (statistics.beaconCount() > 0) {
            log.debug("Tick {} evaluated {} beacon(s) in {} ms: {}", statistics.tickNumber(),
                    statistics.beaconCount(), duration.toMillis(), outcomes);
        }
        return statistics;
    }

    private BeaconOutcome evaluate(String beaconId, Instant now, long cut) {
        if (state != State.RUNNING) {
            return BeaconOutcome.DROPPED;
        }
        long startNanos = System.nanoTime();
        try {
            BeaconOutcome outcome = processingService.process(beaconId, now, cut);
            metrics.recordBeaconEvaluated(Duration.ofNanos(System.nanoTime() - startNanos));
            return outcome;
        } catch (RuntimeException e) {
            metrics.recordBeaconFailure();
            log.error("Failed to evaluate beacon {} at {}", beaconId, now, e);
            return BeaconOutcome.FAILED;
        }
    }
}
