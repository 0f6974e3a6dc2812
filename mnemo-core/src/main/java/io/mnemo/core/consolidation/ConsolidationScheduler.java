package io.mnemo.core.consolidation;

import io.mnemo.core.session.Session;
import io.mnemo.core.session.SessionCloseListener;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the configured triggers on a single background thread and runs the engine when any
 * of them fires. Session close requests a run.
 */
public final class ConsolidationScheduler implements SessionCloseListener, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ConsolidationScheduler.class);

    private final ConsolidationEngine engine;
    private final List<ConsolidationTrigger> triggers;
    private final Clock clock;
    private final AtomicLong turnsSinceLastRun = new AtomicLong();
    private final AtomicBoolean explicitRequested = new AtomicBoolean();
    private volatile Instant lastRunAt;
    private volatile ConsolidationReport lastReport;
    private volatile ScheduledExecutorService executor;

    public ConsolidationScheduler(ConsolidationEngine engine, List<ConsolidationTrigger> triggers, Clock clock) {
        if (engine == null) {
            throw new IllegalArgumentException("engine must not be null");
        }
        this.engine = engine;
        this.triggers = triggers == null ? List.of(new ExplicitRequestTrigger()) : List.copyOf(triggers);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public synchronized void start(Duration pollInterval) {
        if (executor != null) {
            return;
        }
        long pollMs = Math.max(1000L, pollInterval == null ? 60_000L : pollInterval.toMillis());
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mnemo-consolidation");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::tick, pollMs, pollMs, TimeUnit.MILLISECONDS);
        LOG.info("Consolidation scheduler started (poll every {} ms)", pollMs);
    }

    public void recordTurn() {
        turnsSinceLastRun.incrementAndGet();
    }

    public void requestRun() {
        explicitRequested.set(true);
        ScheduledExecutorService current = executor;
        if (current != null && !current.isShutdown()) {
            current.execute(this::tick);
        }
    }

    @Override
    public void onSessionClosed(Session session) {
        requestRun();
    }

    public ConsolidationState state() {
        return new ConsolidationState(lastRunAt, turnsSinceLastRun.get(), explicitRequested.get());
    }

    public boolean due() {
        ConsolidationState state = state();
        Instant now = clock.instant();
        for (ConsolidationTrigger trigger : triggers) {
            if (trigger.shouldRun(state, now)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Runs the engine if a trigger fires. Never throws, so the scheduled task keeps running.
     */
    public void tick() {
        if (!due()) {
            return;
        }
        try {
            runNow();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Consolidation run failed, retrying on a later tick", e);
        }
    }

    public ConsolidationReport runNow() throws IOException {
        explicitRequested.set(false);
        long turnsAtStart = turnsSinceLastRun.get();
        ConsolidationReport report = engine.run();
        turnsSinceLastRun.addAndGet(-turnsAtStart);
        lastRunAt = clock.instant();
        lastReport = report;
        return report;
    }

    public Optional<ConsolidationReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
    }

    @Override
    public void close() {
        stop();
    }
}
