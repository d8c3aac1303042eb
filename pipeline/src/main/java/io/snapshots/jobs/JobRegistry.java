package io.snapshots.jobs;

import io.snapshots.backfill.BackfillContext;
import io.snapshots.backfill.BackfillWatermarkPolicy;
import io.snapshots.backfill.InMemoryWatermarkStore;
import io.snapshots.backfill.WatermarkStore;
import io.snapshots.core.ErrorKind;
import io.snapshots.core.Stage;
import io.snapshots.core.StageResult;
import io.snapshots.core.TimeWindow;
import io.snapshots.error.ConfigurationException;
import io.snapshots.metrics.Metrics;
import io.snapshots.runtime.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Named jobs with their schedule metadata, last-run state and backfill context. Runs are bounded by the job's
 * timeout; a job that overruns is interrupted, marked {@link JobStatus#TIMED_OUT} and its backfill window released.
 */
public class JobRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);
    private static final long RETRY_DELAY_MILLIS = 1_000;

    private static final class Entry {
        final Stage stage;
        final BackfillContext context;
        final ReentrantLock runLock = new ReentrantLock();
        volatile JobDescriptor descriptor;
        // completes when the last submitted run has really returned, even after it was cancelled
        volatile CompletableFuture<Void> worker = CompletableFuture.completedFuture(null);

        Entry(JobDescriptor descriptor, Stage stage, BackfillContext context) {
            this.descriptor = descriptor;
            this.stage = stage;
            this.context = context;
        }
    }

    private final Map<String, Entry> jobs = new LinkedHashMap<>();
    private final WatermarkStore watermarks;
    private final Duration defaultLookback;
    private final BackfillWatermarkPolicy backfillPolicy;
    private final Clock clock;
    private final Stages stages;
    private final ExecutorService executor;
    private volatile Duration cancelGrace = Duration.ofSeconds(10);

    public JobRegistry(WatermarkStore watermarks, Duration defaultLookback, BackfillWatermarkPolicy backfillPolicy, Clock clock, Metrics metrics) {
        this.watermarks = watermarks;
        this.defaultLookback = defaultLookback;
        this.backfillPolicy = backfillPolicy;
        this.clock = clock;
        this.stages = new Stages(metrics);
        AtomicInteger idx = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "job-runner-" + idx.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** How long a timed-out run may take to stop after being interrupted before the caller gives up waiting. */
    JobRegistry cancelGrace(Duration grace) {
        this.cancelGrace = grace;
        return this;
    }

    public JobRegistry() {
        this(new InMemoryWatermarkStore(), Duration.ofHours(1), BackfillWatermarkPolicy.IGNORE, Clock.systemUTC(), Metrics.noop());
    }

    public void register(String name, Stage stage, String schedule, String description) {
        register(JobDescriptor.of(name, schedule, description), stage);
    }

    public void register(JobDescriptor descriptor, Stage stage) {
        register(descriptor, stage, null);
    }

    /** Registers a job with its own backfill context; a null context gets one backed by the registry's watermark store. */
    public synchronized void register(JobDescriptor descriptor, Stage stage, BackfillContext context) {
        String name = descriptor.name();
        if (name == null || name.isBlank()) throw new ConfigurationException("job name must not be empty");
        if (stage == null) throw new ConfigurationException("job " + name + " has no stage");
        if (jobs.containsKey(name)) throw new ConfigurationException("job " + name + " is already registered");
        CronExpressions.validate(descriptor.schedule());
        if (descriptor.timeout() == null || descriptor.timeout().isZero() || descriptor.timeout().isNegative()) {
            throw new ConfigurationException("job " + name + " needs a positive timeout");
        }
        if (descriptor.retryCount() < 0) throw new ConfigurationException("job " + name + " has a negative retry count");
        if (context != null && !context.job().equals(name)) {
            throw new ConfigurationException("backfill context of " + context.job() + " cannot be used by job " + name);
        }

        Stage effective = descriptor.retryCount() > 0 ? stages.retry(stage, descriptor.retryCount(), RETRY_DELAY_MILLIS) : stage;
        BackfillContext ctx = context != null ? context
                : new BackfillContext(name, watermarks, defaultLookback, clock, backfillPolicy);
        jobs.put(name, new Entry(descriptor.finished(JobStatus.IDLE, null), effective, ctx));
        log.info("Registered job {} ({}): {}", name, descriptor.schedule(), descriptor.description());
    }

    public synchronized boolean unregister(String name) {
        boolean removed = jobs.remove(name) != null;
        if (removed) log.info("Unregistered job {}", name);
        return removed;
    }

    public boolean run(String name) {
        return runDetailed(name).isOk();
    }

    /**
     * Runs the job once over the window its context yields. After a successful run that loaded rows the watermark
     * moves to the window end.
     */
    public StageResult runDetailed(String name) {
        Entry e = entry(name);
        if (e == null) {
            log.warn("Unknown job {}", name);
            return StageResult.failure(ErrorKind.CONFIGURATION, "unknown job " + name);
        }
        if (!e.runLock.tryLock()) {
            log.warn("Job {} is already running", name);
            return StageResult.failure(ErrorKind.CONFIGURATION, "job " + name + " is already running");
        }
        try {
            TimeWindow window = e.context.getWindow();
            StageResult r = execute(e, window, true);
            if (r.isOk() && r.recordsLoaded() > 0) e.context.advanceWatermark(window.end());
            return r;
        } finally {
            e.runLock.unlock();
        }
    }

    public boolean backfill(String name, Duration windowSize) {
        return backfill(name, windowSize, Duration.ofDays(1));
    }

    /**
     * Re-runs the job over consecutive {@code step}-sized slices, oldest first, from the slice containing
     * {@code now - windowSize} through the slice containing now. Slices are aligned to the epoch (whole UTC days
     * for a one-day step). The backfill window is released exactly once, whatever the slices do.
     *
     * @return true when every slice succeeded
     */
    public boolean backfill(String name, Duration windowSize, Duration step) {
        if (windowSize == null || windowSize.isNegative()) throw new ConfigurationException("backfill window size must not be negative");
        if (step == null || step.isZero() || step.isNegative()) throw new ConfigurationException("backfill step must be positive");
        Entry e = entry(name);
        if (e == null) {
            log.warn("Unknown job {}", name);
            return false;
        }
        if (!e.runLock.tryLock()) {
            log.warn("Job {} is already running, backfill not started", name);
            return false;
        }
        String owner = "backfill:" + name;
        int slices = 0;
        int failed = 0;
        boolean timedOut = false;
        String firstError = null;
        try {
            Instant now = clock.instant();
            Instant first = align(now.minus(windowSize), step);
            Instant current = align(now, step);
            log.info("Backfilling {} from {} in steps of {}", name, first, step);
            for (Instant start = first; !start.isAfter(current); start = start.plus(step)) {
                Instant end = start.plus(step).isAfter(now) ? now : start.plus(step);
                e.context.setWindow(start, end, owner);
                StageResult r = execute(e, e.context.getWindow(), false);
                slices++;
                if (r.isOk()) {
                    if (r.recordsLoaded() > 0) e.context.advanceWatermark(end);
                } else {
                    failed++;
                    if (firstError == null) firstError = start + ": " + r.message();
                    timedOut |= r.errorKind().orElse(null) == ErrorKind.TIMEOUT;
                    log.warn("Backfill slice {} .. {} of {} failed: {}", start, end, name, r.message());
                }
                if (!e.worker.isDone()) {
                    log.error("Backfill of {} stopped: slice {} .. {} is still running after its timeout", name, start, end);
                    break;
                }
            }
        } finally {
            e.context.clear();
            e.runLock.unlock();
        }
        JobStatus status = failed == 0 ? JobStatus.COMPLETED : (timedOut ? JobStatus.TIMED_OUT : JobStatus.FAILED);
        e.descriptor = e.descriptor.finished(status, firstError);
        log.info("Backfill of {} finished: {} slice(s), {} failed", name, slices, failed);
        return failed == 0;
    }

    private StageResult execute(Entry e, TimeWindow window, boolean clearOnTimeout) {
        JobDescriptor d = e.descriptor;
        if (!e.worker.isDone()) {
            log.warn("Job {} is still finishing a timed-out run, not starting another", d.name());
            return StageResult.failure(ErrorKind.CONFIGURATION, "job " + d.name() + " is still finishing a timed-out run");
        }
        e.descriptor = d.started(clock.instant());
        CompletableFuture<Void> done = new CompletableFuture<>();
        AtomicBoolean claimed = new AtomicBoolean();
        e.worker = done;
        Future<StageResult> f = executor.submit(() -> {
            if (!claimed.compareAndSet(false, true)) return StageResult.failure(ErrorKind.INTERRUPTED, "cancelled before start");
            try {
                return e.stage.run(window);
            } finally {
                done.complete(null);
            }
        });
        StageResult r;
        try {
            r = f.get(d.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            f.cancel(true);
            if (claimed.compareAndSet(false, true)) done.complete(null);
            awaitStop(d.name(), done);
            if (clearOnTimeout) e.context.clear();
            String msg = "job " + d.name() + " exceeded its timeout of " + d.timeout();
            log.error(msg);
            e.descriptor = e.descriptor.finished(JobStatus.TIMED_OUT, msg);
            return StageResult.failure(ErrorKind.TIMEOUT, msg);
        } catch (InterruptedException ie) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            e.descriptor = e.descriptor.finished(JobStatus.FAILED, "interrupted");
            return StageResult.failure(ErrorKind.INTERRUPTED, "job " + d.name() + " interrupted", ie);
        } catch (ExecutionException ee) {
            r = StageResult.fromException(ee.getCause());
        }
        if (r.isOk()) {
            log.info("Job {} completed ({} records loaded)", d.name(), r.recordsLoaded());
            e.descriptor = e.descriptor.finished(JobStatus.COMPLETED, null);
        } else {
            log.error("Job {} failed: {}", d.name(), r.message());
            e.descriptor = e.descriptor.finished(JobStatus.FAILED, r.message());
        }
        return r;
    }

    private void awaitStop(String job, CompletableFuture<Void> done) {
        try {
            done.get(cancelGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            log.error("Job {} did not stop within {} of being interrupted; new runs are rejected until it returns", job, cancelGrace);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException ee) {
            // done only ever completes normally
            throw new IllegalStateException(ee);
        }
    }

    private static Instant align(Instant t, Duration step) {
        long ms = step.toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(t.toEpochMilli(), ms) * ms);
    }

    private synchronized Entry entry(String name) {
        return name == null ? null : jobs.get(name);
    }

    /** Snapshot of all jobs in registration order. */
    public synchronized Map<String, JobDescriptor> list() {
        Map<String, JobDescriptor> out = new LinkedHashMap<>();
        jobs.forEach((k, v) -> out.put(k, v.descriptor));
        return Collections.unmodifiableMap(out);
    }

    public Optional<JobDescriptor> get(String name) {
        return Optional.ofNullable(entry(name)).map(e -> e.descriptor);
    }

    public Optional<BackfillContext> context(String name) {
        return Optional.ofNullable(entry(name)).map(e -> e.context);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
