package net.chime.core.service;

import net.chime.core.error.StoreCorruptedException;
import net.chime.core.error.StoreUnavailableException;
import net.chime.core.model.Reminder;
import net.chime.core.model.ScheduledJob;
import net.chime.core.spi.Clock;
import net.chime.core.spi.ReminderRepository;
import net.chime.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 단일 루프 스레드 스케줄러.
 * <p>
 * 작업 큐(min-heap)는 루프 스레드만 만진다. 외부 변경은 {@link ReminderChangeListener}를 통해
 * 신호 큐에 쌓이고 다음 틱에서 반영된다. 발화는 디스패치 풀로 넘겨 루프를 막지 않는다.
 * <p>
 * 한 인스턴스는 한 번만 시작/정지할 수 있다.
 */
public final class ReminderScheduler implements ReminderChangeListener {
    private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

    static final String LOOP_THREAD_NAME = "chime-scheduler";

    private final ReminderRepository reminders;
    private final TxRunner tx;
    private final Clock clock;
    private final ReminderReconciler reconciler;
    private final ReminderDispatcher dispatcher;
    private final SchedulerSettings settings;

    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();
    private final ExecutorService dispatchPool;

    // 루프 스레드 전용 상태
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(
            Comparator.comparing(Entry::wakeAt).thenComparingLong(e -> e.job().reminderId()));
    private final Map<Long, Entry> entries = new HashMap<>();
    private final Map<Long, Reload> reloads = new HashMap<>();
    private final Deque<Signal> inbox = new ArrayDeque<>();
    private Instant resyncDueAt;
    private int resyncAttempt;

    private volatile List<ScheduledJob> snapshot = List.of();
    private volatile boolean accepting;
    private volatile boolean running;
    private Thread loopThread;
    private boolean stopped;

    public ReminderScheduler(ReminderRepository reminders,
                             TxRunner tx,
                             Clock clock,
                             ReminderReconciler reconciler,
                             ReminderDispatcher dispatcher,
                             SchedulerSettings settings) {
        this.reminders = reminders;
        this.tx = tx;
        this.clock = clock;
        this.reconciler = reconciler;
        this.dispatcher = dispatcher;
        this.settings = settings;
        this.dispatchPool = Executors.newFixedThreadPool(settings.dispatchThreads(), DaemonThreads.named("chime-dispatch-"));
    }

    /** 재조정 후 루프 스레드 기동. 저장소 손상이면 {@link StoreCorruptedException}으로 실패 */
    public synchronized void start() throws Exception {
        if (stopped || loopThread != null) {
            throw new IllegalStateException("scheduler already started");
        }
        initialize();
        running = true;
        loopThread = new Thread(this::runLoop, LOOP_THREAD_NAME);
        loopThread.start();
        log.info("Reminder scheduler started with {} jobs", entries.size());
    }

    /** 신호 수신 시작 → 재조정(재시도 포함) → 큐 채우기. 루프 스레드가 뜨기 전에만 호출 */
    void initialize() throws Exception {
        accepting = true;
        try {
            List<ScheduledJob> jobs = reconcileWithRetry();
            queue.clear();
            entries.clear();
            for (ScheduledJob job : jobs) {
                schedule(new Entry(job, job.nextFireAt(), 0));
            }
            publishSnapshot();
        } catch (Exception e) {
            accepting = false;
            throw e;
        }
    }

    private List<ScheduledJob> reconcileWithRetry() throws Exception {
        int maxAttempts = settings.reconcileAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return reconciler.reconcile(clock.now());
            } catch (StoreUnavailableException e) {
                if (attempt >= maxAttempts) {
                    log.error("Startup reconciliation failed after {} attempts", attempt, e);
                    throw e;
                }
                Duration backoff = settings.storeRetry().nextBackoff(attempt);
                log.warn("Store unavailable during startup reconciliation (attempt {}/{}), retrying in {}",
                        attempt, maxAttempts, backoff);
                Thread.sleep(backoff.toMillis());
            }
        }
    }

    /**
     * 신호 수신 중단 → 루프 정지 → 진행 중 디스패치를 유예 시간까지 기다린 뒤 포기.
     * 메모리 상태는 저장하지 않는다.
     */
    public void stop() {
        Thread t;
        synchronized (this) {
            if (stopped) return;
            stopped = true;
            accepting = false;
            running = false;
            t = loopThread;
            loopThread = null;
        }
        Duration grace = settings.shutdownGrace();
        try {
            if (t != null) {
                signals.offer(Signal.wakeUp());
                t.join(grace.toMillis());
                if (t.isAlive()) {
                    log.warn("Scheduler loop did not exit within {}, interrupting", grace);
                    t.interrupt();
                }
            }
            dispatchPool.shutdown();
            if (!dispatchPool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> abandoned = dispatchPool.shutdownNow();
                log.warn("Abandoned in-flight dispatches after {} ({} queued)", grace, abandoned.size());
            }
        } catch (InterruptedException e) {
            dispatchPool.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            dispatcher.close();
        }
        log.info("Reminder scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /** 현재 작업 목록 (next_fire_at 오름차순, 읽기 전용 복사본) */
    public List<ScheduledJob> snapshot() {
        return snapshot;
    }

    public Optional<ScheduledJob> jobOf(long reminderId) {
        return snapshot.stream().filter(j -> j.reminderId() == reminderId).findFirst();
    }

    // ---- ReminderChangeListener: 호출 스레드에서는 신호만 넣는다

    @Override
    public void reminderUpserted(Reminder reminder) {
        offer(Signal.upsert(reminder.id()));
    }

    @Override
    public void reminderRemoved(long reminderId) {
        offer(Signal.remove(reminderId));
    }

    @Override
    public void resyncRequested() {
        offer(Signal.resync());
    }

    private void offer(Signal signal) {
        if (!accepting) {
            log.debug("Scheduler not accepting signals, dropped {}", signal.kind());
            return;
        }
        signals.offer(signal);
    }

    // ---- 루프

    private void runLoop() {
        Duration maxIdle = settings.maxIdle();
        while (running) {
            try {
                Instant wake = tick();
                Instant now = clock.now();
                long waitMs = maxIdle.toMillis();
                if (wake != null) {
                    waitMs = Math.min(waitMs, Math.max(0, Duration.between(now, wake).toMillis()));
                }
                Signal s = waitMs > 0 ? signals.poll(waitMs, TimeUnit.MILLISECONDS) : signals.poll();
                if (s != null) inbox.add(s);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                // 루프는 죽지 않는다
                log.error("Scheduler loop iteration failed", e);
                pause();
            }
        }
        log.debug("Scheduler loop exited");
    }

    private void pause() {
        try {
            Thread.sleep(settings.storeRetry().nextBackoff(1).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    /**
     * 한 번의 깨어남: (1) 도래한 작업 전부 발화 (2) 밀린 재읽기 (3) 신호 반영 (4) 예약된 재조정.
     * @return 다음에 깨어날 시각, 할 일이 없으면 null
     */
    Instant tick() {
        Instant now = clock.now();
        fireDue(now);
        reloadDue(now);

        signals.drainTo(inbox);
        Signal s;
        while ((s = inbox.poll()) != null) {
            apply(s, now);
        }

        if (resyncDueAt != null && !now.isBefore(resyncDueAt)) {
            resync(now);
        }
        publishSnapshot();

        Instant wake = queue.isEmpty() ? null : queue.peek().wakeAt();
        for (Reload r : reloads.values()) {
            if (wake == null || r.dueAt().isBefore(wake)) wake = r.dueAt();
        }
        if (resyncDueAt != null && (wake == null || resyncDueAt.isBefore(wake))) {
            wake = resyncDueAt;
        }
        return wake;
    }

    private void fireDue(Instant now) {
        List<Entry> due = new ArrayList<>();
        while (!queue.isEmpty() && !queue.peek().wakeAt().isAfter(now)) {
            Entry e = queue.poll();
            entries.remove(e.job().reminderId());
            due.add(e);
        }
        for (Entry e : due) {
            fire(e, now);
        }
    }

    private void fire(Entry entry, Instant now) {
        long id = entry.job().reminderId();
        Instant fireAt = entry.job().nextFireAt();

        Reminder reminder;
        try {
            reminder = tx.required(() -> reminders.findById(id)).orElse(null);
        } catch (Exception e) {
            int attempt = entry.attempt() + 1;
            Duration backoff = settings.storeRetry().nextBackoff(attempt);
            log.warn("Could not load reminder {} due at {} (attempt {}), retrying in {}: {}",
                    id, fireAt, attempt, backoff, e.toString());
            schedule(new Entry(entry.job(), now.plus(backoff), attempt));
            return;
        }

        if (reminder == null || !reminder.enabled()) {
            log.debug("Dropping job of reminder {}: {}", id, reminder == null ? "deleted" : "disabled");
            return;
        }

        submitDispatch(reminder, fireAt);

        try {
            Instant next = reconciler.nextFireAt(reminder, fireAt);
            if (!next.isAfter(now)) {
                next = reconciler.nextFireAt(reminder, now);
                log.info("Reminder {} skipped occurrences between {} and {}", id, fireAt, now);
            }
            schedule(new Entry(new ScheduledJob(id, next), next, 0));
            log.debug("Reminder {} next fire at {}", id, next);
        } catch (StoreCorruptedException e) {
            log.error("Unschedulable reminder {}, job dropped", id, e);
        }
    }

    private void submitDispatch(Reminder reminder, Instant fireAt) {
        long id = reminder.id();
        if (!inFlight.add(id)) {
            log.warn("Skipping occurrence {} of reminder {}: previous dispatch still in flight", fireAt, id);
            return;
        }
        try {
            dispatchPool.execute(() -> {
                try {
                    dispatcher.dispatch(reminder, fireAt);
                } catch (RuntimeException e) {
                    log.error("Dispatch of reminder {} at {} failed", id, fireAt, e);
                } finally {
                    inFlight.remove(id);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(id);
            log.warn("Dispatch pool rejected reminder {} at {}", id, fireAt);
        }
    }

    private void apply(Signal signal, Instant now) {
        switch (signal.kind()) {
            case UPSERT -> reload(signal.reminderId(), now, 0);
            case REMOVE -> {
                reloads.remove(signal.reminderId());
                unschedule(signal.reminderId());
                log.debug("Reminder {} removed from schedule", signal.reminderId());
            }
            case RESYNC -> resyncDueAt = now;
            case WAKE_UP -> { }
        }
    }

    private void reloadDue(Instant now) {
        List<Long> due = new ArrayList<>();
        for (Map.Entry<Long, Reload> e : reloads.entrySet()) {
            if (!e.getValue().dueAt().isAfter(now)) due.add(e.getKey());
        }
        for (Long id : due) {
            reload(id, now, reloads.get(id).attempt());
        }
    }

    /**
     * 신호가 도착한 순서와 커밋 순서가 다를 수 있으므로 신호 내용 대신 저장소의 현재 행으로 작업을 다시 만든다.
     * 읽기에 실패하면 기존 작업은 그대로 두고 이 리마인더만 백오프 후 다시 읽는다.
     */
    private void reload(long id, Instant now, int attempt) {
        reloads.remove(id);
        Reminder r;
        try {
            r = tx.required(() -> reminders.findById(id)).orElse(null);
        } catch (Exception e) {
            int next = attempt + 1;
            Duration backoff = settings.storeRetry().nextBackoff(next);
            log.warn("Could not reload reminder {} (attempt {}), retrying in {}: {}", id, next, backoff, e.toString());
            reloads.put(id, new Reload(now.plus(backoff), next));
            return;
        }

        unschedule(id);
        if (r == null || !r.enabled()) {
            log.debug("Reminder {} {}, job removed", id, r == null ? "deleted" : "disabled");
            return;
        }
        try {
            Instant next = reconciler.nextFireAt(r, now);
            schedule(new Entry(new ScheduledJob(id, next), next, 0));
            log.debug("Reminder {} scheduled at {}", id, next);
        } catch (StoreCorruptedException e) {
            log.error("Ignoring unschedulable reminder {}", id, e);
        }
    }

    private void resync(Instant now) {
        try {
            List<ScheduledJob> jobs = reconciler.reconcile(now);
            queue.clear();
            entries.clear();
            for (ScheduledJob job : jobs) {
                schedule(new Entry(job, job.nextFireAt(), 0));
            }
            reloads.clear();
            resyncDueAt = null;
            resyncAttempt = 0;
        } catch (StoreCorruptedException e) {
            log.error("Resync aborted, keeping current schedule", e);
            resyncDueAt = null;
            resyncAttempt = 0;
        } catch (Exception e) {
            resyncAttempt++;
            Duration backoff = settings.storeRetry().nextBackoff(resyncAttempt);
            log.warn("Resync failed (attempt {}), retrying in {}: {}", resyncAttempt, backoff, e.toString());
            resyncDueAt = now.plus(backoff);
        }
    }

    private void schedule(Entry entry) {
        entries.put(entry.job().reminderId(), entry);
        queue.add(entry);
    }

    private void unschedule(long reminderId) {
        Entry old = entries.remove(reminderId);
        if (old != null) queue.remove(old);
    }

    private void publishSnapshot() {
        List<ScheduledJob> jobs = new ArrayList<>(entries.size());
        for (Entry e : entries.values()) jobs.add(e.job());
        jobs.sort(Comparator.comparing(ScheduledJob::nextFireAt).thenComparingLong(ScheduledJob::reminderId));
        snapshot = List.copyOf(jobs);
    }

    /** wakeAt은 재시도 시 job.nextFireAt(원래 발화 시각)보다 뒤일 수 있다 */
    private record Entry(ScheduledJob job, Instant wakeAt, int attempt) {
    }

    private record Reload(Instant dueAt, int attempt) {
    }

    private record Signal(Kind kind, long reminderId) {
        enum Kind { UPSERT, REMOVE, RESYNC, WAKE_UP }

        static Signal upsert(long id) { return new Signal(Kind.UPSERT, id); }
        static Signal remove(long id) { return new Signal(Kind.REMOVE, id); }
        static Signal resync() { return new Signal(Kind.RESYNC, 0L); }
        static Signal wakeUp() { return new Signal(Kind.WAKE_UP, 0L); }
    }
}
