package com.baykanat.killboard.scheduler;

import com.baykanat.killboard.config.AppProperties;
import com.baykanat.killboard.domain.job.Job;
import com.baykanat.killboard.domain.job.JobQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Üç bağımsız periyodik tetik: Refresh, FetchKillmails, ResolveKillmails.
 *
 * <p>Tek bir denetçi thread en yakın tetik anına kadar bekler, zamanı gelen job'u kuyruğa bloklayarak
 * ({@link JobQueue#submit(Job)}) ekler. Kuyruk doluyken tetik bekler; bu sırada kaçan tetikler atlanır.
 * {@link #cancel()} üç tetiği birlikte durdurur, bloklanmış bir submit'i de keser.
 */
@Slf4j
@Component
public class JobScheduler {

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final JobQueue jobQueue;
    private final boolean enabled;
    private final Duration refreshInterval;
    private final Duration fetchInterval;
    private final Duration resolveInterval;

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile Thread supervisor;

    @Autowired
    public JobScheduler(JobQueue jobQueue, AppProperties appProperties) {
        this(jobQueue,
                appProperties.getScheduler().isEnabled(),
                appProperties.getScheduler().getRefreshInterval(),
                appProperties.getScheduler().getFetchInterval(),
                appProperties.getScheduler().getResolveInterval());
    }

    public JobScheduler(JobQueue jobQueue, Duration refreshInterval, Duration fetchInterval, Duration resolveInterval) {
        this(jobQueue, true, refreshInterval, fetchInterval, resolveInterval);
    }

    private JobScheduler(JobQueue jobQueue, boolean enabled,
                         Duration refreshInterval, Duration fetchInterval, Duration resolveInterval) {
        this.jobQueue = jobQueue;
        this.enabled = enabled;
        this.refreshInterval = refreshInterval;
        this.fetchInterval = fetchInterval;
        this.resolveInterval = resolveInterval;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!enabled) {
            log.info("Job scheduler is disabled");
            return;
        }
        start();
    }

    /** Tetikleri başlatır; ilk tetikler başlangıçtan bir periyot sonra. */
    public synchronized void start() {
        if (supervisor != null) {
            throw new IllegalStateException("Job scheduler already started");
        }
        long startNanos = System.nanoTime();
        List<IntervalTimer> timers = List.of(
                new IntervalTimer("refresh", refreshInterval, Job.REFRESH, startNanos),
                new IntervalTimer("fetch-killmails", fetchInterval, Job.FETCH_KILLMAILS, startNanos),
                new IntervalTimer("resolve-killmails", resolveInterval, Job.RESOLVE_KILLMAILS, startNanos));

        Thread thread = new Thread(() -> runTimers(timers), "job-scheduler");
        thread.setDaemon(true);
        supervisor = thread;
        thread.start();
        log.info("Job scheduler started: refresh every {}, fetch every {}, resolve every {}",
                refreshInterval, fetchInterval, resolveInterval);
    }

    /** Üç tetiği birlikte durdurur. İdempotent. */
    public void cancel() {
        cancelled.countDown();
        Thread thread = supervisor;
        if (thread != null) {
            thread.interrupt();
        }
    }

    /** Denetçi thread'in bitmesini bekler; süre içinde bittiyse true. */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Thread thread = supervisor;
        if (thread == null) {
            return true;
        }
        thread.join(Math.max(1L, timeout.toMillis()));
        return !thread.isAlive();
    }

    public boolean isRunning() {
        Thread thread = supervisor;
        return thread != null && thread.isAlive();
    }

    /** Processor'dan önce durur; kapanışta kuyruğa yeni job girmez. */
    @Order(1)
    @EventListener(ContextClosedEvent.class)
    public void shutdown() {
        if (!isRunning()) {
            return;
        }
        cancel();
        try {
            if (!awaitTermination(SHUTDOWN_TIMEOUT)) {
                log.warn("Job scheduler did not stop within {}", SHUTDOWN_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runTimers(List<IntervalTimer> timers) {
        try {
            while (cancelled.getCount() > 0) {
                for (IntervalTimer timer : timers) {
                    if (cancelled.getCount() == 0) {
                        break;
                    }
                    if (timer.isDue(System.nanoTime())) {
                        log.debug("Timer {} fired, submitting {}", timer.name(), timer.job());
                        jobQueue.submit(timer.job());
                        timer.advance(System.nanoTime());
                    }
                }

                long now = System.nanoTime();
                long waitNanos = timers.stream()
                        .mapToLong(timer -> timer.nanosUntilDue(now))
                        .min()
                        .orElse(0L);
                if (cancelled.await(waitNanos, TimeUnit.NANOSECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Job scheduler stopped");
    }
}
