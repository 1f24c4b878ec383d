package com.baykanat.killboard.scheduler;

import com.baykanat.killboard.domain.job.Job;

import java.time.Duration;

/**
 * Tek bir periyodik zamanlayıcının defteri: adı, periyodu, sıradaki tetik anı ve üreteceği job.
 * Zaman {@link System#nanoTime()} cinsinden dışarıdan verilir; thread tutmaz.
 */
final class IntervalTimer {

    private final String name;
    private final long periodNanos;
    private final Job job;
    private long nextDueNanos;

    /** İlk tetik başlangıçtan bir tam periyot sonra. */
    IntervalTimer(String name, Duration period, Job job, long startNanos) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Timer " + name + " needs a positive period, got " + period);
        }
        this.name = name;
        this.periodNanos = period.toNanos();
        this.job = job;
        this.nextDueNanos = startNanos + periodNanos;
    }

    boolean isDue(long nowNanos) {
        return nowNanos - nextDueNanos >= 0;
    }

    /** Sıradaki tetiğe ilerler; bu arada kaçırılan tetikler birikmez, atlanır. */
    void advance(long nowNanos) {
        nextDueNanos += periodNanos;
        if (nowNanos - nextDueNanos >= 0) {
            long missed = (nowNanos - nextDueNanos) / periodNanos + 1;
            nextDueNanos += missed * periodNanos;
        }
    }

    long nanosUntilDue(long nowNanos) {
        return Math.max(0L, nextDueNanos - nowNanos);
    }

    String name() {
        return name;
    }

    Job job() {
        return job;
    }
}
