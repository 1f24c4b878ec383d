package com.baykanat.killboard.domain.job;

import com.baykanat.killboard.config.AppProperties;
import com.baykanat.killboard.domain.exception.QueueFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Sınırlı FIFO iş kuyruğu: çok üretici, tek tüketici (JobProcessor).
 *
 * <p>HTTP gibi istek işleyen üreticiler {@link #trySubmit(Job)} kullanır; kuyruk doluysa job düşer
 * (load shedding). Scheduler {@link #submit(Job)} ile yer açılana kadar bekler, job düşmez.
 */
@Slf4j
@Component
public class JobQueue {

    private final BlockingQueue<Job> jobs;
    private final int capacity;

    @Autowired
    public JobQueue(AppProperties appProperties) {
        this(appProperties.getQueue().getCapacity());
    }

    public JobQueue(int capacity) {
        this.capacity = capacity;
        this.jobs = new ArrayBlockingQueue<>(capacity);
    }

    /** Bloklamadan ekler; kuyruk doluysa loglar ve QueueFullException fırlatır. */
    public void trySubmit(Job job) {
        if (!jobs.offer(job)) {
            log.warn("Job queue full (capacity={}), dropping job {}", capacity, job);
            throw new QueueFullException(String.valueOf(job), capacity);
        }
        log.debug("Job submitted: {}, queue size={}", job, jobs.size());
    }

    /** Yer açılana kadar bekler; asla düşürmez. */
    public void submit(Job job) throws InterruptedException {
        jobs.put(job);
        log.debug("Job submitted (blocking): {}, queue size={}", job, jobs.size());
    }

    /** Tek tüketici için; kuyruk boşsa bekler. */
    public Job take() throws InterruptedException {
        return jobs.take();
    }

    public int size() {
        return jobs.size();
    }

    public int capacity() {
        return capacity;
    }
}
