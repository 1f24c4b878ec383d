package com.baykanat.killboard.domain.exception;

/** Bloklamayan kuyruk gönderimi reddedildi; job düşürüldü. GlobalExceptionHandler 503 döner. */
public class QueueFullException extends KillboardException {

    private final int capacity;

    public QueueFullException(String jobName, int capacity) {
        super("Job queue is full (capacity " + capacity + "), dropped " + jobName);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
