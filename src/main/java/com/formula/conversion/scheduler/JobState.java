package com.formula.conversion.scheduler;

/**
 * Lifecycle of a single conversion job.
 * {@code PENDING -> RUNNING -> SUCCEEDED | FAILED}, or {@code PENDING -> CANCELLED}
 * once another job of the batch has failed. Running jobs are never cancelled.
 */
public enum JobState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
