package com.umitunal.qdispatch.supervisor;

import com.umitunal.qdispatch.core.ExecutionRecord;

/**
 * States of one execution attempt: {@code START -> RUNNING -> {SUCCEEDED, FAILED, TIMED_OUT}}.
 */
public enum AttemptState {
    START,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean canTransitionTo(AttemptState next) {
        return switch (this) {
            case START -> next == RUNNING;
            case RUNNING -> next == SUCCEEDED || next == FAILED || next == TIMED_OUT;
            case SUCCEEDED, FAILED, TIMED_OUT -> false;
        };
    }

    public boolean isFinal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }

    ExecutionRecord.Outcome toOutcome() {
        return switch (this) {
            case SUCCEEDED -> ExecutionRecord.Outcome.SUCCESS;
            case FAILED -> ExecutionRecord.Outcome.FAILURE;
            case TIMED_OUT -> ExecutionRecord.Outcome.TIMEOUT;
            case START, RUNNING -> throw new IllegalStateException("Attempt in " + this + " has no outcome yet");
        };
    }
}
