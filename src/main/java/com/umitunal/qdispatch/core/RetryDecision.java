package com.umitunal.qdispatch.core;

/**
 * What the queue did with a job after a failed attempt.
 *
 * @param jobId      the job
 * @param attempt    attempt number that failed
 * @param action     rescheduled or terminally failed
 * @param eligibleAt next dispatch time when rescheduled, otherwise 0
 */
public record RetryDecision(String jobId, int attempt, Action action, long eligibleAt) {

    public static RetryDecision rescheduled(String jobId, int attempt, long eligibleAt) {
        return new RetryDecision(jobId, attempt, Action.RESCHEDULED, eligibleAt);
    }

    public static RetryDecision failed(String jobId, int attempt) {
        return new RetryDecision(jobId, attempt, Action.FAILED, 0);
    }

    public boolean isTerminal() {
        return action == Action.FAILED;
    }

    public enum Action {
        RESCHEDULED,
        FAILED
    }
}
