package com.umitunal.qdispatch.storage;

import com.umitunal.qdispatch.core.Job;
import com.umitunal.qdispatch.core.JobState;

import java.util.EnumSet;
import java.util.Set;

/**
 * Selection criteria for {@link JobStore#listJobs(JobFilter)}.
 */
public class JobFilter {
    private static final JobFilter ALL = newBuilder().build();

    private final Set<JobState> states;
    private final long enqueuedFrom;
    private final long enqueuedTo;
    private final int limit;

    private JobFilter(Builder builder) {
        this.states = builder.states.isEmpty() ? EnumSet.allOf(JobState.class) : EnumSet.copyOf(builder.states);
        this.enqueuedFrom = builder.enqueuedFrom;
        this.enqueuedTo = builder.enqueuedTo;
        this.limit = builder.limit;
    }

    public static JobFilter all() {
        return ALL;
    }

    public static JobFilter inState(JobState first, JobState... rest) {
        return newBuilder().withStates(EnumSet.of(first, rest)).build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Set<JobState> getStates() { return states; }
    public long getEnqueuedFrom() { return enqueuedFrom; }
    public long getEnqueuedTo() { return enqueuedTo; }
    public int getLimit() { return limit; }

    public boolean matches(Job<?> job) {
        return states.contains(job.getState())
                && job.getEnqueuedAt() >= enqueuedFrom
                && job.getEnqueuedAt() < enqueuedTo;
    }

    public static class Builder {
        private final Set<JobState> states = EnumSet.noneOf(JobState.class);
        private long enqueuedFrom = 0;
        private long enqueuedTo = Long.MAX_VALUE;
        private int limit = Integer.MAX_VALUE;

        private Builder() {
        }

        public Builder withStates(Set<JobState> states) {
            this.states.addAll(states);
            return this;
        }

        /**
         * Half-open enqueue time range {@code [from, to)}.
         */
        public Builder enqueuedBetween(long from, long to) {
            this.enqueuedFrom = from;
            this.enqueuedTo = to;
            return this;
        }

        public Builder withLimit(int limit) {
            if (limit < 1) {
                throw new IllegalArgumentException("limit must be at least 1");
            }
            this.limit = limit;
            return this;
        }

        public JobFilter build() {
            return new JobFilter(this);
        }
    }
}
