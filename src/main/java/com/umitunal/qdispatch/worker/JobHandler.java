package com.umitunal.qdispatch.worker;

/**
 * Application logic run for each claimed job.
 *
 * <p>Handlers should poll {@link JobContext#isCancelled()} during long work: once the execution
 * deadline passes the supervisor stops crediting the attempt, whether or not the handler returns.
 *
 * @param <T> the type of job payload
 */
@FunctionalInterface
public interface JobHandler<T> {

    /**
     * Process a job and return the result.
     *
     * @throws Exception if processing fails; counted as a failed attempt
     */
    ProcessingResult process(JobContext<T> context) throws Exception;

    /**
     * Result of job processing.
     */
    class ProcessingResult {
        private final boolean success;
        private final String message;

        private ProcessingResult(boolean success, String message) {
            this.success = success;
            this.message = message;
        }

        public boolean isSuccess() { return success; }
        public String getMessage() { return message; }

        public static ProcessingResult success() {
            return new ProcessingResult(true, null);
        }

        public static ProcessingResult success(String message) {
            return new ProcessingResult(true, message);
        }

        public static ProcessingResult failure(String message) {
            return new ProcessingResult(false, message);
        }
    }
}
