package io.cronhub.core.job;

public final class JobNotFoundException extends RuntimeException {
    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("Job " + jobId + " does not exist");
        this.jobId = jobId;
    }

    public long jobId() {
        return jobId;
    }
}
