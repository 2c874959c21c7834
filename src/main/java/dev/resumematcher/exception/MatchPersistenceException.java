package dev.resumematcher.exception;

/**
 * A match result could not be written. Nothing was stored for the pair; the operation
 * may be retried.
 */
public class MatchPersistenceException extends RuntimeException {

    private final Long jobId;
    private final Long resumeId;

    public MatchPersistenceException(Long jobId, Long resumeId, Throwable cause) {
        super("Failed to store match for job " + jobId + " / resume " + resumeId + ": " + cause.getMessage(), cause);
        this.jobId = jobId;
        this.resumeId = resumeId;
    }

    public MatchPersistenceException(Long jobId, Long resumeId, String reason) {
        super("Failed to store match for job " + jobId + " / resume " + resumeId + ": " + reason);
        this.jobId = jobId;
        this.resumeId = resumeId;
    }

    public Long getJobId() {
        return jobId;
    }

    public Long getResumeId() {
        return resumeId;
    }
}
