package com.triagesentinel.analyzer.queue;

/**
 * Raised when a caller asks for a job transition the state machine forbids.
 *
 * @author Naveed Gung
 */
public class IllegalStatusTransitionException extends IllegalStateException {

    private final String jobId;
    private final JobStatus from;
    private final JobStatus to;

    public IllegalStatusTransitionException(String jobId, JobStatus from, JobStatus to) {
        super(String.format("Job %s cannot move from %s to %s",
                jobId, from.getWireValue(), to.getWireValue()));
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }
}
