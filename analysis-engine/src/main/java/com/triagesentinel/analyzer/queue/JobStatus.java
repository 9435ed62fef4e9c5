package com.triagesentinel.analyzer.queue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a queued job.
 *
 * <pre>
 * pending -> analyzing -> analyzed -> reported
 *                     \-> failed
 * </pre>
 *
 * <p>
 * Transitions never skip a state and never go backwards. {@code failed} and
 * {@code reported} are terminal.
 * </p>
 *
 * @author Naveed Gung
 */
public enum JobStatus {

    PENDING("pending"),
    ANALYZING("analyzing"),
    ANALYZED("analyzed"),
    FAILED("failed"),
    REPORTED("reported");

    private final String wireValue;

    JobStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /** States reachable in one step from this one. */
    public Set<JobStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(ANALYZING);
            case ANALYZING -> EnumSet.of(ANALYZED, FAILED);
            case ANALYZED -> EnumSet.of(REPORTED);
            case FAILED, REPORTED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    public boolean canTransitionTo(JobStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    /**
     * Decode from the queue document representation.
     *
     * @param value wire value such as {@code "pending"}
     * @return the corresponding status
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static JobStatus fromWireValue(String value) {
        for (JobStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }
}
