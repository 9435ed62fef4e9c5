package com.triagesentinel.analyzer.archive;

/**
 * Typed extraction failure. Whenever this is thrown the workspace has already
 * been deleted.
 *
 * @author Naveed Gung
 */
public class ExtractionException extends Exception {

    public enum Reason {
        /** A member name resolves outside the workspace. */
        TRAVERSAL_VIOLATION("traversal-violation"),
        /** Declared or observed member count above the cap. */
        COUNT_EXCEEDED("count-exceeded"),
        /** Decompressed bytes above the budget. */
        SIZE_EXCEEDED("size-exceeded"),
        /** The container could not be decoded. */
        BAD_CONTAINER("bad-container"),
        /** No external extractor could handle the container. */
        NO_EXTRACTOR("no-extractor"),
        /** An external extractor ran past its deadline and was killed. */
        TIMED_OUT("timed-out"),
        /** No codec is registered for the format. */
        UNSUPPORTED_FORMAT("unsupported-format"),
        /** The uniquely named workspace already existed. */
        WORKSPACE_COLLISION("workspace-collision"),
        /** The scratch area could not be written. */
        WORKSPACE_UNAVAILABLE("workspace-unavailable");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    private final Reason reason;

    public ExtractionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ExtractionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return reason.getCode() + ": " + super.getMessage();
    }
}
