package com.triagesentinel.analyzer.pipeline;

/**
 * A queued file could not be moved from the intake area into processing.
 *
 * @author Naveed Gung
 */
public class RelocationException extends Exception {

    public RelocationException(String message) {
        super(message);
    }

    public RelocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
