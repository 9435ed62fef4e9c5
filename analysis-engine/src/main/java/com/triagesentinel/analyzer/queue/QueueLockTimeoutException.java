package com.triagesentinel.analyzer.queue;

import java.nio.file.Path;

/**
 * The queue's advisory lock could not be obtained within the configured timeout.
 *
 * @author Naveed Gung
 */
public class QueueLockTimeoutException extends RuntimeException {

    public QueueLockTimeoutException(Path lockFile, long timeoutMs) {
        super("Timed out after " + timeoutMs + "ms waiting for queue lock " + lockFile);
    }
}
