package org.latticeville.datapipeline.replay;

/**
 * Thrown when a replay log cannot be interpreted by this reader, most often because it was
 * written with a different schema version. Replay stops rather than guessing.
 */
public class ReplayMismatchException extends RuntimeException {

    private final long lineNumber;

    public ReplayMismatchException(String message, long lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    public ReplayMismatchException(String message, long lineNumber, Throwable cause) {
        super(message + " (line " + lineNumber + ")", cause);
        this.lineNumber = lineNumber;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
