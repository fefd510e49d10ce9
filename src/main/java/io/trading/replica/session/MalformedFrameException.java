package io.trading.replica.session;

/**
 * A received stream frame could not be decoded into the expected structure.
 * Terminates the session that received it.
 */
public class MalformedFrameException extends RuntimeException {

    private final String frame;

    public MalformedFrameException(String message, String frame) {
        this(message, frame, null);
    }

    public MalformedFrameException(String message, String frame, Throwable cause) {
        super(message, cause);
        this.frame = frame;
    }

    /**
     * The offending frame text (or its JSON rendering).
     */
    public String getFrame() {
        return frame;
    }
}
