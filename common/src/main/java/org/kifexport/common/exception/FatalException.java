package org.kifexport.common.exception;

/**
 * The run failed and no output may be produced. Carries the source offset
 * that caused the failure when there is one.
 */
public class FatalException extends RuntimeException {
    /**
     * Marker for failures not tied to a source position.
     */
    public static final int NO_OFFSET = -1;

    private final int offset;

    public FatalException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    public FatalException(String message) {
        this(message, NO_OFFSET);
    }

    /**
     * Character offset in the source text, or {@link #NO_OFFSET}.
     */
    public int getOffset() {
        return offset;
    }
}
