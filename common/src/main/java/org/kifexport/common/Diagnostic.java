package org.kifexport.common;

import lombok.Value;

/**
 * A non fatal condition found while converting a document. Diagnostics are
 * returned to the caller next to the primary result.
 */
@Value
public class Diagnostic {
    /**
     * Marker for diagnostics not tied to a source position.
     */
    public static final int NO_OFFSET = -1;

    Kind kind;
    String message;
    /**
     * Character offset in the source text, or {@link #NO_OFFSET}.
     */
    int offset;

    public boolean hasOffset() {
        return offset != NO_OFFSET;
    }

    @Override
    public String toString() {
        if (hasOffset()) {
            return kind + " at offset " + offset + ": " + message;
        }
        return kind + ": " + message;
    }

    /**
     * What happened. Every kind is recoverable; fatal conditions are
     * exceptions, not diagnostics.
     */
    public enum Kind {
        /** The canonical parse root does not cover the whole input. */
        PARTIAL_PARSE,
        /** Several same width parse roots competed for the canonical root. */
        AMBIGUOUS_ROOT,
        /** A top level expression could not be evaluated and was skipped. */
        SEMANTIC_ERROR,
        /** An implication could not be turned into a monotone rule. */
        RULE_SKIPPED,
        /** Saturation hit its pass bound before reaching a fixed point. */
        INFERENCE_NON_TERMINATION;

        /**
         * Whether this kind means some input was dropped from the output.
         */
        public boolean isError() {
            return this == SEMANTIC_ERROR;
        }
    }
}
