package org.kifexport.tool.eval;

import org.kifexport.common.exception.ContainedException;

/**
 * A top level expression has a shape the evaluator can't give a meaning to.
 * The expression is skipped, the rest of the document still evaluates.
 */
public class SemanticException extends ContainedException {
    private final int offset;

    public SemanticException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /**
     * Character offset of the offending form.
     */
    public int getOffset() {
        return offset;
    }
}
