package org.kifexport.tool.eval;

import org.kifexport.common.exception.ContainedException;

/**
 * An implication can't be compiled into a monotone rule. The implication
 * still evaluates to a concept but won't take part in inference.
 */
public class UnsupportedRuleException extends ContainedException {
    public UnsupportedRuleException(String message) {
        super(message);
    }

    public UnsupportedRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
