package org.kifexport.common.exception;

/**
 * Processing of one expression failed and that expression won't contribute
 * to the output, but the rest of the document should proceed.
 */
public class ContainedException extends RuntimeException {
    public ContainedException(String message, Throwable cause) {
        super(message, cause);
    }

    public ContainedException(String message) {
        super(message);
    }
}
