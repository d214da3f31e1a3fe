package org.kifexport.parser;

import org.kifexport.common.exception.FatalException;

/**
 * The source contains a character sequence that is not a SUO-KIF token.
 */
public class LexException extends FatalException {
    public LexException(String message, String text, int offset) {
        super(message + " at " + SourceLocation.describe(text, offset), offset);
    }
}
