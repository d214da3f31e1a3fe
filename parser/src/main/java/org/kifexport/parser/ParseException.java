package org.kifexport.parser;

import org.kifexport.common.exception.FatalException;

/**
 * A span the token structure requires to be a constituent (a parenthesized
 * form) has no parse.
 */
public class ParseException extends FatalException {
    public ParseException(String message, String text, int offset) {
        super(message + " at " + SourceLocation.describe(text, offset), offset);
    }
}
