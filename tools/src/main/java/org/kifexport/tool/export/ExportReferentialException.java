package org.kifexport.tool.export;

import org.kifexport.common.exception.FatalException;

/**
 * A row references an id missing from the table it points to. Nothing is
 * written when this is thrown.
 */
public class ExportReferentialException extends FatalException {
    public ExportReferentialException(String message) {
        super(message);
    }
}
