package org.kifexport.tool.export;

import java.io.IOException;
import java.io.Writer;

/**
 * Where tables are written, one writer per table.
 */
@FunctionalInterface
public interface TableSink {
    /**
     * Open the destination of a table. The caller closes it.
     */
    Writer open(String table) throws IOException;
}
