package org.kifexport.common;

/**
 * Naming conventions for logging.
 */
public final class LoggingNames {

    private LoggingNames() {
        // utility class, should not be constructed
    }

    /** MDC key holding the id of the top level expression being evaluated. */
    public static final String EXPRESSION_ID = "kif-expression";
    /** MDC key holding the name of the pipeline stage currently running. */
    public static final String STAGE = "kif-stage";

}
