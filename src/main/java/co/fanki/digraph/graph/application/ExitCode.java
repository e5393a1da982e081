package co.fanki.digraph.graph.application;

import co.fanki.digraph.graph.domain.FilterDirection;
import co.fanki.digraph.graph.domain.GraphBuilder;

/**
 * Process exit codes of the command line shell.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ExitCode {

    /** Successful execution. */
    SUCCESS(0),

    /** Unexpected failure, including output write errors. */
    GENERAL_ERROR(1),

    /** Invalid or missing command line options. */
    INVALID_ARGUMENTS(2),

    /** The declarations could not be parsed or violate the contract. */
    PARSING_ERROR(4),

    /** The input file does not exist. */
    FILE_NOT_FOUND(7),

    /** The input or output location is not accessible. */
    PERMISSION_ERROR(8);

    private final int code;

    ExitCode(final int theCode) {
        this.code = theCode;
    }

    /**
     * Returns the numeric process exit code.
     *
     * @return the exit code
     */
    public int code() {
        return code;
    }

    /**
     * Classifies a domain error code.
     *
     * @param errorCode the error code of a failure, may be null
     * @return the exit code to terminate with
     */
    public static ExitCode of(final String errorCode) {
        if (errorCode == null) {
            return GENERAL_ERROR;
        }
        return switch (errorCode) {
            case GraphCommand.INVALID_ARGUMENTS,
                    FilterDirection.INVALID_DIRECTION,
                    OutputFormat.INVALID_FORMAT -> INVALID_ARGUMENTS;
            case DeclarationReader.INVALID_INPUT,
                    GraphBuilder.INVALID_DECLARATION -> PARSING_ERROR;
            case GraphCommand.FILE_NOT_FOUND -> FILE_NOT_FOUND;
            case GraphCommand.PERMISSION_DENIED -> PERMISSION_ERROR;
            default -> GENERAL_ERROR;
        };
    }

}
