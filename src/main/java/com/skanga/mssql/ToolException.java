package com.skanga.mssql;

/**
 * Base class for failures a tool reports back to the caller as an error envelope
 * rather than as a protocol error.
 */
public class ToolException extends Exception {
    public ToolException(String message) {
        super(message);
    }

    public ToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
