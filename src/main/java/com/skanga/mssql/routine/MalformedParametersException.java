package com.skanga.mssql.routine;

import com.skanga.mssql.ToolException;

/**
 * Thrown when routine parameter text cannot be decoded into a name to value map.
 * Nothing has been sent to the database when this is raised.
 */
public class MalformedParametersException extends ToolException {
    public MalformedParametersException(String decoderMessage, Throwable cause) {
        super("Invalid parameter JSON: " + decoderMessage, cause);
    }

    public MalformedParametersException(String decoderMessage) {
        this(decoderMessage, null);
    }
}
