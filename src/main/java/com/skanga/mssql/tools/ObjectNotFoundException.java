package com.skanga.mssql.tools;

import com.skanga.mssql.ToolException;

/**
 * Thrown when a describe tool cannot find the object it was asked about.
 */
public class ObjectNotFoundException extends ToolException {
    public ObjectNotFoundException(String objectKind, String objectName) {
        super(objectKind + " '" + objectName + "' not found.");
    }
}
