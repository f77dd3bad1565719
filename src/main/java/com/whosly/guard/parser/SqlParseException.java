package com.whosly.guard.parser;

/**
 * Exception thrown when the grammar parser rejects a statement.
 */
public class SqlParseException extends Exception {

    public SqlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
