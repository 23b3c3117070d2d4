package io.duomap.validation;

import io.duomap.core.DuomapException;

/**
 * Raised when JSON input cannot be read as a single object of field values.
 * Line and column are 1-based, or -1 when the parser reported no location.
 */
public class JsonInputException extends DuomapException {

    private final int line;
    private final int column;

    public JsonInputException(String message, Throwable cause, int line, int column) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public JsonInputException(String message) {
        this(message, null, -1, -1);
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
