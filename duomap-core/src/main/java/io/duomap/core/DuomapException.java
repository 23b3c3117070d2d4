package io.duomap.core;

public class DuomapException extends RuntimeException {

    public DuomapException(Throwable cause) {
        super(cause);
    }

    public DuomapException(String message, Throwable cause) {
        super(message, cause);
    }

    public DuomapException(String message) {
        super(message);
    }

}
