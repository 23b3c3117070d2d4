package io.duomap.validation;

public record FieldError(String field, String message) {

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
