package io.github.rfplot.exception;

public enum ErrorKind {
    IO,
    PARSE,
    CONSISTENCY,
    MISSING_REFERENCE
}
