package com.example.excelops.service;

/**
 * Raised when a request cannot be carried out. Always thrown before any sheet state
 * has been changed.
 */
public class SheetOperationException extends RuntimeException {

    private final ErrorKind kind;

    public SheetOperationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static SheetOperationException malformed(String message) {
        return new SheetOperationException(ErrorKind.MALFORMED_REFERENCE, message);
    }

    public static SheetOperationException outOfBounds(String message) {
        return new SheetOperationException(ErrorKind.OUT_OF_BOUNDS, message);
    }

    public static SheetOperationException invalidArgument(String message) {
        return new SheetOperationException(ErrorKind.INVALID_ARGUMENT, message);
    }
}
