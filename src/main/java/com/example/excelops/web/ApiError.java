package com.example.excelops.web;

/**
 * Error body returned by every endpoint. {@code kind} is an {@code ErrorKind} name, or
 * {@code ENVIRONMENT} for failures the caller cannot correct.
 */
public record ApiError(String kind, String message) {
}
