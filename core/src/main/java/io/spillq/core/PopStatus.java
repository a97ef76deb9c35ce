package io.spillq.core;

/**
 * Status of a pop into a caller-provided buffer.
 * EMPTY is a normal negative result, not an error.
 */
public enum PopStatus {
    RETRIEVED,
    EMPTY
}
