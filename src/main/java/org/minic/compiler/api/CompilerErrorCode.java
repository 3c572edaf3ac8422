package org.minic.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur while tokenizing.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A character that cannot continue the current lexeme, e.g. a digit outside the active radix. */
    UNEXPECTED_CHARACTER,
    /** A character that belongs to no token class at all, e.g. '@'. */
    UNKNOWN_CHARACTER,
    /** An integer literal whose value does not fit in an unsigned 64-bit magnitude. */
    INTEGER_LITERAL_OUT_OF_RANGE
    // endregion
}
