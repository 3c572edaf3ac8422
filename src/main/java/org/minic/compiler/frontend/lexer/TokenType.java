package org.minic.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '{' character. */
    OPEN_BRACE("OpenBrace"),
    /** The '}' character. */
    CLOSE_BRACE("CloseBrace"),
    /** The '(' character. */
    OPEN_PARENTHESIS("OpenParenthesis"),
    /** The ')' character. */
    CLOSE_PARENTHESIS("CloseParenthesis"),
    /** The ';' character. */
    SEMICOLON("Semicolon"),

    // Keywords.
    /** The type keyword, spelled {@code Int}. */
    INT_KEYWORD("IntKeyword"),
    /** The return keyword, spelled {@code Return}. */
    RETURN_KEYWORD("ReturnKeyword"),

    // Literals.
    /** An identifier, such as a variable or function name. */
    IDENTIFIER("Identifier"),
    /** An unsigned integer literal in binary, octal, decimal or hexadecimal notation. */
    INTEGER("Integer");

    private final String displayName;

    TokenType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the name used when a token sequence is dumped for debugging.
     * @return The display name, e.g. {@code OpenBrace}.
     */
    public String displayName() {
        return displayName;
    }
}
