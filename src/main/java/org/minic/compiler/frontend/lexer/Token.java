package org.minic.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Identifier, Integer, Semicolon).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: the name of an identifier, the unsigned
 *              magnitude of an integer (as a {@link Long}), {@code null} otherwise.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {

    /**
     * Creates an identifier token.
     */
    static Token identifier(String name, int line, int column) {
        return new Token(TokenType.IDENTIFIER, name, name, line, column);
    }

    /**
     * Creates an integer token. The value is an unsigned 64-bit magnitude.
     */
    static Token integer(long value, String text, int line, int column) {
        return new Token(TokenType.INTEGER, text, value, line, column);
    }

    /**
     * Creates a token that carries no value, i.e. punctuation or a keyword.
     */
    static Token of(TokenType type, String text, int line, int column) {
        return new Token(type, text, null, line, column);
    }

    /**
     * Returns the magnitude of an integer token.
     * @return The value, to be read as unsigned.
     * @throws IllegalStateException if this is not an integer token.
     */
    public long integerValue() {
        if (type != TokenType.INTEGER) {
            throw new IllegalStateException("Not an integer token: " + type);
        }
        return (Long) value;
    }

    /**
     * Formats the token the way a token dump shows it, e.g. {@code Identifier("main")} or {@code Semicolon}.
     * @return The debug representation without position information.
     */
    public String toDebugString() {
        return switch (type) {
            case IDENTIFIER -> type.displayName() + "(\"" + value + "\")";
            case INTEGER -> type.displayName() + "(" + Long.toUnsignedString((Long) value) + ")";
            default -> type.displayName();
        };
    }
}
