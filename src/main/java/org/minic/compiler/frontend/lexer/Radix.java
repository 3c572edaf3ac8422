package org.minic.compiler.frontend.lexer;

/**
 * The base of an integer literal.
 * <p>
 * {@link #UNDETERMINED} is the state right after a leading {@code 0}: the next character
 * decides whether a prefix ({@code b}, {@code o}, {@code x}) follows or the literal is decimal.
 */
public enum Radix {
    UNDETERMINED(0),
    BINARY(2),
    OCTAL(8),
    DECIMAL(10),
    HEXADECIMAL(16);

    private final int base;

    Radix(int base) {
        this.base = base;
    }

    /**
     * Returns the numeric base.
     * @return 2, 8, 10 or 16.
     * @throws IllegalStateException for {@link #UNDETERMINED}, which has no base yet.
     */
    public int base() {
        if (this == UNDETERMINED) {
            throw new IllegalStateException("Radix is not determined yet");
        }
        return base;
    }

    public boolean isDetermined() {
        return this != UNDETERMINED;
    }

    /**
     * Converts a digit character to its value in this radix. This is the only place that decides
     * whether a digit is in range, e.g. {@code '9'} is rejected for {@link #BINARY}.
     *
     * @param codePoint The character to convert.
     * @return The digit value, or -1 if the character is not an ASCII digit of this radix.
     */
    public int digitValue(int codePoint) {
        int value;
        if (codePoint >= '0' && codePoint <= '9') {
            value = codePoint - '0';
        } else if (codePoint >= 'a' && codePoint <= 'z') {
            value = codePoint - 'a' + 10;
        } else if (codePoint >= 'A' && codePoint <= 'Z') {
            value = codePoint - 'A' + 10;
        } else {
            return -1;
        }
        return value < base() ? value : -1;
    }

    /**
     * Resolves the radix selected by the character following a leading {@code 0}.
     *
     * @param codePoint The prefix character.
     * @return The selected radix, or {@code null} if the character is not a radix prefix.
     */
    public static Radix fromPrefix(int codePoint) {
        return switch (codePoint) {
            case 'b' -> BINARY;
            case 'o' -> OCTAL;
            case 'x' -> HEXADECIMAL;
            default -> null;
        };
    }
}
