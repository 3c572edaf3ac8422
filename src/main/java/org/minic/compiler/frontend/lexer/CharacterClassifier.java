package org.minic.compiler.frontend.lexer;

import org.minic.compiler.api.CompilerErrorCode;
import org.minic.compiler.api.SourceInfo;

/**
 * Stateless classification of single characters and completed lexemes.
 * <p>
 * Characters are passed as Unicode code points so that supplementary characters
 * are classified as one character, not as two surrogates.
 */
public final class CharacterClassifier {

    private static final String INT_KEYWORD = "Int";
    private static final String RETURN_KEYWORD = "Return";

    private CharacterClassifier() {}

    /**
     * Maps one of the five punctuation characters to its token.
     *
     * @param codePoint One of {@code { } ( ) ;}.
     * @param position The position of the character, used for the token and for the error.
     * @return The punctuation token.
     * @throws LexerException if the character is not a punctuation character.
     */
    public static Token primitiveToToken(int codePoint, SourceInfo position) throws LexerException {
        TokenType type = switch (codePoint) {
            case '{' -> TokenType.OPEN_BRACE;
            case '}' -> TokenType.CLOSE_BRACE;
            case '(' -> TokenType.OPEN_PARENTHESIS;
            case ')' -> TokenType.CLOSE_PARENTHESIS;
            case ';' -> TokenType.SEMICOLON;
            default -> throw new LexerException(CompilerErrorCode.UNEXPECTED_CHARACTER,
                    "Unexpected character: " + Character.toString(codePoint), position);
        };
        return Token.of(type, Character.toString(codePoint), position.lineNumber(), position.columnNumber());
    }

    /**
     * Maps a completed identifier lexeme to a keyword token if it is spelled exactly like one,
     * otherwise to an identifier token. Matching is case-sensitive: {@code int} is an identifier.
     *
     * @param lexeme A non-empty identifier lexeme.
     * @param position The position of the first character of the lexeme.
     * @return The keyword or identifier token.
     */
    public static Token stringToToken(String lexeme, SourceInfo position) {
        return switch (lexeme) {
            case INT_KEYWORD -> Token.of(TokenType.INT_KEYWORD, lexeme, position.lineNumber(), position.columnNumber());
            case RETURN_KEYWORD -> Token.of(TokenType.RETURN_KEYWORD, lexeme, position.lineNumber(), position.columnNumber());
            default -> Token.identifier(lexeme, position.lineNumber(), position.columnNumber());
        };
    }

    public static boolean isPunctuation(int codePoint) {
        return codePoint == '{' || codePoint == '}' || codePoint == '(' || codePoint == ')' || codePoint == ';';
    }

    /**
     * Unicode White_Space: the space separators, tab through carriage return, and NEL.
     * {@link Character#isWhitespace(int)} is not used since it accepts U+001C-U+001F and rejects no-break spaces.
     */
    public static boolean isWhitespace(int codePoint) {
        return Character.isSpaceChar(codePoint) || (codePoint >= '\t' && codePoint <= '\r') || codePoint == '\u0085';
    }

    public static boolean isIdentifierStart(int codePoint) {
        return Character.isAlphabetic(codePoint) || codePoint == '_';
    }

    public static boolean isIdentifierPart(int codePoint) {
        return isIdentifierStart(codePoint) || isNumeric(codePoint);
    }

    /**
     * Checks for the characters that may continue an integer literal: digits, the hex letters
     * in either case (the lowercase ones include the binary prefix {@code b}) and the prefixes
     * {@code o} and {@code x}. Prefixes are lowercase only.
     */
    public static boolean isIntegerLiteralChar(int codePoint) {
        return (codePoint >= '0' && codePoint <= '9')
                || (codePoint >= 'a' && codePoint <= 'f')
                || (codePoint >= 'A' && codePoint <= 'F')
                || codePoint == 'o' || codePoint == 'x';
    }

    private static boolean isNumeric(int codePoint) {
        int type = Character.getType(codePoint);
        return type == Character.DECIMAL_DIGIT_NUMBER
                || type == Character.LETTER_NUMBER
                || type == Character.OTHER_NUMBER;
    }
}
