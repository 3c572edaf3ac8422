package org.minic.compiler.frontend.lexer;

import org.minic.compiler.api.CompilerErrorCode;
import org.minic.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.minic.compiler.frontend.lexer.CharacterClassifier.isIdentifierPart;
import static org.minic.compiler.frontend.lexer.CharacterClassifier.isIdentifierStart;
import static org.minic.compiler.frontend.lexer.CharacterClassifier.isIntegerLiteralChar;
import static org.minic.compiler.frontend.lexer.CharacterClassifier.isPunctuation;
import static org.minic.compiler.frontend.lexer.CharacterClassifier.isWhitespace;
import static org.minic.compiler.frontend.lexer.CharacterClassifier.primitiveToToken;
import static org.minic.compiler.frontend.lexer.CharacterClassifier.stringToToken;

/**
 * The character-driven state machine behind the {@link Lexer}.
 * <p>
 * It is fed one line at a time and consumes each line one code point at a time. Every character
 * moves the machine from its current {@link LexerState} to the next one and may append tokens.
 * At the end of each line a pending identifier or integer is flushed and the state returns to
 * {@link LexerState#IDLE}, so no lexeme spans two lines.
 * <p>
 * An instance scans exactly one input and is not thread-safe.
 */
public final class Tokenizer {

    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private LexerState state = LexerState.IDLE;
    private String lineContent = "";
    private int lineNumber = 0;
    private int column = 0;

    /**
     * Creates a tokenizer in the idle state.
     * @param fileName The logical name of the input, used in error positions.
     */
    public Tokenizer(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Scans one line of input, then flushes any pending lexeme.
     *
     * @param line The line without its terminator.
     * @throws LexerException on the first character that cannot be tokenized.
     */
    public void scanLine(String line) throws LexerException {
        beginLine(line);
        int i = 0;
        while (i < line.length()) {
            int codePoint = line.codePointAt(i);
            accept(codePoint);
            i += Character.charCount(codePoint);
        }
        endLine();
    }

    /**
     * Returns the tokens emitted so far.
     * @return An unmodifiable view of the tokens in source order.
     */
    public List<Token> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    public LexerState state() {
        return state;
    }

    public int linesScanned() {
        return lineNumber;
    }

    void beginLine(String line) {
        lineNumber++;
        lineContent = line;
        column = 0;
    }

    void accept(int codePoint) throws LexerException {
        column++;
        if (state instanceof LexerState.InIdentifier identifier) {
            state = continueIdentifier(identifier, codePoint);
        } else if (state instanceof LexerState.InInteger integer) {
            state = continueInteger(integer, codePoint);
        } else {
            state = startLexeme(codePoint);
        }
    }

    void endLine() {
        flush(state);
        state = LexerState.IDLE;
    }

    private LexerState startLexeme(int c) throws LexerException {
        if (isPunctuation(c)) {
            tokens.add(primitiveToToken(c, position()));
            return LexerState.IDLE;
        }
        if (c == '0') {
            return new LexerState.InInteger(0, Radix.UNDETERMINED, "0", position());
        }
        if (c >= '1' && c <= '9') {
            return new LexerState.InInteger(c - '0', Radix.DECIMAL, Character.toString(c), position());
        }
        if (isIdentifierStart(c)) {
            return new LexerState.InIdentifier(Character.toString(c), position());
        }
        if (isWhitespace(c)) {
            return LexerState.IDLE;
        }
        throw unknownCharacter(c);
    }

    private LexerState continueIdentifier(LexerState.InIdentifier identifier, int c) throws LexerException {
        if (isPunctuation(c)) {
            flush(identifier);
            tokens.add(primitiveToToken(c, position()));
            return LexerState.IDLE;
        }
        if (isIdentifierPart(c)) {
            return new LexerState.InIdentifier(identifier.accumulated() + Character.toString(c), identifier.start());
        }
        if (isWhitespace(c)) {
            flush(identifier);
            return LexerState.IDLE;
        }
        throw unknownCharacter(c);
    }

    private LexerState continueInteger(LexerState.InInteger integer, int c) throws LexerException {
        if (isPunctuation(c)) {
            flush(integer);
            tokens.add(primitiveToToken(c, position()));
            return LexerState.IDLE;
        }
        if (isIntegerLiteralChar(c)) {
            String lexeme = integer.lexeme() + Character.toString(c);
            Radix radix = integer.radix();
            if (radix.isDetermined()) {
                int digit = radix.digitValue(c);
                if (digit < 0) {
                    throw unexpectedCharacter(c);
                }
                return new LexerState.InInteger(accumulate(integer.value(), radix, digit), radix, lexeme, integer.start());
            }
            Radix prefixed = Radix.fromPrefix(c);
            if (prefixed != null) {
                return new LexerState.InInteger(integer.value(), prefixed, lexeme, integer.start());
            }
            if (c >= '0' && c <= '9') {
                return new LexerState.InInteger(accumulate(integer.value(), Radix.DECIMAL, c - '0'), Radix.DECIMAL, lexeme, integer.start());
            }
            throw unexpectedCharacter(c);
        }
        if (isWhitespace(c)) {
            flush(integer);
            return LexerState.IDLE;
        }
        if (Character.isAlphabetic(c)) {
            throw unexpectedCharacter(c);
        }
        throw unknownCharacter(c);
    }

    private void flush(LexerState pending) {
        if (pending instanceof LexerState.InIdentifier identifier) {
            tokens.add(stringToToken(identifier.accumulated(), identifier.start()));
        } else if (pending instanceof LexerState.InInteger integer) {
            SourceInfo start = integer.start();
            tokens.add(Token.integer(integer.value(), integer.lexeme(), start.lineNumber(), start.columnNumber()));
        }
    }

    /**
     * Computes {@code value * radix + digit} on unsigned 64-bit magnitudes.
     */
    private long accumulate(long value, Radix radix, int digit) throws LexerException {
        long limit = Long.divideUnsigned(-1L - digit, radix.base());
        if (Long.compareUnsigned(value, limit) > 0) {
            throw new LexerException(CompilerErrorCode.INTEGER_LITERAL_OUT_OF_RANGE,
                    "Integer literal out of range", position());
        }
        return value * radix.base() + digit;
    }

    private SourceInfo position() {
        return new SourceInfo(fileName, lineNumber, column, lineContent);
    }

    private LexerException unexpectedCharacter(int c) {
        return new LexerException(CompilerErrorCode.UNEXPECTED_CHARACTER,
                "Unexpected character: " + Character.toString(c), position());
    }

    private LexerException unknownCharacter(int c) {
        return new LexerException(CompilerErrorCode.UNKNOWN_CHARACTER,
                "Encountered unknown character: " + Character.toString(c), position());
    }
}
