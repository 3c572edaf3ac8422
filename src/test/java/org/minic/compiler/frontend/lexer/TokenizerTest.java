package org.minic.compiler.frontend.lexer;

import org.minic.compiler.api.CompilerErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Drives the {@link Tokenizer} one character at a time and checks the state after each step,
 * without any stream I/O involved.
 */
@Tag("unit")
class TokenizerTest {

    private Tokenizer tokenizer;

    @BeforeEach
    void setUp() {
        tokenizer = new Tokenizer("state.c");
        tokenizer.beginLine("");
    }

    private void feed(String chars) throws LexerException {
        for (int i = 0; i < chars.length(); i++) {
            tokenizer.accept(chars.charAt(i));
        }
    }

    @Test
    void startsIdle() {
        assertThat(tokenizer.state()).isEqualTo(LexerState.IDLE);
        assertThat(tokenizer.tokens()).isEmpty();
    }

    @Test
    void leadingZeroEntersUndeterminedRadix() throws LexerException {
        feed("0");

        assertThat(tokenizer.state()).isInstanceOfSatisfying(LexerState.InInteger.class, s -> {
            assertThat(s.value()).isZero();
            assertThat(s.radix()).isEqualTo(Radix.UNDETERMINED);
        });
    }

    @Test
    void nonZeroDigitEntersDecimal() throws LexerException {
        feed("7");

        assertThat(tokenizer.state()).isInstanceOfSatisfying(LexerState.InInteger.class, s -> {
            assertThat(s.value()).isEqualTo(7);
            assertThat(s.radix()).isEqualTo(Radix.DECIMAL);
        });
    }

    @Test
    void prefixSelectsRadixWithoutAddingADigit() throws LexerException {
        feed("0x");

        assertThat(tokenizer.state()).isInstanceOfSatisfying(LexerState.InInteger.class, s -> {
            assertThat(s.value()).isZero();
            assertThat(s.radix()).isEqualTo(Radix.HEXADECIMAL);
            assertThat(s.lexeme()).isEqualTo("0x");
        });
    }

    @Test
    void digitAfterLeadingZeroContinuesAsDecimal() throws LexerException {
        feed("07");

        assertThat(tokenizer.state()).isInstanceOfSatisfying(LexerState.InInteger.class, s -> {
            assertThat(s.value()).isEqualTo(7);
            assertThat(s.radix()).isEqualTo(Radix.DECIMAL);
        });
    }

    @Test
    void identifierAccumulatesUntilWhitespace() throws LexerException {
        feed("ab_1");

        assertThat(tokenizer.state()).isInstanceOfSatisfying(LexerState.InIdentifier.class,
                s -> assertThat(s.accumulated()).isEqualTo("ab_1"));
        assertThat(tokenizer.tokens()).isEmpty();

        feed(" ");

        assertThat(tokenizer.state()).isEqualTo(LexerState.IDLE);
        assertThat(tokenizer.tokens()).extracting(Token::type, Token::value)
                .containsExactly(tuple(TokenType.IDENTIFIER, "ab_1"));
    }

    @Test
    void punctuationTerminatesLexemeAndIsEmittedAfterIt() throws LexerException {
        feed("42;");

        assertThat(tokenizer.state()).isEqualTo(LexerState.IDLE);
        assertThat(tokenizer.tokens()).extracting(Token::type)
                .containsExactly(TokenType.INTEGER, TokenType.SEMICOLON);
    }

    @Test
    void endLineFlushesPendingLexemeAndResetsToIdle() throws LexerException {
        feed("Return");

        tokenizer.endLine();

        assertThat(tokenizer.state()).isEqualTo(LexerState.IDLE);
        assertThat(tokenizer.tokens()).extracting(Token::type).containsExactly(TokenType.RETURN_KEYWORD);
    }

    @Test
    void endLineInIdleEmitsNothing() {
        tokenizer.endLine();

        assertThat(tokenizer.tokens()).isEmpty();
    }

    @Test
    void unknownCharacterInIdentifierFails() throws LexerException {
        feed("ab");

        assertThatThrownBy(() -> tokenizer.accept('-'))
                .isInstanceOfSatisfying(LexerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_CHARACTER));
    }

    @Test
    void alphabeticCharacterInIntegerIsUnexpected() throws LexerException {
        feed("12");

        assertThatThrownBy(() -> tokenizer.accept('g'))
                .isInstanceOfSatisfying(LexerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNEXPECTED_CHARACTER));
    }

    @Test
    void nonAlphabeticCharacterInIntegerIsUnknown() throws LexerException {
        feed("12");

        assertThatThrownBy(() -> tokenizer.accept('_'))
                .isInstanceOfSatisfying(LexerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_CHARACTER));
    }

    @Test
    void hexLetterOtherThanPrefixAfterLeadingZeroIsUnexpected() throws LexerException {
        feed("0");

        assertThatThrownBy(() -> tokenizer.accept('a'))
                .isInstanceOfSatisfying(LexerException.class,
                        e -> assertThat(e.getReason()).isEqualTo("Unexpected character: a"));
    }
}
