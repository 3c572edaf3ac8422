package org.minic.compiler.frontend.lexer;

import org.minic.compiler.api.SourceInfo;

/**
 * The mode of the {@link Tokenizer} between two characters.
 */
public sealed interface LexerState permits LexerState.Idle, LexerState.InIdentifier, LexerState.InInteger {

    /** The shared idle state. */
    Idle IDLE = new Idle();

    /**
     * Not inside a multi-character lexeme. This is the initial state and the state after every emitted token.
     */
    record Idle() implements LexerState {}

    /**
     * Collecting an identifier or keyword.
     * @param accumulated The characters read so far, never empty.
     * @param start The position of the first character.
     */
    record InIdentifier(String accumulated, SourceInfo start) implements LexerState {}

    /**
     * Collecting an integer literal.
     * @param value The unsigned magnitude accumulated so far.
     * @param radix The base of the literal, {@link Radix#UNDETERMINED} right after a leading zero.
     * @param lexeme The characters read so far, including any radix prefix.
     * @param start The position of the first character.
     */
    record InInteger(long value, Radix radix, String lexeme, SourceInfo start) implements LexerState {}
}
