package org.minic.compiler.api;

import org.minic.compiler.frontend.lexer.Token;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the minic lexer.
 * <p>
 * Every call scans its input from scratch, so tokenizing the same input twice yields
 * the same tokens or the same error.
 */
public interface ILexer {

    /**
     * Tokenizes a line-oriented character stream. The reader is consumed to its end but not closed.
     *
     * @param reader The source to read lines from.
     * @return The tokens in source order.
     * @throws CompilationException if the source contains an invalid character.
     * @throws IOException if reading from the stream fails.
     */
    List<Token> tokenize(BufferedReader reader) throws CompilationException, IOException;

    /**
     * Tokenizes source code that is already split into lines.
     *
     * @param sourceLines The lines of the source code, without line terminators.
     * @return The tokens in source order.
     * @throws CompilationException if the source contains an invalid character.
     */
    List<Token> tokenize(List<String> sourceLines) throws CompilationException;

    /**
     * Tokenizes a UTF-8 encoded source file.
     *
     * @param sourcePath The path to the source file.
     * @return The tokens in source order.
     * @throws CompilationException if the source contains an invalid character.
     * @throws IOException if the file cannot be opened or read.
     */
    default List<Token> tokenize(Path sourcePath) throws CompilationException, IOException {
        try (BufferedReader reader = Files.newBufferedReader(sourcePath, StandardCharsets.UTF_8)) {
            return tokenize(reader);
        }
    }
}
