package org.minic.compiler.frontend.lexer;

import org.minic.compiler.api.CompilationException;
import org.minic.compiler.api.ILexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a line-oriented stream of characters (source code) into a sequence of tokens.
 * <p>
 * Each call runs a fresh {@link Tokenizer}, so a Lexer can be reused for any number of inputs.
 */
public class Lexer implements ILexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String logicalFileName;

    /**
     * Creates a new Lexer for in-memory sources.
     */
    public Lexer() {
        this("<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param logicalFileName The name of the file being tokenized, for error reporting.
     */
    public Lexer(String logicalFileName) {
        this.logicalFileName = logicalFileName;
    }

    @Override
    public List<Token> tokenize(BufferedReader reader) throws CompilationException, IOException {
        Tokenizer tokenizer = new Tokenizer(logicalFileName);
        String line;
        while ((line = reader.readLine()) != null) {
            tokenizer.scanLine(line);
        }
        return finish(tokenizer);
    }

    @Override
    public List<Token> tokenize(List<String> sourceLines) throws CompilationException {
        Tokenizer tokenizer = new Tokenizer(logicalFileName);
        for (String line : sourceLines) {
            tokenizer.scanLine(line);
        }
        return finish(tokenizer);
    }

    private List<Token> finish(Tokenizer tokenizer) {
        List<Token> tokens = List.copyOf(tokenizer.tokens());
        LOG.debug("Tokenized {} line(s) of '{}' into {} token(s)", tokenizer.linesScanned(), logicalFileName, tokens.size());
        return tokens;
    }
}
