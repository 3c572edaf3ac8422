package org.minic.compiler.frontend.lexer;

import org.minic.compiler.api.CompilationException;
import org.minic.compiler.api.CompilerErrorCode;
import org.minic.compiler.api.SourceInfo;

/**
 * Thrown when the {@link Lexer} meets a character it cannot turn into a token.
 * The first such character aborts the scan; no tokens are returned for the input.
 */
public class LexerException extends CompilationException {

    private final CompilerErrorCode errorCode;
    private final String reason;
    private final SourceInfo sourceInfo;

    /**
     * Creates a new lexer exception.
     * @param errorCode The error code identifying the kind of failure.
     * @param reason The message without position, e.g. {@code Unexpected character: 9}.
     * @param sourceInfo The position of the offending character.
     */
    public LexerException(CompilerErrorCode errorCode, String reason, SourceInfo sourceInfo) {
        super(reason, sourceInfo);
        this.errorCode = errorCode;
        this.reason = reason;
        this.sourceInfo = sourceInfo;
    }

    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    public String getReason() {
        return reason;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    /**
     * Formats the error as {@code file:line:column: reason}.
     * @return The formatted diagnostic.
     */
    public String toDiagnostic() {
        return sourceInfo.location() + ": " + reason;
    }
}
