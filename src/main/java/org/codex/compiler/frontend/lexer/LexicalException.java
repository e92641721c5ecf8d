package org.codex.compiler.frontend.lexer;

import org.codex.compiler.diagnostics.ErrorKind;

/**
 * Signals a malformed line or value. It does not know its position; the {@link Lexer}
 * attaches the file name and line number when converting it into a
 * {@link org.codex.compiler.diagnostics.CompilationException}.
 */
public class LexicalException extends Exception {

    private final ErrorKind kind;

    public LexicalException(ErrorKind kind, String reason) {
        super(reason);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
