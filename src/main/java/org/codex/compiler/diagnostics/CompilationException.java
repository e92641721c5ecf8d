package org.codex.compiler.diagnostics;

/**
 * A fatal error raised while compiling a notation source. Compilation never produces
 * partial output: the first error aborts the whole build.
 * <p>
 * The message has the form {@code file:line: reason}.
 */
public class CompilationException extends RuntimeException {

    private final ErrorKind kind;
    private final String fileName;
    private final int line;
    private final String reason;

    /**
     * @param kind     The error category.
     * @param fileName The logical name of the source being compiled.
     * @param line     The 1-based line number the error was detected on.
     * @param reason   A human-readable description of the problem.
     */
    public CompilationException(ErrorKind kind, String fileName, int line, String reason) {
        super(fileName + ":" + line + ": " + reason);
        this.kind = kind;
        this.fileName = fileName;
        this.line = line;
        this.reason = reason;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String fileName() {
        return fileName;
    }

    public int line() {
        return line;
    }

    public String reason() {
        return reason;
    }
}
