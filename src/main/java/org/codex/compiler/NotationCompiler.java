package org.codex.compiler;

import org.codex.compiler.diagnostics.CompilationException;
import org.codex.compiler.frontend.io.SourceLoader;
import org.codex.compiler.frontend.lexer.Lexer;
import org.codex.compiler.frontend.lexer.Line;
import org.codex.compiler.frontend.parser.Parser;
import org.codex.compiler.frontend.preprocessor.Declaration;
import org.codex.compiler.frontend.preprocessor.PreProcessor;
import org.codex.runtime.model.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Compiles symbol notation into a frozen {@link Module} tree.
 * <p>
 * Phases: {@link Lexer} classifies lines, {@link PreProcessor} attaches deprecation annotations,
 * {@link Parser} builds the tree and resolves aliases per scope. Every phase fails fast with a
 * {@link CompilationException}; no partial tree is ever returned.
 * <p>
 * Instances are stateless and may be shared between threads.
 */
public class NotationCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(NotationCompiler.class);

    /**
     * Compiles a notation source.
     * @param source      The source text.
     * @param logicalName The file name used in error messages.
     * @return The compiled module.
     * @throws CompilationException if the source is malformed.
     */
    public Module compile(String source, String logicalName) {
        long start = System.nanoTime();
        List<Line> lines = new Lexer(logicalName).lex(source);
        int endOfFile = Math.max(lines.size(), 1);
        List<Declaration> declarations = new PreProcessor(logicalName).process(lines, endOfFile);
        Module module = new Parser(declarations, logicalName, endOfFile).parse();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Compiled {}: {} lines, {} top-level bindings in {} ms", logicalName, lines.size(),
                    module.size(), (System.nanoTime() - start) / 1_000_000);
        }
        return module;
    }

    /**
     * Loads and compiles a notation file.
     * @param path The file to compile.
     * @return The compiled module.
     * @throws IOException if the file cannot be read.
     * @throws CompilationException if the source is malformed.
     */
    public Module compileFile(Path path) throws IOException {
        SourceLoader.LoadResult loaded = SourceLoader.loadFile(path);
        return compile(loaded.content(), loaded.logicalName());
    }

    /**
     * Loads and compiles a notation file from the classpath.
     * @param resourcePath The classpath resource.
     * @return The compiled module.
     * @throws IOException if the resource cannot be read.
     * @throws CompilationException if the source is malformed.
     */
    public Module compileResource(String resourcePath) throws IOException {
        SourceLoader.LoadResult loaded = SourceLoader.loadClasspath(resourcePath);
        return compile(loaded.content(), loaded.logicalName());
    }
}
