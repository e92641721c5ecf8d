package org.codex.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.codex.cli.CommandLineInterface;
import org.codex.compiler.NotationCompiler;
import org.codex.compiler.backend.emit.ModuleJsonCodec;
import org.codex.compiler.backend.verify.VariantAmbiguityCheck;
import org.codex.compiler.diagnostics.CompilationException;
import org.codex.runtime.model.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Compiles one notation file and prints the JSON encoding of the resulting module.
 * Exit codes: 0 on success, 1 on compilation or I/O errors, 2 if {@code --verify} finds ambiguities.
 */
@Command(
    name = "compile",
    description = "Compile a symbol notation file and print the module as JSON"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Notation file to compile"
    )
    private Path file;

    @Option(
        names = {"-o", "--output"},
        description = "Write the JSON to this file instead of standard output"
    )
    private Path output;

    @Option(
        names = {"--compact"},
        description = "Emit compact JSON instead of pretty-printed JSON"
    )
    private boolean compact;

    @Option(
        names = {"--verify"},
        description = "Check that no symbol has ambiguous variants"
    )
    private boolean verify;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        parent.getConfig();

        Module module;
        try {
            module = new NotationCompiler().compileFile(file);
        } catch (CompilationException e) {
            log.error("Compilation failed: {}", e.getMessage());
            err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Cannot read {}: {}", file, e.getMessage());
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return 1;
        }

        if (verify) {
            List<VariantAmbiguityCheck.Problem> problems = new VariantAmbiguityCheck().check(module, "");
            if (!problems.isEmpty()) {
                problems.forEach(problem -> err.println("ambiguous: " + problem));
                return 2;
            }
        }

        String json = ModuleJsonCodec.toJson(module, !compact);
        if (output == null) {
            out.println(json);
            out.flush();
            return 0;
        }
        try {
            Files.writeString(output, json + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: cannot write " + output + ": " + e.getMessage());
            return 1;
        }
        out.printf("Wrote %d top-level bindings to %s%n", module.size(), output);
        out.flush();
        return 0;
    }
}
