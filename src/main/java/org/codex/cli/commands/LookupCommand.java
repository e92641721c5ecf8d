package org.codex.cli.commands;

import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.codex.cli.CommandLineInterface;
import org.codex.runtime.Codex;
import org.codex.runtime.model.Module;
import org.codex.runtime.services.SymbolLookup;
import org.codex.runtime.services.SymbolLookup.Resolution;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Resolves dotted symbol paths such as {@code sym.arrow.r.double} and prints their values.
 */
@Command(
    name = "lookup",
    description = "Print the value of one or more symbols, e.g. sym.arrow.r.double"
)
public class LookupCommand implements Callable<Integer> {

    @Parameters(
        arity = "1..*",
        paramLabel = "PATH",
        description = "Dotted symbol path: corpus, modules, symbol, then modifiers"
    )
    private List<String> paths;

    @Option(
        names = {"-u", "--codepoints"},
        description = "Also print the code points of each value"
    )
    private boolean codepoints;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Module root = Codex.load(parent.getConfig());

        int exitCode = 0;
        for (String path : paths) {
            Optional<Resolution> resolution = SymbolLookup.resolve(root, path);
            if (resolution.isEmpty()) {
                err.println("No such symbol: " + path);
                exitCode = 1;
                continue;
            }
            Resolution found = resolution.get();
            out.println(codepoints ? found.value() + "\t" + describeCodepoints(found.value()) : found.value());
            for (String deprecation : found.deprecations()) {
                err.println("warning: deprecated " + deprecation);
            }
        }
        out.flush();
        err.flush();
        return exitCode;
    }

    static String describeCodepoints(String value) {
        StringBuilder sb = new StringBuilder();
        value.codePoints().forEach(cp -> {
            if (sb.length() > 0) sb.append(' ');
            sb.append(String.format("U+%04X", cp));
        });
        return sb.toString();
    }
}
