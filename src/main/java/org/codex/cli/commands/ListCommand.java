package org.codex.cli.commands;

import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.codex.cli.CommandLineInterface;
import org.codex.runtime.Codex;
import org.codex.runtime.model.Binding;
import org.codex.runtime.model.Module;
import org.codex.runtime.model.Symbol;
import org.codex.runtime.model.Variant;
import org.codex.runtime.services.SymbolLookup;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Lists the bindings of a module, in name order, with the variants of each symbol.
 */
@Command(
    name = "list",
    description = "List the definitions of a module, e.g. sym.greek"
)
public class ListCommand implements Callable<Integer> {

    @Parameters(
        arity = "0..1",
        paramLabel = "MODULE",
        description = "Dotted module path (default: the root module)"
    )
    private String modulePath = "";

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Module root = Codex.load(parent.getConfig());

        Optional<Module> module = SymbolLookup.findModule(root, modulePath);
        if (module.isEmpty()) {
            err.println("No such module: " + modulePath);
            err.flush();
            return 1;
        }

        for (Module.Entry entry : module.get()) {
            Binding binding = entry.binding();
            String suffix = binding.deprecationMessage().map(m -> "  [deprecated: " + m + "]").orElse("");
            if (binding.def() instanceof Module nested) {
                out.printf("%s {%d}%s%n", entry.name(), nested.size(), suffix);
            } else if (binding.def() instanceof Symbol.Single single) {
                out.printf("%s %s%s%n", entry.name(), single.value(), suffix);
            } else if (binding.def() instanceof Symbol.Multi multi) {
                out.printf("%s%s%n", entry.name(), suffix);
                for (Variant variant : multi.variants()) {
                    String modifiers = variant.modifiers().isEmpty() ? "" : "." + variant.modifiers();
                    String deprecated = variant.deprecationMessage().map(m -> "  [deprecated: " + m + "]").orElse("");
                    out.printf("  %s %s%s%n", modifiers.isEmpty() ? "(default)" : modifiers, variant.value(), deprecated);
                }
            }
        }
        out.flush();
        return 0;
    }
}
