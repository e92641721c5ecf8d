package org.codex.compiler.backend.verify;

import org.codex.runtime.model.Module;
import org.codex.runtime.model.ModifierSet;
import org.codex.runtime.model.Symbol;
import org.codex.runtime.model.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Verifies that no symbol in a module tree is ambiguous.
 * <p>
 * For every symbol, each request made of up to {@code k} of the symbol's modifier names
 * ({@code k} being the largest modifier count of any variant) is matched against the variants.
 * The request is ambiguous if two or more eligible variants share the best rank, since the
 * winner would then depend on declaration order alone.
 */
public class VariantAmbiguityCheck {

    private static final Logger LOG = LoggerFactory.getLogger(VariantAmbiguityCheck.class);

    /**
     * An ambiguous request.
     *
     * @param symbolPath The dotted path of the symbol, e.g. {@code sym.arrow}.
     * @param request    The ambiguous request.
     * @param tied       The variants tied for the best rank.
     */
    public record Problem(String symbolPath, ModifierSet request, List<Variant> tied) {

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(symbolPath);
            if (!request.isEmpty()) {
                sb.append('.').append(request);
            }
            sb.append(" is ambiguous between");
            for (Variant variant : tied) {
                sb.append(" [").append(variant.modifiers()).append(" -> ").append(variant.value()).append(']');
            }
            return sb.toString();
        }
    }

    /**
     * Checks a module tree.
     * @param module   The root to check.
     * @param rootPath The path prefix for problem reports, may be empty.
     * @return All ambiguous requests; empty if the tree is unambiguous.
     */
    public List<Problem> check(Module module, String rootPath) {
        List<Problem> problems = new ArrayList<>();
        checkModule(module, rootPath, problems);
        if (!problems.isEmpty()) {
            LOG.warn("Found {} ambiguous request(s) under '{}'", problems.size(), rootPath);
        }
        return problems;
    }

    private void checkModule(Module module, String path, List<Problem> problems) {
        for (Module.Entry entry : module) {
            String childPath = path.isEmpty() ? entry.name() : path + "." + entry.name();
            if (entry.binding().def() instanceof Module nested) {
                checkModule(nested, childPath, problems);
            } else if (entry.binding().def() instanceof Symbol symbol) {
                checkSymbol(symbol, childPath, problems);
            }
        }
    }

    private void checkSymbol(Symbol symbol, String path, List<Problem> problems) {
        List<Variant> variants = symbol.variants();
        Set<String> names = new LinkedHashSet<>();
        int maxSize = 0;
        for (Variant variant : variants) {
            names.addAll(variant.modifiers().names());
            maxSize = Math.max(maxSize, variant.modifiers().size());
        }
        List<String> pool = new ArrayList<>(names);
        collectRequests(pool, 0, maxSize, ModifierSet.EMPTY, request -> {
            List<Variant> tied = tiedForBest(request, variants);
            if (tied.size() > 1) {
                problems.add(new Problem(path, request, tied));
            }
        });
    }

    private void collectRequests(List<String> pool, int from, int budget, ModifierSet request,
                                 Consumer<ModifierSet> sink) {
        sink.accept(request);
        if (budget == 0) return;
        for (int i = from; i < pool.size(); i++) {
            collectRequests(pool, i + 1, budget - 1, request.insertRaw(pool.get(i)), sink);
        }
    }

    private static List<Variant> tiedForBest(ModifierSet request, List<Variant> variants) {
        List<Variant> tied = new ArrayList<>();
        int bestCommon = -1;
        int bestTotal = Integer.MAX_VALUE;
        for (Variant variant : variants) {
            ModifierSet set = variant.modifiers();
            if (!request.admits(set)) continue;
            int common = request.countCommon(set);
            int total = set.size();
            if (common > bestCommon || (common == bestCommon && total < bestTotal)) {
                tied.clear();
                bestCommon = common;
                bestTotal = total;
            }
            if (common == bestCommon && total == bestTotal) {
                tied.add(variant);
            }
        }
        return tied;
    }
}
