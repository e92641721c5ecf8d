package org.codex.compiler.frontend.semantics;

import org.codex.compiler.diagnostics.CompilationException;
import org.codex.compiler.diagnostics.ErrorKind;
import org.codex.compiler.frontend.parser.ScopeEntry;
import org.codex.compiler.frontend.preprocessor.Declaration;
import org.codex.compiler.frontend.preprocessor.ModifierDeprecation;
import org.codex.runtime.model.Binding;
import org.codex.runtime.model.Def;
import org.codex.runtime.model.Modifier;
import org.codex.runtime.model.ModifierSet;
import org.codex.runtime.model.Symbol;
import org.codex.runtime.model.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the alias declarations of one module scope into symbol bindings.
 * <p>
 * An alias {@code name @= target.m1.m2} takes every variant of the sibling symbol {@code target}
 * whose modifiers include {@code m1} and {@code m2}, and strips those modifiers. Without the deep
 * marker ({@code .*}) only variants with nothing left over are kept; with it, the remaining
 * modifiers stay on the alias's variants. A single remaining variant without modifiers collapses
 * the alias into a plain symbol.
 * <p>
 * Only direct definitions of the same scope can be targeted. Aliases of aliases are rejected.
 */
public class AliasResolver {

    private static final Logger LOG = LoggerFactory.getLogger(AliasResolver.class);

    private final String fileName;

    /**
     * @param fileName The logical file name used in error messages.
     */
    public AliasResolver(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Resolves all aliases of a scope.
     * @param direct  The scope's directly declared bindings.
     * @param aliases The scope's alias declarations, in source order.
     * @return One binding per alias, in the same order.
     * @throws CompilationException if an alias targets a missing symbol, a missing variant or another alias.
     */
    public List<ScopeEntry> resolve(List<ScopeEntry> direct, List<Declaration.Alias> aliases) {
        if (aliases.isEmpty()) {
            return List.of();
        }
        Map<String, ScopeEntry> byName = new HashMap<>();
        for (ScopeEntry entry : direct) {
            byName.put(entry.name(), entry);
        }
        Set<String> aliasNames = new HashSet<>();
        for (Declaration.Alias alias : aliases) {
            aliasNames.add(alias.name());
        }

        List<ScopeEntry> resolved = new ArrayList<>(aliases.size());
        for (Declaration.Alias alias : aliases) {
            resolved.add(resolveOne(alias, byName, aliasNames));
        }
        return resolved;
    }

    private ScopeEntry resolveOne(Declaration.Alias alias, Map<String, ScopeEntry> byName, Set<String> aliasNames) {
        if (aliasNames.contains(alias.target())) {
            throw error(ErrorKind.ALIAS_TO_ALIAS, alias,
                    "alias '" + alias.name() + "' refers to alias '" + alias.target() + "'");
        }
        ScopeEntry target = byName.get(alias.target());
        if (target == null) {
            throw error(ErrorKind.ALIAS_TO_NONEXISTENT_SYMBOL, alias,
                    "alias '" + alias.name() + "' refers to nonexistent symbol '" + alias.target() + "'");
        }
        Def def = target.binding().def();
        if (!(def instanceof Symbol symbol)) {
            throw error(ErrorKind.ALIAS_TO_NONEXISTENT_SYMBOL, alias,
                    "alias '" + alias.name() + "' refers to module '" + alias.target() + "', not a symbol");
        }

        List<Variant> variants = new ArrayList<>();
        for (Variant variant : symbol.variants()) {
            Optional<ModifierSet> leftover = strip(variant.modifiers(), alias.path());
            if (leftover.isEmpty() || (!leftover.get().isEmpty() && !alias.deep())) {
                continue;
            }
            variants.add(variant.withModifiers(leftover.get()));
        }
        if (variants.isEmpty()) {
            throw error(ErrorKind.ALIAS_TO_NONEXISTENT_VARIANT, alias,
                    "alias '" + alias.name() + "' refers to nonexistent variant '" + describeTarget(alias) + "'");
        }
        variants = ModifierDeprecation.attachAll(variants, alias.modifierDeprecations(), fileName);

        Binding binding;
        if (variants.size() == 1 && variants.get(0).modifiers().isEmpty()) {
            Variant only = variants.get(0);
            String deprecation = alias.deprecation() != null ? alias.deprecation() : only.deprecation();
            binding = new Binding(new Symbol.Single(only.value()), deprecation);
        } else {
            binding = new Binding(new Symbol.Multi(variants), alias.deprecation());
        }
        LOG.debug("{}:{}: alias '{}' resolved to {} variant(s) of '{}'",
                fileName, alias.line(), alias.name(), variants.size(), describeTarget(alias));
        return new ScopeEntry(alias.name(), binding, alias.line());
    }

    /**
     * Removes the alias path from a variant's modifiers.
     * <p>
     * The path is first matched as a prefix of the modifiers in their written order. If that fails,
     * the path's modifiers are matched by name anywhere in the set and the unmatched modifiers are
     * kept in the order they were written.
     *
     * @param modifiers The variant's modifiers.
     * @param path      The alias path.
     * @return The leftover modifiers, or empty if the variant does not carry every path modifier.
     */
    static Optional<ModifierSet> strip(ModifierSet modifiers, List<String> path) {
        List<Modifier> tokens = modifiers.modifiers();
        if (isPrefix(tokens, path)) {
            return Optional.of(ModifierSet.of(tokens.subList(path.size(), tokens.size())));
        }

        Set<String> remaining = new LinkedHashSet<>(path);
        List<Modifier> leftover = new ArrayList<>();
        for (Modifier token : tokens) {
            if (!remaining.remove(token.name())) {
                leftover.add(token);
            }
        }
        if (!remaining.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ModifierSet.of(leftover));
    }

    private static boolean isPrefix(List<Modifier> tokens, List<String> path) {
        if (path.size() > tokens.size()) return false;
        for (int i = 0; i < path.size(); i++) {
            if (!tokens.get(i).name().equals(path.get(i))) return false;
        }
        return true;
    }

    private static String describeTarget(Declaration.Alias alias) {
        StringBuilder sb = new StringBuilder(alias.target());
        for (String modifier : alias.path()) {
            sb.append('.').append(modifier);
        }
        if (alias.deep()) {
            sb.append(".*");
        }
        return sb.toString();
    }

    private CompilationException error(ErrorKind kind, Declaration.Alias alias, String reason) {
        return new CompilationException(kind, fileName, alias.line(), reason);
    }
}
