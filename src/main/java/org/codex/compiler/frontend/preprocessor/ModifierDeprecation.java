package org.codex.compiler.frontend.preprocessor;

import org.codex.compiler.diagnostics.CompilationException;
import org.codex.compiler.diagnostics.ErrorKind;
import org.codex.runtime.model.ModifierSet;
import org.codex.runtime.model.Variant;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code @deprecated(modifier): message} annotation waiting to be attached to a variant.
 *
 * @param line      The line the annotation was written on.
 * @param modifiers The exact modifier set of the deprecated variant.
 * @param message   The deprecation message.
 */
public record ModifierDeprecation(int line, ModifierSet modifiers, String message) {

    /**
     * Attaches each annotation to every variant whose modifier set equals the annotated one.
     *
     * @param variants     The variants of one symbol.
     * @param deprecations The annotations collected for that symbol.
     * @param fileName     The logical file name used in error messages.
     * @return A copy of the variants with the deprecation messages applied.
     * @throws CompilationException if two annotations name the same set, or one matches no variant.
     */
    public static List<Variant> attachAll(List<Variant> variants, List<ModifierDeprecation> deprecations, String fileName) {
        List<Variant> result = new ArrayList<>(variants);
        for (int i = 0; i < deprecations.size(); i++) {
            ModifierDeprecation deprecation = deprecations.get(i);
            for (int j = 0; j < i; j++) {
                if (deprecations.get(j).modifiers().equals(deprecation.modifiers())) {
                    throw new CompilationException(ErrorKind.DUPLICATE_DEPRECATION, fileName, deprecation.line(),
                            "duplicate `@deprecated(" + deprecation.modifiers() + "):` annotation");
                }
            }
            boolean attached = false;
            for (int k = 0; k < result.size(); k++) {
                if (result.get(k).modifiers().equals(deprecation.modifiers())) {
                    result.set(k, result.get(k).withDeprecation(deprecation.message()));
                    attached = true;
                }
            }
            if (!attached) {
                throw new CompilationException(ErrorKind.DANGLING_DEPRECATION, fileName, deprecation.line(),
                        "dangling `@deprecated(" + deprecation.modifiers() + "):`, no variant has exactly these modifiers");
            }
        }
        return result;
    }
}
