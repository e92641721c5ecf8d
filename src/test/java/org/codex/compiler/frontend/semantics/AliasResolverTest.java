package org.codex.compiler.frontend.semantics;

import org.codex.compiler.NotationCompiler;
import org.codex.compiler.diagnostics.CompilationException;
import org.codex.compiler.diagnostics.ErrorKind;
import org.codex.runtime.model.Binding;
import org.codex.runtime.model.Module;
import org.codex.runtime.model.ModifierSet;
import org.codex.runtime.model.Symbol;
import org.codex.runtime.model.Variant;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.type;

@Tag("unit")
class AliasResolverTest {

    private static final String ARROWS = """
            dir →
              .r →
              .l ←
            arrow
              .r →
              .r.double ⇒
              .r.double.crossed ⤇
              .l ←
            """;

    private static Module compile(String source) {
        return new NotationCompiler().compile(source, "test.txt");
    }

    private static Variant variant(String modifiers, String value) {
        return new Variant(ModifierSet.fromRawDotted(modifiers), value);
    }

    private static void assertFails(String source, ErrorKind kind, int line) {
        assertThatThrownBy(() -> compile(source))
                .asInstanceOf(type(CompilationException.class))
                .satisfies(e -> {
                    assertThat(e.kind()).isEqualTo(kind);
                    assertThat(e.line()).isEqualTo(line);
                });
    }

    @Test
    void simpleAliasCollapsesToSingle() {
        Module module = compile(ARROWS + "right @= dir.r\n");

        assertThat(module.get("right")).map(Binding::def).contains(new Symbol.Single("→"));
    }

    @Test
    void deepAliasKeepsLeftoverModifiers() {
        Module module = compile(ARROWS + "x @= arrow.r.*\n");

        assertThat(module.get("x")).map(Binding::def).contains(new Symbol.Multi(List.of(
                variant("", "→"),
                variant("double", "⇒"),
                variant("double.crossed", "⤇"))));
    }

    @Test
    void shallowAliasDropsDeeperVariants() {
        Module module = compile(ARROWS + "dbl @= arrow.r.double\n");

        assertThat(module.get("dbl")).map(Binding::def).contains(new Symbol.Single("⇒"));
    }

    @Test
    void deepAliasWithoutPathCopiesAllVariants() {
        Module module = compile(ARROWS + "copy @= arrow.*\n");

        Symbol copy = (Symbol) module.get("copy").orElseThrow().def();
        Symbol arrow = (Symbol) module.get("arrow").orElseThrow().def();
        assertThat(copy.variants()).isEqualTo(arrow.variants());
    }

    @Test
    void aliasOfSingleSymbol() {
        Module module = compile("alpha α\na @= alpha\n");

        assertThat(module.get("a")).map(Binding::def).contains(new Symbol.Single("α"));
    }

    @Test
    void reorderedModifiersAreMatchedByName() {
        Module module = compile("""
                arrow
                  .double.r ⇒
                  .long.double.r ⟹
                  .l ←
                x @= arrow.r.double.*
                """);

        assertThat(module.get("x")).map(Binding::def).contains(new Symbol.Multi(List.of(
                variant("", "⇒"),
                variant("long", "⟹"))));
    }

    @Test
    void aliasCarriesOwnDeprecationNotTargets() {
        Module module = compile("""
                @deprecated: target is old
                arrow
                  .r →
                  .l ←
                @deprecated: use `arrow.r`
                right @= arrow.r
                left @= arrow.l
                """);

        assertThat(module.get("right")).map(Binding::deprecation).contains("use `arrow.r`");
        assertThat(module.get("left")).map(Binding::isDeprecated).contains(false);
    }

    @Test
    void collapsedAliasInheritsVariantDeprecation() {
        Module module = compile("""
                arrow
                  .r →
                  @deprecated(squiggly): use `arrow.r` instead
                  .squiggly ⇝
                wave @= arrow.squiggly
                """);

        assertThat(module.get("wave")).map(Binding::deprecation).contains("use `arrow.r` instead");
    }

    @Test
    void aliasModifierDeprecationApplies() {
        Module module = compile(ARROWS + """
                @deprecated(double.crossed): avoid
                x @= arrow.r.*
                """);

        Symbol x = (Symbol) module.get("x").orElseThrow().def();
        assertThat(x.get("double.crossed")).map(Variant::deprecation).contains("avoid");
        assertThat(x.get("double")).map(Variant::isDeprecated).contains(false);
    }

    @Test
    void aliasToAlias() {
        assertFails(ARROWS + """
                right @= dir.r
                again @= right
                """, ErrorKind.ALIAS_TO_ALIAS, 10);
    }

    @Test
    void aliasToNonexistentSymbol() {
        assertFails(ARROWS + "x @= nothing.r\n", ErrorKind.ALIAS_TO_NONEXISTENT_SYMBOL, 9);
    }

    @Test
    void aliasToModule() {
        assertFails("m {\n  a α\n}\nx @= m\n", ErrorKind.ALIAS_TO_NONEXISTENT_SYMBOL, 4);
    }

    @Test
    void aliasDoesNotSeeNestedModules() {
        assertFails("m {\n  a α\n}\nx @= a\n", ErrorKind.ALIAS_TO_NONEXISTENT_SYMBOL, 4);
    }

    @Test
    void aliasToNonexistentVariant() {
        assertFails(ARROWS + "x @= arrow.t\n", ErrorKind.ALIAS_TO_NONEXISTENT_VARIANT, 9);
        assertFails("alpha α\nx @= alpha.alt\n", ErrorKind.ALIAS_TO_NONEXISTENT_VARIANT, 2);
    }

    @Test
    void shallowAliasNeedsAnExactVariant() {
        assertFails("""
                arrow
                  .r.double ⇒
                x @= arrow.r
                """, ErrorKind.ALIAS_TO_NONEXISTENT_VARIANT, 3);
    }

    @Test
    void stripPrefersWrittenOrder() {
        ModifierSet modifiers = ModifierSet.fromRawDotted("r.double.crossed");

        assertThat(AliasResolver.strip(modifiers, List.of("r"))).contains(ModifierSet.fromRawDotted("double.crossed"));
        assertThat(AliasResolver.strip(modifiers, List.of())).contains(modifiers);
    }

    @Test
    void stripFallsBackToNameMatching() {
        ModifierSet modifiers = ModifierSet.fromRawDotted("long.double.r");

        assertThat(AliasResolver.strip(modifiers, List.of("r", "double")))
                .hasValueSatisfying(leftover -> assertThat(leftover.names()).containsExactly("long"));
        assertThat(AliasResolver.strip(modifiers, List.of("r", "stroked"))).isEmpty();
    }
}
