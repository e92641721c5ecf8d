package org.codex.cli.commands;

import org.codex.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LookupCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void printsValues() {
        int exitCode = execute("lookup", "sym.arrow.r.double", "emoji.face.cool");

        assertThat(exitCode).describedAs("stderr: %s", err.toString()).isEqualTo(0);
        assertThat(out.toString().lines()).containsExactly("⇒", "😎");
    }

    @Test
    void printsCodepoints() {
        int exitCode = execute("lookup", "-u", "sym.wj");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("U+2060");
    }

    @Test
    void reportsMisses() {
        int exitCode = execute("lookup", "sym.arrow.r", "sym.nope");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString().lines()).containsExactly("→");
        assertThat(err.toString()).contains("No such symbol: sym.nope");
    }

    @Test
    void warnsAboutDeprecations() {
        int exitCode = execute("lookup", "sym.rarrow");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString().trim()).isEqualTo("→");
        assertThat(err.toString()).contains("warning: deprecated sym.rarrow: use `arrow.r` instead");
    }

    @Test
    void requiresAPath() {
        int exitCode = execute("lookup");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("PATH");
    }

    @Test
    void describesCodepoints() {
        assertThat(LookupCommand.describeCodepoints("❤\uFE0F")).isEqualTo("U+2764 U+FE0F");
        assertThat(LookupCommand.describeCodepoints("😀")).isEqualTo("U+1F600");
    }
}
