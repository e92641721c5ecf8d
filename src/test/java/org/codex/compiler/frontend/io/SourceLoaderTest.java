package org.codex.compiler.frontend.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SourceLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadFileNormalizesLineEndings() throws IOException {
        Path file = tempDir.resolve("corpus.txt");
        Files.writeString(file, "alpha α\r\nbeta β", StandardCharsets.UTF_8);

        SourceLoader.LoadResult result = SourceLoader.loadFile(file);

        assertThat(result.content()).isEqualTo("alpha α\nbeta β\n");
        assertThat(result.logicalName()).endsWith("corpus.txt");
    }

    @Test
    void loadFileFailsForMissingFile() {
        assertThatThrownBy(() -> SourceLoader.loadFile(tempDir.resolve("missing.txt")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void loadClasspathUsesResourcePathAsName() throws IOException {
        SourceLoader.LoadResult result = SourceLoader.loadClasspath("modules/emoji.txt");

        assertThat(result.logicalName()).isEqualTo("modules/emoji.txt");
        assertThat(result.content()).contains("face 😀");
    }

    @Test
    void loadClasspathFailsForMissingResource() {
        assertThatThrownBy(() -> SourceLoader.loadClasspath("does/not/exist.txt"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("does/not/exist.txt");
    }
}
