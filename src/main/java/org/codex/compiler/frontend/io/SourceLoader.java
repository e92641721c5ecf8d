package org.codex.compiler.frontend.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Centralizes source loading for the notation compiler: supports local filesystem paths
 * and classpath resources. Sources are always read as UTF-8.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The name used in diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The path of the notation file.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = path.toString().replace('\\', '/');
        String content = String.join("\n", Files.readAllLines(path, StandardCharsets.UTF_8)) + "\n";
        return new LoadResult(content, logicalName);
    }

    /**
     * Loads content from a classpath resource.
     *
     * @param resourcePath The classpath resource path.
     * @return The loaded content and the resource path as logical name.
     * @throws IOException If the resource is not found or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SourceLoader.class.getClassLoader();
        }
        try (InputStream is = loader.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String content = br.lines().collect(Collectors.joining("\n")) + "\n";
                return new LoadResult(content, resourcePath);
            }
        }
    }
}
