package org.codex.runtime;

import com.typesafe.config.Config;

/**
 * Describes one top-level corpus of the root table.
 *
 * @param name        The name the corpus is bound to in the root module.
 * @param resource    The classpath resource holding the corpus, either notation or precompiled JSON.
 * @param description A short human-readable description.
 */
public record CorpusDescriptor(String name, String resource, String description) {

    /**
     * Reads a descriptor from one entry of {@code codex.corpora}.
     */
    public static CorpusDescriptor fromConfig(Config config) {
        String description = config.hasPath("description") ? config.getString("description") : "";
        return new CorpusDescriptor(config.getString("name"), config.getString("resource"), description);
    }

    public boolean isPrecompiled() {
        return resource.endsWith(".json");
    }
}
