package org.codex.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.codex.compiler.NotationCompiler;
import org.codex.compiler.backend.emit.ModuleJsonCodec;
import org.codex.compiler.frontend.io.SourceLoader;
import org.codex.runtime.model.Binding;
import org.codex.runtime.model.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Entry point to the bundled symbol tables.
 * <p>
 * {@link #root()} returns the process-wide root module, which binds every corpus listed under
 * {@code codex.corpora} in the configuration. It is built on first access and never changes
 * afterwards, so it can be read from any number of threads without locking.
 */
public final class Codex {

    private static final Logger LOG = LoggerFactory.getLogger(Codex.class);

    /** Configuration path listing the corpora bound in the root module. */
    public static final String CORPORA_PATH = "codex.corpora";

    private Codex() {}

    // Class initialization publishes ROOT safely to all threads.
    private static final class RootHolder {
        static final Module ROOT = load(ConfigFactory.load());
    }

    /**
     * Returns the root module containing all bundled corpora.
     */
    public static Module root() {
        return RootHolder.ROOT;
    }

    /**
     * Named general symbols.
     */
    public static Module sym() {
        return corpus("sym");
    }

    /**
     * Named emoji.
     */
    public static Module emoji() {
        return corpus("emoji");
    }

    private static Module corpus(String name) {
        return root().get(name)
                .map(Binding::def)
                .filter(Module.class::isInstance)
                .map(Module.class::cast)
                .orElseThrow(() -> new NoSuchElementException("No corpus named '" + name + "' is configured"));
    }

    /**
     * Reads the corpus descriptors from a configuration.
     */
    public static List<CorpusDescriptor> corpora(Config config) {
        List<CorpusDescriptor> corpora = new ArrayList<>();
        for (Config entry : config.getConfigList(CORPORA_PATH)) {
            corpora.add(CorpusDescriptor.fromConfig(entry));
        }
        return corpora;
    }

    /**
     * Builds a fresh root module from the corpora listed in the given configuration.
     * @param config The configuration providing {@code codex.corpora}.
     * @return The root module.
     * @throws UncheckedIOException if a corpus resource cannot be read.
     * @throws org.codex.compiler.diagnostics.CompilationException if a corpus is malformed.
     */
    public static Module load(Config config) {
        NotationCompiler compiler = new NotationCompiler();
        List<Module.Entry> entries = new ArrayList<>();
        for (CorpusDescriptor corpus : corpora(config)) {
            Module module = loadCorpus(compiler, corpus);
            LOG.info("Loaded corpus '{}' from {} ({} top-level bindings)", corpus.name(), corpus.resource(), module.size());
            entries.add(new Module.Entry(corpus.name(), Binding.of(module)));
        }
        return Module.of(entries);
    }

    private static Module loadCorpus(NotationCompiler compiler, CorpusDescriptor corpus) {
        try {
            if (corpus.isPrecompiled()) {
                return ModuleJsonCodec.fromJson(SourceLoader.loadClasspath(corpus.resource()).content());
            }
            return compiler.compileResource(corpus.resource());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load corpus '" + corpus.name() + "'", e);
        }
    }
}
