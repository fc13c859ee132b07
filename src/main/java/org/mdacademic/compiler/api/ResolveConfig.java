package org.mdacademic.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;

/**
 * Settings for the resolution stage.
 *
 * @param basePath Directory against which the front matter's bibliography path is resolved.
 * @param strictCitations If true, citation keys missing from the bibliography are fatal.
 * @param strictReferences If true, unknown references and undefined footnotes are fatal.
 * @param maxMacroIterations Upper bound on full macro substitution passes.
 */
public record ResolveConfig(
        Path basePath,
        boolean strictCitations,
        boolean strictReferences,
        int maxMacroIterations
) {
    /** Default bound on macro substitution passes. */
    public static final int DEFAULT_MAX_MACRO_ITERATIONS = 10;

    private static final String PREFIX = "mdacademic.resolve.";

    public ResolveConfig {
        if (basePath == null) {
            basePath = Path.of(".");
        }
        if (maxMacroIterations < 1) {
            throw new IllegalArgumentException("maxMacroIterations must be positive, got " + maxMacroIterations);
        }
    }

    /**
     * Lenient configuration rooted at the given directory.
     * @param basePath The base directory.
     * @return A lenient configuration.
     */
    public static ResolveConfig lenient(Path basePath) {
        return new ResolveConfig(basePath, false, false, DEFAULT_MAX_MACRO_ITERATIONS);
    }

    /**
     * Configuration from the classpath defaults ({@code reference.conf}) and any overrides
     * picked up by {@link ConfigFactory#load()}.
     * @return The default configuration.
     */
    public static ResolveConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads the {@code mdacademic.resolve} section of a Typesafe config.
     * @param config The configuration, normally layered over {@code reference.conf}.
     * @return The resolve configuration.
     */
    public static ResolveConfig fromConfig(Config config) {
        return new ResolveConfig(
                Path.of(config.getString(PREFIX + "base-path")),
                config.getBoolean(PREFIX + "strict-citations"),
                config.getBoolean(PREFIX + "strict-references"),
                config.getInt(PREFIX + "max-macro-iterations"));
    }

    /**
     * @param newBasePath The base directory.
     * @return A copy with a different base path.
     */
    public ResolveConfig withBasePath(Path newBasePath) {
        return new ResolveConfig(newBasePath, strictCitations, strictReferences, maxMacroIterations);
    }

    /**
     * @param citations Strict citation checking.
     * @param references Strict reference checking.
     * @return A copy with different strictness flags.
     */
    public ResolveConfig withStrictness(boolean citations, boolean references) {
        return new ResolveConfig(basePath, citations, references, maxMacroIterations);
    }
}
