package org.mdacademic.compiler.api;

import org.mdacademic.compiler.frontend.parser.ast.Document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Defines the public interface of the academic Markdown compiler.
 */
public interface ICompiler {

    /**
     * Parses a source text into a document. Parsing is total: every input yields a document unless
     * the front matter is malformed.
     *
     * @param source The complete source, optionally starting with a {@code +++} TOML front matter block.
     * @return The parsed document.
     * @throws ParseException if the front matter is unclosed or not valid TOML.
     */
    Document parse(String source) throws ParseException;

    /**
     * Resolves a parsed document, loading the bibliography named in its front matter relative to
     * {@link ResolveConfig#basePath()}.
     *
     * @param document The parsed document.
     * @param config The resolve configuration.
     * @return The resolved document.
     * @throws ResolutionException on a duplicate label, an unreadable bibliography, or an unknown
     *         reference, citation or footnote under strict configuration.
     */
    ResolvedDocument resolve(Document document, ResolveConfig config) throws ResolutionException;

    /**
     * Resolves a parsed document against a bibliography supplied by the caller. The front matter's
     * bibliography path is ignored.
     *
     * @param document The parsed document.
     * @param bibliography The bibliography by key.
     * @param config The resolve configuration.
     * @return The resolved document.
     * @throws ResolutionException as for {@link #resolve(Document, ResolveConfig)}.
     */
    ResolvedDocument resolve(Document document, Map<String, BibEntry> bibliography, ResolveConfig config)
            throws ResolutionException;

    /**
     * Sets the verbosity level for this compiler's log output. Other instances are not affected.
     * @param level The verbosity level: 0=error, 1=warn, 2=info, 3=debug, 4=trace. Out-of-range values are clamped.
     */
    void setVerbosity(int level);

    /**
     * Parses and resolves a source text.
     * @param source The source text.
     * @param config The resolve configuration.
     * @return The resolved document.
     * @throws CompilationException if parsing or resolution fails.
     */
    default ResolvedDocument compile(String source, ResolveConfig config) throws CompilationException {
        return resolve(parse(source), config);
    }

    /**
     * Compiles a file. Unless the configuration names another base path, the bibliography is looked up
     * next to the file.
     * @param file The source file.
     * @param config The resolve configuration.
     * @return The resolved document.
     * @throws CompilationException if parsing or resolution fails.
     * @throws IOException if the file cannot be read.
     */
    default ResolvedDocument compile(Path file, ResolveConfig config) throws CompilationException, IOException {
        String source = Files.readString(file, StandardCharsets.UTF_8);
        Path parent = file.toAbsolutePath().getParent();
        ResolveConfig effective = config.basePath().equals(Path.of(".")) && parent != null
                ? config.withBasePath(parent)
                : config;
        return compile(source, effective);
    }
}
