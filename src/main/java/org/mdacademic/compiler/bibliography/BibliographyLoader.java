package org.mdacademic.compiler.bibliography;

import org.mdacademic.compiler.api.BibEntry;
import org.mdacademic.compiler.api.BibliographyParser;
import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.api.ResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the bibliography file named in the front matter.
 */
public class BibliographyLoader {

    private static final Logger LOG = LoggerFactory.getLogger(BibliographyLoader.class);

    private final BibliographyParser parser;

    /**
     * @param parser The parser for the file's content.
     */
    public BibliographyLoader(BibliographyParser parser) {
        this.parser = parser;
    }

    /**
     * Loads a bibliography.
     * @param basePath The directory relative paths are resolved against.
     * @param path The path as written in the front matter; may be null.
     * @return The entries by key; empty when {@code path} is null.
     * @throws ResolutionException with {@link CompilerErrorCode#BIBLIOGRAPHY_UNREADABLE} if the file cannot be
     *         read, or whatever the parser throws for malformed content.
     */
    public Map<String, BibEntry> load(Path basePath, String path) throws ResolutionException {
        if (path == null) {
            return Map.of();
        }
        String content;
        try {
            Path file = basePath.resolve(path);
            LOG.info("Reading bibliography {}", file);
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException e) {
            throw new ResolutionException(CompilerErrorCode.BIBLIOGRAPHY_UNREADABLE,
                    "Cannot read bibliography '" + path + "': " + e.getMessage(), e);
        }
        return parser.parse(content);
    }
}
