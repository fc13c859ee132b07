package org.mdacademic.compiler.frontend.parser;

import org.mdacademic.compiler.api.ParseException;
import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.frontmatter.FrontMatter;
import org.mdacademic.compiler.frontend.frontmatter.FrontMatterParser;
import org.mdacademic.compiler.frontend.parser.ast.Document;

/**
 * Parses a complete source into a {@link Document}: front matter first, then the body as blocks.
 */
public class Parser {

    private final FrontMatterParser frontMatterParser = new FrontMatterParser();
    private final BlockParser blockParser;

    /**
     * @param diagnostics The engine receiving parser warnings.
     */
    public Parser(DiagnosticsEngine diagnostics) {
        this.blockParser = new BlockParser(diagnostics);
    }

    /**
     * @param source The source text.
     * @return The document.
     * @throws ParseException if the front matter is malformed.
     */
    public Document parse(String source) throws ParseException {
        FrontMatter frontMatter = frontMatterParser.parse(source);
        return new Document(frontMatter.metadata(), blockParser.parseBlocks(frontMatter.body()));
    }
}
