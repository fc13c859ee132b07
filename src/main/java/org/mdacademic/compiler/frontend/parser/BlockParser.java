package org.mdacademic.compiler.frontend.parser;

import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.lexer.Lexer;
import org.mdacademic.compiler.frontend.parser.ast.Block;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.Paragraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses document text into blocks.
 * <p>
 * Lines are processed top to bottom. Blank lines separate blocks; every other line is offered to the
 * registered recognizers in priority order, and a line no recognizer claims starts a paragraph. Container
 * recognizers call back into {@link #parseBlocks(String)} for their contents.
 */
public class BlockParser implements BlockParsingContext {

    private final BlockRecognizerRegistry registry;
    private final InlineParser inlineParser;
    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a block parser with the built-in recognizers.
     * @param diagnostics The engine receiving parser warnings.
     */
    public BlockParser(DiagnosticsEngine diagnostics) {
        this(BlockRecognizerRegistry.initialize(), new InlineParser(), diagnostics);
    }

    /**
     * @param registry The recognizers, in priority order.
     * @param inlineParser The inline parser.
     * @param diagnostics The engine receiving parser warnings.
     */
    public BlockParser(BlockRecognizerRegistry registry, InlineParser inlineParser, DiagnosticsEngine diagnostics) {
        this.registry = registry;
        this.inlineParser = inlineParser;
        this.diagnostics = diagnostics;
    }

    @Override
    public List<Block> parseBlocks(String text) {
        List<String> lines = text.lines().toList();
        List<Block> blocks = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            if (lines.get(i).isBlank()) {
                i++;
                continue;
            }
            List<String> remaining = lines.subList(i, lines.size());
            BlockMatch match = recognize(remaining).orElseGet(() -> paragraph(remaining));
            blocks.add(match.block());
            i += match.consumed();
        }
        return blocks;
    }

    @Override
    public List<Inline> parseInlines(String text) {
        return inlineParser.parse(text);
    }

    @Override
    public boolean interruptsParagraph(String line) {
        String s = line.stripLeading();
        return Lexer.heading(line).isPresent()
                || Lexer.codeFence(line).isPresent()
                || s.startsWith("$$")
                || s.startsWith(":::")
                || s.startsWith(">")
                || Lexer.thematicBreak(line).isPresent()
                || Lexer.pageBreak(line).isPresent()
                || Lexer.appendixMarker(line).isPresent()
                || Lexer.tableOfContents(line).isPresent()
                || Lexer.listMarker(line).isPresent()
                || Lexer.footnoteDefinition(line).isPresent();
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private Optional<BlockMatch> recognize(List<String> lines) {
        for (IBlockRecognizer recognizer : registry.recognizers()) {
            Optional<BlockMatch> match = recognizer.recognize(lines, this);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private BlockMatch paragraph(List<String> lines) {
        List<String> content = new ArrayList<>();
        content.add(lines.get(0));
        int i = 1;
        while (i < lines.size() && !lines.get(i).isBlank() && !interruptsParagraph(lines.get(i))) {
            content.add(lines.get(i));
            i++;
        }
        return new BlockMatch(new Paragraph(parseInlines(String.join("\n", content))), i);
    }
}
