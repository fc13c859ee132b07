package org.mdacademic.compiler.frontend.parser;

import org.mdacademic.compiler.frontend.lexer.Lexer;
import org.mdacademic.compiler.frontend.parser.ast.AppendixMarker;
import org.mdacademic.compiler.frontend.parser.ast.PageBreak;
import org.mdacademic.compiler.frontend.parser.ast.TableOfContents;
import org.mdacademic.compiler.frontend.parser.ast.ThematicBreak;
import org.mdacademic.compiler.frontend.parser.features.code.FencedCodeRecognizer;
import org.mdacademic.compiler.frontend.parser.features.description.DescriptionListRecognizer;
import org.mdacademic.compiler.frontend.parser.features.environment.EnvironmentRecognizer;
import org.mdacademic.compiler.frontend.parser.features.footnote.FootnoteDefinitionRecognizer;
import org.mdacademic.compiler.frontend.parser.features.heading.HeadingRecognizer;
import org.mdacademic.compiler.frontend.parser.features.html.HtmlBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.features.list.ListRecognizer;
import org.mdacademic.compiler.frontend.parser.features.marker.SingleLineRecognizer;
import org.mdacademic.compiler.frontend.parser.features.math.DisplayMathRecognizer;
import org.mdacademic.compiler.frontend.parser.features.quote.BlockQuoteRecognizer;
import org.mdacademic.compiler.frontend.parser.features.table.TableRecognizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A registry for block recognizers. Recognizers are tried in registration order; the first one that
 * claims a line wins, so the order is the block priority.
 */
public class BlockRecognizerRegistry {

    private final List<IBlockRecognizer> recognizers = new ArrayList<>();

    /**
     * Registers a recognizer with the lowest priority so far.
     * @param recognizer The recognizer.
     */
    public void register(IBlockRecognizer recognizer) {
        recognizers.add(recognizer);
    }

    /**
     * @return The recognizers in priority order.
     */
    public List<IBlockRecognizer> recognizers() {
        return Collections.unmodifiableList(recognizers);
    }

    /**
     * Initializes the registry with all built-in recognizers in their fixed priority order.
     * Paragraphs are not registered; they are the parser's fallback.
     * @return A new registry.
     */
    public static BlockRecognizerRegistry initialize() {
        BlockRecognizerRegistry registry = new BlockRecognizerRegistry();
        registry.register(new HeadingRecognizer());
        registry.register(new SingleLineRecognizer(Lexer::pageBreak, PageBreak::new));
        registry.register(new SingleLineRecognizer(Lexer::appendixMarker, AppendixMarker::new));
        registry.register(new SingleLineRecognizer(Lexer::thematicBreak, ThematicBreak::new));
        registry.register(new SingleLineRecognizer(Lexer::tableOfContents, TableOfContents::new));
        registry.register(new FencedCodeRecognizer());
        registry.register(new DisplayMathRecognizer());
        registry.register(new EnvironmentRecognizer());
        registry.register(new BlockQuoteRecognizer());
        registry.register(new ListRecognizer());
        registry.register(new TableRecognizer());
        registry.register(new DescriptionListRecognizer());
        registry.register(new FootnoteDefinitionRecognizer());
        registry.register(new HtmlBlockRecognizer());
        return registry;
    }
}
