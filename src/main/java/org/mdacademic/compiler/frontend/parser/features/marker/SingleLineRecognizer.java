package org.mdacademic.compiler.frontend.parser.features.marker;

import org.mdacademic.compiler.frontend.lexer.Token;
import org.mdacademic.compiler.frontend.parser.BlockMatch;
import org.mdacademic.compiler.frontend.parser.BlockParsingContext;
import org.mdacademic.compiler.frontend.parser.IBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.ast.Block;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Recognizes content-free single-line blocks: page breaks, appendix markers, thematic breaks and the
 * table of contents placeholder.
 */
public class SingleLineRecognizer implements IBlockRecognizer {

    private final Function<String, Optional<Token>> matcher;
    private final Supplier<Block> factory;

    /**
     * @param matcher The lexer method recognizing the marker line.
     * @param factory Creates the block for a matching line.
     */
    public SingleLineRecognizer(Function<String, Optional<Token>> matcher, Supplier<Block> factory) {
        this.matcher = matcher;
        this.factory = factory;
    }

    @Override
    public Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context) {
        return matcher.apply(lines.get(0)).map(token -> new BlockMatch(factory.get(), 1));
    }
}
