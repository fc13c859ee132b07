package org.mdacademic.compiler.frontend.parser.features.heading;

import org.mdacademic.compiler.frontend.lexer.LabelAttributes;
import org.mdacademic.compiler.frontend.lexer.Lexer;
import org.mdacademic.compiler.frontend.lexer.Token;
import org.mdacademic.compiler.frontend.parser.BlockMatch;
import org.mdacademic.compiler.frontend.parser.BlockParsingContext;
import org.mdacademic.compiler.frontend.parser.IBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.ast.Heading;

import java.util.List;
import java.util.Optional;

/**
 * Recognizes ATX headings with an optional trailing {@code {#label}} annotation.
 */
public class HeadingRecognizer implements IBlockRecognizer {

    @Override
    public Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context) {
        return Lexer.heading(lines.get(0)).map(token -> {
            int level = (Integer) token.value();
            String content = token.text();
            String label = null;
            boolean numbered = true;
            Optional<Token> annotation = Lexer.labelSuffix(content);
            if (annotation.isPresent()) {
                LabelAttributes attributes = (LabelAttributes) annotation.get().value();
                content = annotation.get().rest();
                label = attributes.id();
                numbered = attributes.numbered();
            }
            return new BlockMatch(new Heading(level, context.parseInlines(content), label, numbered), 1);
        });
    }
}
