package org.mdacademic.compiler.frontend.parser.features.footnote;

import org.mdacademic.compiler.frontend.lexer.Lexer;
import org.mdacademic.compiler.frontend.lexer.Token;
import org.mdacademic.compiler.frontend.parser.BlockMatch;
import org.mdacademic.compiler.frontend.parser.BlockParsingContext;
import org.mdacademic.compiler.frontend.parser.IBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.ast.FootnoteDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognizes named footnote bodies, {@code [^id]: text}, continued by lines indented at least two spaces.
 */
public class FootnoteDefinitionRecognizer implements IBlockRecognizer {

    private static final int CONTINUATION_INDENT = 2;

    @Override
    public Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context) {
        Optional<Token> definition = Lexer.footnoteDefinition(lines.get(0));
        if (definition.isEmpty()) {
            return Optional.empty();
        }
        List<String> body = new ArrayList<>();
        body.add(definition.get().rest());
        int i = 1;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (line.isBlank()) {
                int j = i + 1;
                while (j < lines.size() && lines.get(j).isBlank()) {
                    j++;
                }
                if (j >= lines.size() || Lexer.indentOf(lines.get(j)) < CONTINUATION_INDENT) {
                    break;
                }
                body.add("");
            } else if (Lexer.indentOf(line) >= CONTINUATION_INDENT) {
                body.add(line.strip());
            } else {
                break;
            }
            i++;
        }
        FootnoteDefinition block = new FootnoteDefinition(definition.get().text(), context.parseInlines(String.join("\n", body)));
        return Optional.of(new BlockMatch(block, i));
    }
}
