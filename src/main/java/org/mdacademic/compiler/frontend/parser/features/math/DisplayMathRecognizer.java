package org.mdacademic.compiler.frontend.parser.features.math;

import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.frontend.lexer.Lexer;
import org.mdacademic.compiler.frontend.lexer.Token;
import org.mdacademic.compiler.frontend.parser.BlockMatch;
import org.mdacademic.compiler.frontend.parser.BlockParsingContext;
import org.mdacademic.compiler.frontend.parser.IBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.ast.DisplayMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognizes display math, either on one line ({@code $$ x $$ {#eq:x}}) or spanning lines between
 * {@code $$} delimiters. The label follows the closing delimiter.
 */
public class DisplayMathRecognizer implements IBlockRecognizer {

    @Override
    public Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context) {
        Optional<Token> open = Lexer.mathFence(lines.get(0));
        if (open.isEmpty()) {
            return Optional.empty();
        }
        String after = open.get().rest();
        int close = after.indexOf("$$");
        if (close >= 0) {
            String trailer = after.substring(close + 2);
            if (!trailer.isBlank() && Lexer.labelSuffix(trailer).filter(t -> t.rest().isEmpty()).isEmpty()) {
                // "$$x$$ and more text" is a paragraph with inline math
                return Optional.empty();
            }
            DisplayMath math = new DisplayMath(after.substring(0, close).strip(), labelOf(trailer));
            return Optional.of(new BlockMatch(math, 1));
        }

        List<String> content = new ArrayList<>();
        if (!after.isBlank()) {
            content.add(after);
        }
        String label = null;
        boolean closed = false;
        int i = 1;
        while (i < lines.size()) {
            String line = lines.get(i);
            int end = line.indexOf("$$");
            if (end >= 0) {
                String before = line.substring(0, end);
                if (!before.isBlank()) {
                    content.add(before);
                }
                label = labelOf(line.substring(end + 2));
                closed = true;
                break;
            }
            content.add(line);
            i++;
        }
        if (!closed) {
            context.getDiagnostics().reportWarning(CompilerErrorCode.UNCLOSED_BLOCK,
                    "Display math is never closed with '$$'; the rest of the document is treated as math.", "$$");
        }
        DisplayMath math = new DisplayMath(String.join("\n", content).strip(), label);
        return Optional.of(new BlockMatch(math, closed ? i + 1 : lines.size()));
    }

    private static String labelOf(String trailer) {
        return Lexer.labelSuffix(trailer.strip())
                .filter(t -> t.rest().isEmpty())
                .map(Token::text)
                .orElse(null);
    }
}
