package org.mdacademic.compiler.frontend.parser.features.code;

import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.frontend.lexer.Lexer;
import org.mdacademic.compiler.frontend.lexer.Token;
import org.mdacademic.compiler.frontend.parser.BlockMatch;
import org.mdacademic.compiler.frontend.parser.BlockParsingContext;
import org.mdacademic.compiler.frontend.parser.IBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.ast.CodeBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognizes fenced code blocks. A fence that is never closed runs to the end of the input.
 */
public class FencedCodeRecognizer implements IBlockRecognizer {

    @Override
    public Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context) {
        Optional<Token> open = Lexer.codeFence(lines.get(0));
        if (open.isEmpty()) {
            return Optional.empty();
        }
        String fence = open.get().text();
        String language = (String) open.get().value();

        List<String> content = new ArrayList<>();
        int i = 1;
        boolean closed = false;
        while (i < lines.size()) {
            if (Lexer.closesFence(lines.get(i), fence)) {
                closed = true;
                break;
            }
            content.add(lines.get(i));
            i++;
        }
        if (!closed) {
            context.getDiagnostics().reportWarning(CompilerErrorCode.UNCLOSED_BLOCK,
                    "Code fence '" + fence + "' is never closed; the rest of the document is treated as code.", fence);
        }
        CodeBlock block = new CodeBlock(language, String.join("\n", content));
        return Optional.of(new BlockMatch(block, closed ? i + 1 : lines.size()));
    }
}
