package org.mdacademic.compiler.frontend.parser.features.quote;

import org.mdacademic.compiler.frontend.parser.BlockMatch;
import org.mdacademic.compiler.frontend.parser.BlockParsingContext;
import org.mdacademic.compiler.frontend.parser.IBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.ast.BlockQuote;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognizes {@code >}-prefixed block quotes. A blank line stays inside the quote when the next line is
 * quoted again. The prefix is removed and the content parsed recursively.
 */
public class BlockQuoteRecognizer implements IBlockRecognizer {

    @Override
    public Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context) {
        if (!isQuoted(lines.get(0))) {
            return Optional.empty();
        }
        List<String> content = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (isQuoted(line)) {
                content.add(unquote(line.stripLeading()));
            } else if (line.isBlank() && i + 1 < lines.size() && isQuoted(lines.get(i + 1))) {
                content.add("");
            } else {
                break;
            }
            i++;
        }
        return Optional.of(new BlockMatch(new BlockQuote(context.parseBlocks(String.join("\n", content))), i));
    }

    private static boolean isQuoted(String line) {
        return line.stripLeading().startsWith(">");
    }

    private static String unquote(String s) {
        return s.startsWith("> ") ? s.substring(2) : s.substring(1);
    }
}
