package org.mdacademic.compiler.frontend.parser.features.description;

import org.mdacademic.compiler.frontend.lexer.Lexer;
import org.mdacademic.compiler.frontend.parser.BlockMatch;
import org.mdacademic.compiler.frontend.parser.BlockParsingContext;
import org.mdacademic.compiler.frontend.parser.IBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.ast.DescriptionItem;
import org.mdacademic.compiler.frontend.parser.ast.DescriptionList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognizes description lists: a term line directly followed by one or more {@code :} definition
 * lines. Blank lines continue a definition only when the next non-blank line is another definition line.
 * A {@code :::} fence is never a definition line.
 */
public class DescriptionListRecognizer implements IBlockRecognizer {

    @Override
    public Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context) {
        if (lines.size() < 2 || !isTerm(lines, 0)) {
            return Optional.empty();
        }

        List<DescriptionItem> items = new ArrayList<>();
        int i = 0;
        int consumed = 0;
        while (i < lines.size()) {
            if (lines.get(i).isBlank()) {
                i++;
                continue;
            }
            if (!isTerm(lines, i)) {
                break;
            }
            String term = lines.get(i).strip();
            i++;
            List<String> definition = new ArrayList<>();
            while (i < lines.size()) {
                String line = lines.get(i);
                String s = line.strip();
                if (isDefinition(s)) {
                    definition.add(s.substring(1).strip());
                } else if (s.isEmpty()) {
                    int j = nextNonBlank(lines, i);
                    if (j >= lines.size() || !isDefinition(lines.get(j).strip())) {
                        break;
                    }
                    definition.add("");
                } else if (Lexer.indentOf(line) > 0) {
                    definition.add(s);
                } else {
                    break;
                }
                i++;
            }
            items.add(new DescriptionItem(context.parseInlines(term), context.parseBlocks(String.join("\n", definition))));
            consumed = i;
        }
        return Optional.of(new BlockMatch(new DescriptionList(items), consumed));
    }

    private static boolean isTerm(List<String> lines, int i) {
        String term = lines.get(i).strip();
        return !term.isEmpty() && !term.startsWith(":")
                && i + 1 < lines.size() && isDefinition(lines.get(i + 1).strip());
    }

    private static boolean isDefinition(String stripped) {
        return stripped.startsWith(":") && !stripped.startsWith(":::");
    }

    private static int nextNonBlank(List<String> lines, int from) {
        int j = from;
        while (j < lines.size() && lines.get(j).isBlank()) {
            j++;
        }
        return j;
    }
}
