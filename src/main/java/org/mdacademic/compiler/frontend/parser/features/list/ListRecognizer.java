package org.mdacademic.compiler.frontend.parser.features.list;

import org.mdacademic.compiler.frontend.lexer.Lexer;
import org.mdacademic.compiler.frontend.lexer.ListMarker;
import org.mdacademic.compiler.frontend.lexer.Token;
import org.mdacademic.compiler.frontend.parser.BlockMatch;
import org.mdacademic.compiler.frontend.parser.BlockParsingContext;
import org.mdacademic.compiler.frontend.parser.IBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.ast.ListBlock;
import org.mdacademic.compiler.frontend.parser.ast.ListItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognizes ordered, unordered and task lists.
 * <p>
 * Items are siblings when their markers sit at the first marker's indentation or less and belong to the
 * same family (ordered vs. unordered/task). Everything else up to the next sibling belongs to the
 * current item: deeper lines, lazy continuation lines, and blank lines, but a blank line only when the
 * next non-blank line is indented deeper than the list. Item lines lose the item's content indentation
 * and are parsed as blocks, which yields nested lists.
 */
public class ListRecognizer implements IBlockRecognizer {

    @Override
    public Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context) {
        Optional<Token> firstToken = Lexer.listMarker(lines.get(0));
        if (firstToken.isEmpty()) {
            return Optional.empty();
        }
        ListMarker first = (ListMarker) firstToken.get().value();
        int baseIndent = Lexer.indentOf(lines.get(0));
        boolean ordered = first.kind() == ListMarker.Kind.ORDERED;

        List<ListItem> items = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (line.isBlank()) {
                i++;
                continue;
            }
            Optional<Token> token = Lexer.listMarker(line);
            int indent = Lexer.indentOf(line);
            if (token.isEmpty() || indent > baseIndent) {
                break;
            }
            ListMarker marker = (ListMarker) token.get().value();
            if (!marker.sameListAs(first)) {
                break;
            }

            int contentIndent = indent + marker.width();
            List<String> itemLines = new ArrayList<>();
            itemLines.add(token.get().rest());
            i++;
            while (i < lines.size()) {
                String next = lines.get(i);
                if (next.isBlank()) {
                    int j = i + 1;
                    while (j < lines.size() && lines.get(j).isBlank()) {
                        j++;
                    }
                    if (j < lines.size() && Lexer.indentOf(lines.get(j)) <= baseIndent) {
                        break;
                    }
                    itemLines.add("");
                    i++;
                    continue;
                }
                if (Lexer.indentOf(next) <= baseIndent && context.interruptsParagraph(next)) {
                    break;
                }
                itemLines.add(dedent(next, contentIndent));
                i++;
            }
            items.add(new ListItem(context.parseBlocks(String.join("\n", itemLines)), marker.checked()));
        }

        // Trailing blank lines after the last item are left to the caller.
        while (i > 0 && lines.get(i - 1).isBlank()) {
            i--;
        }
        Integer start = ordered ? first.number() : null;
        return Optional.of(new BlockMatch(new ListBlock(ordered, start, items), i));
    }

    private static String dedent(String line, int amount) {
        return line.substring(Math.min(amount, Lexer.indentOf(line)));
    }
}
