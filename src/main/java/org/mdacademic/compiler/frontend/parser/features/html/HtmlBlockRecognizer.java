package org.mdacademic.compiler.frontend.parser.features.html;

import org.mdacademic.compiler.frontend.parser.BlockMatch;
import org.mdacademic.compiler.frontend.parser.BlockParsingContext;
import org.mdacademic.compiler.frontend.parser.IBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.ast.HtmlBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Recognizes raw HTML blocks: a line opening with a block-level tag runs to the next blank line, an
 * HTML comment runs to its closing {@code -->}.
 */
public class HtmlBlockRecognizer implements IBlockRecognizer {

    private static final Set<String> BLOCK_TAGS = Set.of(
            "address", "article", "aside", "blockquote", "center", "details", "dialog", "div", "dl",
            "fieldset", "figcaption", "figure", "footer", "form", "h1", "h2", "h3", "h4", "h5", "h6",
            "header", "hr", "iframe", "main", "nav", "ol", "p", "pre", "script", "section", "style",
            "summary", "table", "ul");

    @Override
    public Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context) {
        String first = lines.get(0).stripLeading();
        List<String> html = new ArrayList<>();
        int i = 0;
        if (first.startsWith("<!--")) {
            while (i < lines.size()) {
                html.add(lines.get(i));
                i++;
                if (lines.get(i - 1).contains("-->")) {
                    break;
                }
            }
        } else if (opensBlockTag(first)) {
            while (i < lines.size() && !lines.get(i).isBlank()) {
                html.add(lines.get(i));
                i++;
            }
        } else {
            return Optional.empty();
        }
        return Optional.of(new BlockMatch(new HtmlBlock(String.join("\n", html)), i));
    }

    private static boolean opensBlockTag(String s) {
        if (!s.startsWith("<")) {
            return false;
        }
        int start = s.startsWith("</") ? 2 : 1;
        int end = start;
        while (end < s.length() && Character.isLetterOrDigit(s.charAt(end))) {
            end++;
        }
        if (end == start || !BLOCK_TAGS.contains(s.substring(start, end).toLowerCase(Locale.ROOT))) {
            return false;
        }
        return end == s.length() || " \t>/".indexOf(s.charAt(end)) >= 0;
    }
}
