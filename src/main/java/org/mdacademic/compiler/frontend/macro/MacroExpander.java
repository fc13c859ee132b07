package org.mdacademic.compiler.frontend.macro;

import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.TreeWalker;
import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.parser.ast.DisplayMath;
import org.mdacademic.compiler.frontend.parser.ast.Document;
import org.mdacademic.compiler.frontend.parser.ast.InlineMath;
import org.mdacademic.compiler.frontend.parser.ast.Macro;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Substitutes the user macros declared in the front matter inside every math node of a document.
 * <p>
 * Substitution is textual. One pass applies every macro in declaration order; passes repeat until the
 * text stops changing or the configured bound is reached. Text outside math is never touched.
 */
public class MacroExpander {

    private static final Logger LOG = LoggerFactory.getLogger(MacroExpander.class);

    private final Map<String, Macro> macros;
    private final int maxIterations;
    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a new macro expander.
     * @param macros The macro table, in declaration order.
     * @param maxIterations The maximum number of full substitution passes per math node.
     * @param diagnostics The engine receiving a warning when expansion does not settle.
     */
    public MacroExpander(Map<String, Macro> macros, int maxIterations, DiagnosticsEngine diagnostics) {
        this.macros = macros;
        this.maxIterations = maxIterations;
        this.diagnostics = diagnostics;
    }

    /**
     * Expands macros in all inline and display math of the document.
     * @param document The document.
     * @return A document whose math has been expanded; the input itself when there are no macros.
     */
    public Document expand(Document document) {
        if (macros.isEmpty()) {
            return document;
        }
        LOG.debug("Expanding {} macro(s)", macros.size());
        return document.withBlocks(TreeWalker.transformBlocks(document.blocks(), this::rewrite));
    }

    private AstNode rewrite(AstNode node) {
        if (node instanceof InlineMath math) {
            String expanded = expand(math.latex());
            return expanded.equals(math.latex()) ? node : new InlineMath(expanded);
        }
        if (node instanceof DisplayMath math) {
            String expanded = expand(math.latex());
            return expanded.equals(math.latex()) ? node : new DisplayMath(expanded, math.label());
        }
        return node;
    }

    /**
     * Expands macros in a LaTeX fragment until it reaches a fixed point or the pass bound.
     * @param latex The fragment.
     * @return The expanded fragment.
     */
    public String expand(String latex) {
        String current = latex;
        for (int i = 0; i < maxIterations; i++) {
            String next = applyAll(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        if (!applyAll(current).equals(current)) {
            diagnostics.reportWarning(CompilerErrorCode.MACRO_EXPANSION_LIMIT,
                    "Macro expansion did not settle after " + maxIterations + " passes in '" + latex + "'.", latex);
        }
        return current;
    }

    private String applyAll(String text) {
        String result = text;
        for (Map.Entry<String, Macro> entry : macros.entrySet()) {
            result = substitute(result, entry.getKey(), entry.getValue());
        }
        return result;
    }

    private static String substitute(String text, String name, Macro macro) {
        String invocation = "\\" + name;
        boolean letterName = !name.isEmpty() && Character.isLetter(name.charAt(name.length() - 1));
        StringBuilder out = new StringBuilder(text.length());
        int pos = 0;
        while (true) {
            int start = text.indexOf(invocation, pos);
            if (start < 0) {
                out.append(text, pos, text.length());
                return out.toString();
            }
            int after = start + invocation.length();
            // \R must not match the prefix of \Rightarrow
            if (letterName && after < text.length() && Character.isLetter(text.charAt(after))) {
                out.append(text, pos, after);
                pos = after;
                continue;
            }

            if (macro.argCount() == 0) {
                if (after < text.length() && text.charAt(after) == '{') {
                    out.append(text, pos, after);
                    pos = after;
                    continue;
                }
                out.append(text, pos, start).append(macro.template());
                pos = after;
                continue;
            }

            List<String> arguments = new ArrayList<>(macro.argCount());
            int cursor = after;
            for (int i = 0; i < macro.argCount(); i++) {
                while (cursor < text.length() && Character.isWhitespace(text.charAt(cursor))) {
                    cursor++;
                }
                int close = cursor < text.length() && text.charAt(cursor) == '{' ? closingBrace(text, cursor) : -1;
                if (close < 0) {
                    break;
                }
                arguments.add(text.substring(cursor + 1, close));
                cursor = close + 1;
            }
            if (arguments.size() < macro.argCount()) {
                // malformed invocation stays as written
                out.append(text, pos, after);
                pos = after;
                continue;
            }
            out.append(text, pos, start).append(fill(macro.template(), arguments));
            pos = cursor;
        }
    }

    private static int closingBrace(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String fill(String template, List<String> arguments) {
        StringBuilder out = new StringBuilder(template.length());
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c == '#' && i + 1 < template.length()) {
                int index = template.charAt(i + 1) - '1';
                if (index >= 0 && index < arguments.size()) {
                    out.append(arguments.get(index));
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }
}
