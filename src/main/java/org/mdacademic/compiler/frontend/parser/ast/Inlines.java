package org.mdacademic.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Helpers over inline content.
 */
public final class Inlines {

    private Inlines() {}

    /**
     * Flattens inline content to the text a reader would see, without markup. Footnote bodies and raw
     * HTML are dropped; breaks become single spaces.
     * @param content The inline nodes.
     * @return The plain text.
     */
    public static String plainText(List<Inline> content) {
        StringBuilder out = new StringBuilder();
        append(content, out);
        return out.toString().strip();
    }

    private static void append(List<? extends AstNode> nodes, StringBuilder out) {
        for (AstNode node : nodes) {
            if (node instanceof Text text) {
                out.append(text.text());
            } else if (node instanceof Code code) {
                out.append(code.code());
            } else if (node instanceof InlineMath math) {
                out.append(math.latex());
            } else if (node instanceof SoftBreak || node instanceof HardBreak) {
                out.append(' ');
            } else if (node instanceof Reference reference) {
                out.append(reference.isUnresolved() ? "@" + reference.label() : reference.resolved());
            } else if (node instanceof Citation citation) {
                out.append(String.join("; ", citation.keys()));
            } else if (node instanceof Image image) {
                out.append(image.alt());
            } else if (!(node instanceof Footnote || node instanceof RawHtml)) {
                append(node.getChildren(), out);
            }
        }
    }
}
