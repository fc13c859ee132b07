package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An ATX heading.
 *
 * @param level The level, 1 to 6.
 * @param content The heading text.
 * @param label The label from a trailing {@code {#id}}. May be null.
 * @param numbered False for headings marked {@code .unnumbered} or {@code -}.
 */
public record Heading(int level, List<Inline> content, String label, boolean numbered) implements Block {

    public Heading {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6, got " + level);
        }
        content = List.copyOf(content);
    }

    /**
     * A numbered heading.
     */
    public Heading(int level, List<Inline> content, String label) {
        this(level, content, label, true);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new Heading(level, AstNode.narrow(newChildren, Inline.class), label, numbered);
    }
}
