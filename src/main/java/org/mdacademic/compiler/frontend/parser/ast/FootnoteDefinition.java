package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The body of a named footnote, written {@code [^id]: text}.
 *
 * @param id The footnote id.
 * @param content The body.
 */
public record FootnoteDefinition(String id, List<Inline> content) implements Block {

    public FootnoteDefinition {
        content = List.copyOf(content);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new FootnoteDefinition(id, AstNode.narrow(newChildren, Inline.class));
    }
}
