package org.mdacademic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A hyperlink.
 *
 * @param url The target.
 * @param title The optional title. May be null.
 * @param content The link text.
 */
public record Link(String url, String title, List<Inline> content) implements Inline {

    public Link {
        content = List.copyOf(content);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(content);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new Link(url, title, AstNode.narrow(newChildren, Inline.class));
    }
}
