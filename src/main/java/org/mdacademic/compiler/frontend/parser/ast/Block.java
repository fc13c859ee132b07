package org.mdacademic.compiler.frontend.parser.ast;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Marker for block-level nodes: paragraphs, headings, containers and structural markers.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
public interface Block extends AstNode {
}
