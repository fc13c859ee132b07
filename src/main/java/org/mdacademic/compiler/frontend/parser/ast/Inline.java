package org.mdacademic.compiler.frontend.parser.ast;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Marker for inline-level nodes: text runs, spans, math, citations and references.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
public interface Inline extends AstNode {
}
