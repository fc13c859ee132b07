package org.mdacademic.compiler.frontend.parser.ast;

/**
 * Marks the start of the appendices; later level-1 sections are lettered.
 */
public record AppendixMarker() implements Block {
}
