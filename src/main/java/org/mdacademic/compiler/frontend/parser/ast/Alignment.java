package org.mdacademic.compiler.frontend.parser.ast;

/**
 * Table column alignment.
 */
public enum Alignment {
    LEFT,
    CENTER,
    RIGHT
}
