package org.mdacademic.compiler.api;

/**
 * What a label resolves to.
 *
 * @param displayText The text a reference to this label renders as, e.g. "Section 1.2" or "(3)".
 * @param id The stable identifier derived from the label, usable as an anchor.
 */
public record LabelInfo(String displayText, String id) {
}
