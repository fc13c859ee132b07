package org.mdacademic.compiler.frontend.lexer;

/**
 * A recognized list item marker.
 *
 * @param kind The marker family.
 * @param number The number of an ordered marker; 0 otherwise.
 * @param checked The box state of a task item; null for other kinds.
 * @param width Characters from the marker to the item text, including the spaces after it.
 */
public record ListMarker(Kind kind, int number, Boolean checked, int width) {

    /**
     * Marker families.
     */
    public enum Kind {
        /** {@code -}, {@code *} or {@code +}. */
        UNORDERED,
        /** {@code N.} or {@code N)}. */
        ORDERED,
        /** {@code - [ ]} or {@code - [x]}. */
        CHECKBOX
    }

    /**
     * Unordered and checkbox markers may be siblings; ordered markers only pair with ordered ones.
     * @param other The other marker.
     * @return Whether the two markers can belong to the same list.
     */
    public boolean sameListAs(ListMarker other) {
        return (kind == Kind.ORDERED) == (other.kind == Kind.ORDERED);
    }
}
