package org.mdacademic.compiler.frontend.parser.ast;

/**
 * A cross-reference to a label, written {@code @label}.
 * <p>
 * {@code resolved} stays null until reference resolution fills it in exactly once.
 *
 * @param label The referenced label.
 * @param resolved The display text, or null before resolution.
 */
public record Reference(String label, String resolved) implements Inline {

    /**
     * @param label The referenced label.
     * @return An unresolved reference.
     */
    public static Reference to(String label) {
        return new Reference(label, null);
    }

    /**
     * @return Whether resolution has not yet filled in the display text.
     */
    public boolean isUnresolved() {
        return resolved == null;
    }

    /**
     * @param text The display text.
     * @return A resolved copy of this reference.
     * @throws IllegalStateException if this reference was already resolved.
     */
    public Reference withResolved(String text) {
        if (resolved != null) {
            throw new IllegalStateException("Reference to '" + label + "' is already resolved");
        }
        return new Reference(label, text);
    }
}
