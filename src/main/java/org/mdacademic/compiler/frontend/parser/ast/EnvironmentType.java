package org.mdacademic.compiler.frontend.parser.ast;

/**
 * The closed catalogue of environment kinds, plus {@link #CUSTOM} for unrecognized fence keywords.
 */
public enum EnvironmentType {
    THEOREM("Theorem", true),
    LEMMA("Lemma", true),
    PROPOSITION("Proposition", true),
    COROLLARY("Corollary", true),
    DEFINITION("Definition", true),
    EXAMPLE("Example", true),
    REMARK("Remark", true),
    PROOF("Proof", false),
    FIGURE("Figure", true),
    TABLE("Table", true),
    ALGORITHM("Algorithm", true),
    ABSTRACT("Abstract", false),
    NOTE("Note", false),
    WARNING("Warning", false),
    QUOTE("Quote", false),
    CONJECTURE("Conjecture", true),
    AXIOM("Axiom", true),
    EXERCISE("Exercise", true),
    SOLUTION("Solution", true),
    CASE("Case", false),
    CUSTOM(null, false);

    private final String displayName;
    private final boolean numbered;

    EnvironmentType(String displayName, boolean numbered) {
        this.displayName = displayName;
        this.numbered = numbered;
    }

    /**
     * @return The canonical display name; null for {@link #CUSTOM}, whose name comes from the source.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * @return Whether environments of this type receive a number.
     */
    public boolean numbered() {
        return numbered;
    }
}
