package org.mdacademic.compiler.frontend.parser.ast;

import java.util.Locale;
import java.util.Map;

/**
 * The kind of a fenced environment: one of the {@link EnvironmentType} catalogue entries, or a custom
 * kind carrying the keyword the author wrote.
 *
 * @param type The catalogue entry.
 * @param customName The keyword of a {@link EnvironmentType#CUSTOM} kind; null otherwise.
 */
public record EnvironmentKind(EnvironmentType type, String customName) {

    private static final Map<String, EnvironmentType> KEYWORDS = Map.ofEntries(
            Map.entry("theorem", EnvironmentType.THEOREM), Map.entry("thm", EnvironmentType.THEOREM),
            Map.entry("lemma", EnvironmentType.LEMMA), Map.entry("lem", EnvironmentType.LEMMA),
            Map.entry("proposition", EnvironmentType.PROPOSITION), Map.entry("prop", EnvironmentType.PROPOSITION),
            Map.entry("corollary", EnvironmentType.COROLLARY), Map.entry("cor", EnvironmentType.COROLLARY),
            Map.entry("definition", EnvironmentType.DEFINITION), Map.entry("def", EnvironmentType.DEFINITION),
            Map.entry("defn", EnvironmentType.DEFINITION),
            Map.entry("example", EnvironmentType.EXAMPLE), Map.entry("ex", EnvironmentType.EXAMPLE),
            Map.entry("remark", EnvironmentType.REMARK), Map.entry("rem", EnvironmentType.REMARK),
            Map.entry("proof", EnvironmentType.PROOF), Map.entry("pf", EnvironmentType.PROOF),
            Map.entry("figure", EnvironmentType.FIGURE), Map.entry("fig", EnvironmentType.FIGURE),
            Map.entry("table", EnvironmentType.TABLE), Map.entry("tab", EnvironmentType.TABLE),
            Map.entry("algorithm", EnvironmentType.ALGORITHM), Map.entry("algo", EnvironmentType.ALGORITHM),
            Map.entry("abstract", EnvironmentType.ABSTRACT), Map.entry("abs", EnvironmentType.ABSTRACT),
            Map.entry("note", EnvironmentType.NOTE),
            Map.entry("warning", EnvironmentType.WARNING), Map.entry("caution", EnvironmentType.WARNING),
            Map.entry("quote", EnvironmentType.QUOTE), Map.entry("blockquote", EnvironmentType.QUOTE),
            Map.entry("conjecture", EnvironmentType.CONJECTURE), Map.entry("conj", EnvironmentType.CONJECTURE),
            Map.entry("axiom", EnvironmentType.AXIOM), Map.entry("ax", EnvironmentType.AXIOM),
            Map.entry("exercise", EnvironmentType.EXERCISE),
            Map.entry("solution", EnvironmentType.SOLUTION), Map.entry("sol", EnvironmentType.SOLUTION),
            Map.entry("case", EnvironmentType.CASE));

    public EnvironmentKind {
        if ((type == EnvironmentType.CUSTOM) != (customName != null)) {
            throw new IllegalArgumentException("customName must be set exactly for CUSTOM kinds");
        }
    }

    /**
     * Maps a fence keyword (case-insensitive, aliases accepted) to its kind.
     * @param keyword The keyword after {@code :::}.
     * @return The catalogue kind, or a custom kind named by the keyword.
     */
    public static EnvironmentKind of(String keyword) {
        EnvironmentType type = KEYWORDS.get(keyword.toLowerCase(Locale.ROOT));
        return type != null ? new EnvironmentKind(type, null) : custom(keyword);
    }

    /**
     * @param type A catalogue entry other than CUSTOM.
     * @return The kind for that entry.
     */
    public static EnvironmentKind of(EnvironmentType type) {
        return new EnvironmentKind(type, null);
    }

    /**
     * @param name The keyword.
     * @return A custom kind.
     */
    public static EnvironmentKind custom(String name) {
        return new EnvironmentKind(EnvironmentType.CUSTOM, name);
    }

    /**
     * @return The name shown before the number, e.g. "Theorem"; the keyword itself for custom kinds.
     */
    public String displayName() {
        return type == EnvironmentType.CUSTOM ? customName : type.displayName();
    }

    /**
     * @return Whether environments of this kind are numbered. Custom kinds never are.
     */
    public boolean isNumbered() {
        return type.numbered();
    }
}
