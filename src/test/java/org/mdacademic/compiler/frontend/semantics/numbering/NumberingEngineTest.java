package org.mdacademic.compiler.frontend.semantics.numbering;

import org.mdacademic.compiler.api.ParseException;
import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;
import org.mdacademic.compiler.frontend.parser.Parser;
import org.mdacademic.compiler.frontend.parser.ast.Document;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for the {@link NumberingEngine} and {@link NumberingState}.
 */
public class NumberingEngineTest {

    private static NumberingResult number(String source) throws ParseException {
        Document document = new Parser(new DiagnosticsEngine()).parse(source);
        return new NumberingEngine().number(document);
    }

    /**
     * Verifies hierarchical section numbers and that deeper levels restart under a new parent.
     */
    @Test
    @Tag("unit")
    void testHierarchicalSections() throws ParseException {
        // Act
        NumberingResult result = number("""
                # A {#a}
                ## B {#b}
                ## C {#c}
                ### C1 {#c1}
                # D {#d}
                ## E {#e}
                """);

        // Assert
        assertThat(result.sectionNumbers()).containsExactly(
                entry("a", "1"), entry("b", "1.1"), entry("c", "1.2"), entry("c1", "1.2.1"),
                entry("d", "2"), entry("e", "2.1"));
    }

    /**
     * Verifies that unnumbered headings neither receive a number nor advance the counters, while
     * unlabeled numbered headings still do.
     */
    @Test
    @Tag("unit")
    void testUnnumberedAndUnlabeledHeadings() throws ParseException {
        // Act
        NumberingResult result = number("# Preface {-}\n# One\n# Two {#two}\n# Notes {#notes .unnumbered}");

        // Assert
        assertThat(result.sectionNumbers()).containsExactly(entry("two", "2"));
    }

    /**
     * Verifies that every environment kind counts on its own, with no gaps from unlabeled items, and that
     * equations count whether or not they are labeled.
     */
    @Test
    @Tag("unit")
    void testIndependentCounters() throws ParseException {
        // Act
        NumberingResult result = number("""
                ::: theorem {#thm:a}
                A
                :::

                ::: definition {#def:a}
                D
                :::

                ::: lemma
                L
                :::

                ::: theorem {#thm:b}
                B
                :::

                ::: lemma {#lem:b}
                L
                :::

                $$ x $$

                $$ y $$ {#eq:y}
                """);

        // Assert
        assertThat(result.envNumbers()).containsExactly(
                entry("thm:a", 1), entry("def:a", 1), entry("thm:b", 2), entry("lem:b", 2), entry("eq:y", 2));
    }

    /**
     * Verifies that propositions and corollaries share the theorem sequence and proofs are not numbered.
     */
    @Test
    @Tag("unit")
    void testSharedTheoremSequence() throws ParseException {
        // Act
        NumberingResult result = number("""
                ::: theorem {#t}
                :::
                ::: proof {#p}
                :::
                ::: proposition {#prop}
                :::
                ::: corollary {#cor}
                :::
                """);

        // Assert
        assertThat(result.envNumbers()).containsExactly(entry("t", 1), entry("prop", 2), entry("cor", 3));
    }

    /**
     * Verifies that sections after the appendix marker restart with letters.
     */
    @Test
    @Tag("unit")
    void testAppendixSections() throws ParseException {
        // Act
        NumberingResult result = number("# Main {#main}\n---appendix---\n# Proofs {#proofs}\n## Details {#details}\n# Data {#data}");

        // Assert
        assertThat(result.sectionNumbers()).containsExactly(
                entry("main", "1"), entry("proofs", "A"), entry("details", "A.1"), entry("data", "B"));
    }

    /**
     * Verifies that a table inside a table environment shares the environment's number while a bare
     * table takes the next one.
     */
    @Test
    @Tag("unit")
    void testTableNumbering() throws ParseException {
        // Act
        NumberingResult result = number("""
                ::: table {#tbl:env}
                | a | b |
                |---|---|
                | 1 | 2 |
                Table: Inner {#tbl:inner}
                :::

                | c |
                |---|
                | 3 |
                Table: Bare {#tbl:bare}
                """);

        // Assert
        assertThat(result.envNumbers()).containsExactly(entry("tbl:env", 1), entry("tbl:inner", 1), entry("tbl:bare", 2));
    }

    /**
     * Verifies that numbering looks inside containers such as lists and quotes.
     */
    @Test
    @Tag("unit")
    void testNumbersInsideContainers() throws ParseException {
        // Act
        NumberingResult result = number("> $$ a $$ {#eq:a}\n\n- item\n\n  $$ b $$ {#eq:b}");

        // Assert
        assertThat(result.envNumbers()).containsExactly(entry("eq:a", 1), entry("eq:b", 2));
    }

    /**
     * Verifies the letter sequence used for appendix sections.
     */
    @Test
    @Tag("unit")
    void testLetters() {
        // Assert
        assertThat(NumberingState.letters(1)).isEqualTo("A");
        assertThat(NumberingState.letters(26)).isEqualTo("Z");
        assertThat(NumberingState.letters(27)).isEqualTo("AA");
        assertThat(NumberingState.letters(53)).isEqualTo("BA");
    }
}
