package org.mdacademic.compiler.frontend.parser;

import org.mdacademic.compiler.frontend.parser.ast.Citation;
import org.mdacademic.compiler.frontend.parser.ast.CitationStyle;
import org.mdacademic.compiler.frontend.parser.ast.Code;
import org.mdacademic.compiler.frontend.parser.ast.Emphasis;
import org.mdacademic.compiler.frontend.parser.ast.Footnote;
import org.mdacademic.compiler.frontend.parser.ast.FootnoteReference;
import org.mdacademic.compiler.frontend.parser.ast.HardBreak;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.InlineMath;
import org.mdacademic.compiler.frontend.parser.ast.Link;
import org.mdacademic.compiler.frontend.parser.ast.Reference;
import org.mdacademic.compiler.frontend.parser.ast.SoftBreak;
import org.mdacademic.compiler.frontend.parser.ast.Strong;
import org.mdacademic.compiler.frontend.parser.ast.Subscript;
import org.mdacademic.compiler.frontend.parser.ast.Text;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link InlineParser}.
 */
public class InlineParserTest {

    private final InlineParser parser = new InlineParser();

    /**
     * Verifies the canonical citation form: one key, a locator, parenthetical style.
     */
    @Test
    @Tag("unit")
    void testParentheticalCitationWithLocator() {
        // Act
        List<Inline> inlines = parser.parse("[@knuth1984, p. 42]");

        // Assert
        assertThat(inlines).containsExactly(
                new Citation(List.of("knuth1984"), CitationStyle.PARENTHETICAL, null, "p. 42"));
    }

    /**
     * Verifies author-only and year-only citations.
     */
    @Test
    @Tag("unit")
    void testCitationStyles() {
        // Act
        List<Inline> inlines = parser.parse("@smith2020- argues [-@smith2020]");

        // Assert
        assertThat(inlines).containsExactly(
                new Citation(List.of("smith2020"), CitationStyle.AUTHOR_ONLY, null, null),
                new Text(" argues "),
                new Citation(List.of("smith2020"), CitationStyle.YEAR_ONLY, null, null));
    }

    /**
     * Verifies that strong text is recognized before emphasis and that spans nest.
     */
    @Test
    @Tag("unit")
    void testNestedStrongAndEmphasis() {
        // Act
        List<Inline> inlines = parser.parse("**bold *and* more**");

        // Assert
        assertThat(inlines).containsExactly(new Strong(List.of(
                new Text("bold "), new Emphasis(List.of(new Text("and"))), new Text(" more"))));
    }

    /**
     * Verifies that an unmatched opening marker degrades to literal text.
     */
    @Test
    @Tag("unit")
    void testUnmatchedMarkersStayLiteral() {
        assertThat(parser.parse("a * b")).containsExactly(new Text("a * b"));
        assertThat(parser.parse("**open")).containsExactly(new Text("**open"));
        assertThat(parser.parse("`open")).containsExactly(new Text("`open"));
    }

    /**
     * Verifies that references are unresolved after parsing and that e-mail addresses stay text.
     */
    @Test
    @Tag("unit")
    void testReferencesAndEmailAddresses() {
        // Act
        List<Inline> inlines = parser.parse("See @sec:intro or mail a@b.org");

        // Assert
        assertThat(inlines).containsExactly(
                new Text("See "), Reference.to("sec:intro"), new Text(" or mail a@b.org"));
    }

    /**
     * Verifies that backslash escapes fold special characters into plain text.
     */
    @Test
    @Tag("unit")
    void testEscapes() {
        assertThat(parser.parse("\\*not emphasis\\* costs \\$5")).containsExactly(new Text("*not emphasis* costs $5"));
    }

    /**
     * Verifies soft and hard breaks; hard breaks come from a trailing backslash or two trailing spaces.
     */
    @Test
    @Tag("unit")
    void testLineBreaks() {
        // Act
        List<Inline> soft = parser.parse("one\ntwo");
        List<Inline> hard = parser.parse("one  \ntwo\\\nthree");

        // Assert
        assertThat(soft).containsExactly(new Text("one"), new SoftBreak(), new Text("two"));
        assertThat(hard).containsExactly(new Text("one"), new HardBreak(), new Text("two"), new HardBreak(), new Text("three"));
    }

    /**
     * Verifies that an escaped backslash at the end of a line is literal text followed by a soft break,
     * while a raw backslash after it still makes the break hard.
     */
    @Test
    @Tag("unit")
    void testEscapedBackslashBeforeNewline() {
        // Act
        List<Inline> escaped = parser.parse("a\\\\\nb");
        List<Inline> escapedThenRaw = parser.parse("a\\\\\\\nb");

        // Assert
        assertThat(escaped).containsExactly(new Text("a\\"), new SoftBreak(), new Text("b"));
        assertThat(escapedThenRaw).containsExactly(new Text("a\\"), new HardBreak(), new Text("b"));
    }

    /**
     * Verifies math, code, footnotes and intraword underscores.
     */
    @Test
    @Tag("unit")
    void testMiscellaneousSpans() {
        // Act
        List<Inline> math = parser.parse("$a_b$");
        List<Inline> code = parser.parse("`x = 1`");
        List<Inline> inlineNote = parser.parse("Text^[A note.]");
        List<Inline> noteReference = parser.parse("see[^n1]");
        List<Inline> identifier = parser.parse("snake_case_name");
        List<Inline> subscript = parser.parse("H~2~O");

        // Assert
        assertThat(math).containsExactly(new InlineMath("a_b"));
        assertThat(code).containsExactly(new Code("x = 1"));
        assertThat(inlineNote).containsExactly(new Text("Text"), new Footnote(List.of(new Text("A note."))));
        assertThat(noteReference).containsExactly(new Text("see"), new FootnoteReference("n1"));
        assertThat(identifier).containsExactly(new Text("snake_case_name"));
        assertThat(subscript).containsExactly(new Text("H"), new Subscript(List.of(new Text("2"))), new Text("O"));
    }

    /**
     * Verifies that label annotations inside running text are erased and links keep their text.
     */
    @Test
    @Tag("unit")
    void testLabelErasureAndLinks() {
        assertThat(parser.parse("Caption {#fig:a}")).containsExactly(new Text("Caption "));
        assertThat(parser.parse("<https://example.org>")).containsExactly(
                new Link("https://example.org", null, List.of(new Text("https://example.org"))));
    }

    /**
     * Verifies that the parser is total: arbitrary punctuation never throws and always makes progress.
     */
    @Test
    @Tag("unit")
    void testTotalOverPunctuation() {
        // Act
        List<Inline> inlines = parser.parse("[[@]] {{ }} ^^ ~~ $$ <> ![ ]( \\");

        // Assert
        assertThat(inlines).isNotEmpty();
    }
}
