package org.mdacademic.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link Lexer} recognizers. Each recognizer either matches at the start of its input
 * and reports the unconsumed remainder, or does not match at all.
 */
public class LexerTest {

    /**
     * Verifies that a heading reports its level and loses a closing hash run preceded by a space.
     */
    @Test
    @Tag("unit")
    void testHeadingStripsClosingHashes() {
        // Act
        Optional<Token> token = Lexer.heading("## Results ##");

        // Assert
        assertThat(token).isPresent();
        assertThat(token.get().type()).isEqualTo(TokenType.HEADING);
        assertThat(token.get().value()).isEqualTo(2);
        assertThat(token.get().text()).isEqualTo("Results");
    }

    /**
     * Verifies that seven hashes, or hashes glued to the text, do not form a heading, and that a hash
     * run glued to a word is kept.
     */
    @Test
    @Tag("unit")
    void testHeadingRejectsMalformedMarkers() {
        assertThat(Lexer.heading("####### Too deep")).isEmpty();
        assertThat(Lexer.heading("#hashtag")).isEmpty();
        assertThat(Lexer.heading("# C#")).map(Token::text).contains("C#");
    }

    /**
     * Verifies thematic breaks with and without interior spaces.
     */
    @Test
    @Tag("unit")
    void testThematicBreak() {
        assertThat(Lexer.thematicBreak("---")).isPresent();
        assertThat(Lexer.thematicBreak(" * * * ")).isPresent();
        assertThat(Lexer.thematicBreak("--")).isEmpty();
        assertThat(Lexer.thematicBreak("-*-")).isEmpty();
    }

    /**
     * Verifies the structural markers: page break, appendix and table of contents.
     */
    @Test
    @Tag("unit")
    void testStructuralMarkers() {
        assertThat(Lexer.pageBreak("\\newpage")).isPresent();
        assertThat(Lexer.pageBreak("---pagebreak---")).isPresent();
        assertThat(Lexer.appendixMarker("---appendix---")).isPresent();
        assertThat(Lexer.appendixMarker("\\appendix")).isPresent();
        assertThat(Lexer.tableOfContents("[[toc]]")).isPresent();
        assertThat(Lexer.tableOfContents("[[toc]] please")).isEmpty();
    }

    /**
     * Verifies that a code fence carries its fence string and language tag, and that a closing fence
     * must be at least as long as the opening one.
     */
    @Test
    @Tag("unit")
    void testCodeFence() {
        // Act
        Optional<Token> token = Lexer.codeFence("````python");

        // Assert
        assertThat(token).isPresent();
        assertThat(token.get().text()).isEqualTo("````");
        assertThat(token.get().value()).isEqualTo("python");
        assertThat(Lexer.closesFence("```", "````")).isFalse();
        assertThat(Lexer.closesFence("`````", "````")).isTrue();
        assertThat(Lexer.codeFence("``")).isEmpty();
    }

    /**
     * Verifies that an environment opener yields its keyword and label.
     */
    @Test
    @Tag("unit")
    void testEnvironmentOpen() {
        // Act
        Optional<Token> token = Lexer.environmentOpen("::: theorem {#thm:main}");

        // Assert
        assertThat(token).isPresent();
        assertThat(token.get().text()).isEqualTo("theorem");
        assertThat(token.get().value()).isEqualTo("thm:main");
        assertThat(Lexer.closesEnvironment("  :::  ")).isTrue();
        assertThat(Lexer.environmentOpen(":::")).isEmpty();
    }

    /**
     * Verifies the three list marker families.
     */
    @Test
    @Tag("unit")
    void testListMarkers() {
        // Act
        ListMarker bullet = (ListMarker) Lexer.listMarker("- item").orElseThrow().value();
        ListMarker ordered = (ListMarker) Lexer.listMarker("12) item").orElseThrow().value();
        ListMarker task = (ListMarker) Lexer.listMarker("- [x] done").orElseThrow().value();

        // Assert
        assertThat(bullet.kind()).isEqualTo(ListMarker.Kind.UNORDERED);
        assertThat(bullet.width()).isEqualTo(2);
        assertThat(ordered.kind()).isEqualTo(ListMarker.Kind.ORDERED);
        assertThat(ordered.number()).isEqualTo(12);
        assertThat(task.kind()).isEqualTo(ListMarker.Kind.CHECKBOX);
        assertThat(task.checked()).isTrue();
        assertThat(Lexer.listMarker("-not a list")).isEmpty();
        assertThat(Lexer.listMarker("1.5 is a number")).isEmpty();
    }

    /**
     * Verifies that single dollars around amounts of money are not math, while a tight span is.
     */
    @Test
    @Tag("unit")
    void testInlineMathDisambiguation() {
        assertThat(Lexer.inlineMath("$x^2$ rest")).map(Token::text).contains("x^2");
        assertThat(Lexer.inlineMath("$x^2$ rest")).map(Token::rest).contains(" rest");
        assertThat(Lexer.inlineMath("$5 and $10")).isEmpty();
        assertThat(Lexer.inlineMath("$ x$")).isEmpty();
        assertThat(Lexer.inlineMath("$$E=mc^2$$")).map(Token::text).contains("E=mc^2");
    }

    /**
     * Verifies the canonical bracketed citation with a locator.
     */
    @Test
    @Tag("unit")
    void testCitationWithLocator() {
        // Act
        Optional<Token> token = Lexer.citation("[@knuth1984, p. 42] and more");

        // Assert
        assertThat(token).isPresent();
        CitationToken citation = (CitationToken) token.get().value();
        assertThat(citation.keys()).containsExactly("knuth1984");
        assertThat(citation.locator()).isEqualTo("p. 42");
        assertThat(citation.prefix()).isNull();
        assertThat(citation.suppressAuthor()).isFalse();
        assertThat(token.get().rest()).isEqualTo(" and more");
    }

    /**
     * Verifies multiple keys, a prefix and author suppression.
     */
    @Test
    @Tag("unit")
    void testCitationVariants() {
        // Act
        CitationToken multi = (CitationToken) Lexer.citation("[@a; @b]").orElseThrow().value();
        CitationToken prefixed = (CitationToken) Lexer.citation("[see @a, ch. 2]").orElseThrow().value();
        CitationToken yearOnly = (CitationToken) Lexer.citation("[-@a]").orElseThrow().value();

        // Assert
        assertThat(multi.keys()).containsExactly("a", "b");
        assertThat(prefixed.prefix()).isEqualTo("see");
        assertThat(prefixed.locator()).isEqualTo("ch. 2");
        assertThat(yearOnly.suppressAuthor()).isTrue();
        assertThat(Lexer.citation("[no key here]")).isEmpty();
        assertThat(Lexer.citation("[@a](http://x)")).isEmpty();
    }

    /**
     * Verifies bare references: trailing colons are punctuation, a trailing dash makes an author-only
     * citation, and {@code @[} is not a reference.
     */
    @Test
    @Tag("unit")
    void testReference() {
        assertThat(Lexer.reference("@sec:intro: see")).map(Token::text).contains("sec:intro");
        assertThat(Lexer.reference("@fig:plot.")).map(Token::rest).contains(".");
        assertThat(Lexer.reference("@smith2020- says")).map(Token::type).contains(TokenType.AUTHOR_CITATION);
        assertThat(Lexer.reference("@[x]")).isEmpty();
    }

    /**
     * Verifies footnote forms: inline bodies with nested brackets, references and definitions.
     */
    @Test
    @Tag("unit")
    void testFootnotes() {
        // Act
        Token definition = Lexer.footnoteDefinition("[^note]: The body.").orElseThrow();

        // Assert
        assertThat(Lexer.inlineFootnote("^[see [1]] after")).map(Token::text).contains("see [1]");
        assertThat(Lexer.footnoteReference("[^note]")).map(Token::text).contains("note");
        assertThat(Lexer.footnoteReference("[^two words]")).isEmpty();
        assertThat(definition.text()).isEqualTo("note");
        assertThat(definition.rest()).isEqualTo("The body.");
    }

    /**
     * Verifies label annotations, including the unnumbered forms, and scanning from the right.
     */
    @Test
    @Tag("unit")
    void testLabels() {
        // Act
        LabelAttributes plain = (LabelAttributes) Lexer.label("{#sec:a}").orElseThrow().value();
        LabelAttributes unnumbered = (LabelAttributes) Lexer.label("{#sec:b .unnumbered}").orElseThrow().value();
        LabelAttributes bare = (LabelAttributes) Lexer.label("{-}").orElseThrow().value();
        Token suffix = Lexer.labelSuffix("Introduction {#sec:intro}").orElseThrow();

        // Assert
        assertThat(plain).isEqualTo(new LabelAttributes("sec:a", true));
        assertThat(unnumbered).isEqualTo(new LabelAttributes("sec:b", false));
        assertThat(bare).isEqualTo(new LabelAttributes(null, false));
        assertThat(Lexer.label("{.class}")).isEmpty();
        assertThat(suffix.text()).isEqualTo("sec:intro");
        assertThat(suffix.rest()).isEqualTo("Introduction");
    }

    /**
     * Verifies links with titles, small caps, images and autolinks.
     */
    @Test
    @Tag("unit")
    void testLinksAndImages() {
        // Act
        Token link = Lexer.link("[the site](https://example.org \"Home\")").orElseThrow();

        // Assert
        assertThat(link.type()).isEqualTo(TokenType.LINK);
        assertThat(link.value()).isEqualTo(new LinkTarget("https://example.org", "Home"));
        assertThat(Lexer.link("[Name]{.smallcaps}")).map(Token::type).contains(TokenType.SMALL_CAPS);
        assertThat(Lexer.image("![alt](a.png)")).map(Token::text).contains("alt");
        assertThat(Lexer.autolink("<https://example.org>")).map(Token::text).contains("https://example.org");
        assertThat(Lexer.autolink("<b>")).isEmpty();
        assertThat(Lexer.rawHtml("<b>bold")).map(Token::text).contains("<b>");
        assertThat(Lexer.rawHtml("<!-- note --> x")).map(Token::text).contains("<!-- note -->");
    }

    /**
     * Verifies code spans with longer backtick runs and the symmetric space stripping.
     */
    @Test
    @Tag("unit")
    void testCodeSpans() {
        assertThat(Lexer.code("`a`")).map(Token::text).contains("a");
        assertThat(Lexer.code("`` a`b ``")).map(Token::text).contains("a`b");
        assertThat(Lexer.code("`open")).isEmpty();
    }

    /**
     * Verifies double and single delimiter spans and the no-whitespace rule for scripts.
     */
    @Test
    @Tag("unit")
    void testDelimitedSpans() {
        assertThat(Lexer.doubleDelimited("**bold** x", "**", TokenType.STRONG)).map(Token::text).contains("bold");
        assertThat(Lexer.doubleDelimited("** no**", "**", TokenType.STRONG)).isEmpty();
        assertThat(Lexer.emphasis("*it* x")).map(Token::text).contains("it");
        assertThat(Lexer.emphasis("_snake_case_ x")).map(Token::text).contains("snake_case");
        assertThat(Lexer.script("~2~", '~', TokenType.SUBSCRIPT)).map(Token::text).contains("2");
        assertThat(Lexer.script("^a b^", '^', TokenType.SUPERSCRIPT)).isEmpty();
    }

    /**
     * Verifies table caption trailers.
     */
    @Test
    @Tag("unit")
    void testTableCaption() {
        assertThat(Lexer.tableCaption("Table: Results {#tbl:r}")).map(Token::rest).contains("Results {#tbl:r}");
        assertThat(Lexer.tableCaption("Caption: Other")).map(Token::rest).contains("Other");
        assertThat(Lexer.tableCaption("Tables are nice")).isEmpty();
        assertThat(List.of(Lexer.indentOf("    x"), Lexer.indentOf("x"))).containsExactly(4, 0);
    }
}
