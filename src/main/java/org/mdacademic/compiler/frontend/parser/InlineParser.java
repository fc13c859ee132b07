package org.mdacademic.compiler.frontend.parser;

import org.mdacademic.compiler.frontend.lexer.CitationToken;
import org.mdacademic.compiler.frontend.lexer.Lexer;
import org.mdacademic.compiler.frontend.lexer.LinkTarget;
import org.mdacademic.compiler.frontend.lexer.Token;
import org.mdacademic.compiler.frontend.lexer.TokenType;
import org.mdacademic.compiler.frontend.parser.ast.Citation;
import org.mdacademic.compiler.frontend.parser.ast.CitationStyle;
import org.mdacademic.compiler.frontend.parser.ast.Code;
import org.mdacademic.compiler.frontend.parser.ast.Emphasis;
import org.mdacademic.compiler.frontend.parser.ast.Footnote;
import org.mdacademic.compiler.frontend.parser.ast.FootnoteReference;
import org.mdacademic.compiler.frontend.parser.ast.HardBreak;
import org.mdacademic.compiler.frontend.parser.ast.Image;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.InlineMath;
import org.mdacademic.compiler.frontend.parser.ast.Link;
import org.mdacademic.compiler.frontend.parser.ast.RawHtml;
import org.mdacademic.compiler.frontend.parser.ast.Reference;
import org.mdacademic.compiler.frontend.parser.ast.SmallCaps;
import org.mdacademic.compiler.frontend.parser.ast.SoftBreak;
import org.mdacademic.compiler.frontend.parser.ast.Strikethrough;
import org.mdacademic.compiler.frontend.parser.ast.Strong;
import org.mdacademic.compiler.frontend.parser.ast.Subscript;
import org.mdacademic.compiler.frontend.parser.ast.Superscript;
import org.mdacademic.compiler.frontend.parser.ast.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses paragraph text into inline nodes.
 * <p>
 * At every character that can open a span the recognizers are tried in priority order: math, strong,
 * emphasis, strikethrough, subscript, code, citation, inline footnote, footnote reference, superscript,
 * bare reference, label annotation, link, image, autolink, raw HTML. Everything else is collected into
 * text. A span that does not close leaves its opening character as literal text, so the parser is
 * total over any input.
 */
public class InlineParser {

    private static final String ESCAPABLE = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";
    private static final String SPECIAL = "*_`$[!@^<~{\\\n";

    /**
     * Parses inline content.
     * @param source The text of a paragraph, heading, cell or span.
     * @return The inline nodes; adjacent text is merged into one {@link Text}.
     */
    public List<Inline> parse(String source) {
        String text = source.strip();
        List<Inline> out = new ArrayList<>();
        StringBuilder run = new StringBuilder();
        int pos = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (SPECIAL.indexOf(c) < 0) {
                run.append(c);
                pos++;
                continue;
            }
            if (c == '\n') {
                pos = lineBreak(text, pos, run, out);
                continue;
            }
            if (c == '\\') {
                if (pos + 1 < text.length() && ESCAPABLE.indexOf(text.charAt(pos + 1)) >= 0) {
                    run.append(text.charAt(pos + 1));
                    pos += 2;
                } else {
                    run.append(c);
                    pos++;
                }
                continue;
            }

            String rest = text.substring(pos);
            Optional<Token> token = recognize(rest, previous(text, pos));
            if (token.isPresent()) {
                Inline node = toInline(token.get());
                if (node != null) {
                    flush(run, out);
                    out.add(node);
                }
                pos += token.get().consumed(rest);
            } else if (c == '`') {
                // an unclosed backtick run stays literal as a whole
                int end = pos;
                while (end < text.length() && text.charAt(end) == '`') {
                    end++;
                }
                run.append(text, pos, end);
                pos = end;
            } else {
                run.append(c);
                pos++;
            }
        }
        flush(run, out);
        return out;
    }

    private Optional<Token> recognize(String s, char previous) {
        boolean wordBefore = Character.isLetterOrDigit(previous);
        switch (s.charAt(0)) {
            case '$':
                return Lexer.inlineMath(s);
            case '*':
                return Lexer.doubleDelimited(s, "**", TokenType.STRONG).or(() -> Lexer.emphasis(s));
            case '_':
                if (wordBefore) {
                    return Optional.empty();
                }
                return Lexer.doubleDelimited(s, "__", TokenType.STRONG).or(() -> Lexer.emphasis(s));
            case '~':
                return Lexer.doubleDelimited(s, "~~", TokenType.STRIKETHROUGH)
                        .or(() -> Lexer.script(s, '~', TokenType.SUBSCRIPT));
            case '`':
                return Lexer.code(s);
            case '[':
                return Lexer.citation(s)
                        .or(() -> Lexer.footnoteReference(s))
                        .or(() -> Lexer.link(s));
            case '^':
                return Lexer.inlineFootnote(s).or(() -> Lexer.script(s, '^', TokenType.SUPERSCRIPT));
            case '@':
                return wordBefore ? Optional.empty() : Lexer.reference(s);
            case '{':
                return Lexer.label(s);
            case '!':
                return Lexer.image(s);
            case '<':
                return Lexer.autolink(s).or(() -> Lexer.rawHtml(s));
            default:
                return Optional.empty();
        }
    }

    private Inline toInline(Token token) {
        switch (token.type()) {
            case INLINE_MATH:
                return new InlineMath(token.text());
            case STRONG:
                return new Strong(parse(token.text()));
            case EMPHASIS:
                return new Emphasis(parse(token.text()));
            case STRIKETHROUGH:
                return new Strikethrough(parse(token.text()));
            case SUBSCRIPT:
                return new Subscript(parse(token.text()));
            case SUPERSCRIPT:
                return new Superscript(parse(token.text()));
            case CODE:
                return new Code(token.text());
            case CITATION: {
                CitationToken citation = (CitationToken) token.value();
                CitationStyle style = citation.suppressAuthor() ? CitationStyle.YEAR_ONLY : CitationStyle.PARENTHETICAL;
                return new Citation(citation.keys(), style, citation.prefix(), citation.locator());
            }
            case AUTHOR_CITATION:
                return new Citation(List.of(token.text()), CitationStyle.AUTHOR_ONLY, null, null);
            case INLINE_FOOTNOTE:
                return new Footnote(parse(token.text()));
            case FOOTNOTE_REFERENCE:
                return new FootnoteReference(token.text());
            case REFERENCE:
                return Reference.to(token.text());
            case LABEL:
                // annotations carry no visible text
                return null;
            case LINK: {
                LinkTarget target = (LinkTarget) token.value();
                return new Link(target.url(), target.title(), parse(token.text()));
            }
            case SMALL_CAPS:
                return new SmallCaps(parse(token.text()));
            case IMAGE: {
                LinkTarget target = (LinkTarget) token.value();
                return new Image(target.url(), token.text(), target.title());
            }
            case AUTOLINK:
                return new Link(token.text(), null, List.of(new Text(token.text())));
            case RAW_HTML:
                return new RawHtml(token.text());
            default:
                throw new IllegalStateException("Not an inline token: " + token.type());
        }
    }

    /**
     * Emits a soft or hard break for the newline at {@code pos}. Two trailing spaces or a trailing
     * backslash make it hard; an escaped backslash ({@code \\}) before the newline does not.
     * Whitespace around the newline is dropped.
     * @return The position after the newline and the next line's indentation.
     */
    private int lineBreak(String text, int pos, StringBuilder run, List<Inline> out) {
        boolean hard = false;
        int len = run.length();
        if (len > 0 && run.charAt(len - 1) == '\\' && backslashesBefore(text, pos) % 2 == 1) {
            hard = true;
            run.setLength(len - 1);
        } else if (len >= 2 && run.charAt(len - 1) == ' ' && run.charAt(len - 2) == ' ') {
            hard = true;
        }
        int end = run.length();
        while (end > 0 && (run.charAt(end - 1) == ' ' || run.charAt(end - 1) == '\t')) {
            end--;
        }
        run.setLength(end);
        flush(run, out);
        out.add(hard ? new HardBreak() : new SoftBreak());

        int next = pos + 1;
        while (next < text.length() && (text.charAt(next) == ' ' || text.charAt(next) == '\t')) {
            next++;
        }
        return next;
    }

    private static int backslashesBefore(String text, int pos) {
        int count = 0;
        while (pos - count > 0 && text.charAt(pos - count - 1) == '\\') {
            count++;
        }
        return count;
    }

    private static void flush(StringBuilder run, List<Inline> out) {
        if (run.length() > 0) {
            out.add(new Text(run.toString()));
            run.setLength(0);
        }
    }

    private static char previous(String text, int pos) {
        return pos == 0 ? ' ' : text.charAt(pos - 1);
    }
}
