package org.mdacademic.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recognizes the atomic lexical patterns of academic Markdown.
 * <p>
 * Every method looks at the start of its input only and either returns a token together with the
 * unconsumed remainder, or {@link Optional#empty()}. Nothing is consumed past the closing delimiter of
 * a match, and a recognizer never partially succeeds. Line-level methods take a single source line;
 * inline methods take the text from the parser's cursor to the end of the paragraph.
 */
public final class Lexer {

    private static final Set<String> PAGE_BREAKS = Set.of(
            "---pagebreak---", "\\pagebreak", "\\newpage", "<!-- pagebreak -->", "<!-- newpage -->");
    private static final Set<String> APPENDIX_MARKERS = Set.of(
            "\\appendix", "---appendix---", "<!-- appendix -->");
    private static final String TOC = "[[toc]]";
    private static final String CITATION_KEY_PUNCTUATION = "_-:.#$%&+?/";

    private Lexer() {}

    // region Line-level recognizers

    /**
     * ATX heading: one to six {@code #}, whitespace, text. A closing run of {@code #} is removed when a
     * space precedes it.
     * @param line The source line.
     * @return A HEADING token with the level as value.
     */
    public static Optional<Token> heading(String line) {
        String s = line.stripLeading();
        int hashes = countRun(s, 0, '#');
        if (hashes == 0 || hashes > 6 || hashes == s.length() || !isSpace(s.charAt(hashes))) {
            return Optional.empty();
        }
        String content = stripClosingHashes(s.substring(hashes).strip());
        return Optional.of(new Token(TokenType.HEADING, content, hashes, ""));
    }

    /**
     * Three or more {@code -}, {@code *} or {@code _}, optionally separated by spaces, and nothing else.
     * @param line The source line.
     * @return A THEMATIC_BREAK token.
     */
    public static Optional<Token> thematicBreak(String line) {
        String s = line.strip();
        if (s.isEmpty()) {
            return Optional.empty();
        }
        char c = s.charAt(0);
        if (c != '-' && c != '*' && c != '_') {
            return Optional.empty();
        }
        int count = 0;
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == c) {
                count++;
            } else if (!isSpace(ch)) {
                return Optional.empty();
            }
        }
        return count >= 3 ? Optional.of(new Token(TokenType.THEMATIC_BREAK, s, null, "")) : Optional.empty();
    }

    /**
     * @param line The source line.
     * @return A PAGE_BREAK token if the trimmed line is one of the page break markers.
     */
    public static Optional<Token> pageBreak(String line) {
        String s = line.strip();
        return PAGE_BREAKS.contains(s) ? Optional.of(new Token(TokenType.PAGE_BREAK, s, null, "")) : Optional.empty();
    }

    /**
     * @param line The source line.
     * @return An APPENDIX_MARKER token if the trimmed line is one of the appendix markers.
     */
    public static Optional<Token> appendixMarker(String line) {
        String s = line.strip();
        return APPENDIX_MARKERS.contains(s)
                ? Optional.of(new Token(TokenType.APPENDIX_MARKER, s, null, ""))
                : Optional.empty();
    }

    /**
     * @param line The source line.
     * @return A TABLE_OF_CONTENTS token for {@code [[toc]]}.
     */
    public static Optional<Token> tableOfContents(String line) {
        String s = line.strip();
        return TOC.equals(s) ? Optional.of(new Token(TokenType.TABLE_OF_CONTENTS, s, null, "")) : Optional.empty();
    }

    /**
     * Opening code fence: three or more backticks or tildes, then an optional language tag.
     * @param line The source line.
     * @return A CODE_FENCE token whose text is the fence and whose value is the language or null.
     */
    public static Optional<Token> codeFence(String line) {
        String s = line.stripLeading();
        if (s.isEmpty() || (s.charAt(0) != '`' && s.charAt(0) != '~')) {
            return Optional.empty();
        }
        char c = s.charAt(0);
        int n = countRun(s, 0, c);
        if (n < 3) {
            return Optional.empty();
        }
        String info = s.substring(n).strip();
        if (c == '`' && info.indexOf('`') >= 0) {
            return Optional.empty();
        }
        int end = 0;
        while (end < info.length() && isLanguageChar(info.charAt(end))) {
            end++;
        }
        String language = end > 0 ? info.substring(0, end) : null;
        return Optional.of(new Token(TokenType.CODE_FENCE, s.substring(0, n), language, info));
    }

    /**
     * @param line The source line.
     * @param fence The opening fence.
     * @return Whether the line closes a code block opened by {@code fence}.
     */
    public static boolean closesFence(String line, String fence) {
        String s = line.strip();
        int n = countRun(s, 0, fence.charAt(0));
        return n >= fence.length() && n == s.length();
    }

    /**
     * @param line The source line.
     * @return A MATH_FENCE token if the line starts with {@code $$}; the remainder follows the delimiter.
     */
    public static Optional<Token> mathFence(String line) {
        String s = line.stripLeading();
        return s.startsWith("$$")
                ? Optional.of(new Token(TokenType.MATH_FENCE, "$$", null, s.substring(2)))
                : Optional.empty();
    }

    /**
     * Environment opener: {@code :::}, a keyword of letters, digits, {@code -} or {@code _}, and an
     * optional label annotation.
     * @param line The source line.
     * @return An ENVIRONMENT_OPEN token with the keyword as text and the label (or null) as value.
     */
    public static Optional<Token> environmentOpen(String line) {
        String s = line.strip();
        if (!s.startsWith(":::")) {
            return Optional.empty();
        }
        String after = s.substring(3).stripLeading();
        int end = 0;
        while (end < after.length() && isKeywordChar(after.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return Optional.empty();
        }
        String keyword = after.substring(0, end);
        String remainder = after.substring(end).strip();
        String label = labelSuffix(remainder).map(Token::text).orElse(null);
        return Optional.of(new Token(TokenType.ENVIRONMENT_OPEN, keyword, label, remainder));
    }

    /**
     * @param line The source line.
     * @return Whether the line is exactly {@code :::}, ignoring surrounding whitespace.
     */
    public static boolean closesEnvironment(String line) {
        return ":::".equals(line.strip());
    }

    /**
     * List item marker: {@code - [ ]}/{@code - [x]} task markers, {@code -}/{@code *}/{@code +} bullets,
     * or one to nine digits followed by {@code .} or {@code )}. The marker must be followed by whitespace
     * or the end of the line.
     * @param line The source line.
     * @return A LIST_MARKER token; the remainder is the item text.
     */
    public static Optional<Token> listMarker(String line) {
        String s = line.stripLeading();
        if (s.isEmpty()) {
            return Optional.empty();
        }
        char c = s.charAt(0);
        if (c == '-' || c == '*' || c == '+') {
            if (s.length() > 1 && !isSpace(s.charAt(1))) {
                return Optional.empty();
            }
            int spaces = countSpaces(s, 1);
            String rest = s.substring(1 + spaces);
            if (spaces > 0 && rest.length() >= 3 && rest.charAt(0) == '[' && rest.charAt(2) == ']'
                    && "xX ".indexOf(rest.charAt(1)) >= 0
                    && (rest.length() == 3 || isSpace(rest.charAt(3)))) {
                int boxSpaces = countSpaces(rest, 3);
                int width = 1 + spaces + 3 + boxSpaces;
                ListMarker marker = new ListMarker(ListMarker.Kind.CHECKBOX, 0, rest.charAt(1) != ' ', width);
                return Optional.of(new Token(TokenType.LIST_MARKER, String.valueOf(c), marker, s.substring(width)));
            }
            ListMarker marker = new ListMarker(ListMarker.Kind.UNORDERED, 0, null, 1 + spaces);
            return Optional.of(new Token(TokenType.LIST_MARKER, String.valueOf(c), marker, rest));
        }
        int digits = 0;
        while (digits < s.length() && Character.isDigit(s.charAt(digits)) && s.charAt(digits) < 128) {
            digits++;
        }
        if (digits == 0 || digits > 9 || digits == s.length()) {
            return Optional.empty();
        }
        char delimiter = s.charAt(digits);
        if (delimiter != '.' && delimiter != ')') {
            return Optional.empty();
        }
        if (s.length() > digits + 1 && !isSpace(s.charAt(digits + 1))) {
            return Optional.empty();
        }
        int spaces = countSpaces(s, digits + 1);
        int width = digits + 1 + spaces;
        ListMarker marker = new ListMarker(ListMarker.Kind.ORDERED, Integer.parseInt(s.substring(0, digits)), null, width);
        return Optional.of(new Token(TokenType.LIST_MARKER, s.substring(0, digits + 1), marker, s.substring(width)));
    }

    /**
     * Footnote definition: {@code [^id]: body}.
     * @param line The source line.
     * @return A FOOTNOTE_DEFINITION token with the id as text; the remainder is the body.
     */
    public static Optional<Token> footnoteDefinition(String line) {
        String s = line.stripLeading();
        Optional<Token> ref = footnoteReference(s);
        if (ref.isEmpty() || !ref.get().rest().startsWith(":")) {
            return Optional.empty();
        }
        String body = ref.get().rest().substring(1).strip();
        return Optional.of(new Token(TokenType.FOOTNOTE_DEFINITION, ref.get().text(), null, body));
    }

    /**
     * @param line The source line.
     * @return A TABLE_CAPTION token for lines starting with {@code Table:} or {@code Caption:}.
     */
    public static Optional<Token> tableCaption(String line) {
        String s = line.strip();
        for (String prefix : List.of("Table:", "Caption:")) {
            if (s.startsWith(prefix)) {
                return Optional.of(new Token(TokenType.TABLE_CAPTION, prefix, null, s.substring(prefix.length()).strip()));
            }
        }
        return Optional.empty();
    }

    // endregion

    // region Inline recognizers

    /**
     * Math span. {@code $$...$$} is taken first. A single {@code $} opens only when followed by a
     * non-space character and closes at the next unescaped {@code $} that follows a non-space character
     * and is not followed by a digit, so amounts like "$5 and $10" stay text.
     * @param s The input at the cursor.
     * @return An INLINE_MATH token with the LaTeX as text.
     */
    public static Optional<Token> inlineMath(String s) {
        if (s.startsWith("$$")) {
            int close = s.indexOf("$$", 2);
            if (close > 2) {
                return Optional.of(new Token(TokenType.INLINE_MATH, s.substring(2, close).strip(), null, s.substring(close + 2)));
            }
            return Optional.empty();
        }
        if (!s.startsWith("$") || s.length() < 3 || Character.isWhitespace(s.charAt(1))) {
            return Optional.empty();
        }
        for (int j = 2; j < s.length(); j++) {
            char prev = s.charAt(j - 1);
            if (s.charAt(j) == '$' && prev != '\\' && !Character.isWhitespace(prev)
                    && (j + 1 >= s.length() || !Character.isDigit(s.charAt(j + 1)))) {
                return Optional.of(new Token(TokenType.INLINE_MATH, s.substring(1, j), null, s.substring(j + 1)));
            }
        }
        return Optional.empty();
    }

    /**
     * Double-delimiter span such as {@code **strong**}, {@code __strong__} or {@code ~~struck~~}.
     * The opener must be followed by a non-space character and the closer preceded by one. When the
     * closer sits inside a longer run of the delimiter character, the rightmost position is used.
     * @param s The input at the cursor.
     * @param delimiter The two-character delimiter.
     * @param type The token type to produce.
     * @return A token whose text is the inner source.
     */
    public static Optional<Token> doubleDelimited(String s, String delimiter, TokenType type) {
        int d = delimiter.length();
        if (!s.startsWith(delimiter) || s.length() <= 2 * d || Character.isWhitespace(s.charAt(d))) {
            return Optional.empty();
        }
        int from = d + 1;
        while (true) {
            int idx = s.indexOf(delimiter, from);
            if (idx < 0) {
                return Optional.empty();
            }
            while (idx + d < s.length() && s.charAt(idx + d) == delimiter.charAt(0)) {
                idx++;
            }
            if (!Character.isWhitespace(s.charAt(idx - 1))) {
                return Optional.of(new Token(type, s.substring(d, idx), null, s.substring(idx + d)));
            }
            from = idx + d;
        }
    }

    /**
     * Single-delimiter emphasis with {@code *} or {@code _}. Doubled delimiters inside the span are
     * skipped so strong text can nest. An underscore does not close inside a word.
     * @param s The input at the cursor.
     * @return An EMPHASIS token whose text is the inner source.
     */
    public static Optional<Token> emphasis(String s) {
        if (s.length() < 3) {
            return Optional.empty();
        }
        char c = s.charAt(0);
        if ((c != '*' && c != '_') || s.charAt(1) == c || Character.isWhitespace(s.charAt(1))) {
            return Optional.empty();
        }
        int j = 1;
        while (j < s.length()) {
            if (s.charAt(j) != c) {
                j++;
                continue;
            }
            if (j + 1 < s.length() && s.charAt(j + 1) == c) {
                j += 2;
                continue;
            }
            boolean closes = !Character.isWhitespace(s.charAt(j - 1))
                    && (c != '_' || j + 1 >= s.length() || !Character.isLetterOrDigit(s.charAt(j + 1)));
            if (closes) {
                return Optional.of(new Token(TokenType.EMPHASIS, s.substring(1, j), null, s.substring(j + 1)));
            }
            j++;
        }
        return Optional.empty();
    }

    /**
     * {@code ~sub~} or {@code ^sup^}: a single delimiter, no whitespace inside, non-empty.
     * @param s The input at the cursor.
     * @param delimiter {@code ~} or {@code ^}.
     * @param type SUBSCRIPT or SUPERSCRIPT.
     * @return A token whose text is the inner source.
     */
    public static Optional<Token> script(String s, char delimiter, TokenType type) {
        if (s.length() < 3 || s.charAt(0) != delimiter || s.charAt(1) == delimiter || s.charAt(1) == '[') {
            return Optional.empty();
        }
        for (int j = 1; j < s.length(); j++) {
            char ch = s.charAt(j);
            if (Character.isWhitespace(ch)) {
                return Optional.empty();
            }
            if (ch == delimiter) {
                return j > 1 ? Optional.of(new Token(type, s.substring(1, j), null, s.substring(j + 1))) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Code span: a run of N backticks closed by a run of exactly N backticks. One leading and one trailing
     * space are removed when both are present.
     * @param s The input at the cursor.
     * @return A CODE token.
     */
    public static Optional<Token> code(String s) {
        int n = countRun(s, 0, '`');
        if (n == 0) {
            return Optional.empty();
        }
        int j = n;
        while (j < s.length()) {
            if (s.charAt(j) != '`') {
                j++;
                continue;
            }
            int run = countRun(s, j, '`');
            if (run == n) {
                String code = s.substring(n, j);
                if (code.length() >= 2 && code.startsWith(" ") && code.endsWith(" ") && !code.isBlank()) {
                    code = code.substring(1, code.length() - 1);
                }
                return Optional.of(new Token(TokenType.CODE, code, null, s.substring(j + n)));
            }
            j += run;
        }
        return Optional.empty();
    }

    /**
     * Bracketed citation: {@code [@a]}, {@code [@a, p. 4]}, {@code [@a; @b]}, {@code [-@a]},
     * {@code [see @a, ch. 2]}. Every semicolon-separated part must contain a key.
     * @param s The input at the cursor.
     * @return A CITATION token with a {@link CitationToken} value.
     */
    public static Optional<Token> citation(String s) {
        if (!s.startsWith("[")) {
            return Optional.empty();
        }
        int close = s.indexOf(']');
        if (close < 0) {
            return Optional.empty();
        }
        String content = s.substring(1, close);
        if (content.indexOf('[') >= 0 || content.indexOf('@') < 0) {
            return Optional.empty();
        }
        String rest = s.substring(close + 1);
        if (rest.startsWith("(")) {
            return Optional.empty();
        }

        List<String> keys = new ArrayList<>();
        String prefix = null;
        String locator = null;
        boolean suppressAuthor = false;
        String[] parts = content.split(";", -1);
        for (int p = 0; p < parts.length; p++) {
            String part = parts[p].strip();
            int at = findKeyMarker(part);
            if (at < 0) {
                return Optional.empty();
            }
            String before = part.substring(0, at).strip();
            boolean dash = before.endsWith("-");
            if (dash) {
                before = before.substring(0, before.length() - 1).strip();
            }
            int keyEnd = at + 1;
            while (keyEnd < part.length() && isCitationKeyChar(part.charAt(keyEnd))) {
                keyEnd++;
            }
            while (keyEnd > at + 1 && ".:-".indexOf(part.charAt(keyEnd - 1)) >= 0) {
                keyEnd--;
            }
            if (keyEnd == at + 1) {
                return Optional.empty();
            }
            keys.add(part.substring(at + 1, keyEnd));
            String after = part.substring(keyEnd).strip();
            if (after.startsWith(",")) {
                after = after.substring(1).strip();
            }
            if (locator == null && !after.isEmpty()) {
                locator = after;
            }
            if (p == 0) {
                prefix = before.isEmpty() ? null : before;
                suppressAuthor = dash;
            }
        }
        return Optional.of(new Token(TokenType.CITATION, content, new CitationToken(keys, prefix, locator, suppressAuthor), rest));
    }

    /**
     * Inline footnote {@code ^[body]}; brackets inside the body are balanced.
     * @param s The input at the cursor.
     * @return An INLINE_FOOTNOTE token with the body as text.
     */
    public static Optional<Token> inlineFootnote(String s) {
        if (!s.startsWith("^[")) {
            return Optional.empty();
        }
        int close = matchingClose(s, 1, '[', ']');
        if (close < 0) {
            return Optional.empty();
        }
        return Optional.of(new Token(TokenType.INLINE_FOOTNOTE, s.substring(2, close), null, s.substring(close + 1)));
    }

    /**
     * Footnote reference {@code [^id]}; the id contains no whitespace.
     * @param s The input at the cursor.
     * @return A FOOTNOTE_REFERENCE token with the id as text.
     */
    public static Optional<Token> footnoteReference(String s) {
        if (!s.startsWith("[^")) {
            return Optional.empty();
        }
        int j = 2;
        while (j < s.length() && s.charAt(j) != ']' && !Character.isWhitespace(s.charAt(j)) && s.charAt(j) != '[') {
            j++;
        }
        if (j == 2 || j >= s.length() || s.charAt(j) != ']') {
            return Optional.empty();
        }
        return Optional.of(new Token(TokenType.FOOTNOTE_REFERENCE, s.substring(2, j), null, s.substring(j + 1)));
    }

    /**
     * Bare reference {@code @label}, where the label consists of letters, digits, {@code :}, {@code -}
     * and {@code _}. An {@code @} directly followed by {@code [} is not a reference. A trailing
     * {@code -} makes the token an author-only citation; trailing colons are punctuation.
     * @param s The input at the cursor.
     * @return A REFERENCE or AUTHOR_CITATION token with the label or key as text.
     */
    public static Optional<Token> reference(String s) {
        if (s.length() < 2 || s.charAt(0) != '@' || s.charAt(1) == '[') {
            return Optional.empty();
        }
        if (!Character.isLetterOrDigit(s.charAt(1)) && s.charAt(1) != '_') {
            return Optional.empty();
        }
        int end = 1;
        while (end < s.length() && isReferenceChar(s.charAt(end))) {
            end++;
        }
        while (s.charAt(end - 1) == ':') {
            end--;
        }
        String label = s.substring(1, end);
        String rest = s.substring(end);
        if (label.endsWith("-")) {
            String key = label.replaceAll("-+$", "");
            if (!key.isEmpty()) {
                return Optional.of(new Token(TokenType.AUTHOR_CITATION, key, null, rest));
            }
        }
        return Optional.of(new Token(TokenType.REFERENCE, label, null, rest));
    }

    /**
     * Attribute block at the cursor: {@code {#id}}, {@code {#id .unnumbered}}, {@code {-}}.
     * Blocks with neither an id nor an unnumbered flag are not labels.
     * @param s The input at the cursor.
     * @return A LABEL token with the id (or null) as text and {@link LabelAttributes} as value.
     */
    public static Optional<Token> label(String s) {
        if (!s.startsWith("{")) {
            return Optional.empty();
        }
        int close = s.indexOf('}');
        if (close < 0) {
            return Optional.empty();
        }
        String inner = s.substring(1, close).strip();
        if (inner.isEmpty() || inner.indexOf('{') >= 0) {
            return Optional.empty();
        }
        String id = null;
        boolean numbered = true;
        for (String part : inner.split("\\s+")) {
            if (part.startsWith("#") && part.length() > 1) {
                id = part.substring(1);
            } else if (part.equals("-") || part.equals(".unnumbered")) {
                numbered = false;
            } else if (!part.startsWith(".") && !part.contains("=")) {
                return Optional.empty();
            }
        }
        if (id == null && numbered) {
            return Optional.empty();
        }
        return Optional.of(new Token(TokenType.LABEL, id, new LabelAttributes(id, numbered), s.substring(close + 1)));
    }

    /**
     * Label annotation at the end of a text, as written after headings, equations and captions.
     * Unlike the other recognizers this one scans from the right: the token's {@code rest} is the text
     * before the annotation, trailing whitespace removed.
     * @param text The text.
     * @return A LABEL token, if the text ends with an attribute block.
     */
    public static Optional<Token> labelSuffix(String text) {
        String s = text.stripTrailing();
        if (!s.endsWith("}")) {
            return Optional.empty();
        }
        int open = s.lastIndexOf('{');
        if (open < 0) {
            return Optional.empty();
        }
        return label(s.substring(open))
                .filter(t -> t.rest().isEmpty())
                .map(t -> new Token(TokenType.LABEL, t.text(), t.value(), s.substring(0, open).stripTrailing()));
    }

    /**
     * Link {@code [text](url "title")}, or small caps {@code [text]{.smallcaps}}. Brackets and
     * parentheses nest.
     * @param s The input at the cursor.
     * @return A LINK token with a {@link LinkTarget}, or a SMALL_CAPS token.
     */
    public static Optional<Token> link(String s) {
        if (!s.startsWith("[")) {
            return Optional.empty();
        }
        int closeText = matchingClose(s, 0, '[', ']');
        if (closeText < 0) {
            return Optional.empty();
        }
        String text = s.substring(1, closeText);
        String after = s.substring(closeText + 1);
        if (after.startsWith("{.smallcaps}")) {
            return Optional.of(new Token(TokenType.SMALL_CAPS, text, null, after.substring("{.smallcaps}".length())));
        }
        if (!after.startsWith("(")) {
            return Optional.empty();
        }
        int closeDest = matchingClose(after, 0, '(', ')');
        if (closeDest < 0) {
            return Optional.empty();
        }
        LinkTarget target = linkTarget(after.substring(1, closeDest).strip());
        return Optional.of(new Token(TokenType.LINK, text, target, after.substring(closeDest + 1)));
    }

    /**
     * Image {@code ![alt](url "title")}.
     * @param s The input at the cursor.
     * @return An IMAGE token with the alt text and a {@link LinkTarget}.
     */
    public static Optional<Token> image(String s) {
        if (!s.startsWith("![")) {
            return Optional.empty();
        }
        return link(s.substring(1))
                .filter(t -> t.type() == TokenType.LINK)
                .map(t -> new Token(TokenType.IMAGE, t.text(), t.value(), t.rest()));
    }

    /**
     * Autolink {@code <scheme:...>}.
     * @param s The input at the cursor.
     * @return An AUTOLINK token with the URL as text.
     */
    public static Optional<Token> autolink(String s) {
        if (!s.startsWith("<") || s.length() < 4 || !isAsciiLetter(s.charAt(1))) {
            return Optional.empty();
        }
        int j = 2;
        while (j < s.length() && (isAsciiLetter(s.charAt(j)) || Character.isDigit(s.charAt(j)) || "+.-".indexOf(s.charAt(j)) >= 0)) {
            j++;
        }
        if (j < 3 || j >= s.length() || s.charAt(j) != ':') {
            return Optional.empty();
        }
        int close = j + 1;
        while (close < s.length() && s.charAt(close) != '>') {
            char ch = s.charAt(close);
            if (Character.isWhitespace(ch) || ch == '<') {
                return Optional.empty();
            }
            close++;
        }
        if (close >= s.length()) {
            return Optional.empty();
        }
        return Optional.of(new Token(TokenType.AUTOLINK, s.substring(1, close), null, s.substring(close + 1)));
    }

    /**
     * Inline HTML: an opening or closing tag, or a comment.
     * @param s The input at the cursor.
     * @return A RAW_HTML token with the markup as text.
     */
    public static Optional<Token> rawHtml(String s) {
        if (s.startsWith("<!--")) {
            int close = s.indexOf("-->", 4);
            return close < 0 ? Optional.empty()
                    : Optional.of(new Token(TokenType.RAW_HTML, s.substring(0, close + 3), null, s.substring(close + 3)));
        }
        if (s.length() < 3 || s.charAt(0) != '<') {
            return Optional.empty();
        }
        int nameStart = s.charAt(1) == '/' ? 2 : 1;
        if (nameStart >= s.length() || !isAsciiLetter(s.charAt(nameStart))) {
            return Optional.empty();
        }
        int close = s.indexOf('>', nameStart);
        if (close < 0) {
            return Optional.empty();
        }
        return Optional.of(new Token(TokenType.RAW_HTML, s.substring(0, close + 1), null, s.substring(close + 1)));
    }

    // endregion

    // region Helpers

    /**
     * @param s The string.
     * @param open The index of the opening character.
     * @param openChar The opening bracket.
     * @param closeChar The closing bracket.
     * @return The index of the balancing closing bracket, or -1.
     */
    static int matchingClose(String s, int open, char openChar, char closeChar) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '\\' && i + 1 < s.length()) {
                i++;
            } else if (ch == openChar) {
                depth++;
            } else if (ch == closeChar) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * @param line A source line.
     * @return The number of leading whitespace characters.
     */
    public static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && isSpace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    private static LinkTarget linkTarget(String dest) {
        String url = dest;
        String title = null;
        if (dest.length() >= 2) {
            char last = dest.charAt(dest.length() - 1);
            if (last == '"' || last == '\'') {
                int open = dest.lastIndexOf(last, dest.length() - 2);
                if (open > 0 && Character.isWhitespace(dest.charAt(open - 1))) {
                    title = dest.substring(open + 1, dest.length() - 1);
                    url = dest.substring(0, open).strip();
                }
            }
        }
        if (url.startsWith("<") && url.endsWith(">")) {
            url = url.substring(1, url.length() - 1);
        }
        return new LinkTarget(url, title);
    }

    private static int findKeyMarker(String part) {
        for (int i = 0; i < part.length(); i++) {
            if (part.charAt(i) == '@' && (i == 0 || Character.isWhitespace(part.charAt(i - 1)) || part.charAt(i - 1) == '-')) {
                return i;
            }
        }
        return -1;
    }

    private static String stripClosingHashes(String content) {
        int i = content.length();
        while (i > 0 && content.charAt(i - 1) == '#') {
            i--;
        }
        if (i == content.length()) {
            return content;
        }
        if (i == 0) {
            return "";
        }
        return isSpace(content.charAt(i - 1)) ? content.substring(0, i).strip() : content;
    }

    private static int countRun(String s, int from, char c) {
        int i = from;
        while (i < s.length() && s.charAt(i) == c) {
            i++;
        }
        return i - from;
    }

    private static int countSpaces(String s, int from) {
        int i = from;
        while (i < s.length() && isSpace(s.charAt(i))) {
            i++;
        }
        return i - from;
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isLanguageChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '+' || c == '#' || c == '.';
    }

    private static boolean isKeywordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_';
    }

    private static boolean isReferenceChar(char c) {
        return Character.isLetterOrDigit(c) || c == ':' || c == '-' || c == '_';
    }

    private static boolean isCitationKeyChar(char c) {
        return Character.isLetterOrDigit(c) || CITATION_KEY_PUNCTUATION.indexOf(c) >= 0;
    }

    // endregion
}
