package org.mdacademic.compiler.bibliography;

import org.mdacademic.compiler.api.BibEntry;
import org.mdacademic.compiler.api.BibliographyParser;
import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.api.ResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * A tolerant BibTeX reader.
 * <p>
 * Entries are {@code @type{key, name = value, ...}} where a value is a braced group, a quoted string or
 * a bare number. {@code @comment}, {@code @preamble} and {@code @string} blocks are skipped, as are
 * {@code %} line comments and any text between entries. An entry that is syntactically broken is
 * skipped and parsing resumes at the next {@code @}; only an entry whose braces never balance makes
 * the whole file invalid. Later entries replace earlier ones with the same key.
 */
public class BibTexParser implements BibliographyParser {

    private static final Logger LOG = LoggerFactory.getLogger(BibTexParser.class);

    private static final Set<String> SKIPPED_TYPES = Set.of("comment", "preamble", "string");
    private static final Set<String> KNOWN_FIELDS = Set.of(
            "title", "author", "year", "journal", "booktitle", "publisher", "volume", "number", "pages", "doi", "url");

    @Override
    public Map<String, BibEntry> parse(String source) throws ResolutionException {
        Map<String, BibEntry> entries = new LinkedHashMap<>();
        int pos = 0;
        while (true) {
            int at = nextEntry(source, pos);
            if (at < 0) {
                break;
            }
            int bodyEnd = entryEnd(source, at);
            if (bodyEnd == -2) {
                throw new ResolutionException(CompilerErrorCode.BIBLIOGRAPHY_INVALID,
                        "Unbalanced braces in bibliography entry starting at offset " + at + ".");
            }
            if (bodyEnd < 0) {
                // not an entry header; keep scanning after the '@'
                pos = at + 1;
                continue;
            }
            BibEntry entry = parseEntry(source.substring(at + 1, bodyEnd + 1));
            if (entry != null) {
                entries.put(entry.key(), entry);
            }
            pos = bodyEnd + 1;
        }
        LOG.debug("{} bibliography entries", entries.size());
        return entries;
    }

    /**
     * Finds the next '@' that is not inside a {@code %} comment.
     */
    private static int nextEntry(String s, int from) {
        int i = from;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '%') {
                int eol = s.indexOf('\n', i);
                if (eol < 0) {
                    return -1;
                }
                i = eol + 1;
            } else if (c == '@') {
                return i;
            } else {
                i++;
            }
        }
        return -1;
    }

    /**
     * @return The index of the brace closing the entry at {@code at}, -1 if no entry header follows the
     *         '@', or -2 if the braces never balance.
     */
    private static int entryEnd(String s, int at) {
        int i = at + 1;
        while (i < s.length() && Character.isLetterOrDigit(s.charAt(i))) {
            i++;
        }
        if (i == at + 1) {
            return -1;
        }
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        if (i >= s.length() || s.charAt(i) != '{') {
            return -1;
        }
        int depth = 0;
        for (; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -2;
    }

    /**
     * @param text The entry without the leading '@', from the type to the closing brace inclusive.
     * @return The entry, or null for skipped block types and malformed entries.
     */
    private static BibEntry parseEntry(String text) {
        int open = text.indexOf('{');
        String type = text.substring(0, open).strip().toLowerCase(Locale.ROOT);
        if (SKIPPED_TYPES.contains(type)) {
            return null;
        }
        String body = text.substring(open + 1, text.length() - 1);
        int comma = body.indexOf(',');
        String key = (comma < 0 ? body : body.substring(0, comma)).strip();
        if (key.isEmpty() || !validKey(key)) {
            LOG.warn("Skipping @{} entry without a valid key", type);
            return null;
        }
        Map<String, String> fields = comma < 0 ? Map.of() : parseFields(body.substring(comma + 1));
        return build(key, type, fields);
    }

    private static boolean validKey(String key) {
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ':' || c == '.')) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, String> parseFields(String s) {
        Map<String, String> fields = new LinkedHashMap<>();
        int i = 0;
        while (i < s.length()) {
            i = skipWhitespaceAndCommas(s, i);
            int nameStart = i;
            while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_' || s.charAt(i) == '-')) {
                i++;
            }
            if (i == nameStart) {
                break;
            }
            String name = s.substring(nameStart, i).toLowerCase(Locale.ROOT);
            i = skipWhitespace(s, i);
            if (i >= s.length() || s.charAt(i) != '=') {
                break;
            }
            i = skipWhitespace(s, i + 1);
            if (i >= s.length()) {
                break;
            }
            int valueEnd;
            String value;
            char c = s.charAt(i);
            if (c == '{') {
                valueEnd = closing(s, i, '{', '}');
                if (valueEnd < 0) {
                    break;
                }
                value = clean(s.substring(i + 1, valueEnd));
                i = valueEnd + 1;
            } else if (c == '"') {
                valueEnd = closingQuote(s, i);
                if (valueEnd < 0) {
                    break;
                }
                value = clean(s.substring(i + 1, valueEnd));
                i = valueEnd + 1;
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < s.length() && Character.isDigit(s.charAt(i))) {
                    i++;
                }
                value = s.substring(start, i);
            } else {
                break;
            }
            fields.put(name, value);
        }
        return fields;
    }

    private static int closing(String s, int open, char opening, char closing) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == opening) {
                depth++;
            } else if (c == closing) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int closingQuote(String s, int open) {
        for (int i = open + 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Drops grouping braces, keeps braces that belong to a LaTeX command such as {@code {\"o}}, and
     * collapses whitespace.
     */
    static String clean(String value) {
        StringBuilder out = new StringBuilder(value.length());
        int depth = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '{') {
                if (i + 1 < value.length() && value.charAt(i + 1) == '\\') {
                    out.append(c);
                    depth++;
                }
            } else if (c == '}') {
                if (depth > 0) {
                    out.append(c);
                    depth--;
                }
            } else {
                out.append(c);
            }
        }
        return String.join(" ", out.toString().strip().split("\\s+"));
    }

    private static int skipWhitespace(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int skipWhitespaceAndCommas(String s, int i) {
        while (i < s.length() && (Character.isWhitespace(s.charAt(i)) || s.charAt(i) == ',')) {
            i++;
        }
        return i;
    }

    private static BibEntry build(String key, String type, Map<String, String> fields) {
        Map<String, String> extra = new LinkedHashMap<>();
        fields.forEach((name, value) -> {
            if (!KNOWN_FIELDS.contains(name)) {
                extra.put(name, value);
            }
        });
        return new BibEntry(key, type,
                fields.get("title"),
                authors(fields.get("author")),
                fields.get("year"),
                fields.get("journal"),
                fields.get("booktitle"),
                fields.get("publisher"),
                fields.get("volume"),
                fields.get("number"),
                fields.get("pages"),
                fields.get("doi"),
                fields.get("url"),
                extra);
    }

    private static List<String> authors(String field) {
        List<String> authors = new ArrayList<>();
        if (field == null) {
            return authors;
        }
        for (String author : field.split(" and ")) {
            if (!author.isBlank()) {
                authors.add(author.strip());
            }
        }
        return authors;
    }
}
