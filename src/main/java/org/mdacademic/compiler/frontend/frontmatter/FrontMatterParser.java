package org.mdacademic.compiler.frontend.frontmatter;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.api.ParseException;
import org.mdacademic.compiler.frontend.parser.ast.Macro;
import org.mdacademic.compiler.frontend.parser.ast.Metadata;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits off and parses the TOML front matter delimited by {@code +++} lines.
 * <p>
 * The front matter must be the first non-whitespace content of the source. Recognized keys are
 * {@code title}, {@code subtitle}, {@code authors} (or a single {@code author}), {@code date},
 * {@code abstract}, {@code keywords}, {@code institution}, {@code department}, {@code advisor},
 * {@code lang}/{@code language}, {@code bibliography} (a path, or a table with a {@code path} key) and a
 * {@code [macros]} table of name to template. Unknown keys are ignored.
 */
public class FrontMatterParser {

    private static final String DELIMITER = "+++";

    private final TomlMapper mapper = new TomlMapper();

    /**
     * @param source The full document source.
     * @return The metadata and the remaining body.
     * @throws ParseException if the front matter is unclosed, not valid TOML, or has ill-typed values.
     */
    public FrontMatter parse(String source) throws ParseException {
        String text = source.startsWith("\uFEFF") ? source.substring(1) : source;
        String trimmed = text.stripLeading();
        if (!trimmed.startsWith(DELIMITER)) {
            return new FrontMatter(Metadata.empty(), text);
        }
        String afterOpen = trimmed.substring(DELIMITER.length());
        int close = afterOpen.indexOf("\n" + DELIMITER);
        if (close < 0) {
            throw new ParseException(CompilerErrorCode.FRONT_MATTER_UNCLOSED,
                    "Unclosed front matter: no closing '" + DELIMITER + "' line.");
        }
        String toml = afterOpen.substring(0, close);
        String afterClose = afterOpen.substring(close + 1 + DELIMITER.length());
        int lineEnd = afterClose.indexOf('\n');
        String body = lineEnd < 0 ? "" : afterClose.substring(lineEnd + 1);
        return new FrontMatter(toMetadata(readToml(toml)), body);
    }

    private JsonNode readToml(String toml) throws ParseException {
        try {
            return mapper.readTree(toml);
        } catch (JacksonException e) {
            throw new ParseException(CompilerErrorCode.FRONT_MATTER_INVALID,
                    "Invalid front matter: " + e.getOriginalMessage(), e);
        }
    }

    private Metadata toMetadata(JsonNode root) throws ParseException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Metadata.empty();
        }
        List<String> authors = stringList(root, "authors");
        if (authors.isEmpty()) {
            String author = scalar(root, "author");
            if (author != null) {
                authors = List.of(author);
            }
        }
        String language = scalar(root, "lang");
        if (language == null) {
            language = scalar(root, "language");
        }
        return new Metadata(
                scalar(root, "title"),
                scalar(root, "subtitle"),
                authors,
                scalar(root, "date"),
                scalar(root, "abstract"),
                stringList(root, "keywords"),
                scalar(root, "institution"),
                scalar(root, "department"),
                scalar(root, "advisor"),
                language,
                bibliography(root),
                macros(root));
    }

    private static String scalar(JsonNode root, String key) throws ParseException {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw invalid(key, "a string");
        }
        return node.asText();
    }

    private static List<String> stringList(JsonNode root, String key) throws ParseException {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isValueNode()) {
            return List.of(node.asText());
        }
        if (!node.isArray()) {
            throw invalid(key, "an array of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isValueNode()) {
                throw invalid(key, "an array of strings");
            }
            values.add(element.asText());
        }
        return values;
    }

    private static String bibliography(JsonNode root) throws ParseException {
        JsonNode node = root.get("bibliography");
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isObject() && node.path("path").isTextual()) {
            return node.get("path").asText();
        }
        throw invalid("bibliography", "a path or a table with a 'path' key");
    }

    private static Map<String, Macro> macros(JsonNode root) throws ParseException {
        JsonNode node = root.get("macros");
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw invalid("macros", "a table");
        }
        Map<String, Macro> macros = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw invalid("macros." + field.getKey(), "a template string");
            }
            macros.put(field.getKey(), Macro.fromTemplate(field.getValue().asText()));
        }
        return macros;
    }

    private static ParseException invalid(String key, String expected) {
        return new ParseException(CompilerErrorCode.FRONT_MATTER_INVALID,
                "Invalid front matter: '" + key + "' must be " + expected + ".");
    }
}
