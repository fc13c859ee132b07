package org.mdacademic.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document properties from the front matter. Scalars may be null; lists and the macro table are never null.
 *
 * @param title The title.
 * @param subtitle The subtitle.
 * @param authors The authors.
 * @param date The date as written.
 * @param abstractText The abstract given in the front matter.
 * @param keywords The keywords.
 * @param institution The institution.
 * @param department The department.
 * @param advisor The advisor.
 * @param language The document language.
 * @param bibliography The bibliography path, relative to the resolve base path.
 * @param macros User macros by name, in declaration order.
 */
public record Metadata(
        String title,
        String subtitle,
        List<String> authors,
        String date,
        String abstractText,
        List<String> keywords,
        String institution,
        String department,
        String advisor,
        String language,
        String bibliography,
        Map<String, Macro> macros
) {
    public Metadata {
        authors = authors == null ? List.of() : List.copyOf(authors);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        macros = macros == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(macros));
    }

    /**
     * @return Metadata for a document without front matter.
     */
    public static Metadata empty() {
        return new Metadata(null, null, List.of(), null, null, List.of(), null, null, null, null, null, Map.of());
    }
}
