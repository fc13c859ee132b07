package org.mdacademic.compiler.api;

import java.util.List;
import java.util.Map;

/**
 * A single bibliography entry as produced by a {@link BibliographyParser}.
 * All optional fields may be null; {@code authors} and {@code extra} are never null.
 *
 * @param key The citation key.
 * @param entryType The entry type in lower case (e.g., "article", "book").
 * @param title The title.
 * @param authors The author names, in order.
 * @param year The publication year as written.
 * @param journal The journal name.
 * @param booktitle The title of the containing book or proceedings.
 * @param publisher The publisher.
 * @param volume The volume.
 * @param number The issue number.
 * @param pages The page range.
 * @param doi The DOI.
 * @param url The URL.
 * @param extra All remaining fields by lower-case name.
 */
public record BibEntry(
        String key,
        String entryType,
        String title,
        List<String> authors,
        String year,
        String journal,
        String booktitle,
        String publisher,
        String volume,
        String number,
        String pages,
        String doi,
        String url,
        Map<String, String> extra
) {
    public BibEntry {
        authors = authors == null ? List.of() : List.copyOf(authors);
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    /**
     * Creates an entry with only a key and type, mostly useful for tests and programmatic bibliographies.
     * @param key The citation key.
     * @param entryType The entry type.
     * @return A new entry without fields.
     */
    public static BibEntry of(String key, String entryType) {
        return new BibEntry(key, entryType, null, List.of(), null, null, null, null, null, null, null, null, null, Map.of());
    }
}
