package org.mdacademic.compiler.frontend.semantics.numbering;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Numbers assigned to labeled items.
 *
 * @param sectionNumbers Dotted section numbers by heading label.
 * @param envNumbers Counter values by label of an equation, environment or table.
 */
public record NumberingResult(Map<String, String> sectionNumbers, Map<String, Integer> envNumbers) {

    public NumberingResult {
        sectionNumbers = Collections.unmodifiableMap(new LinkedHashMap<>(sectionNumbers));
        envNumbers = Collections.unmodifiableMap(new LinkedHashMap<>(envNumbers));
    }
}
