package org.mdacademic.compiler.frontend.semantics;

import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.api.LabelInfo;
import org.mdacademic.compiler.diagnostics.DiagnosticsEngine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps every label defined in a document to its display text and anchor id.
 * <p>
 * Labels share one namespace across headings, equations, environments and tables. Defining a label
 * twice reports {@link CompilerErrorCode#DUPLICATE_LABEL}; the first definition is kept.
 */
public class LabelRegistry {

    private final Map<String, LabelInfo> labels = new LinkedHashMap<>();
    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a new, empty label registry.
     * @param diagnostics The engine for reporting duplicate labels.
     */
    public LabelRegistry(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Defines a label.
     * @param label The label.
     * @param displayText The text references to it render as.
     * @return {@code true} if the label was new.
     */
    public boolean define(String label, String displayText) {
        if (labels.containsKey(label)) {
            diagnostics.reportError(CompilerErrorCode.DUPLICATE_LABEL,
                    "Label '" + label + "' is already defined.", label);
            return false;
        }
        labels.put(label, new LabelInfo(displayText, stableId(label)));
        return true;
    }

    /**
     * @param label The label.
     * @return The label's information, if defined.
     */
    public Optional<LabelInfo> resolve(String label) {
        return Optional.ofNullable(labels.get(label));
    }

    /**
     * @return All labels in definition order. Unmodifiable.
     */
    public Map<String, LabelInfo> asMap() {
        return Collections.unmodifiableMap(labels);
    }

    /**
     * Derives an anchor id from a label: letters, digits, '-' and '_' are kept, everything else
     * becomes '-'.
     * @param label The label.
     * @return The id, e.g. "sec-intro" for "sec:intro".
     */
    public static String stableId(String label) {
        StringBuilder id = new StringBuilder(label.length());
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            id.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' ? c : '-');
        }
        return id.toString();
    }
}
