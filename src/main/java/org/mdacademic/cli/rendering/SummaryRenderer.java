package org.mdacademic.cli.rendering;

import org.mdacademic.compiler.api.DocumentRenderer;
import org.mdacademic.compiler.api.LabelInfo;
import org.mdacademic.compiler.api.RenderException;
import org.mdacademic.compiler.api.ResolvedDocument;
import org.mdacademic.compiler.diagnostics.Diagnostic;
import org.mdacademic.compiler.frontend.parser.ast.Metadata;

import java.io.IOException;
import java.util.Map;

/**
 * Writes a plain-text overview of a resolved document.
 */
public class SummaryRenderer implements DocumentRenderer {

    private static final String NL = System.lineSeparator();

    @Override
    public void render(ResolvedDocument document, Appendable out) throws RenderException {
        try {
            Metadata metadata = document.document().metadata();
            if (metadata.title() != null) {
                out.append("Title: ").append(metadata.title()).append(NL);
            }
            if (!metadata.authors().isEmpty()) {
                out.append("Authors: ").append(String.join(", ", metadata.authors())).append(NL);
            }
            out.append("Blocks: ").append(String.valueOf(document.document().blocks().size())).append(NL);

            out.append("Labels: ").append(String.valueOf(document.labels().size())).append(NL);
            for (Map.Entry<String, LabelInfo> label : document.labels().entrySet()) {
                out.append("  ").append(label.getKey()).append(" -> ").append(label.getValue().displayText())
                        .append(" (#").append(label.getValue().id()).append(')').append(NL);
            }

            out.append("Footnotes: ").append(String.valueOf(document.footnotes().size())).append(NL);
            out.append("Citations: ").append(String.join(", ", document.citationOrder())).append(NL);
            if (!document.unknownCitations().isEmpty()) {
                out.append("Unknown citations: ").append(String.join(", ", document.unknownCitations())).append(NL);
            }

            if (!document.diagnostics().isEmpty()) {
                out.append("Warnings:").append(NL);
                for (Diagnostic diagnostic : document.diagnostics()) {
                    out.append("  ").append(diagnostic.toString()).append(NL);
                }
            }
        } catch (IOException e) {
            throw new RenderException("Cannot write summary: " + e.getMessage(), e);
        }
    }
}
