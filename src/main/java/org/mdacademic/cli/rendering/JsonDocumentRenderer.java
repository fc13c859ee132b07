package org.mdacademic.cli.rendering;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.mdacademic.compiler.api.DocumentRenderer;
import org.mdacademic.compiler.api.RenderException;
import org.mdacademic.compiler.api.ResolvedDocument;

import java.io.IOException;

/**
 * Writes a resolved document, including its side tables and diagnostics, as pretty-printed JSON.
 * AST nodes carry their type in a {@code "node"} property.
 */
public class JsonDocumentRenderer implements DocumentRenderer {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public void render(ResolvedDocument document, Appendable out) throws RenderException {
        try {
            out.append(mapper.writeValueAsString(document)).append(System.lineSeparator());
        } catch (JsonProcessingException e) {
            throw new RenderException("Cannot serialize document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RenderException("Cannot write JSON output: " + e.getMessage(), e);
        }
    }
}
