package org.mdacademic.compiler.frontend.frontmatter;

import org.mdacademic.compiler.frontend.parser.ast.Metadata;

/**
 * A source split into its front matter and the Markdown body after it.
 *
 * @param metadata The parsed metadata, empty when the source has no front matter.
 * @param body The body text.
 */
public record FrontMatter(Metadata metadata, String body) {
}
