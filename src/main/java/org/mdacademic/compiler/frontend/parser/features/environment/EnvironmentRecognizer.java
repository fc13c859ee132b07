package org.mdacademic.compiler.frontend.parser.features.environment;

import org.mdacademic.compiler.api.CompilerErrorCode;
import org.mdacademic.compiler.frontend.lexer.Lexer;
import org.mdacademic.compiler.frontend.lexer.Token;
import org.mdacademic.compiler.frontend.parser.BlockMatch;
import org.mdacademic.compiler.frontend.parser.BlockParsingContext;
import org.mdacademic.compiler.frontend.parser.IBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.ast.Abstract;
import org.mdacademic.compiler.frontend.parser.ast.Block;
import org.mdacademic.compiler.frontend.parser.ast.Environment;
import org.mdacademic.compiler.frontend.parser.ast.EnvironmentKind;
import org.mdacademic.compiler.frontend.parser.ast.EnvironmentType;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.Paragraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognizes {@code ::: kind {#label}} environments. Nesting is tracked by depth: every nested opener
 * increments it and every bare {@code :::} line decrements it, so only the matching closer ends the
 * environment. The inner lines are parsed as blocks.
 */
public class EnvironmentRecognizer implements IBlockRecognizer {

    @Override
    public Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context) {
        Optional<Token> open = Lexer.environmentOpen(lines.get(0));
        if (open.isEmpty()) {
            return Optional.empty();
        }
        String keyword = open.get().text();
        EnvironmentKind kind = EnvironmentKind.of(keyword);
        String label = (String) open.get().value();

        List<String> inner = new ArrayList<>();
        int depth = 1;
        int i = 1;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (Lexer.closesEnvironment(line)) {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (Lexer.environmentOpen(line).isPresent()) {
                depth++;
            }
            inner.add(line);
            i++;
        }
        boolean closed = depth == 0;
        if (!closed) {
            context.getDiagnostics().reportWarning(CompilerErrorCode.UNCLOSED_BLOCK,
                    "Environment '" + keyword + "' is never closed with ':::'.", keyword);
        }
        int consumed = closed ? i + 1 : lines.size();
        List<Block> blocks = new ArrayList<>(context.parseBlocks(String.join("\n", inner)));

        if (kind.type() == EnvironmentType.ABSTRACT) {
            if (label != null) {
                context.getDiagnostics().reportWarning(CompilerErrorCode.IGNORED_LABEL,
                        "The abstract cannot carry a label; '" + label + "' is ignored.", label);
            }
            return Optional.of(new BlockMatch(new Abstract(blocks), consumed));
        }

        List<Inline> caption = null;
        boolean captioned = kind.type() == EnvironmentType.FIGURE || kind.type() == EnvironmentType.TABLE;
        if (captioned && blocks.size() > 1 && blocks.get(blocks.size() - 1) instanceof Paragraph last) {
            caption = last.content();
            blocks.remove(blocks.size() - 1);
        }
        return Optional.of(new BlockMatch(new Environment(kind, label, blocks, caption), consumed));
    }
}
