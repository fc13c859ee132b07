package org.mdacademic.compiler.frontend.parser.features.table;

import org.mdacademic.compiler.frontend.lexer.Lexer;
import org.mdacademic.compiler.frontend.lexer.Token;
import org.mdacademic.compiler.frontend.parser.BlockMatch;
import org.mdacademic.compiler.frontend.parser.BlockParsingContext;
import org.mdacademic.compiler.frontend.parser.IBlockRecognizer;
import org.mdacademic.compiler.frontend.parser.ast.Alignment;
import org.mdacademic.compiler.frontend.parser.ast.Inline;
import org.mdacademic.compiler.frontend.parser.ast.Table;
import org.mdacademic.compiler.frontend.parser.ast.TableCell;
import org.mdacademic.compiler.frontend.parser.ast.TableRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognizes pipe tables: a header row, a delimiter row of {@code -}/{@code :} cells, then data rows
 * until the first line without a pipe. A directly following {@code Table:} or {@code Caption:} line
 * supplies the caption and label. Rows are padded or cut to the header's width.
 */
public class TableRecognizer implements IBlockRecognizer {

    @Override
    public Optional<BlockMatch> recognize(List<String> lines, BlockParsingContext context) {
        if (lines.size() < 2 || lines.get(0).indexOf('|') < 0) {
            return Optional.empty();
        }
        Optional<List<Alignment>> delimiter = parseDelimiterRow(lines.get(1));
        if (delimiter.isEmpty()) {
            return Optional.empty();
        }

        List<String> headerCells = splitRow(lines.get(0));
        int width = headerCells.size();
        List<Alignment> alignments = new ArrayList<>(delimiter.get());
        while (alignments.size() < width) {
            alignments.add(Alignment.LEFT);
        }
        alignments = alignments.subList(0, width);

        TableRow header = toRow(headerCells, width, context);
        List<TableRow> rows = new ArrayList<>();
        int i = 2;
        while (i < lines.size() && !lines.get(i).isBlank() && lines.get(i).indexOf('|') >= 0) {
            rows.add(toRow(splitRow(lines.get(i)), width, context));
            i++;
        }

        String label = null;
        List<Inline> caption = null;
        if (i < lines.size()) {
            Optional<Token> trailer = Lexer.tableCaption(lines.get(i));
            if (trailer.isPresent()) {
                String text = trailer.get().rest();
                Optional<Token> annotation = Lexer.labelSuffix(text);
                if (annotation.isPresent()) {
                    label = annotation.get().text();
                    text = annotation.get().rest();
                }
                caption = context.parseInlines(text);
                i++;
            }
        }
        return Optional.of(new BlockMatch(new Table(header, alignments, rows, label, caption), i));
    }

    /**
     * @param line A candidate delimiter row.
     * @return The column alignments, or empty if the line is not a delimiter row.
     */
    static Optional<List<Alignment>> parseDelimiterRow(String line) {
        if (line.indexOf('|') < 0 && line.indexOf('-') < 0) {
            return Optional.empty();
        }
        List<String> cells = splitRow(line);
        if (cells.isEmpty()) {
            return Optional.empty();
        }
        List<Alignment> alignments = new ArrayList<>();
        for (String cell : cells) {
            if (!cell.matches(":?-+:?")) {
                return Optional.empty();
            }
            boolean left = cell.startsWith(":");
            boolean right = cell.endsWith(":");
            if (left && right) {
                alignments.add(Alignment.CENTER);
            } else if (right) {
                alignments.add(Alignment.RIGHT);
            } else {
                alignments.add(Alignment.LEFT);
            }
        }
        return Optional.of(alignments);
    }

    /**
     * Splits a row on unescaped pipes, dropping one leading and one trailing pipe. {@code \|} becomes a
     * literal pipe inside the cell.
     * @param line The row.
     * @return The trimmed cell texts.
     */
    static List<String> splitRow(String line) {
        String s = line.strip();
        if (s.startsWith("|")) {
            s = s.substring(1);
        }
        if (s.endsWith("|") && !s.endsWith("\\|")) {
            s = s.substring(0, s.length() - 1);
        }
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length() && s.charAt(i + 1) == '|') {
                cell.append('|');
                i++;
            } else if (c == '|') {
                cells.add(cell.toString().strip());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString().strip());
        return cells;
    }

    private static TableRow toRow(List<String> texts, int width, BlockParsingContext context) {
        List<TableCell> cells = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            String text = c < texts.size() ? texts.get(c) : "";
            cells.add(new TableCell(context.parseInlines(text)));
        }
        return new TableRow(cells);
    }
}
