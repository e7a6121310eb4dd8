/*
 * Pandoc-Postprocess - Canonicalizing rewrite passes for Pandoc document trees
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pandoc.postprocess.recognizers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.boyechko.pandoc.postprocess.document.Alignment;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Caption;
import net.boyechko.pandoc.postprocess.document.Cell;
import net.boyechko.pandoc.postprocess.document.ColSpec;
import net.boyechko.pandoc.postprocess.document.ColWidth;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.Row;
import net.boyechko.pandoc.postprocess.document.SourceRange;
import net.boyechko.pandoc.postprocess.document.TableBody;
import net.boyechko.pandoc.postprocess.document.TableFoot;
import net.boyechko.pandoc.postprocess.document.TableHead;
import net.boyechko.pandoc.postprocess.issue.Issue;
import net.boyechko.pandoc.postprocess.issue.IssueLoc;
import net.boyechko.pandoc.postprocess.issue.IssueSev;
import net.boyechko.pandoc.postprocess.issue.IssueType;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts Divs with class {@code list-table} into Tables. The Div's last block is a bullet list
 * of rows, each row a bullet list of cells; any blocks before it form the caption. Div
 * attributes {@code header-rows}, {@code aligns} and {@code widths} shape the table, and an
 * empty Span opening a cell may set {@code colspan}, {@code rowspan} and {@code align}.
 */
public class ListTableRecognizer implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(ListTableRecognizer.class);

    public static final String CLASS_NAME = "list-table";
    static final String HINT = "Check the list-table documentation for the correct structure?";

    private static final String HEADER_ROWS = "header-rows";
    private static final String ALIGNS = "aligns";
    private static final String WIDTHS = "widths";

    @Override
    public String name() {
        return "List-table recognizer";
    }

    @Override
    public String description() {
        return "Divs of class list-table become tables";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onBlock(Block.Div.class, this::onDiv);
    }

    private FilterReturn<Block, List<Block>> onDiv(Block.Div div, WalkContext ctx) {
        ListTableValidation validation = validate(div);
        if (validation instanceof ListTableValidation.Invalid invalid) {
            logger.debug("Malformed list-table at {}: {}", div.range(), invalid.reason());
            ctx.issues()
                    .add(
                            new Issue(
                                    IssueType.INVALID_LIST_TABLE,
                                    IssueSev.WARNING,
                                    IssueLoc.at(invalid.location()),
                                    IssueType.INVALID_LIST_TABLE.groupLabel(),
                                    invalid.reason(),
                                    List.of(HINT)));
            return FilterReturn.unchanged(div);
        }
        if (validation instanceof ListTableValidation.NotListTable) {
            return FilterReturn.unchanged(div);
        }
        // Cell contents were already walked as the Div's children.
        return FilterReturn.replaced(List.of(transform(div, validation)));
    }

    /** Checks the Div's shape without changing it. */
    public static ListTableValidation validate(Block.Div div) {
        if (!div.attr().hasClass(CLASS_NAME)) {
            return ListTableValidation.notListTable();
        }
        if (div.content().isEmpty()) {
            return ListTableValidation.invalid(
                    "list-table div must contain at least one bullet list", div.range());
        }
        Block last = div.content().get(div.content().size() - 1);
        if (!(last instanceof Block.BulletList rows)) {
            return ListTableValidation.invalid(
                    "list-table div's last block must be a bullet list (the rows)",
                    last.range());
        }
        for (int i = 0; i < rows.items().size(); i++) {
            List<Block> row = rows.items().get(i);
            if (row.size() != 1) {
                SourceRange where = row.isEmpty() ? rows.range() : row.get(0).range();
                return ListTableValidation.invalid(
                        "row "
                                + (i + 1)
                                + " in list-table must contain exactly one bullet list"
                                + " (the cells), found "
                                + row.size()
                                + " blocks",
                        where);
            }
            if (!(row.get(0) instanceof Block.BulletList)) {
                return ListTableValidation.invalid(
                        "row " + (i + 1) + " in list-table must contain a bullet list of cells",
                        row.get(0).range());
            }
        }
        return ListTableValidation.valid();
    }

    /**
     * Builds the Table for a Div that {@link #validate} accepted.
     *
     * @throws IllegalStateException if {@code validation} is not {@link ListTableValidation.Valid}
     */
    public static Block.Table transform(Block.Div div, ListTableValidation validation) {
        if (!(validation instanceof ListTableValidation.Valid)) {
            throw new IllegalStateException(
                    "list-table transform requires a valid Div, got " + validation);
        }
        Map<String, String> kv = div.attr().attributes();
        int headerRows = parseCount(kv.get(HEADER_ROWS), 0);

        List<Block> content = div.content();
        List<Block> captionBlocks = content.subList(0, content.size() - 1);
        Block.BulletList rowList = (Block.BulletList) content.get(content.size() - 1);

        Caption caption =
                captionBlocks.isEmpty()
                        ? Caption.empty()
                        : Caption.of(captionBlocks, div.range());

        List<Row> rows = new ArrayList<>();
        int numCols = 0;
        for (List<Block> rowItem : rowList.items()) {
            Block.BulletList cellList = (Block.BulletList) rowItem.get(0);
            SourceRange rowRange = cellList.range();
            List<Cell> cells = new ArrayList<>();
            int rowCols = 0;
            for (List<Block> cellBlocks : cellList.items()) {
                Cell cell = buildCell(cellBlocks, rowRange);
                rowCols += cell.colSpan();
                cells.add(cell);
            }
            numCols = Math.max(numCols, rowCols);
            rows.add(new Row(Attr.EMPTY, cells, rowRange));
        }

        List<ColSpec> colSpecs =
                columnSpecs(
                        numCols,
                        parseAlignments(kv.get(ALIGNS)),
                        normalizeWidths(parseWidths(kv.get(WIDTHS))));

        int headCount = Math.min(headerRows, rows.size());
        List<Row> headRows = rows.subList(0, headCount);
        List<Row> bodyRows = rows.subList(headCount, rows.size());
        TableBody body = new TableBody(Attr.EMPTY, 0, List.of(), bodyRows, div.range());

        Attr tableAttr =
                div.attr().withoutClass(CLASS_NAME).withoutAttributes(HEADER_ROWS, ALIGNS, WIDTHS);

        logger.debug(
                "Built {}x{} table from list-table at {} ({} header rows)",
                rows.size(),
                numCols,
                div.range(),
                headRows.size());
        return new Block.Table(
                tableAttr,
                caption,
                colSpecs,
                new TableHead(Attr.EMPTY, headRows, div.range()),
                List.of(body),
                new TableFoot(Attr.EMPTY, List.of(), div.range()),
                div.range());
    }

    private static Cell buildCell(List<Block> blocks, SourceRange rowRange) {
        int colSpan = 1;
        int rowSpan = 1;
        Alignment alignment = Alignment.DEFAULT;
        List<Block> content = blocks;

        List<Inline> first = leadingInlines(blocks);
        if (first != null
                && !first.isEmpty()
                && first.get(0) instanceof Inline.Span span
                && span.content().isEmpty()) {
            for (Map.Entry<String, String> entry : span.attr().attributes().entrySet()) {
                switch (entry.getKey()) {
                    case "colspan" -> colSpan = parseCount(entry.getValue(), colSpan, 1);
                    case "rowspan" -> rowSpan = parseCount(entry.getValue(), rowSpan, 1);
                    case "align" -> alignment = Alignment.fromCode(entry.getValue());
                    default -> {}
                }
            }
            List<Inline> rest = new ArrayList<>(first.subList(1, first.size()));
            if (!rest.isEmpty() && rest.get(0) instanceof Inline.Space) {
                rest.remove(0);
            }
            content = new ArrayList<>(blocks);
            content.set(0, withInlines(blocks.get(0), rest));
        }

        SourceRange range = content.isEmpty() ? rowRange : content.get(0).range();
        return new Cell(Attr.EMPTY, alignment, rowSpan, colSpan, content, range);
    }

    private static List<Inline> leadingInlines(List<Block> blocks) {
        if (blocks.isEmpty()) {
            return null;
        }
        Block first = blocks.get(0);
        if (first instanceof Block.Plain plain) {
            return plain.content();
        } else if (first instanceof Block.Paragraph para) {
            return para.content();
        }
        return null;
    }

    private static Block withInlines(Block block, List<Inline> inlines) {
        if (block instanceof Block.Plain plain) {
            return plain.withContent(inlines);
        }
        return ((Block.Paragraph) block).withContent(inlines);
    }

    static List<Alignment> parseAlignments(String aligns) {
        if (aligns == null) {
            return List.of();
        }
        List<Alignment> out = new ArrayList<>();
        for (String code : aligns.split(",", -1)) {
            out.add(Alignment.fromCode(code));
        }
        return out;
    }

    /** Parses width ratios; entries that are not positive numbers stay default. */
    static List<ColWidth> parseWidths(String widths) {
        if (widths == null) {
            return List.of();
        }
        List<ColWidth> out = new ArrayList<>();
        for (String entry : widths.split(",", -1)) {
            ColWidth width = ColWidth.defaultWidth();
            try {
                double ratio = Double.parseDouble(entry.trim());
                if (ratio > 0.0) {
                    width = ColWidth.percentage(ratio);
                }
            } catch (NumberFormatException e) {
                logger.debug("Ignoring list-table width '{}'", entry);
            }
            out.add(width);
        }
        return out;
    }

    /** Scales ratios to fractions of their total; default entries count as 1 in the total. */
    static List<ColWidth> normalizeWidths(List<ColWidth> widths) {
        double total = 0.0;
        for (ColWidth width : widths) {
            total += width instanceof ColWidth.Percentage pct ? pct.fraction() : 1.0;
        }
        List<ColWidth> out = new ArrayList<>(widths.size());
        for (ColWidth width : widths) {
            if (width instanceof ColWidth.Percentage pct && total > 0.0) {
                out.add(ColWidth.percentage(pct.fraction() / total));
            } else {
                out.add(ColWidth.defaultWidth());
            }
        }
        return out;
    }

    private static List<ColSpec> columnSpecs(
            int numCols, List<Alignment> alignments, List<ColWidth> widths) {
        List<ColSpec> specs = new ArrayList<>(numCols);
        for (int i = 0; i < numCols; i++) {
            Alignment align = i < alignments.size() ? alignments.get(i) : Alignment.DEFAULT;
            ColWidth width = i < widths.size() ? widths.get(i) : ColWidth.defaultWidth();
            specs.add(new ColSpec(align, width));
        }
        return specs;
    }

    private static int parseCount(String value, int fallback) {
        return parseCount(value, fallback, 0);
    }

    private static int parseCount(String value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed < 0 ? fallback : Math.max(min, parsed);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
