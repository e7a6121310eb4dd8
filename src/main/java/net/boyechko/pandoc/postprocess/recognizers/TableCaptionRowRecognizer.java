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
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Caption;
import net.boyechko.pandoc.postprocess.document.Cell;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.Row;
import net.boyechko.pandoc.postprocess.document.TableBody;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers a table caption written directly under a pipe table. Without a blank line the parser
 * reads {@code : Caption} as a one-cell last row; that row is moved into the empty caption.
 *
 * <p>Only tables that reach the walk as tables are visited. A table built from a list-table
 * Div replaces the Div without a rescan, so its rows are never taken for a caption. A caption
 * block after the table is attached later by {@code CaptionAttacher} and replaces a caption
 * recovered here.
 */
public class TableCaptionRowRecognizer implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(TableCaptionRowRecognizer.class);

    @Override
    public String name() {
        return "Table caption-row recognizer";
    }

    @Override
    public String description() {
        return "A trailing ': caption' row becomes the table caption";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onBlock(Block.Table.class, this::onTable);
    }

    private FilterReturn<Block, List<Block>> onTable(Block.Table table, WalkContext ctx) {
        return FilterReturn.unchanged(captionFromLastRow(table));
    }

    /** Returns the table with its caption row moved into the caption, or the table itself. */
    static Block.Table captionFromLastRow(Block.Table table) {
        if (!table.caption().longCaption().isEmpty() || table.bodies().isEmpty()) {
            return table;
        }
        TableBody lastBody = table.bodies().get(table.bodies().size() - 1);
        if (lastBody.body().isEmpty()) {
            return table;
        }
        Row lastRow = lastBody.body().get(lastBody.body().size() - 1);
        List<Inline> inlines = captionRowInlines(lastRow);
        if (inlines == null) {
            return table;
        }

        List<Inline> captionInlines = new ArrayList<>(inlines);
        Inline.Str first = (Inline.Str) captionInlines.get(0);
        String text = first.text().substring(1).stripLeading();
        if (text.isEmpty()) {
            captionInlines.remove(0);
            if (!captionInlines.isEmpty() && captionInlines.get(0) instanceof Inline.Space) {
                captionInlines.remove(0);
            }
        } else {
            captionInlines.set(0, first.withText(text));
        }

        List<TableBody> bodies = new ArrayList<>(table.bodies());
        bodies.set(
                bodies.size() - 1,
                lastBody.withRows(
                        lastBody.head(), lastBody.body().subList(0, lastBody.body().size() - 1)));
        Caption caption =
                Caption.of(
                        List.of(new Block.Plain(captionInlines, lastRow.range())), lastRow.range());

        logger.debug("Moved caption row at {} into table caption", lastRow.range());
        return table.withBodies(bodies).withCaption(caption);
    }

    /** Returns the row's inlines if it is a single Plain cell starting with ":", else null. */
    private static List<Inline> captionRowInlines(Row row) {
        if (row.cells().size() != 1) {
            return null;
        }
        Cell cell = row.cells().get(0);
        if (cell.content().size() != 1 || !(cell.content().get(0) instanceof Block.Plain plain)) {
            return null;
        }
        if (plain.content().isEmpty()
                || !(plain.content().get(0) instanceof Inline.Str str)
                || !str.text().startsWith(":")) {
            return null;
        }
        return plain.content();
    }
}
