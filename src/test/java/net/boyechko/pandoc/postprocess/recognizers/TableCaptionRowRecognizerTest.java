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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import net.boyechko.pandoc.postprocess.DocTestBase;
import net.boyechko.pandoc.postprocess.document.Alignment;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Caption;
import net.boyechko.pandoc.postprocess.document.Cell;
import net.boyechko.pandoc.postprocess.document.ColSpec;
import net.boyechko.pandoc.postprocess.document.ColWidth;
import net.boyechko.pandoc.postprocess.document.Document;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.Row;
import net.boyechko.pandoc.postprocess.document.TableBody;
import net.boyechko.pandoc.postprocess.document.TableFoot;
import net.boyechko.pandoc.postprocess.document.TableHead;
import net.boyechko.pandoc.postprocess.normalizers.CaptionAttacher;
import org.junit.jupiter.api.Test;

class TableCaptionRowRecognizerTest extends DocTestBase {

    private static Row row(Inline... inlines) {
        Cell cell =
                new Cell(Attr.EMPTY, Alignment.DEFAULT, 1, 1, List.of(plain(inlines)), NO_RANGE);
        return new Row(Attr.EMPTY, List.of(cell), at(30, 40));
    }

    private static Block.Table table(Row... rows) {
        return new Block.Table(
                Attr.EMPTY,
                Caption.empty(),
                List.of(new ColSpec(Alignment.DEFAULT, ColWidth.defaultWidth())),
                TableHead.empty(),
                List.of(new TableBody(Attr.EMPTY, 0, List.of(), List.of(rows), NO_RANGE)),
                TableFoot.empty(),
                at(0, 40));
    }

    @Test
    void colonRowBecomesTheCaption() {
        Document result =
                run(
                        doc(table(row(str("x")), row(str(":"), space(), str("Totals")))),
                        new CaptionAttacher(),
                        new TableCaptionRowRecognizer());

        Block.Table fixed = (Block.Table) result.blocks().get(0);
        assertEquals(1, fixed.bodies().get(0).body().size());
        assertEquals(
                List.of(new Block.Plain(List.of(str("Totals")), at(30, 40))),
                fixed.caption().longCaption());
    }

    @Test
    void colonGluedToTheFirstWordIsStripped() {
        Block.Table fixed =
                TableCaptionRowRecognizer.captionFromLastRow(
                        table(row(str("x")), row(str(":Totals"), space(), str("2024"))));

        assertEquals(
                List.of(new Block.Plain(List.of(str("Totals"), space(), str("2024")), at(30, 40))),
                fixed.caption().longCaption());
    }

    @Test
    void explicitCaptionBlockWins() {
        Document result =
                run(
                        doc(
                                table(row(str("x")), row(str(":"), space(), str("Row"))),
                                captionBlock(str("Block"))),
                        new TableCaptionRowRecognizer(),
                        new CaptionAttacher());

        Block.Table fixed = (Block.Table) result.blocks().get(0);
        assertEquals(1, fixed.bodies().get(0).body().size());
        assertEquals(List.of(plain(str("Block"))), fixed.caption().longCaption());
    }

    @Test
    @SuppressWarnings("unchecked")
    void listTableRowsAreNeverTakenForCaption() {
        Block.Div listTable =
                div(
                        attr("", List.of("list-table"), Map.of()),
                        bulletList(
                                item(bulletList(item(plain(str("a"))), item(plain(str("b"))))),
                                item(bulletList(item(plain(str(":-)")))))));

        Document result =
                run(doc(listTable), new ListTableRecognizer(), new TableCaptionRowRecognizer());

        Block.Table table = (Block.Table) result.blocks().get(0);
        assertEquals(2, table.bodies().get(0).body().size());
        assertTrue(table.caption().isEmpty());
        Row last = table.bodies().get(0).body().get(1);
        assertEquals(List.of(plain(str(":-)"))), last.cells().get(0).content());
    }

    @Test
    void ordinaryLastRowIsKept() {
        Block.Table original = table(row(str("a")), row(str("b")));

        assertSame(original, TableCaptionRowRecognizer.captionFromLastRow(original));
    }
}
