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
package net.boyechko.pandoc.postprocess.ids;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pandoc.postprocess.DocTestBase;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Citation;
import net.boyechko.pandoc.postprocess.document.Document;
import net.boyechko.pandoc.postprocess.document.Inline;
import org.junit.jupiter.api.Test;

class CitationNumbererTest extends DocTestBase {

    private static int noteNum(Inline inline) {
        return ((Inline.Cite) inline).citations().get(0).noteNum();
    }

    @Test
    void citesAreNumberedInDocumentOrder() {
        CitationNumberer numberer = new CitationNumberer();

        Document result =
                run(doc(para(cite("a"), space(), cite("b")), para(cite("c"))), numberer);

        List<Inline> first = ((Block.Paragraph) result.blocks().get(0)).content();
        List<Inline> second = ((Block.Paragraph) result.blocks().get(1)).content();
        assertEquals(1, noteNum(first.get(0)));
        assertEquals(2, noteNum(first.get(2)));
        assertEquals(3, noteNum(second.get(0)));
        assertEquals(3, numberer.count());
    }

    @Test
    void citationsInOneGroupShareNumber() {
        Inline.Cite group =
                new Inline.Cite(
                        List.of(
                                Citation.of("x", Citation.Mode.NORMAL),
                                Citation.of("y", Citation.Mode.NORMAL)),
                        List.of(str("[@x; @y]")),
                        NO_RANGE);

        Document result = run(doc(para(group)), new CitationNumberer());

        Inline.Cite numbered = (Inline.Cite) ((Block.Paragraph) result.blocks().get(0)).content()
                .get(0);
        assertEquals(
                List.of(1, 1), numbered.citations().stream().map(Citation::noteNum).toList());
    }

    @Test
    void nestedCiteIsNumberedBeforeItsContainer() {
        Inline.Cite outer =
                new Inline.Cite(
                        List.of(Citation.of("outer", Citation.Mode.NORMAL)),
                        List.of(cite("inner")),
                        NO_RANGE);

        Document result = run(doc(para(outer)), new CitationNumberer());

        Inline.Cite numbered = (Inline.Cite) ((Block.Paragraph) result.blocks().get(0)).content()
                .get(0);
        assertEquals(2, numbered.citations().get(0).noteNum());
        assertEquals(1, noteNum(numbered.content().get(0)));
    }
}
