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
package net.boyechko.pandoc.postprocess.normalizers;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import net.boyechko.pandoc.postprocess.DocTestBase;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Document;
import net.boyechko.pandoc.postprocess.document.Inline;
import org.junit.jupiter.api.Test;

class InlineSequenceNormalizerTest extends DocTestBase {

    @Test
    void softBreakAfterLineBreakIsDropped() {
        Document result =
                run(
                        doc(para(str("a"), lineBreak(), softBreak(), str("b"))),
                        new InlineSequenceNormalizer());

        assertEquals(List.of(para(str("a"), lineBreak(), str("b"))), result.blocks());
    }

    @Test
    void mathWithAttributeBlockBecomesSpan() {
        Attr eq = attr("eq-1", List.of("big"), Map.of("k", "v"));
        Inline.Math m = new Inline.Math(Inline.MathType.DISPLAY, "E=mc^2", at(0, 10));
        Inline.AttrMarker marker = new Inline.AttrMarker(eq, at(11, 25));

        Document result =
                run(doc(para(m, space(), marker, str("x"))), new InlineSequenceNormalizer());

        List<Inline> content = ((Block.Paragraph) result.blocks().get(0)).content();
        Inline.Span span = (Inline.Span) content.get(0);
        assertEquals(
                attr("eq-1", List.of("quarto-math-with-attribute", "big"), Map.of("k", "v")),
                span.attr());
        assertEquals(List.of(m), span.content());
        assertEquals(at(0, 25), span.range());
        assertEquals(str("x"), content.get(1));
    }

    @Test
    void trailingMarkerInHeaderIsLeftForTheHeader() {
        Inline.AttrMarker marker = attrMarker(Attr.withId("sec"));
        Block.Header h = header(2, math("x"), space(), marker);

        Document result = run(doc(h), new InlineSequenceNormalizer());

        assertEquals(List.of(h), result.blocks());
    }

    @Test
    void trailingMarkerInParagraphIsFused() {
        Document result =
                run(
                        doc(para(math("x"), attrMarker(Attr.withId("m")))),
                        new InlineSequenceNormalizer());

        Block.Paragraph p = (Block.Paragraph) result.blocks().get(0);
        assertInstanceOf(Inline.Span.class, p.content().get(0));
        assertEquals(1, p.content().size());
    }

    @Test
    void citationLocatorIsFusedInsideParagraphs() {
        Document result =
                run(
                        doc(para(cite("k1"), space(), span(Attr.EMPTY, str("p.")))),
                        new InlineSequenceNormalizer());

        Block.Paragraph p = (Block.Paragraph) result.blocks().get(0);
        assertEquals(1, p.content().size());
        assertInstanceOf(Inline.Cite.class, p.content().get(0));
    }
}
