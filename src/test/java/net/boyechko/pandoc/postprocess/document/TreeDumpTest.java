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
package net.boyechko.pandoc.postprocess.document;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TreeDumpTest {

    @Test
    void attrUsesSourceSyntax() {
        Map<String, String> kv = new LinkedHashMap<>();
        kv.put("width", "50%");
        kv.put("title", "say \"hi\"");

        String rendered = TreeDump.attr(new Attr("fig-1", List.of("wide", "dark"), kv));

        assertEquals("{#fig-1 .wide .dark width=\"50%\" title=\"say \\\"hi\\\"\"}", rendered);
        assertEquals("{}", TreeDump.attr(Attr.EMPTY));
    }

    @Test
    void rangesAreShownOnRequest() {
        Document doc =
                new Document(
                        List.of(
                                new Block.Paragraph(
                                        List.of(new Inline.Str("hi", SourceRange.of(0, 2))),
                                        SourceRange.of(0, 3))));

        assertEquals("Para\n  Str \"hi\"\n", TreeDump.dump(doc));
        assertEquals("Para @0-3\n  Str \"hi\" @0-2\n", TreeDump.dump(doc, true));
    }
}
