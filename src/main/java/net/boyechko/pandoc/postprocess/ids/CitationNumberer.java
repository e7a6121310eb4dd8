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

import java.util.List;
import net.boyechko.pandoc.postprocess.document.Citation;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;

/**
 * Numbers citation groups in document order, starting at 1. All citations of one Cite share
 * its number. Holds per-document state: use a fresh instance for each document.
 */
public class CitationNumberer implements RewritePass {
    private int counter = 0;

    @Override
    public String name() {
        return "Citation numbering";
    }

    @Override
    public String description() {
        return "Each citation group gets the next note number";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onInline(Inline.Cite.class, this::onCite);
    }

    private FilterReturn<Inline, List<Inline>> onCite(Inline.Cite cite, WalkContext ctx) {
        int number = ++counter;
        List<Citation> numbered =
                cite.citations().stream().map(c -> c.withNoteNum(number)).toList();
        return FilterReturn.unchanged(cite.withCitations(numbered));
    }

    public int count() {
        return counter;
    }
}
