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

import java.util.List;
import java.util.Map;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;

/** Replaces {@code [^id]} references with empty marker Spans carrying the note id. */
public class NoteReferences implements RewritePass {
    public static final String NOTE_REFERENCE_CLASS = "quarto-note-reference";
    public static final String REFERENCE_ID = "reference-id";

    @Override
    public String name() {
        return "Note references";
    }

    @Override
    public String description() {
        return "Note references become marker spans";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onInline(Inline.NoteReference.class, this::onNoteReference);
    }

    private FilterReturn<Inline, List<Inline>> onNoteReference(
            Inline.NoteReference ref, WalkContext ctx) {
        Attr attr = new Attr("", List.of(NOTE_REFERENCE_CLASS), Map.of(REFERENCE_ID, ref.id()));
        return FilterReturn.replaced(List.of(new Inline.Span(attr, List.of(), ref.range())));
    }
}
