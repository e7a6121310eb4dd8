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
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.Inlines;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;

/** Strips leading and trailing spaces inside superscripts, e.g. {@code ^ 2 ^}. */
public class SuperscriptTrimmer implements RewritePass {

    @Override
    public String name() {
        return "Superscript trimmer";
    }

    @Override
    public String description() {
        return "Spaces at the edges of superscripts are removed";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onInline(Inline.Superscript.class, this::onSuperscript);
    }

    private FilterReturn<Inline, List<Inline>> onSuperscript(
            Inline.Superscript superscript, WalkContext ctx) {
        if (!Inlines.needsTrim(superscript.content())) {
            return FilterReturn.unchanged(superscript);
        }
        return FilterReturn.unchanged(superscript.withContent(Inlines.trim(superscript.content())));
    }
}
