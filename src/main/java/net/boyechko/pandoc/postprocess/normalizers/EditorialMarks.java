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
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.Inlines;
import net.boyechko.pandoc.postprocess.document.SourceRange;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;

/**
 * Lowers the editorial marks {@code [++ins]}, {@code [--del]}, {@code [==mark]} and {@code
 * [>>comment]} to Spans with a marker class in front of their own classes.
 */
public class EditorialMarks implements RewritePass {
    public static final String INSERT_CLASS = "quarto-insert";
    public static final String DELETE_CLASS = "quarto-delete";
    public static final String HIGHLIGHT_CLASS = "quarto-highlight";
    public static final String EDIT_COMMENT_CLASS = "quarto-edit-comment";

    @Override
    public String name() {
        return "Editorial marks";
    }

    @Override
    public String description() {
        return "Insert, delete, highlight and comment marks become spans";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onInline(
                Inline.Insert.class,
                (mark, ctx) -> toSpan(INSERT_CLASS, mark.attr(), mark.content(), mark.range()));
        builder.onInline(
                Inline.Delete.class,
                (mark, ctx) -> toSpan(DELETE_CLASS, mark.attr(), mark.content(), mark.range()));
        builder.onInline(
                Inline.Highlight.class,
                (mark, ctx) -> toSpan(HIGHLIGHT_CLASS, mark.attr(), mark.content(), mark.range()));
        builder.onInline(Inline.EditComment.class, this::onEditComment);
    }

    private FilterReturn<Inline, List<Inline>> onEditComment(
            Inline.EditComment mark, WalkContext ctx) {
        return toSpan(EDIT_COMMENT_CLASS, mark.attr(), mark.content(), mark.range());
    }

    private static FilterReturn<Inline, List<Inline>> toSpan(
            String markClass, Attr attr, List<Inline> content, SourceRange range) {
        Inline span = new Inline.Span(attr.prependClass(markClass), Inlines.trim(content), range);
        return FilterReturn.replaced(List.of(span));
    }
}
