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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;

/**
 * A hard line break cannot end a block, so a trailing LineBreak in a Header, Paragraph or Plain
 * is turned back into the literal backslash that produced it.
 */
public class TrailingLineBreaks implements RewritePass {
    static final String BACKSLASH = "\\";

    @Override
    public String name() {
        return "Trailing line breaks";
    }

    @Override
    public String description() {
        return "Block-final hard breaks become a literal backslash";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onBlock(Block.Header.class, this::onHeader);
        builder.onBlock(Block.Paragraph.class, this::onParagraph);
        builder.onBlock(Block.Plain.class, this::onPlain);
    }

    private FilterReturn<Block, List<Block>> onHeader(Block.Header header, WalkContext ctx) {
        return FilterReturn.unchanged(header.withContent(convert(header.content())));
    }

    private FilterReturn<Block, List<Block>> onParagraph(Block.Paragraph para, WalkContext ctx) {
        return FilterReturn.unchanged(para.withContent(convert(para.content())));
    }

    private FilterReturn<Block, List<Block>> onPlain(Block.Plain plain, WalkContext ctx) {
        return FilterReturn.unchanged(plain.withContent(convert(plain.content())));
    }

    /** Returns {@code inlines} itself when it does not end in a LineBreak. */
    public static List<Inline> convert(List<Inline> inlines) {
        Inline last = inlines.isEmpty() ? null : inlines.get(inlines.size() - 1);
        if (!(last instanceof Inline.LineBreak lb)) {
            return inlines;
        }
        List<Inline> out = new ArrayList<>(inlines);
        out.set(out.size() - 1, new Inline.Str(BACKSLASH, lb.range()));
        return out;
    }
}
