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
 * Lets {@code * []} write an empty list item: an item whose only content is an empty Span
 * without attributes keeps its block but loses the Span.
 */
public class EmptyListItems implements RewritePass {

    @Override
    public String name() {
        return "Empty list items";
    }

    @Override
    public String description() {
        return "Bullet items holding only an empty span are emptied";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onBlock(Block.BulletList.class, this::onBulletList);
    }

    private FilterReturn<Block, List<Block>> onBulletList(Block.BulletList list, WalkContext ctx) {
        List<List<Block>> items = null;
        for (int i = 0; i < list.items().size(); i++) {
            List<Block> item = list.items().get(i);
            if (item.size() != 1) {
                continue;
            }
            Block cleared = clearedBlock(item.get(0));
            if (cleared != null) {
                if (items == null) {
                    items = new ArrayList<>(list.items());
                }
                items.set(i, List.of(cleared));
            }
        }
        return FilterReturn.unchanged(items == null ? list : list.withItems(items));
    }

    /** Returns the block emptied, or null when it is not a lone empty Span. */
    private static Block clearedBlock(Block block) {
        if (block instanceof Block.Plain plain && isLoneEmptySpan(plain.content())) {
            return plain.withContent(List.of());
        }
        if (block instanceof Block.Paragraph para && isLoneEmptySpan(para.content())) {
            return para.withContent(List.of());
        }
        return null;
    }

    private static boolean isLoneEmptySpan(List<Inline> inlines) {
        return inlines.size() == 1
                && inlines.get(0) instanceof Inline.Span span
                && span.content().isEmpty()
                && span.attr().isEmpty();
    }
}
