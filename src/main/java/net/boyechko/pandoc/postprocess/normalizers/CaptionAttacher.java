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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Caption;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.Inlines;
import net.boyechko.pandoc.postprocess.issue.IssueType;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches each CaptionBlock to the Table right before it. A trailing attribute block in the
 * caption is merged into the table's attributes. A caption with no table before it is dropped
 * with a warning.
 */
public class CaptionAttacher implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(CaptionAttacher.class);

    static final String ORPHAN_MESSAGE = "Caption found without a preceding table";

    @Override
    public String name() {
        return "Caption attacher";
    }

    @Override
    public String description() {
        return "Caption blocks are attached to the preceding table";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onBlocks(this::onBlocks);
    }

    private FilterReturn<List<Block>, List<Block>> onBlocks(List<Block> blocks, WalkContext ctx) {
        if (blocks.stream().noneMatch(Block.CaptionBlock.class::isInstance)) {
            return FilterReturn.unchanged(blocks);
        }
        List<Block> out = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            if (!(block instanceof Block.CaptionBlock caption)) {
                out.add(block);
                continue;
            }
            Block previous = out.isEmpty() ? null : out.get(out.size() - 1);
            if (previous instanceof Block.Table table) {
                out.set(out.size() - 1, attach(table, caption));
            } else {
                ctx.issues().warnAt(IssueType.ORPHAN_CAPTION, ORPHAN_MESSAGE, caption.range());
            }
        }
        return FilterReturn.replaced(out);
    }

    static Block.Table attach(Block.Table table, Block.CaptionBlock captionBlock) {
        List<Inline> content = captionBlock.content();
        Attr attr = table.attr();
        Inline last = content.isEmpty() ? null : content.get(content.size() - 1);
        if (last instanceof Inline.AttrMarker marker) {
            content = Inlines.trim(content.subList(0, content.size() - 1));
            attr = mergeAttr(attr, marker.attr());
        }
        Caption caption =
                Caption.of(
                        List.of(new Block.Plain(content, captionBlock.range())),
                        captionBlock.range());
        logger.debug("Attached caption at {} to table at {}", captionBlock.range(), table.range());
        return table.withAttr(attr)
                .withCaption(caption)
                .withRange(table.range().combine(captionBlock.range()));
    }

    /** Caption key-values win, classes are unioned, the caption id fills an empty table id. */
    static Attr mergeAttr(Attr table, Attr caption) {
        Map<String, String> kv = new LinkedHashMap<>(table.attributes());
        kv.putAll(caption.attributes());
        List<String> classes = new ArrayList<>(table.classes());
        for (String cls : caption.classes()) {
            if (!classes.contains(cls)) {
                classes.add(cls);
            }
        }
        String id = table.id().isEmpty() && !caption.id().isEmpty() ? caption.id() : table.id();
        return new Attr(id, classes, kv);
    }
}
