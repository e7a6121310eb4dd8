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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.Inlines;
import net.boyechko.pandoc.postprocess.normalizers.TrailingLineBreaks;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives every header an identifier. A trailing attribute block ({@code # Title {#id .cls}})
 * becomes the header's attributes; otherwise an id is derived from the text and made unique
 * within the document by appending {@code -1}, {@code -2} and so on.
 *
 * <p>Holds per-document state: use a fresh instance for each document.
 */
public class HeaderIdAssigner implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(HeaderIdAssigner.class);

    private final Slugifier slugifier;
    private final Map<String, Integer> seenIds = new HashMap<>();

    public HeaderIdAssigner() {
        this(new PandocSlugifier());
    }

    public HeaderIdAssigner(Slugifier slugifier) {
        this.slugifier = slugifier;
    }

    @Override
    public String name() {
        return "Header identifiers";
    }

    @Override
    public String description() {
        return "Headers get their attribute block or a unique generated id";
    }

    @Override
    public Set<Class<? extends RewritePass>> prerequisites() {
        return Set.of(TrailingLineBreaks.class);
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onBlock(Block.Header.class, this::onHeader);
    }

    private FilterReturn<Block, List<Block>> onHeader(Block.Header header, WalkContext ctx) {
        Block.Header result = attachAttrMarker(header);
        if (result.attr().id().isEmpty()) {
            String id = uniqueId(slugifier.slugify(result.content()));
            logger.debug("Assigned id '{}' to header {}", id, header.range());
            result = result.withAttr(result.attr().id(id));
        }
        return FilterReturn.unchanged(result);
    }

    private static Block.Header attachAttrMarker(Block.Header header) {
        List<Inline> content = header.content();
        if (content.isEmpty() || !(content.get(content.size() - 1) instanceof Inline.AttrMarker)) {
            return header;
        }
        List<Inline> remaining = new ArrayList<>(content);
        Attr attr = header.attr();
        while (!remaining.isEmpty()
                && remaining.get(remaining.size() - 1) instanceof Inline.AttrMarker marker) {
            remaining.remove(remaining.size() - 1);
            attr = marker.attr();
        }
        return header.withAttr(attr).withContent(Inlines.trim(remaining));
    }

    /** Returns {@code base} the first time it is seen, then {@code base-1}, {@code base-2}... */
    String uniqueId(String base) {
        Integer count = seenIds.get(base);
        if (count == null) {
            seenIds.put(base, 0);
            return base;
        }
        seenIds.put(base, count + 1);
        return base + "-" + (count + 1);
    }
}
