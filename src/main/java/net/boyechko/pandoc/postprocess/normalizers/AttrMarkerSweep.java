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
import net.boyechko.pandoc.postprocess.document.TreeDump;
import net.boyechko.pandoc.postprocess.issue.IssueType;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports every attribute block that no header, caption or math span claimed. Runs as its own
 * walk after all other passes, since a bottom-up walk reaches a marker before its owner.
 */
public class AttrMarkerSweep implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(AttrMarkerSweep.class);

    @Override
    public String name() {
        return "Leftover attribute sweep";
    }

    @Override
    public String description() {
        return "Attribute blocks must be attached to a header, caption or math";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onInline(Inline.AttrMarker.class, this::onAttrMarker);
    }

    private FilterReturn<Inline, List<Inline>> onAttrMarker(
            Inline.AttrMarker marker, WalkContext ctx) {
        logger.debug("Removing leftover attribute block {}", marker.range());
        ctx.issues()
                .errorAt(
                        IssueType.LEFTOVER_ATTR_MARKER,
                        "Found attr in postprocess: "
                                + TreeDump.attr(marker.attr())
                                + " - this should have been removed",
                        marker.range());
        return FilterReturn.replaced(List.of());
    }
}
