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
package net.boyechko.pandoc.postprocess.walk;

import net.boyechko.pandoc.postprocess.document.NodeKind;
import net.boyechko.pandoc.postprocess.issue.IssueList;

/**
 * Context handed to every callback.
 *
 * @param issues where callbacks report problems; callbacks never throw for bad input
 * @param parent kind of the node owning the sequence being processed, or {@link
 *     NodeKind#DOCUMENT} at the top level and in metadata
 */
public record WalkContext(IssueList issues, NodeKind parent) {
    public WalkContext within(NodeKind owner) {
        return owner == parent ? this : new WalkContext(issues, owner);
    }
}
