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
package net.boyechko.pandoc.postprocess.ui;

import net.boyechko.pandoc.postprocess.issue.Issue;
import net.boyechko.pandoc.postprocess.issue.IssueLoc;

/** Strategy interface for rendering Issues in different output surfaces. */
public interface IssueFormatter {
    String format(IssueLoc where);

    default String format(Issue issue) {
        StringBuilder sb = new StringBuilder(issue.message());
        if (issue.problem() != null) {
            sb.append(": ").append(issue.problem());
        }
        return sb.append(format(issue.where())).toString();
    }
}
