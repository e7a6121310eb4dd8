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

/** Renders Issues with debugging-oriented detail for logs. */
public final class LogIssueFormatter implements IssueFormatter {

    @Override
    public String format(IssueLoc where) {
        if (where instanceof IssueLoc.AtRange at) {
            return " (bytes " + at.range().start() + "-" + at.range().end() + ")";
        }
        return "";
    }

    @Override
    public String format(Issue issue) {
        String text = IssueFormatter.super.format(issue);
        if (issue.hints().isEmpty()) {
            return text;
        }
        return text + " [hint: " + String.join("; ", issue.hints()) + "]";
    }
}
