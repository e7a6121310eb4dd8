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
package net.boyechko.pandoc.postprocess.core;

import net.boyechko.pandoc.postprocess.document.Document;
import net.boyechko.pandoc.postprocess.issue.IssueList;

/**
 * Outcome of one postprocessing run. A run fails when any error-severity issue was recorded; a
 * failed result carries no document.
 */
public record PostprocessResult(Document document, IssueList issues) {

    public static PostprocessResult success(Document document, IssueList issues) {
        return new PostprocessResult(document, issues);
    }

    public static PostprocessResult failed(IssueList issues) {
        return new PostprocessResult(null, issues);
    }

    public boolean isSuccess() {
        return document != null;
    }
}
