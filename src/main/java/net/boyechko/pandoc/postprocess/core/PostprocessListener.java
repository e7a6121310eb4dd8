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

import java.util.List;
import net.boyechko.pandoc.postprocess.issue.Issue;
import net.boyechko.pandoc.postprocess.issue.IssueList;

/** Interface for reporting progress and results of postprocessing. */
public interface PostprocessListener {
    void onPhaseStart(String phaseName);

    void onIssue(Issue issue);

    void onSummary(IssueList allIssues);

    default void onInfo(String message) {}

    default void onVerboseOutput(String message) {}

    default void onIssueGroup(String groupLabel, List<Issue> issues) {
        for (Issue issue : issues) {
            onIssue(issue);
        }
    }

    /** Returns a listener that ignores every event. */
    static PostprocessListener silent() {
        return new PostprocessListener() {
            @Override
            public void onPhaseStart(String phaseName) {}

            @Override
            public void onIssue(Issue issue) {}

            @Override
            public void onSummary(IssueList allIssues) {}
        };
    }
}
