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
package net.boyechko.pandoc.postprocess.issue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.pandoc.postprocess.document.SourceRange;

/** Append-only collection of issues gathered during one postprocessing run. */
public class IssueList extends ArrayList<Issue> {

    public IssueList() {
        super();
    }

    public IssueList(Collection<Issue> issues) {
        super(issues != null ? issues : new ArrayList<>());
    }

    public void warn(String message) {
        add(new Issue(IssueType.GENERIC, IssueSev.WARNING, message));
    }

    public void warnAt(String message, SourceRange range) {
        warnAt(IssueType.GENERIC, message, range);
    }

    public void warnAt(IssueType type, String message, SourceRange range) {
        add(new Issue(type, IssueSev.WARNING, IssueLoc.at(range), message));
    }

    public void error(String message) {
        add(new Issue(IssueType.GENERIC, IssueSev.ERROR, message));
    }

    public void errorAt(String message, SourceRange range) {
        errorAt(IssueType.GENERIC, message, range);
    }

    public void errorAt(IssueType type, String message, SourceRange range) {
        add(new Issue(type, IssueSev.ERROR, IssueLoc.at(range), message));
    }

    /** Returns true if any issue has ERROR severity, meaning postprocessing failed. */
    public boolean hasErrors() {
        return stream().anyMatch(Issue::isError);
    }

    public IssueList getErrors() {
        return stream().filter(Issue::isError).collect(Collectors.toCollection(IssueList::new));
    }

    public IssueList getWarnings() {
        return stream()
                .filter(issue -> issue.severity() == IssueSev.WARNING)
                .collect(Collectors.toCollection(IssueList::new));
    }

    public IssueList ofType(IssueType type) {
        return stream()
                .filter(issue -> issue.type() == type)
                .collect(Collectors.toCollection(IssueList::new));
    }

    /** Returns the issues ordered by source position; the sort is stable. */
    public List<Issue> sortedByLocation() {
        List<Issue> sorted = new ArrayList<>(this);
        sorted.sort(Comparator.comparingInt(issue -> issue.where().sortKey()));
        return sorted;
    }
}
