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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pandoc.postprocess.document.SourceRange;
import org.junit.jupiter.api.Test;

class IssueListTest {

    @Test
    void onlyErrorsFailARun() {
        IssueList issues = new IssueList();
        issues.warnAt(IssueType.ORPHAN_CAPTION, "orphan", SourceRange.of(0, 3));
        assertFalse(issues.hasErrors());

        issues.errorAt(IssueType.LEFTOVER_ATTR_MARKER, "leftover", SourceRange.of(5, 9));

        assertTrue(issues.hasErrors());
        assertEquals(1, issues.getErrors().size());
        assertEquals(1, issues.getWarnings().size());
        assertEquals(1, issues.ofType(IssueType.ORPHAN_CAPTION).size());
    }

    @Test
    void sortedByLocationPutsLocationlessFirstAndKeepsTies() {
        IssueList issues = new IssueList();
        issues.warnAt("late", SourceRange.of(20, 25));
        issues.warnAt("early-a", SourceRange.of(3, 4));
        issues.warn("nowhere");
        issues.warnAt("early-b", SourceRange.of(3, 8));

        List<String> order = issues.sortedByLocation().stream().map(Issue::message).toList();

        assertEquals(List.of("nowhere", "early-a", "early-b", "late"), order);
    }

    @Test
    void emptyRangeMeansNoLocation() {
        IssueList issues = new IssueList();
        issues.warnAt("synthetic", SourceRange.EMPTY);

        assertNull(issues.get(0).where().range());
        assertInstanceOf(IssueLoc.None.class, issues.get(0).where());
    }
}
