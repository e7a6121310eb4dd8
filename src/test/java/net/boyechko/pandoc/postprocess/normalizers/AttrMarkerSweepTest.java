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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pandoc.postprocess.DocTestBase;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Document;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.issue.Issue;
import net.boyechko.pandoc.postprocess.issue.IssueList;
import net.boyechko.pandoc.postprocess.issue.IssueType;
import org.junit.jupiter.api.Test;

class AttrMarkerSweepTest extends DocTestBase {

    @Test
    void leftoverMarkerIsRemovedWithError() {
        Inline.AttrMarker marker = new Inline.AttrMarker(Attr.withClasses("stray"), at(4, 12));
        IssueList issues = new IssueList();

        Document result =
                run(doc(para(str("a"), space(), marker)), issues, new AttrMarkerSweep());

        assertEquals(List.of(para(str("a"), space())), result.blocks());
        assertTrue(issues.hasErrors());
        Issue issue = issues.get(0);
        assertEquals(IssueType.LEFTOVER_ATTR_MARKER, issue.type());
        assertEquals(
                "Found attr in postprocess: {.stray} - this should have been removed",
                issue.message());
        assertEquals(at(4, 12), issue.where().range());
    }

    @Test
    void documentWithoutMarkersHasNoIssues() {
        IssueList issues = new IssueList();

        run(doc(para(str("clean"))), issues, new AttrMarkerSweep());

        assertTrue(issues.isEmpty());
    }
}
