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

import static org.junit.jupiter.api.Assertions.*;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import net.boyechko.pandoc.postprocess.DocTestBase;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Document;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.TreeDump;
import net.boyechko.pandoc.postprocess.issue.IssueList;
import org.junit.jupiter.api.Test;

/**
 * Runs the full pipeline, including string merging, and compares the resulting tree with a
 * snapshot under {@code src/test/resources/goals}. A failure prints a unified diff.
 */
class GoalTreeTest extends DocTestBase {

    private static final Path GOALS_DIR = Path.of("src/test/resources/goals");

    @Test
    void headersAndInlineMarks() throws Exception {
        Document doc =
                doc(
                        header(1, str("Intro"), space(), attrMarker(Attr.withClasses("lead"))),
                        header(2, str("Intro")),
                        para(
                                str("See"), space(), str("Dr."), space(), str("Who"), space(),
                                str("..."), lineBreak()),
                        para(
                                new Inline.Insert(Attr.EMPTY, List.of(str("new")), NO_RANGE),
                                space(),
                                new Inline.NoteReference("fn1", NO_RANGE)));

        assertMatchesGoal("headers-and-marks", doc);
    }

    @Test
    @SuppressWarnings("unchecked")
    void listTable() throws Exception {
        Document doc =
                doc(
                        div(
                                attr("", List.of("list-table"), Map.of("header-rows", "1")),
                                bulletList(
                                        item(
                                                bulletList(
                                                        item(plain(str("a"))),
                                                        item(plain(str("b"))))),
                                        item(
                                                bulletList(
                                                        item(plain(str("c"))),
                                                        item(plain(str("d"))))))));

        assertMatchesGoal("list-table", doc);
    }

    private static void assertMatchesGoal(String name, Document doc) throws Exception {
        Path goalFile = GOALS_DIR.resolve(name + ".goal.txt");
        assertTrue(Files.exists(goalFile), "Goal snapshot not found: " + goalFile);

        Postprocessor postprocessor =
                Postprocessor.builder()
                        .withConfig(PostprocessConfig.builtin())
                        .withListener(new NoOpPostprocessListener())
                        .build();
        PostprocessResult result = postprocessor.postprocess(doc, new IssueList());
        assertTrue(result.isSuccess(), "Postprocessing failed: " + result.issues());
        postprocessor.mergeStrs(doc);

        String actualTree = TreeDump.dump(doc).strip();
        String expectedTree = Files.readString(goalFile).strip();
        if (!expectedTree.equals(actualTree)) {
            fail("Tree of " + name + " does not match goal.\n\n"
                    + unifiedDiff(expectedTree, actualTree));
        }
    }

    private static String unifiedDiff(String expected, String actual) {
        List<String> goalLines = expected.lines().toList();
        List<String> actualLines = actual.lines().toList();
        Patch<String> patch = DiffUtils.diff(goalLines, actualLines);
        List<String> diff =
                UnifiedDiffUtils.generateUnifiedDiff("goal", "actual", goalLines, patch, 2);
        return String.join("\n", diff);
    }
}
