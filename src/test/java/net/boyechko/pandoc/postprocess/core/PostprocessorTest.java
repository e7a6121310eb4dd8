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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.pandoc.postprocess.DocTestBase;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Document;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.issue.Issue;
import net.boyechko.pandoc.postprocess.issue.IssueList;
import net.boyechko.pandoc.postprocess.issue.IssueType;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import org.junit.jupiter.api.Test;

class PostprocessorTest extends DocTestBase {

    private static Postprocessor postprocessor() {
        return Postprocessor.builder()
                .withConfig(PostprocessConfig.builtin())
                .withListener(new NoOpPostprocessListener())
                .build();
    }

    /** A Div written as {@code ::: {.list-table header-rows=1}} with a 2x2 grid. */
    @SuppressWarnings("unchecked")
    private static Block.Div listTableDiv() {
        return div(
                attr("", List.of("list-table"), Map.of("header-rows", "1")),
                bulletList(
                        item(bulletList(item(plain(str("a"))), item(plain(str("b"))))),
                        item(bulletList(item(plain(str("c"))), item(plain(str("d")))))));
    }

    @Test
    void cleanDocumentSucceeds() {
        Document doc = doc(header(1, str("Intro")), listTableDiv());
        IssueList issues = new IssueList();

        PostprocessResult result = postprocessor().postprocess(doc, issues);

        assertTrue(result.isSuccess());
        assertSame(doc, result.document());
        assertTrue(issues.isEmpty());
        assertInstanceOf(Block.Table.class, doc.blocks().get(1));
        assertEquals("intro", ((Block.Header) doc.blocks().get(0)).attr().id());
    }

    @Test
    void leftoverAttrMarkerFailsTheRun() {
        Document doc = doc(para(str("a"), space(), attrMarker(Attr.withClasses("x"))));
        IssueList issues = new IssueList();

        PostprocessResult result = postprocessor().postprocess(doc, issues);

        assertFalse(result.isSuccess());
        assertNull(result.document());
        assertEquals(1, issues.ofType(IssueType.LEFTOVER_ATTR_MARKER).size());
    }

    @Test
    void warningsDoNotFailTheRun() {
        Document doc = doc(para(str("x")), new Block.CaptionBlock(List.of(str("c")), NO_RANGE));
        IssueList issues = new IssueList();

        PostprocessResult result = postprocessor().postprocess(doc, issues);

        assertTrue(result.isSuccess());
        assertEquals(1, issues.getWarnings().size());
    }

    @Test
    void secondRunChangesNothing() {
        Document doc =
                doc(
                        header(1, str("Intro"), space(), attrMarker(Attr.withClasses("lead"))),
                        header(2, str("Intro")),
                        para(cite("key"), space(), str("end"), lineBreak()),
                        para(math("x^2"), space(), attrMarker(Attr.withId("eq-1"))),
                        para(cite("k1"), space(), span(Attr.EMPTY, str("p."), space(), str("12"))),
                        para(new Inline.Insert(Attr.EMPTY, List.of(str("new")), NO_RANGE)),
                        listTableDiv(),
                        captionBlock(
                                str("Totals"),
                                space(),
                                attrMarker(attr("tbl-1", List.of("wide"), Map.of("k", "v")))),
                        div(
                                Attr.withClasses("definition-list"),
                                bulletList(
                                        item(
                                                plain(str("apple")),
                                                bulletList(item(plain(str("fruit"))))))));
        Postprocessor postprocessor = postprocessor();
        IssueList firstIssues = new IssueList();
        assertTrue(postprocessor.postprocess(doc, firstIssues).isSuccess());
        assertTrue(firstIssues.isEmpty());
        Document once = doc.copy();

        IssueList secondIssues = new IssueList();
        assertTrue(postprocessor.postprocess(doc, secondIssues).isSuccess());

        assertEquals(once, doc);
        assertTrue(secondIssues.isEmpty());
        assertEquals(8, doc.blocks().size());
        Block.Table table = (Block.Table) doc.blocks().get(6);
        assertEquals("tbl-1", table.attr().id());
        assertEquals(List.of(plain(str("Totals"))), table.caption().longCaption());
        assertInstanceOf(Block.DefinitionList.class, doc.blocks().get(7));
    }

    @Test
    @SuppressWarnings("unchecked")
    void listTableKeepsColonRowInBody() {
        Block.Div div =
                div(
                        attr("", List.of("list-table"), Map.of()),
                        bulletList(
                                item(bulletList(item(plain(str("a"))), item(plain(str("b"))))),
                                item(bulletList(item(plain(str(":-)")))))));
        Document doc = doc(div);

        postprocessor().postprocess(doc, new IssueList());

        Block.Table table = (Block.Table) doc.blocks().get(0);
        assertEquals(2, table.bodies().get(0).body().size());
        assertTrue(table.caption().isEmpty());
    }

    @Test
    void headerIdsRestartForEachDocument() {
        Postprocessor postprocessor = postprocessor();
        Document first = doc(header(1, str("Intro")));
        Document second = doc(header(1, str("Intro")));

        postprocessor.postprocess(first, new IssueList());
        postprocessor.postprocess(second, new IssueList());

        assertEquals("intro", ((Block.Header) second.blocks().get(0)).attr().id());
    }

    @Test
    void skippingPrerequisiteIsRejected() {
        IllegalArgumentException e =
                assertThrows(
                        IllegalArgumentException.class,
                        () ->
                                Postprocessor.builder()
                                        .withConfig(PostprocessConfig.builtin())
                                        .skipPasses(Set.of("TrailingLineBreaks"))
                                        .build());

        assertTrue(e.getMessage().startsWith("HeaderIdAssigner requires TrailingLineBreaks"));
    }

    @Test
    void skippingPassAndDependentsIsAllowed() {
        Postprocessor postprocessor =
                Postprocessor.builder()
                        .withConfig(PostprocessConfig.builtin())
                        .skipPasses(
                                Set.of(
                                        "TrailingLineBreaks",
                                        "HeaderIdAssigner",
                                        "FigureRecognizer"))
                        .build();
        Document doc = doc(header(1, str("Intro")));

        postprocessor.postprocess(doc, new IssueList());

        assertEquals("", ((Block.Header) doc.blocks().get(0)).attr().id());
    }

    @Test
    void nullListenerIsRejected() {
        assertThrows(
                IllegalStateException.class,
                () -> Postprocessor.builder().withListener(null).build());
    }

    @Test
    void extraPassRunsAfterStandardPasses() {
        List<String> seen = new ArrayList<>();
        RewritePass recorder =
                new RewritePass() {
                    @Override
                    public String name() {
                        return "Recorder";
                    }

                    @Override
                    public String description() {
                        return "Records span classes";
                    }

                    @Override
                    public void register(Filter.Builder builder) {
                        builder.onInline(
                                Inline.Span.class,
                                (span, ctx) -> {
                                    seen.add(span.attr().classes().get(0));
                                    return FilterReturn.unchanged(span);
                                });
                    }
                };
        Postprocessor postprocessor =
                Postprocessor.builder()
                        .withConfig(PostprocessConfig.builtin())
                        .addPass(() -> recorder)
                        .build();
        Document doc =
                doc(para(new Inline.Insert(Attr.EMPTY, List.of(str("new")), NO_RANGE)));

        postprocessor.postprocess(doc, new IssueList());

        assertEquals(List.of("quarto-insert"), seen);
    }

    @Test
    void repeatedIssuesAreReportedAsGroup() {
        List<String> groups = new ArrayList<>();
        List<Issue> singles = new ArrayList<>();
        PostprocessListener listener =
                new NoOpPostprocessListener() {
                    @Override
                    public void onIssue(Issue issue) {
                        singles.add(issue);
                    }

                    @Override
                    public void onIssueGroup(String groupLabel, List<Issue> issues) {
                        groups.add(groupLabel + ":" + issues.size());
                    }
                };
        Block.CaptionBlock orphan = new Block.CaptionBlock(List.of(str("c")), NO_RANGE);
        Document doc =
                doc(
                        para(attrMarker(Attr.withId("a"))),
                        para(attrMarker(Attr.withId("b"))),
                        para(attrMarker(Attr.withId("c"))),
                        para(str("x")),
                        orphan);

        Postprocessor.builder()
                .withConfig(PostprocessConfig.builtin())
                .withListener(listener)
                .build()
                .postprocess(doc, new IssueList());

        assertEquals(List.of("attribute block left unattached:3"), groups);
        assertEquals(1, singles.size());
        assertEquals(IssueType.ORPHAN_CAPTION, singles.get(0).type());
    }

    @Test
    void mergeStrsAppliesConfiguredTables() {
        Document doc = doc(para(str("See"), space(), str("Dr."), space(), str("Who"), str("...")));

        postprocessor().mergeStrs(doc);

        assertEquals(List.of(para(str("See"), space(), str("Dr.\u00A0Who…"))), doc.blocks());
    }
}
