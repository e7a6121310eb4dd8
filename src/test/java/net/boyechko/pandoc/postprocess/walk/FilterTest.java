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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pandoc.postprocess.DocTestBase;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.NodeKind;
import net.boyechko.pandoc.postprocess.issue.IssueList;
import org.junit.jupiter.api.Test;

class FilterTest extends DocTestBase {
    private final WalkContext ctx = new WalkContext(new IssueList(), NodeKind.DOCUMENT);

    @Test
    void callbacksForOneKindSeeThePreviousValue() {
        Filter filter =
                Filter.builder()
                        .onInline(
                                Inline.Str.class,
                                (s, c) -> FilterReturn.unchanged(s.withText(s.text() + "b")))
                        .onInline(
                                Inline.Str.class,
                                (s, c) -> FilterReturn.unchanged(s.withText(s.text() + "c")))
                        .build();

        FilterReturn<Inline, List<Inline>> result = filter.applyInline(str("a"), ctx);

        assertTrue(result.isUnchanged());
        Inline value = ((FilterReturn.Unchanged<Inline, List<Inline>>) result).value();
        assertEquals(str("abc"), value);
    }

    @Test
    void replacementEndsTheChain() {
        List<String> calls = new ArrayList<>();
        Filter filter =
                Filter.builder()
                        .onInline(
                                Inline.Str.class,
                                (s, c) -> {
                                    calls.add("first");
                                    return FilterReturn.replaced(List.of(space()));
                                })
                        .onInline(
                                Inline.Str.class,
                                (s, c) -> {
                                    calls.add("second");
                                    return FilterReturn.unchanged(s);
                                })
                        .build();

        FilterReturn<Inline, List<Inline>> result = filter.applyInline(str("a"), ctx);

        assertEquals(List.of("first"), calls);
        var replaced = (FilterReturn.Replaced<Inline, List<Inline>>) result;
        assertEquals(List.of(space()), replaced.replacement());
    }

    @Test
    void keptValueOfAnotherKindSkipsRemainingCallbacks() {
        List<String> calls = new ArrayList<>();
        Filter filter =
                Filter.builder()
                        .onInline(Inline.Str.class, (s, c) -> FilterReturn.unchanged(space()))
                        .onInline(
                                Inline.Str.class,
                                (s, c) -> {
                                    calls.add("second");
                                    return FilterReturn.unchanged(s);
                                })
                        .build();

        FilterReturn<Inline, List<Inline>> result = filter.applyInline(str("a"), ctx);

        assertTrue(calls.isEmpty(), "Str callback must not see a Space");
        assertEquals(space(), ((FilterReturn.Unchanged<Inline, List<Inline>>) result).value());
    }

    @Test
    void unregisteredKindIsUnchanged() {
        Filter filter = Filter.builder().build();

        FilterReturn<Inline, List<Inline>> result = filter.applyInline(str("a"), ctx);

        assertTrue(result.isUnchanged());
        assertFalse(filter.handles(NodeKind.STR));
    }

    @Test
    void sequenceCallbacksThreadValuesAndCombineRescan() {
        Filter filter =
                Filter.builder()
                        .onInlines(
                                (seq, c) -> {
                                    List<Inline> out = new ArrayList<>(seq);
                                    out.add(str("x"));
                                    return FilterReturn.replaced(out, true);
                                })
                        .onInlines(
                                (seq, c) -> {
                                    List<Inline> out = new ArrayList<>(seq);
                                    out.add(str("y"));
                                    return FilterReturn.replaced(out, false);
                                })
                        .build();

        FilterReturn<List<Inline>, List<Inline>> result =
                filter.applyInlines(List.of(str("a")), ctx);

        var replaced = (FilterReturn.Replaced<List<Inline>, List<Inline>>) result;
        assertEquals(List.of(str("a"), str("x"), str("y")), replaced.replacement());
        assertTrue(replaced.rescan(), "Any rescan request must be kept");
    }

    @Test
    void sequenceCallbacksThatKeepTheirInputReportUnchanged() {
        Filter filter =
                Filter.builder().onBlocks((seq, c) -> FilterReturn.unchanged(seq)).build();

        assertTrue(filter.applyBlocks(List.of(para(str("a"))), ctx).isUnchanged());
    }
}
