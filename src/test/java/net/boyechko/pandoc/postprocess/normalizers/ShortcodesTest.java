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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pandoc.postprocess.DocTestBase;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.ShortcodeArg;
import net.boyechko.pandoc.postprocess.issue.IssueList;
import net.boyechko.pandoc.postprocess.issue.IssueType;
import org.junit.jupiter.api.Test;

class ShortcodesTest extends DocTestBase {

    private static Inline.Shortcode shortcode(
            String name, List<ShortcodeArg> positional, Map<String, ShortcodeArg> keywords) {
        return new Inline.Shortcode(false, name, positional, keywords, at(0, 20));
    }

    private static Map<String, String> param(String value) {
        Map<String, String> kv = new LinkedHashMap<>();
        kv.put("data-raw", value);
        kv.put("data-value", value);
        kv.put("data-is-shortcode", "1");
        return kv;
    }

    @Test
    void nameAndPositionalArgsBecomeParamSpans() {
        Inline.Shortcode sc =
                shortcode(
                        "meta",
                        List.of(
                                new ShortcodeArg.Text("title"),
                                new ShortcodeArg.Number(3.0),
                                new ShortcodeArg.Number(2.5),
                                new ShortcodeArg.Bool(true)),
                        Map.of());

        Inline.Span span = Shortcodes.toSpan(sc, new IssueList());

        assertEquals(List.of("quarto-shortcode__"), span.attr().classes());
        assertEquals("1", span.attr().attribute("data-is-shortcode"));
        List<String> values =
                span.content().stream()
                        .map(i -> ((Inline.Span) i).attr().attribute("data-value"))
                        .toList();
        assertEquals(List.of("meta", "title", "3", "2.5", "true"), values);
        assertEquals(param("meta"), ((Inline.Span) span.content().get(0)).attr().attributes());
        assertEquals(
                List.of("quarto-shortcode__-param"),
                ((Inline.Span) span.content().get(1)).attr().classes());
    }

    @Test
    void keywordArgsBecomeKeyValueSpans() {
        Map<String, ShortcodeArg> keywords = new LinkedHashMap<>();
        keywords.put("size", new ShortcodeArg.Text("large"));
        Inline.Shortcode sc = shortcode("video", List.of(), keywords);

        Inline.Span span = Shortcodes.toSpan(sc, new IssueList());

        Inline.Span kv = (Inline.Span) span.content().get(1);
        assertEquals("size = large", kv.attr().attribute("data-raw"));
        assertEquals("size", kv.attr().attribute("data-key"));
        assertEquals("large", kv.attr().attribute("data-value"));
    }

    @Test
    void nestedShortcodeIsConvertedRecursively() {
        Inline.Shortcode inner = shortcode("var", List.of(new ShortcodeArg.Text("x")), Map.of());
        Inline.Shortcode outer =
                shortcode("meta", List.of(new ShortcodeArg.Nested(inner)), Map.of());

        Inline.Span span = Shortcodes.toSpan(outer, new IssueList());

        Inline.Span nested = (Inline.Span) span.content().get(1);
        assertEquals(List.of("quarto-shortcode__"), nested.attr().classes());
        assertEquals(2, nested.content().size());
    }

    @Test
    void nestedShortcodeAsKeywordValueIsSkippedWithWarning() {
        Map<String, ShortcodeArg> keywords = new LinkedHashMap<>();
        keywords.put("bad", new ShortcodeArg.Nested(shortcode("var", List.of(), Map.of())));
        keywords.put("good", new ShortcodeArg.Bool(false));
        IssueList issues = new IssueList();

        Inline.Span span = Shortcodes.toSpan(shortcode("x", List.of(), keywords), issues);

        assertEquals(2, span.content().size(), "name plus the one supported argument");
        assertEquals(1, issues.size());
        assertEquals(IssueType.UNSUPPORTED_SHORTCODE_ARG, issues.get(0).type());
        assertFalse(issues.hasErrors());
    }

    @Test
    void shortcodeInlineIsReplacedDuringWalk() {
        var result =
                run(doc(para(shortcode("pagebreak", List.of(), Map.of()))), new Shortcodes());

        Block.Paragraph para = (Block.Paragraph) result.blocks().get(0);
        assertInstanceOf(Inline.Span.class, para.content().get(0));
    }
}
