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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.ShortcodeArg;
import net.boyechko.pandoc.postprocess.document.SourceRange;
import net.boyechko.pandoc.postprocess.issue.IssueList;
import net.boyechko.pandoc.postprocess.issue.IssueType;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes unresolved shortcodes as Spans so that later stages can find and resolve them. The
 * outer Span has class {@value #SHORTCODE_CLASS}; its content holds one empty parameter Span
 * per name, positional value and key-value pair, in source order.
 */
public class Shortcodes implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(Shortcodes.class);

    public static final String SHORTCODE_CLASS = "quarto-shortcode__";
    public static final String PARAM_CLASS = "quarto-shortcode__-param";
    public static final String IS_SHORTCODE = "data-is-shortcode";

    @Override
    public String name() {
        return "Shortcodes";
    }

    @Override
    public String description() {
        return "Shortcodes are encoded as marker spans";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onInline(Inline.Shortcode.class, this::onShortcode);
    }

    private FilterReturn<Inline, List<Inline>> onShortcode(
            Inline.Shortcode shortcode, WalkContext ctx) {
        return FilterReturn.replaced(List.of(toSpan(shortcode, ctx.issues())));
    }

    /** Converts {@code shortcode} and any shortcodes nested in its positional arguments. */
    public static Inline.Span toSpan(Inline.Shortcode shortcode, IssueList issues) {
        List<Inline> content = new ArrayList<>();
        content.add(valueSpan(shortcode.name()));
        for (ShortcodeArg arg : shortcode.positionalArgs()) {
            if (arg instanceof ShortcodeArg.Nested nested) {
                content.add(toSpan(nested.shortcode(), issues));
            } else if (arg instanceof ShortcodeArg.KeyValues keyValues) {
                keyValues.entries().forEach(
                        (key, value) -> addKeyValue(content, key, value, shortcode, issues));
            } else {
                content.add(valueSpan(render(arg)));
            }
        }
        shortcode.keywordArgs().forEach(
                (key, value) -> addKeyValue(content, key, value, shortcode, issues));

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(IS_SHORTCODE, "1");
        Attr attr = new Attr("", List.of(SHORTCODE_CLASS), attributes);
        logger.debug("Encoded shortcode '{}' {}", shortcode.name(), shortcode.range());
        return new Inline.Span(attr, content, SourceRange.EMPTY);
    }

    private static void addKeyValue(
            List<Inline> content,
            String key,
            ShortcodeArg value,
            Inline.Shortcode owner,
            IssueList issues) {
        if (value instanceof ShortcodeArg.Nested || value instanceof ShortcodeArg.KeyValues) {
            issues.warnAt(
                    IssueType.UNSUPPORTED_SHORTCODE_ARG,
                    "Shortcode '"
                            + owner.name()
                            + "' argument '"
                            + key
                            + "' must be a string, number or boolean; argument ignored",
                    owner.range());
            return;
        }
        content.add(keyValueSpan(key, render(value)));
    }

    private static String render(ShortcodeArg arg) {
        if (arg instanceof ShortcodeArg.Text text) {
            return text.value();
        } else if (arg instanceof ShortcodeArg.Number number) {
            return number.render();
        } else if (arg instanceof ShortcodeArg.Bool bool) {
            return Boolean.toString(bool.value());
        }
        throw new IllegalStateException("Cannot render shortcode argument " + arg);
    }

    private static Inline valueSpan(String value) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("data-raw", value);
        attributes.put("data-value", value);
        attributes.put(IS_SHORTCODE, "1");
        return paramSpan(attributes);
    }

    private static Inline keyValueSpan(String key, String value) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("data-raw", key + " = " + value);
        attributes.put("data-key", key);
        attributes.put("data-value", value);
        attributes.put(IS_SHORTCODE, "1");
        return paramSpan(attributes);
    }

    private static Inline paramSpan(Map<String, String> attributes) {
        return new Inline.Span(
                new Attr("", List.of(PARAM_CLASS), attributes), List.of(), SourceRange.EMPTY);
    }
}
