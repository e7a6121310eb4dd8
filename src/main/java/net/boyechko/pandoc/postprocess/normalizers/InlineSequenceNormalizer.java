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
import java.util.List;
import java.util.Set;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.NodeKind;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;

/**
 * Cleans up every inline sequence: drops the SoftBreak the parser emits after a hard
 * LineBreak, wraps Math followed by an attribute block in a Span, then applies {@link
 * CitationSuffixFusion}.
 */
public class InlineSequenceNormalizer implements RewritePass {
    public static final String MATH_WITH_ATTRIBUTE = "quarto-math-with-attribute";

    // Owners that consume a trailing attribute block themselves.
    private static final Set<NodeKind> ATTR_OWNERS =
            Set.of(NodeKind.HEADER, NodeKind.CAPTION_BLOCK);

    @Override
    public String name() {
        return "Inline sequence normalizer";
    }

    @Override
    public String description() {
        return "Break cleanup, math attributes and citation locators";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onInlines(this::onInlines);
    }

    private FilterReturn<List<Inline>, List<Inline>> onInlines(
            List<Inline> inlines, WalkContext ctx) {
        List<Inline> cleaned = dropSoftBreaksAfterLineBreaks(inlines);
        List<Inline> withMath = wrapAttributedMath(cleaned, ATTR_OWNERS.contains(ctx.parent()));
        List<Inline> fused = CitationSuffixFusion.fuse(withMath);
        return FilterReturn.unchanged(fused.equals(inlines) ? inlines : fused);
    }

    static List<Inline> dropSoftBreaksAfterLineBreaks(List<Inline> inlines) {
        List<Inline> out = new ArrayList<>(inlines.size());
        for (int i = 0; i < inlines.size(); i++) {
            Inline current = inlines.get(i);
            out.add(current);
            if (current instanceof Inline.LineBreak
                    && i + 1 < inlines.size()
                    && inlines.get(i + 1) instanceof Inline.SoftBreak) {
                i++;
            }
        }
        return out;
    }

    /**
     * Replaces {@code Math [Space] AttrMarker} with a Span carrying the marker's attributes. A
     * marker ending the sequence is left for its owner when {@code keepTrailingMarker} is set.
     */
    static List<Inline> wrapAttributedMath(List<Inline> inlines, boolean keepTrailingMarker) {
        List<Inline> out = new ArrayList<>(inlines.size());
        int i = 0;
        while (i < inlines.size()) {
            Inline current = inlines.get(i);
            if (current instanceof Inline.Math math) {
                boolean hasSpace =
                        i + 1 < inlines.size() && inlines.get(i + 1) instanceof Inline.Space;
                int attrIdx = hasSpace ? i + 2 : i + 1;
                boolean reserved = keepTrailingMarker && attrIdx == inlines.size() - 1;
                if (attrIdx < inlines.size()
                        && !reserved
                        && inlines.get(attrIdx) instanceof Inline.AttrMarker marker) {
                    Attr attr = marker.attr().prependClass(MATH_WITH_ATTRIBUTE);
                    out.add(
                            new Inline.Span(
                                    attr, List.of(math), math.range().combine(marker.range())));
                    i = attrIdx + 1;
                    continue;
                }
            }
            out.add(current);
            i++;
        }
        return out;
    }
}
