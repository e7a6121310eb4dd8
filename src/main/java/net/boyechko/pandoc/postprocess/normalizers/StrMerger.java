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
import java.util.Map;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.SourceRange;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;

/**
 * Merges runs of adjacent Str nodes into one, substituting smart typography for a Str whose
 * whole text is a known sequence (e.g. {@code ...} becomes an ellipsis), then coalesces
 * abbreviations with the following word.
 */
public class StrMerger implements RewritePass {
    private final Map<String, String> smartTypography;
    private final AbbreviationCoalescer coalescer;

    public StrMerger(Map<String, String> smartTypography, AbbreviationCoalescer coalescer) {
        this.smartTypography = Map.copyOf(smartTypography);
        this.coalescer = coalescer;
    }

    @Override
    public String name() {
        return "Str merger";
    }

    @Override
    public String description() {
        return "Adjacent strings are merged and abbreviations kept with the next word";
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onInlines(this::onInlines);
    }

    private FilterReturn<List<Inline>, List<Inline>> onInlines(
            List<Inline> inlines, WalkContext ctx) {
        List<Inline> merged = coalescer.coalesce(merge(inlines));
        return FilterReturn.unchanged(merged.equals(inlines) ? inlines : merged);
    }

    List<Inline> merge(List<Inline> inlines) {
        List<Inline> result = new ArrayList<>(inlines.size());
        StringBuilder pending = null;
        SourceRange pendingRange = null;
        for (Inline inline : inlines) {
            if (inline instanceof Inline.Str str) {
                String text = smartTypography.getOrDefault(str.text(), str.text());
                if (pending == null) {
                    pending = new StringBuilder(text);
                    pendingRange = str.range();
                } else {
                    pending.append(text);
                    pendingRange = pendingRange.combine(str.range());
                }
                continue;
            }
            if (pending != null) {
                result.add(new Inline.Str(pending.toString(), pendingRange));
                pending = null;
            }
            result.add(inline);
        }
        if (pending != null) {
            result.add(new Inline.Str(pending.toString(), pendingRange));
        }
        return result;
    }
}
