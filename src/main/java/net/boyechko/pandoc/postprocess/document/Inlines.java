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
package net.boyechko.pandoc.postprocess.document;

import java.util.ArrayList;
import java.util.List;

/** Utility methods for inline sequences. */
public final class Inlines {
    private Inlines() {}

    public static boolean isSpace(Inline inline) {
        return inline instanceof Inline.Space;
    }

    /** Returns the sequence without leading or trailing Space nodes. */
    public static List<Inline> trim(List<Inline> inlines) {
        int from = 0;
        int to = inlines.size();
        while (from < to && isSpace(inlines.get(from))) {
            from++;
        }
        while (to > from && isSpace(inlines.get(to - 1))) {
            to--;
        }
        if (from == 0 && to == inlines.size()) {
            return inlines;
        }
        return new ArrayList<>(inlines.subList(from, to));
    }

    /** Returns true if {@link #trim} would remove anything. */
    public static boolean needsTrim(List<Inline> inlines) {
        return !inlines.isEmpty()
                && (isSpace(inlines.get(0)) || isSpace(inlines.get(inlines.size() - 1)));
    }

    /** Flattens inlines to plain text the way Pandoc's {@code stringify} does. */
    public static String stringify(List<Inline> inlines) {
        StringBuilder sb = new StringBuilder();
        for (Inline inline : inlines) {
            appendText(sb, inline);
        }
        return sb.toString();
    }

    private static void appendText(StringBuilder sb, Inline inline) {
        if (inline instanceof Inline.Str str) {
            sb.append(str.text());
        } else if (inline instanceof Inline.Space
                || inline instanceof Inline.SoftBreak
                || inline instanceof Inline.LineBreak) {
            sb.append(' ');
        } else if (inline instanceof Inline.Code code) {
            sb.append(code.text());
        } else if (inline instanceof Inline.Math math) {
            sb.append(math.text());
        } else if (inline instanceof Inline.Quoted quoted) {
            String mark = quoted.quoteType() == Inline.QuoteType.SINGLE ? "‘" : "“";
            String close = quoted.quoteType() == Inline.QuoteType.SINGLE ? "’" : "”";
            sb.append(mark).append(stringify(quoted.content())).append(close);
        } else if (inline instanceof Inline.Container container) {
            sb.append(stringify(container.content()));
        } else if (inline instanceof Inline.Link link) {
            sb.append(stringify(link.content()));
        } else if (inline instanceof Inline.Image image) {
            sb.append(stringify(image.content()));
        } else if (inline instanceof Inline.Cite cite) {
            sb.append(stringify(cite.content()));
        }
        // Notes, raw content and transient markers contribute no text.
    }
}
