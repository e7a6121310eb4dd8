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
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.SourceRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps an abbreviation with the word after it, the way Pandoc does: {@code Dr.} followed by a
 * Space and {@code Smith} becomes the single Str {@code Dr.&nbsp;Smith}.
 *
 * <p>An abbreviation counts only at a word boundary, i.e. when it is the whole text or the
 * character before it is neither a letter nor a digit ({@code (e.g.} qualifies, {@code xe.g.}
 * does not). Absorption continues while the growing text still ends in an abbreviation. When
 * no word follows, a single trailing Space is absorbed as a non-breaking space.
 */
public final class AbbreviationCoalescer {
    private static final Logger logger = LoggerFactory.getLogger(AbbreviationCoalescer.class);

    public static final char NBSP = '\u00A0';

    private final List<String> abbreviations;

    public AbbreviationCoalescer(List<String> abbreviations) {
        this.abbreviations = List.copyOf(abbreviations);
    }

    public List<String> abbreviations() {
        return abbreviations;
    }

    /** Returns true if {@code text} ends with a known abbreviation at a word boundary. */
    public boolean endsWithAbbreviation(String text) {
        for (String abbreviation : abbreviations) {
            if (hasBoundary(text, abbreviation)) {
                return true;
            }
        }
        return false;
    }

    static boolean hasBoundary(String text, String abbreviation) {
        if (!text.endsWith(abbreviation)) {
            return false;
        }
        int prefixEnd = text.length() - abbreviation.length();
        if (prefixEnd == 0) {
            return true;
        }
        int before = text.codePointBefore(prefixEnd);
        return !Character.isLetterOrDigit(before);
    }

    /** Returns the sequence with abbreviations coalesced; the input list is not modified. */
    public List<Inline> coalesce(List<Inline> inlines) {
        List<Inline> result = new ArrayList<>(inlines.size());
        int i = 0;
        while (i < inlines.size()) {
            if (!(inlines.get(i) instanceof Inline.Str str) || !endsWithAbbreviation(str.text())) {
                result.add(inlines.get(i));
                i++;
                continue;
            }
            StringBuilder text = new StringBuilder(str.text());
            SourceRange range = str.range();
            int next = i + 1;
            while (next + 1 < inlines.size()
                    && inlines.get(next) instanceof Inline.Space
                    && inlines.get(next + 1) instanceof Inline.Str word) {
                text.append(NBSP).append(word.text());
                range = range.combine(word.range());
                next += 2;
                if (!endsWithAbbreviation(text.toString())) {
                    break;
                }
            }
            if (next == i + 1
                    && next < inlines.size()
                    && inlines.get(next) instanceof Inline.Space space) {
                text.append(NBSP);
                range = range.combine(space.range());
                next++;
            }
            if (next > i + 1) {
                logger.debug("Coalesced abbreviation into \"{}\" {}", text, range);
            }
            result.add(new Inline.Str(text.toString(), range));
            i = next;
        }
        return result;
    }
}
