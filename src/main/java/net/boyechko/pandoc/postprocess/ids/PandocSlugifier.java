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
package net.boyechko.pandoc.postprocess.ids;

import java.util.List;
import java.util.Locale;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.Inlines;

/**
 * Pandoc's {@code auto_identifiers} algorithm. The plain text of the header is lowercased and
 * everything but letters, digits, whitespace, {@code _}, {@code -} and {@code .} is removed.
 * The remaining words are joined with single hyphens and anything before the first letter is
 * dropped. An empty result becomes {@value #FALLBACK_ID}.
 */
public class PandocSlugifier implements Slugifier {
    public static final String FALLBACK_ID = "section";

    @Override
    public String slugify(List<Inline> content) {
        return slugify(Inlines.stringify(content));
    }

    public String slugify(String text) {
        StringBuilder kept = new StringBuilder();
        text.toLowerCase(Locale.ROOT)
                .codePoints()
                .forEach(
                        cp -> {
                            if (isWordChar(cp)) {
                                kept.appendCodePoint(cp);
                            } else if (isSpace(cp)) {
                                kept.append(' ');
                            }
                        });
        String joined = String.join("-", kept.toString().trim().split(" +"));

        int start = 0;
        while (start < joined.length() && !Character.isLetter(joined.codePointAt(start))) {
            start += Character.charCount(joined.codePointAt(start));
        }
        String id = joined.substring(start);
        return id.isEmpty() ? FALLBACK_ID : id;
    }

    private static boolean isWordChar(int cp) {
        return Character.isLetterOrDigit(cp) || cp == '_' || cp == '-' || cp == '.';
    }

    private static boolean isSpace(int cp) {
        return Character.isWhitespace(cp) || Character.isSpaceChar(cp);
    }
}
