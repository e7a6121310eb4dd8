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
import net.boyechko.pandoc.postprocess.document.Citation;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.SourceRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds the {@code @key [locator]} idiom into the citation. A Cite with one bare citation,
 * then a Space, then a Span of only Str and Space nodes becomes a single Cite whose citation
 * suffix is the Span's content and whose rendered content ends with the bracketed words.
 */
public final class CitationSuffixFusion {
    private static final Logger logger = LoggerFactory.getLogger(CitationSuffixFusion.class);

    enum State {
        SCANNING,
        SAW_SIMPLE_CITE,
        SAW_SPACE_AFTER_CITE
    }

    private CitationSuffixFusion() {}

    /** Returns the sequence with every cite-space-span run fused; other nodes pass through. */
    public static List<Inline> fuse(List<Inline> inlines) {
        List<Inline> out = new ArrayList<>(inlines.size());
        State state = State.SCANNING;
        Inline.Cite pendingCite = null;
        Inline.Space pendingSpace = null;

        for (Inline inline : inlines) {
            switch (state) {
                case SCANNING -> {
                    if (inline instanceof Inline.Cite cite && isSimple(cite)) {
                        pendingCite = cite;
                        state = State.SAW_SIMPLE_CITE;
                    } else {
                        out.add(inline);
                    }
                }
                case SAW_SIMPLE_CITE -> {
                    if (inline instanceof Inline.Space space) {
                        pendingSpace = space;
                        state = State.SAW_SPACE_AFTER_CITE;
                    } else {
                        out.add(pendingCite);
                        out.add(inline);
                        pendingCite = null;
                        state = State.SCANNING;
                    }
                }
                case SAW_SPACE_AFTER_CITE -> {
                    if (inline instanceof Inline.Span span && isSuffixSpan(span)) {
                        out.add(merge(pendingCite, span));
                    } else {
                        out.add(pendingCite);
                        out.add(pendingSpace);
                        out.add(inline);
                    }
                    pendingCite = null;
                    pendingSpace = null;
                    state = State.SCANNING;
                }
            }
        }

        if (pendingCite != null) {
            out.add(pendingCite);
            if (state == State.SAW_SPACE_AFTER_CITE) {
                out.add(pendingSpace);
            }
        }
        return out;
    }

    private static boolean isSimple(Inline.Cite cite) {
        if (cite.citations().size() != 1) {
            return false;
        }
        Citation only = cite.citations().get(0);
        return only.prefix().isEmpty() && only.suffix().isEmpty();
    }

    private static boolean isSuffixSpan(Inline.Span span) {
        for (Inline inline : span.content()) {
            if (!(inline instanceof Inline.Str || inline instanceof Inline.Space)) {
                return false;
            }
        }
        return true;
    }

    private static Inline.Cite merge(Inline.Cite cite, Inline.Span span) {
        Citation citation = cite.citations().get(0).withSuffix(span.content());

        List<Inline> bracketed = new ArrayList<>();
        for (Inline inline : span.content()) {
            if (inline instanceof Inline.Str str) {
                String[] words = str.text().split(" ", -1);
                for (int i = 0; i < words.length; i++) {
                    if (i > 0) {
                        bracketed.add(new Inline.Space(SourceRange.EMPTY));
                    }
                    if (!words[i].isEmpty()) {
                        bracketed.add(new Inline.Str(words[i], str.range()));
                    }
                }
            } else {
                bracketed.add(inline);
            }
        }
        if (!bracketed.isEmpty()) {
            if (bracketed.get(0) instanceof Inline.Str first) {
                bracketed.set(0, first.withText("[" + first.text()));
            }
            for (int i = bracketed.size() - 1; i >= 0; i--) {
                if (bracketed.get(i) instanceof Inline.Str last) {
                    bracketed.set(i, last.withText(last.text() + "]"));
                    break;
                }
            }
        }

        List<Inline> content = new ArrayList<>(cite.content());
        content.add(new Inline.Space(SourceRange.EMPTY));
        content.addAll(bracketed);

        logger.debug("Fused locator into citation @{} at {}", citation.id(), cite.range());
        return new Inline.Cite(List.of(citation), content, cite.range());
    }
}
