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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Argument of a shortcode as written in the source. */
public sealed interface ShortcodeArg {
    record Text(String value) implements ShortcodeArg {}

    record Number(double value) implements ShortcodeArg {
        /** Renders integral values without a fractional part. */
        public String render() {
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
    }

    record Bool(boolean value) implements ShortcodeArg {}

    record Nested(Inline.Shortcode shortcode) implements ShortcodeArg {}

    record KeyValues(Map<String, ShortcodeArg> entries) implements ShortcodeArg {
        public KeyValues {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }
}
