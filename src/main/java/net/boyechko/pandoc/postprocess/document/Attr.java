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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Identifier, classes, and ordered key-value attributes attached to a node. */
public record Attr(String id, List<String> classes, Map<String, String> attributes) {
    public static final Attr EMPTY = new Attr("", List.of(), Map.of());

    public Attr {
        id = id != null ? id : "";
        classes = classes != null ? List.copyOf(classes) : List.of();
        attributes =
                attributes != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                        : Map.of();
    }

    public static Attr withId(String id) {
        return new Attr(id, List.of(), Map.of());
    }

    public static Attr withClasses(String... classes) {
        return new Attr("", Arrays.asList(classes), Map.of());
    }

    public boolean isEmpty() {
        return id.isEmpty() && classes.isEmpty() && attributes.isEmpty();
    }

    public boolean hasClass(String name) {
        return classes.contains(name);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public Attr id(String newId) {
        return new Attr(newId, classes, attributes);
    }

    public Attr classes(List<String> newClasses) {
        return new Attr(id, newClasses, attributes);
    }

    public Attr attributes(Map<String, String> newAttributes) {
        return new Attr(id, classes, newAttributes);
    }

    /** Returns a copy with {@code name} prepended to the class list. */
    public Attr prependClass(String name) {
        List<String> merged = new ArrayList<>(classes.size() + 1);
        merged.add(name);
        merged.addAll(classes);
        return new Attr(id, merged, attributes);
    }

    public Attr withoutClass(String name) {
        return new Attr(id, classes.stream().filter(c -> !c.equals(name)).toList(), attributes);
    }

    public Attr withoutAttributes(String... keys) {
        Map<String, String> kept = new LinkedHashMap<>(attributes);
        for (String key : keys) {
            kept.remove(key);
        }
        return new Attr(id, classes, kept);
    }
}
