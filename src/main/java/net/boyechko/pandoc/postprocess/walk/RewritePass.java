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
package net.boyechko.pandoc.postprocess.walk;

import java.util.Set;

/** A named rewrite that contributes callbacks to a shared {@link Filter}. */
public interface RewritePass {

    String name();

    String description();

    /** Registers this pass's callbacks. Called once per run on a fresh instance. */
    void register(Filter.Builder builder);

    /**
     * Passes whose callbacks must be registered before this one. Callbacks for the same node
     * kind run in registration order.
     */
    default Set<Class<? extends RewritePass>> prerequisites() {
        return Set.of();
    }
}
