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
package net.boyechko.pandoc.postprocess.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class PostprocessConfigTest {

    @Test
    void defaultResourceMatchesBuiltinTables() {
        PostprocessConfig loaded = PostprocessConfig.loadDefault();
        PostprocessConfig builtin = PostprocessConfig.builtin();

        assertEquals(29, loaded.getAbbreviations().size());
        assertEquals(builtin.getAbbreviations(), loaded.getAbbreviations());
        assertEquals(builtin.getSmartTypography(), loaded.getSmartTypography());
        assertEquals("…", loaded.getSmartTypography().get("..."));
    }

    @Test
    void missingResourceIsReported() {
        IllegalStateException e =
                assertThrows(
                        IllegalStateException.class,
                        () -> PostprocessConfig.fromResource("/no-such-config.yaml"));

        assertTrue(e.getMessage().contains("Resource not found"));
    }

    @Test
    void partialResourceKeepsEmptyDefaults() {
        PostprocessConfig config = PostprocessConfig.fromResource("/abbreviations-only.yaml");

        assertEquals(List.of("Fig."), config.getAbbreviations());
        assertTrue(config.getSmartTypography().isEmpty());
    }
}
