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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Tables that drive string merging, loaded from YAML. */
public final class PostprocessConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/postprocess-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(PostprocessConfig.class);

    /** Abbreviations kept together with the following word, e.g. {@code Dr.}. */
    public List<String> abbreviations;

    /** Replacements for a Str whose whole text matches a key, e.g. {@code ...}. */
    public Map<String, String> smart_typography;

    public PostprocessConfig() {
        this.abbreviations = new ArrayList<>();
        this.smart_typography = new LinkedHashMap<>();
    }

    public List<String> getAbbreviations() {
        return abbreviations;
    }

    public Map<String, String> getSmartTypography() {
        return smart_typography;
    }

    /**
     * Load configuration from a classpath resource
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static PostprocessConfig fromResource(String resourcePath) {
        try (var inputStream = PostprocessConfig.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(PostprocessConfig.class, new LoaderOptions()));
            PostprocessConfig config = yaml.load(inputStream);
            if (config == null) {
                throw new IllegalArgumentException("Resource is empty: " + resourcePath);
            }
            config.fillMissing();

            logger.debug(
                    "Loaded {} abbreviations and {} typography rules from resource {}",
                    config.abbreviations.size(),
                    config.smart_typography.size(),
                    resourcePath);
            return config;
        } catch (Exception e) {
            logger.error(
                    "Failed to load postprocess config from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new IllegalStateException(
                    "Failed to load config from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load default configuration from standard location */
    public static PostprocessConfig loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    /** The built-in tables, for use without the classpath resource. */
    public static PostprocessConfig builtin() {
        PostprocessConfig c = new PostprocessConfig();
        c.abbreviations =
                new ArrayList<>(
                        List.of(
                                "Mr.", "Mrs.", "Ms.", "Capt.", "Dr.", "Prof.", "Gen.", "Gov.",
                                "e.g.", "i.e.", "Sgt.", "St.", "vol.", "vs.", "Sen.", "Rep.",
                                "Pres.", "Hon.", "Rev.", "Ph.D.", "M.D.", "M.A.", "p.", "pp.",
                                "ch.", "chap.", "sec.", "cf.", "cp."));
        c.smart_typography.put("...", "…");
        c.smart_typography.put("--", "–");
        c.smart_typography.put("---", "—");
        return c;
    }

    private void fillMissing() {
        if (abbreviations == null) {
            abbreviations = new ArrayList<>();
        }
        if (smart_typography == null) {
            smart_typography = new LinkedHashMap<>();
        }
    }
}
