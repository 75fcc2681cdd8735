/*
 * PDF-Forge - Batch PDF Document Operations
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
package net.boyechko.pdf.forge.ui;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.pdf.forge.core.EngineSettings;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.core.Quality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link EngineSettings} from YAML. The bundled {@code /pdf-forge-defaults.yaml} is applied
 * first; a user file then overrides only the keys it sets.
 *
 * <pre>
 * output_directory: out
 * default_quality: medium
 * ocr_language: tur+eng
 * ocr_dpi: 300
 * max_workers: 4
 * overwrite: false
 * </pre>
 */
public final class SettingsLoader {
    private static final Logger logger = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String DEFAULTS_RESOURCE = "/pdf-forge-defaults.yaml";

    /** The YAML shape. Absent keys stay null. */
    public static final class SettingsFile {
        public String output_directory;
        public String default_quality;
        public String ocr_language;
        public Integer ocr_dpi;
        public Integer ocr_min_text_runs;
        public Integer max_workers;
        public Integer max_ocr_workers;
        public Boolean overwrite;
    }

    private SettingsLoader() {}

    /** Built-in defaults, with the bundled resource applied if present. */
    public static EngineSettings loadDefault() {
        EngineSettings settings = EngineSettings.defaults();
        try (InputStream in = SettingsLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath; using built-in defaults", DEFAULTS_RESOURCE);
                return settings;
            }
            Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
            return apply(settings, parse(reader, DEFAULTS_RESOURCE));
        } catch (IOException e) {
            throw PdfForgeException.io("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    /** Defaults overridden by the keys of {@code file}. */
    public static EngineSettings load(Path file) {
        EngineSettings base = loadDefault();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            SettingsFile parsed = parse(reader, file.toString());
            logger.debug("Loaded settings from {}", file);
            return apply(base, parsed);
        } catch (IOException e) {
            throw PdfForgeException.io("Cannot read settings file " + file, e);
        }
    }

    private static SettingsFile parse(Reader source, String origin) {
        Yaml yaml = new Yaml(new Constructor(SettingsFile.class, new LoaderOptions()));
        try {
            SettingsFile parsed = yaml.load(source);
            return parsed != null ? parsed : new SettingsFile();
        } catch (YAMLException e) {
            throw PdfForgeException.invalidParameter(
                    "Malformed settings in " + origin + ": " + e.getMessage());
        }
    }

    static EngineSettings apply(EngineSettings base, SettingsFile file) {
        EngineSettings.Builder b = base.toBuilder();
        if (file.output_directory != null) {
            b.withOutputDirectory(Path.of(file.output_directory));
        }
        if (file.default_quality != null) {
            b.withDefaultQuality(Quality.fromId(file.default_quality));
        }
        if (file.ocr_language != null) {
            b.withOcrLanguage(file.ocr_language);
        }
        if (file.ocr_dpi != null) {
            b.withOcrDpi(file.ocr_dpi);
        }
        if (file.ocr_min_text_runs != null) {
            b.withOcrMinTextRuns(file.ocr_min_text_runs);
        }
        if (file.max_workers != null) {
            b.withMaxWorkers(file.max_workers);
        }
        if (file.max_ocr_workers != null) {
            b.withMaxOcrWorkers(file.max_ocr_workers);
        }
        if (file.overwrite != null) {
            b.withOverwrite(file.overwrite);
        }
        try {
            return b.build();
        } catch (IllegalArgumentException e) {
            throw PdfForgeException.invalidParameter("Invalid settings: " + e.getMessage());
        }
    }
}
