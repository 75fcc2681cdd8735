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
package net.boyechko.pdf.forge.core;

import java.nio.file.Path;

/**
 * Immutable engine configuration, passed by value into every job.
 *
 * @param outputDirectory Where derived output names are placed when a job gives no explicit path.
 * @param defaultQuality Compression quality used when a job does not specify one.
 * @param ocrLanguage Recognizer language code (Tesseract style, e.g. {@code tur}, {@code eng}).
 * @param ocrDpi Rasterization resolution for OCR.
 * @param ocrMinTextRuns Pages with at least this many text runs are considered text-bearing.
 * @param maxWorkers Upper bound on the structural worker pool.
 * @param maxOcrWorkers Size of the dedicated OCR pool.
 * @param overwrite Replace existing outputs instead of suffixing the name.
 */
public record EngineSettings(
        Path outputDirectory,
        Quality defaultQuality,
        String ocrLanguage,
        int ocrDpi,
        int ocrMinTextRuns,
        int maxWorkers,
        int maxOcrWorkers,
        boolean overwrite) {

    public static final String DEFAULT_OCR_LANGUAGE = "tur";
    public static final int DEFAULT_OCR_DPI = 300;
    public static final int DEFAULT_MAX_WORKERS = 4;

    public EngineSettings {
        if (outputDirectory == null) {
            throw new IllegalArgumentException("Output directory is required");
        }
        if (defaultQuality == null) {
            throw new IllegalArgumentException("Default quality is required");
        }
        if (ocrLanguage == null || ocrLanguage.isBlank()) {
            throw new IllegalArgumentException("OCR language is required");
        }
        if (ocrDpi < 72 || ocrDpi > 1200) {
            throw new IllegalArgumentException("OCR DPI must be between 72 and 1200: " + ocrDpi);
        }
        if (ocrMinTextRuns < 1) {
            throw new IllegalArgumentException("OCR text threshold must be positive");
        }
        if (maxWorkers < 1 || maxOcrWorkers < 1) {
            throw new IllegalArgumentException("Worker counts must be positive");
        }
    }

    public static EngineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with these settings. */
    public Builder toBuilder() {
        return new Builder()
                .withOutputDirectory(outputDirectory)
                .withDefaultQuality(defaultQuality)
                .withOcrLanguage(ocrLanguage)
                .withOcrDpi(ocrDpi)
                .withOcrMinTextRuns(ocrMinTextRuns)
                .withMaxWorkers(maxWorkers)
                .withMaxOcrWorkers(maxOcrWorkers)
                .withOverwrite(overwrite);
    }

    /** Structural worker count: the configured cap, bounded by the available processors. */
    public int effectiveWorkers() {
        return Math.max(1, Math.min(maxWorkers, Runtime.getRuntime().availableProcessors()));
    }

    public static class Builder {
        private Path outputDirectory = Path.of("output");
        private Quality defaultQuality = Quality.MEDIUM;
        private String ocrLanguage = DEFAULT_OCR_LANGUAGE;
        private int ocrDpi = DEFAULT_OCR_DPI;
        private int ocrMinTextRuns = 1;
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private int maxOcrWorkers = 1;
        private boolean overwrite;

        public Builder withOutputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder withDefaultQuality(Quality defaultQuality) {
            this.defaultQuality = defaultQuality;
            return this;
        }

        public Builder withOcrLanguage(String ocrLanguage) {
            this.ocrLanguage = ocrLanguage;
            return this;
        }

        public Builder withOcrDpi(int ocrDpi) {
            this.ocrDpi = ocrDpi;
            return this;
        }

        public Builder withOcrMinTextRuns(int ocrMinTextRuns) {
            this.ocrMinTextRuns = ocrMinTextRuns;
            return this;
        }

        public Builder withMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder withMaxOcrWorkers(int maxOcrWorkers) {
            this.maxOcrWorkers = maxOcrWorkers;
            return this;
        }

        public Builder withOverwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(
                    outputDirectory,
                    defaultQuality,
                    ocrLanguage,
                    ocrDpi,
                    ocrMinTextRuns,
                    maxWorkers,
                    maxOcrWorkers,
                    overwrite);
        }
    }
}
