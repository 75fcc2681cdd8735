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
package net.boyechko.pdf.forge.ocr;

import net.boyechko.pdf.forge.core.EngineSettings;

/**
 * How pages are recognized.
 *
 * @param language recognizer language code
 * @param dpi rasterization resolution
 * @param minTextRuns pages with at least this many non-blank text runs are left alone
 * @param minConfidence spans below this confidence (0 to 100) are dropped
 */
public record OcrOptions(String language, int dpi, int minTextRuns, double minConfidence) {
    /** Mean confidence under which a page is reported as doubtful. */
    public static final double LOW_CONFIDENCE = 70;

    public OcrOptions {
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("OCR language is required");
        }
        if (dpi < 72 || dpi > 1200) {
            throw new IllegalArgumentException("OCR DPI must be between 72 and 1200: " + dpi);
        }
        if (minTextRuns < 1) {
            throw new IllegalArgumentException("Text run threshold must be positive");
        }
    }

    public static OcrOptions from(EngineSettings settings) {
        return new OcrOptions(
                settings.ocrLanguage(), settings.ocrDpi(), settings.ocrMinTextRuns(), 0);
    }
}
