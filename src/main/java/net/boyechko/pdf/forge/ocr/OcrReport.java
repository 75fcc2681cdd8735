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

import java.util.ArrayList;
import java.util.List;

/**
 * Per-document OCR statistics and the text of each page.
 *
 * @param pagesExamined pages looked at
 * @param pagesRecognized pages that were rasterized and recognized
 * @param pagesSkipped pages left alone because they had text or an OCR layer already
 * @param spanCount spans written across all pages
 * @param meanConfidence mean span confidence, or 0 if there were none
 * @param doubtfulPages 1-based pages whose mean confidence was below {@link
 *     OcrOptions#LOW_CONFIDENCE}
 * @param pages the text of every page, in page order
 */
public record OcrReport(
        int pagesExamined,
        int pagesRecognized,
        int pagesSkipped,
        int spanCount,
        double meanConfidence,
        List<Integer> doubtfulPages,
        List<PageResult> pages) {

    public OcrReport {
        doubtfulPages = List.copyOf(doubtfulPages);
        pages = List.copyOf(pages);
    }

    /** Where a page's text came from. */
    public enum TextSource {
        RECOGNIZED,
        TEXT_LAYER,
        OCR_LAYER
    }

    /**
     * Text of one page.
     *
     * @param page 1-based page number
     * @param confidence mean span confidence for recognized pages, otherwise 0
     */
    public record PageResult(int page, TextSource source, String text, double confidence) {}

    /** Warnings worth showing to the user. */
    public List<String> warnings() {
        List<String> warnings = new ArrayList<>();
        for (int page : doubtfulPages) {
            warnings.add("Low OCR confidence on page " + page);
        }
        if (pagesRecognized > 0 && spanCount == 0) {
            warnings.add("OCR found no text on " + pagesRecognized + " pages");
        }
        return warnings;
    }

    @Override
    public String toString() {
        return String.format(
                "%d pages examined, %d recognized, %d skipped, %d spans, mean confidence %.1f",
                pagesExamined, pagesRecognized, pagesSkipped, spanCount, meanConfidence);
    }
}
