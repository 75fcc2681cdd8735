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

import java.awt.image.BufferedImage;
import java.util.List;

/** Recognizes words in a page image. */
public interface TextRecognizer {

    /**
     * @param language recognizer language code, e.g. {@code tur} or {@code eng+deu}
     * @param dpi resolution the image was rendered at
     * @throws net.boyechko.pdf.forge.core.PdfForgeException OCR_UNAVAILABLE if the engine or its
     *     language data is missing
     */
    List<RecognizedSpan> recognize(BufferedImage image, String language, int dpi);
}
