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

/** Renders pages of an encoded document to images. */
public interface PageRasterizer {

    /** Opens {@code pdf} for rendering. The caller closes the result. */
    RenderedPages open(byte[] pdf);

    /** An open document whose pages can be rendered one at a time. */
    interface RenderedPages extends AutoCloseable {
        /** Renders the 0-based page {@code index}, cropped and rotated as a viewer displays it. */
        BufferedImage render(int index, int dpi);

        @Override
        void close();
    }
}
