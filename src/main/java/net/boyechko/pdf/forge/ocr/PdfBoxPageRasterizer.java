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
import java.io.IOException;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Rasterizes pages with Apache PDFBox. */
public class PdfBoxPageRasterizer implements PageRasterizer {
    private static final Logger logger = LoggerFactory.getLogger(PdfBoxPageRasterizer.class);

    @Override
    public RenderedPages open(byte[] pdf) {
        PDDocument document;
        try {
            document = Loader.loadPDF(pdf);
        } catch (IOException e) {
            throw new PdfForgeException(
                    ErrorKind.MALFORMED_DOCUMENT, "Cannot open document for rendering", e);
        }
        PDFRenderer renderer = new PDFRenderer(document);
        return new RenderedPages() {
            @Override
            public BufferedImage render(int index, int dpi) {
                try {
                    return renderer.renderImageWithDPI(index, dpi, ImageType.RGB);
                } catch (IOException e) {
                    throw new PdfForgeException(
                            ErrorKind.MALFORMED_DOCUMENT,
                            "Cannot render page " + (index + 1) + ": " + e.getMessage(),
                            e);
                }
            }

            @Override
            public void close() {
                try {
                    document.close();
                } catch (IOException e) {
                    logger.debug("Error closing rendered document: {}", e.getMessage());
                }
            }
        };
    }
}
