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

import com.itextpdf.kernel.exceptions.PdfException;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.canvas.parser.EventType;
import com.itextpdf.kernel.pdf.canvas.parser.PdfCanvasProcessor;
import com.itextpdf.kernel.pdf.canvas.parser.PdfTextExtractor;
import com.itextpdf.kernel.pdf.canvas.parser.data.IEventData;
import com.itextpdf.kernel.pdf.canvas.parser.data.TextRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.listener.IEventListener;
import com.itextpdf.kernel.pdf.canvas.parser.listener.LocationTextExtractionStrategy;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Set;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Text-layer access through iText's content stream parser: page text in reading order and a count
 * of the non-blank text runs on a page.
 */
public final class PageText implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PageText.class);

    private final PdfDocument pdf;

    private PageText(PdfDocument pdf) {
        this.pdf = pdf;
    }

    /** Opens the current state of {@code document}. */
    public static PageText open(Document document) {
        return open(PdfEncoder.encodeUnprotected(document));
    }

    public static PageText open(byte[] bytes) {
        try {
            return new PageText(new PdfDocument(new PdfReader(new ByteArrayInputStream(bytes))));
        } catch (IOException | PdfException e) {
            throw new PdfForgeException(
                    ErrorKind.MALFORMED_DOCUMENT,
                    "Cannot parse page content: " + e.getMessage(),
                    e);
        }
    }

    public int pageCount() {
        return pdf.getNumberOfPages();
    }

    /** Text of the 0-based page {@code index}; empty if its content cannot be parsed. */
    public String text(int index) {
        try {
            String text =
                    PdfTextExtractor.getTextFromPage(
                            pdf.getPage(index + 1), new LocationTextExtractionStrategy());
            return text != null ? text : "";
        } catch (PdfException e) {
            logger.debug("Failed to extract text from page {}: {}", index + 1, e.getMessage());
            return "";
        }
    }

    /** Number of text-showing operations that draw at least one non-blank character. */
    public int textRuns(int index) {
        RunCounter counter = new RunCounter();
        try {
            new PdfCanvasProcessor(counter).processPageContent(pdf.getPage(index + 1));
        } catch (PdfException e) {
            logger.debug("Failed to parse content of page {}: {}", index + 1, e.getMessage());
        }
        return counter.runs;
    }

    @Override
    public void close() {
        pdf.close();
    }

    private static final class RunCounter implements IEventListener {
        private int runs;

        @Override
        public void eventOccurred(IEventData data, EventType type) {
            if (data instanceof TextRenderInfo info) {
                String text = info.getText();
                if (text != null && !text.isBlank()) {
                    runs++;
                }
            }
        }

        @Override
        public Set<EventType> getSupportedEvents() {
            return Set.of(EventType.RENDER_TEXT);
        }
    }
}
