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
package net.boyechko.pdf.forge.codec;

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.WriterProperties;
import com.itextpdf.layout.element.AreaBreak;
import com.itextpdf.layout.element.Paragraph;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import net.boyechko.pdf.forge.PdfTestBase;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.PageBox;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;

class PdfCodecTest extends PdfTestBase {

    private static Document twoPageDocument() {
        Document document = Document.blank();
        document.addPage(document.createPage(PageBox.A4));
        document.addPage(document.createPage(PageBox.LETTER));
        return document;
    }

    private static int indexOfLast(byte[] data, String marker) {
        String text = new String(data, StandardCharsets.ISO_8859_1);
        return text.lastIndexOf(marker);
    }

    // ── Encoding ────────────────────────────────────────────────────

    @Test
    void encodedDocumentOpensInITextAndPdfBox() throws Exception {
        byte[] pdf = PdfEncoder.encode(twoPageDocument());

        try (PdfDocument itext = new PdfDocument(new PdfReader(new ByteArrayInputStream(pdf)))) {
            assertEquals(2, itext.getNumberOfPages());
            assertEquals(612f, itext.getPage(2).getMediaBox().getWidth(), 0.01f);
        }
        try (PDDocument pdfbox = Loader.loadPDF(pdf)) {
            assertEquals(2, pdfbox.getNumberOfPages());
        }
    }

    @Test
    void encodingIsDeterministic() {
        Document document = twoPageDocument();
        assertArrayEquals(PdfEncoder.encode(document), PdfEncoder.encode(document));
    }

    @Test
    void reencodingPreservesPagesAndText() throws Exception {
        Path source = createTextPdf("source.pdf", "Alpha page", "Beta page", "Gamma page");
        Document document = decode(source);

        assertEquals(3, document.pageCount());
        assertFalse(document.isRecovered());
        assertEquals(List.of("Alpha page", "Beta page", "Gamma page"), pageTexts(document));
    }

    // ── Decoding ────────────────────────────────────────────────────

    @Test
    void readsCrossReferenceStreamsAndObjectStreams() throws Exception {
        Path source = testOutputPath("compressed.pdf");
        WriterProperties props = new WriterProperties().setFullCompressionMode(true);
        try (PdfDocument pdfDoc = new PdfDocument(new PdfWriter(source.toString(), props))) {
            com.itextpdf.layout.Document layout = new com.itextpdf.layout.Document(pdfDoc);
            layout.add(new Paragraph("First"));
            layout.add(new AreaBreak());
            layout.add(new Paragraph("Second"));
            layout.close();
        }

        Document document = decode(source);

        assertEquals(2, document.pageCount());
        assertEquals(List.of("First", "Second"), pageTexts(document));
    }

    @Test
    void scansFileWhenStartxrefIsWrong() throws Exception {
        byte[] bytes = read(createTextPdf("broken.pdf", "One", "Two"));
        int at = indexOfLast(bytes, "startxref");
        int digits = at + "startxref".length() + 1;
        // point startxref at the header
        while (Character.isDigit(bytes[digits])) {
            bytes[digits++] = '0';
        }

        Document document = PdfDecoder.decode(bytes);

        assertTrue(document.isRecovered());
        assertEquals(List.of("One", "Two"), pageTexts(document));
    }

    @Test
    void scansFileWithoutCrossReferenceOrTrailer() throws Exception {
        byte[] bytes = read(createTextPdf("truncated.pdf", "Kept"));
        byte[] truncated = Arrays.copyOf(bytes, indexOfLast(bytes, "\nxref"));

        Document document = PdfDecoder.decode(truncated);

        assertTrue(document.isRecovered());
        assertEquals(1, document.pageCount());
        assertEquals(List.of("Kept"), pageTexts(document));
    }

    @Test
    void rejectsEmptyInput() {
        PdfForgeException e =
                assertThrows(PdfForgeException.class, () -> PdfDecoder.decode(new byte[0]));
        assertEquals(ErrorKind.MALFORMED_DOCUMENT, e.kind());
    }

    @Test
    void rejectsDataWithoutHeader() {
        byte[] data = "just some text, not a document".getBytes(StandardCharsets.US_ASCII);
        PdfForgeException e = assertThrows(PdfForgeException.class, () -> PdfDecoder.decode(data));
        assertEquals(ErrorKind.MALFORMED_DOCUMENT, e.kind());
    }

    @Test
    void keepsVersionFromHeader() throws Exception {
        Document document = decode(createTextPdf("versioned.pdf", "x"));
        assertTrue(document.version().startsWith("1.") || document.version().startsWith("2."));
    }
}
