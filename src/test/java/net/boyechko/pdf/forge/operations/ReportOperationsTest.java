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
package net.boyechko.pdf.forge.operations;

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.io.image.ImageDataFactory;
import com.itextpdf.layout.element.Image;
import com.itextpdf.layout.element.Paragraph;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import javax.imageio.ImageIO;
import net.boyechko.pdf.forge.PdfTestBase;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.DocumentInfo;
import net.boyechko.pdf.forge.document.PageBox;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.OperationResult.Artifact;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

class ReportOperationsTest extends PdfTestBase {

    private static Map<String, Object> yaml(Artifact artifact) {
        assertEquals("yaml", artifact.extension());
        return new Yaml().load(new String(artifact.bytes(), StandardCharsets.UTF_8));
    }

    private static byte[] jpegBytes() throws Exception {
        BufferedImage image = new BufferedImage(32, 16, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.BLUE);
        g.fillRect(0, 0, 32, 16);
        g.dispose();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "jpg", out);
        return out.toByteArray();
    }

    // ── extract-text ───────────────────────────────────────────────

    @Test
    void extractTextSeparatesPagesWithFormFeed() throws Exception {
        Path pdf = createTextPdf("letters.pdf", "Alpha", "Beta");

        OperationResult result = run(new ExtractTextOperation(), Map.of(), load(pdf));

        assertTrue(result.documents().isEmpty());
        Artifact text = result.artifacts().get(0);
        assertNull(text.label());
        assertEquals("txt", text.extension());
        String[] pages = new String(text.bytes(), StandardCharsets.UTF_8).split("\f", -1);
        assertEquals(2, pages.length);
        assertTrue(pages[0].contains("Alpha"));
        assertTrue(pages[1].contains("Beta"));
        assertFalse(result.hasWarnings());
    }

    @Test
    void extractTextWarnsWhenThereIsNoTextLayer() {
        Document blank = Document.blank();
        blank.addPage(blank.createPage(PageBox.A4));

        OperationResult result =
                run(new ExtractTextOperation(), Map.of(), LoadedDocument.of("scan.pdf", blank));

        assertTrue(result.hasWarnings());
        assertTrue(result.warnings().get(0).contains("no text layer"));
    }

    // ── extract-images ─────────────────────────────────────────────

    @Test
    void extractImagesWritesJpegUnchanged() throws Exception {
        byte[] jpeg = jpegBytes();
        Path pdf =
                createTestPdf(
                        testOutputPath("photo.pdf"),
                        (pdfDoc, document) ->
                                document.add(new Image(ImageDataFactory.create(jpeg))));

        OperationResult result = run(new ExtractImagesOperation(), Map.of(), load(pdf));

        assertEquals(1, result.artifacts().size());
        Artifact image = result.artifacts().get(0);
        assertEquals("jpg", image.extension());
        assertTrue(image.label().startsWith("page_1_img_"), image.label());
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image.bytes()));
        assertEquals(32, decoded.getWidth());
        assertEquals(16, decoded.getHeight());
    }

    @Test
    void extractImagesWarnsWhenThereAreNone() throws Exception {
        Path pdf = createTextPdf("plain.pdf", "Text only");

        OperationResult result = run(new ExtractImagesOperation(), Map.of(), load(pdf));

        assertTrue(result.artifacts().isEmpty());
        assertTrue(result.warnings().get(0).contains("contains no images"));
    }

    // ── info ───────────────────────────────────────────────────────

    @Test
    void infoReportsPagesAndMetadata() throws Exception {
        Path pdf =
                createTestPdf(
                        testOutputPath("report.pdf"),
                        (pdfDoc, document) -> {
                            pdfDoc.getDocumentInfo().setTitle("Quarterly Report");
                            document.add(new Paragraph("One"));
                        });

        Map<String, Object> report =
                yaml(run(new InfoOperation(), Map.of(), load(pdf)).artifacts().get(0));

        assertEquals("report.pdf", report.get("file"));
        assertEquals(1, report.get("pages"));
        assertEquals(Map.of("595x842", 1), report.get("page-sizes"));
        assertEquals("none", report.get("encryption"));
        assertEquals(0, report.get("signatures"));
        @SuppressWarnings("unchecked")
        Map<String, Object> metadata = (Map<String, Object>) report.get("metadata");
        assertEquals("Quarterly Report", metadata.get("Title"));
    }

    @Test
    void infoReportsEncryptionOfSealedDocument() throws Exception {
        Path plain = createTextPdf("plain.pdf", "Secret");
        Document encrypted =
                run(new EncryptOperation(), Map.of("user-password", "pw"), load(plain))
                        .documents()
                        .get(0)
                        .document();
        Path sealed = testOutputPath("sealed.pdf");
        Files.write(sealed, PdfEncoder.encode(encrypted));

        Map<String, Object> report =
                yaml(run(new InfoOperation(), Map.of(), load(sealed)).artifacts().get(0));

        @SuppressWarnings("unchecked")
        Map<String, Object> encryption = (Map<String, Object>) report.get("encryption");
        assertEquals("aes-128", encryption.get("algorithm"));
        assertEquals(true, encryption.get("sealed"));
        assertEquals("unavailable without password", report.get("metadata"));
    }

    // ── metadata ───────────────────────────────────────────────────

    @Test
    void metadataSetsAndRemovesFields() throws Exception {
        Path pdf =
                createTestPdf(
                        testOutputPath("meta.pdf"),
                        (pdfDoc, document) -> {
                            pdfDoc.getDocumentInfo().setAuthor("Old Author");
                            pdfDoc.getDocumentInfo().setSubject("Old Subject");
                            document.add(new Paragraph("Body"));
                        });

        Document edited =
                run(
                                new MetadataOperation(),
                                Map.of("title", "New Title", "subject", ""),
                                load(pdf))
                        .documents()
                        .get(0)
                        .document();

        DocumentInfo info = edited.info();
        assertEquals("New Title", info.title().orElseThrow());
        assertEquals("Old Author", info.author().orElseThrow());
        assertTrue(info.get(DocumentInfo.SUBJECT).isEmpty());
        assertTrue(info.modificationDate().isPresent());
    }

    @Test
    void metadataClearDropsEverythingNotGiven() throws Exception {
        Path pdf =
                createTestPdf(
                        testOutputPath("meta.pdf"),
                        (pdfDoc, document) -> {
                            pdfDoc.getDocumentInfo().setAuthor("Someone");
                            document.add(new Paragraph("Body"));
                        });

        Document edited =
                run(
                                new MetadataOperation(),
                                Map.of("clear", "true", "keywords", "a, b"),
                                load(pdf))
                        .documents()
                        .get(0)
                        .document();

        assertTrue(edited.info().author().isEmpty());
        assertEquals("a, b", edited.info().get(DocumentInfo.KEYWORDS).orElseThrow());
    }

    // ── validate ───────────────────────────────────────────────────

    @Test
    void validateAcceptsWellFormedDocument() throws Exception {
        Path pdf = createTextPdf("good.pdf", "One", "Two");

        OperationResult result = run(new ValidateOperation(), Map.of(), load(pdf));

        Map<String, Object> report = yaml(result.artifacts().get(0));
        assertEquals(true, report.get("valid"));
        assertEquals(List.of(), report.get("errors"));
        assertFalse(result.hasWarnings());
    }

    @Test
    void validateReportsPageWithoutMediaBox() {
        Document document = Document.blank();
        document.addPage(document.createPage(PageBox.A4));
        document.addPage(document.createPage(PageBox.A4));
        document.page(1).dictionary().remove("MediaBox");

        OperationResult result =
                run(new ValidateOperation(), Map.of(), LoadedDocument.of("broken.pdf", document));

        Map<String, Object> report = yaml(result.artifacts().get(0));
        assertEquals(false, report.get("valid"));
        assertEquals(List.of("page 2: missing or malformed MediaBox"), report.get("errors"));
        assertTrue(result.warnings().get(0).contains("1 errors"));
    }

    @Test
    void validateFlagsDocumentWithoutPages() {
        Map<String, Object> report =
                yaml(
                        run(
                                        new ValidateOperation(),
                                        Map.of(),
                                        LoadedDocument.of("empty.pdf", Document.blank()))
                                .artifacts()
                                .get(0));

        assertEquals(false, report.get("valid"));
        assertTrue(((List<?>) report.get("errors")).contains("document has no pages"));
    }

    // ── compare ────────────────────────────────────────────────────

    @Test
    void compareIdenticalDocuments() throws Exception {
        Path first = createTextPdf("a.pdf", "Same", "Text");
        Path second = createTextPdf("b.pdf", "Same", "Text");

        Map<String, Object> report =
                yaml(
                        run(new CompareOperation(), Map.of(), load(first), load(second))
                                .artifacts()
                                .get(0));

        assertEquals(true, report.get("identical"));
        assertEquals(0, report.get("text-changes"));
        assertFalse(report.containsKey("diff"));
    }

    @Test
    void compareReportsTextAndPageDifferences() throws Exception {
        Path first = createTextPdf("a.pdf", "Hello", "World");
        Path second = createTextPdf("b.pdf", "Hello", "Planet", "Extra");

        Map<String, Object> report =
                yaml(
                        run(new CompareOperation(), Map.of(), load(first), load(second))
                                .artifacts()
                                .get(0));

        assertEquals(false, report.get("identical"));
        assertEquals(Map.of("first", 2, "second", 3), report.get("pages"));
        String diff = (String) report.get("diff");
        assertTrue(diff.contains("-World"), diff);
        assertTrue(diff.contains("+Planet"), diff);
        assertTrue(diff.contains("+[page 3]"), diff);
    }
}
