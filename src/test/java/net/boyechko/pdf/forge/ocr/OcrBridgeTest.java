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

import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.PdfTestBase;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.PageBox;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.OperationResult.Artifact;
import net.boyechko.pdf.forge.operations.OcrOperation;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

class OcrBridgeTest extends PdfTestBase {
    private static final OcrOptions OPTIONS = new OcrOptions("tur", 72, 1, 0);

    /** Renders every page as a blank image the size of the page at the requested DPI. */
    private static final class BlankRasterizer implements PageRasterizer {
        int opened;

        @Override
        public RenderedPages open(byte[] pdf) {
            opened++;
            return new RenderedPages() {
                @Override
                public BufferedImage render(int index, int dpi) {
                    double scale = dpi / 72.0;
                    return new BufferedImage(
                            (int) Math.round(595 * scale),
                            (int) Math.round(842 * scale),
                            BufferedImage.TYPE_BYTE_GRAY);
                }

                @Override
                public void close() {}
            };
        }
    }

    /** Returns the same spans for every page and records the languages asked for. */
    private static final class ScriptedRecognizer implements TextRecognizer {
        final List<RecognizedSpan> spans;
        final List<String> calls = new ArrayList<>();

        ScriptedRecognizer(RecognizedSpan... spans) {
            this.spans = List.of(spans);
        }

        @Override
        public List<RecognizedSpan> recognize(BufferedImage image, String language, int dpi) {
            calls.add(language);
            return spans;
        }
    }

    private static Document blankPages(int count) {
        Document document = Document.blank();
        for (int i = 0; i < count; i++) {
            document.addPage(document.createPage(PageBox.A4));
        }
        return document;
    }

    @Test
    void recognizedTextBecomesExtractable() {
        ScriptedRecognizer recognizer =
                new ScriptedRecognizer(
                        new RecognizedSpan("Merhaba", 72, 72, 120, 20, 95),
                        new RecognizedSpan("şehir", 72, 120, 80, 20, 91));
        Document document = blankPages(2);

        OcrReport report =
                new OcrBridge(recognizer, new BlankRasterizer()).apply(document, OPTIONS);

        assertEquals(2, report.pagesRecognized());
        assertEquals(4, report.spanCount());
        assertTrue(report.warnings().isEmpty());
        assertEquals(List.of("tur", "tur"), recognizer.calls);
        for (String text : pageTexts(document)) {
            assertTrue(text.contains("Merhaba"), text);
            assertTrue(text.contains("şehir"), text);
        }
        assertTrue(OcrBridge.hasOcrLayer(document.page(0)));
    }

    @Test
    void pagesWithTextAreLeftAlone() throws Exception {
        Path pdf = createTextPdf("typed.pdf", "Already typed");
        ScriptedRecognizer recognizer = new ScriptedRecognizer();
        BlankRasterizer rasterizer = new BlankRasterizer();
        Document document = decode(pdf);

        OcrReport report = new OcrBridge(recognizer, rasterizer).apply(document, OPTIONS);

        assertEquals(1, report.pagesSkipped());
        assertEquals(0, report.pagesRecognized());
        assertTrue(recognizer.calls.isEmpty());
        assertEquals(0, rasterizer.opened);
    }

    @Test
    void secondPassChangesNothing() {
        ScriptedRecognizer recognizer =
                new ScriptedRecognizer(new RecognizedSpan("Word", 10, 10, 50, 12, 90));
        Document document = blankPages(1);
        OcrBridge bridge = new OcrBridge(recognizer, new BlankRasterizer());
        bridge.apply(document, OPTIONS);
        int streams = document.page(0).contentStreams().size();

        // min-text-runs above what the first pass wrote, so only the marker stops it
        OcrReport again = bridge.apply(document, new OcrOptions("tur", 72, 50, 0));

        assertEquals(1, again.pagesSkipped());
        assertEquals(1, recognizer.calls.size());
        assertEquals(streams, document.page(0).contentStreams().size());
    }

    @Test
    void pageWithoutRecognizedTextIsStillMarked() {
        Document document = blankPages(1);

        OcrReport report =
                new OcrBridge(new ScriptedRecognizer(), new BlankRasterizer())
                        .apply(document, OPTIONS);

        assertEquals(List.of("OCR found no text on 1 pages"), report.warnings());
        assertTrue(OcrBridge.hasOcrLayer(document.page(0)));
    }

    @Test
    void lowConfidenceSpansAreDroppedOrReported() {
        ScriptedRecognizer recognizer =
                new ScriptedRecognizer(
                        new RecognizedSpan("clear", 10, 10, 50, 12, 65),
                        new RecognizedSpan("noise", 10, 40, 50, 12, 20),
                        new RecognizedSpan("   ", 10, 70, 50, 12, 99));

        OcrReport filtered =
                new OcrBridge(recognizer, new BlankRasterizer())
                        .apply(blankPages(1), new OcrOptions("tur", 72, 1, 50));
        assertEquals(1, filtered.spanCount());
        assertEquals(List.of(1), filtered.doubtfulPages());
        assertEquals(List.of("Low OCR confidence on page 1"), filtered.warnings());
    }

    @Test
    void missingEngineIsReported() {
        PdfForgeException e =
                assertThrows(
                        PdfForgeException.class,
                        () -> new OcrBridge(null, null).apply(blankPages(1), OPTIONS));
        assertEquals(ErrorKind.OCR_UNAVAILABLE, e.kind());
    }

    @Test
    void displayCoordinatesMapBackToUserSpace() {
        PageBox box = new PageBox(0, 0, 600, 800);

        assertArrayEquals(new double[] {10, 780}, OcrBridge.toUserSpace(box, 0, 10, 20), 1e-9);
        assertArrayEquals(new double[] {20, 10}, OcrBridge.toUserSpace(box, 90, 10, 20), 1e-9);
        assertArrayEquals(new double[] {590, 20}, OcrBridge.toUserSpace(box, 180, 10, 20), 1e-9);
        assertArrayEquals(new double[] {580, 790}, OcrBridge.toUserSpace(box, 270, 10, 20), 1e-9);
    }

    @Test
    void ocrOperationPassesParametersThrough() {
        ScriptedRecognizer recognizer =
                new ScriptedRecognizer(new RecognizedSpan("Hello", 10, 10, 50, 12, 90));
        OcrOperation operation = new OcrOperation(new OcrBridge(recognizer, new BlankRasterizer()));

        OperationResult result =
                run(
                        operation,
                        Map.of("language", "eng+deu", "dpi", "150"),
                        LoadedDocument.of("scan.pdf", blankPages(1)));

        assertEquals(List.of("eng+deu"), recognizer.calls);
        assertTrue(pageTexts(result.documents().get(0).document()).get(0).contains("Hello"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> textArtifact(OperationResult result) {
        assertEquals(1, result.artifacts().size());
        Artifact artifact = result.artifacts().get(0);
        assertEquals("text", artifact.label());
        assertEquals("yaml", artifact.extension());
        return new Yaml().load(new String(artifact.bytes(), StandardCharsets.UTF_8));
    }

    @Test
    @SuppressWarnings("unchecked")
    void ocrOperationReportsTextOfEveryPage() throws Exception {
        Document document = decode(createTextPdf("mixed.pdf", "Already typed"));
        document.addPage(document.createPage(PageBox.A4));
        ScriptedRecognizer recognizer =
                new ScriptedRecognizer(
                        new RecognizedSpan("Merhaba", 72, 72, 120, 20, 95),
                        new RecognizedSpan("şehir", 72, 120, 80, 20, 91));
        OcrOperation operation = new OcrOperation(new OcrBridge(recognizer, new BlankRasterizer()));

        Map<String, Object> text =
                textArtifact(run(operation, Map.of(), LoadedDocument.of("mixed.pdf", document)));

        Map<String, Object> summary = (Map<String, Object>) text.get("summary");
        assertEquals(1, summary.get("pages-recognized"));
        assertEquals(1, summary.get("pages-skipped"));
        assertEquals(93.0, summary.get("mean-confidence"));
        List<Map<String, Object>> pages = (List<Map<String, Object>>) text.get("pages");
        assertEquals(2, pages.size());
        assertEquals("text-layer", pages.get(0).get("source"));
        assertTrue(((String) pages.get(0).get("text")).contains("Already typed"));
        assertFalse(pages.get(0).containsKey("confidence"));
        assertEquals("recognized", pages.get(1).get("source"));
        assertEquals("Merhaba şehir", pages.get(1).get("text"));
        assertEquals(93.0, pages.get(1).get("confidence"));
        assertFalse(text.containsKey("search"));
    }

    @Test
    void secondPassReadsTextBackFromOcrLayer() {
        ScriptedRecognizer recognizer =
                new ScriptedRecognizer(new RecognizedSpan("Layered", 72, 72, 120, 20, 88));
        OcrBridge bridge = new OcrBridge(recognizer, new BlankRasterizer());
        Document document = blankPages(1);
        bridge.apply(document, OPTIONS);

        OcrReport again = bridge.apply(document, OPTIONS);

        OcrReport.PageResult page = again.pages().get(0);
        assertEquals(OcrReport.TextSource.OCR_LAYER, page.source());
        assertTrue(page.text().contains("Layered"), page.text());
    }

    @Test
    @SuppressWarnings("unchecked")
    void searchListsMatchesWithContext() {
        ScriptedRecognizer recognizer =
                new ScriptedRecognizer(
                        new RecognizedSpan("Invoice total", 72, 72, 200, 20, 90),
                        new RecognizedSpan("invoice date", 72, 120, 200, 20, 80));
        OcrOperation operation = new OcrOperation(new OcrBridge(recognizer, new BlankRasterizer()));

        Map<String, Object> anyCase =
                (Map<String, Object>)
                        textArtifact(
                                        run(
                                                operation,
                                                Map.of("search", "INVOICE"),
                                                LoadedDocument.of("scan.pdf", blankPages(2))))
                                .get("search");
        assertEquals("INVOICE", anyCase.get("term"));
        assertEquals(4, anyCase.get("total"));
        List<Map<String, Object>> hits = (List<Map<String, Object>>) anyCase.get("pages");
        assertEquals(List.of(1, 2), List.of(hits.get(0).get("page"), hits.get(1).get("page")));
        Map<String, Object> first =
                ((List<Map<String, Object>>) hits.get(0).get("matches")).get(0);
        assertEquals(0, first.get("position"));
        assertEquals("Invoice total invoice date", first.get("context"));

        Map<String, Object> exact =
                (Map<String, Object>)
                        textArtifact(
                                        run(
                                                operation,
                                                Map.of("search", "invoice", "match-case", "true"),
                                                LoadedDocument.of("scan.pdf", blankPages(1))))
                                .get("search");
        assertEquals(1, exact.get("total"));
    }

    @Test
    void blankSearchTermIsAParameterError() {
        ScriptedRecognizer recognizer = new ScriptedRecognizer();
        OcrOperation operation = new OcrOperation(new OcrBridge(recognizer, new BlankRasterizer()));

        PdfForgeException e =
                assertThrows(
                        PdfForgeException.class,
                        () ->
                                run(
                                        operation,
                                        Map.of("search", "  "),
                                        LoadedDocument.of("scan.pdf", blankPages(1))));
        assertEquals(ErrorKind.INVALID_PARAMETER, e.kind());
        assertTrue(recognizer.calls.isEmpty());
    }

    @Test
    void invalidDpiIsAParameterError() {
        OcrOperation operation =
                new OcrOperation(new OcrBridge(new ScriptedRecognizer(), new BlankRasterizer()));

        PdfForgeException e =
                assertThrows(
                        PdfForgeException.class,
                        () ->
                                run(
                                        operation,
                                        Map.of("dpi", "10"),
                                        LoadedDocument.of("scan.pdf", blankPages(1))));
        assertEquals(ErrorKind.INVALID_PARAMETER, e.kind());
    }
}
