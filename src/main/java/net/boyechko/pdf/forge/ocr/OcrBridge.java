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
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosBoolean;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosStream;
import net.boyechko.pdf.forge.document.ContentBuilder;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.Page;
import net.boyechko.pdf.forge.document.PageBox;
import net.boyechko.pdf.forge.document.PdfDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds an invisible, extractable text layer to pages that have none.
 *
 * <p>Pages that already show text, and pages marked as carrying an OCR layer, are left alone, so
 * applying the bridge twice changes nothing. Other pages are rasterized, recognized, and get one
 * appended content stream in rendering mode 3 whose spans are stretched over the recognized boxes.
 */
public class OcrBridge {
    private static final Logger logger = LoggerFactory.getLogger(OcrBridge.class);

    static final String PIECE_INFO_KEY = "PdfForge";
    static final String LAYER_MARKER = "OcrLayer";

    private final TextRecognizer recognizer;
    private final PageRasterizer rasterizer;

    public OcrBridge(TextRecognizer recognizer, PageRasterizer rasterizer) {
        this.recognizer = recognizer;
        this.rasterizer = rasterizer;
    }

    /** Tesseract recognition over PDFBox rendering. */
    public static OcrBridge standard() {
        return new OcrBridge(new TesseractRecognizer(), new PdfBoxPageRasterizer());
    }

    public OcrReport apply(Document document, OcrOptions options) {
        if (recognizer == null || rasterizer == null) {
            throw new PdfForgeException(ErrorKind.OCR_UNAVAILABLE, "No OCR engine configured");
        }
        byte[] encoded = PdfEncoder.encodeUnprotected(document);
        int recognized = 0;
        int skipped = 0;
        int spanCount = 0;
        double confidenceSum = 0;
        List<Integer> doubtful = new ArrayList<>();
        List<OcrReport.PageResult> pages = new ArrayList<>();

        PageRasterizer.RenderedPages rendered = null;
        try (PageText text = PageText.open(encoded)) {
            for (int i = 0; i < document.pageCount(); i++) {
                Page page = document.page(i);
                if (hasOcrLayer(page)) {
                    logger.debug("Page {} already has an OCR layer", i + 1);
                    pages.add(
                            new OcrReport.PageResult(
                                    i + 1, OcrReport.TextSource.OCR_LAYER, text.text(i), 0));
                    skipped++;
                    continue;
                }
                int runs = text.textRuns(i);
                if (runs >= options.minTextRuns()) {
                    logger.debug("Page {} has {} text runs; no OCR needed", i + 1, runs);
                    pages.add(
                            new OcrReport.PageResult(
                                    i + 1, OcrReport.TextSource.TEXT_LAYER, text.text(i), 0));
                    skipped++;
                    continue;
                }
                if (rendered == null) {
                    rendered = rasterizer.open(encoded);
                }
                BufferedImage image = rendered.render(i, options.dpi());
                List<RecognizedSpan> spans = new ArrayList<>();
                for (RecognizedSpan span :
                        recognizer.recognize(image, options.language(), options.dpi())) {
                    if (!span.text().isBlank()
                            && span.width() > 0
                            && span.height() > 0
                            && span.confidence() >= options.minConfidence()) {
                        spans.add(span);
                    }
                }
                writeLayer(document, page, spans, image);
                recognized++;
                spanCount += spans.size();
                double pageConfidence = 0;
                StringBuilder recognizedText = new StringBuilder();
                for (RecognizedSpan span : spans) {
                    pageConfidence += span.confidence();
                    if (recognizedText.length() > 0) {
                        recognizedText.append(' ');
                    }
                    recognizedText.append(span.text().strip());
                }
                confidenceSum += pageConfidence;
                double pageMean = spans.isEmpty() ? 0 : pageConfidence / spans.size();
                if (!spans.isEmpty() && pageMean < OcrOptions.LOW_CONFIDENCE) {
                    doubtful.add(i + 1);
                }
                pages.add(
                        new OcrReport.PageResult(
                                i + 1,
                                OcrReport.TextSource.RECOGNIZED,
                                recognizedText.toString(),
                                pageMean));
                logger.debug("Page {}: {} spans recognized", i + 1, spans.size());
            }
        } finally {
            if (rendered != null) {
                rendered.close();
            }
        }
        OcrReport report =
                new OcrReport(
                        document.pageCount(),
                        recognized,
                        skipped,
                        spanCount,
                        spanCount == 0 ? 0 : confidenceSum / spanCount,
                        doubtful,
                        pages);
        logger.info("OCR: {}", report);
        return report;
    }

    /** True if the page's private metadata marks an OCR layer. */
    public static boolean hasOcrLayer(Page page) {
        Document document = page.document();
        CosDictionary pieceInfo = document.resolveDictionary(page.dictionary().get("PieceInfo"));
        if (pieceInfo == null) {
            return false;
        }
        CosDictionary ours = document.resolveDictionary(pieceInfo.get(PIECE_INFO_KEY));
        if (ours == null) {
            return false;
        }
        CosDictionary data = document.resolveDictionary(ours.get("Private"));
        return data != null && data.getBoolean(LAYER_MARKER, false);
    }

    private static void writeLayer(
            Document document, Page page, List<RecognizedSpan> spans, BufferedImage image) {
        if (!spans.isEmpty()) {
            PageBox box = page.cropBox();
            int rotation = page.rotation();
            double scaleX = image.getWidth() / box.displayWidth(rotation);
            double scaleY = image.getHeight() / box.displayHeight(rotation);
            double radians = Math.toRadians(rotation);
            double cos = Math.cos(radians);
            double sin = Math.sin(radians);

            // Font dictionaries are registered empty and filled once every code is assigned.
            Map<OcrFont, CosDictionary> fonts = new LinkedHashMap<>();
            ContentBuilder content = new ContentBuilder().beginText().renderingMode(3);
            OcrFont current = null;
            String currentName = null;
            for (RecognizedSpan span : spans) {
                if (current == null || !current.canEncode(span.text())) {
                    OcrFont candidate = new OcrFont();
                    if (!candidate.canEncode(span.text())) {
                        logger.debug("Span has too many distinct characters: {}", span.text());
                        continue;
                    }
                    current = candidate;
                    CosDictionary fontDict = new CosDictionary();
                    fonts.put(current, fontDict);
                    currentName = page.addResource("Font", "OCR", document.add(fontDict));
                }
                double size = span.height() / scaleY;
                int glyphs = span.text().codePointCount(0, span.text().length());
                double natural = OcrFont.width(glyphs, size);
                double[] origin =
                        toUserSpace(
                                box,
                                rotation,
                                span.x() / scaleX,
                                (span.y() + span.height()) / scaleY);
                content.font(currentName, size)
                        .horizontalScaling(100.0 * (span.width() / scaleX) / natural)
                        .textMatrix(cos, sin, -sin, cos, origin[0], origin[1])
                        .showText(current.encode(span.text()));
            }
            content.endText();

            for (Map.Entry<OcrFont, CosDictionary> entry : fonts.entrySet()) {
                OcrFont font = entry.getKey();
                CosStream cmap = CosStream.ofData(new CosDictionary(), font.toUnicodeCMap());
                font.describeInto(entry.getValue(), document.add(cmap));
            }
            page.isolateExistingContent();
            page.appendContent(wrap(content.toBytes()));
        }
        markOcrLayer(page);
    }

    /**
     * Maps a point given in displayed page coordinates (points from the top-left corner of the
     * rotated crop box) back to default user space.
     */
    static double[] toUserSpace(PageBox box, int rotation, double dx, double dy) {
        return switch (rotation) {
            case 90 -> new double[] {box.llx() + dy, box.lly() + dx};
            case 180 -> new double[] {box.urx() - dx, box.lly() + dy};
            case 270 -> new double[] {box.urx() - dy, box.ury() - dx};
            default -> new double[] {box.llx() + dx, box.ury() - dy};
        };
    }

    private static void markOcrLayer(Page page) {
        Document document = page.document();
        CosDictionary pieceInfo = document.resolveDictionary(page.dictionary().get("PieceInfo"));
        if (pieceInfo == null) {
            pieceInfo = new CosDictionary();
            page.dictionary().put("PieceInfo", pieceInfo);
        }
        CosDictionary ours = new CosDictionary();
        ours.putText("LastModified", PdfDate.format(ZonedDateTime.now()));
        CosDictionary data = new CosDictionary();
        data.put(LAYER_MARKER, CosBoolean.TRUE);
        ours.put("Private", data);
        pieceInfo.put(PIECE_INFO_KEY, ours);
    }

    private static byte[] wrap(byte[] body) {
        byte[] wrapped = new byte[body.length + 4];
        wrapped[0] = 'q';
        wrapped[1] = '\n';
        System.arraycopy(body, 0, wrapped, 2, body.length);
        wrapped[wrapped.length - 2] = 'Q';
        wrapped[wrapped.length - 1] = '\n';
        return wrapped;
    }
}
