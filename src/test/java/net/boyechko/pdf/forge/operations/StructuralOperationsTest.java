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

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.PdfTestBase;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.PageBox;
import net.boyechko.pdf.forge.operation.Operation;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.OperationResult.ResultDocument;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StructuralOperationsTest extends PdfTestBase {

    private Path threePages;

    @BeforeEach
    void createFixture() throws Exception {
        threePages = createTextPdf("three.pdf", "One", "Two", "Three");
    }

    private Document single(OperationResult result) {
        assertEquals(1, result.documents().size());
        return result.documents().get(0).document();
    }

    private Document apply(Operation operation, Map<String, String> params) {
        return single(run(operation, params, load(threePages)));
    }

    private static ErrorKind failureOf(Runnable action) {
        return assertThrows(PdfForgeException.class, action::run).kind();
    }

    // ── blank ──────────────────────────────────────────────────────

    @Test
    void blankCreatesRequestedPages() {
        Document document =
                single(run(new BlankOperation(), Map.of("pages", "3", "size", "letter")));

        assertEquals(3, document.pageCount());
        assertEquals(PageBox.LETTER, document.page(2).mediaBox());
    }

    // ── merge ──────────────────────────────────────────────────────

    @Test
    void mergeConcatenatesInInputOrderWithBookmarks() throws Exception {
        Path second = createTextPdf("second.pdf", "Four", "Five");

        Document merged =
                single(run(new MergeOperation(), Map.of(), load(threePages), load(second)));

        assertEquals(List.of("One", "Two", "Three", "Four", "Five"), pageTexts(merged));
        try (PDDocument pdfbox = Loader.loadPDF(PdfEncoder.encode(merged))) {
            List<String> titles = new ArrayList<>();
            PDDocumentOutline outline = pdfbox.getDocumentCatalog().getDocumentOutline();
            for (PDOutlineItem item : outline.children()) {
                titles.add(item.getTitle());
            }
            assertEquals(List.of("three", "second"), titles);
        }
    }

    @Test
    void mergeSortsByName() throws Exception {
        Path alpha = createTextPdf("alpha.pdf", "Alpha");

        Document merged =
                single(
                        run(
                                new MergeOperation(),
                                Map.of("sort", "name"),
                                load(threePages),
                                load(alpha)));

        assertEquals(List.of("Alpha", "One", "Two", "Three"), pageTexts(merged));
    }

    @Test
    void mergeSkipsEmptyInputWithWarning() throws Exception {
        Path other = createTextPdf("other.pdf", "Other");
        LoadedDocument empty = LoadedDocument.of("empty.pdf", Document.blank());

        OperationResult result =
                run(new MergeOperation(), Map.of(), load(threePages), empty, load(other));

        assertEquals(4, single(result).pageCount());
        assertTrue(result.warnings().get(0).contains("empty.pdf"));
    }

    @Test
    void mergeIsAssociative() throws Exception {
        LoadedDocument a = load(threePages);
        LoadedDocument b = load(createTextPdf("b.pdf", "Four", "Five"));
        LoadedDocument c = load(createTextPdf("c.pdf", "Six"));
        Map<String, String> plain = Map.of("bookmarks", "false");

        Document ab = single(run(new MergeOperation(), plain, a, b));
        Document stepwise =
                single(run(new MergeOperation(), plain, LoadedDocument.of("ab.pdf", ab), c));
        Document direct =
                single(run(new MergeOperation(), plain, load(threePages), b, c));

        assertSamePages(direct, stepwise);
    }

    private static void assertSamePages(Document expected, Document actual) {
        assertEquals(expected.pageCount(), actual.pageCount());
        for (int i = 0; i < expected.pageCount(); i++) {
            assertArrayEquals(
                    expected.page(i).contentBytes(), actual.page(i).contentBytes(), "page " + i);
            assertEquals(expected.page(i).mediaBox(), actual.page(i).mediaBox());
            assertEquals(expected.page(i).rotation(), actual.page(i).rotation());
        }
        assertEquals(pageTexts(expected), pageTexts(actual));
    }

    // ── split ──────────────────────────────────────────────────────

    @Test
    void splitByRangesLabelsEachPart() {
        OperationResult result =
                run(new SplitOperation(), Map.of("ranges", "1-2,3"), load(threePages));

        List<String> labels = new ArrayList<>();
        for (ResultDocument part : result.documents()) {
            labels.add(part.label());
        }
        assertEquals(List.of("pages_1-2", "pages_3-3"), labels);
        assertEquals(List.of("One", "Two"), pageTexts(result.documents().get(0).document()));
        assertEquals(List.of("Three"), pageTexts(result.documents().get(1).document()));
    }

    @Test
    void splitEveryTwoPages() {
        OperationResult result = run(new SplitOperation(), Map.of("every", "2"), load(threePages));
        assertEquals(2, result.documents().size());
        assertEquals(1, result.documents().get(1).document().pageCount());
    }

    @Test
    void splitRejectsOverlappingAndOutOfBoundsRanges() {
        assertEquals(ErrorKind.INVALID_RANGE, splitFailure("1-2,2-3"));
        assertEquals(ErrorKind.INVALID_RANGE, splitFailure("2-5"));
    }

    private ErrorKind splitFailure(String ranges) {
        return failureOf(
                () -> run(new SplitOperation(), Map.of("ranges", ranges), load(threePages)));
    }

    @Test
    void splitThenMergeRestoresTheDocument() throws Exception {
        String[] texts = new String[10];
        for (int i = 0; i < texts.length; i++) {
            texts[i] = "Page " + (i + 1);
        }
        Path tenPages = createTextPdf("ten.pdf", texts);

        OperationResult parts =
                run(new SplitOperation(), Map.of("ranges", "1-3,4-6,7-10"), load(tenPages));
        assertEquals(3, parts.documents().size());
        List<LoadedDocument> inputs = new ArrayList<>();
        for (ResultDocument part : parts.documents()) {
            inputs.add(LoadedDocument.of(part.label() + ".pdf", part.document()));
        }
        Document merged =
                single(
                        run(
                                new MergeOperation(),
                                Map.of("bookmarks", "false"),
                                inputs.toArray(new LoadedDocument[0])));

        assertSamePages(decode(tenPages), merged);
    }

    // ── rotate ─────────────────────────────────────────────────────

    @Test
    void rotateSelectedPagesOnly() {
        Document rotated = apply(new RotateOperation(), Map.of("angle", "90", "pages", "2"));

        assertEquals(0, rotated.page(0).rotation());
        assertEquals(90, rotated.page(1).rotation());
        assertEquals(0, rotated.page(2).rotation());
    }

    @Test
    void fourQuarterTurnsRestoreOriginalRotation() {
        Document document = decode(threePages);
        List<Integer> before = new ArrayList<>();
        for (int i = 0; i < document.pageCount(); i++) {
            before.add(document.page(i).rotation());
        }

        for (int turn = 0; turn < 4; turn++) {
            LoadedDocument input = LoadedDocument.of("turn" + turn + ".pdf", document);
            document = single(run(new RotateOperation(), Map.of("angle", "90"), input));
        }

        for (int i = 0; i < document.pageCount(); i++) {
            assertEquals(before.get(i), document.page(i).rotation());
        }
    }

    @Test
    void rotateNormalizesNegativeAngles() {
        Document rotated = apply(new RotateOperation(), Map.of("angle", "-90"));
        assertEquals(270, rotated.page(0).rotation());
    }

    @Test
    void rotateRejectsNonRightAngles() {
        assertEquals(
                ErrorKind.INVALID_ANGLE,
                failureOf(() -> apply(new RotateOperation(), Map.of("angle", "45"))));
    }

    // ── reorder ────────────────────────────────────────────────────

    @Test
    void reorderFollowsPermutation() {
        Document reordered = apply(new ReorderOperation(), Map.of("order", "3,1,2"));
        assertEquals(List.of("Three", "One", "Two"), pageTexts(reordered));
    }

    @Test
    void reorderRejectsDuplicatesAndGaps() {
        assertEquals(
                ErrorKind.INVALID_PERMUTATION,
                failureOf(() -> apply(new ReorderOperation(), Map.of("order", "1,1,2"))));
        assertEquals(
                ErrorKind.INVALID_PERMUTATION,
                failureOf(() -> apply(new ReorderOperation(), Map.of("order", "1,2"))));
    }

    @Test
    void reorderRejectsRangesBeyondDocumentWithoutExpanding() {
        assertTimeoutPreemptively(
                Duration.ofSeconds(5),
                () -> {
                    assertEquals(ErrorKind.INVALID_PERMUTATION, reorderFailure("1-2147483647"));
                    assertEquals(ErrorKind.INVALID_PERMUTATION, reorderFailure("0-2"));
                    assertEquals(ErrorKind.INVALID_PERMUTATION, reorderFailure("1-3,1-3"));
                });
        Document reordered = apply(new ReorderOperation(), Map.of("order", "2-3,1"));
        assertEquals(List.of("Two", "Three", "One"), pageTexts(reordered));
    }

    private ErrorKind reorderFailure(String order) {
        return failureOf(() -> apply(new ReorderOperation(), Map.of("order", order)));
    }

    // ── delete-pages ───────────────────────────────────────────────

    @Test
    void deleteRemovesSelectedPages() {
        Document remaining = apply(new DeletePagesOperation(), Map.of("pages", "2"));
        assertEquals(List.of("One", "Three"), pageTexts(remaining));
    }

    @Test
    void deletingEveryPageIsRejected() {
        assertEquals(
                ErrorKind.INVALID_RANGE,
                failureOf(() -> apply(new DeletePagesOperation(), Map.of("pages", "1-3"))));
    }
}
