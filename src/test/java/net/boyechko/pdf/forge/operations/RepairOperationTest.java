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

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.PdfTestBase;
import net.boyechko.pdf.forge.codec.PdfDecoder;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.PageBox;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationResult;
import org.junit.jupiter.api.Test;

class RepairOperationTest extends PdfTestBase {

    /** Points startxref at offset zero so the cross-reference table cannot be found. */
    private static byte[] breakStartXref(byte[] pdf) {
        String text = new String(pdf, StandardCharsets.ISO_8859_1);
        int at = text.lastIndexOf("startxref") + "startxref".length();
        while (!Character.isDigit(text.charAt(at))) {
            at++;
        }
        byte[] broken = pdf.clone();
        while (Character.isDigit(text.charAt(at))) {
            broken[at++] = '0';
        }
        return broken;
    }

    private Path write(String name, byte[] bytes) throws Exception {
        Path path = testOutputPath(name);
        Files.write(path, bytes);
        return path;
    }

    @Test
    void repairRebuildsDamagedCrossReference() throws Exception {
        Path good = createTextPdf("good.pdf", "First", "Second", "Third");
        Path broken = write("broken.pdf", breakStartXref(read(good)));

        OperationResult result = run(new RepairOperation(), Map.of(), load(broken));

        Document repaired = result.documents().get(0).document();
        assertEquals(3, repaired.pageCount());
        assertEquals(List.of("Recovered 3 pages from broken.pdf"), result.warnings());

        byte[] written = PdfEncoder.encode(repaired);
        assertFalse(PdfDecoder.decode(written).isRecovered());
        assertEquals(List.of("First", "Second", "Third"), pageTexts(written));
    }

    @Test
    void repairOfHealthyFileKeepsEveryPage() throws Exception {
        Path good = createTextPdf("good.pdf", "Only");

        OperationResult result = run(new RepairOperation(), Map.of(), load(good));

        assertEquals(List.of("Only"), pageTexts(result.documents().get(0).document()));
    }

    @Test
    void garbageIsUnrecoverable() throws Exception {
        byte[] bytes = "%PDF-1.7\nnothing to see here\n".getBytes(StandardCharsets.US_ASCII);
        Path garbage = write("garbage.pdf", bytes);
        LoadedDocument input = new LoadedDocument("garbage.pdf", garbage, bytes, null, null);

        PdfForgeException e =
                assertThrows(
                        PdfForgeException.class,
                        () -> run(new RepairOperation(), Map.of(), input));
        assertEquals(ErrorKind.UNRECOVERABLE, e.kind());
    }

    @Test
    void repairRecoversFileWithoutHeader() throws Exception {
        Path good = createTextPdf("good.pdf", "Headless");
        byte[] bytes = read(good);
        for (int i = 0; i < "%PDF-1.7".length(); i++) {
            bytes[i] = ' ';
        }
        Path headless = write("headless.pdf", bytes);
        LoadedDocument input = new LoadedDocument("headless.pdf", headless, bytes, null, null);

        PdfForgeException strict =
                assertThrows(PdfForgeException.class, () -> PdfDecoder.decode(bytes));
        assertEquals(ErrorKind.MALFORMED_DOCUMENT, strict.kind());

        Document repaired =
                run(new RepairOperation(), Map.of(), input).documents().get(0).document();
        assertEquals("1.7", repaired.version());
        assertEquals(List.of("Headless"), pageTexts(repaired));
    }

    @Test
    void inMemoryDocumentIsPassedThrough() {
        Document document = Document.blank();
        document.addPage(document.createPage(PageBox.LETTER));

        OperationResult result =
                run(new RepairOperation(), Map.of(), LoadedDocument.of("new.pdf", document));

        assertSame(document, result.documents().get(0).document());
        assertTrue(result.warnings().get(0).contains("nothing to repair"));
    }
}
