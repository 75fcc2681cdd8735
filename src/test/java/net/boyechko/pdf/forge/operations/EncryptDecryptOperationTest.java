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

import com.itextpdf.kernel.pdf.EncryptionConstants;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.WriterProperties;
import com.itextpdf.layout.element.Paragraph;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.PdfTestBase;
import net.boyechko.pdf.forge.batch.BatchJob;
import net.boyechko.pdf.forge.batch.BatchListener;
import net.boyechko.pdf.forge.batch.BatchProcessor;
import net.boyechko.pdf.forge.batch.JobSnapshot;
import net.boyechko.pdf.forge.batch.JobStatus;
import net.boyechko.pdf.forge.codec.DecodeOptions;
import net.boyechko.pdf.forge.codec.PdfDecoder;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.EncryptionState;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EncryptDecryptOperationTest extends PdfTestBase {

    private static final String USER = "reader";
    private static final String OWNER = "keeper";

    private Path plainPdf;

    @BeforeEach
    void createFixture() throws Exception {
        plainPdf = createTextPdf("plain.pdf", "Confidential memo");
    }

    private byte[] encrypt(String algorithm) {
        OperationResult result =
                run(
                        new EncryptOperation(),
                        Map.of(
                                "user-password", USER,
                                "owner-password", OWNER,
                                "algorithm", algorithm),
                        load(plainPdf));
        return PdfEncoder.encode(result.documents().get(0).document());
    }

    private static LoadedDocument loaded(String name, byte[] bytes) {
        return new LoadedDocument(name, null, bytes, PdfDecoder.decode(bytes), null);
    }

    // ── encrypt ────────────────────────────────────────────────────

    @Test
    void aesOutputOpensInPdfBoxWithUserPassword() throws Exception {
        byte[] encrypted = encrypt("aes-128");

        try (PDDocument pdfbox = Loader.loadPDF(encrypted, USER)) {
            assertTrue(pdfbox.isEncrypted());
            assertEquals(1, pdfbox.getNumberOfPages());
            assertEquals("Confidential memo", new PDFTextStripper().getText(pdfbox).trim());
            assertTrue(pdfbox.getCurrentAccessPermission().canPrint());
            assertFalse(pdfbox.getCurrentAccessPermission().canModify());
        }
    }

    @Test
    void rc4OutputOpensInPdfBoxWithOwnerPassword() throws Exception {
        byte[] encrypted = encrypt("rc4-128");

        try (PDDocument pdfbox = Loader.loadPDF(encrypted, OWNER)) {
            assertEquals("Confidential memo", new PDFTextStripper().getText(pdfbox).trim());
        }
    }

    @Test
    void encryptedOutputNeedsPassword() {
        byte[] encrypted = encrypt("aes-128");
        assertThrows(InvalidPasswordException.class, () -> Loader.loadPDF(encrypted).close());
    }

    @Test
    void decoderOpensOwnOutputWithUserPassword() {
        byte[] encrypted = encrypt("aes-128");

        Document document = PdfDecoder.decode(encrypted, DecodeOptions.withPassword(USER));

        assertTrue(document.isEncrypted());
        assertFalse(document.isSealed());
        assertEquals(EncryptionState.Algorithm.AES_128, document.encryption().algorithm());
        assertEquals(
                List.of("Confidential memo"), pageTexts(PdfEncoder.encodeUnprotected(document)));
    }

    @Test
    void withoutPasswordDocumentStaysSealed() {
        Document document = PdfDecoder.decode(encrypt("aes-128"));

        assertTrue(document.isSealed());
        PdfForgeException e =
                assertThrows(PdfForgeException.class, () -> PdfEncoder.encode(document));
        assertEquals(ErrorKind.WRONG_PASSWORD, e.kind());
    }

    @Test
    void wrongPasswordIsRejected() {
        byte[] encrypted = encrypt("aes-128");
        PdfForgeException e =
                assertThrows(
                        PdfForgeException.class,
                        () -> PdfDecoder.decode(encrypted, DecodeOptions.withPassword("guess")));
        assertEquals(ErrorKind.WRONG_PASSWORD, e.kind());
    }

    @Test
    void structuralOperationRefusesSealedInput() {
        LoadedDocument sealed = loaded("sealed.pdf", encrypt("aes-128"));
        PdfForgeException e =
                assertThrows(
                        PdfForgeException.class,
                        () -> run(new RotateOperation(), Map.of(), sealed));
        assertEquals(ErrorKind.WRONG_PASSWORD, e.kind());
    }

    // ── decrypt ────────────────────────────────────────────────────

    @Test
    void decryptRemovesProtection() throws Exception {
        LoadedDocument sealed = loaded("sealed.pdf", encrypt("aes-128"));

        OperationResult result = run(new DecryptOperation(), Map.of("password", USER), sealed);
        byte[] decrypted = PdfEncoder.encode(result.documents().get(0).document());

        try (PDDocument pdfbox = Loader.loadPDF(decrypted)) {
            assertFalse(pdfbox.isEncrypted());
            assertEquals("Confidential memo", new PDFTextStripper().getText(pdfbox).trim());
        }
    }

    @Test
    void encryptThenDecryptRestoresContentBytes() {
        byte[] original = decode(plainPdf).page(0).contentBytes();

        for (String algorithm : List.of("aes-128", "rc4-128")) {
            LoadedDocument sealed = loaded("sealed.pdf", encrypt(algorithm));
            OperationResult result =
                    run(new DecryptOperation(), Map.of("password", USER), sealed);
            Document reopened =
                    PdfDecoder.decode(PdfEncoder.encode(result.documents().get(0).document()));

            assertFalse(reopened.isEncrypted(), algorithm);
            assertArrayEquals(original, reopened.page(0).contentBytes(), algorithm);
        }
    }

    @Test
    void decryptWithWrongPasswordLeavesInputUntouched() throws Exception {
        Path sealed = testOutputPath("sealed.pdf");
        byte[] encrypted = encrypt("aes-128");
        Files.write(sealed, encrypted);
        BatchJob job =
                BatchJob.builder(OperationKind.DECRYPT)
                        .withInput(sealed)
                        .withParameter("password", "guess")
                        .build();

        JobSnapshot result;
        try (BatchProcessor processor = new BatchProcessor(settings())) {
            result = processor.run(List.of(job), BatchListener.NONE).get(0);
        }

        assertEquals(ErrorKind.WRONG_PASSWORD, ((JobStatus.Failed) result.status()).kind());
        assertArrayEquals(encrypted, Files.readAllBytes(sealed));
        assertFalse(Files.exists(settings().outputDirectory().resolve("decrypted_sealed.pdf")));
    }

    @Test
    void decryptWithoutPasswordFails() {
        LoadedDocument sealed = loaded("sealed.pdf", encrypt("rc4-128"));
        PdfForgeException e =
                assertThrows(
                        PdfForgeException.class,
                        () -> run(new DecryptOperation(), Map.of(), sealed));
        assertEquals(ErrorKind.WRONG_PASSWORD, e.kind());
    }

    @Test
    void decryptOfPlainDocumentWarns() {
        OperationResult result = run(new DecryptOperation(), Map.of(), load(plainPdf));
        assertTrue(result.hasWarnings());
    }

    @Test
    void readsAes256FromITextWithUserPassword() throws Exception {
        Path aes256 = testOutputPath("aes256.pdf");
        WriterProperties props =
                new WriterProperties()
                        .setStandardEncryption(
                                USER.getBytes(),
                                OWNER.getBytes(),
                                EncryptionConstants.ALLOW_PRINTING,
                                EncryptionConstants.ENCRYPTION_AES_256);
        try (PdfDocument pdfDoc = new PdfDocument(new PdfWriter(aes256.toString(), props))) {
            com.itextpdf.layout.Document layout = new com.itextpdf.layout.Document(pdfDoc);
            layout.add(new Paragraph("Strong box"));
            layout.close();
        }

        Document document = PdfDecoder.decode(read(aes256), DecodeOptions.withPassword(USER));

        assertEquals(EncryptionState.Algorithm.AES_256, document.encryption().algorithm());
        assertEquals(List.of("Strong box"), pageTexts(PdfEncoder.encodeUnprotected(document)));
    }
}
