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

import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.Date;
import java.util.Map;
import net.boyechko.pdf.forge.PdfTestBase;
import net.boyechko.pdf.forge.codec.PdfDecoder;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.VerificationResult;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SignVerifyOperationTest extends PdfTestBase {

    private static final String STORE_PASSWORD = "changeit";

    private Path keyStore;
    private Path plainPdf;

    @BeforeEach
    void createFixtures() throws Exception {
        keyStore = createKeyStore(testOutputPath("signer.p12"), "Test Signer");
        plainPdf = createTextPdf("contract.pdf", "Terms and conditions", "Signatures");
    }

    // ── Fixture helpers ────────────────────────────────────────────

    /** A PKCS#12 file holding a throwaway self-signed RSA key. */
    static Path createKeyStore(Path output, String commonName) throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        KeyPair pair = generator.generateKeyPair();

        X500Name subject = new X500Name("CN=" + commonName + ", O=PDF Forge Tests");
        long now = System.currentTimeMillis();
        JcaX509v3CertificateBuilder builder =
                new JcaX509v3CertificateBuilder(
                        subject,
                        BigInteger.valueOf(now),
                        new Date(now - 60_000),
                        new Date(now + 86_400_000L),
                        subject,
                        pair.getPublic());
        X509Certificate certificate =
                new JcaX509CertificateConverter()
                        .getCertificate(
                                builder.build(
                                        new JcaContentSignerBuilder("SHA256withRSA")
                                                .build(pair.getPrivate())));

        KeyStore store = KeyStore.getInstance("PKCS12");
        store.load(null, null);
        store.setKeyEntry(
                "signer",
                pair.getPrivate(),
                STORE_PASSWORD.toCharArray(),
                new Certificate[] {certificate});
        try (OutputStream out = Files.newOutputStream(output)) {
            store.store(out, STORE_PASSWORD.toCharArray());
        }
        return output;
    }

    private byte[] signEmbedded() {
        OperationResult result =
                run(
                        new SignOperation(),
                        Map.of(
                                "keystore", keyStore.toString(),
                                "keystore-password", STORE_PASSWORD,
                                "reason", "Approval"),
                        load(plainPdf));
        return PdfEncoder.encode(result.documents().get(0).document());
    }

    private VerificationResult verify(byte[] bytes, Map<String, String> params) {
        LoadedDocument input =
                new LoadedDocument("signed.pdf", null, bytes, PdfDecoder.decode(bytes), null);
        return run(new VerifyOperation(), params, input).verification();
    }

    // ── Embedded signatures ────────────────────────────────────────

    @Test
    void embeddedSignatureVerifies() {
        VerificationResult result = verify(signEmbedded(), Map.of());

        VerificationResult.Valid valid = assertInstanceOf(VerificationResult.Valid.class, result);
        assertTrue(valid.signer().contains("Test Signer"), valid.signer());
        assertEquals(1, valid.signatureCount());
    }

    @Test
    void pdfBoxSeesSignatureField() throws Exception {
        try (PDDocument pdfbox = Loader.loadPDF(signEmbedded())) {
            assertEquals(1, pdfbox.getSignatureDictionaries().size());
            assertEquals("Approval", pdfbox.getSignatureDictionaries().get(0).getReason());
            assertEquals(2, pdfbox.getNumberOfPages());
        }
    }

    @Test
    void flippedByteInsideSignedRangeIsInvalid() {
        byte[] signed = signEmbedded();
        byte[] tampered = Arrays.copyOf(signed, signed.length);
        // byte 10 sits in the binary comment after the header
        tampered[10] ^= 0x01;

        assertInstanceOf(VerificationResult.Invalid.class, verify(tampered, Map.of()));
    }

    @Test
    void appendedBytesAreReportedAsModification() {
        byte[] signed = signEmbedded();
        byte[] extended = Arrays.copyOf(signed, signed.length + 2);
        extended[signed.length] = '%';
        extended[signed.length + 1] = '\n';

        VerificationResult result = verify(extended, Map.of());

        VerificationResult.Invalid invalid =
                assertInstanceOf(VerificationResult.Invalid.class, result);
        assertTrue(invalid.reason().contains("modified"), invalid.reason());
    }

    @Test
    void unsignedDocumentHasNoSignature() {
        assertInstanceOf(
                VerificationResult.NoSignature.class, verify(read(plainPdf), Map.of()));
    }

    @Test
    void resigningWarnsThatOlderSignatureBreaks() {
        byte[] signed = signEmbedded();
        LoadedDocument input =
                new LoadedDocument("signed.pdf", null, signed, PdfDecoder.decode(signed), null);

        OperationResult result =
                run(
                        new SignOperation(),
                        Map.of(
                                "keystore", keyStore.toString(),
                                "keystore-password", STORE_PASSWORD),
                        input);

        assertTrue(result.hasWarnings());
    }

    // ── Detached signatures ────────────────────────────────────────

    @Test
    void detachedSignatureVerifiesAgainstEncodedDocument() throws Exception {
        OperationResult result =
                run(
                        new SignOperation(),
                        Map.of(
                                "keystore", keyStore.toString(),
                                "keystore-password", STORE_PASSWORD,
                                "mode", "detached"),
                        load(plainPdf));
        byte[] document = PdfEncoder.encode(result.documents().get(0).document());
        OperationResult.Artifact artifact = result.artifacts().get(0);
        assertEquals("p7s", artifact.extension());
        Path signature = testOutputPath("contract.p7s");
        Files.write(signature, artifact.bytes());

        VerificationResult verified = verify(document, Map.of("signature", signature.toString()));

        assertTrue(verified.isValid(), verified.describe());
    }

    @Test
    void wrongKeyStorePasswordFails() {
        Map<String, String> params =
                Map.of("keystore", keyStore.toString(), "keystore-password", "wrong");
        PdfForgeException e =
                assertThrows(
                        PdfForgeException.class,
                        () -> run(new SignOperation(), params, load(plainPdf)));
        assertEquals(ErrorKind.SIGNATURE_FAILURE, e.kind());
    }
}
