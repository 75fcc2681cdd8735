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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.EncryptionState;
import net.boyechko.pdf.forge.document.PendingSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes a {@link Document} as a complete PDF file with a classic cross-reference table.
 *
 * <p>Output is deterministic for a given document: objects are renumbered breadth-first from the
 * catalog and a missing file identifier is derived from the body. An embedded signature request
 * is honored with a two-phase layout: placeholders first, then the byte range and the signature
 * container are patched in place.
 */
public final class PdfEncoder {
    private static final Logger logger = LoggerFactory.getLogger(PdfEncoder.class);

    private static final byte[] HEADER =
            "%PDF-1.7\n%âãÏÓ\n".getBytes(StandardCharsets.ISO_8859_1);
    private static final HexFormat HEX = HexFormat.of();

    private PdfEncoder() {}

    /**
     * Encodes {@code document}. The page tree is rebuilt from the page list first.
     *
     * @throws PdfForgeException WRONG_PASSWORD for a sealed document, BROKEN_REFERENCE for a
     *     reference that does not resolve, SIGNATURE_FAILURE if a pending signature cannot be
     *     produced
     */
    public static byte[] encode(Document document) {
        if (document.isSealed()) {
            throw new PdfForgeException(
                    ErrorKind.WRONG_PASSWORD, "Document is encrypted and was not opened");
        }
        document.syncPageTree();

        List<CosReference> roots = new ArrayList<>();
        roots.add(document.rootReference());
        if (document.infoReference() != null) {
            roots.add(document.infoReference());
        }
        ObjectNumbering numbering = ObjectNumbering.of(document, roots);

        EncryptionState encryption = document.encryption();
        PendingSignature pending = document.pendingSignature();
        CosSerializer serializer =
                new CosSerializer(
                        numbering,
                        encryption,
                        pending != null ? pending.signatureDictionary() : null,
                        pending != null ? pending.contentsCapacity() : 0);

        serializer.writeBytes(HEADER);
        List<CosObject> objects = numbering.objects();
        int total = objects.size() + (encryption != null ? 1 : 0);
        int[] offsets = new int[total + 1];
        for (int i = 0; i < objects.size(); i++) {
            offsets[i + 1] = serializer.position();
            serializer.writeIndirect(i + 1, objects.get(i), true);
        }
        int encryptNumber = 0;
        if (encryption != null) {
            encryptNumber = total;
            offsets[encryptNumber] = serializer.position();
            serializer.writeIndirect(
                    encryptNumber, StandardSecurityHandler.toDictionary(encryption), false);
        }

        byte[][] fileId = fileIdFor(document, encryption, serializer.toByteArray());
        int xrefOffset = serializer.position();
        StringBuilder xref = new StringBuilder();
        xref.append("xref\n0 ").append(total + 1).append('\n');
        xref.append("0000000000 65535 f\r\n");
        for (int i = 1; i <= total; i++) {
            xref.append(String.format("%010d %05d n\r\n", offsets[i], 0));
        }
        xref.append("trailer\n<< /Size ").append(total + 1);
        xref.append(" /Root ").append(numbering.numberOf(document.rootReference())).append(" 0 R");
        if (document.infoReference() != null) {
            int info = numbering.numberOf(document.infoReference());
            if (info > 0) {
                xref.append(" /Info ").append(info).append(" 0 R");
            }
        }
        xref.append(" /ID [<")
                .append(HEX.formatHex(fileId[0]))
                .append("> <")
                .append(HEX.formatHex(fileId[1]))
                .append(">]");
        if (encryptNumber > 0) {
            xref.append(" /Encrypt ").append(encryptNumber).append(" 0 R");
        }
        xref.append(" >>\nstartxref\n").append(xrefOffset).append("\n%%EOF\n");
        serializer.writeAscii(xref.toString());

        byte[] file = serializer.toByteArray();
        if (pending != null) {
            sign(file, pending, serializer.byteRangeOffset(), serializer.contentsOffset());
        }
        logger.debug("Encoded {} objects into {} bytes", total, file.length);
        return file;
    }

    /**
     * Serializes {@code document} without encryption or a pending signature, for handing to
     * third-party readers. The document itself is left as it was.
     */
    public static byte[] encodeUnprotected(Document document) {
        EncryptionState encryption = document.encryption();
        PendingSignature signature = document.pendingSignature();
        document.setEncryption(null);
        document.setPendingSignature(null);
        try {
            return encode(document);
        } finally {
            document.setEncryption(encryption);
            document.setPendingSignature(signature);
        }
    }

    private static byte[][] fileIdFor(Document document, EncryptionState encryption, byte[] body) {
        byte[][] existing = document.fileId();
        if (encryption != null && encryption.fileId().length > 0) {
            byte[] second = existing != null ? existing[1] : encryption.fileId();
            return new byte[][] {encryption.fileId(), second};
        }
        if (existing != null) {
            return existing;
        }
        byte[] digest = md5(body);
        return new byte[][] {digest, digest.clone()};
    }

    // ── Signing ─────────────────────────────────────────────────────

    private static void sign(
            byte[] file, PendingSignature pending, int byteRangeOffset, int contentsOffset) {
        if (byteRangeOffset < 0 || contentsOffset < 0) {
            throw new PdfForgeException(
                    ErrorKind.SIGNATURE_FAILURE,
                    "Signature dictionary is not reachable from the document catalog");
        }
        int contentsEnd = contentsOffset + pending.contentsCapacity() * 2 + 2;
        int trailingLength = file.length - contentsEnd;
        String byteRange =
                String.format("[0 %010d %010d %010d]", contentsOffset, contentsEnd, trailingLength);
        if (byteRange.length() != CosSerializer.BYTE_RANGE_PLACEHOLDER.length()) {
            throw new PdfForgeException(
                    ErrorKind.SIGNATURE_FAILURE, "File too large for the signature byte range");
        }
        byte[] rangeBytes = byteRange.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(rangeBytes, 0, file, byteRangeOffset, rangeBytes.length);

        byte[] signedContent = new byte[contentsOffset + trailingLength];
        System.arraycopy(file, 0, signedContent, 0, contentsOffset);
        System.arraycopy(file, contentsEnd, signedContent, contentsOffset, trailingLength);

        byte[] container;
        try {
            container = pending.signer().sign(signedContent);
        } catch (PdfForgeException e) {
            throw e;
        } catch (Exception e) {
            throw new PdfForgeException(
                    ErrorKind.SIGNATURE_FAILURE, "Signing failed: " + e.getMessage(), e);
        }
        byte[] hex = HEX.formatHex(container).getBytes(StandardCharsets.US_ASCII);
        if (hex.length > pending.contentsCapacity() * 2) {
            throw new PdfForgeException(
                    ErrorKind.SIGNATURE_FAILURE,
                    "Signature of "
                            + container.length
                            + " bytes exceeds the reserved "
                            + pending.contentsCapacity());
        }
        System.arraycopy(hex, 0, file, contentsOffset + 1, hex.length);
        logger.debug(
                "Embedded {}-byte signature over ranges {}",
                container.length,
                Arrays.toString(new int[] {0, contentsOffset, contentsEnd, trailingLength}));
    }

    private static byte[] md5(byte[] data) {
        try {
            return MessageDigest.getInstance("MD5").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new PdfForgeException(ErrorKind.INTERNAL, "MD5 unavailable", e);
        }
    }
}
