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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.codec.StandardSecurityHandler;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.EncryptionState;
import net.boyechko.pdf.forge.document.EncryptionState.Algorithm;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/** Protects a document with the standard security handler. Encryption happens on encode. */
public class EncryptOperation extends AbstractOperation {

    public EncryptOperation() {
        super(
                OperationKind.ENCRYPT,
                ParameterSchema.of(
                        ParameterSpec.text("user-password", null).asRequired(),
                        ParameterSpec.text("owner-password", null),
                        ParameterSpec.bool("allow-print", true),
                        ParameterSpec.bool("allow-copy", true),
                        ParameterSpec.bool("allow-modify", false),
                        ParameterSpec.choice("algorithm", "aes-128", "aes-128", "rc4-128")));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        OperationResult.Builder result = OperationResult.builder();
        if (document.isEncrypted()) {
            result.withWarning("Existing encryption replaced");
        }
        String user = params.text("user-password");
        String owner = params.text("owner-password", user + "_owner");
        boolean modify = params.bool("allow-modify");
        int permissions =
                EncryptionState.permissionsOf(
                        params.bool("allow-print"), modify, params.bool("allow-copy"), modify);
        Algorithm algorithm =
                params.choice("algorithm").equals("rc4-128")
                        ? Algorithm.RC4_128
                        : Algorithm.AES_128;

        byte[] fileId = firstFileId(document);
        document.setEncryption(
                StandardSecurityHandler.create(algorithm, user, owner, permissions, fileId));
        logger.debug("Document will be encrypted with {}", algorithm);
        return result.withDocument(document).build();
    }

    /** The first /ID element, which keys the encryption. Derived from the content if missing. */
    private static byte[] firstFileId(Document document) {
        byte[][] id = document.fileId();
        if (id != null && id.length > 0 && id[0] != null && id[0].length > 0) {
            return id[0];
        }
        try {
            byte[] body = PdfEncoder.encodeUnprotected(document);
            byte[] digest = MessageDigest.getInstance("MD5").digest(body);
            document.setFileId(new byte[][] {digest, digest});
            return digest;
        } catch (NoSuchAlgorithmException e) {
            throw new PdfForgeException(ErrorKind.INTERNAL, "MD5 unavailable", e);
        }
    }
}
