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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.codec.PdfDecoder;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosString;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;
import net.boyechko.pdf.forge.operation.VerificationResult;

/**
 * Checks embedded signatures against the bytes they cover, or a detached {@code .p7s} against the
 * whole file. The latest embedded signature must cover the file to its end; anything appended after
 * it counts as a modification.
 */
public class VerifyOperation extends AbstractOperation {

    public VerifyOperation() {
        super(OperationKind.VERIFY, ParameterSchema.of(ParameterSpec.path("signature")));
    }

    private record EmbeddedSignature(long[] byteRange, byte[] contents) {}

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        LoadedDocument input = ctx.single();
        byte[] bytes = input.bytes();
        Document document = input.document();
        if (bytes == null) {
            bytes = PdfEncoder.encode(document);
            document = PdfDecoder.decode(bytes);
        }

        VerificationResult verification;
        if (params.has("signature")) {
            verification = CmsSignatures.verify(read(params.path("signature")), bytes, 1);
        } else {
            verification = verifyEmbedded(document, bytes);
        }
        logger.debug("{}: {}", input.name(), verification.describe());

        OperationResult.Builder result = OperationResult.builder().withVerification(verification);
        if (verification instanceof VerificationResult.Invalid) {
            result.withWarning(input.name() + ": signature " + verification.describe());
        }
        return result.withArtifact(null, YamlReport.EXTENSION, report(input, verification)).build();
    }

    static VerificationResult verifyEmbedded(Document document, byte[] bytes) {
        List<EmbeddedSignature> signatures = findSignatures(document);
        if (signatures.isEmpty()) {
            return VerificationResult.noSignature();
        }
        VerificationResult last = null;
        long furthest = -1;
        for (EmbeddedSignature signature : signatures) {
            byte[] signed = signedContent(signature.byteRange(), bytes);
            if (signed == null) {
                return VerificationResult.invalid("byte range lies outside the file");
            }
            VerificationResult checked =
                    CmsSignatures.verify(signature.contents(), signed, signatures.size());
            if (!checked.isValid()) {
                return checked;
            }
            long end = signature.byteRange()[2] + signature.byteRange()[3];
            if (end > furthest) {
                furthest = end;
                last = checked;
            }
        }
        if (furthest != bytes.length) {
            return VerificationResult.invalid("document was modified after signing");
        }
        return last;
    }

    private static List<EmbeddedSignature> findSignatures(Document document) {
        List<EmbeddedSignature> found = new ArrayList<>();
        for (int number : document.objectNumbers()) {
            if (!(document.get(number) instanceof CosDictionary dict)
                    || !PdfDecoder.isSignatureDictionary(dict)) {
                continue;
            }
            CosArray range = document.resolveArray(dict.get("ByteRange"));
            CosObject contents = document.resolve(dict.get("Contents"));
            if (range == null || range.size() != 4 || !(contents instanceof CosString string)) {
                continue;
            }
            long[] byteRange = new long[4];
            for (int i = 0; i < 4; i++) {
                byteRange[i] = (long) range.getNumber(i, -1);
            }
            found.add(new EmbeddedSignature(byteRange, string.bytes()));
        }
        return found;
    }

    /** The two covered spans joined, or null if the range does not fit in the file. */
    static byte[] signedContent(long[] range, byte[] bytes) {
        for (long value : range) {
            if (value < 0) {
                return null;
            }
        }
        if (range[0] + range[1] > range[2] || range[2] + range[3] > bytes.length) {
            return null;
        }
        byte[] signed = new byte[(int) (range[1] + range[3])];
        System.arraycopy(bytes, (int) range[0], signed, 0, (int) range[1]);
        System.arraycopy(bytes, (int) range[2], signed, (int) range[1], (int) range[3]);
        return signed;
    }

    private static byte[] read(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw PdfForgeException.io("Cannot read signature " + path, e);
        }
    }

    private static byte[] report(LoadedDocument input, VerificationResult verification) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("file", input.name());
        report.put("valid", verification.isValid());
        if (verification instanceof VerificationResult.Valid valid) {
            report.put("status", "valid");
            report.put("signer", valid.signer());
            if (valid.signingTime() != null) {
                report.put("signed-at", valid.signingTime().toString());
            }
            report.put("signatures", valid.signatureCount());
        } else if (verification instanceof VerificationResult.Invalid invalid) {
            report.put("status", "invalid");
            report.put("reason", invalid.reason());
        } else {
            report.put("status", "unsigned");
        }
        return YamlReport.render(report);
    }
}
