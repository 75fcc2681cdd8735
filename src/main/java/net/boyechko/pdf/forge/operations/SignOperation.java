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

import java.time.ZonedDateTime;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.Page;
import net.boyechko.pdf.forge.document.PdfDate;
import net.boyechko.pdf.forge.document.PendingSignature;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Signs a document with a key from a PKCS#12 store.
 *
 * <p>In {@code embedded} mode an invisible signature field is added to the first page and the CMS
 * container is computed over the encoded file, excluding the {@code /Contents} placeholder. In
 * {@code detached} mode the document is left unchanged and a separate {@code .p7s} covers its
 * encoded bytes.
 */
public class SignOperation extends AbstractOperation {
    static final String MODE_EMBEDDED = "embedded";
    static final String MODE_DETACHED = "detached";

    /** Annotation flags: print and locked. */
    private static final int WIDGET_FLAGS = 132;
    /** AcroForm /SigFlags: signatures exist, append only. */
    private static final int SIG_FLAGS = 3;

    public SignOperation() {
        super(
                OperationKind.SIGN,
                ParameterSchema.of(
                        ParameterSpec.path("keystore").asRequired(),
                        ParameterSpec.text("keystore-password", ""),
                        ParameterSpec.text("alias", null),
                        ParameterSpec.text("reason", null),
                        ParameterSpec.text("location", null),
                        ParameterSpec.text("signer-name", null),
                        ParameterSpec.choice("mode", MODE_EMBEDDED, MODE_EMBEDDED, MODE_DETACHED)));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        SigningKey key =
                SigningKey.load(
                        params.path("keystore"),
                        params.text("keystore-password"),
                        params.text("alias"));
        String name = params.text("signer-name", CmsSignatures.commonName(key.certificate()));
        OperationResult.Builder result = OperationResult.builder();

        if (params.choice("mode").equals(MODE_DETACHED)) {
            byte[] encoded = PdfEncoder.encode(document);
            byte[] signature = CmsSignatures.sign(encoded, key);
            logger.debug("Detached signature of {} bytes by {}", signature.length, name);
            return result.withDocument(document)
                    .withArtifact("signature", "p7s", signature)
                    .build();
        }

        if (document.pageCount() == 0) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_RANGE, "Cannot sign a document with no pages");
        }
        if (countSignatureFields(document) > 0) {
            result.withWarning("Existing signatures no longer cover the rewritten file");
        }
        CosDictionary signature = signatureDictionary(name, params);
        addSignatureField(document, signature);
        document.setPendingSignature(
                new PendingSignature(
                        signature,
                        content -> CmsSignatures.sign(content, key),
                        PendingSignature.DEFAULT_CAPACITY));
        logger.debug("Embedded signature by {} will be applied on encode", name);
        return result.withDocument(document).build();
    }

    private static CosDictionary signatureDictionary(String name, Parameters params) {
        CosDictionary sig = CosDictionary.ofType("Sig");
        sig.putName("Filter", "Adobe.PPKLite");
        sig.putName("SubFilter", "adbe.pkcs7.detached");
        sig.putText("Name", name);
        sig.putText("M", PdfDate.format(ZonedDateTime.now()));
        if (params.has("reason")) {
            sig.putText("Reason", params.text("reason"));
        }
        if (params.has("location")) {
            sig.putText("Location", params.text("location"));
        }
        return sig;
    }

    private static void addSignatureField(Document document, CosDictionary signature) {
        CosReference sigRef = document.add(signature);
        Page page = document.page(0);

        CosDictionary widget = CosDictionary.ofType("Annot");
        widget.putName("Subtype", "Widget");
        widget.putName("FT", "Sig");
        widget.put("Rect", CosArray.ofNumbers(0, 0, 0, 0));
        widget.putNumber("F", WIDGET_FLAGS);
        widget.putText("T", "Signature" + (countSignatureFields(document) + 1));
        widget.put("V", sigRef);
        widget.put("P", page.reference());
        CosReference widgetRef = document.add(widget);

        CosArray annots = document.resolveArray(page.dictionary().get("Annots"));
        if (annots == null) {
            annots = new CosArray();
            page.dictionary().put("Annots", annots);
        }
        annots.add(widgetRef);

        CosDictionary catalog = document.catalog();
        CosDictionary acroForm = document.resolveDictionary(catalog.get("AcroForm"));
        if (acroForm == null) {
            acroForm = new CosDictionary();
            catalog.put("AcroForm", acroForm);
        }
        CosArray fields = document.resolveArray(acroForm.get("Fields"));
        if (fields == null) {
            fields = new CosArray();
            acroForm.put("Fields", fields);
        }
        fields.add(widgetRef);
        acroForm.putNumber("SigFlags", SIG_FLAGS);
    }

    /** Number of top-level signature fields in the AcroForm. */
    static int countSignatureFields(Document document) {
        CosDictionary acroForm = document.resolveDictionary(document.catalog().get("AcroForm"));
        if (acroForm == null) {
            return 0;
        }
        CosArray fields = document.resolveArray(acroForm.get("Fields"));
        if (fields == null) {
            return 0;
        }
        int count = 0;
        for (CosObject item : fields) {
            CosDictionary field = document.resolveDictionary(item);
            if (field != null && field.getName("FT").orElse("").equals("Sig")) {
                count++;
            }
        }
        return count;
    }
}
