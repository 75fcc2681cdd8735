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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.boyechko.pdf.forge.codec.PdfDecoder;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.EncryptionState;
import net.boyechko.pdf.forge.document.Page;
import net.boyechko.pdf.forge.document.PageBox;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.Parameters;

/** Reports version, page geometry, security, metadata and signatures as YAML. */
public class InfoOperation extends AbstractOperation {

    public InfoOperation() {
        super(OperationKind.INFO, ParameterSchema.empty());
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        LoadedDocument input = ctx.single();
        Document document = input.document();
        byte[] report = YamlReport.render(describe(input, document));
        return OperationResult.builder().withArtifact(null, YamlReport.EXTENSION, report).build();
    }

    static Map<String, Object> describe(LoadedDocument input, Document document) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("file", input.name());
        if (input.bytes() != null) {
            report.put("size", input.bytes().length);
        }
        report.put("version", document.version());
        report.put("pages", document.pageCount());
        report.put("page-sizes", pageSizes(document));
        report.put("objects", document.objectCount());
        report.put("recovered", document.isRecovered());
        report.put("encryption", encryption(document));
        if (document.isSealed()) {
            report.put("metadata", "unavailable without password");
        } else if (document.hasInfo()) {
            report.put("metadata", new LinkedHashMap<>(document.info().asMap()));
        } else {
            report.put("metadata", Map.of());
        }
        report.put("signatures", signatureCount(document));
        return report;
    }

    private static Map<String, Integer> pageSizes(Document document) {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        for (Page page : document.pages()) {
            PageBox box = page.mediaBox();
            int rotation = page.rotation();
            String size =
                    String.format(
                            "%.0fx%.0f", box.displayWidth(rotation), box.displayHeight(rotation));
            sizes.merge(size, 1, Integer::sum);
        }
        return sizes;
    }

    private static Object encryption(Document document) {
        EncryptionState state = document.encryption();
        if (state == null) {
            return "none";
        }
        Map<String, Object> details = new LinkedHashMap<>();
        String algorithm = state.algorithm().name().toLowerCase(Locale.ROOT).replace('_', '-');
        details.put("algorithm", algorithm);
        details.put("revision", state.revision());
        details.put("sealed", !state.isAuthenticated());
        List<String> allowed = new ArrayList<>();
        addIf(allowed, state, EncryptionState.ALLOW_PRINT, "print");
        addIf(allowed, state, EncryptionState.ALLOW_MODIFY, "modify");
        addIf(allowed, state, EncryptionState.ALLOW_COPY, "copy");
        addIf(allowed, state, EncryptionState.ALLOW_ANNOTATE, "annotate");
        addIf(allowed, state, EncryptionState.ALLOW_FILL_FORMS, "fill-forms");
        addIf(allowed, state, EncryptionState.ALLOW_ASSEMBLE, "assemble");
        details.put("permissions", allowed);
        return details;
    }

    private static void addIf(List<String> allowed, EncryptionState state, int bit, String name) {
        if (state.allows(bit)) {
            allowed.add(name);
        }
    }

    static int signatureCount(Document document) {
        int count = 0;
        for (int number : document.objectNumbers()) {
            if (document.get(number) instanceof CosDictionary dict
                    && PdfDecoder.isSignatureDictionary(dict)) {
                count++;
            }
        }
        return count;
    }
}
