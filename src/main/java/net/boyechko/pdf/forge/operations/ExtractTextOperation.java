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

import java.nio.charset.StandardCharsets;
import java.util.List;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.ocr.PageText;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/** Extracts the text layer as UTF-8, one form feed between pages. */
public class ExtractTextOperation extends AbstractOperation {
    static final String PAGE_SEPARATOR = "\f";

    public ExtractTextOperation() {
        super(OperationKind.EXTRACT_TEXT, ParameterSchema.of(ParameterSpec.pages("pages")));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        List<Integer> indices = params.pages("pages").indices(document.pageCount());
        StringBuilder text = new StringBuilder();
        boolean any = false;
        try (PageText pages = PageText.open(document)) {
            for (int i = 0; i < indices.size(); i++) {
                if (i > 0) {
                    text.append(PAGE_SEPARATOR);
                }
                String page = pages.text(indices.get(i));
                any |= !page.isBlank();
                text.append(page);
            }
        }
        OperationResult.Builder result = OperationResult.builder();
        if (!any) {
            result.withWarning(
                    ctx.single().name() + " has no text layer; run ocr first for scanned pages");
        }
        return result.withArtifact(null, "txt", text.toString().getBytes(StandardCharsets.UTF_8))
                .build();
    }
}
