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

import net.boyechko.pdf.forge.codec.DecodeOptions;
import net.boyechko.pdf.forge.codec.PdfDecoder;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Rebuilds a damaged file by scanning its bytes for objects, ignoring the cross-reference data.
 * Writing the result produces a fresh, consistent cross-reference table.
 */
public class RepairOperation extends AbstractOperation {

    public RepairOperation() {
        super(OperationKind.REPAIR, ParameterSchema.empty());
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        LoadedDocument input = ctx.single();
        if (input.bytes() == null) {
            return OperationResult.builder()
                    .withDocument(input.document())
                    .withWarning(input.name() + " was built in memory; nothing to repair")
                    .build();
        }
        Document document;
        try {
            document = PdfDecoder.decode(input.bytes(), new DecodeOptions(input.password(), true));
        } catch (PdfForgeException e) {
            if (e.kind() == ErrorKind.MALFORMED_DOCUMENT
                    || e.kind() == ErrorKind.BROKEN_REFERENCE) {
                throw new PdfForgeException(
                        ErrorKind.UNRECOVERABLE,
                        input.name() + " cannot be recovered: " + e.getMessage(),
                        e);
            }
            throw e;
        }
        if (document.isSealed()) {
            throw new PdfForgeException(
                    ErrorKind.WRONG_PASSWORD, input.name() + " needs a password to be repaired");
        }
        if (document.pageCount() == 0) {
            throw new PdfForgeException(
                    ErrorKind.UNRECOVERABLE, "No pages could be recovered from " + input.name());
        }
        return OperationResult.builder()
                .withDocument(document)
                .withWarning("Recovered " + document.pageCount() + " pages from " + input.name())
                .build();
    }
}
