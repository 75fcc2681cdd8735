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

import java.util.List;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/** Removes the selected pages. At least one page must remain. */
public class DeletePagesOperation extends AbstractOperation {

    public DeletePagesOperation() {
        super(
                OperationKind.DELETE_PAGES,
                ParameterSchema.of(ParameterSpec.pages("pages").asRequired()));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        List<Integer> indices = params.pages("pages").indices(document.pageCount());
        if (indices.size() >= document.pageCount()) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_RANGE, "Cannot delete every page of the document");
        }
        for (int i = indices.size() - 1; i >= 0; i--) {
            document.removePage(indices.get(i));
        }
        logger.debug("Deleted {} pages, {} remain", indices.size(), document.pageCount());
        return OperationResult.of(document);
    }
}
