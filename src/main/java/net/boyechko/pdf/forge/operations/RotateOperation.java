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

import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.Page;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/** Adds a clockwise rotation to the selected pages. */
public class RotateOperation extends AbstractOperation {

    public RotateOperation() {
        super(
                OperationKind.ROTATE,
                ParameterSchema.of(
                        ParameterSpec.integer("angle", 90), ParameterSpec.pages("pages")));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        int angle = params.integer("angle");
        if (angle % 90 != 0) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_ANGLE, "Rotation must be a multiple of 90: " + angle);
        }
        Document document = ctx.document();
        for (int index : params.pages("pages").indices(document.pageCount())) {
            Page page = document.page(index);
            page.setRotation(page.rotation() + angle);
        }
        return OperationResult.of(document);
    }
}
