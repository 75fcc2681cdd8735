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
import net.boyechko.pdf.forge.document.PageBox;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/** Creates a new document of empty pages. */
public class BlankOperation extends AbstractOperation {

    public BlankOperation() {
        super(
                OperationKind.BLANK,
                ParameterSchema.of(
                        ParameterSpec.integer("pages", 1),
                        ParameterSpec.choice("size", "a4", "a4", "letter")));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        int count = params.integer("pages");
        if (count < 1) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_PARAMETER, "Page count must be positive: " + count);
        }
        PageBox size = params.choice("size").equals("letter") ? PageBox.LETTER : PageBox.A4;
        Document document = Document.blank();
        for (int i = 0; i < count; i++) {
            document.addPage(document.createPage(size));
        }
        return OperationResult.of(document);
    }
}
