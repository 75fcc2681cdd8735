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
import net.boyechko.pdf.forge.codec.StandardSecurityHandler;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/** Removes encryption. A document still sealed is re-opened with the given password first. */
public class DecryptOperation extends AbstractOperation {

    public DecryptOperation() {
        super(OperationKind.DECRYPT, ParameterSchema.of(ParameterSpec.text("password", null)));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        LoadedDocument input = ctx.single();
        String password = params.text("password");
        Document document = input.document();
        OperationResult.Builder result = OperationResult.builder();

        if (document.isSealed()) {
            if (password == null || input.bytes() == null) {
                throw new PdfForgeException(
                        ErrorKind.WRONG_PASSWORD, input.name() + " needs a password to decrypt");
            }
            document = PdfDecoder.decode(input.bytes(), DecodeOptions.withPassword(password));
        } else if (document.isEncrypted()) {
            boolean wrong =
                    password != null
                            && StandardSecurityHandler.authenticate(document.encryption(), password)
                                    == null;
            if (wrong) {
                throw new PdfForgeException(
                        ErrorKind.WRONG_PASSWORD, "Password does not open " + input.name());
            }
        } else {
            result.withWarning(input.name() + " was not encrypted");
        }
        document.setEncryption(null);
        return result.withDocument(document).build();
    }
}
