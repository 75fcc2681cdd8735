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
import java.util.Locale;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.DocumentInfo;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Edits the document information dictionary. Fields that are not given keep their value; an empty
 * value removes the field. The modification date is always refreshed.
 */
public class MetadataOperation extends AbstractOperation {

    public MetadataOperation() {
        super(
                OperationKind.METADATA,
                ParameterSchema.of(
                        ParameterSpec.text("title", null),
                        ParameterSpec.text("author", null),
                        ParameterSpec.text("subject", null),
                        ParameterSpec.text("keywords", null),
                        ParameterSpec.text("creator", null),
                        ParameterSpec.text("producer", null),
                        ParameterSpec.bool("clear", false)));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        DocumentInfo info = document.info();
        if (params.bool("clear")) {
            info.clear();
        }
        for (String key : DocumentInfo.TEXT_KEYS) {
            String name = key.toLowerCase(Locale.ROOT);
            if (params.has(name)) {
                info.set(key, params.text(name));
            }
        }
        info.setDate(DocumentInfo.MOD_DATE, ZonedDateTime.now());
        return OperationResult.of(document);
    }
}
