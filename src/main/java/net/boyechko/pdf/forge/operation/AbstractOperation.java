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
package net.boyechko.pdf.forge.operation;

import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for operations: checks input arity and refuses sealed documents unless the kind can
 * handle them, then delegates to {@link #perform}.
 */
public abstract class AbstractOperation implements Operation {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final OperationKind kind;
    private final ParameterSchema schema;

    protected AbstractOperation(OperationKind kind, ParameterSchema schema) {
        this.kind = kind;
        this.schema = schema;
    }

    @Override
    public final OperationKind kind() {
        return kind;
    }

    @Override
    public final ParameterSchema schema() {
        return schema;
    }

    @Override
    public final OperationResult apply(OperationContext ctx, Parameters params) {
        int count = ctx.inputs().size();
        if (count == 0 && kind.minInputs() > 0) {
            throw new PdfForgeException(ErrorKind.EMPTY_INPUT, kind.id() + " needs an input");
        }
        if (count < kind.minInputs() || count > kind.maxInputs()) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_PARAMETER,
                    kind.id() + " takes " + arity() + " input(s), got " + count);
        }
        if (!kind.acceptsSealed() && !kind.decodesInput()) {
            for (OperationContext.LoadedDocument input : ctx.inputs()) {
                Document document = input.document();
                if (document != null && document.isSealed()) {
                    throw new PdfForgeException(
                            ErrorKind.WRONG_PASSWORD,
                            input.name() + " is encrypted; a password is required");
                }
            }
        }
        logger.debug("Running {} on {} input(s) with {}", kind.id(), count, params);
        return perform(ctx, params);
    }

    protected abstract OperationResult perform(OperationContext ctx, Parameters params);

    private String arity() {
        if (kind.minInputs() == kind.maxInputs()) {
            return Integer.toString(kind.minInputs());
        }
        return kind.maxInputs() == Integer.MAX_VALUE
                ? "at least " + kind.minInputs()
                : kind.minInputs() + "-" + kind.maxInputs();
    }
}
