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

import java.util.EnumMap;
import java.util.Map;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.ocr.OcrBridge;
import net.boyechko.pdf.forge.operation.Operation;
import net.boyechko.pdf.forge.operation.OperationKind;

/** Looks up the operation implementing each {@link OperationKind}. */
public final class OperationRegistry {
    private final Map<OperationKind, Operation> operations = new EnumMap<>(OperationKind.class);

    private OperationRegistry() {}

    /** All operations, with OCR through Tesseract and PDFBox. */
    public static OperationRegistry standard() {
        return standard(OcrBridge.standard());
    }

    public static OperationRegistry standard(OcrBridge ocr) {
        OperationRegistry registry = new OperationRegistry();
        registry.register(new BlankOperation());
        registry.register(new MergeOperation());
        registry.register(new SplitOperation());
        registry.register(new RotateOperation());
        registry.register(new ReorderOperation());
        registry.register(new DeletePagesOperation());
        registry.register(new CompressOperation());
        registry.register(new EncryptOperation());
        registry.register(new DecryptOperation());
        registry.register(new SignOperation());
        registry.register(new VerifyOperation());
        registry.register(new WatermarkOperation());
        registry.register(new AddTextOperation());
        registry.register(new AddImageOperation());
        registry.register(new PaginateOperation());
        registry.register(new ExtractTextOperation());
        registry.register(new ExtractImagesOperation());
        registry.register(new MetadataOperation());
        registry.register(new InfoOperation());
        registry.register(new ValidateOperation());
        registry.register(new CompareOperation());
        registry.register(new RepairOperation());
        registry.register(new OcrOperation(ocr));
        return registry;
    }

    private void register(Operation operation) {
        operations.put(operation.kind(), operation);
    }

    public Operation get(OperationKind kind) {
        Operation operation = operations.get(kind);
        if (operation == null) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_PARAMETER, "Operation not available: " + kind.id());
        }
        return operation;
    }

    public Operation get(String id) {
        return get(OperationKind.fromId(id));
    }
}
