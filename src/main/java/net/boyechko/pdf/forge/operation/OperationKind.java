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

import java.util.Arrays;
import java.util.stream.Collectors;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;

/** Every operation the engine can run, with its input arity and output naming prefix. */
public enum OperationKind {
    BLANK("blank", 0, 0, "blank", "Create a document of blank pages"),
    MERGE("merge", 1, Integer.MAX_VALUE, "merged", "Concatenate documents"),
    SPLIT("split", 1, 1, "split", "Split into page ranges"),
    ROTATE("rotate", 1, 1, "rotated", "Rotate pages"),
    REORDER("reorder", 1, 1, "reordered", "Reorder pages"),
    DELETE_PAGES("delete-pages", 1, 1, "trimmed", "Delete pages"),
    COMPRESS("compress", 1, 1, "compressed", "Recompress images and streams"),
    ENCRYPT("encrypt", 1, 1, "encrypted", "Password-protect a document"),
    DECRYPT("decrypt", 1, 1, "decrypted", "Remove password protection"),
    SIGN("sign", 1, 1, "signed", "Add a digital signature"),
    VERIFY("verify", 1, 1, "verified", "Verify digital signatures"),
    WATERMARK("watermark", 1, 1, "watermarked", "Stamp a text watermark"),
    ADD_TEXT("add-text", 1, 1, "annotated", "Add text to pages"),
    ADD_IMAGE("add-image", 1, 1, "stamped", "Add an image to pages"),
    PAGINATE("paginate", 1, 1, "paginated", "Add page numbers"),
    EXTRACT_TEXT("extract-text", 1, 1, "text", "Extract text"),
    EXTRACT_IMAGES("extract-images", 1, 1, "images", "Extract images"),
    METADATA("metadata", 1, 1, "updated", "Edit document metadata"),
    INFO("info", 1, 1, "info", "Report document properties"),
    VALIDATE("validate", 1, 1, "validated", "Check document structure"),
    COMPARE("compare", 2, 2, "compared", "Compare two documents"),
    REPAIR("repair", 1, 1, "repaired", "Rebuild a damaged document"),
    OCR("ocr", 1, 1, "ocr", "Add a searchable text layer");

    private final String id;
    private final int minInputs;
    private final int maxInputs;
    private final String outputPrefix;
    private final String description;

    OperationKind(
            String id, int minInputs, int maxInputs, String outputPrefix, String description) {
        this.id = id;
        this.minInputs = minInputs;
        this.maxInputs = maxInputs;
        this.outputPrefix = outputPrefix;
        this.description = description;
    }

    public String id() {
        return id;
    }

    public int minInputs() {
        return minInputs;
    }

    public int maxInputs() {
        return maxInputs;
    }

    /** Prefix of derived output names, as in {@code compressed_report.pdf}. */
    public String outputPrefix() {
        return outputPrefix;
    }

    public String description() {
        return description;
    }

    /** Operations that may run on an encrypted document that has not been opened. */
    public boolean acceptsSealed() {
        return this == DECRYPT || this == INFO || this == VALIDATE || this == VERIFY;
    }

    /** Operations that read the raw input bytes themselves instead of a decoded document. */
    public boolean decodesInput() {
        return this == REPAIR;
    }

    /** Operations that need the OCR engine and therefore run on the OCR pool. */
    public boolean usesOcr() {
        return this == OCR;
    }

    public static OperationKind fromId(String id) {
        for (OperationKind kind : values()) {
            if (kind.id.equalsIgnoreCase(id)) {
                return kind;
            }
        }
        throw new PdfForgeException(
                ErrorKind.INVALID_PARAMETER,
                "Unknown operation '" + id + "'; expected one of " + ids());
    }

    public static String ids() {
        return Arrays.stream(values()).map(OperationKind::id).collect(Collectors.joining(", "));
    }
}
