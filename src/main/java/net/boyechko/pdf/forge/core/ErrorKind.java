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
package net.boyechko.pdf.forge.core;

/** Classifies every failure the engine can report for a job. */
public enum ErrorKind {
    MALFORMED_DOCUMENT("Malformed document"),
    BROKEN_REFERENCE("Broken object reference"),
    INVALID_RANGE("Invalid page range"),
    INVALID_PERMUTATION("Invalid page order"),
    INVALID_ANGLE("Invalid rotation angle"),
    INVALID_PARAMETER("Invalid parameter"),
    EMPTY_INPUT("No input documents"),
    WRONG_PASSWORD("Wrong password"),
    UNSUPPORTED_IMAGE_FORMAT("Unsupported image format"),
    OCR_UNAVAILABLE("OCR unavailable"),
    UNRECOVERABLE("Document cannot be recovered"),
    SIGNATURE_FAILURE("Signature failure"),
    IO_FAILURE("I/O failure"),
    INTERNAL("Internal error");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
