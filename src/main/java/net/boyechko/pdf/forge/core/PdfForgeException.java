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

/** Unchecked failure raised anywhere in the engine, tagged with an {@link ErrorKind}. */
public class PdfForgeException extends RuntimeException {
    private final ErrorKind kind;

    public PdfForgeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PdfForgeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static PdfForgeException malformed(String message) {
        return new PdfForgeException(ErrorKind.MALFORMED_DOCUMENT, message);
    }

    public static PdfForgeException invalidParameter(String message) {
        return new PdfForgeException(ErrorKind.INVALID_PARAMETER, message);
    }

    public static PdfForgeException io(String message, Throwable cause) {
        return new PdfForgeException(ErrorKind.IO_FAILURE, message, cause);
    }

    @Override
    public String toString() {
        return kind.label() + ": " + getMessage();
    }
}
