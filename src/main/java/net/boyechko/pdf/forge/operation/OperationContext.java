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

import java.nio.file.Path;
import java.util.List;
import net.boyechko.pdf.forge.core.EngineSettings;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;

/**
 * Everything an operation may read: its input documents and the engine settings.
 *
 * @param inputs the inputs in job order
 * @param settings engine settings in force for the job
 */
public record OperationContext(List<LoadedDocument> inputs, EngineSettings settings) {

    /**
     * One input.
     *
     * @param name display name, usually the file name
     * @param path source file, or null for in-memory input
     * @param bytes the original file bytes, or null for a document built in memory
     * @param document the decoded document, or null for operations that decode the bytes
     *     themselves
     * @param password the password the input was opened with, or null
     */
    public record LoadedDocument(
            String name, Path path, byte[] bytes, Document document, String password) {

        public static LoadedDocument of(String name, Document document) {
            return new LoadedDocument(name, null, null, document, null);
        }

        /** File name without its extension. */
        public String stem() {
            int dot = name.lastIndexOf('.');
            return dot > 0 ? name.substring(0, dot) : name;
        }
    }

    public OperationContext {
        inputs = List.copyOf(inputs);
    }

    public static OperationContext of(EngineSettings settings, LoadedDocument... inputs) {
        return new OperationContext(List.of(inputs), settings);
    }

    /** The first input. */
    public LoadedDocument single() {
        if (inputs.isEmpty()) {
            throw new PdfForgeException(ErrorKind.EMPTY_INPUT, "Operation needs an input document");
        }
        return inputs.get(0);
    }

    public Document document() {
        return single().document();
    }
}
