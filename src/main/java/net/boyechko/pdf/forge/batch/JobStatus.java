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
package net.boyechko.pdf.forge.batch;

import java.nio.file.Path;
import java.util.List;
import net.boyechko.pdf.forge.core.ErrorKind;

/**
 * Lifecycle of a job: Pending, then Running, then Succeeded or Failed; or Pending then Skipped
 * when its batch is cancelled first.
 */
public sealed interface JobStatus {

    record Pending() implements JobStatus {}

    record Running() implements JobStatus {}

    /**
     * @param outputs files written, in result order
     * @param warnings non-fatal problems met along the way
     */
    record Succeeded(List<Path> outputs, List<String> warnings) implements JobStatus {
        public Succeeded {
            outputs = List.copyOf(outputs);
            warnings = List.copyOf(warnings);
        }
    }

    record Failed(ErrorKind kind, String reason, List<String> warnings) implements JobStatus {
        public Failed {
            warnings = List.copyOf(warnings);
        }
    }

    record Skipped() implements JobStatus {}

    static JobStatus pending() {
        return new Pending();
    }

    static JobStatus running() {
        return new Running();
    }

    static JobStatus succeeded(List<Path> outputs, List<String> warnings) {
        return new Succeeded(outputs, warnings);
    }

    static JobStatus failed(ErrorKind kind, String reason, List<String> warnings) {
        return new Failed(kind, reason, warnings);
    }

    static JobStatus skipped() {
        return new Skipped();
    }

    default boolean isTerminal() {
        return this instanceof Succeeded || this instanceof Failed || this instanceof Skipped;
    }

    default String label() {
        if (this instanceof Pending) {
            return "pending";
        }
        if (this instanceof Running) {
            return "running";
        }
        if (this instanceof Succeeded) {
            return "succeeded";
        }
        if (this instanceof Failed) {
            return "failed";
        }
        return "skipped";
    }
}
