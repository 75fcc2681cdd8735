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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import net.boyechko.pdf.forge.core.EngineSettings;
import net.boyechko.pdf.forge.operation.OperationKind;

/**
 * Chooses output file names for one batch. A name already claimed by another job of the batch,
 * or naming an existing file when overwriting is off, gets a numbered suffix:
 * {@code report.pdf}, {@code report (1).pdf}, {@code report (2).pdf}.
 */
final class OutputNamer {
    static final String PDF = "pdf";

    private final boolean overwrite;
    private final Set<Path> claimed = new HashSet<>();

    OutputNamer(boolean overwrite) {
        this.overwrite = overwrite;
    }

    /** Reserves a free name as close to {@code desired} as possible. */
    synchronized Path claim(Path desired) {
        Path normalized = desired.toAbsolutePath().normalize();
        Path candidate = normalized;
        int n = 0;
        while (claimed.contains(candidate) || (!overwrite && Files.exists(candidate))) {
            candidate = suffixed(normalized, ++n);
        }
        claimed.add(candidate);
        return candidate;
    }

    synchronized void release(Path path) {
        claimed.remove(path);
    }

    static Path suffixed(Path path, int n) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";
        return path.resolveSibling(stem + " (" + n + ")" + extension);
    }

    /**
     * The main output path of a job: its output file, or a name derived from the first input in
     * its output directory (or the default one), such as {@code compressed_report.pdf}.
     */
    static Path primaryPath(BatchJob job, EngineSettings settings) {
        Path output = job.output();
        if (output != null && !Files.isDirectory(output)) {
            return output;
        }
        Path directory = output != null ? output : settings.outputDirectory();
        return directory.resolve(derivedName(job) + "." + PDF);
    }

    static String derivedName(BatchJob job) {
        OperationKind kind = job.operation();
        if (job.inputs().isEmpty()) {
            return kind.outputPrefix();
        }
        return kind.outputPrefix() + "_" + stem(job.inputs().get(0));
    }

    /** {@code dir/stem_label.ext} for a primary path {@code dir/stem.pdf}. */
    static Path sibling(Path primary, String label, String extension) {
        return primary.resolveSibling(stem(primary) + "_" + label + "." + extension);
    }

    static Path withExtension(Path primary, String extension) {
        return primary.resolveSibling(stem(primary) + "." + extension);
    }

    static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
