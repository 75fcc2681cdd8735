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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.pdf.forge.core.EngineSettings;
import net.boyechko.pdf.forge.operation.OperationKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutputNamerTest {
    @TempDir Path tempDir;

    @Test
    void claimedNamesAreNotHandedOutTwice() {
        OutputNamer namer = new OutputNamer(true);
        Path desired = tempDir.resolve("merged.pdf");

        assertEquals(desired, namer.claim(desired));
        assertEquals(tempDir.resolve("merged (1).pdf"), namer.claim(desired));
        assertEquals(tempDir.resolve("merged (2).pdf"), namer.claim(desired));
    }

    @Test
    void releasedNameCanBeClaimedAgain() {
        OutputNamer namer = new OutputNamer(false);
        Path desired = tempDir.resolve("report.txt");

        Path first = namer.claim(desired);
        namer.release(first);

        assertEquals(first, namer.claim(desired));
    }

    @Test
    void existingFilesAreAvoidedUnlessOverwriting() throws Exception {
        Path existing = Files.createFile(tempDir.resolve("info.yaml"));

        assertEquals(tempDir.resolve("info (1).yaml"), new OutputNamer(false).claim(existing));
        assertEquals(existing, new OutputNamer(true).claim(existing));
    }

    @Test
    void suffixGoesBeforeTheExtension() {
        assertEquals(Path.of("a", "x (3).pdf"), OutputNamer.suffixed(Path.of("a", "x.pdf"), 3));
        assertEquals(Path.of("noext (1)"), OutputNamer.suffixed(Path.of("noext"), 1));
        assertEquals(Path.of(".hidden (1)"), OutputNamer.suffixed(Path.of(".hidden"), 1));
    }

    @Test
    void primaryPathDerivesFromOperationAndFirstInput() throws Exception {
        EngineSettings settings = EngineSettings.builder().withOutputDirectory(tempDir).build();
        BatchJob merge =
                BatchJob.builder(OperationKind.MERGE)
                        .withInput(Path.of("in", "a.pdf"))
                        .withInput(Path.of("in", "b.pdf"))
                        .build();
        BatchJob blank = BatchJob.builder(OperationKind.BLANK).build();
        Path subdir = Files.createDirectory(tempDir.resolve("sub"));
        BatchJob intoDirectory =
                BatchJob.builder(OperationKind.COMPRESS)
                        .withInput(Path.of("scan.PDF"))
                        .withOutput(subdir)
                        .build();
        BatchJob toFile =
                BatchJob.builder(OperationKind.COMPRESS)
                        .withInput(Path.of("scan.pdf"))
                        .withOutput(tempDir.resolve("small.pdf"))
                        .build();

        assertEquals(tempDir.resolve("merged_a.pdf"), OutputNamer.primaryPath(merge, settings));
        assertEquals(tempDir.resolve("blank.pdf"), OutputNamer.primaryPath(blank, settings));
        assertEquals(
                subdir.resolve("compressed_scan.pdf"),
                OutputNamer.primaryPath(intoDirectory, settings));
        assertEquals(tempDir.resolve("small.pdf"), OutputNamer.primaryPath(toFile, settings));
    }

    @Test
    void siblingsAndExtensionsShareTheStem() {
        Path primary = Path.of("out", "split_book.pdf");

        assertEquals(
                Path.of("out", "split_book_pages_1-2.pdf"),
                OutputNamer.sibling(primary, "pages_1-2", "pdf"));
        assertEquals(Path.of("out", "split_book.txt"), OutputNamer.withExtension(primary, "txt"));
    }
}
