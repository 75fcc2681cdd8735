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
package net.boyechko.pdf.forge.ui;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.pdf.forge.batch.BatchJob;
import net.boyechko.pdf.forge.batch.JobSnapshot;
import net.boyechko.pdf.forge.batch.JobStatus;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.VerbosityLevel;
import net.boyechko.pdf.forge.operation.OperationKind;
import org.junit.jupiter.api.Test;

class BatchReporterTest {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private static final BatchJob JOB =
            BatchJob.builder(OperationKind.COMPRESS).withInput(Path.of("in", "scan.pdf")).build();

    private BatchReporter reporter(VerbosityLevel verbosity) {
        return new BatchReporter(
                new PrintStream(buffer, true, StandardCharsets.UTF_8), verbosity);
    }

    private String rendered() {
        return buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private static JobSnapshot succeeded(int index, String... warnings) {
        List<Path> outputs = List.of(Path.of("out", "compressed_scan.pdf"));
        return new JobSnapshot(index, JOB, JobStatus.succeeded(outputs, List.of(warnings)));
    }

    private static JobSnapshot failed(int index) {
        return new JobSnapshot(
                index,
                JOB,
                JobStatus.failed(ErrorKind.MALFORMED_DOCUMENT, "No %PDF- header", List.of()));
    }

    @Test
    void jobLinesAreBoxedAndSummarized() {
        BatchReporter reporter = reporter(VerbosityLevel.NORMAL);
        reporter.begin("compress: 3 job(s)");
        reporter.onJobSuccess(succeeded(0));
        reporter.onJobWarning(succeeded(1), "Image Im1 on page 2 kept as is");
        reporter.onJobSuccess(succeeded(1, "Image Im1 on page 2 kept as is"));
        reporter.onJobFailure(failed(2));
        reporter.onBatchComplete(List.of(succeeded(0), succeeded(1, "w"), failed(2)));

        String out = rendered();
        assertTrue(out.startsWith("┌─ compress: 3 job(s) ─"), out);
        assertTrue(out.contains("│ ✓ #1 compress scan.pdf: wrote compressed_scan.pdf"), out);
        assertTrue(out.contains("#2 Image Im1 on page 2 kept as is"), out);
        assertTrue(out.contains("│ ⛔️ #3 compress scan.pdf: No %PDF- header"), out);
        assertTrue(out.contains("┌─ Summary ─"), out);
        assertTrue(out.contains("│ ○ Jobs: 3"), out);
        assertTrue(out.contains("│ ✓ Succeeded: 2"), out);
        assertTrue(out.contains("Warnings: 1"), out);
        assertTrue(out.contains("│ ⛔️ Failed: 1"), out);
        assertFalse(out.contains("Skipped"), out);
        assertTrue(out.endsWith("└─╯\n"), out);
    }

    @Test
    void quietShowsOnlyFailures() {
        BatchReporter reporter = reporter(VerbosityLevel.QUIET);
        reporter.begin("compress: 2 job(s)");
        reporter.onJobSuccess(succeeded(0));
        reporter.onJobFailure(failed(1));
        reporter.onBatchComplete(List.of(succeeded(0), failed(1)));

        assertEquals(
                List.of(
                        "│ ⛔️ #2 compress scan.pdf: No %PDF- header",
                        "│ ⛔️ Failed: 1"),
                List.of(rendered().split("\n")));
    }

    @Test
    void jobStartIsShownOnlyWhenVerbose() {
        JobSnapshot running = new JobSnapshot(0, JOB, JobStatus.running());

        reporter(VerbosityLevel.NORMAL).onJobStart(running);
        assertEquals("", rendered());

        reporter(VerbosityLevel.VERBOSE).onJobStart(running);
        assertEquals("│ ○ #1 compress scan.pdf\n", rendered());
    }

    @Test
    void skippedJobsAreCounted() {
        BatchReporter reporter = reporter(VerbosityLevel.NORMAL);
        JobSnapshot skipped = new JobSnapshot(0, JOB, JobStatus.skipped());
        reporter.onJobSkipped(skipped);
        reporter.onBatchComplete(List.of(skipped));

        String out = rendered();
        assertTrue(out.contains("│ ○ #1 compress scan.pdf: skipped"), out);
        assertTrue(out.contains("│ ○ Skipped: 1"), out);
    }

    @Test
    void longMessagesWrapAtWordBoundaries() {
        String message = "word ".repeat(30).trim();
        List<String> lines = BatchReporter.wordWrap(message, 80);

        assertEquals(2, lines.size());
        assertTrue(lines.get(0).length() <= 80);
        assertEquals(message, String.join(" ", lines));
        assertEquals(List.of(), BatchReporter.wordWrap("", 80));
    }
}
