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
package net.boyechko.pdf.forge.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.PdfTestBase;
import net.boyechko.pdf.forge.batch.BatchJob;
import net.boyechko.pdf.forge.core.EngineSettings;
import net.boyechko.pdf.forge.core.VerbosityLevel;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.ui.cli.PdfForgeCLI.CLIConfig;
import net.boyechko.pdf.forge.ui.cli.PdfForgeCLI.CLIException;
import org.junit.jupiter.api.Test;

class PdfForgeCLITest extends PdfTestBase {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int cli(String... args) {
        return PdfForgeCLI.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static CLIConfig parse(String... args) throws CLIException {
        return PdfForgeCLI.parseArguments(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    // ── Argument parsing ───────────────────────────────────────────

    @Test
    void parsesOptionsAndParameters() throws Exception {
        Path input = createTextPdf("in.pdf", "Page");

        CLIConfig config =
                PdfForgeCLI.parseArguments(
                        new String[] {
                            "watermark",
                            "-P",
                            "text=DRAFT",
                            "--param=opacity=0.5",
                            input.toString(),
                            "-o",
                            "result.pdf",
                            "-p",
                            "secret",
                            "--overwrite",
                            "--ocr",
                            "-vv"
                        });

        assertEquals(OperationKind.WATERMARK, config.operation());
        assertEquals(Map.of("text", "DRAFT", "opacity", "0.5"), config.parameters());
        assertEquals(List.of(input), config.inputs());
        assertEquals(Path.of("result.pdf"), config.outputPath());
        assertEquals("secret", config.password());
        assertTrue(config.overwrite());
        assertTrue(config.ocrFirst());
        assertEquals(VerbosityLevel.DEBUG, config.verbosity());
    }

    @Test
    void parameterValueMayContainEquals() throws Exception {
        Path input = createTextPdf("in.pdf", "Page");
        CLIConfig config =
                PdfForgeCLI.parseArguments(
                        new String[] {"add-text", "-P", "text=a=b", input.toString()});
        assertEquals("a=b", config.parameters().get("text"));
    }

    @Test
    void blankNeedsNoInput() throws Exception {
        CLIConfig config = PdfForgeCLI.parseArguments(new String[] {"blank", "-P", "pages=2"});
        assertTrue(config.inputs().isEmpty());
    }

    @Test
    void malformedArgumentsAreRejected() throws Exception {
        Path input = createTextPdf("in.pdf", "Page");
        String in = input.toString();

        assertThrows(CLIException.class, () -> parse());
        assertThrows(CLIException.class, () -> parse("shred"));
        assertThrows(CLIException.class, () -> parse("rotate"));
        assertThrows(CLIException.class, () -> parse("rotate", "--frobnicate", in));
        assertThrows(CLIException.class, () -> parse("rotate", "-P", "angle", in));
        assertThrows(CLIException.class, () -> parse("rotate", in, "-o"));
        assertThrows(CLIException.class, () -> parse("compare", in));
        assertThrows(CLIException.class, () -> parse("rotate", "missing.pdf"));
    }

    // ── Job construction ───────────────────────────────────────────

    @Test
    void oneJobPerInputWithOutputDirectory() throws Exception {
        Path a = createTextPdf("a.pdf", "A");
        Path b = createTextPdf("b.pdf", "B");
        Path dir = tempDir.resolve("rotated");
        CLIConfig config =
                PdfForgeCLI.parseArguments(
                        new String[] {"rotate", a.toString(), b.toString(), "-o", dir.toString()});

        List<BatchJob> jobs = PdfForgeCLI.buildJobs(config, settings());

        assertEquals(2, jobs.size());
        assertEquals(List.of(a), jobs.get(0).inputs());
        assertTrue(Files.isDirectory(dir));
        assertEquals(dir, jobs.get(1).output());
    }

    @Test
    void mergeCombinesInputsIntoOneJob() throws Exception {
        Path a = createTextPdf("a.pdf", "A");
        Path b = createTextPdf("b.pdf", "B");
        CLIConfig config =
                PdfForgeCLI.parseArguments(new String[] {"merge", a.toString(), b.toString()});

        List<BatchJob> jobs = PdfForgeCLI.buildJobs(config, EngineSettings.defaults());

        assertEquals(1, jobs.size());
        assertEquals(List.of(a, b), jobs.get(0).inputs());
    }

    // ── Exit codes ─────────────────────────────────────────────────

    @Test
    void helpAndListExitCleanly() {
        assertEquals(PdfForgeCLI.EXIT_OK, cli("--help"));
        assertTrue(stdout().contains("Usage: pdf-forge"));

        assertEquals(PdfForgeCLI.EXIT_OK, cli("--list"));
        assertTrue(stdout().contains("watermark"));
        assertTrue(stdout().contains("text, required"));
        assertTrue(stdout().contains("layer (under|over), default over"));
    }

    @Test
    void successfulRunExitsZero() throws Exception {
        Path input = createTextPdf("in.pdf", "One", "Two");
        Path output = tempDir.resolve("rotated.pdf");

        int code = cli("rotate", "-P", "angle=180", input.toString(), "-o", output.toString());

        assertEquals(PdfForgeCLI.EXIT_OK, code, stderr());
        assertEquals(180, decode(output).page(1).rotation());
        assertTrue(stdout().contains("┌─ rotate: 1 job(s)"));
        assertTrue(stdout().contains("Succeeded: 1"));
    }

    @Test
    void usageErrorsExitOne() throws Exception {
        Path input = createTextPdf("in.pdf", "Page");
        Path output = tempDir.resolve("x.pdf");

        assertEquals(PdfForgeCLI.EXIT_USAGE, cli());
        assertEquals(PdfForgeCLI.EXIT_USAGE, cli("rotate", "nope.pdf", "-o", output.toString()));
        assertEquals(
                PdfForgeCLI.EXIT_USAGE,
                cli("rotate", "-P", "spin=1", input.toString(), "-o", output.toString()));
        assertEquals(
                PdfForgeCLI.EXIT_USAGE,
                cli("rotate", "-P", "angle=abc", input.toString(), "-o", output.toString()));
        assertTrue(stderr().contains("Error:"));
        assertFalse(Files.exists(output));
    }

    @Test
    void failedJobExitsTwo() throws Exception {
        Path good = createTextPdf("good.pdf", "Page");
        Path corrupt = tempDir.resolve("corrupt.pdf");
        Files.writeString(corrupt, "garbage");
        Path dir = tempDir.resolve("results");

        int code =
                cli("rotate", "-q", good.toString(), corrupt.toString(), "-o", dir.toString());

        assertEquals(PdfForgeCLI.EXIT_JOB_FAILED, code);
        assertTrue(Files.exists(dir.resolve("rotated_good.pdf")));
        assertFalse(Files.exists(dir.resolve("rotated_corrupt.pdf")));
        assertTrue(stdout().contains("corrupt.pdf"), stdout());
    }

    @Test
    void settingsFileIsApplied() throws Exception {
        Path input = createTextPdf("in.pdf", "Page");
        Path outputDir = tempDir.resolve("configured");
        Path config = tempDir.resolve("forge.yaml");
        Files.writeString(config, "output_directory: " + outputDir + "\n");

        int code = cli("rotate", "-q", "-c", config.toString(), input.toString());

        assertEquals(PdfForgeCLI.EXIT_OK, code, stderr());
        assertTrue(Files.exists(outputDir.resolve("rotated_in.pdf")));
    }
}
