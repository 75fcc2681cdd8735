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

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.forge.batch.BatchListener;
import net.boyechko.pdf.forge.batch.JobSnapshot;
import net.boyechko.pdf.forge.batch.JobStatus;
import net.boyechko.pdf.forge.core.VerbosityLevel;

/**
 * Console output for a batch run. Events from worker threads are serialized, so lines of
 * different jobs never interleave.
 */
public class BatchReporter implements BatchListener {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "️✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;

    private boolean boxOpen = false;

    public BatchReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
    }

    /** Opens the box that job lines are printed into. */
    public synchronized void begin(String title) {
        closeBoxIfOpen();
        printBoxHeader(title);
        boxOpen = true;
    }

    @Override
    public synchronized void onJobStart(JobSnapshot job) {
        printLine(prefix(job) + job.job().describe(), INFO, VerbosityLevel.VERBOSE);
    }

    @Override
    public synchronized void onJobWarning(JobSnapshot job, String warning) {
        printLine(prefix(job) + warning, WARNING);
    }

    @Override
    public synchronized void onJobSuccess(JobSnapshot job) {
        if (job.status() instanceof JobStatus.Succeeded ok) {
            String written =
                    ok.outputs().isEmpty() ? "no output" : "wrote " + fileNames(ok.outputs());
            printLine(prefix(job) + job.job().describe() + ": " + written, SUCCESS);
        }
    }

    @Override
    public synchronized void onJobFailure(JobSnapshot job) {
        if (job.status() instanceof JobStatus.Failed failed) {
            printLine(
                    prefix(job) + job.job().describe() + ": " + failed.reason(),
                    ERROR,
                    VerbosityLevel.QUIET);
        }
    }

    @Override
    public synchronized void onJobSkipped(JobSnapshot job) {
        printLine(prefix(job) + job.job().describe() + ": skipped", INFO);
    }

    @Override
    public synchronized void onBatchComplete(List<JobSnapshot> jobs) {
        int succeeded = 0;
        int failed = 0;
        int warnings = 0;
        for (JobSnapshot job : jobs) {
            if (job.status() instanceof JobStatus.Succeeded ok) {
                succeeded++;
                warnings += ok.warnings().size();
            } else if (job.status() instanceof JobStatus.Failed) {
                failed++;
            }
        }
        int skipped = jobs.size() - succeeded - failed;

        closeBoxIfOpen();
        printBoxHeader("Summary");
        printLine("Jobs: " + jobs.size(), INFO);
        printLine("Succeeded: " + succeeded, SUCCESS);
        if (warnings > 0) {
            printLine("Warnings: " + warnings, WARNING);
        }
        if (failed > 0) {
            printLine("Failed: " + failed, ERROR, VerbosityLevel.QUIET);
        }
        if (skipped > 0) {
            printLine("Skipped: " + skipped, INFO);
        }
        printBoxFooter();
    }

    public boolean shouldShow(VerbosityLevel level) {
        return verbosity.shouldShow(level);
    }

    private static String prefix(JobSnapshot job) {
        return "#" + (job.index() + 1) + " ";
    }

    private static String fileNames(List<Path> paths) {
        List<String> names = new ArrayList<>(paths.size());
        for (Path path : paths) {
            names.add(String.valueOf(path.getFileName()));
        }
        return String.join(", ", names);
    }

    private void closeBoxIfOpen() {
        if (boxOpen) {
            printBoxFooter();
            boxOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
            output.println("│");
        }
    }

    private void printBoxFooter() {
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            output.println("│");
            output.println("└─╯");
        }
    }

    /**
     * Prints an indented line with the given message and icon, word-wrapping long messages to stay
     * within the box width.
     */
    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.shouldShow(level)) {
            return;
        }
        String prefix = INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(prefix);
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    private void printLine(String message, String icon) {
        printLine(message, icon, VerbosityLevel.NORMAL);
    }

    /** Word-wraps text at word boundaries to fit within maxWidth characters per line. */
    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxWidth) {
            return List.of(text);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder currentLine = new StringBuilder();
        for (String word : text.split(" ")) {
            if (currentLine.isEmpty()) {
                currentLine.append(word);
            } else if (currentLine.length() + 1 + word.length() <= maxWidth) {
                currentLine.append(' ').append(word);
            } else {
                lines.add(currentLine.toString());
                currentLine.setLength(0);
                currentLine.append(word);
            }
        }
        if (!currentLine.isEmpty()) {
            lines.add(currentLine.toString());
        }
        return lines;
    }
}
