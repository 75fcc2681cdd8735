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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import net.boyechko.pdf.forge.codec.DecodeOptions;
import net.boyechko.pdf.forge.codec.PdfDecoder;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.core.EngineSettings;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.ocr.OcrBridge;
import net.boyechko.pdf.forge.ocr.OcrOptions;
import net.boyechko.pdf.forge.ocr.OcrReport;
import net.boyechko.pdf.forge.operation.Operation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.OperationResult.Artifact;
import net.boyechko.pdf.forge.operation.OperationResult.ResultDocument;
import net.boyechko.pdf.forge.operation.Parameters;
import net.boyechko.pdf.forge.operations.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs batches of jobs on two bounded pools: structural jobs on one, OCR-bound jobs on the other,
 * so a long recognition run never holds up the rest of the batch.
 *
 * <p>Each job moves from pending to running to exactly one terminal status. A failed job leaves
 * no files behind. Cancelling a batch skips the jobs that have not started; running jobs finish.
 */
public final class BatchProcessor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

    private final EngineSettings settings;
    private final OperationRegistry registry;
    private final OcrBridge ocr;
    private final ExecutorService workers;
    private final ExecutorService ocrWorkers;
    private final AtomicInteger batchIds = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    /** A rendered output waiting for its final name. */
    private record PendingOutput(Path desired, byte[] bytes) {}

    public BatchProcessor(EngineSettings settings) {
        this(settings, OcrBridge.standard());
    }

    public BatchProcessor(EngineSettings settings, OcrBridge ocr) {
        this.settings = settings;
        this.ocr = ocr;
        this.registry = OperationRegistry.standard(ocr);
        this.workers =
                Executors.newFixedThreadPool(
                        settings.effectiveWorkers(), namedThreads("pdf-forge-worker"));
        this.ocrWorkers =
                Executors.newFixedThreadPool(
                        settings.maxOcrWorkers(), namedThreads("pdf-forge-ocr"));
    }

    public EngineSettings settings() {
        return settings;
    }

    public BatchHandle submit(List<BatchJob> jobs) {
        return submit(jobs, BatchListener.NONE);
    }

    /** Queues every job and returns at once. */
    public BatchHandle submit(List<BatchJob> jobs, BatchListener listener) {
        if (closed.get()) {
            throw new IllegalStateException("Batch processor is closed");
        }
        List<JobState> states = new ArrayList<>(jobs.size());
        for (int i = 0; i < jobs.size(); i++) {
            states.add(new JobState(i, jobs.get(i)));
        }
        BatchHandle handle =
                new BatchHandle(
                        batchIds.incrementAndGet(),
                        states,
                        new OutputNamer(settings.overwrite()),
                        listener);
        logger.debug("Submitting {} with {} job(s)", handle, states.size());
        if (states.isEmpty()) {
            listener.onBatchComplete(List.of());
            return handle;
        }
        for (JobState state : states) {
            ExecutorService pool = state.job().isOcrBound() ? ocrWorkers : workers;
            try {
                handle.addFuture(pool.submit(() -> runJob(handle, state)));
            } catch (RejectedExecutionException e) {
                logger.warn("Job {} rejected: {}", state.job().describe(), e.getMessage());
                skip(handle, state);
            }
        }
        return handle;
    }

    /** Current status of every job, in submission order. */
    public List<JobSnapshot> poll(BatchHandle handle) {
        return handle.snapshots();
    }

    /** Skips every job of the batch that has not started yet. */
    public void cancel(BatchHandle handle) {
        if (!handle.markCancelled()) {
            return;
        }
        int skipped = 0;
        for (JobState state : handle.jobs()) {
            if (skip(handle, state)) {
                skipped++;
            }
        }
        logger.info("Cancelled {}; {} job(s) skipped", handle, skipped);
    }

    /**
     * Blocks until every job of the batch is terminal and returns the final snapshots. Waits on
     * every job even when one of the worker threads dies.
     */
    public List<JobSnapshot> await(BatchHandle handle) throws InterruptedException {
        Throwable died = null;
        for (Future<?> future : handle.futures()) {
            try {
                future.get();
            } catch (CancellationException e) {
                logger.debug("Job future of {} was cancelled", handle);
            } catch (ExecutionException e) {
                logger.error("Worker thread of {} died", handle, e.getCause());
                if (died == null) {
                    died = e.getCause();
                }
            }
        }
        List<JobSnapshot> snapshots = handle.snapshots();
        if (died != null && snapshots.stream().anyMatch(job -> !job.status().isTerminal())) {
            throw new IllegalStateException("Job thread died", died);
        }
        return snapshots;
    }

    /** Submits and waits. */
    public List<JobSnapshot> run(List<BatchJob> jobs, BatchListener listener)
            throws InterruptedException {
        return await(submit(jobs, listener));
    }

    /** Waits for in-flight jobs, then stops both pools. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        workers.shutdown();
        ocrWorkers.shutdown();
        try {
            while (!workers.awaitTermination(1, TimeUnit.MINUTES)
                    || !ocrWorkers.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.info("Waiting for running jobs to finish");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            ocrWorkers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private boolean skip(BatchHandle handle, JobState state) {
        if (!state.skip()) {
            return false;
        }
        handle.listener().onJobSkipped(state.snapshot());
        finished(handle);
        return true;
    }

    private void finished(BatchHandle handle) {
        if (handle.jobFinished()) {
            handle.listener().onBatchComplete(handle.snapshots());
        }
    }

    private void runJob(BatchHandle handle, JobState state) {
        if (!state.start()) {
            return;
        }
        BatchListener listener = handle.listener();
        BatchJob job = state.job();

        List<String> warnings = new ArrayList<>();
        List<Path> claimed = new ArrayList<>();
        AtomicFileWriter writer = new AtomicFileWriter(settings.overwrite());
        JobStatus outcome;
        try {
            listener.onJobStart(state.snapshot());
            List<PendingOutput> outputs = execute(job, warnings);
            for (String warning : warnings) {
                listener.onJobWarning(state.snapshot(), warning);
            }
            List<Path> written = write(handle.namer(), outputs, claimed, writer);
            outcome = JobStatus.succeeded(written, warnings);
        } catch (PdfForgeException e) {
            discard(handle.namer(), claimed, writer);
            logger.debug("Job {} failed: {}", job.describe(), e.getMessage());
            outcome = JobStatus.failed(e.kind(), e.getMessage(), warnings);
        } catch (RuntimeException | Error e) {
            discard(handle.namer(), claimed, writer);
            logger.error("Unexpected failure in job {}", job.describe(), e);
            outcome = JobStatus.failed(ErrorKind.INTERNAL, String.valueOf(e), warnings);
        }

        state.finish(outcome);
        try {
            if (outcome instanceof JobStatus.Succeeded) {
                listener.onJobSuccess(state.snapshot());
            } else {
                listener.onJobFailure(state.snapshot());
            }
        } finally {
            finished(handle);
        }
    }

    /** Everything up to, but not including, touching the output directory. */
    private List<PendingOutput> execute(BatchJob job, List<String> warnings) {
        Operation operation = registry.get(job.operation());
        Parameters params = operation.schema().validate(job.parameters(), settings);
        checkArity(job);

        List<LoadedDocument> inputs = load(job);
        if (job.ocrFirst() && !job.operation().usesOcr()) {
            OcrOptions options = OcrOptions.from(settings);
            for (LoadedDocument input : inputs) {
                Document document = input.document();
                if (document != null && !document.isSealed()) {
                    OcrReport report = ocr.apply(document, options);
                    logger.debug("OCR pass on {}: {}", input.name(), report);
                    warnings.addAll(report.warnings());
                }
            }
        }

        OperationResult result = operation.apply(new OperationContext(inputs, settings), params);
        warnings.addAll(result.warnings());
        return render(job, result);
    }

    private static void checkArity(BatchJob job) {
        OperationKind kind = job.operation();
        int count = job.inputs().size();
        if (count == 0 && kind.minInputs() > 0) {
            throw new PdfForgeException(ErrorKind.EMPTY_INPUT, kind.id() + " needs an input");
        }
        if (count < kind.minInputs() || count > kind.maxInputs()) {
            throw PdfForgeException.invalidParameter(
                    kind.id() + " cannot take " + count + " input(s)");
        }
    }

    private static List<LoadedDocument> load(BatchJob job) {
        DecodeOptions options =
                job.password() == null
                        ? DecodeOptions.defaults()
                        : DecodeOptions.withPassword(job.password());
        List<LoadedDocument> inputs = new ArrayList<>(job.inputs().size());
        for (Path path : job.inputs()) {
            String name = String.valueOf(path.getFileName());
            byte[] bytes;
            try {
                bytes = Files.readAllBytes(path);
            } catch (IOException e) {
                throw PdfForgeException.io("Cannot read " + path, e);
            }
            Document document =
                    job.operation().decodesInput() ? null : PdfDecoder.decode(bytes, options);
            inputs.add(new LoadedDocument(name, path, bytes, document, job.password()));
        }
        return inputs;
    }

    private List<PendingOutput> render(BatchJob job, OperationResult result) {
        Path primary = OutputNamer.primaryPath(job, settings);
        List<PendingOutput> outputs = new ArrayList<>();
        List<ResultDocument> documents = result.documents();
        for (int i = 0; i < documents.size(); i++) {
            ResultDocument document = documents.get(i);
            Path desired = primary;
            if (documents.size() > 1) {
                String label =
                        document.label() != null ? document.label() : Integer.toString(i + 1);
                desired = OutputNamer.sibling(primary, label, OutputNamer.PDF);
            }
            outputs.add(new PendingOutput(desired, PdfEncoder.encode(document.document())));
        }
        for (Artifact artifact : result.artifacts()) {
            Path desired =
                    artifact.label() == null
                            ? OutputNamer.withExtension(primary, artifact.extension())
                            : OutputNamer.sibling(
                                    primary, artifact.label(), artifact.extension());
            outputs.add(new PendingOutput(desired, artifact.bytes()));
        }
        return outputs;
    }

    /** Stages every output, then commits them together. */
    private static List<Path> write(
            OutputNamer namer,
            List<PendingOutput> outputs,
            List<Path> claimed,
            AtomicFileWriter writer) {
        Path current = null;
        try {
            for (PendingOutput output : outputs) {
                current = namer.claim(output.desired());
                claimed.add(current);
                writer.stage(current, output.bytes());
            }
            current = null;
            List<Path> written = writer.commit();
            logger.debug("Wrote {}", written);
            return written;
        } catch (IOException e) {
            throw PdfForgeException.io(
                    "Cannot write " + (current != null ? current : claimed), e);
        }
    }

    private static void discard(OutputNamer namer, List<Path> claimed, AtomicFileWriter writer) {
        writer.abort();
        for (Path path : claimed) {
            namer.release(path);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
