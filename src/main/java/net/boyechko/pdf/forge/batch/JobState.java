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

import java.util.concurrent.atomic.AtomicReference;

/** Mutable holder of a job's status. Every transition is a compare-and-set, so it happens once. */
final class JobState {
    private final int index;
    private final BatchJob job;
    private final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.pending());

    JobState(int index, BatchJob job) {
        this.index = index;
        this.job = job;
    }

    BatchJob job() {
        return job;
    }

    JobStatus status() {
        return status.get();
    }

    /** Pending to Running. False if the job was skipped or already started. */
    boolean start() {
        JobStatus current = status.get();
        return current instanceof JobStatus.Pending
                && status.compareAndSet(current, JobStatus.running());
    }

    /** Pending to Skipped. False if the job already started. */
    boolean skip() {
        JobStatus current = status.get();
        return current instanceof JobStatus.Pending
                && status.compareAndSet(current, JobStatus.skipped());
    }

    /** Running to a terminal status. */
    boolean finish(JobStatus terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        JobStatus current = status.get();
        return current instanceof JobStatus.Running && status.compareAndSet(current, terminal);
    }

    JobSnapshot snapshot() {
        return new JobSnapshot(index, job, status.get());
    }
}
