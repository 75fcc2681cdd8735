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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/** A submitted batch. Query it through {@link BatchProcessor}. */
public final class BatchHandle {
    private final int id;
    private final List<JobState> jobs;
    private final List<Future<?>> futures = new ArrayList<>();
    private final OutputNamer namer;
    private final BatchListener listener;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicInteger remaining;

    BatchHandle(int id, List<JobState> jobs, OutputNamer namer, BatchListener listener) {
        this.id = id;
        this.jobs = List.copyOf(jobs);
        this.namer = namer;
        this.listener = listener;
        this.remaining = new AtomicInteger(jobs.size());
    }

    public int id() {
        return id;
    }

    public int size() {
        return jobs.size();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** True once every job reached a terminal status. */
    public boolean isDone() {
        return remaining.get() == 0;
    }

    List<JobState> jobs() {
        return jobs;
    }

    OutputNamer namer() {
        return namer;
    }

    BatchListener listener() {
        return listener;
    }

    synchronized void addFuture(Future<?> future) {
        futures.add(future);
    }

    synchronized List<Future<?>> futures() {
        return List.copyOf(futures);
    }

    boolean markCancelled() {
        return cancelled.compareAndSet(false, true);
    }

    /** Counts one job as terminal; true for the last one. */
    boolean jobFinished() {
        return remaining.decrementAndGet() == 0;
    }

    List<JobSnapshot> snapshots() {
        List<JobSnapshot> snapshots = new ArrayList<>(jobs.size());
        for (JobState job : jobs) {
            snapshots.add(job.snapshot());
        }
        return snapshots;
    }

    @Override
    public String toString() {
        return "BatchHandle[" + id + ", " + jobs.size() + " jobs]";
    }
}
