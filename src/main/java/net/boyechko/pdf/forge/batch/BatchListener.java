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

import java.util.List;

/**
 * Receives job lifecycle events. Callbacks arrive on worker threads; implementations that share
 * state must synchronize.
 */
public interface BatchListener {
    BatchListener NONE = new BatchListener() {};

    default void onJobStart(JobSnapshot job) {}

    default void onJobWarning(JobSnapshot job, String warning) {}

    default void onJobSuccess(JobSnapshot job) {}

    default void onJobFailure(JobSnapshot job) {}

    default void onJobSkipped(JobSnapshot job) {}

    /** Called once, after every job of the batch reached a terminal status. */
    default void onBatchComplete(List<JobSnapshot> jobs) {}

    /** Forwards every event to each listener in order. */
    static BatchListener of(BatchListener... listeners) {
        List<BatchListener> all = List.of(listeners);
        return new BatchListener() {
            @Override
            public void onJobStart(JobSnapshot job) {
                all.forEach(l -> l.onJobStart(job));
            }

            @Override
            public void onJobWarning(JobSnapshot job, String warning) {
                all.forEach(l -> l.onJobWarning(job, warning));
            }

            @Override
            public void onJobSuccess(JobSnapshot job) {
                all.forEach(l -> l.onJobSuccess(job));
            }

            @Override
            public void onJobFailure(JobSnapshot job) {
                all.forEach(l -> l.onJobFailure(job));
            }

            @Override
            public void onJobSkipped(JobSnapshot job) {
                all.forEach(l -> l.onJobSkipped(job));
            }

            @Override
            public void onBatchComplete(List<JobSnapshot> jobs) {
                all.forEach(l -> l.onBatchComplete(jobs));
            }
        };
    }
}
