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

import java.util.List;
import net.boyechko.pdf.forge.batch.BatchListener;
import net.boyechko.pdf.forge.batch.JobSnapshot;
import net.boyechko.pdf.forge.batch.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A {@link BatchListener} that routes all events through SLF4J. */
public class LoggingListener implements BatchListener {

    private static final Logger logger =
            LoggerFactory.getLogger("net.boyechko.pdf.forge.batch.jobs");

    @Override
    public void onJobStart(JobSnapshot job) {
        logger.info("START #{} {}", job.index() + 1, job.job().describe());
    }

    @Override
    public void onJobWarning(JobSnapshot job, String warning) {
        logger.warn("WARN #{} {}", job.index() + 1, warning);
    }

    @Override
    public void onJobSuccess(JobSnapshot job) {
        if (job.status() instanceof JobStatus.Succeeded ok) {
            logger.info("OK #{} wrote {}", job.index() + 1, ok.outputs());
        }
    }

    @Override
    public void onJobFailure(JobSnapshot job) {
        if (job.status() instanceof JobStatus.Failed failed) {
            logger.error(
                    "FAILED #{} {}: [{}] {}",
                    job.index() + 1,
                    job.job().describe(),
                    failed.kind().label(),
                    failed.reason());
        }
    }

    @Override
    public void onJobSkipped(JobSnapshot job) {
        logger.info("SKIPPED #{} {}", job.index() + 1, job.job().describe());
    }

    @Override
    public void onBatchComplete(List<JobSnapshot> jobs) {
        long succeeded = jobs.stream().filter(JobSnapshot::succeeded).count();
        long failed = jobs.stream().filter(JobSnapshot::failed).count();
        logger.info(
                "SUMMARY jobs={} succeeded={} failed={} skipped={}",
                jobs.size(),
                succeeded,
                failed,
                jobs.size() - succeeded - failed);
    }
}
