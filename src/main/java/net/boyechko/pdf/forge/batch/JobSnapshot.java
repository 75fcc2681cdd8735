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

/**
 * A job and its status at one moment.
 *
 * @param index position of the job in its batch, from 0
 */
public record JobSnapshot(int index, BatchJob job, JobStatus status) {

    public boolean succeeded() {
        return status instanceof JobStatus.Succeeded;
    }

    public boolean failed() {
        return status instanceof JobStatus.Failed;
    }
}
