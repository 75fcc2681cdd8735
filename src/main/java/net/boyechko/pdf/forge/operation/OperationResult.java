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
package net.boyechko.pdf.forge.operation;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.forge.document.Document;

/**
 * What an operation produced: output documents, auxiliary artifacts and warnings.
 *
 * @param documents output documents; a single unlabelled document goes to the job's output path
 * @param artifacts non-PDF outputs such as text, images and reports
 * @param warnings problems that did not stop the operation
 * @param verification signature check outcome, for {@code verify}
 */
public record OperationResult(
        List<ResultDocument> documents,
        List<Artifact> artifacts,
        List<String> warnings,
        VerificationResult verification) {

    /** An output document, with a label used to name its file when there are several. */
    public record ResultDocument(String label, Document document) {}

    /**
     * A non-PDF output.
     *
     * @param label name suffix, or null to write to the job's output path itself
     * @param extension file extension without the dot
     * @param bytes file content
     */
    public record Artifact(String label, String extension, byte[] bytes) {}

    public OperationResult {
        documents = List.copyOf(documents);
        artifacts = List.copyOf(artifacts);
        warnings = List.copyOf(warnings);
    }

    public static OperationResult of(Document document) {
        return builder().withDocument(document).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public static class Builder {
        private final List<ResultDocument> documents = new ArrayList<>();
        private final List<Artifact> artifacts = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private VerificationResult verification;

        public Builder withDocument(Document document) {
            documents.add(new ResultDocument(null, document));
            return this;
        }

        public Builder withDocument(String label, Document document) {
            documents.add(new ResultDocument(label, document));
            return this;
        }

        public Builder withArtifact(String label, String extension, byte[] bytes) {
            artifacts.add(new Artifact(label, extension, bytes));
            return this;
        }

        public Builder withWarning(String warning) {
            warnings.add(warning);
            return this;
        }

        public Builder withWarnings(List<String> more) {
            warnings.addAll(more);
            return this;
        }

        public Builder withVerification(VerificationResult verification) {
            this.verification = verification;
            return this;
        }

        public OperationResult build() {
            return new OperationResult(documents, artifacts, warnings, verification);
        }
    }
}
