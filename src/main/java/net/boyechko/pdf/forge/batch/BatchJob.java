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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.operation.OperationKind;

/**
 * One unit of batch work: an operation over its inputs.
 *
 * @param inputs input files; several only for merge and compare
 * @param operation the operation to apply
 * @param parameters raw parameter values, validated when the job runs
 * @param output output file or directory, or null for the default output directory
 * @param password password for encrypted inputs, or null
 * @param ocrFirst run OCR over the inputs before the operation
 */
public record BatchJob(
        List<Path> inputs,
        OperationKind operation,
        Map<String, String> parameters,
        Path output,
        String password,
        boolean ocrFirst) {

    public BatchJob {
        if (operation == null) {
            throw new IllegalArgumentException("Operation is required");
        }
        inputs = List.copyOf(inputs);
        parameters = Map.copyOf(parameters);
    }

    public static Builder builder(OperationKind operation) {
        return new Builder(operation);
    }

    /** OCR-bound jobs run on the dedicated OCR pool. */
    public boolean isOcrBound() {
        return operation.usesOcr() || ocrFirst;
    }

    /** Short description for logs. */
    public String describe() {
        if (inputs.isEmpty()) {
            return operation.id();
        }
        List<String> names = new ArrayList<>();
        for (Path input : inputs) {
            names.add(String.valueOf(input.getFileName()));
        }
        return operation.id() + " " + String.join(", ", names);
    }

    public static class Builder {
        private final OperationKind operation;
        private final List<Path> inputs = new ArrayList<>();
        private final Map<String, String> parameters = new LinkedHashMap<>();
        private Path output;
        private String password;
        private boolean ocrFirst;

        private Builder(OperationKind operation) {
            this.operation = operation;
        }

        public Builder withInput(Path input) {
            inputs.add(input);
            return this;
        }

        public Builder withInputs(List<Path> more) {
            inputs.addAll(more);
            return this;
        }

        public Builder withParameter(String name, String value) {
            parameters.put(name, value);
            return this;
        }

        public Builder withParameters(Map<String, String> more) {
            parameters.putAll(more);
            return this;
        }

        public Builder withOutput(Path output) {
            this.output = output;
            return this;
        }

        public Builder withPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder withOcrFirst(boolean ocrFirst) {
            this.ocrFirst = ocrFirst;
            return this;
        }

        public BatchJob build() {
            return new BatchJob(inputs, operation, parameters, output, password, ocrFirst);
        }
    }
}
