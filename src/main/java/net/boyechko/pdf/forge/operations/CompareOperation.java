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
package net.boyechko.pdf.forge.operations;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.DocumentInfo;
import net.boyechko.pdf.forge.ocr.PageText;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Compares two documents by page count, metadata and extracted text. Text differences are given
 * as a unified diff with {@code [page n]} markers between pages.
 */
public class CompareOperation extends AbstractOperation {

    public CompareOperation() {
        super(OperationKind.COMPARE, ParameterSchema.of(ParameterSpec.integer("context", 2)));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        LoadedDocument first = ctx.inputs().get(0);
        LoadedDocument second = ctx.inputs().get(1);
        int context = Math.max(0, params.integer("context"));

        List<Map<String, Object>> metadata =
                metadataDifferences(first.document(), second.document());
        List<String> firstLines = textLines(first.document());
        List<String> secondLines = textLines(second.document());
        Patch<String> patch = DiffUtils.diff(firstLines, secondLines);
        List<String> diff =
                UnifiedDiffUtils.generateUnifiedDiff(
                        first.name(), second.name(), firstLines, patch, context);

        boolean samePages = first.document().pageCount() == second.document().pageCount();
        boolean identical = samePages && metadata.isEmpty() && patch.getDeltas().isEmpty();

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("first", first.name());
        report.put("second", second.name());
        report.put("identical", identical);
        Map<String, Object> pages = new LinkedHashMap<>();
        pages.put("first", first.document().pageCount());
        pages.put("second", second.document().pageCount());
        report.put("pages", pages);
        report.put("metadata-differences", metadata);
        report.put("text-changes", patch.getDeltas().size());
        if (!diff.isEmpty()) {
            report.put("diff", String.join("\n", diff) + "\n");
        }
        logger.debug(
                "{} vs {}: {} text changes, {} metadata differences",
                first.name(),
                second.name(),
                patch.getDeltas().size(),
                metadata.size());
        return OperationResult.builder()
                .withArtifact(null, YamlReport.EXTENSION, YamlReport.render(report))
                .build();
    }

    private static List<Map<String, Object>> metadataDifferences(Document a, Document b) {
        Map<String, String> left = a.hasInfo() ? a.info().asMap() : Map.of();
        Map<String, String> right = b.hasInfo() ? b.info().asMap() : Map.of();
        List<Map<String, Object>> differences = new ArrayList<>();
        for (String key : DocumentInfo.TEXT_KEYS) {
            String l = left.get(key);
            String r = right.get(key);
            if (!Objects.equals(l, r)) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("field", key);
                entry.put("first", l);
                entry.put("second", r);
                differences.add(entry);
            }
        }
        return differences;
    }

    static List<String> textLines(Document document) {
        List<String> lines = new ArrayList<>();
        try (PageText text = PageText.open(document)) {
            for (int i = 0; i < text.pageCount(); i++) {
                lines.add("[page " + (i + 1) + "]");
                for (String line : text.text(i).split("\r?\n")) {
                    if (!line.isBlank()) {
                        lines.add(line.strip());
                    }
                }
            }
        }
        return lines;
    }
}
