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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.boyechko.pdf.forge.core.EngineSettings;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.ocr.OcrBridge;
import net.boyechko.pdf.forge.ocr.OcrOptions;
import net.boyechko.pdf.forge.ocr.OcrReport;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Adds a recognized text layer to pages without text.
 *
 * <p>Besides the document, the result carries a {@code text} YAML artifact with the text of every
 * page and where it came from. With {@code search}, the artifact also lists each occurrence of the
 * term with its surrounding text.
 */
public class OcrOperation extends AbstractOperation {
    static final String TEXT_LABEL = "text";

    private final OcrBridge bridge;

    public OcrOperation(OcrBridge bridge) {
        super(
                OperationKind.OCR,
                ParameterSchema.of(
                        ParameterSpec.text("language", null)
                                .withSettingsDefault(EngineSettings::ocrLanguage),
                        ParameterSpec.integer("dpi", null)
                                .withSettingsDefault(s -> String.valueOf(s.ocrDpi())),
                        ParameterSpec.integer("min-text-runs", null)
                                .withSettingsDefault(s -> String.valueOf(s.ocrMinTextRuns())),
                        ParameterSpec.decimal("min-confidence", 0.0),
                        ParameterSpec.text("search", null),
                        ParameterSpec.bool("match-case", false)));
        this.bridge = bridge;
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        OcrOptions options;
        try {
            options =
                    new OcrOptions(
                            params.text("language"),
                            params.integer("dpi"),
                            params.integer("min-text-runs"),
                            params.decimal("min-confidence"));
        } catch (IllegalArgumentException e) {
            throw PdfForgeException.invalidParameter(e.getMessage());
        }
        String term = params.text("search", "");
        if (params.has("search") && term.isBlank()) {
            throw PdfForgeException.invalidParameter("search term must not be blank");
        }
        OcrReport report = bridge.apply(document, options);

        Map<String, Object> text = new LinkedHashMap<>();
        text.put("summary", summary(report));
        text.put("pages", pages(report));
        if (!term.isEmpty()) {
            text.put("search", search(report, term, params.bool("match-case")));
        }
        return OperationResult.builder()
                .withDocument(document)
                .withArtifact(TEXT_LABEL, YamlReport.EXTENSION, YamlReport.render(text))
                .withWarnings(report.warnings())
                .build();
    }

    private static Map<String, Object> summary(OcrReport report) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("pages-examined", report.pagesExamined());
        summary.put("pages-recognized", report.pagesRecognized());
        summary.put("pages-skipped", report.pagesSkipped());
        summary.put("spans", report.spanCount());
        summary.put("mean-confidence", round(report.meanConfidence()));
        summary.put("low-confidence-pages", report.doubtfulPages());
        return summary;
    }

    private static List<Map<String, Object>> pages(OcrReport report) {
        List<Map<String, Object>> pages = new ArrayList<>();
        for (OcrReport.PageResult page : report.pages()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("page", page.page());
            entry.put("source", sourceName(page.source()));
            if (page.source() == OcrReport.TextSource.RECOGNIZED) {
                entry.put("confidence", round(page.confidence()));
            }
            entry.put("text", page.text());
            pages.add(entry);
        }
        return pages;
    }

    private static Map<String, Object> search(OcrReport report, String term, boolean matchCase) {
        int total = 0;
        List<Map<String, Object>> hits = new ArrayList<>();
        for (OcrReport.PageResult page : report.pages()) {
            List<TextSearch.Match> matches = TextSearch.find(page.text(), term, matchCase);
            if (matches.isEmpty()) {
                continue;
            }
            total += matches.size();
            List<Map<String, Object>> found = new ArrayList<>();
            for (TextSearch.Match match : matches) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("position", match.position());
                entry.put("line", match.line());
                entry.put("context", match.context());
                found.add(entry);
            }
            Map<String, Object> hit = new LinkedHashMap<>();
            hit.put("page", page.page());
            hit.put("count", matches.size());
            hit.put("matches", found);
            hits.add(hit);
        }
        Map<String, Object> search = new LinkedHashMap<>();
        search.put("term", term);
        search.put("match-case", matchCase);
        search.put("total", total);
        search.put("pages", hits);
        return search;
    }

    private static String sourceName(OcrReport.TextSource source) {
        return source.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
