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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.Page;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/** Rearranges pages into a new order that must name every page exactly once. */
public class ReorderOperation extends AbstractOperation {

    public ReorderOperation() {
        super(
                OperationKind.REORDER,
                ParameterSchema.of(ParameterSpec.text("order", null).asRequired()));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        List<Integer> order = parseOrder(params.text("order"), document.pageCount());
        checkPermutation(order, document.pageCount());
        List<Page> pages = new ArrayList<>();
        for (int number : order) {
            pages.add(document.page(number - 1));
        }
        document.setPages(pages);
        return OperationResult.of(document);
    }

    /**
     * Parses {@code 3,1,2}; ascending ranges such as {@code 4-6} expand in place. Range ends are
     * checked against {@code pageCount} before expansion.
     */
    static List<Integer> parseOrder(String text, int pageCount) {
        List<Integer> order = new ArrayList<>();
        for (String part : text.split(",")) {
            String item = part.trim();
            if (item.isEmpty()) {
                continue;
            }
            int dash = item.indexOf('-', 1);
            if (dash < 0) {
                order.add(number(item));
                continue;
            }
            int first = number(item.substring(0, dash));
            int last = number(item.substring(dash + 1));
            if (last < first) {
                throw new PdfForgeException(
                        ErrorKind.INVALID_PERMUTATION, "Reversed range in page order: " + item);
            }
            if (first < 1 || last > pageCount) {
                throw new PdfForgeException(
                        ErrorKind.INVALID_PERMUTATION,
                        "Range " + item + " is outside pages 1-" + pageCount);
            }
            if (order.size() + (last - first + 1) > pageCount) {
                throw new PdfForgeException(
                        ErrorKind.INVALID_PERMUTATION,
                        "Order lists more pages than the document's " + pageCount);
            }
            for (int page = first; page <= last; page++) {
                order.add(page);
            }
        }
        return order;
    }

    private static int number(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_PARAMETER, "Not a page number: '" + text.trim() + "'");
        }
    }

    static void checkPermutation(List<Integer> order, int pageCount) {
        if (order.size() != pageCount) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_PERMUTATION,
                    "Order lists " + order.size() + " pages but the document has " + pageCount);
        }
        Set<Integer> seen = new HashSet<>();
        for (int number : order) {
            if (number < 1 || number > pageCount) {
                throw new PdfForgeException(
                        ErrorKind.INVALID_PERMUTATION, "No page " + number + " in the document");
            }
            if (!seen.add(number)) {
                throw new PdfForgeException(
                        ErrorKind.INVALID_PERMUTATION, "Page " + number + " appears twice");
            }
        }
    }
}
