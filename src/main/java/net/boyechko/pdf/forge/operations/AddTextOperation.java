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

import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.document.ContentBuilder;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.Page;
import net.boyechko.pdf.forge.document.PageBox;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Writes text at a position measured in points from the lower-left corner of each page's crop box.
 * Lines are separated by {@code \n}; the first line's baseline sits at the given position.
 */
public class AddTextOperation extends AbstractOperation {
    static final double LEADING = 1.2;

    public AddTextOperation() {
        super(
                OperationKind.ADD_TEXT,
                ParameterSchema.of(
                        ParameterSpec.text("text", null).asRequired(),
                        ParameterSpec.decimal("x", null).asRequired(),
                        ParameterSpec.decimal("y", null).asRequired(),
                        ParameterSpec.decimal("font-size", 12.0),
                        ParameterSpec.decimal("gray", 0.0),
                        ParameterSpec.choice("layer", "over", Layer.CHOICES),
                        ParameterSpec.pages("pages")));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        double size = params.decimal("font-size");
        if (size <= 0) {
            throw PdfForgeException.invalidParameter("Font size must be positive: " + size);
        }
        double gray = params.decimal("gray");
        WatermarkOperation.checkUnit("gray", gray);
        double x = params.decimal("x");
        double y = params.decimal("y");
        String[] lines = params.text("text").replace("\\n", "\n").split("\r?\n", -1);
        Layer layer = Layer.fromId(params.choice("layer"));

        StandardFont font = StandardFont.HELVETICA;
        CosReference fontRef = document.add(font.fontDictionary());
        for (int index : params.pages("pages").indices(document.pageCount())) {
            Page page = document.page(index);
            String fontName = page.addResource("Font", "F", fontRef);
            PageBox box = page.cropBox();
            ContentBuilder content =
                    new ContentBuilder()
                            .fillGray(gray)
                            .beginText()
                            .font(fontName, size)
                            .textMatrix(1, 0, 0, 1, box.llx() + x, box.lly() + y);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    content.moveText(0, -size * LEADING);
                }
                content.showText(font.encode(lines[i]));
            }
            layer.stamp(page, content.endText().toBytes());
        }
        return OperationResult.of(document);
    }
}
