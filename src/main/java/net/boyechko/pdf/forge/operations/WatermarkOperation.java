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

import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosDictionary;
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
 * Draws a translucent line of text across the middle of each selected page. The angle is measured
 * counterclockwise as the page is displayed, so rotated pages get the same visual result.
 */
public class WatermarkOperation extends AbstractOperation {

    public WatermarkOperation() {
        super(
                OperationKind.WATERMARK,
                ParameterSchema.of(
                        ParameterSpec.text("text", null).asRequired(),
                        ParameterSpec.decimal("opacity", 0.3),
                        ParameterSpec.decimal("font-size", 50.0),
                        ParameterSpec.decimal("angle", 45.0),
                        ParameterSpec.decimal("gray", 0.5),
                        ParameterSpec.choice("layer", "over", Layer.CHOICES),
                        ParameterSpec.pages("pages")));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        String text = params.text("text");
        double opacity = params.decimal("opacity");
        double size = params.decimal("font-size");
        double gray = params.decimal("gray");
        double angle = params.decimal("angle");
        checkUnit("opacity", opacity);
        checkUnit("gray", gray);
        if (size <= 0) {
            throw PdfForgeException.invalidParameter("Font size must be positive: " + size);
        }
        if (text.isBlank()) {
            throw new PdfForgeException(ErrorKind.INVALID_PARAMETER, "Watermark text is empty");
        }
        Layer layer = Layer.fromId(params.choice("layer"));

        StandardFont font = StandardFont.HELVETICA;
        byte[] encoded = font.encode(text);
        double width = font.width(text, size);
        CosReference fontRef = document.add(font.fontDictionary());
        CosDictionary gs = CosDictionary.ofType("ExtGState");
        gs.putNumber("ca", opacity);
        gs.putNumber("CA", opacity);
        CosReference gsRef = document.add(gs);

        int stamped = 0;
        for (int index : params.pages("pages").indices(document.pageCount())) {
            Page page = document.page(index);
            String fontName = page.addResource("Font", "F", fontRef);
            String gsName = page.addResource("ExtGState", "GS", gsRef);
            PageBox box = page.cropBox();
            double radians = Math.toRadians(angle + page.rotation());
            double cos = Math.cos(radians);
            double sin = Math.sin(radians);
            byte[] content =
                    new ContentBuilder()
                            .graphicsState(gsName)
                            .fillGray(gray)
                            .beginText()
                            .font(fontName, size)
                            .textMatrix(
                                    cos,
                                    sin,
                                    -sin,
                                    cos,
                                    (box.llx() + box.urx()) / 2,
                                    (box.lly() + box.ury()) / 2)
                            .moveText(-width / 2, -font.capHeight() * size / 2)
                            .showText(encoded)
                            .endText()
                            .toBytes();
            layer.stamp(page, content);
            stamped++;
        }
        logger.debug("Watermarked {} pages", stamped);
        return OperationResult.of(document);
    }

    static void checkUnit(String name, double value) {
        if (value < 0 || value > 1) {
            throw PdfForgeException.invalidParameter(name + " must be between 0 and 1: " + value);
        }
    }
}
