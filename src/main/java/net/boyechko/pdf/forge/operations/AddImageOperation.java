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

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosName;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.cos.CosStream;
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
 * Places an image file on the selected pages. JPEG files are embedded unchanged; other formats
 * readable by ImageIO are stored as Flate-compressed RGB with a soft mask for transparency.
 *
 * <p>Without {@code width} and {@code height} the image is drawn at one point per pixel. With only
 * one of them, the other follows the aspect ratio.
 */
public class AddImageOperation extends AbstractOperation {

    public AddImageOperation() {
        super(
                OperationKind.ADD_IMAGE,
                ParameterSchema.of(
                        ParameterSpec.path("image").asRequired(),
                        ParameterSpec.decimal("x", null).asRequired(),
                        ParameterSpec.decimal("y", null).asRequired(),
                        ParameterSpec.decimal("width", null),
                        ParameterSpec.decimal("height", null),
                        ParameterSpec.choice("layer", "over", Layer.CHOICES),
                        ParameterSpec.pages("pages")));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        Path path = params.path("image");
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw PdfForgeException.io("Cannot read image " + path, e);
        }
        BufferedImage image = decode(bytes, path);
        CosStream xobject = imageXObject(document, bytes, image);
        CosReference imageRef = document.add(xobject);

        double[] size =
                drawSize(image, params.optionalDecimal("width"), params.optionalDecimal("height"));
        double x = params.decimal("x");
        double y = params.decimal("y");
        Layer layer = Layer.fromId(params.choice("layer"));
        for (int index : params.pages("pages").indices(document.pageCount())) {
            Page page = document.page(index);
            String name = page.addResource("XObject", "Im", imageRef);
            PageBox box = page.cropBox();
            byte[] content =
                    new ContentBuilder()
                            .transform(size[0], 0, 0, size[1], box.llx() + x, box.lly() + y)
                            .drawXObject(name)
                            .toBytes();
            layer.stamp(page, content);
        }
        logger.debug(
                "Placed {} ({}x{} px) at {} x {} pt",
                path.getFileName(),
                image.getWidth(),
                image.getHeight(),
                size[0],
                size[1]);
        return OperationResult.of(document);
    }

    private static BufferedImage decode(byte[] bytes, Path path) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                throw RasterImages.unsupported(path.getFileName() + " is not a readable image");
            }
            return image;
        } catch (IOException e) {
            throw RasterImages.unsupported(path.getFileName() + ": " + e.getMessage());
        }
    }

    static boolean isJpeg(byte[] bytes) {
        return bytes.length > 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xD8;
    }

    static CosStream imageXObject(Document document, byte[] bytes, BufferedImage image) {
        CosDictionary dict = CosDictionary.ofType("XObject");
        dict.putName("Subtype", "Image");
        dict.putNumber("Width", image.getWidth());
        dict.putNumber("Height", image.getHeight());
        dict.putNumber("BitsPerComponent", 8);
        boolean gray = image.getColorModel().getNumColorComponents() == 1;
        dict.putName("ColorSpace", gray ? "DeviceGray" : "DeviceRGB");

        if (isJpeg(bytes)) {
            int components = image.getColorModel().getNumComponents();
            if (components != 1 && components != 3) {
                throw RasterImages.unsupported("JPEG with " + components + " components");
            }
            dict.put("Filter", CosName.of("DCTDecode"));
            return new CosStream(dict, bytes);
        }

        int width = image.getWidth();
        int height = image.getHeight();
        int channels = gray ? 1 : 3;
        byte[] samples = new byte[width * height * channels];
        byte[] alpha = image.getColorModel().hasAlpha() ? new byte[width * height] : null;
        // 8-bit gray is read from the raster; getRGB would convert it from linear gray to sRGB
        Raster raster = image.getRaster();
        boolean rawGray = gray && raster.getSampleModel().getSampleSize(0) == 8;
        int pos = 0;
        for (int py = 0; py < height; py++) {
            for (int px = 0; px < width; px++) {
                int argb = image.getRGB(px, py);
                if (rawGray) {
                    samples[pos++] = (byte) raster.getSample(px, py, 0);
                } else if (gray) {
                    samples[pos++] = (byte) (argb & 0xFF);
                } else {
                    samples[pos++] = (byte) ((argb >> 16) & 0xFF);
                    samples[pos++] = (byte) ((argb >> 8) & 0xFF);
                    samples[pos++] = (byte) (argb & 0xFF);
                }
                if (alpha != null) {
                    alpha[py * width + px] = (byte) ((argb >>> 24) & 0xFF);
                }
            }
        }
        if (alpha != null) {
            CosDictionary mask = CosDictionary.ofType("XObject");
            mask.putName("Subtype", "Image");
            mask.putNumber("Width", width);
            mask.putNumber("Height", height);
            mask.putNumber("BitsPerComponent", 8);
            mask.putName("ColorSpace", "DeviceGray");
            dict.put("SMask", document.add(CosStream.ofData(mask, alpha)));
        }
        return CosStream.ofData(dict, samples);
    }

    /** Drawn width and height in points. */
    static double[] drawSize(BufferedImage image, Double width, Double height) {
        double pixelsWide = image.getWidth();
        double pixelsHigh = image.getHeight();
        if (width != null && width <= 0 || height != null && height <= 0) {
            throw PdfForgeException.invalidParameter("Image width and height must be positive");
        }
        if (width != null && height != null) {
            return new double[] {width, height};
        }
        if (width != null) {
            return new double[] {width, width * pixelsHigh / pixelsWide};
        }
        if (height != null) {
            return new double[] {height * pixelsWide / pixelsHigh, height};
        }
        return new double[] {pixelsWide, pixelsHigh};
    }
}
