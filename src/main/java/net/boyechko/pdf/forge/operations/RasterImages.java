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

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosName;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosStream;
import net.boyechko.pdf.forge.cos.filter.Filters;
import net.boyechko.pdf.forge.document.Document;

/** Conversions between image XObjects and {@link BufferedImage}s, through ImageIO. */
final class RasterImages {
    private RasterImages() {}

    /**
     * Number of color components of an image's color space: 1 for gray, 3 for RGB.
     *
     * @throws PdfForgeException UNSUPPORTED_IMAGE_FORMAT for any other color space
     */
    static int components(Document document, CosDictionary image) {
        CosObject colorSpace = document.resolve(image.get("ColorSpace"));
        if (colorSpace instanceof CosName name) {
            switch (name.value()) {
                case "DeviceGray", "CalGray", "G":
                    return 1;
                case "DeviceRGB", "CalRGB", "RGB":
                    return 3;
                default:
                    break;
            }
        } else if (colorSpace instanceof CosArray array
                && array.size() == 2
                && array.get(0) instanceof CosName family) {
            if (family.value().equals("ICCBased")) {
                CosStream profile = document.resolveStream(array.get(1));
                int n = profile != null ? profile.dictionary().getInt("N", 0) : 0;
                if (n == 1 || n == 3) {
                    return n;
                }
            } else if (family.value().equals("CalRGB")) {
                return 3;
            } else if (family.value().equals("CalGray")) {
                return 1;
            }
        }
        throw unsupported("color space " + (colorSpace == null ? "none" : colorSpace.toString()));
    }

    /** The image codec ending the stream's filter chain, or null for raw samples. */
    static String codec(CosStream stream) {
        for (Filters.FilterStep step : stream.filterChain()) {
            if (Filters.IMAGE_CODECS.contains(step.name())) {
                return step.name();
            }
        }
        return null;
    }

    static boolean isJpeg(String codec) {
        return "DCTDecode".equals(codec) || "DCT".equals(codec);
    }

    /**
     * Decodes an 8-bit gray or RGB image, either raw or JPEG-compressed.
     *
     * @throws PdfForgeException UNSUPPORTED_IMAGE_FORMAT for anything else
     */
    static BufferedImage read(Document document, CosStream stream) {
        CosDictionary dict = stream.dictionary();
        if (dict.getBoolean("ImageMask", false)) {
            throw unsupported("stencil mask");
        }
        String codec = codec(stream);
        if (codec != null && !isJpeg(codec)) {
            throw unsupported(codec);
        }
        int components = components(document, dict);
        if (isJpeg(codec)) {
            byte[] jpeg = stream.decodeGeneralFilters().data();
            try {
                BufferedImage image = ImageIO.read(new ByteArrayInputStream(jpeg));
                if (image == null) {
                    throw unsupported("unreadable JPEG data");
                }
                return image;
            } catch (IOException e) {
                throw unsupported("JPEG: " + e.getMessage());
            }
        }
        int bits = dict.getInt("BitsPerComponent", 8);
        if (bits != 8) {
            throw unsupported(bits + "-bit samples");
        }
        int width = dict.getInt("Width", 0);
        int height = dict.getInt("Height", 0);
        byte[] samples = stream.decodedData();
        if (width <= 0 || height <= 0 || samples.length < (long) width * height * components) {
            throw unsupported("truncated sample data");
        }
        // gray samples go straight into the raster; setRGB would apply a gamma conversion
        if (components == 1) {
            BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            image.getRaster()
                    .setDataElements(0, 0, width, height, Arrays.copyOf(samples, width * height));
            return image;
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] pixels = new int[width * height];
        for (int i = 0, pos = 0; i < pixels.length; i++, pos += 3) {
            pixels[i] =
                    ((samples[pos] & 0xFF) << 16)
                            | ((samples[pos + 1] & 0xFF) << 8)
                            | (samples[pos + 2] & 0xFF);
        }
        image.getRaster().setDataElements(0, 0, width, height, pixels);
        return image;
    }

    /** Scales {@code image} by {@code factor}; dimensions never drop below one pixel. */
    static BufferedImage scale(BufferedImage image, double factor) {
        int width = Math.max(1, (int) Math.round(image.getWidth() * factor));
        int height = Math.max(1, (int) Math.round(image.getHeight() * factor));
        if (width == image.getWidth() && height == image.getHeight()) {
            return image;
        }
        int type =
                image.getType() == BufferedImage.TYPE_BYTE_GRAY
                        ? BufferedImage.TYPE_BYTE_GRAY
                        : BufferedImage.TYPE_INT_RGB;
        BufferedImage scaled = new BufferedImage(width, height, type);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(
                    RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    /** Encodes {@code image} as baseline JPEG at the given quality (0..1). */
    static byte[] jpeg(BufferedImage image, float quality) {
        BufferedImage opaque = withoutAlpha(image);
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new PdfForgeException(ErrorKind.INTERNAL, "No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(stream);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(opaque, null, null), param);
        } catch (IOException e) {
            throw new PdfForgeException(ErrorKind.IO_FAILURE, "JPEG encoding failed", e);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    static byte[] png(BufferedImage image) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new PdfForgeException(ErrorKind.IO_FAILURE, "PNG encoding failed", e);
        }
        return out.toByteArray();
    }

    private static BufferedImage withoutAlpha(BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) {
            return image;
        }
        BufferedImage rgb =
                new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    static PdfForgeException unsupported(String what) {
        return new PdfForgeException(
                ErrorKind.UNSUPPORTED_IMAGE_FORMAT, "Unsupported image: " + what);
    }
}
