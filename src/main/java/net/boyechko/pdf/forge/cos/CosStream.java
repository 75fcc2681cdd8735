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
package net.boyechko.pdf.forge.cos;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.zip.Deflater;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.filter.Filters;
import net.boyechko.pdf.forge.cos.filter.FlateFilter;

/**
 * A stream object: a dictionary plus a payload kept in its encoded (filtered) form. The decoded
 * payload is computed on first access and cached until the payload changes.
 *
 * <p>Byte arrays passed in and handed out are not copied; callers must not modify them.
 */
public final class CosStream implements CosObject {
    private final CosDictionary dictionary;
    private byte[] encoded;
    private byte[] decodedCache;

    public CosStream(CosDictionary dictionary, byte[] encoded) {
        this.dictionary = dictionary;
        this.encoded = encoded;
        dictionary.putNumber("Length", encoded.length);
    }

    /** Creates a Flate-compressed stream holding {@code data}. */
    public static CosStream ofData(CosDictionary dictionary, byte[] data) {
        CosStream stream = new CosStream(dictionary, new byte[0]);
        stream.setData(data);
        return stream;
    }

    public CosDictionary dictionary() {
        return dictionary;
    }

    public byte[] encodedData() {
        return encoded;
    }

    public int encodedLength() {
        return encoded.length;
    }

    public List<Filters.FilterStep> filterChain() {
        return Filters.chain(dictionary);
    }

    /** Returns true if the filter chain ends with an image codec such as DCTDecode. */
    public boolean hasImageCodec() {
        return filterChain().stream().anyMatch(s -> Filters.IMAGE_CODECS.contains(s.name()));
    }

    /**
     * Returns the fully decoded payload.
     *
     * @throws PdfForgeException UNSUPPORTED_IMAGE_FORMAT if an image codec is applied, or
     *     MALFORMED_DOCUMENT if the payload cannot be decoded
     */
    public byte[] decodedData() {
        if (decodedCache != null) {
            return decodedCache;
        }
        Filters.Decoded decoded = decodeGeneralFilters();
        if (!decoded.fullyDecoded()) {
            throw new PdfForgeException(
                    ErrorKind.UNSUPPORTED_IMAGE_FORMAT,
                    "Stream is encoded with " + decoded.remainingCodec());
        }
        decodedCache = decoded.data();
        return decodedCache;
    }

    /** Runs the general-purpose filters, stopping before an image codec. */
    public Filters.Decoded decodeGeneralFilters() {
        try {
            return Filters.decode(encoded, filterChain());
        } catch (IOException e) {
            throw new PdfForgeException(
                    ErrorKind.MALFORMED_DOCUMENT, "Cannot decode stream: " + e.getMessage(), e);
        }
    }

    /** Replaces the payload with {@code data}, compressed with FlateDecode. */
    public void setData(byte[] data) {
        this.encoded = FlateFilter.deflate(data, Deflater.BEST_COMPRESSION);
        this.decodedCache = data;
        dictionary.putName("Filter", "FlateDecode");
        dictionary.remove("DecodeParms");
        dictionary.remove("DL");
        dictionary.putNumber("Length", encoded.length);
    }

    /**
     * Replaces the encoded payload and its filter entries.
     *
     * @param filter the new {@code /Filter} value, or null for an unfiltered payload
     * @param decodeParms the new {@code /DecodeParms} value, or null for none
     */
    public void setEncodedData(byte[] encoded, CosObject filter, CosObject decodeParms) {
        this.encoded = encoded;
        this.decodedCache = null;
        dictionary.put("Filter", filter);
        dictionary.put("DecodeParms", decodeParms);
        dictionary.putNumber("Length", encoded.length);
    }

    /** Replaces the encoded payload and keeps the filter chain, as after decryption. */
    public void replaceEncodedData(byte[] encoded) {
        this.encoded = encoded;
        this.decodedCache = null;
        dictionary.putNumber("Length", encoded.length);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CosStream other
                && dictionary.equals(other.dictionary)
                && Arrays.equals(encoded, other.encoded);
    }

    @Override
    public int hashCode() {
        return 31 * dictionary.hashCode() + Arrays.hashCode(encoded);
    }

    @Override
    public String toString() {
        return "stream" + dictionary + "[" + encoded.length + " bytes]";
    }
}
