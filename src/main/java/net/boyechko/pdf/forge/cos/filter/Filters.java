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
package net.boyechko.pdf.forge.cos.filter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosName;
import net.boyechko.pdf.forge.cos.CosObject;

/** Registry of the general-purpose stream filters and helpers to run a stream's filter chain. */
public final class Filters {
    private static final Map<String, StreamFilter> FILTERS =
            Map.of(
                    "FlateDecode", new FlateFilter(),
                    "Fl", new FlateFilter(),
                    "ASCIIHexDecode", new AsciiHexFilter(),
                    "AHx", new AsciiHexFilter(),
                    "ASCII85Decode", new Ascii85Filter(),
                    "A85", new Ascii85Filter(),
                    "RunLengthDecode", new RunLengthFilter(),
                    "RL", new RunLengthFilter(),
                    "LZWDecode", new LzwFilter(),
                    "LZW", new LzwFilter());

    /** Image codecs whose payload is kept as-is; decoding them is an imaging concern. */
    public static final Set<String> IMAGE_CODECS =
            Set.of(
                    "DCTDecode",
                    "DCT",
                    "JPXDecode",
                    "JBIG2Decode",
                    "CCITTFaxDecode",
                    "CCF");

    private Filters() {}

    public static boolean isSupported(String name) {
        return FILTERS.containsKey(name);
    }

    /** One filter and its decode parameters, in chain order. */
    public record FilterStep(String name, CosDictionary parms) {}

    /**
     * Reads the {@code /Filter} and {@code /DecodeParms} entries of a stream dictionary. Indirect
     * values must already be resolved by the caller.
     */
    public static List<FilterStep> chain(CosDictionary streamDict) {
        List<String> names = new ArrayList<>();
        CosObject filter = streamDict.get("Filter");
        if (filter instanceof CosName name) {
            names.add(name.value());
        } else if (filter instanceof CosArray array) {
            for (CosObject item : array) {
                if (item instanceof CosName name) {
                    names.add(name.value());
                }
            }
        }
        CosObject parms = streamDict.get("DecodeParms");
        List<FilterStep> steps = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            CosDictionary stepParms = new CosDictionary();
            if (parms instanceof CosDictionary dict && i == 0) {
                stepParms = dict;
            } else if (parms instanceof CosArray array
                    && i < array.size()
                    && array.get(i) instanceof CosDictionary dict) {
                stepParms = dict;
            }
            steps.add(new FilterStep(names.get(i), stepParms));
        }
        return steps;
    }

    /**
     * Runs the general-purpose filters of the chain. Stops before the first image codec; the
     * returned {@link Decoded} reports which codec, if any, remains applied to the data.
     *
     * @throws IOException if the chain contains an unknown filter or the data is corrupt
     */
    public static Decoded decode(byte[] data, List<FilterStep> steps) throws IOException {
        byte[] current = data;
        for (FilterStep step : steps) {
            if (IMAGE_CODECS.contains(step.name())) {
                return new Decoded(current, step.name());
            }
            StreamFilter filter = FILTERS.get(step.name());
            if (filter == null) {
                throw new IOException("Unsupported stream filter: " + step.name());
            }
            current = filter.decode(current, step.parms());
        }
        return new Decoded(current, null);
    }

    /**
     * Result of running a filter chain.
     *
     * @param data the decoded bytes
     * @param remainingCodec the image codec still applied to {@code data}, or null if fully decoded
     */
    public record Decoded(byte[] data, String remainingCodec) {
        public boolean fullyDecoded() {
            return remainingCodec == null;
        }
    }
}
