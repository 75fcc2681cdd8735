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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;

/**
 * A private key with its certificate chain, read from a PKCS#12 key store.
 *
 * @param privateKey the signing key
 * @param certificate the signer's certificate
 * @param chain the full chain, signer first
 */
public record SigningKey(
        PrivateKey privateKey, X509Certificate certificate, List<X509Certificate> chain) {

    public SigningKey {
        chain = List.copyOf(chain);
    }

    /**
     * Loads a key entry from a PKCS#12 file.
     *
     * @param alias entry alias, or null for the first key entry
     */
    public static SigningKey load(Path keyStore, String password, String alias) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(keyStore);
        } catch (IOException e) {
            throw PdfForgeException.io("Cannot read key store " + keyStore, e);
        }
        char[] secret = password == null ? new char[0] : password.toCharArray();
        try {
            KeyStore store = KeyStore.getInstance("PKCS12");
            store.load(new ByteArrayInputStream(bytes), secret);
            String entry = alias != null ? alias : firstKeyAlias(store);
            if (entry == null || !store.isKeyEntry(entry)) {
                throw new PdfForgeException(
                        ErrorKind.SIGNATURE_FAILURE, "No private key entry in " + keyStore);
            }
            PrivateKey key = (PrivateKey) store.getKey(entry, secret);
            Certificate[] certificates = store.getCertificateChain(entry);
            if (certificates == null || certificates.length == 0) {
                throw new PdfForgeException(
                        ErrorKind.SIGNATURE_FAILURE,
                        "Key entry '" + entry + "' has no certificate");
            }
            List<X509Certificate> chain = new ArrayList<>();
            for (Certificate certificate : certificates) {
                chain.add((X509Certificate) certificate);
            }
            return new SigningKey(key, chain.get(0), chain);
        } catch (GeneralSecurityException | IOException e) {
            throw new PdfForgeException(
                    ErrorKind.SIGNATURE_FAILURE,
                    "Cannot open key store " + keyStore + ": " + e.getMessage(),
                    e);
        }
    }

    private static String firstKeyAlias(KeyStore store) throws GeneralSecurityException {
        for (String alias : Collections.list(store.aliases())) {
            if (store.isKeyEntry(alias)) {
                return alias;
            }
        }
        return null;
    }
}
