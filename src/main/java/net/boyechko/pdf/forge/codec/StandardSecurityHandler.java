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
package net.boyechko.pdf.forge.codec;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosBoolean;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosName;
import net.boyechko.pdf.forge.cos.CosNumber;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosString;
import net.boyechko.pdf.forge.document.EncryptionState;
import net.boyechko.pdf.forge.document.EncryptionState.Algorithm;
import org.bouncycastle.crypto.engines.RC4Engine;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * The password-based standard security handler of ISO 32000: key derivation, password checks,
 * and per-object string and stream ciphers.
 *
 * <p>Revisions 2 to 4 (RC4 and AES-128) are read and written; revisions 5 and 6 (AES-256) are
 * read, and documents using them are re-encrypted with their original parameters.
 */
public final class StandardSecurityHandler {
    private static final byte[] PADDING = {
        (byte) 0x28, (byte) 0xBF, (byte) 0x4E, (byte) 0x5E, (byte) 0x4E, (byte) 0x75,
        (byte) 0x8A, (byte) 0x41, (byte) 0x64, (byte) 0x00, (byte) 0x4E, (byte) 0x56,
        (byte) 0xFF, (byte) 0xFA, (byte) 0x01, (byte) 0x08, (byte) 0x2E, (byte) 0x2E,
        (byte) 0x00, (byte) 0xB6, (byte) 0xD0, (byte) 0x68, (byte) 0x3E, (byte) 0x80,
        (byte) 0x2F, (byte) 0x0C, (byte) 0xA9, (byte) 0xFE, (byte) 0x64, (byte) 0x53,
        (byte) 0x69, (byte) 0x7A
    };
    private static final byte[] AES_SALT = {0x73, 0x41, 0x6C, 0x54};
    private static final int AES_BLOCK = 16;

    private StandardSecurityHandler() {}

    // ── Encryption dictionary ───────────────────────────────────────

    /**
     * Reads an encryption dictionary. The returned state has no file key yet.
     *
     * @throws PdfForgeException MALFORMED_DOCUMENT if the handler or revision is unsupported
     */
    public static EncryptionState fromDictionary(CosDictionary dict, byte[] fileId) {
        String filter = dict.getName("Filter").orElse("Standard");
        if (!filter.equals("Standard")) {
            throw PdfForgeException.malformed("Unsupported security handler: " + filter);
        }
        int version = dict.getInt("V", 0);
        int revision = dict.getInt("R", 2);
        int lengthBits = dict.getInt("Length", 40);
        Algorithm algorithm =
                switch (version) {
                    case 1 -> Algorithm.RC4_40;
                    case 2 -> lengthBits <= 40 ? Algorithm.RC4_40 : Algorithm.RC4_128;
                    case 4 -> cryptFilterAlgorithm(dict);
                    case 5 -> Algorithm.AES_256;
                    default ->
                            throw PdfForgeException.malformed(
                                    "Unsupported encryption version V=" + version);
                };
        byte[] owner = bytesOf(dict.get("O"));
        byte[] user = bytesOf(dict.get("U"));
        if (owner == null || user == null) {
            throw PdfForgeException.malformed("Encryption dictionary lacks /O or /U");
        }
        return new EncryptionState(
                algorithm,
                revision,
                owner,
                user,
                dict.getInt("P", 0),
                fileId == null ? new byte[0] : fileId,
                dict.getBoolean("EncryptMetadata", true),
                bytesOf(dict.get("OE")),
                bytesOf(dict.get("UE")),
                bytesOf(dict.get("Perms")),
                null);
    }

    private static Algorithm cryptFilterAlgorithm(CosDictionary dict) {
        String stmF = dict.getName("StmF").orElse("Identity");
        if (dict.get("CF") instanceof CosDictionary cf
                && cf.get(stmF) instanceof CosDictionary filter) {
            String method = filter.getName("CFM").orElse("None");
            return switch (method) {
                case "AESV2" -> Algorithm.AES_128;
                case "AESV3" -> Algorithm.AES_256;
                default -> Algorithm.RC4_128;
            };
        }
        return Algorithm.RC4_128;
    }

    /** Writes the encryption dictionary for {@code state}. */
    public static CosDictionary toDictionary(EncryptionState state) {
        CosDictionary dict = new CosDictionary();
        dict.putName("Filter", "Standard");
        dict.putNumber("V", state.algorithm().version());
        dict.putNumber("R", state.revision());
        dict.putNumber("Length", state.algorithm().keyLength() * 8);
        dict.put("O", CosString.hex(state.ownerHash()));
        dict.put("U", CosString.hex(state.userHash()));
        dict.put("P", CosNumber.of(state.permissions()));
        if (state.algorithm().version() >= 4) {
            String method = switch (state.algorithm()) {
                case AES_128 -> "AESV2";
                case AES_256 -> "AESV3";
                default -> "V2";
            };
            CosDictionary stdCf = new CosDictionary();
            stdCf.putName("CFM", method);
            stdCf.putName("AuthEvent", "DocOpen");
            stdCf.putNumber("Length", state.algorithm().keyLength());
            CosDictionary cf = new CosDictionary();
            cf.put("StdCF", stdCf);
            dict.put("CF", cf);
            dict.putName("StmF", "StdCF");
            dict.putName("StrF", "StdCF");
            if (!state.encryptMetadata()) {
                dict.put("EncryptMetadata", CosBoolean.FALSE);
            }
        }
        if (state.algorithm() == Algorithm.AES_256) {
            dict.put("OE", CosString.hex(state.ownerKey()));
            dict.put("UE", CosString.hex(state.userKey()));
            dict.put("Perms", CosString.hex(state.encryptedPermissions()));
        }
        return dict;
    }

    // ── Creating and authenticating ─────────────────────────────────

    /**
     * Creates a new authenticated state for RC4-128 (revision 3) or AES-128 (revision 4).
     *
     * @param ownerPassword owner password; if empty, the user password is used
     */
    public static EncryptionState create(
            Algorithm algorithm,
            String userPassword,
            String ownerPassword,
            int permissions,
            byte[] fileId) {
        if (algorithm == Algorithm.AES_256) {
            throw PdfForgeException.invalidParameter("AES-256 output is not supported");
        }
        int revision = algorithm == Algorithm.AES_128 ? 4 : algorithm == Algorithm.RC4_128 ? 3 : 2;
        String owner =
                ownerPassword == null || ownerPassword.isEmpty() ? userPassword : ownerPassword;
        EncryptionState draft =
                new EncryptionState(
                        algorithm,
                        revision,
                        null,
                        null,
                        permissions,
                        fileId,
                        true,
                        null,
                        null,
                        null,
                        null);
        byte[] ownerHash = computeOwnerHash(draft, owner, userPassword);
        draft =
                new EncryptionState(
                        algorithm,
                        revision,
                        ownerHash,
                        null,
                        permissions,
                        fileId,
                        true,
                        null,
                        null,
                        null,
                        null);
        byte[] key = computeFileKey(draft, userPassword);
        byte[] userHash = computeUserHash(draft, key);
        return new EncryptionState(
                algorithm,
                revision,
                ownerHash,
                userHash,
                permissions,
                fileId,
                true,
                null,
                null,
                null,
                key);
    }

    /**
     * Tries {@code password} as user password, then as owner password.
     *
     * @return the authenticated state, or null if the password is wrong
     */
    public static EncryptionState authenticate(EncryptionState state, String password) {
        String candidate = password == null ? "" : password;
        byte[] key =
                state.algorithm() == Algorithm.AES_256
                        ? authenticateAes256(state, candidate)
                        : authenticateLegacy(state, candidate);
        return key == null ? null : state.withFileKey(key);
    }

    private static byte[] authenticateLegacy(EncryptionState state, String password) {
        byte[] key = computeFileKey(state, password);
        if (userHashMatches(state, key)) {
            return key;
        }
        byte[] userPassword = recoverUserPassword(state, password);
        key = computeFileKey(state, userPassword);
        return userHashMatches(state, key) ? key : null;
    }

    private static boolean userHashMatches(EncryptionState state, byte[] key) {
        byte[] expected = computeUserHash(state, key);
        byte[] actual = state.userHash();
        int compare = state.revision() >= 3 ? 16 : 32;
        if (actual == null || actual.length < compare) {
            return false;
        }
        return Arrays.equals(expected, 0, compare, actual, 0, compare);
    }

    /** Algorithm 2: derive the file key from a user password. */
    private static byte[] computeFileKey(EncryptionState state, String password) {
        return computeFileKey(state, pad(password));
    }

    private static byte[] computeFileKey(EncryptionState state, byte[] paddedPassword) {
        MessageDigest md5 = md5();
        md5.update(paddedPassword);
        md5.update(state.ownerHash(), 0, Math.min(32, state.ownerHash().length));
        int p = state.permissions();
        md5.update(new byte[] {(byte) p, (byte) (p >> 8), (byte) (p >> 16), (byte) (p >> 24)});
        md5.update(state.fileId());
        if (state.revision() >= 4 && !state.encryptMetadata()) {
            md5.update(new byte[] {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF});
        }
        byte[] hash = md5.digest();
        int n = state.revision() == 2 ? 5 : state.algorithm().keyLength();
        if (state.revision() >= 3) {
            for (int i = 0; i < 50; i++) {
                md5.update(hash, 0, n);
                hash = md5.digest();
            }
        }
        return Arrays.copyOf(hash, n);
    }

    /** Algorithms 4 and 5: the /U value for a file key. */
    private static byte[] computeUserHash(EncryptionState state, byte[] key) {
        if (state.revision() == 2) {
            return rc4(key, PADDING);
        }
        MessageDigest md5 = md5();
        md5.update(PADDING);
        md5.update(state.fileId());
        byte[] value = rc4(key, md5.digest());
        for (int i = 1; i <= 19; i++) {
            value = rc4(xorKey(key, i), value);
        }
        return Arrays.copyOf(value, 32);
    }

    /** Algorithm 3: the /O value. */
    private static byte[] computeOwnerHash(
            EncryptionState state, String ownerPassword, String userPassword) {
        byte[] rc4Key = ownerKey(state, ownerPassword);
        byte[] value = rc4(rc4Key, pad(userPassword));
        if (state.revision() >= 3) {
            for (int i = 1; i <= 19; i++) {
                value = rc4(xorKey(rc4Key, i), value);
            }
        }
        return value;
    }

    /** Algorithm 7: decrypt /O with the owner password to recover the padded user password. */
    private static byte[] recoverUserPassword(EncryptionState state, String ownerPassword) {
        byte[] rc4Key = ownerKey(state, ownerPassword);
        byte[] value = Arrays.copyOf(state.ownerHash(), 32);
        if (state.revision() == 2) {
            return rc4(rc4Key, value);
        }
        for (int i = 19; i >= 0; i--) {
            value = rc4(xorKey(rc4Key, i), value);
        }
        return value;
    }

    private static byte[] ownerKey(EncryptionState state, String ownerPassword) {
        MessageDigest md5 = md5();
        byte[] hash = md5.digest(pad(ownerPassword));
        int n = state.revision() == 2 ? 5 : state.algorithm().keyLength();
        if (state.revision() >= 3) {
            for (int i = 0; i < 50; i++) {
                hash = md5.digest(hash);
            }
        }
        return Arrays.copyOf(hash, n);
    }

    // ── AES-256 (revisions 5 and 6) ─────────────────────────────────

    private static byte[] authenticateAes256(EncryptionState state, String password) {
        byte[] pw = password.getBytes(StandardCharsets.UTF_8);
        if (pw.length > 127) {
            pw = Arrays.copyOf(pw, 127);
        }
        byte[] u = state.userHash();
        byte[] o = state.ownerHash();
        if (u == null || u.length < 48 || o == null || o.length < 48) {
            throw PdfForgeException.malformed("AES-256 /O or /U entry is too short");
        }
        byte[] u48 = Arrays.copyOf(u, 48);
        try {
            byte[] ownerCheck = hash2B(state, pw, Arrays.copyOfRange(o, 32, 40), u48);
            if (Arrays.equals(ownerCheck, 0, 32, o, 0, 32)) {
                byte[] intermediate = hash2B(state, pw, Arrays.copyOfRange(o, 40, 48), u48);
                return aesNoPadding(Cipher.DECRYPT_MODE, intermediate, state.ownerKey());
            }
            byte[] userCheck = hash2B(state, pw, Arrays.copyOfRange(u, 32, 40), new byte[0]);
            if (Arrays.equals(userCheck, 0, 32, u, 0, 32)) {
                byte[] intermediate =
                        hash2B(state, pw, Arrays.copyOfRange(u, 40, 48), new byte[0]);
                return aesNoPadding(Cipher.DECRYPT_MODE, intermediate, state.userKey());
            }
            return null;
        } catch (GeneralSecurityException e) {
            throw new PdfForgeException(ErrorKind.MALFORMED_DOCUMENT, "AES-256 key error", e);
        }
    }

    /** Algorithm 2.B (revision 6) or plain SHA-256 (revision 5). */
    private static byte[] hash2B(EncryptionState state, byte[] password, byte[] salt, byte[] udata)
            throws GeneralSecurityException {
        MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
        sha256.update(password);
        sha256.update(salt);
        sha256.update(udata);
        byte[] k = sha256.digest();
        if (state.revision() < 6) {
            return k;
        }
        int round = 0;
        while (true) {
            int unit = password.length + k.length + udata.length;
            byte[] k1 = new byte[unit * 64];
            for (int i = 0; i < 64; i++) {
                int off = i * unit;
                System.arraycopy(password, 0, k1, off, password.length);
                System.arraycopy(k, 0, k1, off + password.length, k.length);
                System.arraycopy(udata, 0, k1, off + password.length + k.length, udata.length);
            }
            Cipher aes = Cipher.getInstance("AES/CBC/NoPadding");
            aes.init(
                    Cipher.ENCRYPT_MODE,
                    new SecretKeySpec(Arrays.copyOf(k, 16), "AES"),
                    new IvParameterSpec(Arrays.copyOfRange(k, 16, 32)));
            byte[] e = aes.doFinal(k1);
            int sum = 0;
            for (int i = 0; i < 16; i++) {
                sum += e[i] & 0xFF;
            }
            String digest =
                    switch (sum % 3) {
                        case 0 -> "SHA-256";
                        case 1 -> "SHA-384";
                        default -> "SHA-512";
                    };
            k = MessageDigest.getInstance(digest).digest(e);
            round++;
            if (round >= 64 && (e[e.length - 1] & 0xFF) <= round - 32) {
                break;
            }
        }
        return Arrays.copyOf(k, 32);
    }

    private static byte[] aesNoPadding(int mode, byte[] key, byte[] data)
            throws GeneralSecurityException {
        if (data == null || data.length < 32) {
            throw new GeneralSecurityException("Encrypted file key is missing");
        }
        Cipher aes = Cipher.getInstance("AES/CBC/NoPadding");
        aes.init(mode, new SecretKeySpec(key, "AES"), new IvParameterSpec(new byte[AES_BLOCK]));
        return aes.doFinal(data, 0, 32);
    }

    // ── Per-object ciphers ──────────────────────────────────────────

    /** Encrypts a string or stream payload of object {@code number}. */
    public static byte[] encrypt(EncryptionState state, int number, int generation, byte[] data) {
        byte[] key = objectKey(state, number, generation);
        if (!state.algorithm().isAes()) {
            return rc4(key, data);
        }
        try {
            // Deterministic IV so that encoding the same document twice yields the same bytes.
            MessageDigest md5 = md5();
            md5.update(key);
            md5.update(data);
            byte[] iv = md5.digest();
            Cipher aes = Cipher.getInstance("AES/CBC/PKCS5Padding");
            aes.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
            byte[] body = aes.doFinal(data);
            byte[] out = new byte[AES_BLOCK + body.length];
            System.arraycopy(iv, 0, out, 0, AES_BLOCK);
            System.arraycopy(body, 0, out, AES_BLOCK, body.length);
            return out;
        } catch (GeneralSecurityException e) {
            throw new PdfForgeException(ErrorKind.INTERNAL, "AES encryption failed", e);
        }
    }

    /** Decrypts a string or stream payload of object {@code number}. */
    public static byte[] decrypt(EncryptionState state, int number, int generation, byte[] data) {
        byte[] key = objectKey(state, number, generation);
        if (!state.algorithm().isAes()) {
            return rc4(key, data);
        }
        if (data.length < AES_BLOCK) {
            return new byte[0];
        }
        IvParameterSpec iv = new IvParameterSpec(Arrays.copyOf(data, AES_BLOCK));
        SecretKeySpec spec = new SecretKeySpec(key, "AES");
        int bodyLength = (data.length - AES_BLOCK) / AES_BLOCK * AES_BLOCK;
        try {
            Cipher aes = Cipher.getInstance("AES/CBC/PKCS5Padding");
            aes.init(Cipher.DECRYPT_MODE, spec, iv);
            return aes.doFinal(data, AES_BLOCK, bodyLength);
        } catch (BadPaddingException e) {
            try {
                Cipher raw = Cipher.getInstance("AES/CBC/NoPadding");
                raw.init(Cipher.DECRYPT_MODE, spec, iv);
                return raw.doFinal(data, AES_BLOCK, bodyLength);
            } catch (GeneralSecurityException inner) {
                throw new PdfForgeException(
                        ErrorKind.MALFORMED_DOCUMENT, "AES decryption failed", inner);
            }
        } catch (GeneralSecurityException e) {
            throw new PdfForgeException(ErrorKind.MALFORMED_DOCUMENT, "AES decryption failed", e);
        }
    }

    /** Algorithm 1: the per-object key. AES-256 uses the file key directly. */
    static byte[] objectKey(EncryptionState state, int number, int generation) {
        byte[] fileKey = state.fileKey();
        if (fileKey == null) {
            throw new PdfForgeException(ErrorKind.WRONG_PASSWORD, "Document is not unlocked");
        }
        if (state.algorithm() == Algorithm.AES_256) {
            return fileKey;
        }
        MessageDigest md5 = md5();
        md5.update(fileKey);
        md5.update(
                new byte[] {
                    (byte) number,
                    (byte) (number >> 8),
                    (byte) (number >> 16),
                    (byte) generation,
                    (byte) (generation >> 8)
                });
        if (state.algorithm().isAes()) {
            md5.update(AES_SALT);
        }
        return Arrays.copyOf(md5.digest(), Math.min(fileKey.length + 5, 16));
    }

    // ── Helpers ─────────────────────────────────────────────────────

    static byte[] rc4(byte[] key, byte[] data) {
        RC4Engine engine = new RC4Engine();
        engine.init(true, new KeyParameter(key));
        byte[] out = new byte[data.length];
        engine.processBytes(data, 0, data.length, out, 0);
        return out;
    }

    private static byte[] xorKey(byte[] key, int value) {
        byte[] out = new byte[key.length];
        for (int i = 0; i < key.length; i++) {
            out[i] = (byte) (key[i] ^ value);
        }
        return out;
    }

    /** Pads or truncates a password to 32 bytes with the standard padding string. */
    private static byte[] pad(String password) {
        byte[] pw =
                password == null ? new byte[0] : password.getBytes(StandardCharsets.ISO_8859_1);
        byte[] out = new byte[32];
        int n = Math.min(pw.length, 32);
        System.arraycopy(pw, 0, out, 0, n);
        System.arraycopy(PADDING, 0, out, n, 32 - n);
        return out;
    }

    private static byte[] bytesOf(CosObject value) {
        return value instanceof CosString s ? s.bytes() : null;
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /** True for streams that stay in clear text regardless of the document's encryption. */
    static boolean isExemptStream(EncryptionState state, CosDictionary dict) {
        if (dict.isType("XRef")) {
            return true;
        }
        if (!state.encryptMetadata() && dict.isType("Metadata")) {
            return true;
        }
        return dict.get("Filter") instanceof CosName name && name.value().equals("Crypt");
    }
}
