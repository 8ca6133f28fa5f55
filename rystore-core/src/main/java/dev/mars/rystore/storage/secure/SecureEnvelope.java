/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.rystore.storage.secure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Authenticated encryption of record payloads (AES-256-GCM).
 * <p>
 * <b>Encrypted format</b> (all components hex, fixed lengths):
 * <pre>
 * enc1:&lt;salt 64&gt;:&lt;nonce 24&gt;:&lt;tag 32&gt;:&lt;ciphertext&gt;
 * </pre>
 * The AES key is derived per envelope from the master key and the envelope's
 * random salt with PBKDF2-HMAC-SHA256. Derived key bytes are wiped after use.
 * <p>
 * <b>Plaintext format:</b> {@code plaintext:<json>}, written when no master key
 * is configured. Both formats are read regardless of configuration, as is
 * bare legacy JSON, so encryption can be switched on for an existing store and
 * the records migrated with {@link #reencrypt(byte[])}.
 * <p>
 * Decryption fails closed: any malformed component, wrong key or modified
 * byte in salt, nonce, tag or ciphertext raises {@link AuthenticationException}.
 */
public final class SecureEnvelope {

    private static final Logger LOG = LoggerFactory.getLogger(SecureEnvelope.class);

    public static final String ENCRYPTED_MARKER = "enc1";
    public static final String PLAINTEXT_MARKER = "plaintext";

    /** Default PBKDF2 iteration count for new stores. */
    public static final int DEFAULT_KDF_ITERATIONS = 100_000;

    static final int KEY_LENGTH = 32;
    static final int SALT_LENGTH = 32;
    static final int NONCE_LENGTH = 12;
    static final int TAG_LENGTH = 16;

    private static final String CIPHER = "AES/GCM/NoPadding";
    private static final String KDF = "PBKDF2WithHmacSHA256";
    private static final byte[] ENCRYPTED_PREFIX = (ENCRYPTED_MARKER + ":").getBytes(StandardCharsets.US_ASCII);
    private static final byte[] PLAINTEXT_PREFIX = (PLAINTEXT_MARKER + ":").getBytes(StandardCharsets.US_ASCII);
    private static final HexFormat HEX = HexFormat.of();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String masterKey;
    private final int kdfIterations;

    private SecureEnvelope(String masterKey, int kdfIterations) {
        if (kdfIterations < 1) {
            throw new IllegalArgumentException("KDF iterations must be positive: " + kdfIterations);
        }
        this.masterKey = masterKey;
        this.kdfIterations = kdfIterations;
    }

    /**
     * An envelope with no master key: writes plaintext, reads plaintext and legacy
     * records, and refuses encrypted ones.
     */
    public static SecureEnvelope plaintextOnly() {
        return new SecureEnvelope(null, DEFAULT_KDF_ITERATIONS);
    }

    /**
     * An envelope that encrypts with {@code masterKey}.
     *
     * @param masterKey     master passphrase; {@code null} or blank yields a plaintext-only envelope
     * @param kdfIterations PBKDF2 iterations; must match the value used to write existing records
     */
    public static SecureEnvelope withKey(String masterKey, int kdfIterations) {
        if (masterKey == null || masterKey.isBlank()) {
            return new SecureEnvelope(null, kdfIterations);
        }
        if (!isValidKey(masterKey)) {
            LOG.warn("Encryption key is not a base64 {}-byte key; using it as a passphrase", KEY_LENGTH);
        }
        return new SecureEnvelope(masterKey, kdfIterations);
    }

    public boolean hasKey() {
        return masterKey != null;
    }

    /**
     * Wraps a payload for storage: encrypted if a master key is configured,
     * otherwise marked as plaintext.
     */
    public byte[] seal(byte[] payload) {
        return hasKey() ? encrypt(payload) : plaintext(payload);
    }

    /**
     * Returns the payload of a plaintext, encrypted or legacy envelope.
     *
     * @throws AuthenticationException if an encrypted envelope cannot be authenticated
     * @throws IntegrityException      if the bytes are not a recognizable envelope
     */
    public byte[] open(byte[] envelope) {
        switch (detect(envelope)) {
            case ENCRYPTED:
                return decrypt(envelope);
            case PLAINTEXT:
                return Arrays.copyOfRange(envelope, PLAINTEXT_PREFIX.length, envelope.length);
            case LEGACY_JSON:
                return envelope;
            default:
                throw new IntegrityException("Unrecognized record envelope");
        }
    }

    /**
     * Marks a payload as unencrypted.
     */
    public static byte[] plaintext(byte[] payload) {
        byte[] out = Arrays.copyOf(PLAINTEXT_PREFIX, PLAINTEXT_PREFIX.length + payload.length);
        System.arraycopy(payload, 0, out, PLAINTEXT_PREFIX.length, payload.length);
        return out;
    }

    /**
     * Encrypts {@code payload} under a fresh salt and nonce.
     *
     * @throws IllegalStateException if no master key is configured
     */
    public byte[] encrypt(byte[] payload) {
        if (!hasKey()) {
            throw new IllegalStateException("No encryption key configured");
        }
        byte[] salt = randomBytes(SALT_LENGTH);
        byte[] nonce = randomBytes(NONCE_LENGTH);
        byte[] key = deriveKey(salt);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            byte[] sealed = cipher.doFinal(payload);

            // JCE appends the tag to the ciphertext; the envelope stores it separately.
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_LENGTH);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_LENGTH, sealed.length);

            String envelope = ENCRYPTED_MARKER + ":" + HEX.formatHex(salt) + ":" + HEX.formatHex(nonce) +
                    ":" + HEX.formatHex(tag) + ":" + HEX.formatHex(ciphertext);
            return envelope.getBytes(StandardCharsets.US_ASCII);
        } catch (GeneralSecurityException e) {
            LOG.error("Encryption failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to encrypt record", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * Authenticates and decrypts an encrypted envelope.
     *
     * @throws AuthenticationException on a missing or wrong key, a malformed envelope or any tampering
     */
    public byte[] decrypt(byte[] envelope) {
        if (!hasKey()) {
            throw new AuthenticationException("Record is encrypted but no encryption key is configured");
        }
        if (!isEncrypted(envelope)) {
            throw new AuthenticationException("Malformed encrypted envelope");
        }
        String[] parts = new String(envelope, StandardCharsets.US_ASCII).split(":", -1);
        byte[] salt = HEX.parseHex(parts[1]);
        byte[] nonce = HEX.parseHex(parts[2]);
        byte[] tag = HEX.parseHex(parts[3]);
        byte[] ciphertext = HEX.parseHex(parts[4]);

        byte[] sealed = Arrays.copyOf(ciphertext, ciphertext.length + TAG_LENGTH);
        System.arraycopy(tag, 0, sealed, ciphertext.length, TAG_LENGTH);

        byte[] key = deriveKey(salt);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            LOG.error("Decryption failed: authentication tag mismatch (wrong key or tampered data)");
            throw new AuthenticationException("Failed to decrypt record - wrong key or tampered data", e);
        } catch (GeneralSecurityException e) {
            LOG.error("Decryption failed: {}", e.getMessage(), e);
            throw new AuthenticationException("Failed to decrypt record", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * Returns an encrypted envelope for any readable envelope. Encrypted input
     * is returned unchanged.
     */
    public byte[] reencrypt(byte[] envelope) {
        if (isEncrypted(envelope)) {
            return envelope;
        }
        return encrypt(open(envelope));
    }

    /**
     * Structural check: marker, five components, exact lowercase hex lengths
     * for salt, nonce and tag, and an even-length hex ciphertext.
     */
    public static boolean isEncrypted(byte[] data) {
        if (data == null || !startsWith(data, ENCRYPTED_PREFIX)) {
            return false;
        }
        String[] parts = new String(data, StandardCharsets.US_ASCII).split(":", -1);
        if (parts.length != 5) {
            return false;
        }
        return parts[1].length() == SALT_LENGTH * 2
                && parts[2].length() == NONCE_LENGTH * 2
                && parts[3].length() == TAG_LENGTH * 2
                && parts[4].length() % 2 == 0
                && isHex(parts[1]) && isHex(parts[2]) && isHex(parts[3]) && isHex(parts[4]);
    }

    /**
     * Classifies envelope bytes by their leading marker.
     */
    public static EnvelopeKind detect(byte[] data) {
        if (data == null || data.length == 0) {
            return EnvelopeKind.UNKNOWN;
        }
        if (startsWith(data, ENCRYPTED_PREFIX)) {
            return EnvelopeKind.ENCRYPTED;
        }
        if (startsWith(data, PLAINTEXT_PREFIX)) {
            return EnvelopeKind.PLAINTEXT;
        }
        for (byte b : data) {
            if (b == ' ' || b == '\t' || b == '\r' || b == '\n') {
                continue;
            }
            return b == '{' || b == '[' ? EnvelopeKind.LEGACY_JSON : EnvelopeKind.UNKNOWN;
        }
        return EnvelopeKind.UNKNOWN;
    }

    /**
     * Generates a random key suitable for the master key variable.
     *
     * @return base64 of 32 random bytes
     */
    public static String generateKey() {
        return Base64.getEncoder().encodeToString(randomBytes(KEY_LENGTH));
    }

    /**
     * Whether {@code key} is base64 decoding to at least 32 bytes.
     */
    public static boolean isValidKey(String key) {
        if (key == null || key.isBlank()) {
            return false;
        }
        try {
            return Base64.getDecoder().decode(key).length >= KEY_LENGTH;
        } catch (IllegalArgumentException e) {
            LOG.debug("Encryption key is not base64: {}", e.getMessage());
            return false;
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private byte[] deriveKey(byte[] salt) {
        char[] password = masterKey.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(password, salt, kdfIterations, KEY_LENGTH * 8);
        try {
            return SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(password, '\0');
        }
    }

    private static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        return bytes;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    /** Lowercase only: a case flip must not decode to the same bytes. */
    private static boolean isHex(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!(c >= '0' && c <= '9') && !(c >= 'a' && c <= 'f')) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "SecureEnvelope{encrypted=" + hasKey() + ", kdfIterations=" + kdfIterations + "}";
    }
}
