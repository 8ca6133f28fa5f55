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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Outer SHA-256 checksum wrapper, independent of encryption.
 * <p>
 * <b>Format:</b> {@code <sha256 of payload, 64 lowercase hex>:<payload>}
 * <p>
 * The checksum is verified before the payload is decrypted or parsed, so disk
 * corruption surfaces as {@link IntegrityException} and never reaches the
 * cipher, where it would be indistinguishable from a wrong key.
 */
public final class Integrity {

    private static final Logger LOG = LoggerFactory.getLogger(Integrity.class);

    /** Length of the hex checksum prefix. */
    public static final int CHECKSUM_LENGTH = 64;

    private static final byte SEPARATOR = ':';
    private static final HexFormat HEX = HexFormat.of();

    private Integrity() {
    }

    /**
     * Returns the lowercase hex SHA-256 of {@code data}.
     */
    public static String computeChecksum(byte[] data) {
        return HEX.formatHex(sha256(data));
    }

    /**
     * Constant-time comparison of the checksum of {@code data} with
     * {@code expectedChecksum}. The comparison is on the lowercase hex text, so
     * a case change in a stored checksum counts as corruption.
     */
    public static boolean verifyChecksum(byte[] data, String expectedChecksum) {
        if (expectedChecksum == null || expectedChecksum.length() != CHECKSUM_LENGTH) {
            return false;
        }
        byte[] actual = computeChecksum(data).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = expectedChecksum.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(actual, expected);
    }

    /**
     * Prefixes {@code data} with its checksum.
     */
    public static byte[] wrap(byte[] data) {
        byte[] header = (computeChecksum(data) + ":").getBytes(StandardCharsets.US_ASCII);
        byte[] wrapped = Arrays.copyOf(header, header.length + data.length);
        System.arraycopy(data, 0, wrapped, header.length, data.length);
        return wrapped;
    }

    /**
     * Verifies and strips the checksum header.
     *
     * @return the payload
     * @throws IntegrityException if the header is missing or malformed, or the checksum does not match
     */
    public static byte[] unwrap(byte[] wrapped) {
        if (wrapped == null || wrapped.length < CHECKSUM_LENGTH + 1 || wrapped[CHECKSUM_LENGTH] != SEPARATOR) {
            throw new IntegrityException("Invalid integrity format - missing or malformed checksum");
        }
        String expected = new String(wrapped, 0, CHECKSUM_LENGTH, StandardCharsets.US_ASCII);
        byte[] payload = Arrays.copyOfRange(wrapped, CHECKSUM_LENGTH + 1, wrapped.length);

        if (!verifyChecksum(payload, expected)) {
            LOG.error("Integrity check failed: expected={}, actual={}, payload={} bytes",
                    expected, computeChecksum(payload), payload.length);
            throw new IntegrityException("Data integrity check failed - data may be corrupted");
        }
        return payload;
    }

    /**
     * Structural check for a checksum header: 64 lowercase hex characters
     * followed by a colon.
     */
    public static boolean hasIntegrity(byte[] data) {
        if (data == null || data.length < CHECKSUM_LENGTH + 1 || data[CHECKSUM_LENGTH] != SEPARATOR) {
            return false;
        }
        for (int i = 0; i < CHECKSUM_LENGTH; i++) {
            byte b = data[i];
            if (!(b >= '0' && b <= '9') && !(b >= 'a' && b <= 'f')) {
                return false;
            }
        }
        return true;
    }

    private static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
