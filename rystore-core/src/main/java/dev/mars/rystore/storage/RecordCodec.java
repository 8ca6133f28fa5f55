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
package dev.mars.rystore.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.rystore.storage.secure.EnvelopeKind;
import dev.mars.rystore.storage.secure.Integrity;
import dev.mars.rystore.storage.secure.IntegrityException;
import dev.mars.rystore.storage.secure.SecureEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Converts records to and from their on-disk bytes.
 * <p>
 * <b>Write path:</b> JSON &rarr; size check &rarr; {@link SecureEnvelope#seal} &rarr; {@link Integrity#wrap}.
 * <p>
 * <b>Read path:</b> the checksum is verified before anything else looks at the
 * payload, so a corrupted file is always reported as {@link IntegrityException}
 * and never reaches decryption. Files without a checksum header are accepted
 * only when they are a bare {@code enc1:}/{@code plaintext:} envelope or raw
 * JSON written by older versions.
 */
final class RecordCodec {

    private static final Logger LOG = LoggerFactory.getLogger(RecordCodec.class);

    private final ObjectMapper mapper;
    private final SecureEnvelope envelope;
    private final long maxRecordSize;

    RecordCodec(ObjectMapper mapper, SecureEnvelope envelope, long maxRecordSize) {
        this.mapper = mapper;
        this.envelope = envelope;
        this.maxRecordSize = maxRecordSize;
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    ObjectMapper mapper() {
        return mapper;
    }

    SecureEnvelope envelope() {
        return envelope;
    }

    /**
     * Serializes a record and checks its size. Touches no file.
     *
     * @throws ValidationException if the value is null, not serializable, or too large
     */
    byte[] serialize(StorageKey key, Object value) {
        if (value == null) {
            throw new ValidationException("Cannot store null record at " + key);
        }
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Record at " + key + " is not serializable: " + e.getOriginalMessage(), e);
        }
        if (json.length > maxRecordSize) {
            throw new ValidationException("Record at " + key + " is " + json.length +
                    " bytes, exceeds maximum of " + maxRecordSize + " bytes");
        }
        return json;
    }

    /**
     * Full write path: serialize, seal and integrity-wrap.
     */
    byte[] encode(StorageKey key, Object value) {
        return seal(serialize(key, value));
    }

    /**
     * Seals and integrity-wraps already serialized JSON.
     */
    byte[] seal(byte[] json) {
        return Integrity.wrap(envelope.seal(json));
    }

    /**
     * Returns the JSON payload of a stored record.
     *
     * @throws IntegrityException if the checksum fails or the bytes are not a known format
     * @throws dev.mars.rystore.storage.secure.AuthenticationException if decryption fails
     */
    byte[] unseal(StorageKey key, byte[] stored) {
        if (Integrity.hasIntegrity(stored)) {
            byte[] inner = Integrity.unwrap(stored);
            EnvelopeKind kind = SecureEnvelope.detect(inner);
            if (kind != EnvelopeKind.ENCRYPTED && kind != EnvelopeKind.PLAINTEXT) {
                throw new IntegrityException("Record at " + key + " has an unrecognized envelope inside its checksum");
            }
            return envelope.open(inner);
        }

        EnvelopeKind kind = SecureEnvelope.detect(stored);
        if (kind == EnvelopeKind.UNKNOWN) {
            throw new IntegrityException("Record at " + key + " is not in a recognized format");
        }
        LOG.debug("Reading {} record without checksum: {}", kind, key);
        return envelope.open(stored);
    }

    /**
     * Whether the stored bytes hold an encrypted envelope, with or without
     * checksum header. Verifies the checksum when one is present.
     */
    boolean isEncrypted(byte[] stored) {
        if (Integrity.hasIntegrity(stored)) {
            return SecureEnvelope.detect(Integrity.unwrap(stored)) == EnvelopeKind.ENCRYPTED;
        }
        return SecureEnvelope.detect(stored) == EnvelopeKind.ENCRYPTED;
    }

    /**
     * Parses a stored record into a JSON tree.
     *
     * @throws IntegrityException if the payload is not valid JSON
     */
    JsonNode decodeTree(StorageKey key, byte[] stored) {
        byte[] json = unseal(key, stored);
        try {
            JsonNode tree = mapper.readTree(json);
            if (tree == null || tree.isMissingNode()) {
                throw new IntegrityException("Record at " + key + " is empty");
            }
            return tree;
        } catch (IOException e) {
            throw new IntegrityException("Record at " + key + " does not contain valid JSON", e);
        }
    }

    /**
     * Parses a stored record into {@code type}.
     *
     * @throws IntegrityException if the payload is not valid JSON
     * @throws StorageException   if the JSON does not map onto {@code type}
     */
    <T> T decode(StorageKey key, byte[] stored, Class<T> type) {
        JsonNode tree = decodeTree(key, stored);
        try {
            return mapper.treeToValue(tree, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Record at " + key + " cannot be read as " +
                    type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
