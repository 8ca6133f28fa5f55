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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.rystore.storage.secure.AuthenticationException;
import dev.mars.rystore.storage.secure.Integrity;
import dev.mars.rystore.storage.secure.IntegrityException;
import dev.mars.rystore.storage.secure.SecureEnvelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for {@link FileRecordStore}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Single-key read/write/remove/update</li>
 *   <li>On-disk format and integrity checking</li>
 *   <li>Encryption and reading of older formats</li>
 *   <li>Prefix listing</li>
 *   <li>Open/close lifecycle and process locking</li>
 * </ul>
 */
class FileRecordStoreTest {

    record Session(String id, String title, int messages) {
    }

    static StoreConfig.Builder testConfig(Path dir) {
        return StoreConfig.builder()
                .dataDir(dir)
                .minFreeSpaceMb(0)
                .kdfIterations(1_000)
                .lockTimeout(Duration.ofSeconds(5))
                .encryptionKey(null);
    }

    @TempDir
    Path tempDir;

    private FileRecordStore store;

    @BeforeEach
    void setUp() {
        store = new FileRecordStore(testConfig(tempDir).build());
        store.open();
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private FileRecordStore reopen(String encryptionKey) {
        store.close();
        store = new FileRecordStore(testConfig(tempDir).encryptionKey(encryptionKey).build());
        store.open();
        return store;
    }

    private Path fileOf(StorageKey key) {
        return key.toPath(store.root());
    }

    // ========================================================================
    // Basic Operations
    // ========================================================================

    @Nested
    @DisplayName("Basic Operations")
    class BasicTests {

        @Test
        @DisplayName("Read of a never-written key is empty, not an error")
        void testReadMissing() {
            assertTrue(store.read(StorageKey.of("session", "nope"), Session.class).isEmpty());
            assertTrue(store.read(StorageKey.of("nothing", "here", "at", "all")).isEmpty());
        }

        @Test
        @DisplayName("Write then read returns an equal record")
        void testRoundTrip() {
            StorageKey key = StorageKey.of("session", "proj-1", "ses-1");
            Session session = new Session("ses-1", "Refactor parser", 12);

            store.write(key, session);

            assertEquals(Optional.of(session), store.read(key, Session.class));
        }

        @Test
        @DisplayName("Read as JSON tree")
        void testReadTree() {
            StorageKey key = StorageKey.of("share", "ses-1");
            store.write(key, Map.of("url", "https://example.test/s/1", "secret", "abc"));

            JsonNode node = store.read(key).orElseThrow();
            assertEquals("abc", node.get("secret").asText());
        }

        @Test
        @DisplayName("First write under a new prefix creates the directories")
        void testCreatesParentDirectories() {
            StorageKey key = StorageKey.of("message", "ses-9", "part", "p-1");
            assertFalse(Files.exists(tempDir.resolve("message")));

            store.write(key, Map.of("text", "hi"));

            assertTrue(Files.isRegularFile(tempDir.resolve("message/ses-9/part/p-1.json")));
        }

        @Test
        @DisplayName("Overwrite replaces the record")
        void testOverwrite() {
            StorageKey key = StorageKey.of("session", "s");
            store.write(key, new Session("s", "one", 1));
            store.write(key, new Session("s", "two", 2));

            assertEquals("two", store.read(key, Session.class).orElseThrow().title());
        }

        @Test
        @DisplayName("Remove is idempotent")
        void testRemoveTwice() {
            StorageKey key = StorageKey.of("session", "s");
            store.write(key, new Session("s", "t", 0));

            store.remove(key);
            store.remove(key);

            assertTrue(store.read(key).isEmpty());
            assertFalse(Files.exists(fileOf(key)));
        }

        @Test
        @DisplayName("Records survive a restart")
        void testSurvivesRestart() {
            StorageKey key = StorageKey.of("session", "persist");
            store.write(key, new Session("persist", "kept", 3));

            reopen(null);

            assertEquals(3, store.read(key, Session.class).orElseThrow().messages());
        }

        @Test
        @DisplayName("No temp files remain after writes")
        void testNoTempFiles() throws Exception {
            for (int i = 0; i < 5; i++) {
                store.write(StorageKey.of("session", "s" + i), Map.of("i", i));
            }
            try (Stream<Path> files = Files.walk(tempDir)) {
                assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(FileRecordStore.TMP_SUFFIX)));
            }
        }

        @Test
        @DisplayName("Locks are released after every operation")
        void testLocksReleased() {
            StorageKey key = StorageKey.of("session", "s");
            store.write(key, Map.of("a", 1));
            store.read(key);
            store.remove(key);

            assertTrue(store.lockDiagnostics().isEmpty());
        }

        @Test
        @DisplayName("Read into a mismatched type is a storage error, not corruption")
        void testTypeMismatch() {
            StorageKey key = StorageKey.of("session", "s");
            store.write(key, List.of(1, 2, 3));

            StorageException e = assertThrows(StorageException.class, () -> store.read(key, Session.class));
            assertFalse(e instanceof IntegrityException);
        }
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Null record is rejected before any file is created")
        void testNullRecord() {
            StorageKey key = StorageKey.of("session", "null");
            assertThrows(ValidationException.class, () -> store.write(key, null));
            assertFalse(Files.exists(tempDir.resolve("session")));
        }

        @Test
        @DisplayName("Unserializable record is rejected")
        void testUnserializable() {
            StorageKey key = StorageKey.of("session", "bad");
            assertThrows(ValidationException.class, () -> store.write(key, new Exploding()));
            assertFalse(Files.exists(fileOf(key)));
        }

        @Test
        @DisplayName("Record over the size limit is rejected")
        void testOversized() {
            store.close();
            store = new FileRecordStore(testConfig(tempDir).maxRecordSizeMb(1).build());
            store.open();

            StorageKey key = StorageKey.of("session", "big");
            String big = "x".repeat(1024 * 1024 + 1);

            ValidationException e = assertThrows(ValidationException.class, () -> store.write(key, Map.of("b", big)));
            assertTrue(e.getMessage().contains("exceeds"));
            assertFalse(Files.exists(fileOf(key)));
        }

        @Test
        @DisplayName("A record file is never needed as a directory by another key")
        void testRecordFileNotShadowed() {
            StorageKey x = StorageKey.of("x");
            store.write(x, Map.of("v", 1));

            assertThrows(ValidationException.class, () -> StorageKey.of("x.json", "y"));
            StorageKey sibling = StorageKey.of("x.json");
            store.write(sibling, Map.of("v", 2));

            assertEquals(1, store.read(x).orElseThrow().get("v").asInt());
            assertEquals(2, store.read(sibling).orElseThrow().get("v").asInt());
            assertEquals(List.of(x, sibling), store.list(List.of()));
        }

        @Test
        @DisplayName("Operations require an open store")
        void testNotOpen() {
            FileRecordStore unopened = new FileRecordStore(testConfig(tempDir.resolve("other")).build());
            assertThrows(IllegalStateException.class, () -> unopened.read(StorageKey.of("a")));

            store.close();
            assertThrows(IllegalStateException.class, () -> store.write(StorageKey.of("a"), Map.of()));
            assertThrows(IllegalStateException.class, store::open);
        }
    }

    // ========================================================================
    // On-disk Format & Integrity
    // ========================================================================

    @Nested
    @DisplayName("Format and Integrity")
    class IntegrityTests {

        @Test
        @DisplayName("Without a key, records are checksummed plaintext")
        void testPlaintextFormat() throws Exception {
            StorageKey key = StorageKey.of("session", "fmt");
            store.write(key, Map.of("a", 1));

            String text = Files.readString(fileOf(key), StandardCharsets.UTF_8);
            assertTrue(text.matches("[0-9a-f]{64}:plaintext:\\{.*\\}"), text);
        }

        @Test
        @DisplayName("With a key, records are checksummed ciphertext")
        void testEncryptedFormat() throws Exception {
            reopen(SecureEnvelope.generateKey());
            StorageKey key = StorageKey.of("auth", "anthropic");
            store.write(key, Map.of("key", "sk-secret"));

            String text = Files.readString(fileOf(key), StandardCharsets.UTF_8);
            assertTrue(text.matches("[0-9a-f]{64}:enc1:.*"), text);
            assertFalse(text.contains("sk-secret"));
            assertEquals("sk-secret", store.read(key).orElseThrow().get("key").asText());
        }

        @Test
        @DisplayName("A flipped byte is reported as corruption")
        void testCorruptionDetected() throws Exception {
            StorageKey key = StorageKey.of("session", "c");
            store.write(key, new Session("c", "title", 1));

            Path file = fileOf(key);
            byte[] bytes = Files.readAllBytes(file);
            bytes[bytes.length - 3] ^= 0x01;
            Files.write(file, bytes);

            assertThrows(IntegrityException.class, () -> store.read(key, Session.class));
        }

        @Test
        @DisplayName("Corruption is detected before decryption is attempted")
        void testIntegrityBeforeDecryption() throws Exception {
            reopen(SecureEnvelope.generateKey());
            StorageKey key = StorageKey.of("auth", "x");
            store.write(key, Map.of("token", "t"));

            Path file = fileOf(key);
            byte[] bytes = Files.readAllBytes(file);
            bytes[bytes.length - 1] = (byte) (bytes[bytes.length - 1] == '0' ? '1' : '0');
            Files.write(file, bytes);

            // A wrong key would fail decryption; IntegrityException proves decryption never ran
            reopen(SecureEnvelope.generateKey());
            assertThrows(IntegrityException.class, () -> store.read(key));
        }

        @Test
        @DisplayName("Wrong key on an intact record is an authentication failure")
        void testWrongKey() {
            reopen(SecureEnvelope.generateKey());
            StorageKey key = StorageKey.of("auth", "x");
            store.write(key, Map.of("token", "t"));

            reopen(SecureEnvelope.generateKey());
            assertThrows(AuthenticationException.class, () -> store.read(key));
        }

        @Test
        @DisplayName("Encrypted record read without a key is an authentication failure")
        void testEncryptedWithoutKey() {
            reopen(SecureEnvelope.generateKey());
            StorageKey key = StorageKey.of("auth", "x");
            store.write(key, Map.of("token", "t"));

            reopen(null);
            assertThrows(AuthenticationException.class, () -> store.read(key));
        }

        @Test
        @DisplayName("Raw legacy JSON and unwrapped plaintext are still readable")
        void testLegacyFormats() throws Exception {
            StorageKey legacy = StorageKey.of("session", "legacy");
            StorageKey bare = StorageKey.of("session", "bare");
            Files.createDirectories(fileOf(legacy).getParent());
            Files.writeString(fileOf(legacy), "{\"id\":\"legacy\",\"title\":\"old\",\"messages\":4}");
            Files.writeString(fileOf(bare), "plaintext:{\"id\":\"bare\",\"title\":\"older\",\"messages\":5}");

            assertEquals(4, store.read(legacy, Session.class).orElseThrow().messages());
            assertEquals(5, store.read(bare, Session.class).orElseThrow().messages());
        }

        @Test
        @DisplayName("Unrecognized bytes are reported as corruption")
        void testGarbage() throws Exception {
            StorageKey key = StorageKey.of("session", "garbage");
            Files.createDirectories(fileOf(key).getParent());
            Files.writeString(fileOf(key), "this is not a record");

            assertThrows(IntegrityException.class, () -> store.read(key));
        }

        @Test
        @DisplayName("Valid checksum over invalid JSON is reported as corruption")
        void testInvalidJsonInsideChecksum() throws Exception {
            StorageKey key = StorageKey.of("session", "badjson");
            Files.createDirectories(fileOf(key).getParent());
            Files.write(fileOf(key), Integrity.wrap(SecureEnvelope.plaintext("{not json".getBytes(StandardCharsets.UTF_8))));

            assertThrows(IntegrityException.class, () -> store.read(key));
        }

        @Test
        @DisplayName("Checksum over raw JSON without envelope marker is rejected")
        void testChecksumOverBareJson() throws Exception {
            StorageKey key = StorageKey.of("session", "nomarker");
            Files.createDirectories(fileOf(key).getParent());
            Files.write(fileOf(key), Integrity.wrap("{\"a\":1}".getBytes(StandardCharsets.UTF_8)));

            assertThrows(IntegrityException.class, () -> store.read(key));
        }

        @Test
        @DisplayName("Write verification reads records back")
        void testVerifyWrites() {
            store.close();
            store = new FileRecordStore(testConfig(tempDir).verifyWrites(true).build());
            store.open();

            StorageKey key = StorageKey.of("session", "v");
            store.write(key, new Session("v", "verified", 1));
            assertEquals("verified", store.read(key, Session.class).orElseThrow().title());
        }
    }

    // ========================================================================
    // Permissions
    // ========================================================================

    @Test
    @DisplayName("Sensitive namespaces are written owner-only")
    void testOwnerOnlyPermissions() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));

        StorageKey secret = StorageKey.of("auth", "provider");
        store.write(secret, Map.of("key", "k"));

        assertEquals("rw-------",
                PosixFilePermissions.toString(Files.getPosixFilePermissions(fileOf(secret))));
    }

    @Test
    @DisplayName("Sensitive temp files are created owner-only, before any byte is written")
    void testTempFileCreatedOwnerOnly() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));

        StorageKey secret = StorageKey.of("auth", "provider");
        FileAttribute<?>[] attributes = store.tempFileAttributes(secret, tempDir);
        assertEquals(1, attributes.length);
        assertEquals("posix:permissions", attributes[0].name());
        assertEquals(PosixFilePermissions.fromString("rw-------"), attributes[0].value());

        Path tmp = tempDir.resolve(".provider.json.check.tmp");
        Files.createFile(tmp, attributes);
        assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(tmp)));
    }

    @Test
    @DisplayName("Ordinary namespaces keep default creation permissions")
    void testTempFileDefaultPermissions() throws Exception {
        assertEquals(0, store.tempFileAttributes(StorageKey.of("session", "s"), tempDir).length);
    }

    // ========================================================================
    // Listing
    // ========================================================================

    @Nested
    @DisplayName("Listing")
    class ListTests {

        @Test
        @DisplayName("Lists keys below a prefix in sorted order")
        void testListSorted() {
            store.write(StorageKey.of("session", "p1", "b"), Map.of());
            store.write(StorageKey.of("session", "p1", "a"), Map.of());
            store.write(StorageKey.of("session", "p2", "c"), Map.of());
            store.write(StorageKey.of("auth", "x"), Map.of());

            assertEquals(List.of(StorageKey.of("session", "p1", "a"), StorageKey.of("session", "p1", "b")),
                    store.list(List.of("session", "p1")));
            assertEquals(3, store.list(List.of("session")).size());
            assertEquals(4, store.list(List.of()).size());
        }

        @Test
        @DisplayName("Unknown prefix yields an empty list")
        void testListUnknown() {
            assertEquals(List.of(), store.list(List.of("nothing")));
        }

        @Test
        @DisplayName("Listing reflects the current state each time")
        void testListRestartable() {
            StorageKey a = StorageKey.of("session", "a");
            StorageKey b = StorageKey.of("session", "b");
            store.write(a, Map.of());
            assertEquals(List.of(a), store.list(List.of("session")));

            store.write(b, Map.of());
            store.remove(a);
            assertEquals(List.of(b), store.list(List.of("session")));
        }

        @Test
        @DisplayName("Lock, temp, hidden and foreign files are not listed")
        void testListSkipsNonRecords() throws Exception {
            StorageKey real = StorageKey.of("session", "real");
            store.write(real, Map.of());
            Path dir = fileOf(real).getParent();
            Files.writeString(dir.resolve(".real.json.1234.tmp"), "partial");
            Files.writeString(dir.resolve("notes.txt"), "x");
            Files.createDirectories(dir.resolve(".hidden"));
            Files.writeString(dir.resolve(".hidden").resolve("x.json"), "{}");

            assertEquals(List.of(real), store.list(List.of()));
        }

        @Test
        @DisplayName("Invalid prefix is rejected")
        void testListInvalidPrefix() {
            assertThrows(ValidationException.class, () -> store.list(List.of("..")));
        }

        @Test
        @DisplayName("stream() walks lazily and must be closed")
        void testStream() {
            store.write(StorageKey.of("session", "a"), Map.of());
            store.write(StorageKey.of("session", "b"), Map.of());

            try (Stream<StorageKey> keys = store.stream(List.of("session"))) {
                assertEquals(2, keys.collect(Collectors.toSet()).size());
            }
        }
    }

    // ========================================================================
    // Update
    // ========================================================================

    @Nested
    @DisplayName("Update")
    class UpdateTests {

        @Test
        @DisplayName("update() rewrites an existing record")
        void testUpdate() {
            StorageKey key = StorageKey.of("session", "u");
            store.write(key, new Session("u", "t", 1));

            Optional<Session> result = store.update(key, Session.class,
                    s -> new Session(s.id(), s.title(), s.messages() + 1));

            assertEquals(2, result.orElseThrow().messages());
            assertEquals(2, store.read(key, Session.class).orElseThrow().messages());
        }

        @Test
        @DisplayName("update() on an absent key writes nothing")
        void testUpdateAbsent() {
            StorageKey key = StorageKey.of("session", "none");
            assertTrue(store.update(key, Session.class, s -> s).isEmpty());
            assertFalse(Files.exists(fileOf(key)));
        }

        @Test
        @DisplayName("update() returning null is rejected and keeps the old record")
        void testUpdateNull() {
            StorageKey key = StorageKey.of("session", "u");
            store.write(key, new Session("u", "t", 1));

            assertThrows(ValidationException.class, () -> store.update(key, Session.class, s -> null));
            assertEquals(1, store.read(key, Session.class).orElseThrow().messages());
        }
    }

    // ========================================================================
    // Process Lock & Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Second store on the same directory is refused")
        void testProcessLock() {
            FileRecordStore second = new FileRecordStore(testConfig(tempDir).build());
            assertThrows(StorageException.class, second::open);
            assertTrue(Files.exists(tempDir.resolve(FileRecordStore.LOCK_FILE)));
        }

        @Test
        @DisplayName("open() and close() are idempotent")
        void testIdempotent() {
            store.open();
            store.close();
            store.close();
        }

        @Test
        @DisplayName("Insufficient disk space refuses to open")
        void testDiskSpace() {
            FileRecordStore greedy = new FileRecordStore(testConfig(tempDir.resolve("greedy"))
                    .minFreeSpaceMb(Integer.MAX_VALUE)
                    .build());
            StorageException e = assertThrows(StorageException.class, greedy::open);
            assertTrue(e.getMessage().contains("disk space"));
            greedy.close();
        }
    }

    /** Getter throws during serialization. */
    static class Exploding {
        public String getValue() {
            throw new IllegalStateException("boom");
        }
    }
}
