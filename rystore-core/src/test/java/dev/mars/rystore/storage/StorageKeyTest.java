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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link StorageKey} validation and path mapping.
 */
class StorageKeyTest {

    @TempDir
    Path tempDir;

    // ========================================================================
    // Validation
    // ========================================================================

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Ordinary segments are accepted")
        void testValidKey() {
            StorageKey key = StorageKey.of("session", "proj-1", "ses_42");
            assertEquals(List.of("session", "proj-1", "ses_42"), key.segments());
            assertEquals("session", key.namespace());
            assertEquals("ses_42", key.name());
        }

        @Test
        @DisplayName("Empty key is rejected")
        void testEmptyKey() {
            assertThrows(ValidationException.class, StorageKey::of);
            assertThrows(ValidationException.class, () -> new StorageKey(List.of()));
            assertThrows(ValidationException.class, () -> new StorageKey(null));
        }

        @ParameterizedTest
        @ValueSource(strings = {"..", "a..b", "a/b", "a\\b", "", ".hidden", ".", "nul\u0000byte"})
        @DisplayName("Traversal and malformed segments are rejected")
        void testInvalidSegments(String segment) {
            assertThrows(ValidationException.class, () -> StorageKey.of("session", segment));
        }

        @Test
        @DisplayName("Null segment is rejected with ValidationException")
        void testNullSegment() {
            assertThrows(ValidationException.class, () -> StorageKey.of("session", null));
        }

        @Test
        @DisplayName("Segments are copied on construction")
        void testImmutable() {
            List<String> segments = new ArrayList<>(List.of("a", "b"));
            StorageKey key = new StorageKey(segments);
            segments.add("c");

            assertEquals(2, key.segments().size());
            assertThrows(UnsupportedOperationException.class, () -> key.segments().add("d"));
        }

        @Test
        @DisplayName("Prefix may be empty but not invalid")
        void testPrefix() {
            assertEquals(List.of(), StorageKey.validatePrefix(null));
            assertEquals(List.of(), StorageKey.validatePrefix(Collections.emptyList()));
            assertEquals(List.of("session"), StorageKey.validatePrefix(List.of("session")));
            assertThrows(ValidationException.class, () -> StorageKey.validatePrefix(List.of("..")));
        }

        @ParameterizedTest
        @ValueSource(strings = {"x.json", "x.JSON", "archive.Json"})
        @DisplayName("Only the last segment may end in the record suffix")
        void testSuffixOnlyLast(String segment) {
            assertEquals(segment, StorageKey.of("session", segment).name());
            assertThrows(ValidationException.class, () -> StorageKey.of(segment, "y"));
            assertThrows(ValidationException.class, () -> StorageKey.of("session", segment).child("y"));
            assertThrows(ValidationException.class, () -> StorageKey.validatePrefix(List.of("session", segment)));
        }

        @Test
        @DisplayName("child() validates the appended segments")
        void testChild() {
            StorageKey parent = StorageKey.of("session");
            assertEquals(StorageKey.of("session", "x"), parent.child("x"));
            assertThrows(ValidationException.class, () -> parent.child("../etc"));
        }
    }

    // ========================================================================
    // Path Mapping
    // ========================================================================

    @Nested
    @DisplayName("Path Mapping")
    class PathTests {

        @Test
        @DisplayName("Key maps to nested .json file under the root")
        void testToPath() {
            Path path = StorageKey.of("session", "proj", "s1").toPath(tempDir);
            assertEquals(tempDir.resolve("session").resolve("proj").resolve("s1.json"), path);
            assertTrue(path.normalize().startsWith(tempDir));
        }

        @Test
        @DisplayName("Canonical path is absolute and normalized")
        void testCanonicalPath() {
            Path relative = Path.of("data", "..", "data");
            String canonical = StorageKey.of("a", "b").canonicalPath(relative);

            assertTrue(Path.of(canonical).isAbsolute());
            assertEquals(Path.of("data").toAbsolutePath().resolve("a").resolve("b.json").toString(), canonical);
        }

        @Test
        @DisplayName("No valid key needs another key's record file as a directory")
        void testFileNeverDirectory() {
            Path file = StorageKey.of("x").toPath(tempDir);
            assertEquals(tempDir.resolve("x.json"), file);
            // The only keys that could descend through x.json are rejected
            assertThrows(ValidationException.class, () -> StorageKey.of("x.json", "y"));
            assertEquals(tempDir.resolve("x.json.json"), StorageKey.of("x.json").toPath(tempDir));
        }

        @Test
        @DisplayName("Distinct keys never share a canonical path")
        void testInjective() {
            assertNotEquals(StorageKey.of("a", "b").canonicalPath(tempDir),
                    StorageKey.of("a", "b", "c").canonicalPath(tempDir));
            assertNotEquals(StorageKey.of("ab").canonicalPath(tempDir),
                    StorageKey.of("a", "b").canonicalPath(tempDir));
        }
    }

    // ========================================================================
    // Equality & Ordering
    // ========================================================================

    @Test
    @DisplayName("Equal segments mean equal keys")
    void testEquality() {
        assertEquals(StorageKey.of("a", "b"), new StorageKey(List.of("a", "b")));
        assertEquals(StorageKey.of("a", "b").hashCode(), new StorageKey(List.of("a", "b")).hashCode());
        assertEquals("a/b", StorageKey.of("a", "b").toString());
    }

    @Test
    @DisplayName("Keys order segment by segment, shorter first")
    void testOrdering() {
        List<StorageKey> keys = new ArrayList<>(List.of(
                StorageKey.of("b"),
                StorageKey.of("a", "z"),
                StorageKey.of("a"),
                StorageKey.of("a", "b")));
        Collections.sort(keys);

        assertEquals(List.of(StorageKey.of("a"), StorageKey.of("a", "b"),
                StorageKey.of("a", "z"), StorageKey.of("b")), keys);
    }
}
