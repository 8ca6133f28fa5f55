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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Hierarchical record key, e.g. {@code ["session", projectId, sessionId]}.
 * <p>
 * <b>INVARIANT:</b> a key has at least one segment, and no segment is empty,
 * starts with a dot, or contains {@code ..}, {@code /}, {@code \} or NUL, and
 * no segment but the last ends in {@code .json}, since a directory of that
 * name would occupy another key's record file.
 * Validation runs in the constructor, so every instance in circulation is safe
 * to turn into a path. This is the only path traversal defence in the store.
 * <p>
 * Keys map injectively onto files: {@code root/<s1>/.../<sn>.json}. The
 * {@link #canonicalPath(Path)} of that file is the lock resource identifier
 * and the global lock ordering key for transactions.
 *
 * @param segments the validated, immutable segment list
 */
public record StorageKey(List<String> segments) implements Comparable<StorageKey> {

    /** Suffix of every record file. */
    public static final String FILE_SUFFIX = ".json";

    public StorageKey {
        if (segments == null || segments.isEmpty()) {
            throw new ValidationException("Storage key cannot be empty");
        }
        segments = List.copyOf(validateSegments(segments, true));
    }

    /**
     * Creates a key from its segments.
     *
     * @throws ValidationException if any segment is invalid
     */
    public static StorageKey of(String... segments) {
        if (segments == null) {
            throw new ValidationException("Storage key cannot be empty");
        }
        return new StorageKey(Arrays.asList(segments));
    }

    /**
     * Validates a key prefix for listing. Unlike a key, a prefix may be empty.
     *
     * @return an immutable copy of the prefix
     * @throws ValidationException if any segment is invalid
     */
    public static List<String> validatePrefix(List<String> prefix) {
        if (prefix == null) {
            return List.of();
        }
        return List.copyOf(validateSegments(prefix, false));
    }

    /**
     * @param lastIsFile whether the last segment names a record file rather than a directory
     */
    private static List<String> validateSegments(List<String> segments, boolean lastIsFile) {
        int directories = lastIsFile ? segments.size() - 1 : segments.size();
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (segment == null || segment.isEmpty()) {
                throw new ValidationException("Invalid key segment: '" + segment + "'");
            }
            if (segment.contains("..") || segment.indexOf('/') >= 0
                    || segment.indexOf('\\') >= 0 || segment.indexOf('\0') >= 0) {
                throw new ValidationException("Invalid characters in key segment: " + segment);
            }
            if (segment.startsWith(".")) {
                throw new ValidationException("Key segments cannot start with dot: " + segment);
            }
            if (i < directories && endsWithSuffix(segment)) {
                throw new ValidationException("Only the last key segment may end with " + FILE_SUFFIX + ": " + segment);
            }
        }
        return segments;
    }

    private static boolean endsWithSuffix(String segment) {
        int start = segment.length() - FILE_SUFFIX.length();
        return start >= 0 && segment.regionMatches(true, start, FILE_SUFFIX, 0, FILE_SUFFIX.length());
    }

    /**
     * Appends further segments to this key.
     */
    public StorageKey child(String... more) {
        List<String> joined = new ArrayList<>(segments);
        joined.addAll(Arrays.asList(more));
        return new StorageKey(joined);
    }

    /** First segment, used to decide namespace policies such as file permissions. */
    public String namespace() {
        return segments.get(0);
    }

    /** Last segment. */
    public String name() {
        return segments.get(segments.size() - 1);
    }

    /**
     * Returns the record file for this key under {@code root}.
     */
    public Path toPath(Path root) {
        Path path = root;
        int last = segments.size() - 1;
        for (int i = 0; i < last; i++) {
            path = path.resolve(segments.get(i));
        }
        return path.resolve(segments.get(last) + FILE_SUFFIX);
    }

    /**
     * Returns the normalized absolute path string of the record file, used as
     * the lock resource identifier. Two equal keys under the same root always
     * produce the same string, and distinct keys never collide.
     */
    public String canonicalPath(Path root) {
        return toPath(root.toAbsolutePath().normalize()).toString();
    }

    /**
     * Orders keys segment by segment. Transactions sort by canonical path
     * instead, which is what the lock table sees.
     */
    @Override
    public int compareTo(StorageKey other) {
        int n = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < n; i++) {
            int c = segments.get(i).compareTo(other.segments.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public String toString() {
        return String.join("/", segments);
    }
}
