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

import java.util.Objects;

/**
 * A write or remove recorded by an open transaction, not yet applied.
 *
 * @param kind  operation kind
 * @param key   target key
 * @param value record to write, {@code null} for removes
 */
record StagedOperation(Kind kind, StorageKey key, Object value) {

    enum Kind { WRITE, REMOVE }

    StagedOperation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(key, "key");
    }

    static StagedOperation write(StorageKey key, Object value) {
        return new StagedOperation(Kind.WRITE, key, value);
    }

    static StagedOperation remove(StorageKey key) {
        return new StagedOperation(Kind.REMOVE, key, null);
    }
}
