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

import dev.mars.rystore.storage.StorageException;

/**
 * Stored bytes failed the outer checksum or are not a recognizable envelope.
 * Indicates storage-level corruption (disk error, torn or foreign write), as
 * opposed to {@link AuthenticationException}, which indicates a wrong key or
 * tampered ciphertext.
 */
public class IntegrityException extends StorageException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
