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

/**
 * Structural classification of stored record bytes (after the integrity
 * header, if any, has been removed).
 */
public enum EnvelopeKind {
    /** {@code enc1:<salt>:<nonce>:<tag>:<ciphertext>} */
    ENCRYPTED,
    /** {@code plaintext:<json>} */
    PLAINTEXT,
    /** Bare JSON object or array written before envelopes existed. */
    LEGACY_JSON,
    /** None of the above. */
    UNKNOWN
}
