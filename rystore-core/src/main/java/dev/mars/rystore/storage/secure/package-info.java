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
/**
 * Secure Envelope - encryption at rest and integrity checking for record bytes.
 * <p>
 * <ul>
 *   <li>{@link dev.mars.rystore.storage.secure.SecureEnvelope} - AES-256-GCM envelopes with plaintext fallback</li>
 *   <li>{@link dev.mars.rystore.storage.secure.Integrity} - outer SHA-256 checksum wrapper</li>
 * </ul>
 * <p>
 * <b>On-disk layering:</b>
 * <pre>
 * &lt;sha256 hex&gt;:enc1:&lt;salt&gt;:&lt;nonce&gt;:&lt;tag&gt;:&lt;ciphertext&gt;   (key configured)
 * &lt;sha256 hex&gt;:plaintext:&lt;json&gt;                             (no key)
 * </pre>
 * The checksum is always checked first. A checksum failure is an
 * {@link dev.mars.rystore.storage.secure.IntegrityException}; only bytes that
 * pass it reach the cipher, whose failures are
 * {@link dev.mars.rystore.storage.secure.AuthenticationException}s.
 */
package dev.mars.rystore.storage.secure;
