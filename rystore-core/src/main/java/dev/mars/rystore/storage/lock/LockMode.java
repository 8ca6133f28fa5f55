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
package dev.mars.rystore.storage.lock;

/**
 * Lock mode for a resource. Any number of {@link #SHARED} holders may coexist;
 * an {@link #EXCLUSIVE} holder excludes every other holder.
 */
public enum LockMode {
    SHARED,
    EXCLUSIVE;

    /** Whether a request in this mode can be granted alongside holders in {@code held}. */
    boolean compatibleWith(LockMode held) {
        return this == SHARED && held == SHARED;
    }
}
