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

import java.util.List;

/**
 * Fatal: a staged operation failed while being applied, after every operation
 * had passed validation. Operations applied before the failure stay applied.
 * <p>
 * <b>Never catch and ignore this.</b> The on-disk state now mixes old and new
 * records for the keys of the failed transaction.
 */
public class PartialCommitException extends StorageException {

    private final List<StorageKey> appliedKeys;
    private final StorageKey failedKey;

    public PartialCommitException(long transactionId, List<StorageKey> appliedKeys,
                                  StorageKey failedKey, Throwable cause) {
        super("Transaction " + transactionId + " partially applied: " + appliedKeys.size() +
                " operation(s) applied before failure on " + failedKey, cause);
        this.appliedKeys = List.copyOf(appliedKeys);
        this.failedKey = failedKey;
    }

    /** Keys whose operations reached disk before the failure, in apply order. */
    public List<StorageKey> appliedKeys() {
        return appliedKeys;
    }

    /** Key of the operation that failed. */
    public StorageKey failedKey() {
        return failedKey;
    }
}
