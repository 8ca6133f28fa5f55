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

/**
 * Thrown when staging, commit or rollback is called on a transaction that has
 * already left the {@link TransactionState#OPEN} state.
 */
public class TransactionFinalizedException extends StorageException {

    private final TransactionState state;

    public TransactionFinalizedException(long transactionId, TransactionState state) {
        super("Transaction " + transactionId + " already finalized (" + state + ")");
        this.state = state;
    }

    /** The terminal state the transaction was found in. */
    public TransactionState state() {
        return state;
    }
}
