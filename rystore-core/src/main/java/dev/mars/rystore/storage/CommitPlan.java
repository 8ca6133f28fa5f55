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
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Prepared form of a transaction's staged operations, ready to apply.
 * <p>
 * <b>Usage Pattern (Order &rarr; Prepare &rarr; Apply):</b>
 * <pre>{@code
 * // 1. Lock every touched resource in global order
 * List<String> order = CommitPlan.lockOrder(root, staged);
 * locks = acquireAll(order);
 *
 * // 2. Serialize, size-check and seal every write (no mutations)
 * CommitPlan plan = CommitPlan.prepare(staged, codec);
 *
 * // 3. Apply to disk (only after every operation prepared successfully)
 * plan.applyTo(store, transactionId);
 * }</pre>
 * A {@link ValidationException} from {@link #prepare} means nothing was
 * written. A failure inside {@link #applyTo} after some operations landed is
 * reported as {@link PartialCommitException}.
 *
 * @param operations prepared operations in staging order
 */
record CommitPlan(List<Prepared> operations) {

    /**
     * One prepared operation. {@code bytes} is the final on-disk content for
     * writes and {@code null} for removes.
     */
    record Prepared(StorageKey key, byte[] bytes) {
        boolean isRemove() {
            return bytes == null;
        }
    }

    CommitPlan {
        operations = operations == null
                ? Collections.emptyList()
                : List.copyOf(operations);
    }

    /**
     * Distinct lock resources of the staged operations, sorted by canonical
     * path. Every transaction acquiring in this order makes circular waits
     * impossible.
     */
    static List<String> lockOrder(Path root, List<StagedOperation> staged) {
        TreeSet<String> resources = new TreeSet<>();
        for (StagedOperation op : staged) {
            resources.add(op.key().canonicalPath(root));
        }
        return new ArrayList<>(resources);
    }

    /**
     * Encodes every staged write. Either all operations prepare or a
     * {@link ValidationException} is thrown and nothing has been written.
     */
    static CommitPlan prepare(List<StagedOperation> staged, RecordCodec codec) {
        List<Prepared> prepared = new ArrayList<>(staged.size());
        for (StagedOperation op : staged) {
            if (op.kind() == StagedOperation.Kind.WRITE) {
                prepared.add(new Prepared(op.key(), codec.encode(op.key(), op.value())));
            } else {
                prepared.add(new Prepared(op.key(), null));
            }
        }
        return new CommitPlan(prepared);
    }

    /**
     * Applies the plan through the store. The caller must hold exclusive locks
     * on every key of the plan.
     *
     * @throws PartialCommitException if an operation fails
     */
    void applyTo(FileRecordStore store, long transactionId) {
        List<StorageKey> applied = new ArrayList<>(operations.size());
        for (Prepared op : operations) {
            try {
                if (op.isRemove()) {
                    store.deleteLocked(op.key());
                } else {
                    store.persistLocked(op.key(), op.bytes());
                }
            } catch (RuntimeException e) {
                throw new PartialCommitException(transactionId, applied, op.key(), e);
            }
            applied.add(op.key());
        }
    }

    boolean hasWrites() {
        for (Prepared op : operations) {
            if (!op.isRemove()) {
                return true;
            }
        }
        return false;
    }

    boolean isEmpty() {
        return operations.isEmpty();
    }
}
