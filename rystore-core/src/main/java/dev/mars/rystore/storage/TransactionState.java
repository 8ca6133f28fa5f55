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
 * Lifecycle of a {@link Transaction}.
 * <pre>
 * OPEN ──commit()──▶ COMMITTED
 *   │  └─apply fails─▶ FAILED
 *   └──rollback()/close()──▶ ROLLED_BACK
 * </pre>
 * Every state except {@link #OPEN} is terminal.
 */
public enum TransactionState {
    OPEN,
    COMMITTED,
    ROLLED_BACK,
    /** Commit failed while applying; some operations may have reached disk. */
    FAILED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
