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
package dev.mars.rystore.demo;

import dev.mars.rystore.storage.FileRecordStore;
import dev.mars.rystore.storage.StorageKey;
import dev.mars.rystore.storage.StoreConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test: the demo runs repeatedly against the same directory.
 */
class StoreDemoTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Each run adds one session and bumps the run counter")
    void testTwoRuns() {
        System.setProperty("rystore.minFreeSpaceMb", "0");
        try {
            StoreDemo.main(new String[]{tempDir.toString()});
            StoreDemo.main(new String[]{tempDir.toString()});
        } finally {
            System.clearProperty("rystore.minFreeSpaceMb");
        }

        try (FileRecordStore store = new FileRecordStore(StoreConfig.builder()
                .dataDir(tempDir)
                .minFreeSpaceMb(0)
                .build())) {
            store.open();
            assertEquals(2, store.list(List.of("session", "demo")).size());
            assertEquals(2, store.read(StorageKey.of("stats", "runs")).orElseThrow().path("count").asInt());
            assertTrue(new CredentialVault(store).get("demo-provider").isPresent());
        }
    }
}
