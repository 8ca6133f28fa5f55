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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.rystore.storage.FileRecordStore;
import dev.mars.rystore.storage.StorageKey;
import dev.mars.rystore.storage.StoreConfig;
import dev.mars.rystore.storage.Transaction;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Demo entry point for the record store.
 * <p>
 * This demonstrates basic store operations:
 * <ul>
 *   <li>Opening the store</li>
 *   <li>Writing a session and its first message in one transaction</li>
 *   <li>Listing sessions by prefix</li>
 *   <li>Storing provider credentials</li>
 *   <li>Migrating plaintext records once a key is configured</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link StoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Drystore.dataDir=/path -Drystore.syncEnabled=true ...}</li>
 *   <li>Environment variables: {@code RYSTORE_DATA_DIR, RYSTORE_SYNC_ENABLED, ...}</li>
 *   <li>Properties file: {@code rystore.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 * The master key is read from {@code RYCODE_ENCRYPTION_KEY}; without it records
 * are stored as checksummed plaintext.
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl rystore-demo -am
 *
 * # Run with default configuration
 * java -jar rystore-demo/target/rystore-demo-1.0-SNAPSHOT.jar
 *
 * # Run with CLI data directory override
 * java -jar rystore-demo/target/rystore-demo-1.0-SNAPSHOT.jar /path/to/data
 *
 * # Run again with encryption; existing records are migrated
 * RYCODE_ENCRYPTION_KEY=$(openssl rand -base64 32) java -jar rystore-demo/target/rystore-demo-1.0-SNAPSHOT.jar /path/to/data
 * </pre>
 *
 * @see StoreConfig
 */
public class StoreDemo {

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|          Record Store Demo            |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        // Build configuration with CLI override if provided
        StoreConfig config = args.length > 0 && !args[0].isBlank()
                ? StoreConfig.builder().dataDir(args[0]).build()
                : StoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (FileRecordStore store = new FileRecordStore(config)) {
            store.open();
            System.out.println("[OK] Store opened at: " + store.root());

            // Existing sessions from earlier runs
            List<StorageKey> sessions = store.list(List.of("session", "demo"));
            System.out.println("[OK] Found " + sessions.size() + " existing session(s)");
            for (StorageKey key : sessions) {
                store.read(key).map(node -> node.path("title").asText("?"))
                        .ifPresent(title -> System.out.printf("    %s: %s%n", key, title));
            }

            // Session + first message, all or nothing
            String sessionId = "ses-" + (sessions.size() + 1);
            StorageKey sessionKey = StorageKey.of("session", "demo", sessionId);
            StorageKey messageKey = StorageKey.of("message", sessionId, "msg-1");
            try (Transaction tx = store.beginTransaction()) {
                tx.stageWrite(sessionKey, Map.of(
                        "id", sessionId,
                        "title", "Demo session " + (sessions.size() + 1),
                        "created", Instant.now().toString()));
                tx.stageWrite(messageKey, Map.of("role", "user", "text", "Hello from run " + (sessions.size() + 1)));
                tx.commit();
            }
            System.out.println("\n[OK] Committed " + sessionKey + " and " + messageKey);

            // Read-modify-write on a single key
            StorageKey counterKey = StorageKey.of("stats", "runs");
            if (store.read(counterKey).isEmpty()) {
                store.write(counterKey, Map.of("count", 0));
            }
            JsonNode runs = store.update(counterKey, JsonNode.class, StoreDemo::incremented).orElseThrow();
            System.out.println("[OK] Run counter: " + runs.path("count").asInt());

            // Credentials go to the owner-only auth namespace
            CredentialVault vault = new CredentialVault(store);
            if (vault.get("demo-provider").isEmpty()) {
                vault.set("demo-provider", new AuthCredential.Api("sk-demo-" + sessionId));
            }
            System.out.println("[OK] Stored credentials for: " + vault.all().keySet());

            // Upgrade older plaintext records when a key is present
            if (store.encryptionEnabled()) {
                int migrated = store.migrateToEncrypted();
                System.out.println("[OK] Migrated " + migrated + " record(s) to encrypted storage");
            } else {
                System.out.println("[--] No " + StoreConfig.ENV_ENCRYPTION_KEY + " set; records stored as plaintext");
            }

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Store demo complete!                 |");
            System.out.println("|  Run again to see sessions listed.    |");
            System.out.println("+---------------------------------------+");
        }
    }

    private static JsonNode incremented(JsonNode node) {
        ObjectNode copy = node.deepCopy();
        copy.put("count", node.path("count").asInt() + 1);
        return copy;
    }
}
