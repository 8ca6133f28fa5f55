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

import dev.mars.rystore.storage.secure.SecureEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for the record store.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Drystore.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code RYSTORE_DATA_DIR})</li>
 *   <li>Properties file ({@code rystore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>rystore.dataDir</td><td>RYSTORE_DATA_DIR</td><td>~/.rycode/storage</td></tr>
 *   <tr><td>syncEnabled</td><td>rystore.syncEnabled</td><td>RYSTORE_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>verifyWrites</td><td>rystore.verifyWrites</td><td>RYSTORE_VERIFY_WRITES</td><td>false</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>rystore.minFreeSpaceMb</td><td>RYSTORE_MIN_FREE_SPACE_MB</td><td>16</td></tr>
 *   <tr><td>maxRecordSizeMb</td><td>rystore.maxRecordSizeMb</td><td>RYSTORE_MAX_RECORD_SIZE_MB</td><td>10</td></tr>
 *   <tr><td>lockTimeoutMs</td><td>rystore.lockTimeoutMs</td><td>RYSTORE_LOCK_TIMEOUT_MS</td><td>30000</td></tr>
 *   <tr><td>kdfIterations</td><td>rystore.kdfIterations</td><td>RYSTORE_KDF_ITERATIONS</td><td>100000</td></tr>
 *   <tr><td>sensitiveNamespaces</td><td>rystore.sensitiveNamespaces</td><td>RYSTORE_SENSITIVE_NAMESPACES</td><td>auth,credential,secret</td></tr>
 *   <tr><td>encryptionKey</td><td>-</td><td>RYCODE_ENCRYPTION_KEY</td><td>(none: plaintext)</td></tr>
 * </table>
 * <p>
 * The encryption key is only taken from the builder or the environment, never
 * from a properties file or system property, and is masked in {@link #toString()}.
 * <p>
 * {@code kdfIterations} must stay the same for the lifetime of a data
 * directory; encrypted records written with another count will not decrypt.
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * StoreConfig config = StoreConfig.builder()
 *     .dataDir(Path.of("/var/lib/rycode/storage"))
 *     .encryptionKey(System.getenv("RYCODE_ENCRYPTION_KEY"))
 *     .lockTimeout(Duration.ofSeconds(10))
 *     .build();
 *
 * try (FileRecordStore store = new FileRecordStore(config)) {
 *     store.open();
 *     store.write(StorageKey.of("session", "abc"), session);
 * }
 * </pre>
 */
public final class StoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(StoreConfig.class);

    private static final String PROPERTIES_FILE = "rystore.properties";

    // Property keys
    private static final String PROP_DATA_DIR = "rystore.dataDir";
    private static final String PROP_SYNC_ENABLED = "rystore.syncEnabled";
    private static final String PROP_VERIFY_WRITES = "rystore.verifyWrites";
    private static final String PROP_MIN_FREE_SPACE_MB = "rystore.minFreeSpaceMb";
    private static final String PROP_MAX_RECORD_SIZE_MB = "rystore.maxRecordSizeMb";
    private static final String PROP_LOCK_TIMEOUT_MS = "rystore.lockTimeoutMs";
    private static final String PROP_KDF_ITERATIONS = "rystore.kdfIterations";
    private static final String PROP_SENSITIVE_NAMESPACES = "rystore.sensitiveNamespaces";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "RYSTORE_DATA_DIR";
    private static final String ENV_SYNC_ENABLED = "RYSTORE_SYNC_ENABLED";
    private static final String ENV_VERIFY_WRITES = "RYSTORE_VERIFY_WRITES";
    private static final String ENV_MIN_FREE_SPACE_MB = "RYSTORE_MIN_FREE_SPACE_MB";
    private static final String ENV_MAX_RECORD_SIZE_MB = "RYSTORE_MAX_RECORD_SIZE_MB";
    private static final String ENV_LOCK_TIMEOUT_MS = "RYSTORE_LOCK_TIMEOUT_MS";
    private static final String ENV_KDF_ITERATIONS = "RYSTORE_KDF_ITERATIONS";
    private static final String ENV_SENSITIVE_NAMESPACES = "RYSTORE_SENSITIVE_NAMESPACES";

    /** The single master key variable. */
    public static final String ENV_ENCRYPTION_KEY = "RYCODE_ENCRYPTION_KEY";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".rycode", "storage");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final boolean DEFAULT_VERIFY_WRITES = false;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 16;
    private static final int DEFAULT_MAX_RECORD_SIZE_MB = 10;
    private static final long DEFAULT_LOCK_TIMEOUT_MS = 30_000L;
    private static final int DEFAULT_KDF_ITERATIONS = SecureEnvelope.DEFAULT_KDF_ITERATIONS;
    private static final String DEFAULT_SENSITIVE_NAMESPACES = "auth,credential,secret";

    private final Path dataDir;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int minFreeSpaceMb;
    private final int maxRecordSizeMb;
    private final Duration lockTimeout;
    private final int kdfIterations;
    private final Set<String> sensitiveNamespaces;
    private final String encryptionKey;

    private StoreConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.syncEnabled = builder.syncEnabled;
        this.verifyWrites = builder.verifyWrites;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.maxRecordSizeMb = builder.maxRecordSizeMb;
        this.lockTimeout = builder.lockTimeout;
        this.kdfIterations = builder.kdfIterations;
        this.sensitiveNamespaces = Set.copyOf(builder.sensitiveNamespaces);
        this.encryptionKey = builder.encryptionKey;
    }

    /** Root directory of the record tree. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether temp files and directories are fsynced before and after the rename. */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether every persisted record is read back and compared. */
    public boolean verifyWrites() {
        return verifyWrites;
    }

    /** Minimum free disk space in MB required before applying writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Maximum serialized JSON size of a record in MB. */
    public int maxRecordSizeMb() {
        return maxRecordSizeMb;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** Maximum serialized JSON size of a record in bytes. */
    public long maxRecordSizeBytes() {
        return (long) maxRecordSizeMb * 1024 * 1024;
    }

    /** Default bounded wait for every lock acquisition. */
    public Duration lockTimeout() {
        return lockTimeout;
    }

    /** PBKDF2 iterations for deriving per-record AES keys. */
    public int kdfIterations() {
        return kdfIterations;
    }

    /** First key segments whose record files are written owner-only. */
    public Set<String> sensitiveNamespaces() {
        return sensitiveNamespaces;
    }

    /** Whether a master key is configured; records are then written encrypted. */
    public boolean encryptionEnabled() {
        return encryptionKey != null;
    }

    /** Master key, or {@code null} when records are written unencrypted. */
    String encryptionKey() {
        return encryptionKey;
    }

    @Override
    public String toString() {
        return "StoreConfig{" +
                "dataDir=" + dataDir +
                ", syncEnabled=" + syncEnabled +
                ", verifyWrites=" + verifyWrites +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", maxRecordSizeMb=" + maxRecordSizeMb +
                ", lockTimeoutMs=" + lockTimeout.toMillis() +
                ", kdfIterations=" + kdfIterations +
                ", sensitiveNamespaces=" + sensitiveNamespaces +
                ", encryptionKey=" + (encryptionKey == null ? "(none)" : "****") +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code StoreConfig.builder().build()}.
     */
    public static StoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link StoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private Boolean syncEnabled;
        private Boolean verifyWrites;
        private Integer minFreeSpaceMb;
        private Integer maxRecordSizeMb;
        private Duration lockTimeout;
        private Integer kdfIterations;
        private Set<String> sensitiveNamespaces;
        private String encryptionKey;
        private boolean encryptionKeySet;

        private final Properties fileProperties;

        private Builder() {
            // Load properties file once
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables read-after-write verification (default: false). */
        public Builder verifyWrites(boolean verifyWrites) {
            this.verifyWrites = verifyWrites;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 16). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /** Sets maximum record size in MB (default: 10). */
        public Builder maxRecordSizeMb(int maxRecordSizeMb) {
            this.maxRecordSizeMb = maxRecordSizeMb;
            return this;
        }

        /** Sets the default lock timeout (default: 30 s). */
        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        /** Sets PBKDF2 iterations (default: 100000). */
        public Builder kdfIterations(int kdfIterations) {
            this.kdfIterations = kdfIterations;
            return this;
        }

        /** Sets the namespaces written with owner-only permissions. */
        public Builder sensitiveNamespaces(Set<String> sensitiveNamespaces) {
            this.sensitiveNamespaces = sensitiveNamespaces;
            return this;
        }

        /**
         * Sets the master key. {@code null} or blank explicitly disables
         * encryption, even if the environment variable is set.
         */
        public Builder encryptionKey(String encryptionKey) {
            this.encryptionKey = encryptionKey == null || encryptionKey.isBlank() ? null : encryptionKey;
            this.encryptionKeySet = true;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public StoreConfig build() {
            // Resolve each value with priority: programmatic > sysprop > env > file > default
            if (dataDir == null) {
                dataDir = resolvePath(PROP_DATA_DIR, ENV_DATA_DIR, DEFAULT_DATA_DIR);
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (verifyWrites == null) {
                verifyWrites = resolveBoolean(PROP_VERIFY_WRITES, ENV_VERIFY_WRITES, DEFAULT_VERIFY_WRITES);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = (int) resolveLong(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxRecordSizeMb == null) {
                maxRecordSizeMb = (int) resolveLong(PROP_MAX_RECORD_SIZE_MB, ENV_MAX_RECORD_SIZE_MB, DEFAULT_MAX_RECORD_SIZE_MB);
            }
            if (lockTimeout == null) {
                lockTimeout = Duration.ofMillis(resolveLong(PROP_LOCK_TIMEOUT_MS, ENV_LOCK_TIMEOUT_MS, DEFAULT_LOCK_TIMEOUT_MS));
            }
            if (kdfIterations == null) {
                kdfIterations = (int) resolveLong(PROP_KDF_ITERATIONS, ENV_KDF_ITERATIONS, DEFAULT_KDF_ITERATIONS);
            }
            if (sensitiveNamespaces == null) {
                sensitiveNamespaces = parseNamespaces(
                        resolveString(PROP_SENSITIVE_NAMESPACES, ENV_SENSITIVE_NAMESPACES, DEFAULT_SENSITIVE_NAMESPACES));
            }
            if (!encryptionKeySet) {
                String fromEnv = System.getenv(ENV_ENCRYPTION_KEY);
                encryptionKey = fromEnv == null || fromEnv.isBlank() ? null : fromEnv;
            }

            if (maxRecordSizeMb < 1) {
                throw new IllegalArgumentException("maxRecordSizeMb must be at least 1: " + maxRecordSizeMb);
            }
            if (minFreeSpaceMb < 0) {
                throw new IllegalArgumentException("minFreeSpaceMb must not be negative: " + minFreeSpaceMb);
            }
            if (lockTimeout.isNegative()) {
                throw new IllegalArgumentException("lockTimeout must not be negative: " + lockTimeout);
            }
            if (kdfIterations < 1) {
                throw new IllegalArgumentException("kdfIterations must be positive: " + kdfIterations);
            }

            return new StoreConfig(this);
        }

        private String resolveString(String sysProp, String envVar, String defaultValue) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 4. Default
            return defaultValue;
        }

        private Path resolvePath(String sysProp, String envVar, Path defaultValue) {
            String value = resolveString(sysProp, envVar, null);
            return value == null ? defaultValue : Path.of(value);
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = resolveString(sysProp, envVar, null);
            return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
        }

        private long resolveLong(String sysProp, String envVar, long defaultValue) {
            String value = resolveString(sysProp, envVar, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric value '{}' for {}, using default {}", value, sysProp, defaultValue);
                return defaultValue;
            }
        }

        private static Set<String> parseNamespaces(String value) {
            return Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toUnmodifiableSet());
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = StoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
