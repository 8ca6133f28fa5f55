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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.rystore.storage.lock.LockDiagnostics;
import dev.mars.rystore.storage.lock.LockHandle;
import dev.mars.rystore.storage.lock.LockMode;
import dev.mars.rystore.storage.lock.ResourceLockManager;
import dev.mars.rystore.storage.secure.SecureEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * File-based implementation of {@link RecordStore}.
 * <p>
 * Each record is one file; the key's segments are the directory path:
 * <pre>
 * dataDir/
 *  ├─ .rystore.lock               // process lock, held while open
 *  ├─ session/
 *  │   └─ proj-1/
 *  │       └─ ses-42.json          // checksum:envelope
 *  └─ auth/
 *      └─ anthropic.json          // rw------- (sensitive namespace)
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * Every file access happens under a {@link ResourceLockManager} lock on the
 * file's canonical path: shared for reads, exclusive for writes and removes.
 * Operations on different keys do not block each other.
 * <p>
 * <b>Durability:</b>
 * Records are replaced atomically: write temp &rarr; fsync &rarr; rename &rarr; fsync dir.
 * <p>
 * <b>Protection Mechanisms:</b>
 * <ul>
 *   <li><b>File Locking:</b> Exclusive lock on {@code .rystore.lock} prevents a second
 *       process from opening the same data directory.</li>
 *   <li><b>Disk Space Checking:</b> Pre-flight check before writes so a full disk fails
 *       before a record is touched.</li>
 *   <li><b>Read-After-Write Verification:</b> Optional read-back of every persisted record.</li>
 *   <li><b>Integrity Checksums:</b> Every record carries a SHA-256 checksum that is
 *       verified before decryption.</li>
 * </ul>
 *
 * @see RecordStore
 */
public final class FileRecordStore implements RecordStore {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileRecordStore.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Lock file name */
    static final String LOCK_FILE = ".rystore.lock";

    /** Temp file suffix */
    static final String TMP_SUFFIX = ".tmp";

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private static final Set<OpenOption> TMP_OPEN_OPTIONS =
            Set.of(StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);

    private static final FileAttribute<?>[] NO_ATTRIBUTES = new FileAttribute<?>[0];

    // ========================================================================
    // State
    // ========================================================================

    private final StoreConfig config;
    private final Path root;
    private final RecordCodec codec;
    private final ResourceLockManager locks;
    private final TransactionManager transactions;
    private final Duration lockTimeout;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final long minFreeSpace;
    private final Set<String> sensitiveNamespaces;

    private FileChannel lockChannel;
    private FileLock processLock;
    private volatile boolean opened = false;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a store with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     *
     * @see StoreConfig
     */
    public FileRecordStore() {
        this(StoreConfig.load());
    }

    public FileRecordStore(StoreConfig config) {
        this(config, RecordCodec.defaultMapper());
    }

    /**
     * Creates a store that maps records with a caller-supplied {@link ObjectMapper}.
     */
    public FileRecordStore(StoreConfig config, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config");
        this.root = config.dataDir().toAbsolutePath().normalize();
        this.syncEnabled = config.syncEnabled();
        this.verifyWrites = config.verifyWrites();
        this.minFreeSpace = config.minFreeSpaceBytes();
        this.lockTimeout = config.lockTimeout();
        this.sensitiveNamespaces = config.sensitiveNamespaces();

        SecureEnvelope envelope = config.encryptionEnabled()
                ? SecureEnvelope.withKey(config.encryptionKey(), config.kdfIterations())
                : SecureEnvelope.plaintextOnly();
        this.codec = new RecordCodec(mapper, envelope, config.maxRecordSizeBytes());
        this.locks = new ResourceLockManager(lockTimeout);
        this.transactions = new TransactionManager(this, locks, lockTimeout);

        LOG.info("FileRecordStore initialized: root={}, encryption={}, syncEnabled={}, verifyWrites={}, maxRecordSize={} MB",
                root, envelope.hasKey() ? "enabled" : "disabled", syncEnabled, verifyWrites, config.maxRecordSizeMb());

        if (!syncEnabled) {
            LOG.warn("FileRecordStore created with fsync DISABLED. Do NOT use in production!");
        }
        if (!envelope.hasKey()) {
            LOG.info("No {} configured; records are stored as integrity-checked plaintext",
                    StoreConfig.ENV_ENCRYPTION_KEY);
        }
    }

    public StoreConfig config() {
        return config;
    }

    /** Absolute, normalized data directory. */
    public Path root() {
        return root;
    }

    public boolean encryptionEnabled() {
        return codec.envelope().hasKey();
    }

    /** Current lock table, for operational visibility. */
    public SortedMap<String, LockDiagnostics> lockDiagnostics() {
        return locks.diagnostics();
    }

    public TransactionManager transactions() {
        return transactions;
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    @Override
    public synchronized void open() {
        if (closed) {
            throw new IllegalStateException("Store has been closed: " + root);
        }
        if (opened) {
            LOG.debug("Store already open, ignoring duplicate open()");
            return;
        }
        try {
            LOG.info("Opening record store at: {}", root);
            Files.createDirectories(root);

            // Acquire exclusive lock to prevent multiple processes
            acquireProcessLock();

            // Check available disk space
            checkDiskSpace();

            opened = true;
            LOG.info("Record store opened: {}", root);
        } catch (IOException e) {
            LOG.error("Failed to open record store at {}: {}", root, e.getMessage(), e);
            releaseProcessLock();
            throw new StorageException("Failed to open record store at " + root, e);
        } catch (RuntimeException e) {
            releaseProcessLock();
            throw e;
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            LOG.debug("Store already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        int active = transactions.activeCount();
        if (active > 0) {
            LOG.warn("Closing record store with {} open transaction(s)", active);
        }
        releaseProcessLock();
        LOG.info("Record store closed: {}", root);
    }

    // ========================================================================
    // Single-key operations
    // ========================================================================

    @Override
    public <T> Optional<T> read(StorageKey key, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return readBytes(key).map(bytes -> codec.decode(key, bytes, type));
    }

    @Override
    public Optional<JsonNode> read(StorageKey key) {
        return readBytes(key).map(bytes -> codec.decodeTree(key, bytes));
    }

    private Optional<byte[]> readBytes(StorageKey key) {
        ensureOpen();
        Objects.requireNonNull(key, "key");
        try (LockHandle ignored = locks.acquire(resourceOf(key), LockMode.SHARED, lockTimeout)) {
            return readLocked(key);
        }
    }

    @Override
    public void write(StorageKey key, Object record) {
        ensureOpen();
        Objects.requireNonNull(key, "key");
        byte[] bytes = codec.encode(key, record);
        try (LockHandle ignored = locks.acquire(resourceOf(key), LockMode.EXCLUSIVE, lockTimeout)) {
            checkDiskSpace();
            persistLocked(key, bytes);
        }
    }

    @Override
    public void remove(StorageKey key) {
        ensureOpen();
        Objects.requireNonNull(key, "key");
        try (LockHandle ignored = locks.acquire(resourceOf(key), LockMode.EXCLUSIVE, lockTimeout)) {
            deleteLocked(key);
        }
    }

    @Override
    public <T> Optional<T> update(StorageKey key, Class<T> type, UnaryOperator<T> fn) {
        ensureOpen();
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(fn, "fn");
        try (LockHandle ignored = locks.acquire(resourceOf(key), LockMode.EXCLUSIVE, lockTimeout)) {
            Optional<byte[]> current = readLocked(key);
            if (current.isEmpty()) {
                LOG.debug("update() on absent key {}, nothing written", key);
                return Optional.empty();
            }
            T updated = fn.apply(codec.decode(key, current.get(), type));
            byte[] bytes = codec.encode(key, updated);
            checkDiskSpace();
            persistLocked(key, bytes);
            return Optional.of(updated);
        }
    }

    // ========================================================================
    // Listing
    // ========================================================================

    @Override
    public List<StorageKey> list(List<String> prefix) {
        try (Stream<StorageKey> keys = stream(prefix)) {
            return keys.sorted().collect(Collectors.toList());
        }
    }

    @Override
    public Stream<StorageKey> stream(List<String> prefix) {
        ensureOpen();
        List<String> segments = StorageKey.validatePrefix(prefix);
        Path dir = root;
        for (String segment : segments) {
            dir = dir.resolve(segment);
        }
        return walk(dir);
    }

    /**
     * Lazily walks {@code dir} without taking locks. Dot-prefixed entries
     * (the lock file, in-flight temp files) are dropped by name before
     * anything stats them, and entries that vanish mid-walk are skipped.
     */
    private Stream<StorageKey> walk(Path dir) {
        DirectoryStream<Path> entries;
        try {
            entries = Files.newDirectoryStream(dir, entry -> !entry.getFileName().toString().startsWith("."));
        } catch (NoSuchFileException | NotDirectoryException e) {
            LOG.trace("Nothing to list at {}: {}", dir, e.toString());
            return Stream.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to list records under " + dir, e);
        }
        Iterator<Path> raw = entries.iterator();
        Iterator<Path> guarded = new Iterator<>() {
            @Override
            public boolean hasNext() {
                try {
                    return raw.hasNext();
                } catch (DirectoryIteratorException e) {
                    throw new StorageException("Failed to list records under " + dir, e.getCause());
                }
            }

            @Override
            public Path next() {
                try {
                    return raw.next();
                } catch (DirectoryIteratorException e) {
                    throw new StorageException("Failed to list records under " + dir, e.getCause());
                }
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(guarded, Spliterator.NONNULL), false)
                .onClose(() -> closeListing(dir, entries))
                .flatMap(entry -> Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)
                        ? walk(entry)
                        : keyOf(entry).stream());
    }

    private static void closeListing(Path dir, DirectoryStream<Path> entries) {
        try {
            entries.close();
        } catch (IOException e) {
            LOG.debug("Could not close listing of {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Maps a record file back to its key. Lock files, temp files and anything
     * that is not a valid record path are skipped.
     */
    private Optional<StorageKey> keyOf(Path file) {
        Path relative = root.relativize(file);
        List<String> segments = new ArrayList<>(relative.getNameCount());
        for (Path part : relative) {
            segments.add(part.toString());
        }
        String last = segments.get(segments.size() - 1);
        if (!last.endsWith(StorageKey.FILE_SUFFIX) || last.length() == StorageKey.FILE_SUFFIX.length()) {
            return Optional.empty();
        }
        segments.set(segments.size() - 1, last.substring(0, last.length() - StorageKey.FILE_SUFFIX.length()));
        try {
            return Optional.of(new StorageKey(segments));
        } catch (ValidationException e) {
            LOG.trace("Skipping non-record file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    // ========================================================================
    // Transactions & maintenance
    // ========================================================================

    @Override
    public Transaction beginTransaction() {
        ensureOpen();
        return transactions.begin();
    }

    @Override
    public int migrateToEncrypted() {
        ensureOpen();
        if (!encryptionEnabled()) {
            throw new StorageException("Cannot migrate to encrypted storage: no " +
                    StoreConfig.ENV_ENCRYPTION_KEY + " configured");
        }
        LOG.info("Migrating records under {} to encrypted storage", root);
        int migrated = 0;
        int alreadyEncrypted = 0;
        for (StorageKey key : list(List.of())) {
            try (LockHandle ignored = locks.acquire(resourceOf(key), LockMode.EXCLUSIVE, lockTimeout)) {
                Optional<byte[]> stored = readLocked(key);
                if (stored.isEmpty()) {
                    continue;
                }
                if (codec.isEncrypted(stored.get())) {
                    alreadyEncrypted++;
                    continue;
                }
                byte[] json = codec.unseal(key, stored.get());
                persistLocked(key, codec.seal(json));
                migrated++;
                LOG.debug("Migrated {} to encrypted storage", key);
            }
        }
        LOG.info("Encryption migration complete: {} migrated, {} already encrypted", migrated, alreadyEncrypted);
        return migrated;
    }

    // ========================================================================
    // Locked primitives (caller holds the key's lock)
    // ========================================================================

    String resourceOf(StorageKey key) {
        return key.canonicalPath(root);
    }

    RecordCodec codec() {
        return codec;
    }

    void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Store has been closed: " + root);
        }
        if (!opened) {
            throw new IllegalStateException("Store is not open: " + root);
        }
    }

    private Optional<byte[]> readLocked(StorageKey key) {
        Path file = key.toPath(root);
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            LOG.error("Failed to read {}: {}", file, e.getMessage());
            throw new StorageException("Failed to read record " + key, e);
        }
    }

    /**
     * Atomically replaces the record file with {@code bytes}.
     * <p>
     * Caller must hold the exclusive lock on {@code key}.
     */
    void persistLocked(StorageKey key, byte[] bytes) {
        Path file = key.toPath(root);
        Path dir = file.getParent();
        Path tmp = dir.resolve("." + file.getFileName() + "." + UUID.randomUUID() + TMP_SUFFIX);
        try {
            Files.createDirectories(dir);

            // Write to temp file, created owner-only for sensitive namespaces
            try (FileChannel ch = FileChannel.open(tmp, TMP_OPEN_OPTIONS, tempFileAttributes(key, dir))) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (syncEnabled) {
                    ch.force(true);
                    LOG.trace("Synced temp file {}", tmp);
                }
            }

            // Atomic rename
            moveIntoPlace(tmp, file);

            // Fsync directory (critical on Linux)
            if (syncEnabled) {
                syncDirectory(dir);
            }

            if (verifyWrites) {
                verifyWrittenRecord(file, bytes);
            }
            LOG.debug("Persisted {} ({} bytes)", key, bytes.length);
        } catch (IOException e) {
            LOG.error("Failed to write {}: {}", file, e.getMessage(), e);
            deleteTempQuietly(tmp);
            throw new StorageException("Failed to write record " + key, e);
        }
    }

    /**
     * Deletes the record file if present.
     * <p>
     * Caller must hold the exclusive lock on {@code key}.
     */
    void deleteLocked(StorageKey key) {
        Path file = key.toPath(root);
        try {
            if (Files.deleteIfExists(file)) {
                if (syncEnabled) {
                    syncDirectory(file.getParent());
                }
                LOG.debug("Removed {}", key);
            } else {
                LOG.trace("Remove of absent key {}", key);
            }
        } catch (IOException e) {
            LOG.error("Failed to remove {}: {}", file, e.getMessage(), e);
            throw new StorageException("Failed to remove record " + key, e);
        }
    }

    /**
     * Checks that sufficient disk space is available.
     *
     * @throws StorageException if disk space is below minimum threshold
     */
    void checkDiskSpace() {
        if (minFreeSpace <= 0) {
            return;
        }
        long usableSpace;
        try {
            FileStore store = Files.getFileStore(root);
            usableSpace = store.getUsableSpace();
        } catch (IOException e) {
            throw new StorageException("Could not determine free disk space for " + root, e);
        }
        long usableSpaceMb = usableSpace / 1024 / 1024;
        long minFreeSpaceMb = minFreeSpace / 1024 / 1024;

        LOG.trace("Disk space check: {} MB available, {} MB required", usableSpaceMb, minFreeSpaceMb);

        if (usableSpace < minFreeSpace) {
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpaceMb, minFreeSpaceMb);
            throw new StorageException(
                    "Insufficient disk space: " + usableSpaceMb + " MB available, " +
                    "need at least " + minFreeSpaceMb + " MB");
        }
    }

    // ========================================================================
    // File helpers
    // ========================================================================

    private void moveIntoPlace(Path tmp, Path file) throws IOException {
        try {
            Files.move(tmp, file,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic move not supported for {}, falling back to plain replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        LOG.trace("Atomic rename: {} -> {}", tmp, file);
    }

    /**
     * Creation attributes for a record's temp file. Records in sensitive
     * namespaces are owner-only from the moment the file exists, and the
     * rename carries that mode over to the record file.
     */
    FileAttribute<?>[] tempFileAttributes(StorageKey key, Path dir) throws IOException {
        if (!sensitiveNamespaces.contains(key.namespace())) {
            return NO_ATTRIBUTES;
        }
        if (!Files.getFileStore(dir).supportsFileAttributeView(PosixFileAttributeView.class)) {
            LOG.debug("POSIX permissions not supported, leaving default permissions for {}", key);
            return NO_ATTRIBUTES;
        }
        return new FileAttribute<?>[]{PosixFilePermissions.asFileAttribute(OWNER_ONLY)};
    }

    private void deleteTempQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.debug("Could not delete temp file {}: {}", tmp, e.getMessage());
        }
    }

    /**
     * Syncs a directory to ensure rename operations are durable.
     * <p>
     * On Linux, directory entries are not guaranteed to be persisted
     * until the directory itself is fsynced.
     */
    private void syncDirectory(Path dir) throws IOException {
        // Skip on Windows - directory sync isn't supported the same way
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some systems don't support directory fsync - log but continue
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Reads a persisted record back and compares it byte for byte.
     *
     * @throws StorageException if the file content differs
     */
    private void verifyWrittenRecord(Path file, byte[] expected) throws IOException {
        byte[] actual = Files.readAllBytes(file);
        if (!Arrays.equals(actual, expected)) {
            LOG.error("Write verification failed for {}: wrote {} bytes, read back {} bytes",
                    file, expected.length, actual.length);
            throw new StorageException("Write verification failed for " + file +
                    ": content read back differs from content written. Possible silent data corruption!");
        }
        LOG.trace("Write verification passed for {}", file);
    }

    /**
     * Acquires an exclusive lock on the data directory to prevent multiple processes.
     * <p>
     * Uses a separate lock file to avoid holding a lock on any record file.
     *
     * @throws StorageException if lock cannot be acquired (another process holds it)
     */
    private void acquireProcessLock() throws IOException {
        Path lockPath = root.resolve(LOCK_FILE);
        LOG.debug("Acquiring process lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            processLock = lockChannel.tryLock();
            if (processLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire process lock: another process holds the lock");
                throw new StorageException(
                        "Cannot acquire exclusive lock on data directory: " + root +
                        ". Another process may be using this storage.");
            }
            LOG.info("Process lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire process lock: lock already held in this JVM");
            throw new StorageException(
                    "Cannot acquire exclusive lock on " + root + ": already open in this JVM", e);
        }
    }

    /**
     * Releases the process lock and closes the lock channel.
     */
    private void releaseProcessLock() {
        try {
            if (processLock != null && processLock.isValid()) {
                processLock.release();
                LOG.debug("Process lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
                LOG.trace("Lock channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }
}
