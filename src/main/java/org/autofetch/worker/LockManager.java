package org.autofetch.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-job advisory locks on {@code <lockDirectory>/<file-id>.lck}.
 * <p>
 * An acquired lock is kept for the rest of the process's life and released by the
 * operating system when the process exits, however it exits. Lock files are never deleted.
 * A new lock file is made readable and writable by everyone regardless of the umask, so
 * daemons running under different accounts can share one lock directory.
 */
public class LockManager {
    private static final Logger logger = LoggerFactory.getLogger(LockManager.class);

    static final Set<PosixFilePermission> LOCK_FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-rw-rw-");

    private final Path lockDirectory;
    // strong references: a collected channel would drop its lock
    private final Map<String, FileLock> held = new ConcurrentHashMap<>();

    public LockManager(Path lockDirectory) {
        this.lockDirectory = lockDirectory;
    }

    public Path lockFile(String jobName) {
        return lockDirectory.resolve(FileIds.of(jobName) + ".lck");
    }

    /**
     * Non-blocking attempt to take the job's exclusive lock.
     *
     * @return true if this process now holds the lock, false if another holder has it
     */
    public boolean tryAcquire(String jobName) {
        if (held.containsKey(jobName)) {
            return false;
        }
        Path file = lockFile(jobName);
        FileChannel channel;
        try {
            createShared(file);
            channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open lock file " + file, e);
        }

        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        } catch (IOException e) {
            closeQuietly(channel, file);
            throw new UncheckedIOException("Cannot lock " + file, e);
        }

        if (lock == null) {
            closeQuietly(channel, file);
            logger.debug("Lock {} is held elsewhere", file);
            return false;
        }
        held.put(jobName, lock);
        logger.debug("Acquired lock {}", file);
        return true;
    }

    private static void createShared(Path file) throws IOException {
        try {
            Files.createFile(file);
        } catch (FileAlreadyExistsException e) {
            return;
        }
        try {
            Files.setPosixFilePermissions(file, LOCK_FILE_PERMISSIONS);
        } catch (UnsupportedOperationException e) {
            logger.debug("No POSIX permissions for {}, keeping defaults", file);
        }
    }

    private static void closeQuietly(FileChannel channel, Path file) {
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Failed to close lock file {}: {}", file, e.getMessage(), e);
        }
    }
}
