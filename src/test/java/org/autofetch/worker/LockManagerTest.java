package org.autofetch.worker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LockManagerTest {

    @TempDir
    Path lockDir;

    @Test
    void acquiresAndKeepsLockFile() {
        LockManager locks = new LockManager(lockDir);

        assertTrue(locks.tryAcquire("A"));
        assertTrue(Files.exists(lockDir.resolve("A.lck")));
        assertFalse(locks.tryAcquire("A"), "already held by this process");
    }

    @Test
    void heldLockIsNotAcquiredUntilHolderReleases() throws Exception {
        Path file = new LockManager(lockDir).lockFile("B");
        FileChannel holder = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock held = holder.tryLock();
        assertNotNull(held);

        assertFalse(new LockManager(lockDir).tryAcquire("B"));

        holder.close();
        assertTrue(new LockManager(lockDir).tryAcquire("B"));
    }

    @Test
    void distinctNamesUseDistinctFiles() {
        LockManager locks = new LockManager(lockDir);

        assertNotEquals(locks.lockFile("a/b"), locks.lockFile("a-b"));
        assertTrue(locks.tryAcquire("a/b"));
        assertTrue(locks.tryAcquire("a-b"));
    }

    @Test
    void lockFileLivesInLockDirectory() {
        assertEquals(lockDir.resolve("daily.lck"), new LockManager(lockDir).lockFile("daily"));
    }

    @Test
    void newLockFileIsWritableByGroupAndOthers() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));

        assertTrue(new LockManager(lockDir).tryAcquire("shared"));

        Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(lockDir.resolve("shared.lck"));
        assertEquals(LockManager.LOCK_FILE_PERMISSIONS, permissions);
        assertTrue(permissions.contains(PosixFilePermission.GROUP_WRITE));
        assertTrue(permissions.contains(PosixFilePermission.OTHERS_WRITE));
    }
}
