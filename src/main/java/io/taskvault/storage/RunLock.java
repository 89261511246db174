package io.taskvault.storage;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive lock on {@code vault.lock} held for the whole cycle. Only one writer may
 * mutate the vault at a time; a second caller fails fast instead of waiting.
 */
public final class RunLock implements AutoCloseable {
    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;

    private RunLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }

    public static RunLock acquire(Path lockFile) {
        FileChannel channel = null;
        try {
            Files.createDirectories(lockFile.toAbsolutePath().getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                closeChannel(channel);
                throw new RunLockUnavailableException(lockFile);
            }
            return new RunLock(lockFile, channel, lock);
        } catch (OverlappingFileLockException e) {
            // Same JVM already holds it.
            closeChannel(channel);
            throw new RunLockUnavailableException(lockFile);
        } catch (IOException e) {
            closeChannel(channel);
            throw new StateStoreException("Failed to open run lock: " + lockFile, e);
        }
    }

    public Path lockFile() {
        return lockFile;
    }

    public boolean isHeld() {
        return lock.isValid();
    }

    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
            }
            channel.close();
        } catch (IOException e) {
            throw new StateStoreException("Failed to release run lock: " + lockFile, e);
        }
    }

    private static void closeChannel(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            throw new StateStoreException("Failed to close run lock channel", e);
        }
    }
}
