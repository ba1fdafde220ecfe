package com.capitolsync.importer.checkpoint;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive advisory lock on the checkpoint directory, held for the lifetime of one import run.
 */
@Slf4j
public final class CheckpointLock implements AutoCloseable {

    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;

    private CheckpointLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * @throws ImportLockException when another run holds the lock or the lock file cannot be opened
     */
    public static CheckpointLock acquire(Path lockFile) {
        FileChannel channel = null;
        try {
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                closeQuietly(channel);
                throw new ImportLockException("Another import run holds " + lockFile);
            }
            log.debug("Acquired import lock {}", lockFile);
            return new CheckpointLock(lockFile, channel, lock);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new ImportLockException("Import lock " + lockFile + " is already held in this process", e);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new ImportLockException("Cannot open import lock " + lockFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            lock.release();
        } catch (IOException e) {
            log.warn("Failed to release import lock {}: {}", lockFile, e.getMessage());
        } finally {
            closeQuietly(channel);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close lock channel: {}", e.getMessage());
        }
    }
}
