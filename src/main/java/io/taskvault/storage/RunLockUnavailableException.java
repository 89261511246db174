package io.taskvault.storage;

import java.nio.file.Path;

public final class RunLockUnavailableException extends RuntimeException {
    private final Path lockFile;

    public RunLockUnavailableException(Path lockFile) {
        super("Another cycle holds the run lock: " + lockFile);
        this.lockFile = lockFile;
    }

    public Path lockFile() {
        return lockFile;
    }
}
