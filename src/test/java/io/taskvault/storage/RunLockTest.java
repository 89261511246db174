package io.taskvault.storage;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

final class RunLockTest {

    @Test
    void secondAcquireFailsFastUntilReleased() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-lock-");
        try {
            Path lockFile = TaskVaultConfig.fromRoot(root.toString()).lockFile();
            RunLock first = RunLock.acquire(lockFile);
            Assertions.assertTrue(first.isHeld());

            RunLockUnavailableException error = Assertions.assertThrows(RunLockUnavailableException.class,
                    () -> RunLock.acquire(lockFile));
            Assertions.assertTrue(error.getMessage().contains("vault.lock"));

            first.close();
            Assertions.assertFalse(first.isHeld());
            try (RunLock again = RunLock.acquire(lockFile)) {
                Assertions.assertTrue(again.isHeld());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
