package com.planview.core.compaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Keeps numbered snapshots {@code <name>.1 .. <name>.K} of a plan file, where
 * {@code .1} is always the most recent one.
 */
@Component
public class BackupRotator {

    private static final Logger log = LoggerFactory.getLogger(BackupRotator.class);

    /**
     * Shifts existing snapshots up by one, dropping {@code <name>.K} and any
     * higher-numbered snapshot left over from a larger K. Missing snapshots are
     * skipped, so an empty directory is a no-op.
     *
     * @param backupDir  directory holding the snapshots
     * @param baseName   file name the numeric suffix is appended to
     * @param maxBackups K, the number of snapshots to keep
     */
    public void rotate(Path backupDir, String baseName, int maxBackups) {
        try {
            pruneFrom(backupDir, baseName, maxBackups);
            for (int i = maxBackups - 1; i >= 1; i--) {
                Path from = snapshot(backupDir, baseName, i);
                if (Files.exists(from)) {
                    Files.move(from, snapshot(backupDir, baseName, i + 1), StandardCopyOption.REPLACE_EXISTING);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to rotate backups in " + backupDir, e);
        }
    }

    /**
     * Rotates, then copies {@code source} as {@code <source name>.1}.
     *
     * @return the path of the new {@code .1} snapshot
     */
    public Path backup(Path source, Path backupDir, int maxBackups) {
        if (maxBackups < 1) {
            throw new IllegalArgumentException("maxBackups must be at least 1, got " + maxBackups);
        }
        String baseName = source.getFileName().toString();
        try {
            Files.createDirectories(backupDir);
            rotate(backupDir, baseName, maxBackups);
            Path latest = snapshot(backupDir, baseName, 1);
            Files.copy(source, latest, StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up {} to {}", source, latest);
            return latest;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to back up " + source, e);
        }
    }

    private static void pruneFrom(Path backupDir, String baseName, int maxBackups) throws IOException {
        if (!Files.isDirectory(backupDir)) {
            return;
        }
        String prefix = baseName + ".";
        List<Path> stale;
        try (Stream<Path> entries = Files.list(backupDir)) {
            stale = entries
                    .filter(path -> isSnapshotAtOrAbove(path.getFileName().toString(), prefix, maxBackups))
                    .toList();
        }
        for (Path path : stale) {
            Files.deleteIfExists(path);
            log.debug("Dropped backup {}", path);
        }
    }

    private static boolean isSnapshotAtOrAbove(String fileName, String prefix, int maxBackups) {
        if (!fileName.startsWith(prefix)) {
            return false;
        }
        String suffix = fileName.substring(prefix.length());
        if (suffix.isEmpty() || !suffix.chars().allMatch(Character::isDigit)) {
            return false;
        }
        return new BigInteger(suffix).compareTo(BigInteger.valueOf(maxBackups)) >= 0;
    }

    static Path snapshot(Path backupDir, String baseName, int index) {
        return backupDir.resolve(baseName + "." + index);
    }
}
