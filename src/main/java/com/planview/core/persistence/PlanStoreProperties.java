package com.planview.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Where the plan document lives and how many compaction backups are kept.
 */
@Component
@ConfigurationProperties(prefix = "planview")
public class PlanStoreProperties {

    private String file = "plan.json";
    private String backupDir = ".claude/plan-view";
    private int maxBackups = 5;

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public String getBackupDir() {
        return backupDir;
    }

    public void setBackupDir(String backupDir) {
        this.backupDir = backupDir;
    }

    public int getMaxBackups() {
        return maxBackups;
    }

    public void setMaxBackups(int maxBackups) {
        this.maxBackups = maxBackups;
    }

    public Path defaultPlanFile() {
        return Path.of(file);
    }

    /**
     * A relative backup directory is resolved against the plan file's directory.
     */
    public Path resolveBackupDir(Path planFile) {
        Path dir = Path.of(backupDir);
        if (dir.isAbsolute()) {
            return dir;
        }
        Path parent = planFile.toAbsolutePath().getParent();
        return parent == null ? dir : parent.resolve(dir);
    }
}
