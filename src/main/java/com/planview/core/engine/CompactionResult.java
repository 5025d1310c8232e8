package com.planview.core.engine;

import java.nio.file.Path;

/**
 * @param compacted number of completed tasks that were stripped
 * @param backup    the snapshot written before saving, {@code null} on a dry run
 */
public record CompactionResult(int compacted, Path backup) {
}
