package com.costguard.anomaly.report;

import com.costguard.anomaly.model.DetectionRun;
import java.util.Optional;

/**
 * Append-only store of detection runs. Retention is managed outside the service (for example an S3 lifecycle rule).
 */
public interface AnomalyReportRepository {

    void append(DetectionRun run);

    Optional<DetectionRun> findLatest();
}
