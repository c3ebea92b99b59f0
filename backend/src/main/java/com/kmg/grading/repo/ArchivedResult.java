package com.kmg.grading.repo;

import java.time.OffsetDateTime;

public record ArchivedResult(
        String batchId,
        int jobIndex,
        int attempt,
        String sourceDocument,
        String externalJobId,
        String scoringMode,
        double grandTotal,
        double maxPossible,
        boolean passed,
        String resultJson,
        OffsetDateTime completedAt
) {
}
