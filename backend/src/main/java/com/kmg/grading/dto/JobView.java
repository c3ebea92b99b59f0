package com.kmg.grading.dto;

import com.kmg.grading.model.FailureKind;
import com.kmg.grading.model.JobRecord;
import com.kmg.grading.model.JobStatus;

public record JobView(
        int id,
        String sourceDocument,
        String externalJobId,
        JobStatus status,
        String stageDetail,
        FailureKind failureKind,
        String failureMessage,
        int attempt,
        long rateLimitDelayMillis,
        String startedAt,
        String endedAt,
        EvaluationResultView result
) {
    public static JobView from(JobRecord job) {
        return new JobView(
                job.id(),
                job.sourceDocument(),
                job.externalJobId(),
                job.status(),
                job.stageDetail(),
                job.failure() == null ? null : job.failure().kind(),
                job.failure() == null ? null : job.failure().message(),
                job.attempt(),
                job.rateLimitDelay().toMillis(),
                toText(job.startedAt()),
                toText(job.endedAt()),
                job.result() == null ? null : EvaluationResultView.from(job.result())
        );
    }

    private static String toText(Object value) {
        return value == null ? null : value.toString();
    }
}
