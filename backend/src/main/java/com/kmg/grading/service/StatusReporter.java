package com.kmg.grading.service;

import com.kmg.grading.dto.BatchProgress;
import com.kmg.grading.model.BatchSnapshot;
import com.kmg.grading.model.JobRecord;
import com.kmg.grading.model.JobStatus;
import org.springframework.stereotype.Service;

/**
 * Summarizes a batch snapshot for display. Read-only.
 */
@Service
public class StatusReporter {

    public BatchProgress report(BatchSnapshot batch) {
        int total = batch.started() ? batch.jobs().size() : batch.pendingSubmissions().size();
        int waiting = 0;
        int inFlight = 0;
        int completed = 0;
        int failed = 0;
        int cancelled = 0;

        for (JobRecord job : batch.jobs()) {
            if (job.status() == JobStatus.WAITING) {
                waiting++;
            } else if (job.status().isInFlight()) {
                inFlight++;
            } else if (job.status() == JobStatus.COMPLETED) {
                completed++;
            } else if (job.status() == JobStatus.FAILED) {
                failed++;
                if (job.failure() != null && job.failure().isCancellation()) {
                    cancelled++;
                }
            }
        }
        if (!batch.started()) {
            waiting = total;
        }

        int processed = completed + failed;
        double percent = total > 0 ? Math.round(processed * 1000.0 / total) / 10.0 : 0.0;
        JobRecord current = currentJob(batch);

        return new BatchProgress(
                total,
                waiting,
                inFlight,
                completed,
                failed,
                cancelled,
                processed,
                percent,
                current == null ? null : current.id(),
                current == null ? null : current.sourceDocument(),
                statusText(batch, current, total, processed, completed, failed)
        );
    }

    private JobRecord currentJob(BatchSnapshot batch) {
        JobRecord atCursor = batch.currentJob();
        if (atCursor != null) {
            return atCursor;
        }
        return batch.jobs().stream()
                .filter(job -> job.status().isInFlight())
                .findFirst()
                .orElse(null);
    }

    private String statusText(BatchSnapshot batch, JobRecord current, int total, int processed, int completed,
                              int failed) {
        if (!batch.started()) {
            return "Waiting to start";
        }
        if (current != null && !current.status().isTerminal()) {
            String text = "Processing: " + current.sourceDocument();
            if (current.stageDetail() != null && !current.stageDetail().isBlank()) {
                text += " - " + current.stageDetail();
            }
            return text;
        }
        if (batch.processing()) {
            return "Starting evaluation...";
        }
        if (batch.cancelled()) {
            return "Cancelled after " + processed + " of " + total + " students";
        }
        if (processed < total) {
            return processed + " of " + total + " students evaluated";
        }
        if (failed == 0) {
            return "All evaluations completed successfully!";
        }
        if (completed == 0) {
            return "All evaluations failed";
        }
        return "Completed with " + failed + " error" + (failed > 1 ? "s" : "");
    }
}
