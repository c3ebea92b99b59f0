package com.kmg.grading.client;

import com.kmg.grading.model.DocumentRef;
import com.kmg.grading.model.MasterDocuments;
import com.kmg.grading.model.RawGrade;
import com.kmg.grading.model.ScoringMode;

import java.time.Duration;
import java.util.Optional;

/**
 * The remote extract-and-grade pipeline. Implementations signal rate limiting with
 * {@link RateLimitedException} and every other failure with {@link ServiceCallException}.
 */
public interface GradingServiceClient {

    /**
     * @return the job id the pipeline assigned to this submission
     */
    String submit(MasterDocuments masterDocuments, DocumentRef studentDocument, ScoringMode mode);

    PipelineStatus pollStatus(String externalJobId);

    /**
     * Only valid once {@link #pollStatus} reported {@link PipelineStatus.State#COMPLETED}.
     */
    RawGrade fetchResult(String externalJobId);

    class RateLimitedException extends RuntimeException {
        private final Duration retryAfter;

        public RateLimitedException(String message, Duration retryAfter) {
            super(message);
            this.retryAfter = retryAfter;
        }

        public Optional<Duration> retryAfter() {
            return Optional.ofNullable(retryAfter);
        }
    }

    class ServiceCallException extends RuntimeException {
        private final int statusCode;

        public ServiceCallException(String message, int statusCode) {
            super(message);
            this.statusCode = statusCode;
        }

        public ServiceCallException(String message, int statusCode, Throwable cause) {
            super(message, cause);
            this.statusCode = statusCode;
        }

        /**
         * @return the HTTP status, or 0 when the service could not be reached
         */
        public int statusCode() {
            return statusCode;
        }
    }
}
