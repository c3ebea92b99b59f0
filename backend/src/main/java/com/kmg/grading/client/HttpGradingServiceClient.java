package com.kmg.grading.client;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.kmg.grading.config.GradingProperties;
import com.kmg.grading.model.DocumentRef;
import com.kmg.grading.model.MasterDocuments;
import com.kmg.grading.model.QuestionGrade;
import com.kmg.grading.model.RawGrade;
import com.kmg.grading.model.ScoringMode;
import com.kmg.grading.model.SectionGrade;
import com.kmg.grading.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Talks to the grading pipeline over HTTP: multipart upload, status polling and result retrieval.
 */
@Service
public class HttpGradingServiceClient implements GradingServiceClient {
    private static final Logger log = LoggerFactory.getLogger(HttpGradingServiceClient.class);

    private final RestClient restClient;

    public HttpGradingServiceClient(RestClient.Builder restClientBuilder, GradingProperties properties) {
        this.restClient = restClientBuilder
                .baseUrl(properties.getService().getBaseUrl())
                .build();
    }

    @Override
    public String submit(MasterDocuments masterDocuments, DocumentRef studentDocument, ScoringMode mode) {
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("question_paper", new FileSystemResource(masterDocuments.questionPaper().path()));
        parts.add("answer_key", new FileSystemResource(masterDocuments.answerKey().path()));
        parts.add("student_sheet", new FileSystemResource(studentDocument.path()));
        parts.add("mode", mode.wireValue());

        UploadResponse response = execute("submit " + studentDocument.name(), () -> restClient.post()
                .uri("/api/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(parts)
                .retrieve()
                .body(UploadResponse.class));

        if (response == null || response.jobId() == null || response.jobId().isBlank()) {
            throw new ServiceCallException("Grading service accepted " + studentDocument.name()
                    + " without assigning a job id", HttpStatus.OK.value());
        }
        log.debug("Submitted {} as {}", studentDocument.name(), response.jobId());
        return response.jobId();
    }

    @Override
    public PipelineStatus pollStatus(String externalJobId) {
        StatusResponse response = execute("status " + externalJobId, () -> restClient.get()
                .uri("/api/status/{jobId}", externalJobId)
                .retrieve()
                .body(StatusResponse.class));

        if (response == null) {
            throw new ServiceCallException("Empty status response for " + externalJobId, HttpStatus.OK.value());
        }
        return new PipelineStatus(PipelineStatus.State.parse(response.status()), response.stage(), response.error());
    }

    @Override
    public RawGrade fetchResult(String externalJobId) {
        ResultResponse response = execute("result " + externalJobId, () -> restClient.get()
                .uri("/api/result/{jobId}", externalJobId)
                .retrieve()
                .body(ResultResponse.class));

        if (response == null) {
            throw new ServiceCallException("Empty result for " + externalJobId, HttpStatus.OK.value());
        }
        return toRawGrade(response);
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException e) {
            Duration retryAfter = parseRetryAfter(e.getResponseHeaders());
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value() || retryAfter != null) {
                throw new RateLimitedException(operation + " was rate limited (" + e.getStatusCode().value() + ")",
                        retryAfter);
            }
            throw new ServiceCallException(operation + " failed with " + e.getStatusCode().value() + ": "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new ServiceCallException("Grading service unreachable during " + operation + ": " + e.getMessage(),
                    0, e);
        } catch (RestClientException e) {
            throw new ServiceCallException(operation + " failed: " + e.getMessage(), 0, e);
        }
    }

    static Duration parseRetryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header: {}", value);
            return null;
        }
    }

    private RawGrade toRawGrade(ResultResponse response) {
        List<SectionGrade> sections = new ArrayList<>();
        if (response.sections() != null) {
            for (Map.Entry<String, SectionPayload> entry : response.sections().entrySet()) {
                SectionPayload section = entry.getValue();
                List<QuestionGrade> questions = new ArrayList<>();
                Set<String> skipped = new HashSet<>();
                if (section != null && section.questions() != null) {
                    section.questions().forEach((questionId, question) -> {
                        if (question != null && Boolean.FALSE.equals(question.attempted())) {
                            skipped.add(questionId);
                            return;
                        }
                        questions.add(new QuestionGrade(
                                questionId,
                                question == null ? null : question.total(),
                                question == null ? null : question.maxMarks(),
                                question == null ? null : question.remarks()
                        ));
                    });
                }
                List<String> answered = new ArrayList<>();
                if (section != null && section.answered() != null) {
                    section.answered().stream().filter(id -> !skipped.contains(id)).forEach(answered::add);
                }
                sections.add(new SectionGrade(entry.getKey(), answered, questions));
            }
        }
        return new RawGrade(sections, verdictOf(response.verdict()), response.overallFeedback());
    }

    private static Verdict verdictOf(JsonNode verdict) {
        if (verdict == null || !verdict.isTextual()) {
            return null;
        }
        return Verdict.parse(verdict.asText());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UploadResponse(@JsonProperty("job_id") String jobId, String status, String message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StatusResponse(@JsonProperty("job_id") String jobId, String status, String stage, String error) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResultResponse(
            Map<String, SectionPayload> sections,
            @JsonAlias("result") JsonNode verdict,
            @JsonProperty("overall_feedback") String overallFeedback
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SectionPayload(List<String> answered, Map<String, QuestionPayload> questions) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QuestionPayload(
            @JsonProperty("awarded_marks") @JsonAlias("question_total") Double awardedMarks,
            @JsonProperty("total_awarded") Double totalAwarded,
            @JsonProperty("marks_awarded") Double marksAwarded,
            @JsonProperty("max_marks") @JsonAlias("question_max") Double maxMarks,
            @JsonAlias("feedback") String remarks,
            Boolean attempted,
            Map<String, SubdivisionPayload> subdivisions
    ) {
        /** First total present, in pipeline precedence; otherwise the sum of the subdivision marks. */
        Double total() {
            if (awardedMarks != null) {
                return awardedMarks;
            }
            if (totalAwarded != null) {
                return totalAwarded;
            }
            if (marksAwarded != null) {
                return marksAwarded;
            }
            if (subdivisions == null || subdivisions.isEmpty()) {
                return null;
            }
            double sum = 0;
            for (SubdivisionPayload subdivision : subdivisions.values()) {
                if (subdivision != null && subdivision.marksAwarded() != null) {
                    sum += subdivision.marksAwarded();
                }
            }
            return sum;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SubdivisionPayload(String status, @JsonProperty("marks_awarded") Double marksAwarded) {
    }
}
