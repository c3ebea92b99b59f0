package com.kmg.grading.config;

import com.kmg.grading.model.ScoringMode;
import com.kmg.grading.model.SectionSpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "grading")
public class GradingProperties {
    @NotBlank
    private String baseDir;
    @NotNull
    @Valid
    private Service service = new Service();
    @NotNull
    @Valid
    private Retry retry = new Retry();
    @NotNull
    @Valid
    private Polling polling = new Polling();
    @NotNull
    @Valid
    private Batch batch = new Batch();
    @NotNull
    @Valid
    private Scoring scoring = new Scoring();
    @NotNull
    @Valid
    private Output output = new Output();
    @NotNull
    @Valid
    private State state = new State();
    @NotNull
    @Valid
    private Logs logs = new Logs();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public Service getService() {
        return service;
    }

    public void setService(Service service) {
        this.service = service;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Polling getPolling() {
        return polling;
    }

    public void setPolling(Polling polling) {
        this.polling = polling;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public static class Service {
        @NotBlank
        private String baseUrl = "http://localhost:8000";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(120);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Retry {
        @Min(0)
        private int maxRetries = 10;
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(5);
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(80);

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Polling {
        @NotNull
        private Duration interval = Duration.ofSeconds(3);
        /**
         * Polls allowed per job before it is failed; 0 polls forever.
         */
        @Min(0)
        private int maxPolls = 400;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getMaxPolls() {
            return maxPolls;
        }

        public void setMaxPolls(int maxPolls) {
            this.maxPolls = maxPolls;
        }
    }

    public static class Batch {
        @Min(1)
        private int maxStudents = 40;

        public int getMaxStudents() {
            return maxStudents;
        }

        public void setMaxStudents(int maxStudents) {
            this.maxStudents = maxStudents;
        }
    }

    public static class Scoring {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double passThreshold = 0.5;
        @NotNull
        private ScoringMode defaultMode = ScoringMode.LIBERAL;
        @NotEmpty
        @Valid
        private List<Section> sections = new ArrayList<>(List.of(
                new Section("A", 3, 5),
                new Section("B", 3, 10),
                new Section("C", 3, 10)
        ));

        public double getPassThreshold() {
            return passThreshold;
        }

        public void setPassThreshold(double passThreshold) {
            this.passThreshold = passThreshold;
        }

        public ScoringMode getDefaultMode() {
            return defaultMode;
        }

        public void setDefaultMode(ScoringMode defaultMode) {
            this.defaultMode = defaultMode;
        }

        public List<Section> getSections() {
            return sections;
        }

        public void setSections(List<Section> sections) {
            this.sections = sections;
        }

        public List<SectionSpec> toSectionSpecs() {
            return sections.stream()
                    .map(section -> new SectionSpec(section.getName(), section.getDropThreshold(), section.getQuestionMax()))
                    .toList();
        }
    }

    public static class Section {
        @NotBlank
        private String name;
        @Min(2)
        private int dropThreshold = 3;
        @DecimalMin(value = "0.0", inclusive = false)
        private double questionMax = 5;

        public Section() {
        }

        public Section(String name, int dropThreshold, double questionMax) {
            this.name = name;
            this.dropThreshold = dropThreshold;
            this.questionMax = questionMax;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getDropThreshold() {
            return dropThreshold;
        }

        public void setDropThreshold(int dropThreshold) {
            this.dropThreshold = dropThreshold;
        }

        public double getQuestionMax() {
            return questionMax;
        }

        public void setQuestionMax(double questionMax) {
            this.questionMax = questionMax;
        }
    }

    public static class Output {
        @NotBlank
        private String reportDir;

        public String getReportDir() {
            return reportDir;
        }

        public void setReportDir(String reportDir) {
            this.reportDir = reportDir;
        }
    }

    public static class State {
        @NotBlank
        private String dbPath;

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }
}
