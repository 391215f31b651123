package com.whereq.transcribe.config;

import com.whereq.transcribe.model.TriggerInterval;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ Transcribe.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "transcribe")
@Data
public class TranscribeProperties {

    private StoreConfig store = new StoreConfig();

    private SubmissionConfig submission = new SubmissionConfig();

    private DrainConfig drain = new DrainConfig();

    private PollConfig poll = new PollConfig();

    private CompletionConfig completion = new CompletionConfig();

    private RetentionConfig retention = new RetentionConfig();

    private GeminiConfig gemini = new GeminiConfig();

    private NotificationConfig notification = new NotificationConfig();

    private ResourcesConfig resources = new ResourcesConfig();

    private ArtifactsConfig artifacts = new ArtifactsConfig();

    @PostConstruct
    public void validate() {
        if (drain.getBatchSize() < 1) {
            throw new IllegalStateException("transcribe.drain.batch-size must be at least 1");
        }
        if (submission.getMaxAttempts() < 1) {
            throw new IllegalStateException("transcribe.submission.max-attempts must be at least 1");
        }
        if (drain.getTimeBudget().compareTo(drain.getExecutionCeiling()) >= 0) {
            throw new IllegalStateException("transcribe.drain.time-budget (" + drain.getTimeBudget()
                + ") must be strictly less than transcribe.drain.execution-ceiling ("
                + drain.getExecutionCeiling() + ")");
        }
        Duration margin = drain.getExecutionCeiling().minus(drain.getTimeBudget());
        Duration longestStep = longestDrainStep();
        if (margin.compareTo(longestStep) < 0) {
            throw new IllegalStateException("transcribe.drain.execution-ceiling leaves " + margin
                + " after the time-budget, but a single poll step may take " + longestStep
                + " (gemini.request-timeout + completion.lock-timeout + notification.timeout)");
        }
    }

    /**
     * Worst case for one poll step started just before the budget runs out:
     * status request, completion lock wait, owner notification.
     */
    private Duration longestDrainStep() {
        return gemini.getRequestTimeout()
            .plus(completion.getLockTimeout())
            .plus(notification.getTimeout());
    }

    @Data
    public static class StoreConfig {
        /**
         * Backing store for job records, queue index and locks.
         * REDIS: shared across instances (default)
         * MEMORY: single process only, state is lost on restart
         */
        private StoreType type = StoreType.REDIS;

        /**
         * Prefix of every key written to Redis.
         */
        private String keyPrefix = "transcribe";
    }

    @Data
    public static class SubmissionConfig {
        /**
         * Largest resource accepted for queued transcription. A resource of exactly this size is accepted.
         */
        private long maxResourceBytes = 37L * 1024 * 1024;

        /**
         * Submission attempts before a job is failed.
         */
        private int maxAttempts = 3;

        /**
         * Accept jobs without an owner identity.
         */
        private boolean allowAnonymous = false;

        /**
         * Email domains allowed to own jobs. Empty means any domain.
         */
        private List<String> allowedOwnerDomains = new ArrayList<>();
    }

    @Data
    public static class DrainConfig {
        /**
         * Install the periodic drain trigger on startup.
         */
        private boolean enabled = true;

        /**
         * Trigger interval installed on startup.
         */
        private TriggerInterval interval = TriggerInterval.FIFTEEN_MINUTES;

        /**
         * Pending jobs submitted per tick.
         */
        private int batchSize = 5;

        /**
         * Elapsed time after which a tick stops starting new work.
         */
        private Duration timeBudget = Duration.ofMinutes(4);

        /**
         * Hard ceiling for a single tick. Must exceed the time budget by at least the longest poll step.
         */
        private Duration executionCeiling = Duration.ofMinutes(6);
    }

    @Data
    public static class PollConfig {
        /**
         * Longest time a job may stay in processing before it is failed.
         */
        private Duration maxProcessingAge = Duration.ofHours(24);
    }

    @Data
    public static class CompletionConfig {
        /**
         * How long the completer waits for the per-job lock.
         */
        private Duration lockTimeout = Duration.ofSeconds(30);

        /**
         * Lease after which an abandoned lock expires.
         */
        private Duration lockLease = Duration.ofMinutes(2);
    }

    @Data
    public static class RetentionConfig {
        /**
         * Age after which terminal jobs are deleted.
         */
        private Duration horizon = Duration.ofDays(7);

        /**
         * Sweep schedule.
         */
        private String cron = "0 0 3 * * *";
    }

    @Data
    public static class GeminiConfig {
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";

        private String apiKey;

        private String model = "gemini-2.5-flash";

        private double temperature = 0.1;

        private int maxOutputTokens = 65536;

        /**
         * Timeout of a single submit or status call.
         */
        private Duration requestTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class NotificationConfig {
        /**
         * Mail relay endpoint receiving notification messages. Messages are only logged when unset.
         */
        private String webhookUrl;

        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class ResourcesConfig {
        /**
         * Directory holding uploaded media resources.
         */
        private Path directory = Path.of("data", "resources");

        /**
         * Mime type used when the resource type cannot be detected.
         */
        private String defaultMimeType = "audio/mpeg";
    }

    @Data
    public static class ArtifactsConfig {
        /**
         * Directory receiving transcript documents.
         */
        private Path directory = Path.of("data", "artifacts");

        /**
         * Public base URL of the artifact directory, used in notifications when set.
         */
        private String publicBaseUrl;
    }

    public enum StoreType {
        REDIS,
        MEMORY
    }
}
