package com.devscontext.core.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code devscontext.*}. Both processes load the same
 * structure; each reads the parts it needs.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "devscontext")
public class DevsContextProperties {

    @Valid
    private Sources sources = new Sources();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Fetch fetch = new Fetch();

    @Valid
    private Agents agents = new Agents();

    @Data
    public static class Sources {
        @Valid
        private Jira jira = new Jira();
        @Valid
        private Fireflies fireflies = new Fireflies();
        @Valid
        private Slack slack = new Slack();
        @Valid
        private Docs docs = new Docs();
    }

    @Data
    public static class Jira {
        private boolean enabled = false;
        private String baseUrl;
        private String email;
        private String apiToken;
        private boolean primary = true;
        /** Custom field id holding acceptance criteria, e.g. customfield_10042. */
        private String acceptanceCriteriaField;
    }

    @Data
    public static class Fireflies {
        private boolean enabled = false;
        private String apiKey;
        private String baseUrl = "https://api.fireflies.ai/graphql";
    }

    @Data
    public static class Slack {
        private boolean enabled = false;
        private String botToken;
        private String baseUrl = "https://slack.com/api";
        private List<String> channels = new ArrayList<>();
        @Min(1)
        private int lookbackDays = 30;
        @Min(1)
        private int maxMessages = 50;
        private boolean includeThreads = true;
    }

    @Data
    public static class Docs {
        private boolean enabled = false;
        private List<String> paths = new ArrayList<>(List.of("./docs"));
        private String standardsPath;
        private String architecturePath;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        @NotNull
        private Duration ttl = Duration.ofMinutes(15);
        @Min(1)
        private int maxSize = 100;
    }

    @Data
    public static class Fetch {
        @NotNull
        private Duration perSourceTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration overallTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration deepPerSourceTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration deepOverallTimeout = Duration.ofSeconds(90);
        @Min(1)
        private int threads = 16;
    }

    @Data
    public static class Agents {
        @Valid
        private Preprocessor preprocessor = new Preprocessor();
    }

    @Data
    public static class Preprocessor {
        private boolean enabled = false;
        private String jiraStatus = "Ready for Development";
        private List<String> jiraProjects = new ArrayList<>();
        @Min(1)
        @Max(168)
        private int contextTtlHours = 24;
        @NotNull
        private Duration pollInterval = Duration.ofMinutes(5);
        @Min(1)
        private int maxTicketsPerCycle = 50;
        /** Run the gap detection pass after synthesis. */
        private boolean detectGaps = true;
        /** When the agent purges expired records from the store. */
        @NotBlank
        private String cleanupCron = "0 0 3 * * *";
    }
}
