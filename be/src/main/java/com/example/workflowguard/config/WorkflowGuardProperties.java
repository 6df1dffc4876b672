package com.example.workflowguard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code workflow-guard.*}. Defaults apply when a property is not set.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "workflow-guard")
public class WorkflowGuardProperties {

    @Valid
    private Security security = new Security();

    @Valid
    private Versioning versioning = new Versioning();

    @Valid
    private Audit audit = new Audit();

    @Valid
    private Healing healing = new Healing();

    @Data
    public static class Security {

        /** Hosts that outbound URLs in generated code may target without a warning; subdomains included. */
        @NotNull
        private List<String> allowedDomains = new ArrayList<>(
                List.of("api.openrouter.ai", "api.openai.com", "localhost", "127.0.0.1"));

        @Min(1)
        private int maxPromptLength = 50_000;

        @Min(1)
        private int maxCodeLength = 100_000;

        /** Character reads one pattern may spend on one input before the scan is aborted. */
        @Min(1)
        private long matchBudget = 2_000_000L;
    }

    @Data
    public static class Versioning {

        @Min(1)
        private int maxVersions = 50;

        @Min(0)
        private int retainRecent = 20;

        @Min(0)
        private int rollbackWarningDistance = 5;
    }

    @Data
    public static class Audit {

        @Min(1)
        private int maxEvents = 10_000;

        private String appVersion = "1.0.0";
    }

    @Data
    public static class Healing {

        @Min(0)
        private int maxAutoConnections = 3;

        @Min(1)
        private int maxIterations = 3;
    }
}
