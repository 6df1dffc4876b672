package com.example.workflowguard.config;

import com.example.workflowguard.audit.AlertSink;
import com.example.workflowguard.audit.AuditEventRepository;
import com.example.workflowguard.audit.AuditLog;
import com.example.workflowguard.audit.InMemoryAuditEventRepository;
import com.example.workflowguard.audit.LoggingAlertSink;
import com.example.workflowguard.generation.GenerationProvider;
import com.example.workflowguard.graph.WorkflowGraphJson;
import com.example.workflowguard.healing.AutoHealer;
import com.example.workflowguard.security.SecurityScanner;
import com.example.workflowguard.versioning.ContentChecksums;
import com.example.workflowguard.versioning.InMemoryVersionRepository;
import com.example.workflowguard.versioning.VersionRepository;
import com.example.workflowguard.versioning.VersionRetention;
import com.example.workflowguard.versioning.VersionStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.json.JsonMapper;

import java.time.Clock;
import java.util.UUID;

/**
 * Wires the stores, scanner and healer from {@link WorkflowGuardProperties}. Backends and collaborators are
 * conditional so that an application can supply durable or real implementations instead.
 */
@Configuration
@EnableConfigurationProperties(WorkflowGuardProperties.class)
public class WorkflowGuardConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public JsonMapper jsonMapper() {
        return JsonMapper.builder().build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WorkflowGraphJson workflowGraphJson(JsonMapper jsonMapper) {
        return new WorkflowGraphJson(jsonMapper);
    }

    @Bean
    public SecurityScanner securityScanner(WorkflowGuardProperties properties) {
        WorkflowGuardProperties.Security security = properties.getSecurity();
        return new SecurityScanner(security.getAllowedDomains(), security.getMaxPromptLength(),
                security.getMaxCodeLength(), security.getMatchBudget());
    }

    @Bean
    public AutoHealer autoHealer(WorkflowGuardProperties properties) {
        return new AutoHealer(properties.getHealing().getMaxAutoConnections(), () -> UUID.randomUUID().toString());
    }

    @Bean
    @ConditionalOnMissingBean
    public VersionRepository versionRepository() {
        return new InMemoryVersionRepository();
    }

    @Bean
    public VersionStore versionStore(VersionRepository versionRepository, WorkflowGraphJson workflowGraphJson,
                                     Clock clock, WorkflowGuardProperties properties) {
        WorkflowGuardProperties.Versioning versioning = properties.getVersioning();
        return new VersionStore(versionRepository, new ContentChecksums(workflowGraphJson), clock,
                new VersionRetention(versioning.getMaxVersions(), versioning.getRetainRecent(),
                        versioning.getRollbackWarningDistance()));
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditEventRepository auditEventRepository(WorkflowGuardProperties properties) {
        return new InMemoryAuditEventRepository(properties.getAudit().getMaxEvents());
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertSink alertSink() {
        return new LoggingAlertSink();
    }

    @Bean
    public AuditLog auditLog(AuditEventRepository auditEventRepository, AlertSink alertSink, Clock clock,
                             WorkflowGuardProperties properties) {
        return new AuditLog(auditEventRepository, alertSink, clock, properties.getAudit().getAppVersion());
    }

    /**
     * Placeholder until a model-backed provider is registered; every call fails and is audited as a failure.
     */
    @Bean
    @ConditionalOnMissingBean
    public GenerationProvider generationProvider() {
        return description -> {
            throw new IllegalStateException("No GenerationProvider configured");
        };
    }
}
