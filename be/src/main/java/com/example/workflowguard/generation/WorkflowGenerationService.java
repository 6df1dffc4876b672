package com.example.workflowguard.generation;

import com.example.workflowguard.audit.AuditLog;
import com.example.workflowguard.audit.GenerationAudit;
import com.example.workflowguard.audit.Outcome;
import com.example.workflowguard.audit.SecurityViolation;
import com.example.workflowguard.audit.ValidationAudit;
import com.example.workflowguard.config.WorkflowGuardProperties;
import com.example.workflowguard.graph.WorkflowGraph;
import com.example.workflowguard.security.CodeScanResult;
import com.example.workflowguard.security.IssueType;
import com.example.workflowguard.security.PromptScanResult;
import com.example.workflowguard.security.RiskLevel;
import com.example.workflowguard.security.SecurityIssue;
import com.example.workflowguard.security.SecurityScanner;
import com.example.workflowguard.validation.ValidationOptions;
import com.example.workflowguard.validation.ValidationPipeline;
import com.example.workflowguard.validation.ValidationResult;
import com.example.workflowguard.versioning.RollbackOptions;
import com.example.workflowguard.versioning.RollbackResult;
import com.example.workflowguard.versioning.VersionInfo;
import com.example.workflowguard.versioning.VersionNotFoundException;
import com.example.workflowguard.versioning.VersionStore;
import com.example.workflowguard.versioning.WorkflowVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Application service around the generation collaborator: prompt scanning, validation with auto-heal,
 * snapshotting and auditing.
 * <p>
 * Every run is audited, including provider failures, which are audited and then rethrown.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowGenerationService {

    static final String GENERATED_TAG = "generated";

    private final GenerationProvider generationProvider;
    private final SecurityScanner securityScanner;
    private final ValidationPipeline validationPipeline;
    private final VersionStore versionStore;
    private final AuditLog auditLog;
    private final WorkflowGuardProperties properties;
    private final Clock clock;

    public GenerationResult generate(GenerationRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.description() == null || request.description().isBlank()) {
            throw new IllegalArgumentException("description must not be blank");
        }
        long start = clock.millis();
        log.debug("Generating workflow user={} workflowId={} descriptionLength={}",
                request.userId(), request.workflowId(), request.description().length());

        PromptScanResult promptScan = securityScanner.sanitizePromptInput(request.description());
        if (!promptScan.secure()) {
            auditLog.logSecurityViolation(SecurityViolation.builder()
                    .userId(request.userId())
                    .sessionId(request.sessionId())
                    .violationType(IssueType.PROMPT_INJECTION.name())
                    .severity(promptScan.highestSeverity())
                    .description(describe(promptScan.issues()))
                    .input(request.description())
                    .resource("prompt")
                    .build());
        }
        String prompt = promptScan.effectiveText(request.description());

        WorkflowGraph candidate;
        try {
            candidate = generationProvider.generate(prompt);
        } catch (RuntimeException e) {
            log.warn("Workflow generation failed user={}: {}", request.userId(), e.getMessage());
            auditLog.logWorkflowGeneration(GenerationAudit.builder()
                    .userId(request.userId())
                    .sessionId(request.sessionId())
                    .workflowId(request.workflowId())
                    .prompt(prompt)
                    .outcome(Outcome.FAILURE)
                    .durationMs(clock.millis() - start)
                    .errorMessage(e.getMessage())
                    .build());
            throw e;
        }
        if (candidate == null) {
            candidate = WorkflowGraph.empty();
        }

        ValidationOptions options = request.options() != null ? request.options() : ValidationOptions.DEFAULTS;
        ValidationResult validation = validationPipeline.validateUntilStable(candidate, options,
                properties.getHealing().getMaxIterations());
        boolean autoCorrected = validation.valid() && validation.correctedGraph() != null;
        WorkflowGraph accepted = autoCorrected ? validation.correctedGraph() : candidate;

        WorkflowVersion version = null;
        if (request.createVersion() && request.workflowId() != null && validation.valid()) {
            version = versionStore.createVersion(request.workflowId(), accepted, VersionInfo.builder()
                    .name(request.versionName())
                    .createdBy(request.userId())
                    .generationPrompt(prompt)
                    .tags(List.of(GENERATED_TAG))
                    .build());
        }

        long duration = clock.millis() - start;
        auditLog.logWorkflowGeneration(GenerationAudit.builder()
                .userId(request.userId())
                .sessionId(request.sessionId())
                .workflowId(request.workflowId())
                .prompt(prompt)
                .outcome(validation.valid() ? Outcome.SUCCESS : Outcome.PARTIAL)
                .nodeCount(accepted.nodes().size())
                .edgeCount(accepted.edges().size())
                .errorCount(validation.errors().size())
                .warningCount(validation.warnings().size())
                .autoCorrections(autoCorrected ? 1 : 0)
                .durationMs(duration)
                .build());
        log.info("Generated workflow user={} nodes={} edges={} valid={} autoCorrected={} version={}",
                request.userId(), accepted.nodes().size(), accepted.edges().size(), validation.valid(),
                autoCorrected, version != null ? version.version() : null);
        return new GenerationResult(accepted, validation, promptScan, version, autoCorrected, duration);
    }

    /**
     * Validates an existing graph, for example one edited by hand, and records the outcome.
     */
    public ValidationResult validateGraph(WorkflowGraph graph, ValidationOptions options, String userId,
                                          String sessionId, String workflowId) {
        long start = clock.millis();
        ValidationResult result = validationPipeline.validate(graph, options);
        auditLog.logValidation(ValidationAudit.builder()
                .userId(userId)
                .sessionId(sessionId)
                .workflowId(workflowId)
                .valid(result.valid())
                .errorCount(result.errors().size())
                .warningCount(result.warnings().size())
                .autoCorrections(result.correctedGraph() != null ? 1 : 0)
                .durationMs(clock.millis() - start)
                .build());
        return result;
    }

    /**
     * Rolls a workflow back and records the user action. A missing target is audited as a failed action and
     * rethrown.
     */
    public RollbackResult rollback(String workflowId, String targetVersionId, RollbackOptions options, String sessionId) {
        String userId = options != null ? options.performedBy() : null;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("workflowId", workflowId);
        details.put("targetVersionId", targetVersionId);
        try {
            RollbackResult result = versionStore.rollback(workflowId, targetVersionId, options);
            details.put("rolledBackTo", result.rolledBackTo().version());
            result.backupVersion().ifPresent(backup -> details.put("backupVersion", backup.version()));
            details.put("warnings", result.warnings());
            if (options != null && options.reason() != null) {
                details.put("reason", options.reason());
            }
            auditLog.logUserAction(userId, sessionId, "rollback", "workflow_version", details, Outcome.SUCCESS);
            return result;
        } catch (VersionNotFoundException e) {
            details.put("error", e.getMessage());
            auditLog.logUserAction(userId, sessionId, "rollback", "workflow_version", details, Outcome.FAILURE);
            throw e;
        }
    }

    /**
     * Scans a custom-code block and records a security violation when it has high or critical issues.
     */
    public CodeScanResult scanCustomCode(String code, String userId, String sessionId) {
        CodeScanResult result = securityScanner.analyzeCodeSecurity(code);
        List<SecurityIssue> serious = result.issues().stream()
                .filter(i -> i.severity().isAtLeast(RiskLevel.HIGH))
                .toList();
        if (!serious.isEmpty()) {
            auditLog.logSecurityViolation(SecurityViolation.builder()
                    .userId(userId)
                    .sessionId(sessionId)
                    .violationType(serious.get(0).type().name())
                    .severity(result.highestSeverity())
                    .description(describe(serious))
                    .input(code)
                    .resource("custom_code")
                    .build());
        }
        return result;
    }

    private static String describe(List<SecurityIssue> issues) {
        return issues.stream()
                .map(SecurityIssue::description)
                .distinct()
                .collect(Collectors.joining("; "));
    }
}
