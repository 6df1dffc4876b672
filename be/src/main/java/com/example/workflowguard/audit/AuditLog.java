package com.example.workflowguard.audit;

import com.example.workflowguard.security.RiskLevel;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Structured audit trail of generation, validation, security and user operations, with risk scoring, queries
 * and reports.
 * <p>
 * Untrusted text (prompts, offending inputs) is stored only through {@link LogSanitizer}. High and critical
 * security violations are forwarded to the {@link AlertSink}; a failing sink never fails the audit write.
 * </p>
 */
@Slf4j
public class AuditLog {

    static final String SOURCE = "workflow-guard";
    static final int VIOLATION_INPUT_MAX_LENGTH = 200;
    static final int TOP_VIOLATION_TYPES = 5;

    private final AuditEventRepository repository;
    private final AlertSink alertSink;
    private final Clock clock;
    private final String appVersion;

    public AuditLog(AuditEventRepository repository, AlertSink alertSink, Clock clock, String appVersion) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.appVersion = appVersion;
    }

    /**
     * Risk of a generation or validation outcome: failures with many errors are riskier, everything else is low.
     */
    public static RiskLevel classifyRisk(Outcome outcome, int errorCount) {
        if (outcome == Outcome.FAILURE && errorCount > 10) {
            return RiskLevel.HIGH;
        }
        if (outcome == Outcome.FAILURE && errorCount > 5) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    public AuditEvent logWorkflowGeneration(GenerationAudit generation) {
        Objects.requireNonNull(generation, "generation");
        Outcome outcome = generation.outcome() != null ? generation.outcome() : Outcome.SUCCESS;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("workflowId", generation.workflowId());
        details.put("prompt", LogSanitizer.sanitize(generation.prompt()));
        details.put("promptLength", generation.prompt() != null ? generation.prompt().length() : 0);
        details.put("nodeCount", generation.nodeCount());
        details.put("edgeCount", generation.edgeCount());
        details.put("errorCount", generation.errorCount());
        details.put("warningCount", generation.warningCount());
        details.put("autoCorrections", generation.autoCorrections());
        details.put("durationMs", generation.durationMs());
        if (generation.errorMessage() != null) {
            details.put("error", LogSanitizer.sanitize(generation.errorMessage()));
        }
        return record(AuditEvent.builder()
                .eventType(AuditEventType.WORKFLOW_GENERATION)
                .userId(generation.userId())
                .sessionId(generation.sessionId())
                .resource("workflow")
                .action("generate")
                .details(details)
                .outcome(outcome)
                .risk(classifyRisk(outcome, generation.errorCount()))
                .metadata(metadata(true, false)));
    }

    public AuditEvent logValidation(ValidationAudit validation) {
        Objects.requireNonNull(validation, "validation");
        Outcome outcome = validation.valid() ? Outcome.SUCCESS : Outcome.FAILURE;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("workflowId", validation.workflowId());
        details.put("valid", validation.valid());
        details.put("errorCount", validation.errorCount());
        details.put("warningCount", validation.warningCount());
        details.put("autoCorrections", validation.autoCorrections());
        details.put("durationMs", validation.durationMs());
        return record(AuditEvent.builder()
                .eventType(AuditEventType.WORKFLOW_VALIDATION)
                .userId(validation.userId())
                .sessionId(validation.sessionId())
                .resource("workflow")
                .action("validate")
                .details(details)
                .outcome(outcome)
                .risk(classifyRisk(outcome, validation.errorCount()))
                .metadata(metadata(true, false)));
    }

    public AuditEvent logSecurityViolation(SecurityViolation violation) {
        Objects.requireNonNull(violation, "violation");
        RiskLevel severity = violation.severity() != null ? violation.severity() : RiskLevel.MEDIUM;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("violationType", violation.violationType());
        details.put("severity", severity.name());
        details.put("description", LogSanitizer.sanitize(violation.description()));
        details.put("input", LogSanitizer.sanitize(violation.input(), VIOLATION_INPUT_MAX_LENGTH));
        AuditEvent event = record(AuditEvent.builder()
                .eventType(AuditEventType.SECURITY_VIOLATION)
                .userId(violation.userId())
                .sessionId(violation.sessionId())
                .resource(violation.resource() != null ? violation.resource() : "security")
                .action("violation_detected")
                .details(details)
                .outcome(Outcome.FAILURE)
                .risk(severity)
                .metadata(metadata(true, false)));
        log.warn("Security violation type={} severity={} user={}", violation.violationType(), severity, violation.userId());

        if (severity.isAtLeast(RiskLevel.HIGH)) {
            try {
                alertSink.alert(event);
            } catch (RuntimeException e) {
                log.warn("Alert delivery failed for eventId={}: {}", event.eventId(), e.toString());
            }
        }
        return event;
    }

    public AuditEvent logUserAction(String userId, String sessionId, String action, String resource,
                                    Map<String, Object> details, Outcome outcome) {
        return record(AuditEvent.builder()
                .eventType(AuditEventType.USER_ACTION)
                .userId(userId)
                .sessionId(sessionId)
                .resource(resource)
                .action(action)
                .details(LogSanitizer.sanitizeValues(details))
                .outcome(outcome != null ? outcome : Outcome.SUCCESS)
                .risk(RiskLevel.LOW)
                .metadata(metadata(false, true)));
    }

    /** Events of one user, newest first. */
    public List<AuditEvent> getUserAuditTrail(String userId, TrailQuery query) {
        TrailQuery q = query != null ? query : TrailQuery.builder().build();
        return repository.findAll().stream()
                .filter(e -> Objects.equals(userId, e.userId()))
                .filter(e -> q.range().contains(e.timestamp()))
                .filter(e -> q.eventTypes().isEmpty() || q.eventTypes().contains(e.eventType()))
                .sorted(Comparator.comparing(AuditEvent::timestamp).reversed())
                .limit(q.limit())
                .toList();
    }

    public GenerationMetrics getMetrics(TimeRange range) {
        List<AuditEvent> events = eventsIn(range);
        List<AuditEvent> generations = events.stream()
                .filter(e -> e.eventType() == AuditEventType.WORKFLOW_GENERATION)
                .toList();
        long successful = generations.stream().filter(e -> e.outcome() == Outcome.SUCCESS).count();
        long failed = generations.stream().filter(e -> e.outcome() == Outcome.FAILURE).count();
        double averageDuration = generations.stream()
                .filter(e -> e.details().get("durationMs") instanceof Number)
                .mapToLong(e -> e.detailAsLong("durationMs"))
                .average()
                .orElse(0.0);
        long validationFailures = events.stream()
                .filter(e -> e.eventType() == AuditEventType.WORKFLOW_VALIDATION && e.outcome() == Outcome.FAILURE)
                .count();
        long securityIssues = events.stream().filter(e -> e.eventType() == AuditEventType.SECURITY_VIOLATION).count();
        long autoCorrections = events.stream().mapToLong(e -> Math.max(0, e.detailAsLong("autoCorrections"))).sum();
        return new GenerationMetrics(generations.size(), successful, failed, averageDuration, validationFailures,
                securityIssues, autoCorrections);
    }

    public SecurityReport getSecurityReport(TimeRange range) {
        List<AuditEvent> violations = eventsIn(range).stream()
                .filter(e -> e.eventType().isSecurityRelated())
                .toList();

        Map<RiskLevel, Long> bySeverity = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            bySeverity.put(level, 0L);
        }
        violations.forEach(e -> bySeverity.merge(e.risk(), 1L, Long::sum));

        List<ViolationCount> topTypes = violations.stream()
                .collect(Collectors.groupingBy(AuditLog::violationType, LinkedHashMap::new, Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(TOP_VIOLATION_TYPES)
                .map(e -> new ViolationCount(e.getKey(), e.getValue()))
                .toList();

        Map<LocalDate, Long> dailyTrend = violations.stream()
                .collect(Collectors.groupingBy(e -> LocalDate.ofInstant(e.timestamp(), ZoneOffset.UTC),
                        TreeMap::new, Collectors.counting()));

        List<String> recommendations = new ArrayList<>();
        if (bySeverity.get(RiskLevel.CRITICAL) > 0) {
            recommendations.add("Address critical security violations immediately");
        }
        if (!topTypes.isEmpty() && topTypes.get(0).count() > 10) {
            recommendations.add("Focus on preventing " + topTypes.get(0).type() + " violations");
        }
        if (violations.size() > 100) {
            recommendations.add("Consider implementing additional rate limiting");
        }
        return new SecurityReport(violations.size(), bySeverity, topTypes, dailyTrend, recommendations);
    }

    public int size() {
        return repository.size();
    }

    private AuditEvent record(AuditEvent.AuditEventBuilder builder) {
        AuditEvent event = builder
                .eventId(UUID.randomUUID().toString())
                .timestamp(clock.instant())
                .build();
        repository.append(event);
        log.debug("Audit event type={} outcome={} risk={} user={}",
                event.eventType().value(), event.outcome(), event.risk(), event.userId());
        return event;
    }

    private List<AuditEvent> eventsIn(TimeRange range) {
        TimeRange r = range != null ? range : TimeRange.ALL;
        return repository.findAll().stream().filter(e -> r.contains(e.timestamp())).toList();
    }

    private EventMetadata metadata(boolean automated, boolean userInitiated) {
        return new EventMetadata(SOURCE, appVersion, automated, userInitiated);
    }

    private static String violationType(AuditEvent event) {
        Object type = event.details().get("violationType");
        return type != null ? type.toString() : event.eventType().value();
    }
}
