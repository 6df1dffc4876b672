package com.example.workflowguard.validation;

import com.example.workflowguard.graph.BlockConfig;
import com.example.workflowguard.graph.WorkflowGraph;
import com.example.workflowguard.graph.WorkflowNode;
import com.example.workflowguard.healing.AutoHealer;
import com.example.workflowguard.security.CodeScanResult;
import com.example.workflowguard.security.RiskLevel;
import com.example.workflowguard.security.SecurityIssue;
import com.example.workflowguard.security.SecurityScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs schema, business-rule, graph and security checks over a candidate graph and, when asked, one auto-heal pass.
 * <p>
 * Never throws for problems in the graph itself: every problem is a coded finding in the returned
 * {@link ValidationResult}.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationPipeline {

    private final SecurityScanner securityScanner;
    private final AutoHealer autoHealer;

    public ValidationResult validate(WorkflowGraph graph) {
        return validate(graph, ValidationOptions.DEFAULTS);
    }

    public ValidationResult validate(WorkflowGraph graph, ValidationOptions options) {
        Objects.requireNonNull(graph, "graph");
        ValidationOptions opts = options == null ? ValidationOptions.DEFAULTS : options;

        ValidationFindings findings = ValidationFindings.of(SchemaValidator.validate(graph))
                .plus(BusinessRuleValidator.validate(graph))
                .plus(GraphAnalyzer.validate(graph))
                .plus(securityFindings(graph));

        WorkflowGraph corrected = null;
        if (opts.autoHeal() && findings.errors().stream().anyMatch(AutoHealer::isHealable)) {
            corrected = autoHealer.heal(graph, findings.errors()).orElse(null);
        }

        boolean valid = opts.strictMode()
                ? findings.errors().isEmpty()
                : findings.errors().stream().noneMatch(ValidationError::isError);
        log.debug("Validated graph: nodes={} edges={} errors={} warnings={} valid={} healed={}",
                graph.nodes().size(), graph.edges().size(), findings.errors().size(), findings.warnings().size(),
                valid, corrected != null);
        return new ValidationResult(valid, findings.errors(), findings.warnings(), corrected);
    }

    /**
     * Re-validates the corrected graph until healing stops producing changes or {@code maxIterations} validations
     * have run. The returned result describes the last validated graph; its corrected graph is the final healed
     * graph whenever any pass changed something.
     */
    public ValidationResult validateUntilStable(WorkflowGraph graph, ValidationOptions options, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
        WorkflowGraph current = graph;
        ValidationResult result = validate(current, options);
        int iterations = 1;
        while (result.correctedGraph() != null && iterations < maxIterations) {
            current = result.correctedGraph();
            result = validate(current, options);
            iterations++;
        }
        if (result.correctedGraph() == null && current != graph) {
            result = result.withCorrectedGraph(current);
        }
        log.debug("Validation converged after {} iteration(s), valid={}", iterations, result.valid());
        return result;
    }

    private ValidationFindings securityFindings(WorkflowGraph graph) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        for (WorkflowNode node : graph.nodes()) {
            customCode(node).ifPresent(code -> scanCode(node, code, errors, warnings));

            List<String> sensitiveKeys = securityScanner.findSensitiveConfigKeys(node.config());
            if (!sensitiveKeys.isEmpty()) {
                warnings.add(new ValidationWarning(ErrorKind.SECURITY, ValidationCodes.SENSITIVE_CONFIG,
                        "Node " + node.displayName() + " may contain sensitive data in configuration: "
                                + String.join(", ", sensitiveKeys),
                        "Use secure credential storage instead of plain configuration", node.id()));
            }
        }
        return new ValidationFindings(errors, warnings);
    }

    private void scanCode(WorkflowNode node, String code, List<ValidationError> errors, List<ValidationWarning> warnings) {
        CodeScanResult scan = securityScanner.analyzeCodeSecurity(code);
        if (!scan.safe()) {
            String critical = scan.issues().stream()
                    .filter(i -> i.severity() == RiskLevel.CRITICAL)
                    .map(SecurityIssue::description)
                    .distinct()
                    .collect(Collectors.joining(", "));
            log.warn("Unsafe custom code in node={} issues={}", node.id(), scan.issues().size());
            errors.add(ValidationError.builder()
                    .kind(ErrorKind.SECURITY)
                    .code(ValidationCodes.UNSAFE_CODE_DETECTED)
                    .field("nodes[" + node.id() + "].config.code")
                    .message("Unsafe code detected in node " + node.displayName() + ": " + critical)
                    .nodeId(node.id())
                    .severity(Severity.ERROR)
                    .build());
        } else if (!scan.issues().isEmpty()) {
            warnings.add(new ValidationWarning(ErrorKind.SECURITY, ValidationCodes.SUSPICIOUS_CODE,
                    "Potentially suspicious code in node " + node.displayName() + ": " + scan.issues().size()
                            + " issue(s)",
                    "Review code for security best practices", node.id()));
        }
    }

    private static Optional<String> customCode(WorkflowNode node) {
        if (node.typedConfig() instanceof BlockConfig.CustomCodeConfig custom && custom.code() != null) {
            return Optional.of(custom.code());
        }
        return Optional.empty();
    }
}
