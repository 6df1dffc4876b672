package com.example.workflowguard.security;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based detectors for prompt injection in user prompts and for unsafe constructs in generated code.
 * <p>
 * Both entry points are side-effect free and never throw on untrusted input. Every regex runs against a
 * {@link BoundedCharSequence}; a detector that exceeds its budget or fails is reported as an issue so the input
 * is treated as unsafe instead of passing unscanned.
 * </p>
 */
@Slf4j
public class SecurityScanner {

    public static final String FILTERED_MARKER = "[FILTERED]";
    public static final String BLOCKED_MARKER = "/* [BLOCKED_DANGEROUS_FUNCTION] */";
    public static final String TRUNCATED_SUFFIX = "... [TRUNCATED]";

    public static final List<String> DEFAULT_ALLOWED_DOMAINS = List.of(
            "api.openrouter.ai", "api.openai.com", "localhost", "127.0.0.1");
    public static final int DEFAULT_MAX_PROMPT_LENGTH = 50_000;
    public static final int DEFAULT_MAX_CODE_LENGTH = 100_000;
    public static final long DEFAULT_MATCH_BUDGET = 2_000_000L;

    private static final int MAX_MATCHES = 10_000;
    private static final int MAX_ISSUES_PER_DETECTOR = 20;
    private static final int MAX_LOCATION_LENGTH = 100;
    private static final double SECRET_ENTROPY_THRESHOLD = 4.0;

    private static final List<Detector> PROMPT_DETECTORS = List.of(
            new Detector("(?i)\\b(?:ignore|disregard|forget)\\s+(?:all\\s+)?(?:previous|above|prior|all)\\s+(?:instructions?|prompts?|commands?|rules?)",
                    IssueType.PROMPT_INJECTION, RiskLevel.HIGH, "Potential prompt injection: ignore previous instructions"),
            new Detector("(?i)(?:\\b(?:system|assistant|user)\\s*:\\s*(?:now|from now on|instead)|\\byou\\s+are\\s+now\\s+(?:a|an|the|in)\\b)",
                    IssueType.PROMPT_INJECTION, RiskLevel.HIGH, "Potential role manipulation attempt"),
            new Detector("(?i)\\[/?SYSTEM]|\\[/?INST]|<\\|im_(?:start|end)\\|>|<</?SYS>>",
                    IssueType.PROMPT_INJECTION, RiskLevel.MEDIUM, "Potential system tag injection"),
            new Detector("(?s)```.*?```",
                    IssueType.PROMPT_INJECTION, RiskLevel.LOW, "Code block detected - may contain injection attempts"),
            new Detector("(?is)<script\\b.*?(?:</script\\s*>|$)",
                    IssueType.CODE_INJECTION, RiskLevel.CRITICAL, "Script tag detected"));

    private static final List<Detector> CODE_DETECTORS = List.of(
            // dynamic evaluation
            new Detector("\\beval\\s*\\(", IssueType.CODE_INJECTION, RiskLevel.CRITICAL,
                    "eval() function usage - allows arbitrary code execution"),
            new Detector("\\bFunction\\s*\\(", IssueType.CODE_INJECTION, RiskLevel.CRITICAL,
                    "Function constructor usage - allows dynamic code execution"),
            new Detector("\\bsetTimeout\\s*\\(\\s*[\"'`][^\"'`]*[\"'`]", IssueType.CODE_INJECTION, RiskLevel.HIGH,
                    "setTimeout with string argument - potential code injection"),
            new Detector("\\bsetInterval\\s*\\(\\s*[\"'`][^\"'`]*[\"'`]", IssueType.CODE_INJECTION, RiskLevel.HIGH,
                    "setInterval with string argument - potential code injection"),
            new Detector("\\bimport\\s*\\(", IssueType.CODE_INJECTION, RiskLevel.HIGH,
                    "Dynamic import - loads arbitrary modules at runtime"),
            // process and OS escape hatches
            new Detector("\\brequire\\s*\\(\\s*[\"'`](?:node:)?child_process[\"'`]", IssueType.CODE_INJECTION, RiskLevel.CRITICAL,
                    "child_process module - allows system command execution"),
            new Detector("\\brequire\\s*\\(\\s*[\"'`](?:node:)?vm[\"'`]", IssueType.CODE_INJECTION, RiskLevel.CRITICAL,
                    "vm module - allows evaluation in fresh contexts"),
            new Detector("\\brequire\\s*\\(\\s*[\"'`](?:node:)?fs[\"'`]", IssueType.CODE_INJECTION, RiskLevel.HIGH,
                    "fs module - allows file system access"),
            new Detector("\\brequire\\s*\\(\\s*[\"'`](?:node:)?net[\"'`]", IssueType.CODE_INJECTION, RiskLevel.HIGH,
                    "net module - allows network operations"),
            new Detector("\\bprocess\\.exit\\s*\\(", IssueType.CODE_INJECTION, RiskLevel.MEDIUM,
                    "process.exit - can terminate the application"),
            new Detector("\\bprocess\\.env\\b", IssueType.SENSITIVE_DATA, RiskLevel.MEDIUM,
                    "Environment variable access - potential sensitive data exposure"),
            // credential and storage access
            new Detector("\\bdocument\\.cookie\\b", IssueType.SENSITIVE_DATA, RiskLevel.MEDIUM,
                    "Cookie access - potential sensitive data exposure"),
            new Detector("\\b(?:localStorage|sessionStorage)\\b", IssueType.SENSITIVE_DATA, RiskLevel.MEDIUM,
                    "Local storage access - potential data exposure"),
            new Detector("\\bwindow\\.location\\s*=", IssueType.CODE_INJECTION, RiskLevel.MEDIUM,
                    "Location manipulation - potential redirect attacks"),
            // outbound network
            new Detector("\\bXMLHttpRequest\\b|\\bfetch\\s*\\(", IssueType.SENSITIVE_DATA, RiskLevel.MEDIUM,
                    "Network requests - potential data exfiltration"),
            new Detector("\\bWebSocket\\s*\\(", IssueType.SENSITIVE_DATA, RiskLevel.MEDIUM,
                    "WebSocket usage - potential data leakage"));

    private static final List<Detector> SECRET_DETECTORS = List.of(
            new Detector("(?i)(?:api[_-]?key|secret|password|passwd|token|access[_-]?key)\\s*[:=]\\s*[\"'`][^\"'`]{8,}[\"'`]",
                    IssueType.SENSITIVE_DATA, RiskLevel.HIGH, "Potential hardcoded API key or secret"),
            new Detector("[\"'`][A-Za-z0-9+/]{32,}={0,2}[\"'`]",
                    IssueType.SENSITIVE_DATA, RiskLevel.HIGH, "Potential base64-encoded secret"),
            new Detector("\\b(?:AKIA|ASIA)[0-9A-Z]{16}\\b",
                    IssueType.SENSITIVE_DATA, RiskLevel.HIGH, "Potential cloud access key id"),
            new Detector("\\b(?:sk|pk|rk)_(?:live|test)_[0-9A-Za-z]{16,}\\b|\\bgh[pousr]_[0-9A-Za-z]{36}\\b",
                    IssueType.SENSITIVE_DATA, RiskLevel.HIGH, "Potential API token"));

    private static final Detector HIGH_ENTROPY_LITERAL = new Detector("[\"'`]([A-Za-z0-9+/=_\\-]{20,})[\"'`]",
            IssueType.SENSITIVE_DATA, RiskLevel.HIGH, "High-entropy string literal - possible embedded secret");

    private static final List<Detector> LOOP_DETECTORS = List.of(
            new Detector("\\bwhile\\s*\\(\\s*(?:true|1)\\s*\\)",
                    IssueType.MALICIOUS_PATTERN, RiskLevel.HIGH, "Potential infinite loop detected"),
            new Detector("\\bfor\\s*\\(\\s*;\\s*;\\s*\\)",
                    IssueType.MALICIOUS_PATTERN, RiskLevel.HIGH, "Potential infinite loop detected"));

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s\"'`;,)}\\]]+");

    private static final List<String> SENSITIVE_KEY_FRAGMENTS = List.of(
            "password", "secret", "key", "token", "auth", "credential");

    private final Set<String> allowedDomains;
    private final int maxPromptLength;
    private final int maxCodeLength;
    private final long matchBudget;

    public SecurityScanner(Collection<String> allowedDomains, int maxPromptLength, int maxCodeLength, long matchBudget) {
        Objects.requireNonNull(allowedDomains, "allowedDomains");
        if (maxPromptLength <= 0 || maxCodeLength <= 0 || matchBudget <= 0) {
            throw new IllegalArgumentException("Scanner limits must be positive");
        }
        Set<String> domains = new LinkedHashSet<>();
        for (String domain : allowedDomains) {
            if (domain != null && !domain.isBlank()) {
                domains.add(domain.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.allowedDomains = Set.copyOf(domains);
        this.maxPromptLength = maxPromptLength;
        this.maxCodeLength = maxCodeLength;
        this.matchBudget = matchBudget;
    }

    public static SecurityScanner withDefaults() {
        return new SecurityScanner(DEFAULT_ALLOWED_DOMAINS, DEFAULT_MAX_PROMPT_LENGTH, DEFAULT_MAX_CODE_LENGTH,
                DEFAULT_MATCH_BUDGET);
    }

    /**
     * Scans a user prompt for injection attempts. Zero-width and bidirectional control characters are always
     * removed and over-long input is truncated; high and critical matches are replaced by {@value #FILTERED_MARKER}.
     */
    public PromptScanResult sanitizePromptInput(String input) {
        if (input == null || input.isEmpty()) {
            return new PromptScanResult(true, List.of(), null);
        }
        List<SecurityIssue> issues = new ArrayList<>();

        String sanitized = stripInvisibleCharacters(input);
        if (sanitized.length() != input.length()) {
            issues.add(new SecurityIssue(IssueType.PROMPT_INJECTION, RiskLevel.MEDIUM,
                    "Suspicious unicode characters detected", null,
                    "Remove zero-width and directional characters"));
        }

        boolean truncated = sanitized.length() > maxPromptLength;
        if (truncated) {
            issues.add(new SecurityIssue(IssueType.PROMPT_INJECTION, RiskLevel.MEDIUM,
                    "Input exceeds maximum length of " + maxPromptLength + " characters", null,
                    "Limit input to reasonable size"));
            sanitized = sanitized.substring(0, maxPromptLength);
        }

        for (Detector detector : PROMPT_DETECTORS) {
            try {
                List<Match> matches = findAll(detector.pattern(), sanitized, MAX_MATCHES);
                if (matches.isEmpty()) {
                    continue;
                }
                issues.add(new SecurityIssue(detector.type(), detector.severity(), detector.description(),
                        shorten(matches.get(0).text()), suggestionFor(detector.type())));
                if (detector.severity().isAtLeast(RiskLevel.HIGH)) {
                    sanitized = replace(sanitized, matches, FILTERED_MARKER);
                }
            } catch (RuntimeException | StackOverflowError e) {
                log.warn("Prompt detector '{}' aborted: {}", detector.description(), e.toString());
                issues.add(abortedIssue(detector, RiskLevel.HIGH));
            }
        }
        if (truncated) {
            sanitized = sanitized + TRUNCATED_SUFFIX;
        }

        boolean secure = issues.stream().noneMatch(i -> i.severity().isAtLeast(RiskLevel.HIGH));
        log.debug("Prompt security validation: {} issues found secure={}", issues.size(), secure);
        return new PromptScanResult(secure, issues, sanitized.equals(input) ? null : sanitized);
    }

    /**
     * Scans generated code. Critical constructs are replaced by {@value #BLOCKED_MARKER}; URLs outside the
     * allow-list are reported as medium issues only.
     */
    public CodeScanResult analyzeCodeSecurity(String code) {
        if (code == null || code.isEmpty()) {
            return new CodeScanResult(true, List.of(), null);
        }
        List<SecurityIssue> issues = new ArrayList<>();
        String scanned = code;
        if (code.length() > maxCodeLength) {
            issues.add(new SecurityIssue(IssueType.MALICIOUS_PATTERN, RiskLevel.CRITICAL,
                    "Code exceeds maximum analyzable length of " + maxCodeLength + " characters", null,
                    "Split the logic into smaller blocks"));
            scanned = code.substring(0, maxCodeLength);
        }
        String sanitized = scanned;

        for (Detector detector : CODE_DETECTORS) {
            try {
                List<Match> matches = findAll(detector.pattern(), scanned, MAX_MATCHES);
                for (Match match : matches.subList(0, Math.min(matches.size(), MAX_ISSUES_PER_DETECTOR))) {
                    issues.add(new SecurityIssue(detector.type(), detector.severity(), detector.description(),
                            shorten(match.text()), codeSuggestionFor(match.text())));
                }
                if (!matches.isEmpty() && detector.severity() == RiskLevel.CRITICAL) {
                    sanitized = replace(sanitized, findAll(detector.pattern(), sanitized, MAX_MATCHES), BLOCKED_MARKER);
                }
            } catch (RuntimeException | StackOverflowError e) {
                log.warn("Code detector '{}' aborted: {}", detector.description(), e.toString());
                issues.add(abortedIssue(detector, RiskLevel.CRITICAL));
            }
        }

        scanUrls(scanned, issues);

        for (Detector detector : SECRET_DETECTORS) {
            reportOnce(detector, scanned, issues);
        }
        scanHighEntropyLiterals(scanned, issues);
        for (Detector detector : LOOP_DETECTORS) {
            reportOnce(detector, scanned, issues);
        }

        boolean safe = issues.stream().noneMatch(i -> i.severity() == RiskLevel.CRITICAL);
        log.debug("Code security analysis: {} issues found safe={}", issues.size(), safe);
        return new CodeScanResult(safe, issues, sanitized.equals(code) ? null : sanitized);
    }

    /**
     * True when the URL's host equals an allowed domain or is a subdomain of one. Unparseable URLs are not allowed.
     */
    public boolean isAllowedDomain(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (host == null) {
            return false;
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        return allowedDomains.stream()
                .anyMatch(domain -> normalized.equals(domain) || normalized.endsWith("." + domain));
    }

    /**
     * Keys of a node configuration that look like credentials, either by name or by a long base64-like value.
     */
    public List<String> findSensitiveConfigKeys(Map<String, ?> config) {
        if (config == null || config.isEmpty()) {
            return List.of();
        }
        Set<String> keys = new LinkedHashSet<>();
        for (Map.Entry<String, ?> entry : config.entrySet()) {
            if (!(entry.getValue() instanceof String value) || entry.getKey() == null) {
                continue;
            }
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            if (SENSITIVE_KEY_FRAGMENTS.stream().anyMatch(key::contains)) {
                keys.add(entry.getKey());
            }
            if (value.length() > 20 && isBase64Like(value)) {
                keys.add(entry.getKey());
            }
        }
        return List.copyOf(keys);
    }

    private void scanUrls(String code, List<SecurityIssue> issues) {
        try {
            Set<String> seen = new LinkedHashSet<>();
            for (Match match : findAll(URL_PATTERN, code, MAX_MATCHES)) {
                if (seen.size() >= MAX_ISSUES_PER_DETECTOR) {
                    break;
                }
                if (seen.add(match.text()) && !isAllowedDomain(match.text())) {
                    issues.add(new SecurityIssue(IssueType.SENSITIVE_DATA, RiskLevel.MEDIUM,
                            "Potentially suspicious URL: " + shorten(match.text()), shorten(match.text()),
                            "Verify if this URL is necessary and trusted"));
                }
            }
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("URL detector aborted: {}", e.toString());
            issues.add(new SecurityIssue(IssueType.MALICIOUS_PATTERN, RiskLevel.CRITICAL,
                    "Scan aborted for detector 'outbound URLs': input too complex to analyze", null,
                    "Simplify the input or review it manually"));
        }
    }

    private void scanHighEntropyLiterals(String code, List<SecurityIssue> issues) {
        try {
            Matcher matcher = HIGH_ENTROPY_LITERAL.pattern().matcher(new BoundedCharSequence(code, matchBudget));
            while (matcher.find()) {
                String literal = matcher.group(1);
                if (shannonEntropy(literal) >= SECRET_ENTROPY_THRESHOLD) {
                    issues.add(new SecurityIssue(HIGH_ENTROPY_LITERAL.type(), HIGH_ENTROPY_LITERAL.severity(),
                            HIGH_ENTROPY_LITERAL.description(), null,
                            "Use environment variables or secure configuration"));
                    return;
                }
            }
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Entropy detector aborted: {}", e.toString());
            issues.add(abortedIssue(HIGH_ENTROPY_LITERAL, RiskLevel.CRITICAL));
        }
    }

    private void reportOnce(Detector detector, String code, List<SecurityIssue> issues) {
        try {
            if (!findAll(detector.pattern(), code, 1).isEmpty()) {
                issues.add(new SecurityIssue(detector.type(), detector.severity(), detector.description(), null,
                        detector.type() == IssueType.MALICIOUS_PATTERN
                                ? "Add proper loop conditions and limits"
                                : "Use environment variables or secure configuration"));
            }
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Code detector '{}' aborted: {}", detector.description(), e.toString());
            issues.add(abortedIssue(detector, RiskLevel.CRITICAL));
        }
    }

    private List<Match> findAll(Pattern pattern, String text, int maxMatches) {
        Matcher matcher = pattern.matcher(new BoundedCharSequence(text, matchBudget));
        List<Match> matches = new ArrayList<>();
        while (matches.size() < maxMatches && matcher.find()) {
            matches.add(new Match(matcher.start(), matcher.end(), matcher.group()));
        }
        return matches;
    }

    private static String replace(String text, List<Match> matches, String replacement) {
        if (matches.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        for (Match match : matches) {
            out.append(text, cursor, match.start()).append(replacement);
            cursor = match.end();
        }
        out.append(text, cursor, text.length());
        return out.toString();
    }

    private static String stripInvisibleCharacters(String input) {
        StringBuilder out = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (!isInvisibleControl(c)) {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static boolean isInvisibleControl(char c) {
        return (c >= '\u200B' && c <= '\u200F')
                || (c >= '\u202A' && c <= '\u202E')
                || (c >= '\u2060' && c <= '\u2064')
                || (c >= '\u2066' && c <= '\u2069')
                || c == '\uFEFF';
    }

    private static boolean isBase64Like(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean allowed = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '+' || c == '/' || c == '=';
            if (!allowed) {
                return false;
            }
        }
        return true;
    }

    static double shannonEntropy(String value) {
        if (value == null || value.isEmpty()) {
            return 0.0;
        }
        int[] counts = new int[128];
        int other = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 128) {
                counts[c]++;
            } else {
                other++;
            }
        }
        double entropy = 0.0;
        double length = value.length();
        for (int count : counts) {
            if (count > 0) {
                double p = count / length;
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }
        if (other > 0) {
            double p = other / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    private static SecurityIssue abortedIssue(Detector detector, RiskLevel severity) {
        return new SecurityIssue(IssueType.MALICIOUS_PATTERN, severity,
                "Scan aborted for detector '" + detector.description() + "': input too complex to analyze", null,
                "Simplify the input or review it manually");
    }

    private static String shorten(String text) {
        return text.length() <= MAX_LOCATION_LENGTH ? text : text.substring(0, MAX_LOCATION_LENGTH) + "...";
    }

    private static String suggestionFor(IssueType type) {
        return switch (type) {
            case PROMPT_INJECTION -> "Use input validation and sanitization before processing";
            case CODE_INJECTION -> "Execute code in a secure sandbox environment";
            case SENSITIVE_DATA -> "Use secure configuration management for sensitive data";
            case MALICIOUS_PATTERN -> "Review and validate the pattern for legitimate use";
        };
    }

    private static String codeSuggestionFor(String match) {
        if (match.contains("eval")) {
            return "Use JSON.parse() or safe alternatives instead of eval()";
        }
        if (match.contains("Function")) {
            return "Define functions statically instead of using Function constructor";
        }
        if (match.contains("child_process")) {
            return "Use controlled APIs instead of direct system access";
        }
        if (match.contains("fs")) {
            return "Use controlled file operations or avoid filesystem access";
        }
        return "Replace with safer alternatives or validate necessity";
    }

    private record Detector(Pattern pattern, IssueType type, RiskLevel severity, String description) {

        Detector(String regex, IssueType type, RiskLevel severity, String description) {
            this(Pattern.compile(regex), type, severity, description);
        }
    }

    private record Match(int start, int end, String text) {
    }
}
