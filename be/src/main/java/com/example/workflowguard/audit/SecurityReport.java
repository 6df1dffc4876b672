package com.example.workflowguard.audit;

import com.example.workflowguard.security.RiskLevel;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * @param dailyTrend violations per UTC day, in date order
 */
public record SecurityReport(
        long totalViolations,
        Map<RiskLevel, Long> violationsBySeverity,
        List<ViolationCount> topViolationTypes,
        Map<LocalDate, Long> dailyTrend,
        List<String> recommendations
) {
}
