package ai.eigloo.questionnaire.diagram.validation;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the issues collected during a compilation.
 *
 * @param mode the validation mode in force
 * @param issues the issues in the order they were recorded
 */
public record ValidationReport(ValidationMode mode, List<ValidationIssue> issues) {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(50);
    private static final String SECTION_RULE = "-".repeat(30);

    public ValidationReport {
        if (mode == null) {
            throw new IllegalArgumentException("Validation mode cannot be null");
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public List<ValidationIssue> issues(ValidationSeverity severity) {
        return issues.stream()
                .filter(issue -> issue.severity() == severity)
                .toList();
    }

    public Map<ValidationSeverity, Integer> counts() {
        EnumMap<ValidationSeverity, Integer> counts = new EnumMap<>(ValidationSeverity.class);
        for (ValidationSeverity severity : ValidationSeverity.values()) {
            counts.put(severity, issues(severity).size());
        }
        return counts;
    }

    public boolean hasCriticalIssues() {
        return issues.stream().anyMatch(issue -> issue.severity() == ValidationSeverity.CRITICAL);
    }

    public int totalIssues() {
        return issues.size();
    }

    /**
     * Renders the report as plain text, formatting timestamps in the system time zone.
     */
    public String render() {
        return render(ZoneId.systemDefault());
    }

    public String render(ZoneId zone) {
        DateTimeFormatter timeFormat = TIME_FORMAT.withZone(zone);
        StringBuilder out = new StringBuilder();
        out.append("Diagram Validation Report\n")
                .append(RULE).append('\n')
                .append("Validation Level: ").append(mode.name()).append('\n')
                .append("Total Issues: ").append(issues.size()).append('\n')
                .append("-".repeat(50)).append("\n\n");

        for (ValidationSeverity severity : ValidationSeverity.values()) {
            List<ValidationIssue> group = issues(severity);
            if (group.isEmpty()) {
                continue;
            }
            out.append('\n').append(severity.name()).append(" Issues (").append(group.size()).append("):\n")
                    .append(SECTION_RULE).append('\n');
            for (ValidationIssue issue : group) {
                out.append("- ").append(issue.message()).append('\n');
                if (issue.elementId() != null) {
                    out.append("  Element ID: ").append(issue.elementId()).append('\n');
                }
                if (issue.elementType() != null) {
                    out.append("  Element Type: ").append(issue.elementType()).append('\n');
                }
                if (issue.fieldName() != null) {
                    out.append("  Field: ").append(issue.fieldName()).append('\n');
                }
                out.append("  Time: ").append(timeFormat.format(issue.timestamp())).append("\n\n");
            }
        }

        out.append("\nSummary:\n").append(SECTION_RULE).append('\n');
        counts().forEach((severity, count) ->
                out.append(severity.name()).append(": ").append(count).append(" issues\n"));
        if (hasCriticalIssues()) {
            out.append("\nWARNING: Critical issues were found!\n");
        }
        return out.toString();
    }
}
