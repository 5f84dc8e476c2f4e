package ai.eigloo.questionnaire.diagram.validation;

import ai.eigloo.questionnaire.diagram.exception.DiagramValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects validation issues for one compilation and aborts according to its {@link ValidationMode}.
 *
 * <p>Every issue is recorded and logged before the mode decides whether to throw, so the
 * aborting issue is always part of {@link #getIssues()}. Instances are not thread-safe and
 * belong to a single compilation.</p>
 */
public class ValidationCollector {

    private static final Logger logger = LoggerFactory.getLogger(ValidationCollector.class);

    private final ValidationMode mode;
    private final Clock clock;
    private final List<ValidationIssue> issues = new ArrayList<>();

    public ValidationCollector(ValidationMode mode) {
        this(mode, Clock.systemUTC());
    }

    public ValidationCollector(ValidationMode mode, Clock clock) {
        if (mode == null) {
            throw new IllegalArgumentException("Validation mode cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.mode = mode;
        this.clock = clock;
    }

    public ValidationMode getMode() {
        return mode;
    }

    public void critical(String message, String elementId, String elementType) {
        add(ValidationSeverity.CRITICAL, message, elementId, elementType, null);
    }

    public void error(String message, String elementId, String elementType) {
        add(ValidationSeverity.ERROR, message, elementId, elementType, null);
    }

    public void warning(String message, String elementId, String elementType) {
        add(ValidationSeverity.WARNING, message, elementId, elementType, null);
    }

    /**
     * Records an issue, logs it and throws when the mode aborts on its severity.
     *
     * @throws DiagramValidationException when the mode aborts on {@code severity}
     */
    public void add(ValidationSeverity severity, String message, String elementId, String elementType, String fieldName) {
        ValidationIssue issue = new ValidationIssue(severity, message, elementId, elementType, fieldName, clock.instant());
        issues.add(issue);

        if (severity == ValidationSeverity.WARNING) {
            logger.warn(issue.describe());
        } else {
            logger.error(issue.describe());
        }

        if (mode.aborts(severity)) {
            throw new DiagramValidationException(issue);
        }
    }

    public List<ValidationIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public List<ValidationIssue> getIssues(ValidationSeverity severity) {
        return issues.stream()
                .filter(issue -> issue.severity() == severity)
                .toList();
    }

    public Map<ValidationSeverity, Integer> countsBySeverity() {
        EnumMap<ValidationSeverity, Integer> counts = new EnumMap<>(ValidationSeverity.class);
        for (ValidationSeverity severity : ValidationSeverity.values()) {
            counts.put(severity, 0);
        }
        for (ValidationIssue issue : issues) {
            counts.merge(issue.severity(), 1, Integer::sum);
        }
        return counts;
    }

    public boolean hasCriticalIssues() {
        return issues.stream().anyMatch(issue -> issue.severity() == ValidationSeverity.CRITICAL);
    }

    public ValidationReport report() {
        return new ValidationReport(mode, issues);
    }
}
