package ai.eigloo.questionnaire.diagram.style;

/**
 * Result of classifying a node.
 *
 * @param kind the semantic kind
 * @param severity diagnosis severity, only set when {@code kind} is {@link ElementKind#DIAGNOSIS}
 */
public record Classification(ElementKind kind, DiagnosisSeverity severity) {

    public Classification {
        if (kind == null) {
            throw new IllegalArgumentException("Classification kind cannot be null");
        }
        if (kind == ElementKind.DIAGNOSIS && severity == null) {
            throw new IllegalArgumentException("Diagnosis classification requires a severity");
        }
        if (kind != ElementKind.DIAGNOSIS && severity != null) {
            throw new IllegalArgumentException("Only diagnosis classifications carry a severity");
        }
    }

    public static Classification of(ElementKind kind) {
        return new Classification(kind, null);
    }

    public static Classification diagnosis(DiagnosisSeverity severity) {
        return new Classification(ElementKind.DIAGNOSIS, severity);
    }
}
