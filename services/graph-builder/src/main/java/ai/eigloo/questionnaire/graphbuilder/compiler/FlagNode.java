package ai.eigloo.questionnaire.graphbuilder.compiler;

import ai.eigloo.questionnaire.diagram.style.DiagnosisSeverity;

/**
 * A calculated flag. Diagnoses are flags with a severity.
 */
public class FlagNode extends CompiledNode {

    private final boolean diagnosis;
    private final DiagnosisSeverity severity;

    public FlagNode(String id, String label, String pageId, String name, boolean diagnosis, DiagnosisSeverity severity) {
        super(id, label, pageId, name);
        if (diagnosis && severity == null) {
            throw new IllegalArgumentException("Diagnosis flag '" + id + "' needs a severity");
        }
        this.diagnosis = diagnosis;
        this.severity = diagnosis ? severity : null;
    }

    @Override
    public CompiledNodeType type() {
        return CompiledNodeType.FLAG;
    }

    public boolean isDiagnosis() {
        return diagnosis;
    }

    public DiagnosisSeverity getSeverity() {
        return severity;
    }
}
