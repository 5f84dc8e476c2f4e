package ai.eigloo.questionnaire.graphbuilder.dto;

import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledEdge;
import ai.eigloo.questionnaire.graphbuilder.logic.ConditionExpr;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Edge of a compiled questionnaire graph with its branch condition.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompiledEdgeDto(
        String id,
        String source,
        String target,
        String label,
        String option,
        String originalTarget,
        ConditionExpr logic
) {

    public static CompiledEdgeDto from(CompiledEdge edge) {
        return new CompiledEdgeDto(edge.id(), edge.source(), edge.target(), edge.label(),
                edge.option(), edge.originalTarget(), edge.logic());
    }
}
