package ai.eigloo.questionnaire.graphbuilder.compiler;

import ai.eigloo.questionnaire.graphbuilder.logic.ConditionExpr;

/**
 * A directed edge of the compiled graph.
 *
 * @param id id of the diagram edge it came from
 * @param source source node id
 * @param target target node id
 * @param label edge label
 * @param option answer option the edge leaves from, or null
 * @param originalTarget group the edge pointed at before group flattening, or null
 * @param logic condition under which the edge is taken, or null
 */
public record CompiledEdge(
        String id,
        String source,
        String target,
        String label,
        String option,
        String originalTarget,
        ConditionExpr logic
) {

    public CompiledEdge {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Compiled edge id cannot be null or empty");
        }
        if (source == null || source.trim().isEmpty()) {
            throw new IllegalArgumentException("Compiled edge '" + id + "' needs a source");
        }
        if (target == null || target.trim().isEmpty()) {
            throw new IllegalArgumentException("Compiled edge '" + id + "' needs a target");
        }
        label = label == null ? "" : label;
    }

    public static CompiledEdge of(String id, String source, String target, String label) {
        return new CompiledEdge(id, source, target, label, null, null, null);
    }

    public CompiledEdge withSource(String newSource) {
        return new CompiledEdge(id, newSource, target, label, option, originalTarget, logic);
    }

    public CompiledEdge withTarget(String newTarget) {
        return new CompiledEdge(id, source, newTarget, label, option, originalTarget, logic);
    }

    public CompiledEdge withOption(String newOption) {
        return new CompiledEdge(id, source, target, label, newOption, originalTarget, logic);
    }

    public CompiledEdge redirectedFromGroup(String groupId, String member) {
        return new CompiledEdge(id, source, member, label, option, groupId, logic);
    }

    public CompiledEdge withLogic(ConditionExpr newLogic) {
        return new CompiledEdge(id, source, target, label, option, originalTarget, newLogic);
    }
}
