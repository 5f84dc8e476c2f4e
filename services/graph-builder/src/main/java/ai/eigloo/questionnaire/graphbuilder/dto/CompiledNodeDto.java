package ai.eigloo.questionnaire.graphbuilder.dto;

import ai.eigloo.questionnaire.diagram.model.NumericConstraints;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNodeType;
import ai.eigloo.questionnaire.graphbuilder.compiler.FlagNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.NumericNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.SelectNode;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Node of a compiled questionnaire graph. Fields that do not apply to the node type are left
 * out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompiledNodeDto {

    private String id;
    private CompiledNodeType type;
    private String label;
    private String pageId;
    private String name;
    private String groupId;
    private String groupHeading;
    private String helpText;
    private String hintText;
    private List<OptionDto> options;
    private String valueType;
    private Double min;
    private Double max;
    private String constraintMessage;
    private Boolean diagnosis;
    private String severity;

    public static CompiledNodeDto from(CompiledNode node) {
        CompiledNodeDto dto = new CompiledNodeDto();
        dto.id = node.getId();
        dto.type = node.type();
        dto.label = node.getLabel();
        dto.pageId = node.getPageId();
        dto.name = node.getName();
        dto.groupId = node.getGroupId();
        dto.groupHeading = node.getGroupHeading();
        dto.helpText = node.getHelpText();
        dto.hintText = node.getHintText();
        if (node instanceof SelectNode) {
            dto.options = ((SelectNode) node).getOptions().stream()
                    .map(option -> new OptionDto(option.id(), option.label()))
                    .toList();
        } else if (node instanceof NumericNode) {
            NumericNode numeric = (NumericNode) node;
            dto.valueType = numeric.getValueType().value();
            NumericConstraints constraints = numeric.getConstraints();
            if (constraints != null) {
                dto.min = constraints.min();
                dto.max = constraints.max();
                dto.constraintMessage = constraints.message();
            }
        } else if (node instanceof FlagNode) {
            FlagNode flag = (FlagNode) node;
            dto.diagnosis = flag.isDiagnosis();
            dto.severity = flag.getSeverity() != null ? flag.getSeverity().name() : null;
        }
        return dto;
    }

    public String getId() {
        return id;
    }

    public CompiledNodeType getType() {
        return type;
    }

    public String getLabel() {
        return label;
    }

    public String getPageId() {
        return pageId;
    }

    public String getName() {
        return name;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getGroupHeading() {
        return groupHeading;
    }

    public String getHelpText() {
        return helpText;
    }

    public String getHintText() {
        return hintText;
    }

    public List<OptionDto> getOptions() {
        return options;
    }

    public String getValueType() {
        return valueType;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public String getConstraintMessage() {
        return constraintMessage;
    }

    public Boolean getDiagnosis() {
        return diagnosis;
    }

    public String getSeverity() {
        return severity;
    }

    /**
     * Answer option of a select node.
     */
    public record OptionDto(String id, String label) {
    }
}
