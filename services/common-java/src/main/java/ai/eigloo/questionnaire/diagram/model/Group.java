package ai.eigloo.questionnaire.diagram.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A container of nodes, drawn as a group or container cell.
 *
 * @param id group id
 * @param label group heading
 * @param pageId id of the page holding the group
 * @param geometry geometry
 * @param metadata optional metadata; a named group can be targeted by goto nodes
 * @param containedElements ids of member nodes in insertion order
 */
public record Group(
        String id,
        String label,
        String pageId,
        Geometry geometry,
        ElementMetadata metadata,
        Set<String> containedElements
) {

    public Group {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Group id cannot be null or empty");
        }
        label = label == null ? "" : label;
        pageId = pageId == null ? "" : pageId;
        geometry = geometry == null ? Geometry.empty() : geometry;
        containedElements = containedElements == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(containedElements));
    }

    public String name() {
        return metadata != null ? metadata.name() : null;
    }

    public boolean isEmpty() {
        return containedElements.isEmpty();
    }

    public Group withContainedElements(Set<String> members) {
        return new Group(id, label, pageId, geometry, metadata, members);
    }
}
